package com.al.hl7generator.model.schema;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DataTypeComponent {

    int position;
    String name;
    String dataType;
    String optionality;
    Integer tableId;

    public boolean isOptional() {
        return SegmentOccurrence.OPTIONAL.equals(optionality);
    }
}
