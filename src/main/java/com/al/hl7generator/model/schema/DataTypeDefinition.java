package com.al.hl7generator.model.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * HL7 data type. Primitive when it declares no components.
 */
@Value
@Builder
public class DataTypeDefinition {

    String code;
    String name;
    String description;
    String category;

    @Singular
    List<DataTypeComponent> components;

    public boolean isComposite() {
        return !components.isEmpty();
    }
}
