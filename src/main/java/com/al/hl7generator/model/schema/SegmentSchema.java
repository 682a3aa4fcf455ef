package com.al.hl7generator.model.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Field layout of one segment type, fields ordered by position.
 */
@Value
@Builder
public class SegmentSchema {

    String code;
    String name;
    String description;

    @Singular
    List<SegmentFieldDefinition> fields;
}
