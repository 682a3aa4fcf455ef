package com.al.hl7generator.model.schema;

import lombok.Builder;
import lombok.Value;

/**
 * A single field of a segment schema. Composite components are resolved
 * through the same type by deriving a pseudo-field from the component.
 */
@Value
@Builder(toBuilder = true)
public class SegmentFieldDefinition {

    int position;
    String name;
    String dataType;
    String optionality;
    String repeatability;
    int length;
    Integer tableId;
    String description;

    public boolean isOptional() {
        return SegmentOccurrence.OPTIONAL.equals(optionality);
    }

    public boolean hasTable() {
        return tableId != null;
    }

    /**
     * Lower-cased name and description, used by the name-based heuristics.
     */
    public String getSemanticText() {
        String n = name == null ? "" : name.toLowerCase();
        String d = description == null ? "" : description.toLowerCase();
        return (n + " " + d).trim();
    }

    /**
     * Builds the pseudo-field used to push a composite component through the
     * resolver chain. The parent position is kept so that position keyed
     * resolvers still see the owning field.
     */
    public static SegmentFieldDefinition fromComponent(DataTypeComponent component, SegmentFieldDefinition parent) {
        return SegmentFieldDefinition.builder()
                .position(parent.getPosition())
                .name(component.getName())
                .dataType(component.getDataType())
                .optionality(component.getOptionality())
                .repeatability("-")
                .length(0)
                .tableId(component.getTableId())
                .build();
    }
}
