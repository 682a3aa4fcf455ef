package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import com.al.hl7generator.service.composer.GenerationContext;
import com.al.hl7generator.service.composer.GenerationOptions;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a resolver may look at when producing a value for one field or
 * one component of a composite field.
 */
@Value
@Builder(toBuilder = true)
public class FieldResolutionContext {

    String segmentCode;
    int fieldPosition;

    /**
     * 1-based index of the segment occurrence within the message
     */
    int segmentOccurrence;

    SegmentFieldDefinition field;

    /**
     * Set when {@link #field} is a component pseudo-field
     */
    SegmentFieldDefinition parentField;
    String parentDataType;
    int componentPosition;

    GenerationContext generationContext;
    GenerationOptions options;

    public boolean isComponent() {
        return parentField != null;
    }

    /**
     * Path of the owning field, e.g. {@code PID.5}, also for components.
     */
    public String getFieldPath() {
        return segmentCode + "." + fieldPosition;
    }

    /**
     * {@code PID.5.1} for a component, otherwise the field path.
     */
    public String getComponentPath() {
        return isComponent() ? getFieldPath() + "." + componentPosition : getFieldPath();
    }

    public String getDataType() {
        return field.getDataType() == null ? "" : field.getDataType().toUpperCase();
    }

    public String getSemanticText() {
        return field.getSemanticText();
    }

    /**
     * Semantic text of the owning field; for a top level field its own text.
     */
    public String getParentSemanticText() {
        return isComponent() ? parentField.getSemanticText() : field.getSemanticText();
    }
}
