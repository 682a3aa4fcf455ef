package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.schema.DataTypeDefinition;
import com.al.hl7generator.model.schema.SegmentFieldDefinition;

import java.util.Map;
import java.util.Optional;

/**
 * Resolver able to produce a complete composite value at once, keyed by
 * 1-based component position.
 */
public interface CompositeAwareResolver {

    int getPriority();

    boolean canHandleComposite(String dataTypeCode);

    /**
     * @return component values by position, or empty to fall back to
     *         component-by-component resolution
     */
    Optional<Map<Integer, String>> resolveComposite(SegmentFieldDefinition field, DataTypeDefinition dataType,
            FieldResolutionContext context);
}
