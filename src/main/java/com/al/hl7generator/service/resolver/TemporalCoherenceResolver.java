package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.schema.DataTypeDefinition;
import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import com.al.hl7generator.service.temporal.TemporalCoherenceTracker;
import com.al.hl7generator.util.DateTimeUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Writes related timestamps (event, admit, observation, order) through the
 * {@link TemporalCoherenceTracker}.
 */
@Component
public class TemporalCoherenceResolver implements FieldValueResolver, CompositeAwareResolver {

    static final int PRIORITY = 92;

    private final TemporalCoherenceTracker tracker;

    @Autowired
    public TemporalCoherenceResolver(TemporalCoherenceTracker tracker) {
        this.tracker = tracker;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(FieldResolutionContext context) {
        return !context.isComponent()
                && isTimestampType(context.getDataType())
                && tracker.isTracked(context.getFieldPath());
    }

    @Override
    public String resolve(FieldResolutionContext context) {
        return DateTimeUtil.formatDateTime(tracker.timestampFor(context.getFieldPath(), context.getGenerationContext()));
    }

    @Override
    public boolean canHandleComposite(String dataTypeCode) {
        return isTimestampType(dataTypeCode);
    }

    @Override
    public Optional<Map<Integer, String>> resolveComposite(SegmentFieldDefinition field, DataTypeDefinition dataType,
            FieldResolutionContext context) {
        if (!tracker.isTracked(context.getFieldPath())) {
            return Optional.empty();
        }
        return Optional.of(Collections.singletonMap(1, resolve(context)));
    }

    private static boolean isTimestampType(String dataType) {
        return "TS".equalsIgnoreCase(dataType) || "DTM".equalsIgnoreCase(dataType);
    }
}
