package com.al.hl7generator.service.composer;

import com.al.hl7generator.config.GeneratorProperties;
import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import com.al.hl7generator.model.schema.SegmentSchema;
import com.al.hl7generator.schema.SegmentProvider;
import com.al.hl7generator.service.temporal.TemporalCoherenceTracker;
import com.al.hl7generator.util.DateTimeUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Renders one segment line: the segment code followed by one value per field
 * position. MSH gets its protocol fields written directly.
 */
@Component
@Slf4j
public class SegmentGenerator {

    static final String MSH = "MSH";

    private final SegmentProvider segmentProvider;
    private final FieldValueGenerator fieldValueGenerator;
    private final TemporalCoherenceTracker temporalTracker;
    private final GeneratorProperties properties;

    @Autowired
    public SegmentGenerator(SegmentProvider segmentProvider, FieldValueGenerator fieldValueGenerator,
            TemporalCoherenceTracker temporalTracker, GeneratorProperties properties) {
        this.segmentProvider = segmentProvider;
        this.fieldValueGenerator = fieldValueGenerator;
        this.temporalTracker = temporalTracker;
        this.properties = properties;
    }

    /**
     * Generates the next occurrence of a segment. Without a schema the line is
     * just the segment code.
     */
    public String generate(String segmentCode, GenerationContext context, GenerationOptions options) {
        int occurrence = context.nextOccurrence(segmentCode);

        Optional<SegmentSchema> schema = segmentProvider.getSegment(segmentCode);
        if (!schema.isPresent()) {
            log.debug("No schema for segment {}, emitting minimal segment", segmentCode);
            return segmentCode;
        }

        Map<Integer, SegmentFieldDefinition> fields = new HashMap<>();
        int lastPosition = 0;
        for (SegmentFieldDefinition field : schema.get().getFields()) {
            fields.put(field.getPosition(), field);
            lastPosition = Math.max(lastPosition, field.getPosition());
        }

        if (MSH.equals(segmentCode)) {
            return generateHeader(fields, Math.max(lastPosition, 12), context, options);
        }

        StringBuilder line = new StringBuilder(segmentCode);
        for (int position = 1; position <= lastPosition; position++) {
            line.append(ValueEscaper.FIELD_SEPARATOR);
            SegmentFieldDefinition field = fields.get(position);
            if (field != null) {
                line.append(fieldValueGenerator.generate(field, segmentCode, occurrence, context, options));
            }
        }
        return line.toString();
    }

    private String generateHeader(Map<Integer, SegmentFieldDefinition> fields, int lastPosition,
            GenerationContext context, GenerationOptions options) {
        StringBuilder line = new StringBuilder(MSH);
        line.append(ValueEscaper.FIELD_SEPARATOR);
        line.append(ValueEscaper.ENCODING_CHARACTERS);

        for (int position = 3; position <= lastPosition; position++) {
            line.append(ValueEscaper.FIELD_SEPARATOR);
            switch (position) {
                case 3:
                    line.append(properties.getSendingApplication());
                    break;
                case 4:
                    line.append(properties.getSendingFacility());
                    break;
                case 5:
                    line.append(properties.getReceivingApplication());
                    break;
                case 6:
                    line.append(properties.getReceivingFacility());
                    break;
                case 7:
                    line.append(DateTimeUtil.formatDateTime(temporalTracker.timestampFor("MSH.7", context)));
                    break;
                case 9:
                    line.append(context.getMessageType());
                    break;
                case 10:
                    line.append(context.getMessageControlId());
                    break;
                case 11:
                    line.append(properties.getProcessingId());
                    break;
                case 12:
                    line.append(properties.getVersion());
                    break;
                default:
                    SegmentFieldDefinition field = fields.get(position);
                    if (field != null) {
                        line.append(fieldValueGenerator.generate(field, MSH, 1, context, options));
                    }
                    break;
            }
        }
        return line.toString();
    }
}
