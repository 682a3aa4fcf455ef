package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import com.al.hl7generator.schema.DemographicDataSource;
import com.al.hl7generator.service.composer.GenerationContext;
import com.al.hl7generator.util.DateTimeUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.List;

/**
 * Type-appropriate synthetic values for primitive data types, used when no
 * semantic resolver applies.
 */
@Component
public class PrimitiveValueGenerator {

    private static final String CODE_CHARACTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final DemographicDataSource dataSource;

    @Autowired
    public PrimitiveValueGenerator(DemographicDataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * @return a value for the field's type, cut to the field's declared
     *         length when it has one
     */
    public String generate(SegmentFieldDefinition field, GenerationContext context) {
        String dataType = field.getDataType() == null ? "" : field.getDataType().toUpperCase();
        return truncate(valueFor(dataType, context), field.getLength());
    }

    private String valueFor(String dataType, GenerationContext context) {
        switch (dataType) {
            case "ST":
                return capitalize(word(context));
            case "TX":
            case "FT":
                return sentence(context);
            case "NM":
                return String.valueOf(context.nextInt(1, 999));
            case "SI":
                return "1";
            case "DT":
                return DateTimeUtil.formatDate(context.getReferenceTime().toLocalDate()
                        .minusDays(context.nextInt(0, 3 * 365)));
            case "TM":
                return DateTimeUtil.formatTime(LocalTime.of(context.nextInt(0, 23), context.nextInt(0, 59),
                        context.nextInt(0, 59)));
            case "TS":
            case "DTM":
                return DateTimeUtil.formatDateTime(context.getReferenceTime()
                        .minusMinutes(context.nextInt(0, 30 * 24 * 60)));
            case "ID":
            case "IS":
                return code(context, context.nextInt(1, 3));
            default:
                return random(context, ALPHANUMERIC, 6);
        }
    }

    static String truncate(String value, int length) {
        if (value == null || length <= 0 || value.length() <= length) {
            return value;
        }
        return value.substring(0, length);
    }

    private String word(GenerationContext context) {
        return context.pick(dataSource.getValues(DemographicDataSource.WORDS));
    }

    private String sentence(GenerationContext context) {
        List<String> words = dataSource.getValues(DemographicDataSource.WORDS);
        int count = context.nextInt(3, 8);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(context.pick(words));
        }
        return capitalize(sb.toString()) + ".";
    }

    private static String code(GenerationContext context, int length) {
        return random(context, CODE_CHARACTERS, length);
    }

    private static String random(GenerationContext context, String alphabet, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(context.getRandom().nextInt(alphabet.length())));
        }
        return sb.toString();
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
