package com.al.hl7generator.service.resolver;

import com.al.hl7generator.config.GeneratorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Structural HL7 fields: set ids, version, control id and processing id.
 */
@Component
public class Hl7SpecificFieldResolver implements FieldValueResolver {

    static final int PRIORITY = 90;

    private final GeneratorProperties properties;

    @Autowired
    public Hl7SpecificFieldResolver(GeneratorProperties properties) {
        this.properties = properties;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(FieldResolutionContext context) {
        if (context.isComponent()) {
            return false;
        }
        String text = context.getSemanticText();
        return isSetId(context) || text.contains("version id") || text.contains("message control id")
                || text.contains("processing id");
    }

    @Override
    public String resolve(FieldResolutionContext context) {
        String text = context.getSemanticText();
        if (isSetId(context)) {
            return String.valueOf(context.getSegmentOccurrence());
        }
        if (text.contains("version id")) {
            return properties.getVersion();
        }
        if (text.contains("message control id")) {
            return context.getGenerationContext().getMessageControlId();
        }
        if (text.contains("processing id")) {
            return properties.getProcessingId();
        }
        return null;
    }

    private static boolean isSetId(FieldResolutionContext context) {
        return "SI".equals(context.getDataType()) && context.getSemanticText().contains("set id");
    }
}
