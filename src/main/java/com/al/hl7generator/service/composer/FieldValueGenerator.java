package com.al.hl7generator.service.composer;

import com.al.hl7generator.config.GeneratorProperties;
import com.al.hl7generator.model.schema.DataTypeComponent;
import com.al.hl7generator.model.schema.DataTypeDefinition;
import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import com.al.hl7generator.schema.DataTypeProvider;
import com.al.hl7generator.service.resolver.FieldResolutionContext;
import com.al.hl7generator.service.resolver.FieldValueResolverChain;
import com.al.hl7generator.service.resolver.LockedValueLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Produces the text of one field: primitive fields go through the resolver
 * chain, composite fields are offered whole to the composite resolvers and
 * otherwise built component by component.
 */
@Component
@Slf4j
public class FieldValueGenerator {

    static final String COMPONENT_SEPARATOR = "^";

    private final DataTypeProvider dataTypeProvider;
    private final FieldValueResolverChain resolverChain;
    private final ComponentImportanceClassifier importanceClassifier;
    private final LockedValueLookup lockedValues;
    private final ValueEscaper escaper;
    private final GeneratorProperties properties;

    @Autowired
    public FieldValueGenerator(DataTypeProvider dataTypeProvider, FieldValueResolverChain resolverChain,
            ComponentImportanceClassifier importanceClassifier, LockedValueLookup lockedValues,
            ValueEscaper escaper, GeneratorProperties properties) {
        this.dataTypeProvider = dataTypeProvider;
        this.resolverChain = resolverChain;
        this.importanceClassifier = importanceClassifier;
        this.lockedValues = lockedValues;
        this.escaper = escaper;
        this.properties = properties;
    }

    /**
     * Generates the value of one field. A field whose resolution fails is
     * logged and left empty.
     */
    public String generate(SegmentFieldDefinition field, String segmentCode, int segmentOccurrence,
            GenerationContext context, GenerationOptions options) {
        String fieldPath = segmentCode + "." + field.getPosition();

        if (field.isOptional() && !lockedValues.isLocked(options, fieldPath)
                && !context.chance(properties.getOptionalFieldProbability())) {
            return "";
        }

        FieldResolutionContext resolution = FieldResolutionContext.builder()
                .segmentCode(segmentCode)
                .fieldPosition(field.getPosition())
                .segmentOccurrence(segmentOccurrence)
                .field(field)
                .generationContext(context)
                .options(options)
                .build();

        try {
            Optional<DataTypeDefinition> dataType = dataTypeProvider.getDataType(field.getDataType());
            if (dataType.isPresent() && dataType.get().isComposite()) {
                return generateComposite(field, dataType.get(), resolution);
            }
            return escaper.escape(resolverChain.resolve(resolution));
        } catch (RuntimeException e) {
            log.warn("Failed to generate {} ({}): {}", fieldPath, field.getName(), e.getMessage());
            return "";
        }
    }

    private String generateComposite(SegmentFieldDefinition field, DataTypeDefinition dataType,
            FieldResolutionContext resolution) {
        Optional<Map<Integer, String>> whole = resolverChain.resolveComposite(field, dataType, resolution);
        if (whole.isPresent()) {
            Map<Integer, String> escaped = new HashMap<>();
            whole.get().forEach((position, value) -> escaped.put(position, escaper.escape(value)));
            return joinComponents(escaped, dataType.getComponents().size());
        }

        StringBuilder sb = new StringBuilder();
        GenerationContext context = resolution.getGenerationContext();
        for (int i = 0; i < dataType.getComponents().size(); i++) {
            if (i > 0) {
                sb.append(COMPONENT_SEPARATOR);
            }
            DataTypeComponent component = dataType.getComponents().get(i);
            sb.append(generateComponent(field, dataType, component, resolution, context));
        }
        return sb.toString();
    }

    private String generateComponent(SegmentFieldDefinition parent, DataTypeDefinition dataType,
            DataTypeComponent component, FieldResolutionContext resolution, GenerationContext context) {
        FieldResolutionContext componentResolution = resolution.toBuilder()
                .field(SegmentFieldDefinition.fromComponent(component, parent))
                .parentField(parent)
                .parentDataType(dataType.getCode())
                .componentPosition(component.getPosition())
                .build();

        if (component.isOptional()
                && !lockedValues.find(resolution.getOptions(), componentResolution.getComponentPath()).isPresent()) {
            ComponentImportance importance = importanceClassifier.classify(dataType.getCode(), component);
            if (!context.chance(importance.getPopulationProbability())) {
                return "";
            }
        }
        return escaper.escape(resolverChain.resolve(componentResolution));
    }

    /**
     * Emits {@code max(declared, highest key)} components, empty where the
     * map has no entry.
     */
    static String joinComponents(Map<Integer, String> components, int declaredCount) {
        int count = declaredCount;
        for (Integer position : components.keySet()) {
            count = Math.max(count, position);
        }
        StringBuilder sb = new StringBuilder();
        for (int position = 1; position <= count; position++) {
            if (position > 1) {
                sb.append(COMPONENT_SEPARATOR);
            }
            String value = components.get(position);
            sb.append(value == null ? "" : value);
        }
        return sb.toString();
    }
}
