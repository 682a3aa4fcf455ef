package com.al.hl7generator.schema;

import com.al.hl7generator.config.CacheConfig;
import com.al.hl7generator.exception.SchemaLoadException;
import com.al.hl7generator.model.schema.SegmentOccurrence;
import com.al.hl7generator.model.schema.TriggerEventDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import static com.al.hl7generator.schema.SchemaResourceLoader.text;

@Service
@Slf4j
public class ClasspathTriggerEventProvider implements TriggerEventProvider {

    static final String FOLDER = "trigger_events";

    private final SchemaResourceLoader loader;

    @Autowired
    public ClasspathTriggerEventProvider(SchemaResourceLoader loader) {
        this.loader = loader;
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.TRIGGER_EVENTS, key = "#p0 == null ? '' : #p0.trim().toLowerCase()",
            sync = true)
    public Optional<TriggerEventDefinition> getTriggerEvent(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return load(code.trim().toLowerCase());
    }

    @Override
    public List<String> getAvailableTriggerEvents() {
        return loader.list(FOLDER);
    }

    private Optional<TriggerEventDefinition> load(String code) {
        try {
            Optional<TriggerEventDefinition> definition = loader.load(FOLDER, code).map(this::parse);
            definition.ifPresent(d -> log.debug("Loaded trigger event {} with {} occurrences",
                    code, d.getSegments().size()));
            return definition;
        } catch (SchemaLoadException e) {
            log.error("Error loading trigger event {}: {}", code, e.getMessage());
            return Optional.empty();
        }
    }

    private TriggerEventDefinition parse(JsonNode root) {
        List<SegmentOccurrence> occurrences = StreamSupport.stream(root.path("segments").spliterator(), false)
                .map(this::parseOccurrence)
                .sorted(Comparator.comparingInt(SegmentOccurrence::getOrderIndex))
                .collect(Collectors.toList());

        return TriggerEventDefinition.builder()
                .code(text(root, "code"))
                .name(text(root, "name"))
                .version(text(root, "version"))
                .description(text(root, "description"))
                .segments(occurrences)
                .build();
    }

    private SegmentOccurrence parseOccurrence(JsonNode node) {
        SegmentOccurrence.SegmentOccurrenceBuilder builder = SegmentOccurrence.builder()
                .segmentCode(text(node, "segment_code"))
                .description(text(node, "segment_desc"))
                .optionality(text(node, "optionality"))
                .repeatability(text(node, "repeatability"))
                .group(node.path("is_group").asBoolean(false))
                .level(node.path("level").asInt(0))
                .orderIndex(node.path("order_index").asInt(0));
        for (JsonNode element : node.path("group_path")) {
            builder.groupPathElement(element.asText());
        }
        return builder.build();
    }
}
