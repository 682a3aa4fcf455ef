package com.al.hl7generator.schema;

import com.al.hl7generator.config.CacheConfig;
import com.al.hl7generator.exception.SchemaLoadException;
import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import com.al.hl7generator.model.schema.SegmentSchema;
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

import static com.al.hl7generator.schema.SchemaResourceLoader.tableId;
import static com.al.hl7generator.schema.SchemaResourceLoader.text;

@Service
@Slf4j
public class ClasspathSegmentProvider implements SegmentProvider {

    private static final String FOLDER = "segments";

    private final SchemaResourceLoader loader;

    @Autowired
    public ClasspathSegmentProvider(SchemaResourceLoader loader) {
        this.loader = loader;
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.SEGMENTS, key = "#p0 == null ? '' : #p0.trim().toUpperCase()", sync = true)
    public Optional<SegmentSchema> getSegment(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            return loader.load(FOLDER, code.trim().toLowerCase()).map(this::parse);
        } catch (SchemaLoadException e) {
            log.error("Error loading segment {}: {}", code, e.getMessage());
            return Optional.empty();
        }
    }

    private SegmentSchema parse(JsonNode root) {
        List<SegmentFieldDefinition> fields = StreamSupport.stream(root.path("fields").spliterator(), false)
                .map(this::parseField)
                .sorted(Comparator.comparingInt(SegmentFieldDefinition::getPosition))
                .collect(Collectors.toList());

        return SegmentSchema.builder()
                .code(text(root, "code"))
                .name(text(root, "name"))
                .description(text(root, "description"))
                .fields(fields)
                .build();
    }

    private SegmentFieldDefinition parseField(JsonNode node) {
        String name = text(node, "field_name");
        if (name.isEmpty()) {
            name = text(node, "field_description");
        }
        return SegmentFieldDefinition.builder()
                .position(node.path("position").asInt())
                .name(name)
                .dataType(text(node, "data_type"))
                .optionality(text(node, "optionality"))
                .repeatability(text(node, "repeatability"))
                .length(node.path("length").asInt(0))
                .tableId(tableId(node))
                .description(text(node, "description"))
                .build();
    }
}
