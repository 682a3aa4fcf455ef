package com.al.hl7generator.schema;

import com.al.hl7generator.config.CacheConfig;
import com.al.hl7generator.exception.SchemaLoadException;
import com.al.hl7generator.model.schema.DataTypeComponent;
import com.al.hl7generator.model.schema.DataTypeDefinition;
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
public class ClasspathDataTypeProvider implements DataTypeProvider {

    private static final String FOLDER = "data_types";

    private final SchemaResourceLoader loader;

    @Autowired
    public ClasspathDataTypeProvider(SchemaResourceLoader loader) {
        this.loader = loader;
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.DATA_TYPES, key = "#p0 == null ? '' : #p0.trim().toUpperCase()", sync = true)
    public Optional<DataTypeDefinition> getDataType(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            return loader.load(FOLDER, code.trim().toLowerCase()).map(this::parse);
        } catch (SchemaLoadException e) {
            log.error("Error loading data type {}: {}", code, e.getMessage());
            return Optional.empty();
        }
    }

    private DataTypeDefinition parse(JsonNode root) {
        List<DataTypeComponent> components = StreamSupport.stream(root.path("fields").spliterator(), false)
                .map(this::parseComponent)
                .sorted(Comparator.comparingInt(DataTypeComponent::getPosition))
                .collect(Collectors.toList());

        return DataTypeDefinition.builder()
                .code(text(root, "code"))
                .name(text(root, "name"))
                .description(text(root, "description"))
                .category(text(root, "category"))
                .components(components)
                .build();
    }

    private DataTypeComponent parseComponent(JsonNode node) {
        String name = text(node, "field_description");
        if (name.isEmpty()) {
            name = text(node, "field_name");
        }
        return DataTypeComponent.builder()
                .position(node.path("position").asInt())
                .name(name)
                .dataType(text(node, "data_type"))
                .optionality(text(node, "optionality"))
                .tableId(tableId(node))
                .build();
    }
}
