package com.al.hl7generator.schema;

import com.al.hl7generator.config.GeneratorProperties;
import com.al.hl7generator.exception.SchemaLoadException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Reads JSON schema resources from the classpath below the configured base path.
 */
@Component
@Slf4j
public class SchemaResourceLoader {

    private final ObjectMapper objectMapper;
    private final GeneratorProperties properties;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    @Autowired
    public SchemaResourceLoader(ObjectMapper objectMapper, GeneratorProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Loads {@code <base>/<folder>/<name>.json}.
     *
     * @return empty if the resource does not exist
     * @throws SchemaLoadException if the resource exists but is not valid JSON
     */
    public Optional<JsonNode> load(String folder, String name) {
        String location = properties.getSchemaBasePath() + "/" + folder + "/" + name + ".json";
        Resource resource = resolver.getResource("classpath:" + location);
        if (!resource.exists()) {
            log.debug("Schema resource not found: {}", location);
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            return Optional.of(objectMapper.readTree(in));
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read schema resource " + location, e);
        }
    }

    /**
     * Lists resource names (without extension) in a schema folder, sorted.
     */
    public List<String> list(String folder) {
        String pattern = "classpath*:" + properties.getSchemaBasePath() + "/" + folder + "/*.json";
        try {
            List<String> names = new ArrayList<>();
            for (Resource resource : resolver.getResources(pattern)) {
                String filename = resource.getFilename();
                if (filename != null && filename.endsWith(".json")) {
                    names.add(filename.substring(0, filename.length() - ".json".length()));
                }
            }
            Collections.sort(names);
            return names;
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to list schema resources in " + folder, e);
        }
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    static Integer tableId(JsonNode node) {
        String raw = text(node, "table").trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric table reference '{}'", raw);
            return null;
        }
    }
}
