package com.al.hl7generator.schema;

import com.al.hl7generator.config.CacheConfig;
import com.al.hl7generator.exception.SchemaLoadException;
import com.al.hl7generator.model.schema.CodeTable;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.Optional;

import static com.al.hl7generator.schema.SchemaResourceLoader.text;

@Service
@Slf4j
public class ClasspathCodeTableProvider implements CodeTableProvider {

    private static final String FOLDER = "tables";

    private final SchemaResourceLoader loader;

    @Autowired
    public ClasspathCodeTableProvider(SchemaResourceLoader loader) {
        this.loader = loader;
    }

    @Override
    @Cacheable(cacheNames = CacheConfig.CODE_TABLES, sync = true)
    public Optional<CodeTable> getTable(int id) {
        try {
            return loader.load(FOLDER, String.format("%04d", id)).map(root -> parse(id, root));
        } catch (SchemaLoadException e) {
            log.error("Error loading table {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    private CodeTable parse(int id, JsonNode root) {
        CodeTable.CodeTableBuilder builder = CodeTable.builder()
                .id(id)
                .name(text(root, "name"))
                .type(text(root, "type"));
        for (JsonNode value : root.path("values")) {
            String code = text(value, "value");
            if (!code.isEmpty()) {
                builder.value(new CodeTable.Entry(code, text(value, "description")));
            }
        }
        return builder.build();
    }
}
