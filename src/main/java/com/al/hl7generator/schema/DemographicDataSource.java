package com.al.hl7generator.schema;

import com.al.hl7generator.config.CacheConfig;
import com.al.hl7generator.exception.SchemaLoadException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.al.hl7generator.schema.SchemaResourceLoader.text;

/**
 * Pools of synthetic demographic values (names, streets, locations) read from
 * the {@code demographics} folder. A missing pool yields a small built-in list
 * so generation never depends on the resource being present.
 */
@Component
@Slf4j
public class DemographicDataSource {

    public static final String FIRST_NAMES_MALE = "first_names_male";
    public static final String FIRST_NAMES_FEMALE = "first_names_female";
    public static final String LAST_NAMES = "last_names";
    public static final String MIDDLE_NAMES = "middle_names";
    public static final String STREET_NAMES = "street_names";
    public static final String PREFIXES = "prefixes";
    public static final String SUFFIXES = "suffixes";
    public static final String DEGREES = "degrees";
    public static final String FACILITIES = "facilities";
    public static final String ORGANIZATIONS = "organizations";
    public static final String JOB_TITLES = "job_titles";
    public static final String WORDS = "words";

    private static final String FOLDER = "demographics";
    private static final String LOCATIONS = "locations";

    private static final List<String> FALLBACK_VALUES = Collections.singletonList("SAMPLE");
    private static final List<Location> FALLBACK_LOCATIONS =
            Collections.singletonList(new Location("Springfield", "IL", "62701"));

    private final SchemaResourceLoader loader;

    @Autowired
    public DemographicDataSource(SchemaResourceLoader loader) {
        this.loader = loader;
    }

    @Cacheable(cacheNames = CacheConfig.DEMOGRAPHIC_POOLS, sync = true)
    public List<String> getValues(String pool) {
        return loadPool(pool).orElse(FALLBACK_VALUES);
    }

    @Cacheable(cacheNames = CacheConfig.LOCATIONS, sync = true)
    public List<Location> getLocations() {
        return loadLocations(LOCATIONS).orElse(FALLBACK_LOCATIONS);
    }

    private Optional<List<String>> loadPool(String pool) {
        try {
            return loader.load(FOLDER, pool).map(root -> {
                List<String> values = new ArrayList<>();
                for (JsonNode node : root.path("values")) {
                    String value = text(node, "value");
                    if (!value.isEmpty()) {
                        values.add(value);
                    }
                }
                return values;
            }).filter(values -> !values.isEmpty());
        } catch (SchemaLoadException e) {
            log.error("Error loading demographic pool {}: {}", pool, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<List<Location>> loadLocations(String name) {
        try {
            return loader.load(FOLDER, name).map(root -> {
                List<Location> values = new ArrayList<>();
                for (JsonNode node : root.path("values")) {
                    values.add(new Location(text(node, "value"), text(node, "state"), text(node, "zip")));
                }
                return values;
            }).filter(values -> !values.isEmpty());
        } catch (SchemaLoadException e) {
            log.error("Error loading locations: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Value
    public static class Location {
        String city;
        String state;
        String zip;
    }
}
