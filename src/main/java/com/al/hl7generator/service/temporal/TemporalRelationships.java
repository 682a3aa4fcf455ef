package com.al.hl7generator.service.temporal;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed table of timestamp dependencies between fields.
 */
public final class TemporalRelationships {

    /**
     * Field holding the encounter start; every chain of dependencies ends here.
     */
    public static final String ENCOUNTER_ANCHOR = "EVN.2";

    private static final Map<String, TemporalRelationship> RELATIONSHIPS = new LinkedHashMap<>();

    static {
        register("PV1.44", ENCOUNTER_ANCHOR, Duration.ZERO, Duration.ofMinutes(5));
        register("DG1.5", ENCOUNTER_ANCHOR, Duration.ZERO, Duration.ofHours(48));
        register("OBX.14", ENCOUNTER_ANCHOR, Duration.ZERO, Duration.ofHours(24));
        register("MSH.7", ENCOUNTER_ANCHOR, Duration.ZERO, Duration.ofHours(1));
        register("ORC.9", ENCOUNTER_ANCHOR, Duration.ZERO, Duration.ofHours(24));
        register("RXE.32", "ORC.9", Duration.ofHours(-24), Duration.ZERO);
    }

    private TemporalRelationships() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    private static void register(String dependent, String anchor, Duration min, Duration max) {
        RELATIONSHIPS.put(dependent, new TemporalRelationship(dependent, anchor, min, max));
    }

    public static Optional<TemporalRelationship> forField(String fieldPath) {
        return Optional.ofNullable(RELATIONSHIPS.get(fieldPath));
    }

    public static boolean isTracked(String fieldPath) {
        return ENCOUNTER_ANCHOR.equals(fieldPath) || RELATIONSHIPS.containsKey(fieldPath);
    }

    public static Collection<TemporalRelationship> all() {
        return Collections.unmodifiableCollection(RELATIONSHIPS.values());
    }
}
