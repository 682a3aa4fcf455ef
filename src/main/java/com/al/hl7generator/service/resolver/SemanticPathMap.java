package com.al.hl7generator.service.resolver;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps semantic paths such as {@code patient.mrn} onto HL7 field paths and
 * normalizes field paths written as {@code PID-3} or {@code pid.3.1}.
 */
public final class SemanticPathMap {

    private static final Pattern FIELD_PATH = Pattern.compile("^([A-Za-z][A-Za-z0-9]{2})[.-](\\d+)(?:[.-](\\d+))?$");

    private static final Map<String, String> PATHS;

    static {
        Map<String, String> paths = new HashMap<>();
        paths.put("patient.id", "PID.2");
        paths.put("patient.mrn", "PID.3");
        paths.put("patient.name", "PID.5");
        paths.put("patient.familyname", "PID.5.1");
        paths.put("patient.givenname", "PID.5.2");
        paths.put("patient.birthdate", "PID.7");
        paths.put("patient.gender", "PID.8");
        paths.put("patient.sex", "PID.8");
        paths.put("patient.race", "PID.10");
        paths.put("patient.address", "PID.11");
        paths.put("patient.phone", "PID.13");
        paths.put("patient.language", "PID.15");
        paths.put("patient.maritalstatus", "PID.16");
        paths.put("patient.religion", "PID.17");
        paths.put("patient.accountnumber", "PID.18");
        paths.put("patient.ssn", "PID.19");
        paths.put("encounter.class", "PV1.2");
        paths.put("encounter.location", "PV1.3");
        paths.put("encounter.admissiontype", "PV1.4");
        paths.put("encounter.attendingdoctor", "PV1.7");
        paths.put("encounter.hospitalservice", "PV1.10");
        paths.put("encounter.visitnumber", "PV1.19");
        paths.put("encounter.admitdatetime", "PV1.44");
        paths.put("encounter.dischargedatetime", "PV1.45");
        paths.put("event.recordeddatetime", "EVN.2");
        paths.put("order.control", "ORC.1");
        paths.put("order.placernumber", "ORC.2");
        paths.put("order.status", "ORC.5");
        paths.put("medication.code", "RXE.2");
        paths.put("observation.code", "OBX.3");
        paths.put("observation.value", "OBX.5");
        paths.put("observation.units", "OBX.6");
        paths.put("observation.status", "OBX.11");
        PATHS = Collections.unmodifiableMap(paths);
    }

    private SemanticPathMap() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * @return the canonical {@code SEG.N} or {@code SEG.N.C} path, or null if
     *         the key is neither a known semantic path nor a field path
     */
    public static String toFieldPath(String key) {
        if (key == null) {
            return null;
        }
        String trimmed = key.trim();
        String mapped = PATHS.get(trimmed.toLowerCase(Locale.ROOT).replace("_", ""));
        if (mapped != null) {
            return mapped;
        }
        Matcher matcher = FIELD_PATH.matcher(trimmed);
        if (!matcher.matches()) {
            return null;
        }
        String path = matcher.group(1).toUpperCase(Locale.ROOT) + "." + Integer.parseInt(matcher.group(2));
        if (matcher.group(3) != null) {
            path += "." + Integer.parseInt(matcher.group(3));
        }
        return path;
    }

    public static Map<String, String> semanticPaths() {
        return PATHS;
    }
}
