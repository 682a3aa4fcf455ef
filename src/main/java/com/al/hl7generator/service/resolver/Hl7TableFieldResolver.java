package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.clinical.Encounter;
import com.al.hl7generator.model.clinical.ObservationResult;
import com.al.hl7generator.model.clinical.Patient;
import com.al.hl7generator.model.schema.CodeTable;
import com.al.hl7generator.schema.CodeTableProvider;
import com.al.hl7generator.service.composer.GenerationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Coded fields bound to an HL7 table, keyed by {@code SEG-POS}. Values carried
 * by the clinical bundle win over a random table row so that e.g. PID-8 agrees
 * with the patient's gender.
 */
@Component
@Slf4j
public class Hl7TableFieldResolver implements FieldValueResolver {

    static final int PRIORITY = 85;

    private static final Map<String, Integer> FIELD_TABLES;
    private static final Map<Integer, List<String>> USER_DEFINED_DEFAULTS;

    static {
        Map<String, Integer> tables = new HashMap<>();
        tables.put("MSH-15", 155);
        tables.put("MSH-16", 155);
        tables.put("EVN-1", 3);
        tables.put("EVN-4", 62);
        tables.put("PID-8", 1);
        tables.put("PID-16", 2);
        tables.put("PID-17", 6);
        tables.put("PID-22", 189);
        tables.put("PID-24", 136);
        tables.put("PID-30", 136);
        tables.put("NK1-14", 2);
        tables.put("NK1-15", 1);
        tables.put("PV1-2", 4);
        tables.put("PV1-4", 7);
        tables.put("PV1-10", 69);
        tables.put("PV1-14", 23);
        tables.put("PV1-16", 99);
        tables.put("PV1-18", 18);
        tables.put("PV1-36", 112);
        tables.put("PV1-40", 116);
        tables.put("PV1-41", 117);
        tables.put("PV2-15", 136);
        tables.put("PV2-22", 136);
        tables.put("OBX-2", 125);
        tables.put("OBX-8", 78);
        tables.put("OBX-10", 80);
        tables.put("OBX-11", 85);
        tables.put("OBR-11", 65);
        tables.put("OBR-24", 74);
        tables.put("OBR-25", 123);
        tables.put("ORC-1", 119);
        tables.put("ORC-5", 38);
        tables.put("ORC-6", 121);
        tables.put("DG1-2", 53);
        tables.put("DG1-6", 52);
        tables.put("PR1-2", 89);
        tables.put("PR1-6", 90);
        tables.put("AL1-2", 127);
        tables.put("AL1-4", 128);
        tables.put("GT1-9", 1);
        tables.put("GT1-10", 68);
        tables.put("IN1-15", 86);
        tables.put("NTE-2", 105);
        tables.put("RXE-9", 167);
        tables.put("RXE-20", 136);
        FIELD_TABLES = Collections.unmodifiableMap(tables);

        // Site specific tables without published values
        Map<Integer, List<String>> defaults = new HashMap<>();
        defaults.put(18, Arrays.asList("IP", "OP", "ER"));
        defaults.put(23, Arrays.asList("1", "2", "4", "7"));
        defaults.put(53, Arrays.asList("I10", "I9"));
        defaults.put(68, Arrays.asList("P", "O"));
        defaults.put(86, Arrays.asList("HMO", "PPO", "MED", "MCD"));
        defaults.put(99, Arrays.asList("N", "Y"));
        defaults.put(112, Arrays.asList("01", "02", "03", "06", "07"));
        defaults.put(116, Arrays.asList("C", "H", "I", "K", "O", "U"));
        defaults.put(117, Arrays.asList("A", "C", "P"));
        USER_DEFINED_DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final CodeTableProvider tableProvider;

    @Autowired
    public Hl7TableFieldResolver(CodeTableProvider tableProvider) {
        this.tableProvider = tableProvider;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(FieldResolutionContext context) {
        return !context.isComponent() && FIELD_TABLES.containsKey(key(context));
    }

    @Override
    public String resolve(FieldResolutionContext context) {
        String key = key(context);
        GenerationContext generation = context.getGenerationContext();

        if ("EVN-1".equals(key)) {
            return generation.getTriggerEvent();
        }

        Optional<String> bound = boundValue(key, generation);
        if (bound.isPresent()) {
            return bound.get();
        }

        int tableId = FIELD_TABLES.get(key);
        Optional<CodeTable> table = tableProvider.getTable(tableId);
        if (table.isPresent() && !table.get().isEmpty()) {
            return generation.pick(table.get().getValues()).getCode();
        }

        List<String> defaults = USER_DEFINED_DEFAULTS.get(tableId);
        if (defaults != null) {
            return generation.pick(defaults);
        }
        log.debug("No values for table {} used by {}", tableId, key);
        return null;
    }

    private static String key(FieldResolutionContext context) {
        return context.getSegmentCode() + "-" + context.getFieldPosition();
    }

    private Optional<String> boundValue(String key, GenerationContext generation) {
        Patient patient = generation.getPatient();
        Encounter encounter = generation.getEncounter().orElse(null);
        ObservationResult observation = generation.getObservation().orElse(null);

        switch (key) {
            case "PID-8":
                return patient == null ? Optional.empty() : Optional.ofNullable(genderCode(patient.getGender()));
            case "PID-16":
                return patient == null ? Optional.empty() : nonBlank(patient.getMaritalStatus());
            case "PID-17":
                return patient == null ? Optional.empty() : nonBlank(patient.getReligion());
            case "PV1-2":
                return encounter == null ? Optional.empty() : nonBlank(encounter.getPatientClass());
            case "PV1-4":
                return encounter == null ? Optional.empty() : nonBlank(encounter.getAdmissionType());
            case "PV1-10":
                return encounter == null ? Optional.empty() : nonBlank(encounter.getHospitalService());
            case "OBX-2":
                return observation == null ? Optional.empty() : nonBlank(observation.getValueType());
            case "OBX-8":
                return observation == null ? Optional.empty() : nonBlank(observation.getAbnormalFlag());
            case "OBX-11":
                return observation == null ? Optional.empty() : nonBlank(observation.getResultStatus());
            default:
                return Optional.empty();
        }
    }

    static String genderCode(String gender) {
        if (gender == null || gender.isBlank()) {
            return null;
        }
        switch (gender.trim().toLowerCase()) {
            case "male":
            case "m":
                return "M";
            case "female":
            case "f":
                return "F";
            case "other":
            case "o":
                return "O";
            default:
                return "U";
        }
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
