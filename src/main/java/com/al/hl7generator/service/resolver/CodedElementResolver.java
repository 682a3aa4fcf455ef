package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.clinical.Medication;
import com.al.hl7generator.model.clinical.ObservationResult;
import com.al.hl7generator.model.clinical.Patient;
import com.al.hl7generator.model.clinical.Prescription;
import com.al.hl7generator.model.schema.CodeTable;
import com.al.hl7generator.model.schema.DataTypeDefinition;
import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import com.al.hl7generator.schema.CodeTableProvider;
import com.al.hl7generator.service.composer.GenerationContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Coded elements (CE, CWE, CF) composed as a whole so that identifier, text
 * and coding system always describe the same concept.
 */
@Component
public class CodedElementResolver implements CompositeAwareResolver {

    static final int PRIORITY = 82;

    private static final List<Concept> RACES = Arrays.asList(
            new Concept("1002-5", "American Indian or Alaska Native", "HL70005"),
            new Concept("2028-9", "Asian", "HL70005"),
            new Concept("2054-5", "Black or African American", "HL70005"),
            new Concept("2076-8", "Native Hawaiian or Other Pacific Islander", "HL70005"),
            new Concept("2106-3", "White", "HL70005"));

    private static final List<Concept> LANGUAGES = Arrays.asList(
            new Concept("en", "English", "ISO639"),
            new Concept("es", "Spanish", "ISO639"),
            new Concept("fr", "French", "ISO639"),
            new Concept("de", "German", "ISO639"),
            new Concept("zh", "Chinese", "ISO639"));

    private static final List<Concept> COUNTRIES = Arrays.asList(
            new Concept("USA", "United States", "ISO3166"),
            new Concept("CAN", "Canada", "ISO3166"),
            new Concept("GBR", "United Kingdom", "ISO3166"),
            new Concept("MEX", "Mexico", "ISO3166"),
            new Concept("CHN", "China", "ISO3166"));

    private static final List<Concept> RELIGIONS = Arrays.asList(
            new Concept("CHR", "Christian", "HL70006"),
            new Concept("JEW", "Jewish", "HL70006"),
            new Concept("MOS", "Muslim", "HL70006"),
            new Concept("BUD", "Buddhist", "HL70006"),
            new Concept("OTH", "Other", "HL70006"));

    private static final List<Concept> ETHNIC_GROUPS = Arrays.asList(
            new Concept("H", "Hispanic or Latino", "HL70189"),
            new Concept("N", "Not Hispanic or Latino", "HL70189"));

    private static final List<Concept> DIAGNOSES = Arrays.asList(
            new Concept("I10", "Essential (primary) hypertension", "I10"),
            new Concept("E11.9", "Type 2 diabetes mellitus without complications", "I10"),
            new Concept("J18.9", "Pneumonia, unspecified organism", "I10"),
            new Concept("R07.9", "Chest pain, unspecified", "I10"),
            new Concept("N39.0", "Urinary tract infection, site not specified", "I10"));

    private static final List<Concept> ALLERGENS = Arrays.asList(
            new Concept("70618", "Penicillin", "RXNORM"),
            new Concept("1191", "Aspirin", "RXNORM"),
            new Concept("2670", "Codeine", "RXNORM"),
            new Concept("227493", "Peanut", "UNII"),
            new Concept("111088", "Latex", "UNII"));

    private static final List<Concept> OBSERVATIONS = Arrays.asList(
            new Concept("2345-7", "Glucose [Mass/volume] in Serum or Plasma", "LN"),
            new Concept("718-7", "Hemoglobin [Mass/volume] in Blood", "LN"),
            new Concept("2823-3", "Potassium [Moles/volume] in Serum or Plasma", "LN"),
            new Concept("2160-0", "Creatinine [Mass/volume] in Serum or Plasma", "LN"),
            new Concept("8867-4", "Heart rate", "LN"));

    private static final List<Concept> MEDICATIONS = Arrays.asList(
            new Concept("197361", "Amlodipine 5 MG Oral Tablet", "RXNORM"),
            new Concept("860975", "Metformin 500 MG Oral Tablet", "RXNORM"),
            new Concept("308136", "Amlodipine 2.5 MG Oral Tablet", "RXNORM"),
            new Concept("314076", "Lisinopril 10 MG Oral Tablet", "RXNORM"),
            new Concept("198211", "Simvastatin 40 MG Oral Tablet", "RXNORM"));

    private static final List<Concept> UNITS = Arrays.asList(
            new Concept("mg", "milligram", "UCUM"),
            new Concept("mL", "milliliter", "UCUM"),
            new Concept("mg/dL", "milligram per deciliter", "UCUM"),
            new Concept("mmol/L", "millimole per liter", "UCUM"),
            new Concept("{tbl}", "tablet", "UCUM"));

    private final CodeTableProvider tableProvider;

    @Autowired
    public CodedElementResolver(CodeTableProvider tableProvider) {
        this.tableProvider = tableProvider;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandleComposite(String dataTypeCode) {
        return "CE".equalsIgnoreCase(dataTypeCode) || "CWE".equalsIgnoreCase(dataTypeCode)
                || "CF".equalsIgnoreCase(dataTypeCode);
    }

    @Override
    public Optional<Map<Integer, String>> resolveComposite(SegmentFieldDefinition field, DataTypeDefinition dataType,
            FieldResolutionContext context) {
        GenerationContext generation = context.getGenerationContext();

        Optional<Concept> concept = fromBundle(context.getFieldPath(), generation);
        if (!concept.isPresent() && field.hasTable()) {
            concept = fromTable(field.getTableId(), generation);
        }
        if (!concept.isPresent()) {
            concept = fromSemantics(field.getSemanticText(), generation);
        }
        return concept.map(Concept::toComponents);
    }

    private Optional<Concept> fromBundle(String fieldPath, GenerationContext generation) {
        ObservationResult observation = generation.getObservation().orElse(null);
        Prescription prescription = generation.getPrescription().orElse(null);
        Patient patient = generation.getPatient();

        switch (fieldPath) {
            case "OBX.3":
            case "OBR.4":
                if (observation != null && observation.getCode() != null) {
                    return Optional.of(new Concept(observation.getCode(), nullToEmpty(observation.getName()),
                            defaultIfBlank(observation.getCodingSystem(), "LN")));
                }
                return Optional.empty();
            case "OBX.6":
                if (observation != null && observation.getUnits() != null) {
                    return Optional.of(new Concept(observation.getUnits(), observation.getUnits(), "UCUM"));
                }
                return Optional.empty();
            case "RXE.2":
                if (prescription != null && prescription.getMedication() != null
                        && prescription.getMedication().getCode() != null) {
                    Medication medication = prescription.getMedication();
                    return Optional.of(new Concept(medication.getCode(), nullToEmpty(medication.getName()),
                            defaultIfBlank(medication.getCodingSystem(), "RXNORM")));
                }
                return Optional.empty();
            case "RXE.5":
                if (prescription != null && prescription.getDoseUnits() != null) {
                    return Optional.of(new Concept(prescription.getDoseUnits(), prescription.getDoseUnits(), "UCUM"));
                }
                return Optional.empty();
            case "PID.10":
                return patient == null ? Optional.empty() : lookup(RACES, patient.getRace());
            case "PID.15":
                return patient == null ? Optional.empty() : lookup(LANGUAGES, patient.getLanguage());
            default:
                return Optional.empty();
        }
    }

    private Optional<Concept> fromTable(int tableId, GenerationContext generation) {
        Optional<CodeTable> table = tableProvider.getTable(tableId);
        if (!table.isPresent() || table.get().isEmpty()) {
            return Optional.empty();
        }
        CodeTable.Entry entry = generation.pick(table.get().getValues());
        return Optional.of(new Concept(entry.getCode(), entry.getDescription(), table.get().getCodingSystem()));
    }

    private Optional<Concept> fromSemantics(String text, GenerationContext generation) {
        List<Concept> concepts = conceptsFor(text);
        return concepts == null ? Optional.empty() : Optional.of(generation.pick(concepts));
    }

    private static List<Concept> conceptsFor(String text) {
        if (text.contains("race")) {
            return RACES;
        }
        if (text.contains("language")) {
            return LANGUAGES;
        }
        if (text.contains("nationality") || text.contains("country") || text.contains("citizenship")) {
            return COUNTRIES;
        }
        if (text.contains("religion")) {
            return RELIGIONS;
        }
        if (text.contains("ethnic")) {
            return ETHNIC_GROUPS;
        }
        if (text.contains("diagnosis code") || text.contains("admit reason") || text.contains("reason for study")) {
            return DIAGNOSES;
        }
        if (text.contains("allerg")) {
            return ALLERGENS;
        }
        if (text.contains("observation identifier") || text.contains("universal service")) {
            return OBSERVATIONS;
        }
        if (text.contains("give code") || text.contains("medication")) {
            return MEDICATIONS;
        }
        if (text.contains("units")) {
            return UNITS;
        }
        return null;
    }

    private static Optional<Concept> lookup(List<Concept> concepts, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (Concept concept : concepts) {
            if (concept.code.equalsIgnoreCase(value) || concept.text.equalsIgnoreCase(value)) {
                return Optional.of(concept);
            }
        }
        return Optional.of(new Concept(value, value, ""));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String defaultIfBlank(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value;
    }

    private static final class Concept {
        private final String code;
        private final String text;
        private final String codingSystem;

        private Concept(String code, String text, String codingSystem) {
            this.code = code;
            this.text = text;
            this.codingSystem = codingSystem;
        }

        private Map<Integer, String> toComponents() {
            Map<Integer, String> components = new LinkedHashMap<>();
            components.put(1, code);
            components.put(2, text);
            components.put(3, codingSystem);
            return components;
        }
    }
}
