package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.clinical.Encounter;
import com.al.hl7generator.model.clinical.Patient;
import com.al.hl7generator.model.schema.DataTypeDefinition;
import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import com.al.hl7generator.service.composer.GenerationContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.al.hl7generator.service.resolver.SemanticMatcher.containsAny;
import static com.al.hl7generator.service.resolver.SemanticMatcher.hasAnyWord;

/**
 * Identifiers: patient, record, account and visit numbers from the bundle,
 * and prefixed synthetic ids for everything else that looks like an id.
 */
@Component
public class IdentifierFieldResolver implements FieldValueResolver, CompositeAwareResolver {

    static final int PRIORITY = 75;

    static final String ASSIGNING_AUTHORITY = "HOSP";

    enum Kind {
        PATIENT("PAT", "PI"),
        MRN("MRN", "MR"),
        ACCOUNT("ACCT", "AN"),
        VISIT("V", "VN");

        private final String prefix;
        private final String typeCode;

        Kind(String prefix, String typeCode) {
            this.prefix = prefix;
            this.typeCode = typeCode;
        }
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(FieldResolutionContext context) {
        if (context.getField().hasTable() || "XTN".equals(context.getParentDataType())) {
            return false;
        }
        String dataType = context.getDataType();
        if ("TS".equals(dataType) || "DT".equals(dataType) || "DTM".equals(dataType)) {
            return false;
        }
        String text = context.getSemanticText();
        if (containsAny(text, "type", "scheme")) {
            return false;
        }
        if ("NM".equals(dataType) && !hasAnyWord(text, "id")) {
            return false;
        }
        return hasAnyWord(text, "id", "identifier", "number", "ssn") || containsAny(text, "check digit",
                "assigning authority", "assigning facility", "social security", "driver's license");
    }

    @Override
    public String resolve(FieldResolutionContext context) {
        GenerationContext generation = context.getGenerationContext();
        String text = context.getSemanticText();
        String parentText = context.getParentSemanticText();

        if (text.contains("check digit")) {
            return String.valueOf(generation.getRandom().nextInt(10));
        }
        if (text.contains("assigning authority") || text.contains("assigning facility")) {
            return ASSIGNING_AUTHORITY;
        }
        if ("NM".equals(context.getDataType())) {
            return generation.digits(6);
        }

        Kind kind = kindOf(parentText, context.getSegmentCode());
        if (kind != null) {
            return identifierFor(kind, generation);
        }
        if (containsAny(parentText, "ssn", "social security")) {
            Patient patient = generation.getPatient();
            if ("PID".equals(context.getSegmentCode()) && patient != null && patient.getSsn() != null) {
                return patient.getSsn();
            }
            return generation.digits(3) + "-" + generation.digits(2) + "-" + generation.digits(4);
        }
        if (parentText.contains("driver's license")) {
            return "DL" + generation.digits(8);
        }
        if (containsAny(parentText, "doctor", "provider", "clinician", "surgeon", "anesthesiologist",
                "practitioner", "verifier", "entered by", "verified by", "action by", "collector", "operator")) {
            return "PRV" + generation.digits(5);
        }
        if (containsAny(parentText, "placer", "filler", "order number")) {
            return "ORD" + generation.digits(8);
        }
        if (parentText.contains("prescription number")) {
            return "RX" + generation.digits(7);
        }
        if (parentText.contains("insurance company")) {
            return "INS" + generation.digits(5);
        }
        if (parentText.contains("group number")) {
            return "GRP" + generation.digits(6);
        }
        if (containsAny(parentText, "employee")) {
            return "EMP" + generation.digits(6);
        }
        return "ID" + generation.digits(8);
    }

    @Override
    public boolean canHandleComposite(String dataTypeCode) {
        return "CX".equalsIgnoreCase(dataTypeCode);
    }

    /**
     * Builds the whole CX only when the bundle carries the identifier.
     */
    @Override
    public Optional<Map<Integer, String>> resolveComposite(SegmentFieldDefinition field, DataTypeDefinition dataType,
            FieldResolutionContext context) {
        Kind kind = kindOf(field.getSemanticText(), context.getSegmentCode());
        if (kind == null) {
            return Optional.empty();
        }
        return bundleValue(kind, context.getGenerationContext()).map(value -> {
            Map<Integer, String> components = new LinkedHashMap<>();
            components.put(1, format(kind, value));
            components.put(4, ASSIGNING_AUTHORITY);
            components.put(5, kind.typeCode);
            return components;
        });
    }

    static Kind kindOf(String text, String segmentCode) {
        if ("PV1".equals(segmentCode) && containsAny(text, "visit number", "visit id", "preadmit number")) {
            return Kind.VISIT;
        }
        if (!"PID".equals(segmentCode)) {
            return null;
        }
        if (text.contains("account")) {
            return Kind.ACCOUNT;
        }
        if (containsAny(text, "internal id", "medical record", "mrn")) {
            return Kind.MRN;
        }
        if (text.startsWith("patient id") || text.contains("external id")) {
            return Kind.PATIENT;
        }
        return null;
    }

    private String identifierFor(Kind kind, GenerationContext generation) {
        return bundleValue(kind, generation)
                .map(value -> format(kind, value))
                .orElseGet(() -> kind.prefix + generation.digits(8));
    }

    private static Optional<String> bundleValue(Kind kind, GenerationContext generation) {
        Patient patient = generation.getPatient();
        switch (kind) {
            case PATIENT:
                return patient == null ? Optional.empty() : nonBlank(patient.getId());
            case MRN:
                return patient == null ? Optional.empty() : nonBlank(patient.getMrn());
            case ACCOUNT:
                return patient == null ? Optional.empty() : nonBlank(patient.getAccountNumber());
            case VISIT:
                return generation.getEncounter().map(Encounter::getVisitNumber).flatMap(IdentifierFieldResolver::nonBlank);
            default:
                return Optional.empty();
        }
    }

    /**
     * Purely numeric identifiers get the kind's prefix.
     */
    static String format(Kind kind, String value) {
        return value.chars().allMatch(Character::isDigit) ? kind.prefix + value : value;
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
