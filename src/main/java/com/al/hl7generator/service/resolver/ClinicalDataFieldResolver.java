package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.clinical.Encounter;
import com.al.hl7generator.model.clinical.ObservationResult;
import com.al.hl7generator.model.clinical.Prescription;
import com.al.hl7generator.model.clinical.Provider;
import com.al.hl7generator.model.schema.DataTypeDefinition;
import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import com.al.hl7generator.schema.DemographicDataSource;
import com.al.hl7generator.service.composer.GenerationContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Encounter, order and observation data: providers, locations, order numbers
 * and result values.
 */
@Component
public class ClinicalDataFieldResolver implements FieldValueResolver, CompositeAwareResolver {

    static final int PRIORITY = 77;

    private static final List<String> ATTENDING_FIELDS = Arrays.asList("PV1.7", "PV1.17");
    private static final List<String> ORDERING_FIELDS = Arrays.asList("ORC.12", "OBR.16", "RXE.13");
    private static final List<String> PLACER_FIELDS = Arrays.asList("ORC.2", "OBR.2");
    private static final List<String> UNITS = Arrays.asList("ICU", "MED", "SURG", "ER", "PEDS", "CARD");

    private final DemographicDataSource dataSource;

    @Autowired
    public ClinicalDataFieldResolver(DemographicDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(FieldResolutionContext context) {
        if (context.isComponent()) {
            return "PL".equals(context.getParentDataType())
                    || ("EI".equals(context.getParentDataType()) && PLACER_FIELDS.contains(context.getFieldPath()));
        }
        switch (context.getFieldPath()) {
            case "OBX.5":
            case "OBX.7":
            case "RXE.3":
                return true;
            default:
                return false;
        }
    }

    @Override
    public String resolve(FieldResolutionContext context) {
        GenerationContext generation = context.getGenerationContext();
        if (context.isComponent()) {
            if ("EI".equals(context.getParentDataType())) {
                return context.getComponentPosition() == 1
                        ? generation.getPrescription().map(Prescription::getOrderNumber).orElse(null)
                        : null;
            }
            return locationComponent(context);
        }

        Optional<ObservationResult> observation = generation.getObservation();
        switch (context.getFieldPath()) {
            case "OBX.5":
                return observation.map(ObservationResult::getValue).orElse(null);
            case "OBX.7":
                return observation.map(ObservationResult::getReferenceRange).orElse(null);
            case "RXE.3":
                return generation.getPrescription().map(Prescription::getDose).orElse(null);
            default:
                return null;
        }
    }

    @Override
    public boolean canHandleComposite(String dataTypeCode) {
        return "XCN".equalsIgnoreCase(dataTypeCode) || "PL".equalsIgnoreCase(dataTypeCode);
    }

    @Override
    public Optional<Map<Integer, String>> resolveComposite(SegmentFieldDefinition field, DataTypeDefinition dataType,
            FieldResolutionContext context) {
        GenerationContext generation = context.getGenerationContext();
        String path = context.getFieldPath();

        if ("XCN".equalsIgnoreCase(dataType.getCode())) {
            return providerFor(path, generation).map(ClinicalDataFieldResolver::providerComponents);
        }
        if ("PV1.3".equals(path)) {
            return generation.getEncounter()
                    .filter(e -> e.getPointOfCare() != null || e.getRoom() != null || e.getBed() != null)
                    .map(ClinicalDataFieldResolver::locationComponents);
        }
        return Optional.empty();
    }

    private Optional<Provider> providerFor(String path, GenerationContext generation) {
        Optional<Provider> attending = generation.getEncounter().map(Encounter::getAttendingDoctor);
        if (ATTENDING_FIELDS.contains(path)) {
            return attending;
        }
        if (ORDERING_FIELDS.contains(path)) {
            Optional<Provider> prescriber = generation.getPrescription().map(Prescription::getPrescriber);
            return prescriber.isPresent() ? prescriber : attending;
        }
        return Optional.empty();
    }

    private static Map<Integer, String> providerComponents(Provider provider) {
        Map<Integer, String> components = new LinkedHashMap<>();
        components.put(1, provider.getId() == null ? "" : provider.getId());
        if (provider.getName() != null) {
            Map<Integer, String> name = DemographicFieldResolver.nameComponents(provider.getName());
            components.put(2, name.get(1));
            components.put(3, name.get(2));
            components.put(4, name.get(3));
            components.put(5, name.get(4));
            components.put(6, name.get(5));
        }
        return components;
    }

    private static Map<Integer, String> locationComponents(Encounter encounter) {
        Map<Integer, String> components = new LinkedHashMap<>();
        components.put(1, orEmpty(encounter.getPointOfCare()));
        components.put(2, orEmpty(encounter.getRoom()));
        components.put(3, orEmpty(encounter.getBed()));
        components.put(4, orEmpty(encounter.getFacility()));
        return components;
    }

    private String locationComponent(FieldResolutionContext context) {
        GenerationContext generation = context.getGenerationContext();
        String text = context.getSemanticText();
        if (text.contains("point of care")) {
            return generation.pick(UNITS);
        }
        if (text.contains("room")) {
            return String.valueOf(generation.nextInt(100, 599));
        }
        if (text.contains("bed")) {
            return generation.getRandom().nextBoolean() ? "A" : "B";
        }
        if (text.contains("facility")) {
            return generation.pick(dataSource.getValues(DemographicDataSource.FACILITIES));
        }
        if (text.contains("building") || text.contains("floor")) {
            return String.valueOf(generation.nextInt(1, 9));
        }
        return null;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
