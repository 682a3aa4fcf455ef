package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.clinical.Address;
import com.al.hl7generator.model.clinical.Patient;
import com.al.hl7generator.model.clinical.PersonName;
import com.al.hl7generator.model.schema.DataTypeDefinition;
import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import com.al.hl7generator.schema.DemographicDataSource;
import com.al.hl7generator.schema.DemographicDataSource.Location;
import com.al.hl7generator.service.composer.GenerationContext;
import com.al.hl7generator.util.DateTimeUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.al.hl7generator.service.resolver.SemanticMatcher.containsAny;
import static com.al.hl7generator.service.resolver.SemanticMatcher.hasAnyWord;

/**
 * Names, addresses and birth dates. The patient's own name and address are
 * taken from the bundle as whole composites; every other person gets values
 * from the demographic pools.
 */
@Component
public class DemographicFieldResolver implements FieldValueResolver, CompositeAwareResolver {

    static final int PRIORITY = 80;

    private static final String PATIENT_NAME = "PID.5";
    private static final String PATIENT_ADDRESS = "PID.11";
    private static final String PATIENT_BIRTH_DATE = "PID.7";

    private static final List<String> NON_PERSON_PARENTS = Arrays.asList("XTN", "CE", "CWE", "CF", "CX", "EI", "HD");

    private final DemographicDataSource dataSource;

    @Autowired
    public DemographicFieldResolver(DemographicDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(FieldResolutionContext context) {
        return category(context) != null;
    }

    @Override
    public String resolve(FieldResolutionContext context) {
        String category = category(context);
        if (category == null) {
            return null;
        }
        GenerationContext generation = context.getGenerationContext();
        switch (category) {
            case "family":
                return generation.pick(dataSource.getValues(DemographicDataSource.LAST_NAMES));
            case "given":
                return givenName(context);
            case "middle":
                return generation.pick(dataSource.getValues(DemographicDataSource.MIDDLE_NAMES));
            case "suffix":
                return generation.pick(dataSource.getValues(DemographicDataSource.SUFFIXES));
            case "prefix":
                return generation.pick(dataSource.getValues(DemographicDataSource.PREFIXES));
            case "degree":
                return generation.pick(dataSource.getValues(DemographicDataSource.DEGREES));
            case "street":
                return generation.nextInt(100, 9999) + " "
                        + generation.pick(dataSource.getValues(DemographicDataSource.STREET_NAMES));
            case "designation":
                return "Apt " + generation.nextInt(1, 400);
            case "city":
                return location(context).getCity();
            case "state":
                return location(context).getState();
            case "zip":
                return location(context).getZip();
            case "country":
                return "USA";
            case "birthdate":
                return birthDate(context);
            case "birthplace":
                Location place = generation.pick(dataSource.getLocations());
                return place.getCity() + ", " + place.getState();
            case "organization":
                return generation.pick(dataSource.getValues(DemographicDataSource.ORGANIZATIONS));
            case "job":
                return generation.pick(dataSource.getValues(DemographicDataSource.JOB_TITLES));
            default:
                return null;
        }
    }

    @Override
    public boolean canHandleComposite(String dataTypeCode) {
        return "XPN".equalsIgnoreCase(dataTypeCode) || "XAD".equalsIgnoreCase(dataTypeCode);
    }

    @Override
    public Optional<Map<Integer, String>> resolveComposite(SegmentFieldDefinition field, DataTypeDefinition dataType,
            FieldResolutionContext context) {
        Patient patient = context.getGenerationContext().getPatient();
        if (patient == null) {
            return Optional.empty();
        }
        String path = context.getFieldPath();
        if (PATIENT_NAME.equals(path) && patient.getName() != null) {
            return Optional.of(nameComponents(patient.getName()));
        }
        if (PATIENT_ADDRESS.equals(path) && patient.getAddress() != null) {
            return Optional.of(addressComponents(patient.getAddress()));
        }
        return Optional.empty();
    }

    static Map<Integer, String> nameComponents(PersonName name) {
        Map<Integer, String> components = new LinkedHashMap<>();
        components.put(1, orEmpty(name.getFamily()));
        components.put(2, orEmpty(name.getGiven()));
        components.put(3, orEmpty(name.getMiddle()));
        components.put(4, orEmpty(name.getSuffix()));
        components.put(5, orEmpty(name.getPrefix()));
        components.put(7, "L");
        return components;
    }

    private static Map<Integer, String> addressComponents(Address address) {
        Map<Integer, String> components = new LinkedHashMap<>();
        components.put(1, orEmpty(address.getStreet()));
        components.put(2, orEmpty(address.getOtherDesignation()));
        components.put(3, orEmpty(address.getCity()));
        components.put(4, orEmpty(address.getState()));
        components.put(5, orEmpty(address.getPostalCode()));
        components.put(6, orEmpty(address.getCountry()));
        components.put(7, "H");
        return components;
    }

    private String category(FieldResolutionContext context) {
        if (context.isComponent() && NON_PERSON_PARENTS.contains(context.getParentDataType())) {
            return null;
        }
        String text = context.getSemanticText();
        if (containsAny(text, "family name", "last name")) {
            return "family";
        }
        if (containsAny(text, "given name", "first name")) {
            return "given";
        }
        if (text.contains("middle")) {
            return "middle";
        }
        if (hasAnyWord(text, "suffix")) {
            return "suffix";
        }
        if (hasAnyWord(text, "prefix")) {
            return "prefix";
        }
        if (hasAnyWord(text, "degree") && context.isComponent()) {
            return "degree";
        }
        if (text.contains("street")) {
            return "street";
        }
        if (text.contains("other designation") && "XAD".equals(context.getParentDataType())) {
            return "designation";
        }
        if (hasAnyWord(text, "city")) {
            return "city";
        }
        if (hasAnyWord(text, "state")) {
            return "state";
        }
        if (containsAny(text, "zip", "postal")) {
            return "zip";
        }
        if (hasAnyWord(text, "country") && "XAD".equals(context.getParentDataType())) {
            return "country";
        }
        if (text.contains("birth place")) {
            return "birthplace";
        }
        if (containsAny(text, "date of birth", "date/time of birth", "birth date")) {
            return "birthdate";
        }
        if (text.contains("organization name") || text.contains("employer name")) {
            return "organization";
        }
        if (text.contains("job title")) {
            return "job";
        }
        return null;
    }

    private String givenName(FieldResolutionContext context) {
        GenerationContext generation = context.getGenerationContext();
        String gender = null;
        if ("PID".equals(context.getSegmentCode()) && generation.getPatient() != null) {
            gender = Hl7TableFieldResolver.genderCode(generation.getPatient().getGender());
        }
        if (gender == null || (!"M".equals(gender) && !"F".equals(gender))) {
            gender = generation.getRandom().nextBoolean() ? "M" : "F";
        }
        String pool = "F".equals(gender)
                ? DemographicDataSource.FIRST_NAMES_FEMALE
                : DemographicDataSource.FIRST_NAMES_MALE;
        return generation.pick(dataSource.getValues(pool));
    }

    /**
     * One location per address field occurrence so city, state and zip agree.
     */
    private Location location(FieldResolutionContext context) {
        GenerationContext generation = context.getGenerationContext();
        String key = "location:" + context.getFieldPath() + "#" + context.getSegmentOccurrence();
        return generation.remember(key, () -> generation.pick(dataSource.getLocations()));
    }

    private String birthDate(FieldResolutionContext context) {
        GenerationContext generation = context.getGenerationContext();
        Patient patient = generation.getPatient();
        if (PATIENT_BIRTH_DATE.equals(context.getFieldPath()) && patient != null && patient.getBirthDate() != null) {
            return DateTimeUtil.formatDate(patient.getBirthDate());
        }
        LocalDate date = generation.getReferenceTime().toLocalDate()
                .minusYears(generation.nextInt(18, 90))
                .minusDays(generation.nextInt(0, 364));
        return DateTimeUtil.formatDate(date);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
