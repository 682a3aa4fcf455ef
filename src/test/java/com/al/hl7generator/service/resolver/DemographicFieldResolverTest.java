package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.clinical.Address;
import com.al.hl7generator.model.clinical.ClinicalBundle;
import com.al.hl7generator.model.clinical.Patient;
import com.al.hl7generator.model.clinical.PersonName;
import com.al.hl7generator.model.schema.DataTypeDefinition;
import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import com.al.hl7generator.schema.DemographicDataSource;
import com.al.hl7generator.service.composer.GenerationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static com.al.hl7generator.service.resolver.ResolutionContexts.field;
import static com.al.hl7generator.service.resolver.ResolutionContexts.forComponent;
import static com.al.hl7generator.service.resolver.ResolutionContexts.forField;
import static com.al.hl7generator.service.resolver.ResolutionContexts.generation;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class DemographicFieldResolverTest {

    @Mock
    private DemographicDataSource dataSource;

    private DemographicFieldResolver resolver;

    @BeforeEach
    public void setup() {
        resolver = new DemographicFieldResolver(dataSource);
        when(dataSource.getValues(anyString())).thenReturn(Collections.singletonList("Sample"));
        when(dataSource.getValues(DemographicDataSource.LAST_NAMES)).thenReturn(Collections.singletonList("Smith"));
        when(dataSource.getValues(DemographicDataSource.FIRST_NAMES_FEMALE))
                .thenReturn(Collections.singletonList("Mary"));
        when(dataSource.getValues(DemographicDataSource.FIRST_NAMES_MALE))
                .thenReturn(Collections.singletonList("John"));
        when(dataSource.getLocations()).thenReturn(Arrays.asList(
                new DemographicDataSource.Location("Boston", "MA", "02108"),
                new DemographicDataSource.Location("Austin", "TX", "73301")));
    }

    private static ClinicalBundle patientBundle() {
        return ClinicalBundle.builder()
                .patient(Patient.builder()
                        .name(PersonName.builder().family("Doe").given("Jane").prefix("Ms").build())
                        .address(Address.builder().street("1 Main St").city("Springfield").state("IL")
                                .postalCode("62701").build())
                        .birthDate(LocalDate.of(1980, 5, 15))
                        .gender("F")
                        .build())
                .build();
    }

    @Test
    public void testPatientNameFromBundle() {
        SegmentFieldDefinition name = field(5, "Patient Name", "XPN");
        GenerationContext generation = generation(patientBundle());

        Map<Integer, String> components = resolver.resolveComposite(name,
                DataTypeDefinition.builder().code("XPN").build(), forField("PID", name, generation)).get();

        assertEquals("Doe", components.get(1));
        assertEquals("Jane", components.get(2));
        assertEquals("Ms", components.get(5));
        assertEquals("L", components.get(7));
    }

    @Test
    public void testPatientAddressFromBundle() {
        SegmentFieldDefinition address = field(11, "Patient Address", "XAD");

        Map<Integer, String> components = resolver.resolveComposite(address,
                DataTypeDefinition.builder().code("XAD").build(),
                forField("PID", address, generation(patientBundle()))).get();

        assertEquals("1 Main St", components.get(1));
        assertEquals("Springfield", components.get(3));
        assertEquals("62701", components.get(5));
        assertEquals("H", components.get(7));
    }

    @Test
    public void testOtherPeopleAreNotTakenFromPatient() {
        SegmentFieldDefinition kin = field(2, "Name", "XPN");

        assertFalse(resolver.resolveComposite(kin, DataTypeDefinition.builder().code("XPN").build(),
                forField("NK1", kin, generation(patientBundle()))).isPresent());
    }

    @Test
    public void testNameComponentsFromPools() {
        GenerationContext generation = generation(patientBundle());
        SegmentFieldDefinition name = field(5, "Patient Name", "XPN");

        assertEquals("Smith", resolver.resolve(forComponent("PID", name, "XPN", 1, "Family Name", "ST", generation)));
        assertEquals("Mary", resolver.resolve(forComponent("PID", name, "XPN", 2, "Given Name", "ST", generation)));
    }

    @Test
    public void testAddressComponentsShareOneLocation() {
        GenerationContext generation = generation(new ClinicalBundle());
        SegmentFieldDefinition address = field(4, "Address", "XAD");

        String city = resolver.resolve(forComponent("NK1", address, "XAD", 3, "City", "ST", generation));
        String state = resolver.resolve(forComponent("NK1", address, "XAD", 4, "State or Province", "ST", generation));
        String zip = resolver.resolve(forComponent("NK1", address, "XAD", 5, "Zip or Postal Code", "ST", generation));

        if ("Boston".equals(city)) {
            assertEquals("MA", state);
            assertEquals("02108", zip);
        } else {
            assertEquals("Austin", city);
            assertEquals("TX", state);
            assertEquals("73301", zip);
        }
    }

    @Test
    public void testBirthDate() {
        assertEquals("19800515", resolver.resolve(forField("PID", field(7, "Date of Birth", "TS"),
                generation(patientBundle()))));

        String synthetic = resolver.resolve(forField("GT1", field(8, "Guarantor Date of Birth", "DT"),
                generation(new ClinicalBundle())));
        assertEquals(8, synthetic.length());
    }

    @Test
    public void testSkipsNonPersonComposites() {
        GenerationContext generation = generation(new ClinicalBundle());

        assertFalse(resolver.canHandle(forComponent("PID", field(10, "Race", "CE"), "CE", 2, "Text", "ST",
                generation)));
        assertFalse(resolver.canHandle(forField("PID", field(1, "Set ID - Patient ID", "SI"), generation)));
    }
}
