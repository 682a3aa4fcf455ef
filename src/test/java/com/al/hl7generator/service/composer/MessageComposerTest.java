package com.al.hl7generator.service.composer;

import com.al.hl7generator.dto.CompositionResult;
import com.al.hl7generator.dto.GenerationIssue;
import com.al.hl7generator.model.clinical.ClinicalBundle;
import com.al.hl7generator.model.clinical.Encounter;
import com.al.hl7generator.model.clinical.Patient;
import com.al.hl7generator.model.clinical.PersonName;
import com.al.hl7generator.model.schema.SegmentOccurrence;
import com.al.hl7generator.model.schema.TriggerEventDefinition;
import com.al.hl7generator.schema.TriggerEventProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class MessageComposerTest {

    private ComposerFixture fixture;
    private MessageComposer composer;

    @BeforeEach
    public void setup() {
        fixture = new ComposerFixture();
        composer = fixture.composer();
    }

    private static ClinicalBundle bundle() {
        return ClinicalBundle.builder()
                .patient(Patient.builder()
                        .id("12345")
                        .mrn("998877")
                        .name(PersonName.builder().family("Doe").given("Jane").build())
                        .birthDate(LocalDate.of(1980, 5, 15))
                        .gender("female")
                        .build())
                .build();
    }

    private static GenerationOptions seeded(long seed) {
        return GenerationOptions.builder().seed(seed).build();
    }

    private static List<String> segmentCodes(CompositionResult result) {
        return Arrays.stream(result.getMessage().split("\r"))
                .map(line -> line.length() >= 3 ? line.substring(0, 3) : line)
                .collect(Collectors.toList());
    }

    private static SegmentOccurrence occurrence(String code, String optionality, String repeatability,
            boolean group, int level, int order) {
        return SegmentOccurrence.builder()
                .segmentCode(code)
                .optionality(optionality)
                .repeatability(repeatability)
                .group(group)
                .level(level)
                .orderIndex(order)
                .build();
    }

    private MessageComposer composerFor(TriggerEventDefinition definition) {
        TriggerEventProvider provider = mock(TriggerEventProvider.class);
        when(provider.getTriggerEvent(anyString())).thenReturn(Optional.of(definition));
        return new MessageComposer(provider, fixture.segmentProvider, fixture.segmentGenerator(),
                fixture.properties, fixture.clock);
    }

    @Test
    public void testUnknownTriggerEventFailsNamingCode() {
        CompositionResult result = composer.compose("ZZZ^Z99", bundle(), GenerationOptions.defaults());

        assertFalse(result.isSuccess());
        assertNull(result.getMessage());
        assertEquals(0, result.getSegmentCount());
        assertTrue(result.getFailureReason().contains("zzz_z99"));
        assertEquals("zzz_z99", result.getTriggerEventCode());
    }

    @Test
    public void testBlankMessageTypeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> composer.compose(" ", bundle(), GenerationOptions.defaults()));
    }

    @Test
    public void testRequiredSegmentsAlwaysPresent() {
        TriggerEventDefinition definition = fixture.triggerEventProvider.getTriggerEvent("adt_a01").get();

        for (long seed = 0; seed < 25; seed++) {
            CompositionResult result = composer.compose("ADT^A01", bundle(), seeded(seed));

            assertTrue(result.isSuccess());
            List<String> codes = segmentCodes(result);
            assertTrue(codes.containsAll(Arrays.asList("MSH", "EVN", "PID", "PV1")), "seed " + seed);
            assertTrue(result.getSegmentCount() >= definition.getRequiredSegmentCount());
            assertEquals("MSH", codes.get(0));
            assertEquals(codes.size(), result.getSegmentCount());
        }
    }

    @Test
    public void testMessageFormat() {
        CompositionResult result = composer.compose("ADT^A01", bundle(), GenerationOptions.defaults());

        String message = result.getMessage();
        assertTrue(message.startsWith("MSH|^~\\&|HL7GEN|GENERATOR|RECEIVER|FACILITY|"));
        assertFalse(message.endsWith("\r"));
        assertFalse(message.contains("\n"));

        String[] msh = message.split("\r")[0].split("\\|", -1);
        assertEquals("20260314093000".length(), msh[6].length());
        assertEquals("ADT^A01", msh[8]);
        assertTrue(msh[9].startsWith("MSG20260314093000"));
        assertEquals("P", msh[10]);
        assertEquals("2.3", msh[11]);
    }

    @Test
    public void testUnderscoreMessageTypeIsNormalized() {
        CompositionResult result = composer.compose("adt_a01", bundle(), seeded(3L));

        assertEquals("ADT^A01", result.getMessageType());
        assertEquals("adt_a01", result.getTriggerEventCode());
        assertEquals("ADT^A01", result.getMessage().split("\r")[0].split("\\|", -1)[8]);
    }

    @Test
    public void testSeededCompositionIsDeterministic() {
        CompositionResult first = composer.compose("ADT^A01", bundle(), seeded(12345L));
        CompositionResult second = fixture.composer().compose("ADT^A01", bundle(), seeded(12345L));

        assertEquals(first.getMessage(), second.getMessage());
    }

    @Test
    public void testSeededCompositionIgnoresWallClock() throws InterruptedException {
        MessageComposer systemClockComposer = new MessageComposer(fixture.triggerEventProvider,
                fixture.segmentProvider, fixture.segmentGenerator(), fixture.properties, Clock.systemUTC());
        ClinicalBundle admitted = bundle();
        admitted.setEncounter(Encounter.builder()
                .visitNumber("V100")
                .admitDateTime(LocalDateTime.of(2025, 1, 2, 3, 4, 5))
                .build());

        String withEncounter = systemClockComposer.compose("ADT^A01", admitted, seeded(12345L)).getMessage();
        String withoutEncounter = systemClockComposer.compose("ADT^A01", bundle(), seeded(12345L)).getMessage();
        Thread.sleep(1100L);

        assertEquals(withEncounter, systemClockComposer.compose("ADT^A01", admitted, seeded(12345L)).getMessage());
        assertEquals(withoutEncounter, systemClockComposer.compose("ADT^A01", bundle(), seeded(12345L)).getMessage());
    }

    @Test
    public void testSeededReferenceTimeFollowsAdmitTime() {
        ClinicalBundle admitted = bundle();
        admitted.setEncounter(Encounter.builder()
                .admitDateTime(LocalDateTime.of(2025, 1, 2, 3, 4, 5))
                .build());

        CompositionResult result = composer.compose("ADT^A01", admitted, seeded(12345L));

        String[] msh = result.getMessage().split("\r")[0].split("\\|", -1);
        assertTrue(msh[9].startsWith("MSG20250102030405"), msh[9]);
    }

    @Test
    public void testReferenceTimeSelection() {
        LocalDateTime explicit = LocalDateTime.of(2025, 6, 30, 12, 0, 0);
        GenerationOptions pinned = GenerationOptions.builder().seed(5L).referenceTime(explicit).build();

        assertEquals(explicit, composer.referenceTime(bundle(), pinned));
        assertEquals(MessageComposer.SEEDED_EPOCH.plusMinutes(7), composer.referenceTime(bundle(), seeded(7L)));
        assertEquals(ComposerFixture.REFERENCE_TIME, composer.referenceTime(bundle(), GenerationOptions.defaults()));
    }

    @Test
    public void testDifferentSeedsDiffer() {
        CompositionResult first = composer.compose("ADT^A01", bundle(), seeded(1L));
        CompositionResult second = composer.compose("ADT^A01", bundle(), seeded(2L));

        assertNotEquals(first.getMessage(), second.getMessage());
    }

    @Test
    public void testMissingSegmentSchemaEmitsMinimalSegment() {
        TriggerEventDefinition definition = TriggerEventDefinition.builder()
                .code("ZZT_Z01")
                .segment(occurrence("MSH", "R", "1", false, 0, 0))
                .segment(occurrence("ZPI", "R", "1", false, 0, 1))
                .build();

        CompositionResult result = composerFor(definition).compose("ZZT^Z01", bundle(), seeded(5L));

        assertTrue(result.isSuccess());
        String[] lines = result.getMessage().split("\r");
        assertEquals(2, lines.length);
        assertEquals("ZPI", lines[1]);
    }

    @Test
    public void testOptionalSegmentInclusionRate() {
        TriggerEventDefinition definition = TriggerEventDefinition.builder()
                .code("ADT_A01")
                .segment(occurrence("EVN", "R", "1", false, 0, 0))
                .segment(occurrence("PD1", "O", "1", false, 0, 1))
                .build();
        MessageComposer optionalComposer = composerFor(definition);

        int samples = 400;
        int included = 0;
        for (long seed = 0; seed < samples; seed++) {
            CompositionResult result = optionalComposer.compose("ADT^A01", bundle(), seeded(seed));
            if (segmentCodes(result).contains("PD1")) {
                included++;
            }
        }

        double rate = included / (double) samples;
        assertTrue(rate >= 0.5 && rate <= 0.7, "inclusion rate " + rate);
    }

    @Test
    public void testShouldIncludeRequiredDrawsNoRandomness() {
        GenerationContext context = new GenerationContext(bundle(), "ADT^A01", new Random(9L),
                ComposerFixture.REFERENCE_TIME);
        GenerationContext reference = new GenerationContext(bundle(), "ADT^A01", new Random(9L),
                ComposerFixture.REFERENCE_TIME);

        assertTrue(composer.shouldInclude(occurrence("PID", "R", "1", false, 0, 0), context,
                GenerationOptions.defaults()));
        assertEquals(reference.getRandom().nextLong(), context.getRandom().nextLong());
    }

    @Test
    public void testInclusionOverrides() {
        Map<String, Double> probabilities = new HashMap<>();
        probabilities.put("PROCEDURE", 0.0);
        probabilities.put("INSURANCE", 1.0);
        probabilities.put("NK1", 1.0);
        Map<String, Integer> repeats = new HashMap<>();
        repeats.put("NK1", 3);
        GenerationOptions options = GenerationOptions.builder()
                .seed(11L)
                .segmentInclusionProbabilities(probabilities)
                .segmentRepeatCounts(repeats)
                .build();

        CompositionResult result = composer.compose("ADT^A01", bundle(), options);

        List<String> codes = segmentCodes(result);
        assertFalse(codes.contains("PR1"));
        assertTrue(codes.contains("IN1"));
        assertEquals(3, codes.stream().filter("NK1"::equals).count());

        List<String> setIds = new ArrayList<>();
        for (String line : result.getMessage().split("\r")) {
            if (line.startsWith("NK1|")) {
                setIds.add(line.split("\\|", -1)[1]);
            }
        }
        assertEquals(Arrays.asList("1", "2", "3"), setIds);
    }

    @Test
    public void testOverrideKeysMatchAnyCase() {
        Map<String, Double> probabilities = new HashMap<>();
        probabilities.put("nk1", 1.0);
        Map<String, Integer> repeats = new HashMap<>();
        repeats.put("Nk1", 2);
        GenerationOptions options = GenerationOptions.builder()
                .seed(11L)
                .segmentInclusionProbabilities(probabilities)
                .segmentRepeatCounts(repeats)
                .build();

        CompositionResult result = composer.compose("ADT^A01", bundle(), options);

        assertEquals(2, segmentCodes(result).stream().filter("NK1"::equals).count());
        assertEquals(Optional.of(2), options.repeatCountFor("NK1"));
    }

    @Test
    public void testExcludedGroupSkipsNestedGroupsAndSegments() {
        TriggerEventDefinition definition = TriggerEventDefinition.builder()
                .code("ORM_O01")
                .segment(occurrence("MSH", "R", "1", false, 0, 0))
                .segment(occurrence("PATIENT", "O", "1", true, 0, 1))
                .segment(occurrence("PID", "R", "1", false, 1, 2))
                .segment(occurrence("PATIENT_VISIT", "O", "1", true, 1, 3))
                .segment(occurrence("PV1", "R", "1", false, 2, 4))
                .segment(occurrence("ORDER", "R", SegmentOccurrence.UNBOUNDED, true, 0, 5))
                .segment(occurrence("ORC", "R", "1", false, 1, 6))
                .build();
        Map<String, Double> probabilities = new HashMap<>();
        probabilities.put("PATIENT", 0.0);
        probabilities.put("PATIENT_VISIT", 1.0);
        GenerationOptions options = GenerationOptions.builder()
                .seed(4L)
                .segmentInclusionProbabilities(probabilities)
                .build();

        CompositionResult result = composerFor(definition).compose("ORM^O01", bundle(), options);

        assertEquals(Arrays.asList("MSH", "ORC"), segmentCodes(result));
    }

    @Test
    public void testGroupMembersFollowIncludedGroup() {
        Map<String, Double> probabilities = new HashMap<>();
        probabilities.put("PATIENT", 1.0);
        probabilities.put("PATIENT_VISIT", 1.0);
        GenerationOptions options = GenerationOptions.builder()
                .seed(4L)
                .segmentInclusionProbabilities(probabilities)
                .build();

        CompositionResult result = composer.compose("ORM^O01", bundle(), options);

        List<String> codes = segmentCodes(result);
        assertTrue(codes.indexOf("PID") < codes.indexOf("PV1"));
        assertTrue(codes.indexOf("PV1") < codes.indexOf("ORC"));
        assertTrue(!codes.contains("OBX") || codes.contains("OBR"));
    }

    @Test
    public void testFailingSegmentIsSkippedAndReported() {
        SegmentGenerator segmentGenerator = mock(SegmentGenerator.class);
        when(segmentGenerator.generate(anyString(), any(GenerationContext.class), any(GenerationOptions.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        when(segmentGenerator.generate(eq("PID"), any(GenerationContext.class), any(GenerationOptions.class)))
                .thenThrow(new IllegalStateException("boom"));
        MessageComposer failingComposer = new MessageComposer(fixture.triggerEventProvider, fixture.segmentProvider,
                segmentGenerator, fixture.properties, fixture.clock);

        CompositionResult result = failingComposer.compose("ADT^A01", bundle(), seeded(8L));

        assertTrue(result.isSuccess());
        assertFalse(segmentCodes(result).contains("PID"));
        assertTrue(segmentCodes(result).contains("PV1"));
        assertTrue(result.hasIssues());
        GenerationIssue issue = result.getIssues().get(0);
        assertEquals("PID", issue.getSegment());
        assertEquals("SEGMENT_SKIPPED", issue.getCode());
        assertEquals("boom", issue.getMessage());
    }

    @Test
    public void testToTriggerEventCode() {
        assertEquals("adt_a01", MessageComposer.toTriggerEventCode("ADT^A01"));
        assertEquals("oru_r01", MessageComposer.toTriggerEventCode(" ORU_R01 "));
        assertEquals("ADT^A08", MessageComposer.canonicalMessageType("adt_a08"));
    }
}
