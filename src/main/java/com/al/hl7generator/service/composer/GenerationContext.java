package com.al.hl7generator.service.composer;

import com.al.hl7generator.model.clinical.ClinicalBundle;
import com.al.hl7generator.model.clinical.Encounter;
import com.al.hl7generator.model.clinical.ObservationResult;
import com.al.hl7generator.model.clinical.Patient;
import com.al.hl7generator.model.clinical.Prescription;
import com.al.hl7generator.util.DateTimeUtil;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Mutable state of one composition: the clinical bundle, the random source,
 * the reference time and the timestamps already written. Never shared between
 * compositions.
 */
@Getter
public class GenerationContext {

    private final ClinicalBundle bundle;
    private final String messageType;
    private final Random random;
    private final LocalDateTime referenceTime;

    private final Map<String, LocalDateTime> timestamps = new HashMap<>();
    private final Map<String, Integer> segmentCounts = new HashMap<>();
    private final Map<String, Object> memo = new HashMap<>();

    public GenerationContext(ClinicalBundle bundle, String messageType, Random random, LocalDateTime referenceTime) {
        this.bundle = bundle == null ? new ClinicalBundle() : bundle;
        this.messageType = messageType;
        this.random = random;
        this.referenceTime = referenceTime;
    }

    public Patient getPatient() {
        return bundle.getPatient();
    }

    public Optional<Encounter> getEncounter() {
        return Optional.ofNullable(bundle.getEncounter());
    }

    public Optional<Prescription> getPrescription() {
        return Optional.ofNullable(bundle.getPrescription());
    }

    public Optional<ObservationResult> getObservation() {
        return Optional.ofNullable(bundle.getObservation());
    }

    /**
     * Event part of the message type, e.g. {@code A01} for {@code ADT^A01}.
     */
    public String getTriggerEvent() {
        int separator = messageType.indexOf('^');
        return separator < 0 ? "" : messageType.substring(separator + 1);
    }

    /**
     * Advances and returns the 1-based occurrence index of a segment code.
     */
    public int nextOccurrence(String segmentCode) {
        return segmentCounts.merge(segmentCode, 1, Integer::sum);
    }

    public void recordTimestamp(String fieldPath, LocalDateTime value) {
        timestamps.put(fieldPath, value);
    }

    public Optional<LocalDateTime> getRecordedTimestamp(String fieldPath) {
        return Optional.ofNullable(timestamps.get(fieldPath));
    }

    /**
     * Value computed once per composition and key, used to keep related
     * components (city, state and zip of one address) consistent.
     */
    @SuppressWarnings("unchecked")
    public <T> T remember(String key, Supplier<T> supplier) {
        return (T) memo.computeIfAbsent(key, k -> supplier.get());
    }

    public String getMessageControlId() {
        return remember("MSH.10", () -> "MSG" + DateTimeUtil.formatDateTime(referenceTime)
                + String.format("%04d", random.nextInt(10000)));
    }

    public boolean chance(double probability) {
        return random.nextDouble() < probability;
    }

    public int nextInt(int minInclusive, int maxInclusive) {
        return minInclusive + random.nextInt(maxInclusive - minInclusive + 1);
    }

    public <T> T pick(List<T> values) {
        return values.get(random.nextInt(values.size()));
    }

    public String digits(int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(random.nextInt(10));
        }
        return sb.toString();
    }
}
