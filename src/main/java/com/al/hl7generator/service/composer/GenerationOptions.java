package com.al.hl7generator.service.composer;

import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Caller supplied knobs for a single composition.
 */
@Data
@NoArgsConstructor
public class GenerationOptions {

    /**
     * Seed for the random source. A fixed seed yields byte-identical output
     * for the same bundle, independent of the wall clock.
     */
    private Long seed;

    /**
     * Point in time the message is generated "at". Defaults to the clock, or
     * for seeded compositions to a time derived from the bundle or the seed.
     */
    private LocalDateTime referenceTime;

    /**
     * Inclusion probability per segment or group code, overriding the default
     * for optional occurrences. Codes match case-insensitively.
     */
    private Map<String, Double> segmentInclusionProbabilities = byCode(null);

    /**
     * Exact repeat count per segment code for unbounded occurrences. Codes
     * match case-insensitively.
     */
    private Map<String, Integer> segmentRepeatCounts = byCode(null);

    /**
     * Values pinned by field path ({@code PID.3}, {@code PID-5.1}) or semantic
     * path ({@code patient.mrn}).
     */
    private Map<String, String> lockedValues = new HashMap<>();

    @Builder
    public GenerationOptions(Long seed, LocalDateTime referenceTime, Map<String, Double> segmentInclusionProbabilities,
            Map<String, Integer> segmentRepeatCounts, Map<String, String> lockedValues) {
        this.seed = seed;
        this.referenceTime = referenceTime;
        this.segmentInclusionProbabilities = byCode(segmentInclusionProbabilities);
        this.segmentRepeatCounts = byCode(segmentRepeatCounts);
        this.lockedValues = lockedValues == null ? new HashMap<>() : new HashMap<>(lockedValues);
    }

    public static GenerationOptions defaults() {
        return GenerationOptions.builder().build();
    }

    public void setSegmentInclusionProbabilities(Map<String, Double> segmentInclusionProbabilities) {
        this.segmentInclusionProbabilities = byCode(segmentInclusionProbabilities);
    }

    public void setSegmentRepeatCounts(Map<String, Integer> segmentRepeatCounts) {
        this.segmentRepeatCounts = byCode(segmentRepeatCounts);
    }

    public Optional<Double> inclusionProbabilityFor(String code) {
        if (segmentInclusionProbabilities == null || code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(segmentInclusionProbabilities.get(code.trim()));
    }

    public Optional<Integer> repeatCountFor(String code) {
        if (segmentRepeatCounts == null || code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(segmentRepeatCounts.get(code.trim()));
    }

    private static <V> Map<String, V> byCode(Map<String, V> values) {
        Map<String, V> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (values != null) {
            for (Map.Entry<String, V> entry : values.entrySet()) {
                if (entry.getKey() != null) {
                    normalized.put(entry.getKey().trim(), entry.getValue());
                }
            }
        }
        return normalized;
    }
}
