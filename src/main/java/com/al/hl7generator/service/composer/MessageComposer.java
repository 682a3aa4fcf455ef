package com.al.hl7generator.service.composer;

import com.al.hl7generator.config.GeneratorProperties;
import com.al.hl7generator.dto.CompositionResult;
import com.al.hl7generator.dto.GenerationIssue;
import com.al.hl7generator.model.clinical.ClinicalBundle;
import com.al.hl7generator.model.schema.SegmentOccurrence;
import com.al.hl7generator.model.schema.SegmentSchema;
import com.al.hl7generator.model.schema.TriggerEventDefinition;
import com.al.hl7generator.schema.SegmentProvider;
import com.al.hl7generator.schema.TriggerEventProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Composes a complete HL7 v2 message from a trigger event structure and a
 * clinical bundle.
 *
 * <p>
 * Occurrences are walked in declaration order. Group markers are decided once
 * (groups do not repeat) and pushed on a stack; every occurrence first pops
 * the groups it is no longer nested in, and members of an excluded group are
 * skipped without consuming randomness.
 */
@Service
@Slf4j
public class MessageComposer {

    /**
     * Start of the window seeded compositions without an admit time are placed in.
     */
    static final LocalDateTime SEEDED_EPOCH = LocalDateTime.of(2024, 1, 1, 0, 0);

    private static final long MINUTES_PER_YEAR = 365L * 24 * 60;

    private final TriggerEventProvider triggerEventProvider;
    private final SegmentProvider segmentProvider;
    private final SegmentGenerator segmentGenerator;
    private final GeneratorProperties properties;
    private final Clock clock;

    @Autowired
    public MessageComposer(TriggerEventProvider triggerEventProvider, SegmentProvider segmentProvider,
            SegmentGenerator segmentGenerator, GeneratorProperties properties, Clock clock) {
        this.triggerEventProvider = triggerEventProvider;
        this.segmentProvider = segmentProvider;
        this.segmentGenerator = segmentGenerator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param messageType e.g. {@code ADT^A01} or {@code ADT_A01}
     * @throws IllegalArgumentException if the message type is blank
     */
    public CompositionResult compose(String messageType, ClinicalBundle bundle, GenerationOptions options) {
        if (messageType == null || messageType.isBlank()) {
            throw new IllegalArgumentException("Message type is required");
        }
        GenerationOptions effectiveOptions = options == null ? GenerationOptions.defaults() : options;
        String canonicalType = canonicalMessageType(messageType);
        String triggerEventCode = toTriggerEventCode(messageType);

        Optional<TriggerEventDefinition> definition = triggerEventProvider.getTriggerEvent(triggerEventCode);
        if (!definition.isPresent()) {
            log.warn("Trigger event not found: {}", triggerEventCode);
            return CompositionResult.failure(canonicalType, triggerEventCode,
                    "Trigger event " + triggerEventCode + " not found");
        }

        Random random = effectiveOptions.getSeed() != null ? new Random(effectiveOptions.getSeed()) : new Random();
        GenerationContext context = new GenerationContext(bundle, canonicalType, random,
                referenceTime(bundle, effectiveOptions));

        List<String> lines = new ArrayList<>();
        List<GenerationIssue> issues = new ArrayList<>();
        Deque<GroupFrame> groups = new ArrayDeque<>();

        for (SegmentOccurrence occurrence : definition.get().getSegments()) {
            while (!groups.isEmpty() && groups.peek().level >= occurrence.getLevel()) {
                groups.pop();
            }
            boolean insideExcludedGroup = !groups.isEmpty() && !groups.peek().included;

            if (occurrence.isGroup()) {
                boolean included = !insideExcludedGroup && shouldInclude(occurrence, context, effectiveOptions);
                groups.push(new GroupFrame(occurrence.getLevel(), included));
                log.trace("Group {} {}", occurrence.getSegmentCode(), included ? "included" : "excluded");
                continue;
            }
            if (insideExcludedGroup || !shouldInclude(occurrence, context, effectiveOptions)) {
                continue;
            }

            int count = occurrence.isUnbounded() ? repeatCount(occurrence.getSegmentCode(), context, effectiveOptions) : 1;
            for (int i = 0; i < count; i++) {
                emit(occurrence.getSegmentCode(), i + 1, context, effectiveOptions, lines, issues);
            }
        }

        String message = String.join(properties.getSegmentTerminator(), lines).stripTrailing();
        log.debug("Composed {} with {} segments", canonicalType, lines.size());
        return CompositionResult.builder()
                .messageType(canonicalType)
                .triggerEventCode(triggerEventCode)
                .message(message)
                .segmentCount(lines.size())
                .issues(issues)
                .build();
    }

    /**
     * The time the message is generated at. Unseeded compositions use the
     * clock; seeded ones never read it, so the same seed and bundle give the
     * same message whenever they run.
     */
    LocalDateTime referenceTime(ClinicalBundle bundle, GenerationOptions options) {
        if (options.getReferenceTime() != null) {
            return options.getReferenceTime().withNano(0);
        }
        if (options.getSeed() == null) {
            return LocalDateTime.now(clock).withNano(0);
        }
        if (bundle != null && bundle.getEncounter() != null && bundle.getEncounter().getAdmitDateTime() != null) {
            return bundle.getEncounter().getAdmitDateTime().withNano(0);
        }
        return SEEDED_EPOCH.plusMinutes(Math.floorMod(options.getSeed(), MINUTES_PER_YEAR));
    }

    private void emit(String segmentCode, int repetition, GenerationContext context, GenerationOptions options,
            List<String> lines, List<GenerationIssue> issues) {
        try {
            lines.add(segmentGenerator.generate(segmentCode, context, options));
        } catch (RuntimeException e) {
            log.warn("Skipping segment {} (repetition {}): {}", segmentCode, repetition, e.getMessage());
            issues.add(GenerationIssue.segmentSkipped(segmentCode, repetition, e));
        }
    }

    /**
     * Required occurrences are always included and draw no random number.
     */
    boolean shouldInclude(SegmentOccurrence occurrence, GenerationContext context, GenerationOptions options) {
        if (occurrence.isRequired()) {
            return true;
        }
        double probability = options.inclusionProbabilityFor(occurrence.getSegmentCode())
                .orElse(properties.getOptionalSegmentProbability());
        return context.chance(probability);
    }

    int repeatCount(String segmentCode, GenerationContext context, GenerationOptions options) {
        Optional<Integer> override = options.repeatCountFor(segmentCode);
        if (override.isPresent()) {
            return Math.max(1, override.get());
        }
        String purpose = segmentProvider.getSegment(segmentCode)
                .map(SegmentSchema::getName)
                .orElse(segmentCode)
                .toLowerCase();
        RepeatRange range = RepeatRange.forPurpose(purpose);
        return context.nextInt(range.min, range.max);
    }

    /**
     * {@code ADT^A01} and {@code adt_a01} both become {@code adt_a01}.
     */
    public static String toTriggerEventCode(String messageType) {
        return messageType.trim().replace('^', '_').toLowerCase();
    }

    static String canonicalMessageType(String messageType) {
        return messageType.trim().replace('_', '^').toUpperCase();
    }

    private static final class GroupFrame {
        private final int level;
        private final boolean included;

        private GroupFrame(int level, boolean included) {
            this.level = level;
            this.included = included;
        }
    }

    private enum RepeatRange {
        CONTACT(1, 2, "next of kin", "contact"),
        OBSERVATION(1, 5, "observation", "result"),
        ALLERGY(1, 3, "allergy"),
        DIAGNOSIS(1, 3, "diagnosis"),
        FINANCIAL(1, 2, "guarantor", "financial"),
        DEFAULT(1, 2);

        private final int min;
        private final int max;
        private final String[] keywords;

        RepeatRange(int min, int max, String... keywords) {
            this.min = min;
            this.max = max;
            this.keywords = keywords;
        }

        static RepeatRange forPurpose(String purpose) {
            for (RepeatRange range : values()) {
                for (String keyword : range.keywords) {
                    if (purpose.contains(keyword)) {
                        return range;
                    }
                }
            }
            return DEFAULT;
        }
    }
}
