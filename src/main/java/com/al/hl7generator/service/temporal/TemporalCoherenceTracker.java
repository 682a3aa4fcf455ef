package com.al.hl7generator.service.temporal;

import com.al.hl7generator.model.clinical.Encounter;
import com.al.hl7generator.service.composer.GenerationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Produces timestamps for the fields listed in {@link TemporalRelationships}
 * so that related fields of one message stay in a plausible order. Every
 * timestamp handed out is recorded in the composition's context.
 */
@Component
@Slf4j
public class TemporalCoherenceTracker {

    public boolean isTracked(String fieldPath) {
        return TemporalRelationships.isTracked(fieldPath);
    }

    /**
     * Timestamp for a tracked field, or the reference time for any other path.
     */
    public LocalDateTime timestampFor(String fieldPath, GenerationContext context) {
        if (TemporalRelationships.ENCOUNTER_ANCHOR.equals(fieldPath)) {
            return encounterAnchor(context);
        }

        Optional<TemporalRelationship> relationship = TemporalRelationships.forField(fieldPath);
        if (!relationship.isPresent()) {
            return context.getReferenceTime();
        }

        TemporalRelationship rel = relationship.get();
        LocalDateTime value = findAnchor(rel.getAnchorPath(), context)
                .map(anchor -> anchor.plus(randomOffset(rel, context)))
                .orElseGet(context::getReferenceTime);
        context.recordTimestamp(fieldPath, value);
        log.trace("{} -> {} (anchor {})", fieldPath, value, rel.getAnchorPath());
        return value;
    }

    /**
     * The encounter start: an already written EVN-2, the encounter's admit time,
     * or a random point within the week before the reference time.
     */
    LocalDateTime encounterAnchor(GenerationContext context) {
        Optional<LocalDateTime> recorded = context.getRecordedTimestamp(TemporalRelationships.ENCOUNTER_ANCHOR);
        if (recorded.isPresent()) {
            return recorded.get();
        }
        LocalDateTime anchor = admitTime(context).orElseGet(() -> context.getReferenceTime()
                .minusDays(context.getRandom().nextInt(7))
                .minusHours(context.getRandom().nextInt(24))
                .minusMinutes(context.getRandom().nextInt(60)));
        context.recordTimestamp(TemporalRelationships.ENCOUNTER_ANCHOR, anchor);
        return anchor;
    }

    private Optional<LocalDateTime> findAnchor(String anchorPath, GenerationContext context) {
        Optional<LocalDateTime> anchor = context.getRecordedTimestamp(anchorPath);
        if (anchor.isPresent()) {
            return anchor;
        }
        Optional<LocalDateTime> encounterStart = context.getRecordedTimestamp(TemporalRelationships.ENCOUNTER_ANCHOR);
        if (encounterStart.isPresent()) {
            return encounterStart;
        }
        return admitTime(context);
    }

    private Optional<LocalDateTime> admitTime(GenerationContext context) {
        return context.getEncounter().map(Encounter::getAdmitDateTime);
    }

    private Duration randomOffset(TemporalRelationship rel, GenerationContext context) {
        long min = rel.getMinOffset().getSeconds();
        long span = rel.getMaxOffset().getSeconds() - min;
        long offset = min + (long) (context.getRandom().nextDouble() * (span + 1));
        return Duration.ofSeconds(Math.min(offset, rel.getMaxOffset().getSeconds()));
    }
}
