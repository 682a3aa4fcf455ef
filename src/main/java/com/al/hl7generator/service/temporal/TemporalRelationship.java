package com.al.hl7generator.service.temporal;

import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A dependent timestamp field constrained to an offset window after (or
 * before, for negative offsets) an anchor field.
 */
@Value
public class TemporalRelationship {

    String dependentPath;
    String anchorPath;
    Duration minOffset;
    Duration maxOffset;

    public boolean accepts(LocalDateTime anchor, LocalDateTime value) {
        return !value.isBefore(anchor.plus(minOffset)) && !value.isAfter(anchor.plus(maxOffset));
    }
}
