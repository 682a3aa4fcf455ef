package com.al.hl7generator.model.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Structural definition of one HL7 trigger event (e.g. ADT^A01).
 * Segment occurrences are kept in the exact order they are declared.
 */
@Value
@Builder
public class TriggerEventDefinition {

    String code;
    String name;
    String version;
    String description;

    @Singular
    List<SegmentOccurrence> segments;

    /**
     * Number of required segment occurrences whose enclosing groups are all
     * required as well, i.e. the segments every composed message contains.
     */
    public long getRequiredSegmentCount() {
        Deque<SegmentOccurrence> groups = new ArrayDeque<>();
        long count = 0;
        for (SegmentOccurrence occurrence : segments) {
            while (!groups.isEmpty() && groups.peek().getLevel() >= occurrence.getLevel()) {
                groups.pop();
            }
            boolean reachable = groups.stream().allMatch(SegmentOccurrence::isRequired);
            if (occurrence.isGroup()) {
                groups.push(occurrence);
            } else if (reachable && occurrence.isRequired()) {
                count++;
            }
        }
        return count;
    }
}
