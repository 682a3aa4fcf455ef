package com.al.hl7generator.model.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One entry of a trigger event structure: either a segment or a group marker.
 * Members of a group carry a {@code level} one deeper than the group marker.
 */
@Value
@Builder
public class SegmentOccurrence {

    public static final String REQUIRED = "R";
    public static final String OPTIONAL = "O";
    public static final String UNBOUNDED = "∞";

    String segmentCode;
    String description;
    String optionality;
    String repeatability;
    boolean group;
    int level;
    int orderIndex;

    @Singular("groupPathElement")
    List<String> groupPath;

    public boolean isRequired() {
        return REQUIRED.equals(optionality);
    }

    public boolean isUnbounded() {
        return UNBOUNDED.equals(repeatability);
    }
}
