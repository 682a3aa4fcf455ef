package com.al.hl7generator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of composing one message: the message text, or the reason no
 * message could be produced, plus any issues met along the way.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompositionResult {

    /**
     * Message type as written to MSH-9, e.g. ADT^A01
     */
    private String messageType;

    /**
     * Normalized trigger event code, e.g. adt_a01
     */
    private String triggerEventCode;

    /**
     * The composed message, segments separated by the configured terminator
     */
    private String message;

    private int segmentCount;

    /**
     * Set when composition failed as a whole
     */
    private String failureReason;

    @Builder.Default
    private List<GenerationIssue> issues = new ArrayList<>();

    public boolean isSuccess() {
        return message != null && failureReason == null;
    }

    public boolean hasIssues() {
        return issues != null && !issues.isEmpty();
    }

    public void addIssue(GenerationIssue issue) {
        if (issues == null) {
            issues = new ArrayList<>();
        }
        issues.add(issue);
    }

    public static CompositionResult failure(String messageType, String triggerEventCode, String reason) {
        return CompositionResult.builder()
                .messageType(messageType)
                .triggerEventCode(triggerEventCode)
                .failureReason(reason)
                .build();
    }
}
