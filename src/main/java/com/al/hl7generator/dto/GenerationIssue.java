package com.al.hl7generator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A non-fatal problem met while composing a message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationIssue {

    /**
     * Segment code the issue belongs to, null for message level issues
     */
    private String segment;

    /**
     * 1-based repetition of the segment (for repeating segments like OBX)
     */
    private int occurrence;

    /**
     * Error code for programmatic handling
     */
    private String code;

    private String message;

    private Severity severity;

    /**
     * The original exception class name (for debugging)
     */
    private String exceptionType;

    public enum Severity {
        ERROR,
        WARNING
    }

    public static GenerationIssue segmentSkipped(String segment, int occurrence, Exception cause) {
        return GenerationIssue.builder()
                .segment(segment)
                .occurrence(occurrence)
                .code("SEGMENT_SKIPPED")
                .message(cause.getMessage())
                .severity(Severity.ERROR)
                .exceptionType(cause.getClass().getName())
                .build();
    }

    public static GenerationIssue verificationFailed(String message) {
        return GenerationIssue.builder()
                .code("VERIFICATION_FAILED")
                .message(message)
                .severity(Severity.WARNING)
                .build();
    }
}
