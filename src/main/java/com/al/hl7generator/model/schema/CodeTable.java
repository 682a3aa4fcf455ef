package com.al.hl7generator.model.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * HL7 code table (e.g. 0001 Administrative Sex).
 */
@Value
@Builder
public class CodeTable {

    int id;
    String name;
    String type;

    @Singular
    List<Entry> values;

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Optional<Entry> findByCode(String code) {
        return values.stream()
                .filter(v -> v.getCode().equalsIgnoreCase(code))
                .findFirst();
    }

    /**
     * Coding system name in the form used by CE.3, e.g. {@code HL70001}.
     */
    public String getCodingSystem() {
        return String.format("HL7%04d", id);
    }

    @Value
    public static class Entry {
        String code;
        String description;
    }
}
