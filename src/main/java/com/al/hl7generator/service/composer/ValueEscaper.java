package com.al.hl7generator.service.composer;

import ca.uhn.hl7v2.parser.DefaultEscaping;
import ca.uhn.hl7v2.parser.EncodingCharacters;
import ca.uhn.hl7v2.parser.Escaping;
import org.springframework.stereotype.Component;

/**
 * Escapes delimiter characters inside leaf values using HAPI's escaping rules
 * for the standard {@code |^~\&} encoding characters.
 */
@Component
public class ValueEscaper {

    public static final char FIELD_SEPARATOR = '|';
    public static final String ENCODING_CHARACTERS = "^~\\&";

    private final Escaping escaping = new DefaultEscaping();
    private final EncodingCharacters encodingCharacters = new EncodingCharacters(FIELD_SEPARATOR, ENCODING_CHARACTERS);

    public String escape(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return escaping.escape(value, encodingCharacters);
    }
}
