package com.al.hl7generator.service;

import ca.uhn.hl7v2.HL7Exception;
import ca.uhn.hl7v2.HapiContext;
import ca.uhn.hl7v2.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Parses generated messages back with HAPI to confirm they are structurally
 * well formed.
 */
@Component
@Slf4j
public class GeneratedMessageVerifier {

    private final HapiContext hapiContext;

    @Autowired
    public GeneratedMessageVerifier(HapiContext hapiContext) {
        this.hapiContext = hapiContext;
    }

    /**
     * @return the parser's complaint, or empty if the message parses
     */
    public Optional<String> verify(String message) {
        if (message == null || message.isBlank()) {
            return Optional.of("Message is empty");
        }
        try {
            Message parsed = hapiContext.getPipeParser().parse(message.replace("\n", "\r"));
            log.debug("Verified generated {} message", parsed.getName());
            return Optional.empty();
        } catch (HL7Exception e) {
            log.warn("Generated message failed to parse: {}", e.getMessage());
            return Optional.of(e.getMessage());
        }
    }
}
