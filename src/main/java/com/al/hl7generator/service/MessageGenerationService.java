package com.al.hl7generator.service;

import com.al.hl7generator.config.GeneratorProperties;
import com.al.hl7generator.dto.CompositionResult;
import com.al.hl7generator.dto.GenerateMessageRequest;
import com.al.hl7generator.dto.GenerationIssue;
import com.al.hl7generator.exception.TriggerEventNotFoundException;
import com.al.hl7generator.schema.TriggerEventProvider;
import com.al.hl7generator.service.composer.MessageComposer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for message generation: composes the message, optionally
 * parses it back for verification and records metrics.
 */
@Service
@Slf4j
public class MessageGenerationService {

    static final String TIMER_NAME = "hl7.generation.time";
    static final String COUNT_NAME = "hl7.generation.count";
    static final String SEGMENTS_NAME = "hl7.generation.segments";

    private final MessageComposer composer;
    private final TriggerEventProvider triggerEventProvider;
    private final GeneratedMessageVerifier verifier;
    private final MeterRegistry meterRegistry;
    private final GeneratorProperties properties;

    @Autowired
    public MessageGenerationService(MessageComposer composer, TriggerEventProvider triggerEventProvider,
            GeneratedMessageVerifier verifier, MeterRegistry meterRegistry, GeneratorProperties properties) {
        this.composer = composer;
        this.triggerEventProvider = triggerEventProvider;
        this.verifier = verifier;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
        log.info("MessageGenerationService initialized (version {}, verification {})",
                properties.getVersion(), properties.isVerifyOutput() ? "on" : "off");
    }

    /**
     * Generates one message.
     *
     * @throws TriggerEventNotFoundException if no structure exists for the
     *                                       requested message type
     */
    public CompositionResult generate(GenerateMessageRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String type = request.getMessageType() == null ? "unknown" : request.getMessageType().toUpperCase();

        CompositionResult result = composer.compose(request.getMessageType(), request.getBundle(),
                request.getOptions());
        if (!result.isSuccess()) {
            meterRegistry.counter(COUNT_NAME, "type", type, "status", "not_found").increment();
            sample.stop(meterRegistry.timer(TIMER_NAME, "type", type));
            throw new TriggerEventNotFoundException(result.getTriggerEventCode(), result.getFailureReason());
        }

        String status = "success";
        if (properties.isVerifyOutput()) {
            Optional<String> problem = verifier.verify(result.getMessage());
            if (problem.isPresent()) {
                result.addIssue(GenerationIssue.verificationFailed(problem.get()));
                status = "unverified";
            }
        }

        // one status per generated message
        meterRegistry.counter(COUNT_NAME, "type", result.getMessageType(), "status", status).increment();
        meterRegistry.counter(SEGMENTS_NAME, "type", result.getMessageType()).increment(result.getSegmentCount());
        sample.stop(meterRegistry.timer(TIMER_NAME, "type", result.getMessageType()));

        log.info("Generated {} with {} segments and {} issues", result.getMessageType(), result.getSegmentCount(),
                result.getIssues().size());
        return result;
    }

    public List<String> getAvailableTriggerEvents() {
        return triggerEventProvider.getAvailableTriggerEvents();
    }
}
