package com.al.hl7generator.controller;

import com.al.hl7generator.dto.CompositionResult;
import com.al.hl7generator.dto.GenerateMessageRequest;
import com.al.hl7generator.service.MessageGenerationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/messages")
@Slf4j
@Tag(name = "Generation", description = "Synthetic HL7 v2 message generation endpoints")
public class GeneratorController {

    static final String SEGMENT_COUNT_HEADER = "X-Segment-Count";
    static final String ISSUE_COUNT_HEADER = "X-Generation-Issues";

    private final MessageGenerationService generationService;

    @Autowired
    public GeneratorController(MessageGenerationService generationService) {
        this.generationService = generationService;
    }

    @Operation(summary = "Generate an HL7 v2 message", description = "Composes a pipe-delimited HL7 v2 message for the requested message type from the supplied clinical bundle and options.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Message generated"),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "404", description = "Unknown message type")
    })
    @PostMapping(value = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> generate(@Valid @RequestBody GenerateMessageRequest request) {
        log.debug("Generate request for {}", request.getMessageType());
        CompositionResult result = generationService.generate(request);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .header(SEGMENT_COUNT_HEADER, String.valueOf(result.getSegmentCount()))
                .header(ISSUE_COUNT_HEADER, String.valueOf(result.getIssues().size()))
                .body(result.getMessage());
    }

    @Operation(summary = "Generate with details", description = "Same as generate but returns the composition result, including skipped segments and verification problems, as JSON.")
    @PostMapping(value = "/generate/detailed", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CompositionResult> generateDetailed(@Valid @RequestBody GenerateMessageRequest request) {
        return ResponseEntity.ok(generationService.generate(request));
    }

    @Operation(summary = "List trigger events", description = "Returns the codes of all trigger event structures available for generation.")
    @GetMapping(value = "/trigger-events", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<String>> triggerEvents() {
        return ResponseEntity.ok(generationService.getAvailableTriggerEvents());
    }
}
