package com.al.hl7generator.dto;

import com.al.hl7generator.model.clinical.ClinicalBundle;
import com.al.hl7generator.service.composer.GenerationOptions;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body of the generate endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateMessageRequest {

    @NotBlank(message = "Message type is required")
    @Pattern(regexp = "^[A-Za-z0-9]{3}[\\^_][A-Za-z0-9]{3}$",
            message = "Message type must look like ADT^A01 or ADT_A01")
    @Schema(description = "Message type and trigger event", example = "ADT^A01")
    private String messageType;

    /**
     * Clinical data to draw values from; optional, missing parts are synthesized
     */
    @Valid
    private ClinicalBundle bundle;

    private GenerationOptions options;
}
