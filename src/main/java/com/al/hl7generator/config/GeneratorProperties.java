package com.al.hl7generator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for message generation.
 */
@Configuration
@ConfigurationProperties(prefix = "hl7.generator")
@Data
public class GeneratorProperties {

    /**
     * Classpath directory holding trigger_events, segments, data_types, tables
     * and demographics
     */
    private String schemaBasePath = "hl7/v23";

    /**
     * HL7 version written to MSH-12
     */
    private String version = "2.3";

    private String sendingApplication = "HL7GEN";
    private String sendingFacility = "GENERATOR";
    private String receivingApplication = "RECEIVER";
    private String receivingFacility = "FACILITY";

    /**
     * MSH-11 processing id (P, T or D)
     */
    private String processingId = "P";

    private String segmentTerminator = "\r";

    /**
     * Chance that an optional segment or group is included
     */
    private double optionalSegmentProbability = 0.6;

    /**
     * Chance that an optional field is populated at all
     */
    private double optionalFieldProbability = 0.3;

    /**
     * Whether generated messages are parsed back with HAPI before being returned
     */
    private boolean verifyOutput = true;
}
