package com.al.hl7generator;

import ca.uhn.hl7v2.DefaultHapiContext;
import ca.uhn.hl7v2.HapiContext;
import ca.uhn.hl7v2.model.Message;
import ca.uhn.hl7v2.util.Terser;
import ca.uhn.hl7v2.validation.impl.NoValidation;
import com.al.hl7generator.dto.CompositionResult;
import com.al.hl7generator.dto.GenerateMessageRequest;
import com.al.hl7generator.interceptor.MdcInterceptor;
import com.al.hl7generator.model.clinical.ClinicalBundle;
import com.al.hl7generator.model.clinical.Patient;
import com.al.hl7generator.model.clinical.PersonName;
import com.al.hl7generator.service.MessageGenerationService;
import com.al.hl7generator.service.composer.GenerationOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
public class MessageGenerationIntegrationTest {

    @Autowired
    private MessageGenerationService generationService;

    @Autowired
    private MockMvc mockMvc;

    private HapiContext hapiContext;

    @BeforeEach
    public void setup() {
        hapiContext = new DefaultHapiContext();
        hapiContext.setValidationContext(new NoValidation());
    }

    @AfterEach
    public void tearDown() throws IOException {
        hapiContext.close();
    }

    private CompositionResult generate(String messageType, ClinicalBundle bundle) {
        return generate(messageType, bundle, GenerationOptions.builder().seed(7L).build());
    }

    private CompositionResult generate(String messageType, ClinicalBundle bundle, GenerationOptions options) {
        return generationService.generate(GenerateMessageRequest.builder()
                .messageType(messageType)
                .bundle(bundle)
                .options(options)
                .build());
    }

    @Test
    public void testAdtA01ParsesWithVersionStructures() throws Exception {
        ClinicalBundle bundle = ClinicalBundle.builder()
                .patient(Patient.builder()
                        .mrn("MRN123")
                        .name(PersonName.builder().family("Doe").given("Jane").build())
                        .gender("F")
                        .build())
                .build();

        GenerationOptions options = GenerationOptions.builder().seed(7L).build();
        options.getLockedValues().put("PID.8", "F");

        CompositionResult result = generate("ADT^A01", bundle, options);

        assertTrue(result.isSuccess());
        assertFalse(result.hasIssues(), () -> "Unexpected issues: " + result.getIssues());

        Message message = hapiContext.getPipeParser().parse(result.getMessage());
        assertEquals("ADT_A01", message.getName());

        Terser terser = new Terser(message);
        assertEquals("ADT", terser.get("/MSH-9-1"));
        assertEquals("A01", terser.get("/MSH-9-2"));
        assertEquals("2.3", terser.get("/MSH-12"));
        assertEquals("Doe", terser.get("/PID-5-1"));
        assertEquals("Jane", terser.get("/PID-5-2"));
        assertEquals("F", terser.get("/PID-8"));
        assertNotNull(terser.get("/EVN-2"));
    }

    @Test
    public void testOruR01Parses() throws Exception {
        CompositionResult result = generate("ORU^R01", null);

        assertTrue(result.isSuccess());
        Message message = hapiContext.getPipeParser().parse(result.getMessage());
        assertEquals("ORU_R01", message.getName());
        assertTrue(result.getMessage().contains("\rOBR|"));
    }

    @Test
    public void testRdeO01Parses() throws Exception {
        CompositionResult result = generate("RDE_O01", null);

        assertTrue(result.isSuccess());
        assertEquals("RDE^O01", result.getMessageType());
        Message message = hapiContext.getPipeParser().parse(result.getMessage());
        assertEquals("RDE_O01", message.getName());
    }

    @Test
    public void testGenerateOverHttp() throws Exception {
        mockMvc.perform(post("/api/v1/messages/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .header(MdcInterceptor.HEADER_KEY, "it-1")
                .content("{\"messageType\":\"ADT^A08\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string(MdcInterceptor.HEADER_KEY, "it-1"))
                .andExpect(header().exists("X-Segment-Count"));
    }

    @Test
    public void testUnknownTypeOverHttp() throws Exception {
        mockMvc.perform(post("/api/v1/messages/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"messageType\":\"ZZZ^Z99\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    public void testTriggerEventsOverHttp() throws Exception {
        mockMvc.perform(get("/api/v1/messages/trigger-events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@ == 'adt_a01')]").exists());
    }
}
