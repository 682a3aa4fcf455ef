package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.clinical.Patient;
import com.al.hl7generator.service.composer.GenerationContext;
import org.springframework.stereotype.Component;

/**
 * Telephone numbers and email addresses. The components of one XTN field
 * share a single number so area code and local number agree.
 */
@Component
public class ContactFieldResolver implements FieldValueResolver {

    static final int PRIORITY = 74;

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(FieldResolutionContext context) {
        if (context.getField().hasTable()) {
            return false;
        }
        return "XTN".equals(context.getParentDataType()) || "TN".equals(context.getDataType());
    }

    @Override
    public String resolve(FieldResolutionContext context) {
        String text = context.getSemanticText();
        GenerationContext generation = context.getGenerationContext();

        if (text.contains("email")) {
            return email(context);
        }
        if (text.contains("country code")) {
            return "1";
        }
        if (text.contains("extension")) {
            return null;
        }

        String digits = phoneDigits(context);
        if (text.contains("area")) {
            return digits.substring(0, 3);
        }
        if (text.contains("telephone number") || "TN".equals(context.getDataType())) {
            Patient patient = generation.getPatient();
            if (isPatientPhone(context) && patient != null && patient.getPhoneNumber() != null) {
                return patient.getPhoneNumber();
            }
            return "(" + digits.substring(0, 3) + ")" + digits.substring(3, 6) + "-" + digits.substring(6);
        }
        if (text.contains("phone number")) {
            return digits.substring(3);
        }
        return null;
    }

    private String phoneDigits(FieldResolutionContext context) {
        GenerationContext generation = context.getGenerationContext();
        String key = "phone:" + context.getFieldPath() + "#" + context.getSegmentOccurrence();
        return generation.remember(key, () -> generation.nextInt(201, 989) + "555" + generation.digits(4));
    }

    private String email(FieldResolutionContext context) {
        GenerationContext generation = context.getGenerationContext();
        Patient patient = generation.getPatient();
        if (isPatientPhone(context) && patient != null) {
            if (patient.getEmail() != null) {
                return patient.getEmail();
            }
            if (patient.getName() != null && patient.getName().getFamily() != null) {
                return patient.getName().getFamily().toLowerCase() + generation.digits(3) + "@example.com";
            }
        }
        return "contact" + generation.digits(4) + "@example.com";
    }

    private static boolean isPatientPhone(FieldResolutionContext context) {
        return "PID".equals(context.getSegmentCode()) && context.getFieldPosition() == 13;
    }
}
