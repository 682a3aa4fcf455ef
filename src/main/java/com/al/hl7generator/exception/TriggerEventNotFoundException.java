package com.al.hl7generator.exception;

public class TriggerEventNotFoundException extends RuntimeException {

    private final String triggerEventCode;

    public TriggerEventNotFoundException(String triggerEventCode, String message) {
        super(message);
        this.triggerEventCode = triggerEventCode;
    }

    public String getTriggerEventCode() {
        return triggerEventCode;
    }
}
