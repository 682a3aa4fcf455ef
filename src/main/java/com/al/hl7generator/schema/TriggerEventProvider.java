package com.al.hl7generator.schema;

import com.al.hl7generator.model.schema.TriggerEventDefinition;

import java.util.List;
import java.util.Optional;

public interface TriggerEventProvider {

    /**
     * @param code normalized trigger event code, e.g. {@code adt_a01}
     */
    Optional<TriggerEventDefinition> getTriggerEvent(String code);

    List<String> getAvailableTriggerEvents();
}
