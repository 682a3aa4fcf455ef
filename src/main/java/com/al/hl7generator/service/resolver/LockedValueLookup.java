package com.al.hl7generator.service.resolver;

import com.al.hl7generator.service.composer.GenerationOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Finds caller pinned values for a field or component path.
 */
@Component
@Slf4j
public class LockedValueLookup {

    public Optional<String> find(GenerationOptions options, String path) {
        if (options == null || options.getLockedValues() == null || options.getLockedValues().isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<String, String> entry : options.getLockedValues().entrySet()) {
            String fieldPath = SemanticPathMap.toFieldPath(entry.getKey());
            if (fieldPath == null) {
                log.debug("Ignoring unknown locked value key '{}'", entry.getKey());
                continue;
            }
            if (fieldPath.equals(path) && entry.getValue() != null) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * True when the field itself or any of its components is pinned.
     */
    public boolean isLocked(GenerationOptions options, String fieldPath) {
        if (options == null || options.getLockedValues() == null) {
            return false;
        }
        for (String key : options.getLockedValues().keySet()) {
            String path = SemanticPathMap.toFieldPath(key);
            if (path != null && (path.equals(fieldPath) || path.startsWith(fieldPath + "."))) {
                return true;
            }
        }
        return false;
    }
}
