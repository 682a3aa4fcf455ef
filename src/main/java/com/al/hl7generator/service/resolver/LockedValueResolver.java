package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.schema.DataTypeDefinition;
import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Returns caller pinned values. Highest priority in both chains.
 */
@Component
public class LockedValueResolver implements FieldValueResolver, CompositeAwareResolver {

    static final int PRIORITY = 100;

    private final LockedValueLookup lookup;

    @Autowired
    public LockedValueResolver(LockedValueLookup lookup) {
        this.lookup = lookup;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(FieldResolutionContext context) {
        return lookup.find(context.getOptions(), context.getComponentPath()).isPresent();
    }

    @Override
    public String resolve(FieldResolutionContext context) {
        return lookup.find(context.getOptions(), context.getComponentPath()).orElse(null);
    }

    @Override
    public boolean canHandleComposite(String dataTypeCode) {
        return true;
    }

    /**
     * A value locked for the whole field is split on the component separator.
     */
    @Override
    public Optional<Map<Integer, String>> resolveComposite(SegmentFieldDefinition field, DataTypeDefinition dataType,
            FieldResolutionContext context) {
        return lookup.find(context.getOptions(), context.getFieldPath()).map(value -> {
            Map<Integer, String> components = new LinkedHashMap<>();
            String[] parts = value.split("\\^", -1);
            for (int i = 0; i < parts.length; i++) {
                components.put(i + 1, parts[i]);
            }
            return components;
        });
    }
}
