package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.schema.DataTypeDefinition;
import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Priority ordered chain of field resolvers. Sorted once at construction.
 */
@Component
@Slf4j
public class FieldValueResolverChain {

    private final List<FieldValueResolver> resolvers;
    private final List<CompositeAwareResolver> compositeResolvers;

    @Autowired
    public FieldValueResolverChain(List<FieldValueResolver> resolvers,
            List<CompositeAwareResolver> compositeResolvers) {
        List<FieldValueResolver> sorted = new ArrayList<>(resolvers);
        sorted.sort(Comparator.comparingInt(FieldValueResolver::getPriority).reversed());
        this.resolvers = Collections.unmodifiableList(sorted);

        List<CompositeAwareResolver> sortedComposite = new ArrayList<>(compositeResolvers);
        sortedComposite.sort(Comparator.comparingInt(CompositeAwareResolver::getPriority).reversed());
        this.compositeResolvers = Collections.unmodifiableList(sortedComposite);

        log.info("Initialized resolver chain with {} field resolvers and {} composite resolvers",
                this.resolvers.size(), this.compositeResolvers.size());
    }

    /**
     * @return the first non-null value offered by a capable resolver, or an
     *         empty string when none produces one
     */
    public String resolve(FieldResolutionContext context) {
        for (FieldValueResolver resolver : resolvers) {
            if (!resolver.canHandle(context)) {
                continue;
            }
            String value = resolver.resolve(context);
            if (value != null) {
                log.trace("{} resolved by {}", context.getComponentPath(), resolver.getClass().getSimpleName());
                return value;
            }
        }
        return "";
    }

    public Optional<Map<Integer, String>> resolveComposite(SegmentFieldDefinition field, DataTypeDefinition dataType,
            FieldResolutionContext context) {
        for (CompositeAwareResolver resolver : compositeResolvers) {
            if (!resolver.canHandleComposite(dataType.getCode())) {
                continue;
            }
            Optional<Map<Integer, String>> components = resolver.resolveComposite(field, dataType, context);
            if (components.isPresent()) {
                log.trace("{} composed by {}", context.getFieldPath(), resolver.getClass().getSimpleName());
                return components;
            }
        }
        return Optional.empty();
    }

    public List<FieldValueResolver> getResolvers() {
        return resolvers;
    }

    public List<CompositeAwareResolver> getCompositeResolvers() {
        return compositeResolvers;
    }
}
