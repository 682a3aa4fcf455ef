package com.al.hl7generator.service.resolver;

/**
 * One link of the field resolver chain. Resolvers are asked in descending
 * priority; the first non-null value wins.
 */
public interface FieldValueResolver {

    int getPriority();

    boolean canHandle(FieldResolutionContext context);

    /**
     * @return the value, or null to let lower priority resolvers try
     */
    String resolve(FieldResolutionContext context);
}
