package com.al.hl7generator.service.composer;

/**
 * Importance tier of an optional composite component and the chance that
 * such a component is populated.
 */
public enum ComponentImportance {

    CRITICAL(0.95),
    IMPORTANT(0.50),
    OPTIONAL(0.20);

    private final double populationProbability;

    ComponentImportance(double populationProbability) {
        this.populationProbability = populationProbability;
    }

    public double getPopulationProbability() {
        return populationProbability;
    }
}
