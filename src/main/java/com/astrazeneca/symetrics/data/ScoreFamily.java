package com.astrazeneca.symetrics.data;

import com.astrazeneca.symetrics.exception.InvalidGroupException;

/**
 * Families of per-variant scores. Each family is stored in exactly one table of one of the two stores.
 */
public enum ScoreFamily {
    CONSERVATION(Store.SCORES),
    SURFACE_ACCESSIBILITY(Store.SCORES),
    SYNONYMOUS_PATHOGENICITY(Store.SCORES),
    SPLICE_EFFECT(Store.SCORES),
    POPULATION_FREQUENCY(Store.POPULATION);

    /**
     * Table stores known by the configuration.
     */
    public enum Store {
        SCORES,
        POPULATION
    }

    private final Store store;

    ScoreFamily(Store store) {
        this.store = store;
    }

    public Store getStore() {
        return store;
    }

    /**
     * Finds the family by its enum name, ignoring case and treating '-' as '_'.
     * @param name family name, e.g. SPLICE_EFFECT or splice-effect
     * @return score family
     * @throws InvalidGroupException if there is no such family
     */
    public static ScoreFamily fromName(String name) {
        if (name != null) {
            String normalized = name.trim().replace('-', '_');
            for (ScoreFamily family : values()) {
                if (family.name().equalsIgnoreCase(normalized)) {
                    return family;
                }
            }
        }
        throw new InvalidGroupException(name);
    }
}
