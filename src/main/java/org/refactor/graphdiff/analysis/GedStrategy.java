package org.refactor.graphdiff.analysis;

public enum GedStrategy {
    A_STAR("a_star"),
    BEAM("beam"),
    HYBRID("hybrid");

    private final String key;

    GedStrategy(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static GedStrategy fromKey(String key) {
        for (GedStrategy s : values()) {
            if (s.key.equalsIgnoreCase(key.trim())) {
                return s;
            }
        }
        throw new IllegalArgumentException("unknown GED strategy: " + key);
    }
}
