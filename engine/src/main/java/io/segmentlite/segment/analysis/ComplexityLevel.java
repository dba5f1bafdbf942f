package io.segmentlite.segment.analysis;

/**
 * Coarse complexity bands over the complexity score.
 */
public enum ComplexityLevel {
    NONE("none", 0),
    SIMPLE("simple", 5),
    MODERATE("moderate", 15),
    COMPLEX("complex", 30),
    VERY_COMPLEX("very complex", Integer.MAX_VALUE);

    private final String label;
    private final int maxScore;

    ComplexityLevel(String label, int maxScore) {
        this.label = label;
        this.maxScore = maxScore;
    }

    public String label() {
        return label;
    }

    public static ComplexityLevel forScore(int score) {
        for (ComplexityLevel level : values()) {
            if (score <= level.maxScore) {
                return level;
            }
        }
        return VERY_COMPLEX;
    }
}
