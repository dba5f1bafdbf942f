package io.segmentlite.segment.analysis;

import java.util.List;

/**
 * @param score   Weighted complexity score
 * @param level   Band the score falls in
 * @param details What contributed to the score, in the order it was counted
 */
public record SegmentComplexity(int score, ComplexityLevel level, List<String> details) {

    public SegmentComplexity {
        details = List.copyOf(details);
    }

    public String summary() {
        return String.join("; ", details);
    }
}
