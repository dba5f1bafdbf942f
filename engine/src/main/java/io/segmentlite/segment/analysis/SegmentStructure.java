package io.segmentlite.segment.analysis;

import io.segmentlite.segment.model.Scope;

import java.util.Map;

/**
 * Shape of a segment's container tree.
 *
 * @param totalContainers   Containers at every level
 * @param rootContainers    Containers directly under the segment
 * @param maxNestingLevel   Deepest level, 0 when only root containers exist
 * @param totalConditions   Conditions across every container
 * @param excludeContainers Containers with the exclude sign
 * @param containersByScope Container count per scope, every scope present
 */
public record SegmentStructure(
        int totalContainers,
        int rootContainers,
        int maxNestingLevel,
        int totalConditions,
        int excludeContainers,
        Map<Scope, Integer> containersByScope) {

    public SegmentStructure {
        containersByScope = Map.copyOf(containersByScope);
    }

    public int containersOf(Scope scope) {
        return containersByScope.getOrDefault(scope, 0);
    }
}
