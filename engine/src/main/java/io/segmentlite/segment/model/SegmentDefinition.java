package io.segmentlite.segment.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The root of a segment: a name and an ordered list of containers.
 *
 * The definition owns its whole container tree by value, so copies are the records
 * themselves and equality is structural.
 *
 * @param name        Segment name
 * @param description Free text, may be null
 * @param rootScope   Scope given to containers created through {@link #newRootContainer()}
 * @param combinator  Joins the root containers; THEN combines like AND
 * @param containers  Root containers, in order
 */
public record SegmentDefinition(
        String name,
        String description,
        Scope rootScope,
        Combinator combinator,
        List<Container> containers) {

    /**
     * The name a freshly created segment carries until the analyst renames it.
     */
    public static final String DEFAULT_NAME = "New Segment";

    public SegmentDefinition {
        containers = containers == null ? List.of() : List.copyOf(containers);
    }

    /**
     * A new, empty segment as the builder starts it.
     */
    public static SegmentDefinition empty() {
        return named(DEFAULT_NAME);
    }

    public static SegmentDefinition named(String name) {
        return new SegmentDefinition(name, "", Scope.HIT, Combinator.AND, List.of());
    }

    public static SegmentDefinition of(String name, Container... containers) {
        return named(name).withContainers(List.of(containers));
    }

    public Scope effectiveRootScope() {
        return rootScope == null ? Scope.HIT : rootScope;
    }

    public Combinator effectiveCombinator() {
        return combinator == null ? Combinator.AND : combinator;
    }

    /**
     * @return An empty include container at the root scope; not yet added to this definition
     */
    public Container newRootContainer() {
        return Container.of(effectiveRootScope());
    }

    public SegmentDefinition withName(String name) {
        return new SegmentDefinition(name, description, rootScope, combinator, containers);
    }

    public SegmentDefinition withDescription(String description) {
        return new SegmentDefinition(name, description, rootScope, combinator, containers);
    }

    public SegmentDefinition withRootScope(Scope rootScope) {
        return new SegmentDefinition(name, description, rootScope, combinator, containers);
    }

    public SegmentDefinition withCombinator(Combinator combinator) {
        return new SegmentDefinition(name, description, rootScope, combinator, containers);
    }

    public SegmentDefinition withContainers(List<Container> containers) {
        return new SegmentDefinition(name, description, rootScope, combinator, containers);
    }

    public SegmentDefinition addContainer(Container container) {
        List<Container> updated = new ArrayList<>(containers);
        updated.add(container);
        return withContainers(updated);
    }

    public SegmentDefinition replaceContainer(int index, Container container) {
        List<Container> updated = new ArrayList<>(containers);
        updated.set(index, container);
        return withContainers(updated);
    }

    public SegmentDefinition removeContainer(int index) {
        List<Container> updated = new ArrayList<>(containers);
        updated.remove(index);
        return withContainers(updated);
    }
}
