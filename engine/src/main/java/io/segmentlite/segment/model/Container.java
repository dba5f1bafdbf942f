package io.segmentlite.segment.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A scoped, signed boolean group of conditions and nested containers.
 *
 * Null scope, sign or combinator are tolerated while authoring and read as
 * HIT, INCLUDE and AND. The lists are never null.
 *
 * @param scope      Grain at which the group must hold
 * @param sign       Whether the group's predicate is negated
 * @param combinator Joins conditions and children
 * @param conditions Leaf predicates, in order
 * @param children   Nested containers, in order
 */
public record Container(
        Scope scope,
        Sign sign,
        Combinator combinator,
        List<Condition> conditions,
        List<Container> children) {

    public Container {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * An empty include container combining with AND.
     */
    public static Container of(Scope scope) {
        return new Container(scope, Sign.INCLUDE, Combinator.AND, List.of(), List.of());
    }

    public static Container hit(Condition... conditions) {
        return of(Scope.HIT).withConditions(List.of(conditions));
    }

    public static Container visit(Condition... conditions) {
        return of(Scope.VISIT).withConditions(List.of(conditions));
    }

    public static Container visitor(Condition... conditions) {
        return of(Scope.VISITOR).withConditions(List.of(conditions));
    }

    public Scope effectiveScope() {
        return scope == null ? Scope.HIT : scope;
    }

    public Sign effectiveSign() {
        return sign == null ? Sign.INCLUDE : sign;
    }

    public Combinator effectiveCombinator() {
        return combinator == null ? Combinator.AND : combinator;
    }

    public Container withScope(Scope scope) {
        return new Container(scope, sign, combinator, conditions, children);
    }

    public Container withSign(Sign sign) {
        return new Container(scope, sign, combinator, conditions, children);
    }

    public Container excluded() {
        return withSign(Sign.EXCLUDE);
    }

    public Container included() {
        return withSign(Sign.INCLUDE);
    }

    public Container withCombinator(Combinator combinator) {
        return new Container(scope, sign, combinator, conditions, children);
    }

    public Container withConditions(List<Condition> conditions) {
        return new Container(scope, sign, combinator, conditions, children);
    }

    public Container withChildren(List<Container> children) {
        return new Container(scope, sign, combinator, conditions, children);
    }

    public Container addCondition(Condition condition) {
        List<Condition> updated = new ArrayList<>(conditions);
        updated.add(condition);
        return withConditions(updated);
    }

    public Container addChild(Container child) {
        List<Container> updated = new ArrayList<>(children);
        updated.add(child);
        return withChildren(updated);
    }

    public Container replaceCondition(int index, Condition condition) {
        List<Condition> updated = new ArrayList<>(conditions);
        updated.set(index, condition);
        return withConditions(updated);
    }

    public Container removeCondition(int index) {
        List<Condition> updated = new ArrayList<>(conditions);
        updated.remove(index);
        return withConditions(updated);
    }

    public Container replaceChild(int index, Container child) {
        List<Container> updated = new ArrayList<>(children);
        updated.set(index, child);
        return withChildren(updated);
    }

    public Container removeChild(int index) {
        List<Container> updated = new ArrayList<>(children);
        updated.remove(index);
        return withChildren(updated);
    }

    public boolean isEmpty() {
        return conditions.isEmpty() && children.isEmpty();
    }
}
