package io.segmentlite.engine.plan;

/**
 * Double dispatch over the relation node kinds.
 */
public interface RelationNodeVisitor<T> {

    T visit(TableNode table);

    T visit(JoinNode join);

    T visit(SubqueryNode subquery);

    T visit(FilterNode filter);

    T visit(ProjectNode project);

    T visit(GroupByNode groupBy);

    T visit(SortNode sort);

    T visit(LimitNode limit);
}
