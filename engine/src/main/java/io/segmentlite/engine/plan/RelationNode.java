package io.segmentlite.engine.plan;

/**
 * A relation in a query plan. Segment compilation, statistics and profiling build
 * trees of these nodes; {@link io.segmentlite.engine.transpiler.SQLGenerator} turns
 * a tree into one SELECT statement.
 */
public sealed interface RelationNode
        permits TableNode, JoinNode, SubqueryNode, FilterNode, ProjectNode, GroupByNode, SortNode, LimitNode {

    <T> T accept(RelationNodeVisitor<T> visitor);
}
