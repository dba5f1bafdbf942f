package io.segmentlite.engine.plan;

/**
 * A scalar or boolean expression inside a query plan.
 *
 * Includes:
 * - ColumnReference: reference to a column of an aliased table
 * - Literal: constant value rendered inline (only engine-chosen constants)
 * - Parameter: author-supplied value rendered as a bind marker
 * - ComparisonExpression / LikeExpression / BetweenExpression: predicates
 * - LogicalExpression: boolean operators (AND, OR, NOT)
 * - InSubqueryExpression: set membership against a subquery
 */
public sealed interface Expression
        permits ColumnReference, Literal, Parameter, ComparisonExpression, LogicalExpression,
        LikeExpression, BetweenExpression, InSubqueryExpression, SqlFunctionCall, CastExpression,
        AggregateExpression {

    <T> T accept(ExpressionVisitor<T> visitor);
}
