package io.segmentlite.engine.plan;

import java.util.Objects;

/**
 * Represents a set-membership test against a subquery.
 *
 * Used to lift a predicate from the row grain to a coarser grain. Instead of
 * correlating per row, the subquery collects every key whose rows satisfy the
 * predicate and the outer row is kept when its key is in that set.
 *
 * Example:
 * <pre>
 *   SELECT ... FROM hits AS h
 *   WHERE h.session_id IN (
 *       SELECT h1.session_id FROM hits AS h1
 *       WHERE LOWER(h1.page_type) = ?
 *   )
 * </pre>
 *
 * @param operand  The outer key
 * @param subquery The subquery producing the key set (single projected column)
 */
public record InSubqueryExpression(
        Expression operand,
        RelationNode subquery
) implements Expression {

    public InSubqueryExpression {
        Objects.requireNonNull(operand, "Operand cannot be null");
        Objects.requireNonNull(subquery, "Subquery cannot be null");
    }

    public static InSubqueryExpression of(Expression operand, RelationNode subquery) {
        return new InSubqueryExpression(operand, subquery);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitInSubquery(this);
    }

    @Override
    public String toString() {
        return operand + " IN (" + subquery + ")";
    }
}
