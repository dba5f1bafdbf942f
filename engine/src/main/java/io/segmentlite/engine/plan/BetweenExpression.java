package io.segmentlite.engine.plan;

import java.util.Objects;

/**
 * Inclusive range test: {@code operand BETWEEN lower AND upper}.
 */
public record BetweenExpression(
        Expression operand,
        Expression lower,
        Expression upper
) implements Expression {

    public BetweenExpression {
        Objects.requireNonNull(operand, "Operand cannot be null");
        Objects.requireNonNull(lower, "Lower bound cannot be null");
        Objects.requireNonNull(upper, "Upper bound cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitBetween(this);
    }

    @Override
    public String toString() {
        return operand + " BETWEEN " + lower + " AND " + upper;
    }
}
