package io.segmentlite.engine.plan;

import io.segmentlite.engine.store.SqlDataType;

import java.util.Objects;

/**
 * {@code CAST(expression AS targetType)}.
 */
public record CastExpression(
        Expression expression,
        SqlDataType targetType
) implements Expression {

    public CastExpression {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(targetType, "Target type cannot be null");
    }

    public static CastExpression toText(Expression expression) {
        return new CastExpression(expression, SqlDataType.VARCHAR);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitCast(this);
    }

    @Override
    public String toString() {
        return "CAST(" + expression + " AS " + targetType + ")";
    }
}
