package io.segmentlite.engine.plan;

import java.util.Objects;

/**
 * An aggregate used by population counts and field profiling:
 * {@code COUNT(*)}, {@code COUNT(DISTINCT key)}, and MIN/MAX/AVG over a numeric column.
 */
public record AggregateExpression(AggregateFunction function, Expression argument) implements Expression {

    public enum AggregateFunction {
        COUNT_ALL,
        COUNT_DISTINCT,
        MIN,
        MAX,
        AVG;

        /** SQL function name; both count variants render as COUNT. */
        public String sql() {
            return name().startsWith("COUNT") ? "COUNT" : name();
        }
    }

    public AggregateExpression {
        Objects.requireNonNull(function, "Aggregate function cannot be null");
        if ((function == AggregateFunction.COUNT_ALL) != (argument == null)) {
            throw new IllegalArgumentException(function == AggregateFunction.COUNT_ALL
                    ? "COUNT(*) takes no argument"
                    : function + " needs an argument");
        }
    }

    public static AggregateExpression countAll() {
        return new AggregateExpression(AggregateFunction.COUNT_ALL, null);
    }

    public static AggregateExpression countDistinct(Expression argument) {
        return new AggregateExpression(AggregateFunction.COUNT_DISTINCT, argument);
    }

    public static AggregateExpression of(AggregateFunction function, Expression argument) {
        return new AggregateExpression(function, argument);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitAggregate(this);
    }
}
