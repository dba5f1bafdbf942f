package io.segmentlite.engine.plan;

import java.util.Objects;

/**
 * A value bound at execution time. Rendered as a {@code ?} marker; the generator
 * collects the values in the order the markers appear in the SQL text.
 *
 * @param value A String or a Number
 */
public record Parameter(Object value) implements Expression {

    public Parameter {
        Objects.requireNonNull(value, "Parameter value cannot be null");
        if (!(value instanceof String) && !(value instanceof Number)) {
            throw new IllegalArgumentException(
                    "Parameter must be a String or a Number, got " + value.getClass().getSimpleName());
        }
    }

    public static Parameter of(String value) {
        return new Parameter(value);
    }

    public static Parameter of(double value) {
        return new Parameter(value);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitParameter(this);
    }

    @Override
    public String toString() {
        return "?(" + value + ")";
    }
}
