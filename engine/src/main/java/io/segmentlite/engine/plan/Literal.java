package io.segmentlite.engine.plan;

import java.util.Objects;

/**
 * Represents a constant chosen by the engine itself (the empty string of an existence
 * test, the {@code 1 = 0} of an empty segment). Values typed by an analyst never become
 * literals; they travel as {@link Parameter}s.
 *
 * @param value       The literal value (can be null)
 * @param literalType The type of the literal
 */
public record Literal(
        Object value,
        LiteralType literalType) implements Expression {

    public enum LiteralType {
        STRING,
        INTEGER,
        DOUBLE,
        BOOLEAN,
        NULL
    }

    public Literal {
        Objects.requireNonNull(literalType, "Literal type cannot be null");

        if (value != null) {
            switch (literalType) {
                case STRING -> {
                    if (!(value instanceof String)) {
                        throw new IllegalArgumentException("STRING literal must have String value");
                    }
                }
                case INTEGER, DOUBLE -> {
                    if (!(value instanceof Number)) {
                        throw new IllegalArgumentException(literalType + " literal must have Number value");
                    }
                }
                case BOOLEAN -> {
                    if (!(value instanceof Boolean)) {
                        throw new IllegalArgumentException("BOOLEAN literal must have Boolean value");
                    }
                }
                case NULL -> throw new IllegalArgumentException("NULL literal cannot have a value");
            }
        }
    }

    public static Literal string(String value) {
        return new Literal(value, LiteralType.STRING);
    }

    public static Literal integer(long value) {
        return new Literal(value, LiteralType.INTEGER);
    }

    public static Literal decimal(double value) {
        return new Literal(value, LiteralType.DOUBLE);
    }

    public static Literal bool(boolean value) {
        return new Literal(value, LiteralType.BOOLEAN);
    }

    public static Literal nullValue() {
        return new Literal(null, LiteralType.NULL);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        if (literalType == LiteralType.NULL) {
            return "NULL";
        }
        if (literalType == LiteralType.STRING) {
            return "'" + value + "'";
        }
        return String.valueOf(value);
    }
}
