package io.segmentlite.engine.plan;

import java.util.Locale;
import java.util.Objects;

/**
 * A one-argument scalar function. Case-insensitive matching wraps text columns in {@code LOWER}.
 */
public record SqlFunctionCall(String functionName, Expression argument) implements Expression {

    public SqlFunctionCall {
        Objects.requireNonNull(functionName, "Function name cannot be null");
        Objects.requireNonNull(argument, "Function argument cannot be null");
        functionName = functionName.toUpperCase(Locale.ROOT);
    }

    public static SqlFunctionCall lower(Expression argument) {
        return new SqlFunctionCall("LOWER", argument);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return functionName + "(" + argument + ")";
    }
}
