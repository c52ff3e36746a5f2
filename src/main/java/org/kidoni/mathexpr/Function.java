package org.kidoni.mathexpr;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

import static org.kidoni.mathexpr.MathExpressionException.requirePresent;

/**
 * An expression body together with the ordered names of its parameters, e.g. {@code (x, t) -> x * x * t}.
 * <p>
 * Instances are immutable; every operation returns a new function. Parameter names must be unique.
 */
public final class Function {
    private final List<String> parameters;
    private final Expr body;

    public static Function of(final List<String> parameters, final Expr body) {
        return new Function(parameters, body);
    }

    public static Function of(final Expr body, final String... parameters) {
        return new Function(List.of(parameters), body);
    }

    private Function(final List<String> parameters, final Expr body) {
        requirePresent(parameters, "parameters");
        requirePresent(body, "body");
        this.parameters = List.copyOf(parameters);
        if (new HashSet<>(this.parameters).size() != this.parameters.size()) {
            throw new MathExpressionException(MathExpressionException.Kind.ARITY_MISMATCH,
                    "duplicate parameter in " + parameters);
        }
        this.body = body;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public Expr getBody() {
        return body;
    }

    public Function simplify() {
        return Simplifier.simplify(this);
    }

    public Function derive() {
        return Derivation.derive(this);
    }

    public Function derive(final String parameter) {
        return Derivation.derive(this, parameter);
    }

    public Function plus(final Function other) {
        return Arithmetic.add(this, other);
    }

    public Function minus(final Function other) {
        return Arithmetic.sub(this, other);
    }

    public Function times(final double factor) {
        return Arithmetic.mul(factor, this);
    }

    public double evaluate(final double... arguments) {
        if (arguments.length != parameters.size()) {
            throw new MathExpressionException(MathExpressionException.Kind.ARITY_MISMATCH,
                    "expected " + parameters.size() + " argument(s), got " + arguments.length);
        }
        Map<String, Double> bindings = new HashMap<>();
        for (int i = 0; i < arguments.length; i++) {
            bindings.put(parameters.get(i), arguments[i]);
        }
        return Evaluator.evaluate(body, bindings);
    }

    public DoubleUnaryOperator asUnaryOperator() {
        if (parameters.size() != 1) {
            throw new MathExpressionException(MathExpressionException.Kind.ARITY_MISMATCH,
                    "a unary operator needs exactly one parameter, got " + parameters);
        }
        return x -> evaluate(x);
    }

    @Override
    public String toString() {
        return "(" + String.join(", ", parameters) + ") -> " + body;
    }
}
