package org.kidoni.mathexpr;

import java.util.Arrays;
import java.util.Optional;

/**
 * The functions an expression may call. Anything else is rejected by the parser.
 */
public enum MathFunction {
    SIN("sin", 1),
    COS("cos", 1),
    TAN("tan", 1),
    EXP("exp", 1),
    LOG("log", 1),
    POW("pow", 2);

    private final String label;
    private final int arity;

    MathFunction(final String label, final int arity) {
        this.label = label;
        this.arity = arity;
    }

    public String label() {
        return label;
    }

    public int arity() {
        return arity;
    }

    public static Optional<MathFunction> lookup(final String name) {
        return Arrays.stream(values())
                .filter(function -> function.label.equals(name))
                .findFirst();
    }
}
