package org.kidoni.mathexpr;

/**
 * A product {@code coefficient * body} with every constant factor folded into the coefficient.
 * A missing body means the term is just the coefficient: {@code 2 * x * 3 * y} is {@code {6, x * y}}.
 */
final class Term {
    private double coefficient;
    private final Expr body;

    Term(final double coefficient) {
        this(coefficient, null);
    }

    Term(final double coefficient, final Expr body) {
        this.coefficient = coefficient;
        this.body = body;
    }

    double coefficient() {
        return coefficient;
    }

    Expr body() {
        return body;
    }

    void scale(final double factor) {
        coefficient *= factor;
    }

    void negate() {
        coefficient = -coefficient;
    }

    void add(final double value) {
        coefficient += value;
    }

    Expr toExpression() {
        if (coefficient == 0) {
            return new Expr.ConstExpr(0.0);
        }
        if (body == null) {
            return new Expr.ConstExpr(coefficient);
        }
        if (coefficient == 1) {
            return body;
        }
        return new Op.MulOp(new Expr.ConstExpr(coefficient), body);
    }

    @Override
    public String toString() {
        return "{" + coefficient + ", " + body + "}";
    }
}
