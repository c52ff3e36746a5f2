package org.kidoni.mathexpr;

import static org.kidoni.mathexpr.MathExpressionException.requirePresent;

/**
 * Arithmetic that simplifies while it builds: {@code x + 0 -> x}, {@code 2 + 3 -> 5}, {@code x - x -> 0},
 * {@code 2 * x + 3 * x -> 5 * x}, {@code x * 3 * x * 2 -> 6 * x * x} and so on.
 */
public final class Arithmetic {
    private Arithmetic() {
    }

    public static Function add(final Function f1, final Function f2) {
        requireSameParameters(f1, f2);
        return Function.of(f1.getParameters(), add(f1.getBody(), f2.getBody()));
    }

    public static Function sub(final Function f1, final Function f2) {
        requireSameParameters(f1, f2);
        return Function.of(f1.getParameters(), sub(f1.getBody(), f2.getBody()));
    }

    public static Function mul(final double factor, final Function f) {
        requirePresent(f, "function");
        return Function.of(f.getParameters(), mul(new Expr.ConstExpr(factor), f.getBody()));
    }

    static Expr negate(final Expr e) {
        if (e instanceof Expr.ConstExpr c) {
            return new Expr.ConstExpr(-c.value());
        }
        if (e instanceof Expr.NegExpr n) {
            return n.operand();
        }

        Term t = Simplifier.foldConstants(e);
        t.negate();
        return t.toExpression();
    }

    static Expr add(final Expr e1, final Expr e2) {
        if (e1 instanceof Expr.ConstExpr c1) {
            if (c1.value() == 0) {
                return e2;
            }
            if (e2 instanceof Expr.ConstExpr c2) {
                return new Expr.ConstExpr(c1.value() + c2.value());
            }
        }
        if (e2 instanceof Expr.ConstExpr c2 && c2.value() == 0) {
            return e1;
        }

        // x + x -> 2 * x
        if (Identity.identical(e1, e2)) {
            return mul(new Expr.ConstExpr(2.0), e1);
        }

        // a * x + b * x -> (a + b) * x
        Term t1 = Simplifier.foldConstants(e1);
        Term t2 = Simplifier.foldConstants(e2);
        if (Identity.identical(t1.body(), t2.body())) {
            return new Term(t1.coefficient() + t2.coefficient(), t1.body()).toExpression();
        }

        return new Op.AddOp(t1.toExpression(), t2.toExpression());
    }

    static Expr sub(final Expr e1, final Expr e2) {
        if (e1 instanceof Expr.ConstExpr c1) {
            if (c1.value() == 0) {
                return negate(e2);
            }
            if (e2 instanceof Expr.ConstExpr c2) {
                return new Expr.ConstExpr(c1.value() - c2.value());
            }
        }
        if (e2 instanceof Expr.ConstExpr c2 && c2.value() == 0) {
            return e1;
        }

        if (Identity.identical(e1, e2)) {
            return new Expr.ConstExpr(0.0);
        }

        // a * x - b * x -> (a - b) * x
        Term t1 = Simplifier.foldConstants(e1);
        Term t2 = Simplifier.foldConstants(e2);
        if (Identity.identical(t1.body(), t2.body())) {
            return new Term(t1.coefficient() - t2.coefficient(), t1.body()).toExpression();
        }

        return new Op.SubOp(t1.toExpression(), t2.toExpression());
    }

    static Expr mul(final Expr e1, final Expr e2) {
        return Simplifier.foldConstants(new Op.MulOp(e1, e2)).toExpression();
    }

    static Expr div(final Expr e1, final Expr e2) {
        return Simplifier.foldConstants(new Op.DivOp(e1, e2)).toExpression();
    }

    private static void requireSameParameters(final Function f1, final Function f2) {
        requirePresent(f1, "function");
        requirePresent(f2, "function");
        if (!f1.getParameters().equals(f2.getParameters())) {
            throw new MathExpressionException(MathExpressionException.Kind.ARITY_MISMATCH,
                    "parameters differ: " + f1.getParameters() + " and " + f2.getParameters());
        }
    }
}
