package org.kidoni.mathexpr;

import static org.kidoni.mathexpr.MathExpressionException.requirePresent;

/**
 * Symbolic differentiation.
 * <p>
 * Derivatives are built with {@link Arithmetic} so trivial terms vanish as they are produced; the
 * {@link Function} overloads additionally simplify the body before and after differentiating.
 */
public final class Derivation {
    private static final Expr ZERO = new Expr.ConstExpr(0.0);
    private static final Expr ONE = new Expr.ConstExpr(1.0);

    private Derivation() {
    }

    /**
     * Total derivative of a function of one variable.
     */
    public static Function derive(final Function f) {
        requirePresent(f, "function");
        if (f.getParameters().size() != 1) {
            throw new MathExpressionException(MathExpressionException.Kind.ARITY_MISMATCH,
                    "total derivative needs exactly one parameter, got " + f.getParameters());
        }
        return derive(f, f.getParameters().get(0));
    }

    /**
     * Partial derivative with respect to {@code parameter}; zero when the function has no such parameter.
     */
    public static Function derive(final Function f, final String parameter) {
        requirePresent(f, "function");
        requirePresent(parameter, "parameter");
        if (!f.getParameters().contains(parameter)) {
            return Function.of(f.getParameters(), ZERO);
        }

        Expr body = Simplifier.simplify(f.getBody());
        return Function.of(f.getParameters(), Simplifier.simplify(derive(body, parameter)));
    }

    /**
     * Partial derivative of {@code e} with respect to {@code parameter}. Variables with any other name are
     * constants.
     */
    public static Expr derive(final Expr e, final String parameter) {
        requirePresent(e, "expression");
        requirePresent(parameter, "parameter");

        if (e instanceof Expr.ConstExpr) {
            return ZERO;
        }
        if (e instanceof Expr.VarExpr var) {
            return var.name().equals(parameter) ? ONE : ZERO;
        }
        if (e instanceof Expr.NegExpr neg) {
            return Arithmetic.negate(derive(neg.operand(), parameter));
        }
        if (e instanceof Op.AddOp add) {
            return Arithmetic.add(derive(add.left(), parameter), derive(add.right(), parameter));
        }
        if (e instanceof Op.SubOp sub) {
            return Arithmetic.sub(derive(sub.left(), parameter), derive(sub.right(), parameter));
        }
        if (e instanceof Op.MulOp mul) {
            Expr left = mul.left();
            Expr right = mul.right();
            return Arithmetic.add(
                    Arithmetic.mul(left, derive(right, parameter)),
                    Arithmetic.mul(derive(left, parameter), right));
        }
        if (e instanceof Op.DivOp div) {
            Expr left = div.left();
            Expr right = div.right();
            return Arithmetic.div(
                    Arithmetic.sub(
                            Arithmetic.mul(derive(left, parameter), right),
                            Arithmetic.mul(left, derive(right, parameter))),
                    Arithmetic.mul(right, right));
        }
        if (e instanceof Expr.CallExpr call) {
            return derive(call, parameter);
        }

        throw new MathExpressionException(MathExpressionException.Kind.UNSUPPORTED_CONSTRUCT,
                "cannot differentiate " + e.getClass().getSimpleName());
    }

    private static Expr derive(final Expr.CallExpr call, final String parameter) {
        Expr x = call.arguments().get(0);
        Expr d = Simplifier.simplify(derive(x, parameter));

        return switch (call.function()) {
            case SIN -> Arithmetic.mul(d, new Expr.CallExpr(MathFunction.COS, x));
            case COS -> Arithmetic.mul(d, Arithmetic.negate(new Expr.CallExpr(MathFunction.SIN, x)));
            case TAN -> Arithmetic.div(d,
                    new Op.MulOp(new Expr.CallExpr(MathFunction.COS, x), new Expr.CallExpr(MathFunction.COS, x)));
            case EXP -> Arithmetic.mul(d, call);
            case LOG -> Arithmetic.div(d, x);
            case POW -> derivePower(call, d, parameter);
        };
    }

    private static Expr derivePower(final Expr.CallExpr call, final Expr dBase, final String parameter) {
        Expr base = call.arguments().get(0);
        Expr exponent = call.arguments().get(1);
        Expr dExponent = Simplifier.simplify(derive(exponent, parameter));

        // a^f(x) where a does not depend on x
        if (Identity.isZero(dBase)) {
            return Arithmetic.mul(
                    Arithmetic.mul(new Expr.CallExpr(MathFunction.LOG, base), dExponent),
                    call);
        }
        // f(x)^a where a does not depend on x
        if (Identity.isZero(dExponent)) {
            return Arithmetic.mul(
                    Arithmetic.mul(exponent, dBase),
                    new Expr.CallExpr(MathFunction.POW, base, Arithmetic.sub(exponent, ONE)));
        }

        throw new MathExpressionException(MathExpressionException.Kind.UNSUPPORTED_FUNCTION,
                "cannot differentiate " + call + ": base and exponent both depend on " + parameter);
    }
}
