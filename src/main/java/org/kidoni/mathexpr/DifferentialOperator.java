package org.kidoni.mathexpr;

import static org.kidoni.mathexpr.MathExpressionException.requirePresent;

/**
 * A linear differential operator described by its characteristic expression: a variable {@code x} stands for
 * {@code ∂/∂x}, a constant for a scalar multiple, {@code +} and {@code -} for the sum and difference of operators
 * and {@code *} for their composition. The Laplacian in two dimensions is
 * <pre>
 *  DifferentialOperator dx = DifferentialOperator.partial("x");
 *  DifferentialOperator dy = DifferentialOperator.partial("y");
 *  DifferentialOperator laplacian = dx.compose(dx).sum(dy.compose(dy));
 * </pre>
 * or, from its characteristic polynomial, {@code DifferentialOperator.of(Parser.parse("x*x + y*y", "x", "y"))}.
 * <p>
 * Combining operators only builds a new characteristic; nothing is differentiated until {@link #apply(Function)}.
 */
public final class DifferentialOperator {
    private final Expr characteristic;

    public static DifferentialOperator partial(final String parameter) {
        return new DifferentialOperator(new Expr.VarExpr(parameter));
    }

    public static DifferentialOperator scalar(final double factor) {
        return new DifferentialOperator(new Expr.ConstExpr(factor));
    }

    public static DifferentialOperator of(final Function characteristic) {
        requirePresent(characteristic, "characteristic");
        return new DifferentialOperator(characteristic.getBody());
    }

    private DifferentialOperator(final Expr characteristic) {
        this.characteristic = requirePresent(characteristic, "characteristic");
    }

    public Expr getCharacteristic() {
        return characteristic;
    }

    public DifferentialOperator sum(final DifferentialOperator other) {
        requirePresent(other, "operator");
        return new DifferentialOperator(new Op.AddOp(characteristic, other.characteristic));
    }

    public DifferentialOperator difference(final DifferentialOperator other) {
        requirePresent(other, "operator");
        return new DifferentialOperator(new Op.SubOp(characteristic, other.characteristic));
    }

    /**
     * {@code this} after {@code other}: {@code other} is applied first.
     */
    public DifferentialOperator compose(final DifferentialOperator other) {
        requirePresent(other, "operator");
        return new DifferentialOperator(new Op.MulOp(characteristic, other.characteristic));
    }

    public Function apply(final Function target) {
        return apply(characteristic, target);
    }

    public static Function apply(final Expr characteristic, final Function target) {
        requirePresent(characteristic, "characteristic");
        requirePresent(target, "function");

        if (characteristic instanceof Expr.ConstExpr constant) {
            return Arithmetic.mul(constant.value(), target);
        }
        if (characteristic instanceof Expr.VarExpr var) {
            return Simplifier.simplify(Derivation.derive(target, var.name()));
        }
        if (characteristic instanceof Op.AddOp add) {
            return Arithmetic.add(apply(add.left(), target), apply(add.right(), target));
        }
        if (characteristic instanceof Op.SubOp sub) {
            return Arithmetic.sub(apply(sub.left(), target), apply(sub.right(), target));
        }
        if (characteristic instanceof Op.MulOp mul) {
            return apply(mul.left(), apply(mul.right(), target));
        }

        throw new MathExpressionException(MathExpressionException.Kind.UNSUPPORTED_CONSTRUCT,
                "not a differential operator: " + characteristic);
    }

    @Override
    public String toString() {
        return "D[" + characteristic + "]";
    }
}
