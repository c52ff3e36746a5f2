package org.kidoni.mathexpr;

import java.util.List;

/**
 * Structural equality of expression trees.
 * <p>
 * Addition and multiplication are matched with one level of operand swap only, so
 * {@code 3 - 2 * x} is identical to {@code 3 - x * 2}, but {@code x + 1 + y} is <em>not</em> identical to
 * {@code y + 1 + x}: the trees would have to be re-associated first.
 */
public final class Identity {
    private static final Expr ZERO = new Expr.ConstExpr(0.0);

    private Identity() {
    }

    public static boolean identical(final Expr e1, final Expr e2) {
        if (e1 == null) {
            return e2 == null;
        }
        if (e2 == null || e1.getClass() != e2.getClass()) {
            return false;
        }

        if (e1 instanceof Expr.ConstExpr c1) {
            double v1 = c1.value();
            double v2 = ((Expr.ConstExpr) e2).value();
            return v1 == v2 || (Double.isNaN(v1) && Double.isNaN(v2));
        }
        if (e1 instanceof Expr.VarExpr v1) {
            return v1.name().equals(((Expr.VarExpr) e2).name());
        }
        if (e1 instanceof Expr.NegExpr n1) {
            return identical(n1.operand(), ((Expr.NegExpr) e2).operand());
        }
        if (e1 instanceof Op.AddOp || e1 instanceof Op.MulOp) {
            Op o1 = (Op) e1;
            Op o2 = (Op) e2;
            return (identical(o1.left(), o2.left()) && identical(o1.right(), o2.right()))
                    || (identical(o1.left(), o2.right()) && identical(o1.right(), o2.left()));
        }
        if (e1 instanceof Op o1) {
            Op o2 = (Op) e2;
            return identical(o1.left(), o2.left()) && identical(o1.right(), o2.right());
        }
        if (e1 instanceof Expr.CallExpr call1) {
            Expr.CallExpr call2 = (Expr.CallExpr) e2;
            return call1.function() == call2.function() && identical(call1.arguments(), call2.arguments());
        }
        return false;
    }

    public static boolean identical(final Function f1, final Function f2) {
        if (f1 == null) {
            return f2 == null;
        }
        return f2 != null
                && f1.getParameters().equals(f2.getParameters())
                && identical(f1.getBody(), f2.getBody());
    }

    public static boolean isZero(final Expr e) {
        return identical(e, ZERO);
    }

    private static boolean identical(final List<Expr> arguments1, final List<Expr> arguments2) {
        if (arguments1.size() != arguments2.size()) {
            return false;
        }
        for (int i = 0; i < arguments1.size(); i++) {
            if (!identical(arguments1.get(i), arguments2.get(i))) {
                return false;
            }
        }
        return true;
    }
}
