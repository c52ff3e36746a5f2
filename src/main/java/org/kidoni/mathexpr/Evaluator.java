package org.kidoni.mathexpr;

import java.util.Map;

import static org.kidoni.mathexpr.MathExpressionException.requirePresent;

/**
 * Tree-walking numeric evaluation of an expression.
 */
public final class Evaluator {
    private Evaluator() {
    }

    public static double evaluate(final Expr e, final Map<String, Double> bindings) {
        requirePresent(e, "expression");
        requirePresent(bindings, "bindings");

        if (e instanceof Expr.ConstExpr constant) {
            return constant.value();
        }
        if (e instanceof Expr.VarExpr var) {
            Double value = bindings.get(var.name());
            if (value == null) {
                throw new MathExpressionException(MathExpressionException.Kind.UNBOUND_VARIABLE,
                        "no value for " + var.name());
            }
            return value;
        }
        if (e instanceof Expr.NegExpr neg) {
            return -evaluate(neg.operand(), bindings);
        }
        if (e instanceof Op.AddOp add) {
            return evaluate(add.left(), bindings) + evaluate(add.right(), bindings);
        }
        if (e instanceof Op.SubOp sub) {
            return evaluate(sub.left(), bindings) - evaluate(sub.right(), bindings);
        }
        if (e instanceof Op.MulOp mul) {
            return evaluate(mul.left(), bindings) * evaluate(mul.right(), bindings);
        }
        if (e instanceof Op.DivOp div) {
            return evaluate(div.left(), bindings) / evaluate(div.right(), bindings);
        }
        if (e instanceof Expr.CallExpr call) {
            double x = evaluate(call.arguments().get(0), bindings);
            return switch (call.function()) {
                case SIN -> Math.sin(x);
                case COS -> Math.cos(x);
                case TAN -> Math.tan(x);
                case EXP -> Math.exp(x);
                case LOG -> Math.log(x);
                case POW -> Math.pow(x, evaluate(call.arguments().get(1), bindings));
            };
        }

        throw new MathExpressionException(MathExpressionException.Kind.UNSUPPORTED_CONSTRUCT,
                "cannot evaluate " + e.getClass().getSimpleName());
    }
}
