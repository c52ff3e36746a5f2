package org.kidoni.mathexpr;

import java.util.List;
import java.util.stream.Collectors;

import static org.kidoni.mathexpr.MathExpressionException.requirePresent;

/**
 * Expression tree node.
 * <p>
 * Nodes are immutable; every rewrite builds new nodes. The binary arithmetic operators live in {@link Op}.
 */
public sealed interface Expr permits Expr.ConstExpr, Expr.VarExpr, Expr.NegExpr, Expr.CallExpr, Op {
    record ConstExpr(double value) implements Expr {
        /**
         * Integral values print without a fraction. Infinities and NaN print as the quotients that produce them,
         * {@code (1 / 0)}, {@code (-1 / 0)} and {@code (0 / 0)}, so the text stays parseable.
         */
        @Override
        public String toString() {
            if (Double.isNaN(value)) {
                return "(0 / 0)";
            }
            if (Double.isInfinite(value)) {
                return value > 0 ? "(1 / 0)" : "(-1 / 0)";
            }
            if (value == Math.rint(value) && Math.abs(value) < 1e15) {
                return String.valueOf((long) value);
            }
            return String.valueOf(value);
        }
    }

    record VarExpr(String name) implements Expr {
        public VarExpr {
            requirePresent(name, "variable name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record NegExpr(Expr operand) implements Expr {
        public NegExpr {
            requirePresent(operand, "operand");
        }

        @Override
        public String toString() {
            return "-" + operand;
        }
    }

    record CallExpr(MathFunction function, List<Expr> arguments) implements Expr {
        public CallExpr {
            requirePresent(function, "function");
            requirePresent(arguments, "arguments");
            arguments.forEach(argument -> requirePresent(argument, "argument"));
            if (arguments.size() != function.arity()) {
                throw new MathExpressionException(MathExpressionException.Kind.UNSUPPORTED_FUNCTION,
                        function.label() + " takes " + function.arity() + " argument(s), got " + arguments.size());
            }
            arguments = List.copyOf(arguments);
        }

        public CallExpr(MathFunction function, Expr... arguments) {
            this(function, List.of(arguments));
        }

        @Override
        public String toString() {
            return arguments.stream()
                    .map(Expr::toString)
                    .collect(Collectors.joining(", ", function.label() + "(", ")"));
        }
    }
}
