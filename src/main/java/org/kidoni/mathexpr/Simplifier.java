package org.kidoni.mathexpr;

import java.util.ArrayList;
import java.util.List;

import static org.kidoni.mathexpr.MathExpressionException.requirePresent;

/**
 * Algebraic simplification.
 * <p>
 * Sums are normalized by <em>cancelling</em> like terms: {@code 4 * x + y - 2 * x -> 2 * x + y}.
 * Products and quotients are normalized by <em>reducing</em> them to a single fraction with the constants
 * folded and common factors removed: {@code 2 * x * 3 / x -> 6}. The folded constant always stays outside the
 * fraction, so {@code 2 / x} is {@code 2 * (1 / x)}.
 * <p>
 * Like terms and common factors are found with {@link Identity#identical(Expr, Expr)}, so expressions that only
 * differ by re-association may be left unmerged.
 */
public final class Simplifier {
    private Simplifier() {
    }

    public static Function simplify(final Function f) {
        requirePresent(f, "function");
        return Function.of(f.getParameters(), simplify(f.getBody()));
    }

    public static Expr simplify(final Expr e) {
        requirePresent(e, "expression");

        if (e instanceof Op.AddOp || e instanceof Op.SubOp || e instanceof Expr.NegExpr) {
            return cancel(e);
        }
        if (e instanceof Op.MulOp || e instanceof Op.DivOp) {
            return reduce(e);
        }
        if (e instanceof Expr.CallExpr call) {
            List<Expr> arguments = new ArrayList<>();
            for (Expr argument : call.arguments()) {
                arguments.add(simplify(argument));
            }
            return new Expr.CallExpr(call.function(), arguments);
        }
        return e;
    }

    static Expr cancel(final Expr e) {
        List<Term> terms = new ArrayList<>();
        deconstructSum(e, false, terms);
        return constructSum(terms);
    }

    static Expr reduce(final Expr e) {
        return foldConstants(e).toExpression();
    }

    /**
     * Folds the constant factors of a product or quotient into one coefficient, e.g.
     * {@code 2 * x * 3 * x * 4 -> {24, x * x}}.
     */
    static Term foldConstants(final Expr e) {
        List<Expr> numerator = new ArrayList<>();
        List<Expr> denominator = new ArrayList<>();
        deconstructProduct(e, numerator, denominator);
        return constructProduct(numerator, denominator);
    }

    // 4 * x + y - 2 * x -> [{2, x}, {1, y}]
    private static void deconstructSum(final Expr e, final boolean minus, final List<Term> terms) {
        if (e instanceof Expr.NegExpr neg) {
            deconstructSum(neg.operand(), !minus, terms);
            return;
        }
        if (e instanceof Op.AddOp add) {
            deconstructSum(add.left(), minus, terms);
            deconstructSum(add.right(), minus, terms);
            return;
        }
        if (e instanceof Op.SubOp sub) {
            deconstructSum(sub.left(), minus, terms);
            deconstructSum(sub.right(), !minus, terms);
            return;
        }

        Term t = foldConstants(e);
        // 1 * (a + b) contributes a and b
        if (t.coefficient() == 1 && (t.body() instanceof Op.AddOp || t.body() instanceof Op.SubOp)) {
            deconstructSum(t.body(), minus, terms);
            return;
        }
        if (minus) {
            t.negate();
        }

        for (Term existing : terms) {
            if (Identity.identical(t.body(), existing.body())) {
                existing.add(t.coefficient());
                return;
            }
        }
        terms.add(t);
    }

    private static Expr constructSum(final List<Term> terms) {
        Expr sum = new Expr.ConstExpr(0.0);
        for (Term term : terms) {
            sum = Arithmetic.add(sum, term.toExpression());
        }
        return sum;
    }

    // x / a * y * z / b / c -> numerator [x, y, z], denominator [a, b, c]
    private static void deconstructProduct(final Expr e, final List<Expr> numerator, final List<Expr> denominator) {
        if (e instanceof Op.MulOp mul) {
            deconstructProduct(mul.left(), numerator, denominator);
            deconstructProduct(mul.right(), numerator, denominator);
            return;
        }
        if (e instanceof Op.DivOp div) {
            deconstructProduct(div.left(), numerator, denominator);
            deconstructProduct(div.right(), denominator, numerator);
            return;
        }

        // a simplified factor can itself be a product, e.g. x + x -> 2 * x
        addFactors(simplify(e), numerator, denominator);
    }

    private static void addFactors(final Expr e, final List<Expr> numerator, final List<Expr> denominator) {
        if (e instanceof Op.MulOp mul) {
            addFactors(mul.left(), numerator, denominator);
            addFactors(mul.right(), numerator, denominator);
        }
        else if (e instanceof Op.DivOp div) {
            addFactors(div.left(), numerator, denominator);
            addFactors(div.right(), denominator, numerator);
        }
        else {
            numerator.add(e);
        }
    }

    // [x, y, z] -> x * y * z
    private static Term constructProduct(final List<Expr> factors) {
        double c = 1;
        Expr product = null;
        for (Expr factor : factors) {
            if (factor == null) {
                continue;
            }

            if (factor instanceof Expr.ConstExpr constant) {
                c *= constant.value();
            }
            else if (product == null) {
                product = factor;
            }
            else {
                product = new Op.MulOp(product, factor);
            }
        }
        return new Term(c, product);
    }

    // numerator [x, y, z], denominator [a, b, c] -> (x * y * z) / (a * b * c)
    private static Term constructProduct(final List<Expr> numerator, final List<Expr> denominator) {
        double c = 1;

        for (int i = 0; i < numerator.size(); i++) {
            if (numerator.get(i) == null) {
                continue;
            }

            if (numerator.get(i) instanceof Expr.ConstExpr constant) {
                c *= constant.value();
                numerator.set(i, null);
            }

            for (int j = 0; j < denominator.size(); j++) {
                if (denominator.get(j) == null) {
                    continue;
                }

                if (denominator.get(j) instanceof Expr.ConstExpr constant) {
                    c /= constant.value();
                    denominator.set(j, null);
                }

                // common factor
                if (numerator.get(i) != null && Identity.identical(numerator.get(i), denominator.get(j))) {
                    numerator.set(i, null);
                    denominator.set(j, null);
                }
            }
        }

        Term n = constructProduct(numerator);
        Term d = constructProduct(denominator);
        n.scale(c);

        return divide(n, d);
    }

    private static Term divide(final Term t1, final Term t2) {
        double c1 = t1.coefficient();
        double c2 = t2.coefficient();
        Expr b1 = t1.body();
        Expr b2 = t2.body();

        if (c1 == 0) {
            return new Term(0);
        }

        double c = c1 / c2;

        if (b1 == null) {
            if (b2 == null) {
                return new Term(c);
            }
            return new Term(c, new Op.DivOp(new Expr.ConstExpr(1.0), b2));
        }
        if (b2 == null) {
            return new Term(c, b1);
        }

        if (Identity.identical(b1, b2)) {
            return new Term(c);
        }

        return new Term(c, new Op.DivOp(b1, b2));
    }
}
