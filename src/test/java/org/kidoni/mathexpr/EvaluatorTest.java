package org.kidoni.mathexpr;

import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EvaluatorTest {
    @Test
    void evaluatesArithmetic() {
        assertEquals(22.0, Parser.parse("2+5*4").evaluate());
        assertEquals(-1.5, Parser.parse("-x / 2", "x").evaluate(3.0));
        assertEquals(6.0, Parser.parse("x*x*t + 3*x*t*t - t", "x", "t").evaluate(1.0, 1.0));
    }

    @Test
    void evaluatesFunctions() {
        assertEquals(1.0, Parser.parse("sin(x)^2 + cos(x)^2", "x").evaluate(0.0));
        assertEquals(8.0, Parser.parse("pow(2, 3)").evaluate());
        assertEquals(Math.E, Parser.parse("exp(log(exp(1)))").evaluate(), 1e-15);
        assertEquals(Math.tan(0.3), Parser.parse("tan(x)", "x").evaluate(0.3));
    }

    @Test
    void bindsByName() {
        final var e = Parser.parse("a - b", "a", "b").getBody();
        assertEquals(-1.0, Evaluator.evaluate(e, Map.of("a", 1.0, "b", 2.0)));
    }

    @Test
    void unboundVariable() {
        final var e = assertThrows(MathExpressionException.class,
                () -> Evaluator.evaluate(new Expr.VarExpr("q"), Map.of()));
        assertEquals(MathExpressionException.Kind.UNBOUND_VARIABLE, e.getKind());
    }

    @Test
    void argumentCountMustMatch() {
        final var f = Parser.parse("x * y", "x", "y");
        assertEquals(MathExpressionException.Kind.ARITY_MISMATCH,
                assertThrows(MathExpressionException.class, () -> f.evaluate(1.0)).getKind());
        assertEquals(MathExpressionException.Kind.ARITY_MISMATCH,
                assertThrows(MathExpressionException.class, f::asUnaryOperator).getKind());
        assertEquals(9.0, Parser.parse("x * x", "x").asUnaryOperator().applyAsDouble(3.0));
    }
}
