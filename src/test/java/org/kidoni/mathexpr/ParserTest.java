package org.kidoni.mathexpr;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParserTest {
    @Test
    void parseEmpty() {
        final var e = assertThrows(ParseException.class, () -> Parser.parse(""));
        assertEquals(List.of("unexpected end of input"), e.getProblems());
        assertTrue(e.getMessage().startsWith(ParseException.PREFIX));
    }

    @Test
    void parseSimpleAdditionExpression() {
        var function = Parser.parse("123+456");
        assertInstanceOf(Op.AddOp.class, function.getBody());
        assertEquals("(123 + 456)", function.getBody().toString());

        function = Parser.parse(" 123  +  456 ");
        assertInstanceOf(Op.AddOp.class, function.getBody());
        assertEquals("(123 + 456)", function.getBody().toString());
    }

    @Test
    void parseSimpleSubtractionExpression() {
        final var function = Parser.parse(" x  -  1 ", "x");
        assertInstanceOf(Op.SubOp.class, function.getBody());
        assertEquals("(x - 1)", function.getBody().toString());
    }

    @Test
    void parseSimpleMultiplicationExpression() {
        final var function = Parser.parse("x*y", "x", "y");
        assertInstanceOf(Op.MulOp.class, function.getBody());
        assertEquals("(x * y)", function.getBody().toString());
        assertEquals(List.of("x", "y"), function.getParameters());
    }

    @Test
    void parseSimpleDivisionExpression() {
        final var function = Parser.parse("1/x", "x");
        assertInstanceOf(Op.DivOp.class, function.getBody());
        assertEquals("(1 / x)", function.getBody().toString());
    }

    @Test
    void precedenceAndAssociativity() {
        assertEquals("((1 + (2 * 3)) - 4)", Parser.parse("1 + 2 * 3 - 4").getBody().toString());
        assertEquals("((x / 2) / 3)", Parser.parse("x / 2 / 3", "x").getBody().toString());
        assertEquals("((1 + 2) * 3)", Parser.parse("(1 + 2) * 3").getBody().toString());
    }

    @Test
    void powerIsRightAssociativeAndBindsTighterThanNegation() {
        assertEquals("pow(x, pow(2, 3))", Parser.parse("x^2^3", "x").getBody().toString());
        assertEquals("-pow(x, 2)", Parser.parse("-x^2", "x").getBody().toString());
        assertEquals("(2 * pow(x, -1))", Parser.parse("2*x^-1", "x").getBody().toString());
    }

    @Test
    void negatedNumberIsConstant() {
        final var body = Parser.parse("-2 * x", "x").getBody();
        assertInstanceOf(Op.MulOp.class, body);
        assertEquals(new Expr.ConstExpr(-2.0), ((Op.MulOp) body).left());

        assertEquals("(-x * -x)", Parser.parse("-x * -x", "x").getBody().toString());
    }

    @Test
    void numbers() {
        assertEquals(new Expr.ConstExpr(1.5e-3), Parser.parse("1.5e-3").getBody());
        assertEquals(new Expr.ConstExpr(0.25), Parser.parse(".25").getBody());
        assertEquals(new Expr.ConstExpr(12.0), Parser.parse("12.").getBody());
    }

    @Test
    void functionCalls() {
        final var body = Parser.parse("sin(x) + pow(x, 3) * exp(log(cos(tan(x))))", "x").getBody();
        assertEquals("(sin(x) + (pow(x, 3) * exp(log(cos(tan(x))))))", body.toString());

        final var call = assertInstanceOf(Expr.CallExpr.class, ((Op.AddOp) body).left());
        assertEquals(MathFunction.SIN, call.function());
        assertEquals(List.of(new Expr.VarExpr("x")), call.arguments());
    }

    @Test
    void renderedTextParsesBack() {
        final var function = Parser.parse("x*x*t + 3*x*t*t - -t / (2 + sin(x))^2", "x", "t");
        final var reparsed = Parser.parse(function.getBody().toString(), "x", "t");
        assertTrue(Identity.identical(function, reparsed));
    }

    @Test
    void nonFiniteConstantsParseBack() {
        assertEquals("(1 / 0)", new Expr.ConstExpr(Double.POSITIVE_INFINITY).toString());
        assertEquals("(-1 / 0)", new Expr.ConstExpr(Double.NEGATIVE_INFINITY).toString());
        assertEquals("(0 / 0)", new Expr.ConstExpr(Double.NaN).toString());

        final var simplified = Parser.parse("x / 0", "x").simplify().getBody();
        assertEquals("((1 / 0) * x)", simplified.toString());
        final var g = Parser.parse(simplified.toString(), "x");
        assertEquals(Double.POSITIVE_INFINITY, g.evaluate(2.0));
        assertEquals(Double.NEGATIVE_INFINITY, g.evaluate(-2.0));
    }

    @Test
    void reportsEveryProblem() {
        final var e = assertThrows(ParseException.class, () -> Parser.parse("y + foo(x) + pow(x) + z", "x"));
        assertEquals(List.of(
                "unknown name 'y' at 0",
                "unknown function 'foo' at 4",
                "pow takes 2 argument(s), got 1 at 13",
                "unknown name 'z' at 22"), e.getProblems());
        assertEquals(ParseException.PREFIX + String.join("\n", e.getProblems()), e.getMessage());
    }

    @Test
    void syntaxErrors() {
        assertEquals(List.of("unexpected end of input"),
                assertThrows(ParseException.class, () -> Parser.parse("1 +")).getProblems());
        assertEquals(List.of("expected ')' but found ',' at 6"),
                assertThrows(ParseException.class, () -> Parser.parse("(1 + 2, 3)")).getProblems());
        assertEquals(List.of("unexpected token 'x' at 1"),
                assertThrows(ParseException.class, () -> Parser.parse("2x", "x")).getProblems());
        assertEquals(List.of("unexpected token '*' at 0"),
                assertThrows(ParseException.class, () -> Parser.parse("* 2")).getProblems());
    }

    @Test
    void semanticProblemsAreKeptWhenSyntaxFails() {
        final var e = assertThrows(ParseException.class, () -> Parser.parse("y + (", "x"));
        assertEquals(List.of("unknown name 'y' at 0", "unexpected end of input"), e.getProblems());
    }

    @Test
    void parameterProblems() {
        final var e = assertThrows(ParseException.class, () -> Parser.parse("x", "x", "x", "1a"));
        assertEquals(List.of("duplicate parameter 'x'", "invalid parameter name '1a'"), e.getProblems());
    }

    @Test
    void missingInputIsAProblem() {
        assertEquals(List.of("missing parameter name"),
                assertThrows(ParseException.class, () -> Parser.parse("x", "x", null)).getProblems());
        assertEquals(List.of("missing source"),
                assertThrows(ParseException.class, () -> Parser.parse(null, "x")).getProblems());
        assertEquals(List.of("missing parameter list", "missing source"),
                assertThrows(ParseException.class, () -> new Parser(null, null).parse()).getProblems());
        assertEquals(List.of("missing parameter list"),
                assertThrows(ParseException.class, () -> Parser.parse("1", (String[]) null)).getProblems());
    }
}
