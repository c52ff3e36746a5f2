package org.kidoni.mathexpr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.Character.isDigit;
import static java.lang.Character.isLetter;
import static java.lang.Character.isLetterOrDigit;
import static java.lang.Character.isWhitespace;

/**
 * Recursive descent parser for arithmetic expressions over a fixed list of parameters.
 * <p>
 * Grammar:
 * <pre>
 *  Expression: Term (('+' | '-') Term)*
 *  Term:       Unary (('*' | '/') Unary)*
 *  Unary:      ('-' | '+') Unary | Power
 *  Power:      Primary ('^' Unary)?
 *  Primary:    Number | Name | Name '(' Expression (',' Expression)* ')' | '(' Expression ')'
 *  Number:     '[0-9]'+ ('.' '[0-9]'*)? ([eE] [+-]? '[0-9]'+)?
 *  Name:       '[A-Za-z_]' '[A-Za-z0-9_]'*
 * </pre>
 * {@code a ^ b} is {@code pow(a, b)}; a negated number is a negative constant. Unknown names, unknown functions
 * and wrong argument counts are collected and reported together; a syntax error ends the scan.
 */
public class Parser {
    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final String source;
    private final List<String> parameters;
    private final List<String> problems = new ArrayList<>();
    private int position;

    public static Function parse(final String source, final String... parameters) {
        return new Parser(source, parameters == null ? null : Arrays.asList(parameters)).parse();
    }

    /**
     * A missing source or parameter list is reported by {@link #parse()} like any other problem.
     */
    public Parser(final String source, final List<String> parameters) {
        this.source = source;
        this.parameters = parameters == null ? null : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public Function parse() {
        position = 0;
        problems.clear();
        if (parameters == null) {
            problems.add("missing parameter list");
        }
        else {
            checkParameters();
        }
        if (source == null) {
            problems.add("missing source");
        }

        Expr body = null;
        if (source != null && parameters != null) {
            try {
                body = parseExpression();
                skipWhitespace();
                if (position < source.length()) {
                    throw new ParseException("unexpected token '" + source.charAt(position) + "' at " + position);
                }
            }
            catch (ParseException e) {
                problems.addAll(e.getProblems());
            }
        }

        if (!problems.isEmpty()) {
            LOG.debug("rejected '{}' over {}: {}", source, parameters, problems);
            throw new ParseException(problems);
        }

        Function function = Function.of(parameters, body);
        LOG.debug("parsed '{}' into {}", source, function);
        return function;
    }

    private void checkParameters() {
        Set<String> seen = new HashSet<>();
        for (String parameter : parameters) {
            if (parameter == null) {
                problems.add("missing parameter name");
            }
            else if (!isName(parameter)) {
                problems.add("invalid parameter name '" + parameter + "'");
            }
            else if (!seen.add(parameter)) {
                problems.add("duplicate parameter '" + parameter + "'");
            }
        }
    }

    private Expr parseExpression() {
        Expr left = parseTerm();
        while (true) {
            char op = peekOperator();
            if (op == '+') {
                position++;
                left = new Op.AddOp(left, parseTerm());
            }
            else if (op == '-') {
                position++;
                left = new Op.SubOp(left, parseTerm());
            }
            else {
                return left;
            }
        }
    }

    private Expr parseTerm() {
        Expr left = parseUnary();
        while (true) {
            char op = peekOperator();
            if (op == '*') {
                position++;
                left = new Op.MulOp(left, parseUnary());
            }
            else if (op == '/') {
                position++;
                left = new Op.DivOp(left, parseUnary());
            }
            else {
                return left;
            }
        }
    }

    private Expr parseUnary() {
        skipWhitespace();
        checkEndOfInput();

        char token = source.charAt(position);
        if (token == '-') {
            position++;
            Expr operand = parseUnary();
            if (operand instanceof Expr.ConstExpr constant) {
                return new Expr.ConstExpr(-constant.value());
            }
            return new Expr.NegExpr(operand);
        }
        if (token == '+') {
            position++;
            return parseUnary();
        }
        return parsePower(parsePrimary());
    }

    private Expr parsePower(final Expr base) {
        if (peekOperator() == '^') {
            position++;
            return new Expr.CallExpr(MathFunction.POW, base, parseUnary());
        }
        return base;
    }

    private Expr parsePrimary() {
        skipWhitespace();
        checkEndOfInput();

        char token = source.charAt(position);
        if (isNumberStart(token)) {
            return readConstant();
        }
        if (token == '(') {
            position++;
            Expr inner = parseExpression();
            expect(')');
            return inner;
        }
        if (isLetter(token) || token == '_') {
            int start = position;
            String name = readName();
            if (peekOperator() == '(') {
                position++;
                return parseCall(name, start);
            }
            return variable(name, start);
        }

        throw new ParseException("unexpected token '" + token + "' at " + position);
    }

    private Expr parseCall(final String name, final int start) {
        List<Expr> arguments = new ArrayList<>();
        if (peekOperator() != ')') {
            arguments.add(parseExpression());
            while (peekOperator() == ',') {
                position++;
                arguments.add(parseExpression());
            }
        }
        expect(')');

        Optional<MathFunction> function = MathFunction.lookup(name);
        if (function.isEmpty()) {
            problems.add("unknown function '" + name + "' at " + start);
            return new Expr.ConstExpr(Double.NaN);
        }
        if (function.get().arity() != arguments.size()) {
            problems.add(name + " takes " + function.get().arity() + " argument(s), got " + arguments.size()
                    + " at " + start);
            return new Expr.ConstExpr(Double.NaN);
        }
        return new Expr.CallExpr(function.get(), arguments);
    }

    private Expr variable(final String name, final int start) {
        if (!parameters.contains(name)) {
            problems.add("unknown name '" + name + "' at " + start);
        }
        return new Expr.VarExpr(name);
    }

    private Expr.ConstExpr readConstant() {
        int start = position;
        readDigits();
        if (position < source.length() && source.charAt(position) == '.') {
            position++;
            readDigits();
        }
        if (position < source.length() && (source.charAt(position) == 'e' || source.charAt(position) == 'E')) {
            int mark = position;
            position++;
            if (position < source.length() && (source.charAt(position) == '+' || source.charAt(position) == '-')) {
                position++;
            }
            if (position < source.length() && isDigit(source.charAt(position))) {
                readDigits();
            }
            else {
                position = mark;
            }
        }

        String text = source.substring(start, position);
        try {
            return new Expr.ConstExpr(Double.parseDouble(text));
        }
        catch (NumberFormatException e) {
            throw new ParseException("malformed number '" + text + "' at " + start);
        }
    }

    private void readDigits() {
        while (position < source.length() && isDigit(source.charAt(position))) {
            position++;
        }
    }

    private String readName() {
        int start = position;
        while (position < source.length() && (isLetterOrDigit(source.charAt(position)) || source.charAt(position) == '_')) {
            position++;
        }
        return source.substring(start, position);
    }

    private void expect(final char expected) {
        skipWhitespace();
        checkEndOfInput();
        if (source.charAt(position) != expected) {
            throw new ParseException("expected '" + expected + "' but found '" + source.charAt(position) + "' at " + position);
        }
        position++;
    }

    private char peekOperator() {
        skipWhitespace();
        return position < source.length() ? source.charAt(position) : 0;
    }

    private void skipWhitespace() {
        while (position < source.length() && isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    private void checkEndOfInput() {
        if (position >= source.length()) {
            throw new ParseException("unexpected end of input");
        }
    }

    private static boolean isNumberStart(final char token) {
        return isDigit(token) || token == '.';
    }

    private static boolean isName(final String name) {
        if (name.isEmpty() || !(isLetter(name.charAt(0)) || name.charAt(0) == '_')) {
            return false;
        }
        return name.chars().allMatch(c -> isLetterOrDigit(c) || c == '_');
    }
}
