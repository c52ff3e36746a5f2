package org.kidoni.mathexpr;

import static org.kidoni.mathexpr.MathExpressionException.requirePresent;

/**
 * Binary arithmetic operators. Rendered fully parenthesized so the text parses back to the same tree.
 */
public sealed interface Op extends Expr {
    Expr left();

    Expr right();

    record AddOp(Expr left, Expr right) implements Op {
        public AddOp {
            requirePresent(left, "left operand");
            requirePresent(right, "right operand");
        }

        @Override
        public String toString() {
            return "(" + left + " + " + right + ")";
        }
    }

    record SubOp(Expr left, Expr right) implements Op {
        public SubOp {
            requirePresent(left, "left operand");
            requirePresent(right, "right operand");
        }

        @Override
        public String toString() {
            return "(" + left + " - " + right + ")";
        }
    }

    record MulOp(Expr left, Expr right) implements Op {
        public MulOp {
            requirePresent(left, "left operand");
            requirePresent(right, "right operand");
        }

        @Override
        public String toString() {
            return "(" + left + " * " + right + ")";
        }
    }

    record DivOp(Expr left, Expr right) implements Op {
        public DivOp {
            requirePresent(left, "left operand");
            requirePresent(right, "right operand");
        }

        @Override
        public String toString() {
            return "(" + left + " / " + right + ")";
        }
    }
}
