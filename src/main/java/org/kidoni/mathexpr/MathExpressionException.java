package org.kidoni.mathexpr;

/**
 * Raised by the engine when an input cannot be differentiated, simplified or evaluated.
 */
public class MathExpressionException extends RuntimeException {
    public enum Kind {
        NULL_INPUT,
        ARITY_MISMATCH,
        UNSUPPORTED_CONSTRUCT,
        UNSUPPORTED_FUNCTION,
        UNBOUND_VARIABLE
    }

    private final Kind kind;

    public MathExpressionException(final Kind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    static <T> T requirePresent(final T value, final String what) {
        if (value == null) {
            throw new MathExpressionException(Kind.NULL_INPUT, what + " must be non-null");
        }
        return value;
    }
}
