package org.kidoni.mathexpr;

import java.util.List;

/**
 * The source text is not a valid expression over the given parameters. The message starts with
 * {@value #PREFIX} followed by one line per problem found.
 */
public class ParseException extends RuntimeException {
    public static final String PREFIX = "Parsing failed: ";

    private final List<String> problems;

    public ParseException(final List<String> problems) {
        super(PREFIX + String.join("\n", problems));
        this.problems = List.copyOf(problems);
    }

    public ParseException(final String problem) {
        this(List.of(problem));
    }

    public List<String> getProblems() {
        return problems;
    }
}
