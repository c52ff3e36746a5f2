package org.kidoni.mathexpr;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line front end.
 * <pre>
 *  mathexpr simplify &lt;expression&gt; &lt;params&gt;
 *  mathexpr derive &lt;expression&gt; &lt;params&gt; [wrt]
 *  mathexpr apply &lt;characteristic&gt; &lt;expression&gt; &lt;params&gt;
 *  mathexpr eval &lt;expression&gt; &lt;params&gt; &lt;values&gt;
 * </pre>
 * Parameters and values are comma separated, e.g. {@code mathexpr derive "x*x*t + 3*x*t*t" x,t t}.
 */
public class MathExpr {
    private static final Logger LOG = LoggerFactory.getLogger(MathExpr.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(final String[] args, final PrintStream out, final PrintStream err) {
        if (args.length == 0) {
            return usage(err, "missing command");
        }

        LOG.debug("running {}", Arrays.toString(args));
        try {
            switch (args[0]) {
                case "simplify" -> {
                    if (args.length != 3) {
                        return usage(err, "simplify takes an expression and its parameters");
                    }
                    out.println(parse(args[1], args[2]).simplify());
                }
                case "derive" -> {
                    if (args.length != 3 && args.length != 4) {
                        return usage(err, "derive takes an expression, its parameters and optionally a parameter name");
                    }
                    Function f = parse(args[1], args[2]);
                    out.println(args.length == 3 ? f.derive() : f.derive(args[3]));
                }
                case "apply" -> {
                    if (args.length != 4) {
                        return usage(err, "apply takes a characteristic, an expression and their parameters");
                    }
                    DifferentialOperator operator = DifferentialOperator.of(parse(args[1], args[3]));
                    out.println(operator.apply(parse(args[2], args[3])));
                }
                case "eval" -> {
                    if (args.length != 4) {
                        return usage(err, "eval takes an expression, its parameters and their values");
                    }
                    Function f = parse(args[1], args[2]);
                    out.println(f.evaluate(values(args[3])));
                }
                default -> {
                    return usage(err, "unknown command: " + args[0]);
                }
            }
        }
        catch (ParseException | MathExpressionException e) {
            LOG.warn("{} failed: {}", args[0], e.getMessage());
            err.println(e.getMessage());
            return FAILED;
        }
        catch (NumberFormatException e) {
            return usage(err, "not a number: " + e.getMessage());
        }

        return OK;
    }

    private static Function parse(final String source, final String parameters) {
        return new Parser(source, names(parameters)).parse();
    }

    private static List<String> names(final String list) {
        if (list.isBlank()) {
            return List.of();
        }
        return Arrays.stream(list.split(","))
                .map(String::trim)
                .toList();
    }

    private static double[] values(final String list) {
        return names(list).stream()
                .mapToDouble(Double::parseDouble)
                .toArray();
    }

    private static int usage(final PrintStream err, final String message) {
        err.println(message);
        err.println("usage: mathexpr simplify|derive|apply|eval <expression> <params> ...");
        return USAGE;
    }
}
