package com.simplexsolver;

import java.time.Duration;

/**
 * Turns flag-style options into a {@link SolverConfig}, so a front end can pass its
 * command-line settings straight through.
 *
 * <pre>
 *   -tolerance 1e-9   -pivottol 1e-7   -iterations N   -nodes N
 *   -timelimit SECONDS   -bland-after N
 * </pre>
 */
public final class OptionsParser {

    private OptionsParser() {}

    public static SolverConfig parse(String[] args) {
        SolverConfig.Builder b = SolverConfig.builder();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-tolerance": b.tolerance(parseDouble(a, value(args, ++i, a))); break;
                case "-pivottol": b.pivotTolerance(parseDouble(a, value(args, ++i, a))); break;
                case "-iterations": b.iterationLimit(parseLong(a, value(args, ++i, a))); break;
                case "-nodes": b.nodeLimit(parseLong(a, value(args, ++i, a))); break;
                case "-bland-after": b.degenerateSwitch((int) parseLong(a, value(args, ++i, a))); break;
                case "-timelimit": {
                    double secs = parseDouble(a, value(args, ++i, a));
                    b.timeLimit(Duration.ofNanos((long) (secs * 1_000_000_000L)));
                    break;
                }
                default:
                    throw new IllegalArgumentException("Unknown option: " + a);
            }
        }
        return b.build();
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + flag);
        return args[i];
    }

    private static double parseDouble(String flag, String s) {
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad number for " + flag + ": " + s, e);
        }
    }

    private static long parseLong(String flag, String s) {
        try {
            return Long.parseLong(s.trim().replace("_", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad integer for " + flag + ": " + s, e);
        }
    }
}
