package org.pragmatica.expr.eval;

import java.util.Arrays;

/**
 * Common integer functions hosts can install into a registry.
 *
 * <p>None of them are available unless the host registers them, e.g.
 * {@code Expressions.evaluate("max(1, 2)", StandardFunctions.registry())}.
 */
public final class StandardFunctions {
    private static final FunctionRegistry REGISTRY = FunctionRegistry.builder()
                                                                     .function("max", StandardFunctions::max)
                                                                     .function("min", StandardFunctions::min)
                                                                     .function("abs", StandardFunctions::abs)
                                                                     .function("sign", StandardFunctions::sign)
                                                                     .function("pow", StandardFunctions::pow)
                                                                     .function("clamp", StandardFunctions::clamp)
                                                                     .build();

    private StandardFunctions() {}

    /**
     * Registry holding {@code max}, {@code min}, {@code abs}, {@code sign}, {@code pow} and {@code clamp}.
     */
    public static FunctionRegistry registry() {
        return REGISTRY;
    }

    public static long max(long... arguments) {
        requireAtLeastOne("max", arguments);
        return Arrays.stream(arguments).max().getAsLong();
    }

    public static long min(long... arguments) {
        requireAtLeastOne("min", arguments);
        return Arrays.stream(arguments).min().getAsLong();
    }

    public static long abs(long... arguments) {
        requireArity("abs", 1, arguments);
        return Math.absExact(arguments[0]);
    }

    public static long sign(long... arguments) {
        requireArity("sign", 1, arguments);
        return Long.signum(arguments[0]);
    }

    /**
     * {@code pow(base, exponent)} for a non-negative exponent. Overflow is an error.
     */
    public static long pow(long... arguments) {
        requireArity("pow", 2, arguments);
        long base = arguments[0];
        long exponent = arguments[1];
        if (exponent < 0) {
            throw new IllegalArgumentException("pow: negative exponent " + exponent);
        }
        long result = 1;
        while (exponent > 0) {
            if ((exponent & 1) == 1) {
                result = Math.multiplyExact(result, base);
            }
            exponent >>= 1;
            if (exponent > 0) {
                base = Math.multiplyExact(base, base);
            }
        }
        return result;
    }

    /**
     * {@code clamp(value, low, high)} limits value to the inclusive range.
     */
    public static long clamp(long... arguments) {
        requireArity("clamp", 3, arguments);
        long value = arguments[0];
        long low = arguments[1];
        long high = arguments[2];
        if (low > high) {
            throw new IllegalArgumentException("clamp: lower bound " + low + " exceeds upper bound " + high);
        }
        return Math.max(low, Math.min(high, value));
    }

    private static void requireArity(String name, int expected, long[] arguments) {
        if (arguments.length != expected) {
            throw new IllegalArgumentException(name + " expects " + expected + " argument(s), got " + arguments.length);
        }
    }

    private static void requireAtLeastOne(String name, long[] arguments) {
        if (arguments.length == 0) {
            throw new IllegalArgumentException(name + " expects at least one argument");
        }
    }
}
