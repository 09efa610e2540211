package io.settingstree.core.tree;

import java.util.regex.Pattern;

/**
 * Evaluates the integer expressions allowed in configuration values, e.g. {@code (1|4)*0x10}.
 *
 * <p>
 * Operators, loosest binding first: {@code |}, {@code &}, binary {@code + -}, {@code * /}, unary
 * {@code ! - +}. Literals are decimal or {@code 0x} hex. Division truncates toward zero.
 * Overflow raises {@link ArithmeticException}.
 */
public final class IntExpression {

    private static final Pattern CANDIDATE = Pattern.compile("[()|&!+\\-/*x0-9a-fA-F]+");

    private final String text;
    private int pos;

    private IntExpression(String text) {
        this.text = text;
    }

    /** True when {@code text} only uses the characters an expression may contain. */
    public static boolean isCandidate(String text) {
        return CANDIDATE.matcher(text).matches();
    }

    /**
     * Evaluates {@code expression}.
     *
     * @throws IllegalArgumentException if the expression is malformed or divides by zero
     */
    public static long evaluate(String expression) {
        if (!isCandidate(expression)) {
            throw new IllegalArgumentException("'" + expression + "' is not an integer expression");
        }
        IntExpression parser = new IntExpression(expression);
        long value = parser.parseOr();
        if (parser.pos != expression.length()) {
            throw parser.error("unexpected '" + expression.charAt(parser.pos) + "'");
        }
        return value;
    }

    private long parseOr() {
        long value = parseAnd();
        while (accept('|')) {
            value |= parseAnd();
        }
        return value;
    }

    private long parseAnd() {
        long value = parseAdditive();
        while (accept('&')) {
            value &= parseAdditive();
        }
        return value;
    }

    private long parseAdditive() {
        long value = parseMultiplicative();
        while (true) {
            if (accept('+')) {
                value = Math.addExact(value, parseMultiplicative());
            } else if (accept('-')) {
                value = Math.subtractExact(value, parseMultiplicative());
            } else {
                return value;
            }
        }
    }

    private long parseMultiplicative() {
        long value = parseUnary();
        while (true) {
            if (accept('*')) {
                value = Math.multiplyExact(value, parseUnary());
            } else if (accept('/')) {
                long divisor = parseUnary();
                if (divisor == 0) {
                    throw error("division by zero");
                }
                value /= divisor;
            } else {
                return value;
            }
        }
    }

    private long parseUnary() {
        if (accept('!')) {
            return parseUnary() == 0 ? 1 : 0;
        }
        if (accept('-')) {
            return Math.negateExact(parseUnary());
        }
        if (accept('+')) {
            return parseUnary();
        }
        return parsePrimary();
    }

    private long parsePrimary() {
        if (accept('(')) {
            long value = parseOr();
            if (!accept(')')) {
                throw error("missing ')'");
            }
            return value;
        }
        int start = pos;
        int radix = 10;
        if (text.startsWith("0x", pos)) {
            pos += 2;
            start = pos;
            radix = 16;
        }
        while (pos < text.length() && Character.digit(text.charAt(pos), radix) >= 0) {
            pos++;
        }
        if (start == pos) {
            throw error(pos < text.length() ? "unexpected '" + text.charAt(pos) + "'" : "unexpected end");
        }
        try {
            return Long.parseLong(text.substring(start, pos), radix);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("literal out of range in '" + text + "'", e);
        }
    }

    private boolean accept(char c) {
        if (pos < text.length() && text.charAt(pos) == c) {
            pos++;
            return true;
        }
        return false;
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at position " + pos + " in '" + text + "'");
    }
}
