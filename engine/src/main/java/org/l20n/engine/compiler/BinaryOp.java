package org.l20n.engine.compiler;

import org.l20n.dsl.L20nCompileException;

/**
 * Binary operators.
 *
 * Arithmetic and ordering work on numbers; {@code +} also concatenates when
 * either side is a string, and ordering also compares two strings. Equality
 * never fails: values of different kinds are simply unequal, except numbers,
 * numeric strings and booleans, which compare by numeric value.
 */
public enum BinaryOp {
    // Comparison
    EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">="),

    // Arithmetic
    PLUS("+"), MINUS("-"), MULTIPLY("*"), DIVIDE("/"), MODULO("%");

    private final String token;

    BinaryOp(String token) {
        this.token = token;
    }

    public static BinaryOp fromToken(String token) {
        for (BinaryOp op : values()) {
            if (op.token.equals(token)) {
                return op;
            }
        }
        throw new L20nCompileException("Unknown binary operator: " + token);
    }

    public Value apply(Value left, Value right) {
        return switch (this) {
            case EQ -> Value.bool(looselyEquals(left, right));
            case NE -> Value.bool(!looselyEquals(left, right));
            case LT -> Value.bool(compare(left, right) < 0);
            case LE -> Value.bool(compare(left, right) <= 0);
            case GT -> Value.bool(compare(left, right) > 0);
            case GE -> Value.bool(compare(left, right) >= 0);
            case PLUS -> add(left, right);
            case MINUS -> Value.num(requireNumber(left, token) - requireNumber(right, token));
            case MULTIPLY -> Value.num(requireNumber(left, token) * requireNumber(right, token));
            case DIVIDE -> Value.num(requireNumber(left, token) / requireNumber(right, token));
            case MODULO -> Value.num(requireNumber(left, token) % requireNumber(right, token));
        };
    }

    static double requireNumber(Value value, String token) {
        if (value instanceof Value.Num n) {
            return n.value();
        }
        throw new TypeMismatchException("Operator " + token + " expects a number but got " + Values.describe(value));
    }

    private Value add(Value left, Value right) {
        if (left instanceof Value.Num l && right instanceof Value.Num r) {
            return Value.num(l.value() + r.value());
        }
        if (left instanceof Value.Str || right instanceof Value.Str) {
            String l = Values.keyOf(left);
            String r = Values.keyOf(right);
            if (l != null && r != null) {
                return Value.str(l + r);
            }
        }
        throw new TypeMismatchException("Operator + cannot combine " + Values.describe(left)
                + " and " + Values.describe(right));
    }

    /**
     * NaN compares as unordered: every ordering test on it is false.
     */
    private int compare(Value left, Value right) {
        if (left instanceof Value.Num l && right instanceof Value.Num r) {
            if (Double.isNaN(l.value()) || Double.isNaN(r.value())) {
                return this == LT || this == LE ? 1 : -1;
            }
            return Double.compare(l.value(), r.value());
        }
        if (left instanceof Value.Str l && right instanceof Value.Str r) {
            return l.value().compareTo(r.value());
        }
        throw new TypeMismatchException("Operator " + token + " cannot compare " + Values.describe(left)
                + " and " + Values.describe(right));
    }

    private static boolean looselyEquals(Value left, Value right) {
        if (left instanceof Value.Num l && right instanceof Value.Num r) {
            return l.value() == r.value();
        }
        if (left instanceof Value.Str l && right instanceof Value.Str r) {
            return l.value().equals(r.value());
        }
        if (left instanceof Value.Bool l && right instanceof Value.Bool r) {
            return l.value() == r.value();
        }
        if (isNumeric(left) && isNumeric(right)) {
            return toNumber(left) == toNumber(right);
        }
        // references compare by identity, undefined only equals itself
        return left == right;
    }

    private static boolean isNumeric(Value value) {
        return value instanceof Value.Num || value instanceof Value.Bool || value instanceof Value.Str;
    }

    private static double toNumber(Value value) {
        return UnaryOp.PLUS.apply(value) instanceof Value.Num n ? n.value() : Double.NaN;
    }
}
