package org.l20n.engine.compiler;

import org.l20n.dsl.L20nCompileException;

/**
 * Unary operators: -x, +x, !x
 */
public enum UnaryOp {
    NEGATE("-"),
    PLUS("+"),
    NOT("!");

    private final String token;

    UnaryOp(String token) {
        this.token = token;
    }

    public static UnaryOp fromToken(String token) {
        for (UnaryOp op : values()) {
            if (op.token.equals(token)) {
                return op;
            }
        }
        throw new L20nCompileException("Unknown unary operator: " + token);
    }

    public Value apply(Value operand) {
        return switch (this) {
            case NEGATE -> Value.num(-BinaryOp.requireNumber(operand, this.token));
            case PLUS -> Value.num(toNumber(operand));
            case NOT -> Value.bool(!Values.isTruthy(operand));
        };
    }

    private static double toNumber(Value operand) {
        if (operand instanceof Value.Num n) {
            return n.value();
        }
        if (operand instanceof Value.Bool b) {
            return b.value() ? 1 : 0;
        }
        if (operand instanceof Value.Str s) {
            String text = s.value().trim();
            if (text.isEmpty()) {
                return 0;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        throw new TypeMismatchException("Operator + cannot convert " + Values.describe(operand) + " to a number");
    }
}
