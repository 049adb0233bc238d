package org.l20n.engine.compiler;

import org.l20n.dsl.L20nCompileException;

/**
 * Logical operators. Both return the deciding operand rather than a boolean:
 * {@code a && b} is {@code a} when {@code a} is falsy, else {@code b}.
 */
public enum LogicalOp {
    AND("&&"),
    OR("||");

    private final String token;

    LogicalOp(String token) {
        this.token = token;
    }

    public static LogicalOp fromToken(String token) {
        for (LogicalOp op : values()) {
            if (op.token.equals(token)) {
                return op;
            }
        }
        throw new L20nCompileException("Unknown logical operator: " + token);
    }

    public Value apply(Value left, Value right) {
        boolean leftTruthy = Values.isTruthy(left);
        return switch (this) {
            case AND -> leftTruthy ? right : left;
            case OR -> leftTruthy ? left : right;
        };
    }
}
