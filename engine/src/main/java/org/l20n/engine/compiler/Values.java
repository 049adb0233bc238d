package org.l20n.engine.compiler;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversions between Java objects and runtime values, plus the truthiness and
 * display rules shared by operators and selectors.
 */
public final class Values {

    private Values() {
        // Static utility class
    }

    /**
     * Converts a plain Java object into a Value.
     * Strings, numbers, booleans and null are accepted; Values pass through.
     */
    public static Value of(Object value) {
        if (value == null) {
            return Value.undefined();
        }
        if (value instanceof Value v) {
            return v;
        }
        if (value instanceof String s) {
            return Value.str(s);
        }
        if (value instanceof Number n) {
            return Value.num(n.doubleValue());
        }
        if (value instanceof Boolean b) {
            return Value.bool(b);
        }
        if (value instanceof Character c) {
            return Value.str(String.valueOf(c));
        }
        throw new IllegalArgumentException("Cannot convert " + value.getClass().getName() + " to an L20n value");
    }

    /**
     * Converts every entry of a map with {@link #of(Object)}, keeping iteration order.
     */
    public static Map<String, Value> ofMap(Map<String, ?> values) {
        Map<String, Value> converted = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((key, value) -> converted.put(key, of(value)));
        }
        return converted;
    }

    public static boolean isTruthy(Value value) {
        if (value instanceof Value.Str s) {
            return !s.value().isEmpty();
        }
        if (value instanceof Value.Num n) {
            return n.value() != 0 && !Double.isNaN(n.value());
        }
        if (value instanceof Value.Bool b) {
            return b.value();
        }
        return !(value instanceof Value.Undefined);
    }

    /**
     * Integral numbers print without a fraction or exponent: 3 rather than 3.0,
     * 10000000000000000 rather than 1.0E16.
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == Math.rint(value)) {
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
        return Double.toString(value);
    }

    /**
     * String form used for selector keys and text output of primitives,
     * or null when the value has none.
     */
    static String keyOf(Value value) {
        if (value instanceof Value.Str || value instanceof Value.Num || value instanceof Value.Bool) {
            return value.toString();
        }
        return null;
    }

    static String describe(Value value) {
        if (value instanceof Entity entity) {
            return "entity '" + entity.id() + "'";
        }
        if (value instanceof Macro macro) {
            return "macro '" + macro.id() + "'";
        }
        if (value instanceof Value.AttributeRef ref) {
            return "attribute '" + ref.owner().id() + "::" + ref.attribute().id() + "'";
        }
        if (value instanceof Value.Thunk) {
            return "unresolved branch";
        }
        if (value instanceof Value.Str s) {
            return "string \"" + s.value() + "\"";
        }
        if (value instanceof Value.Num n) {
            return "number " + n;
        }
        return value.toString();
    }
}
