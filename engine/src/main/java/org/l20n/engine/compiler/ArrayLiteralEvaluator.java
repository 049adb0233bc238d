package org.l20n.engine.compiler;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Array selector: branches addressed by position. Numbers and canonical
 * integer strings ("1", not " 1 " or "1.0") select; anything else falls back
 * to the default branch.
 */
final class ArrayLiteralEvaluator extends SelectorEvaluator {

    private static final Pattern CANONICAL_INDEX = Pattern.compile("0|[1-9][0-9]*");

    private final List<Evaluator> content;
    private final int defaultIndex;

    ArrayLiteralEvaluator(List<Evaluator> content, int defaultIndex) {
        this.content = List.copyOf(content);
        this.defaultIndex = defaultIndex;
    }

    @Override
    Evaluator branch(Value key) {
        int position = position(key);
        return position >= 0 && position < content.size() ? content.get(position) : null;
    }

    @Override
    Evaluator defaultBranch() {
        return content.get(defaultIndex);
    }

    private static int position(Value key) {
        double number;
        if (key instanceof Value.Num n) {
            number = n.value();
        } else if (key instanceof Value.Str s && CANONICAL_INDEX.matcher(s.value()).matches()) {
            try {
                number = Integer.parseInt(s.value());
            } catch (NumberFormatException e) {
                return -1;
            }
        } else {
            return -1;
        }
        if (number != Math.rint(number) || number < 0 || number > Integer.MAX_VALUE) {
            return -1;
        }
        return (int) number;
    }
}
