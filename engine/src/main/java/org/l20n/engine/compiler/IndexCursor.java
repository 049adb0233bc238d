package org.l20n.engine.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable selector cursor: the keys still to be consumed by nested array and
 * hash literals, one per level, left to right.
 *
 * Popping never mutates the cursor; {@link #tail()} returns a new cursor that
 * shares the key list and advances the position.
 */
public final class IndexCursor {

    private static final IndexCursor EMPTY = new IndexCursor(List.of(), 0);

    private final List<Evaluator> keys;
    private final int position;

    private IndexCursor(List<Evaluator> keys, int position) {
        this.keys = keys;
        this.position = position;
    }

    public static IndexCursor empty() {
        return EMPTY;
    }

    /**
     * Creates a cursor over plain keys (strings, numbers, booleans or Values).
     */
    public static IndexCursor of(Object... keys) {
        List<Evaluator> evaluators = new ArrayList<>(keys.length);
        for (Object key : keys) {
            evaluators.add(Evaluator.constant(Values.of(key)));
        }
        return new IndexCursor(List.copyOf(evaluators), 0);
    }

    /**
     * Creates a cursor over selector expressions, evaluated lazily when popped.
     */
    public static IndexCursor ofEvaluators(List<Evaluator> keys) {
        Objects.requireNonNull(keys, "Keys cannot be null");
        return keys.isEmpty() ? EMPTY : new IndexCursor(List.copyOf(keys), 0);
    }

    public boolean isEmpty() {
        return position >= keys.size();
    }

    public int remaining() {
        return keys.size() - position;
    }

    /**
     * @return The next key, or null when the cursor is exhausted
     */
    public Evaluator head() {
        return isEmpty() ? null : keys.get(position);
    }

    public IndexCursor tail() {
        return isEmpty() ? this : new IndexCursor(keys, position + 1);
    }

    @Override
    public String toString() {
        return "IndexCursor[" + position + "/" + keys.size() + "]";
    }
}
