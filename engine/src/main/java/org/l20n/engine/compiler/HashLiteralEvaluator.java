package org.l20n.engine.compiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hash selector: branches addressed by the string form of the key.
 */
final class HashLiteralEvaluator extends SelectorEvaluator {

    private final Map<String, Evaluator> content;
    private final String defaultKey;

    HashLiteralEvaluator(Map<String, Evaluator> content, String defaultKey) {
        this.content = Collections.unmodifiableMap(new LinkedHashMap<>(content));
        this.defaultKey = defaultKey;
    }

    @Override
    Evaluator branch(Value key) {
        String id = Values.keyOf(key);
        return id != null ? content.get(id) : null;
    }

    @Override
    Evaluator defaultBranch() {
        return content.get(defaultKey);
    }
}
