package org.l20n.engine.compiler;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;

/**
 * State of one public lookup ({@code get}, {@code getAttribute}, ...): the
 * caller's context and data, plus the guards that stop runaway recursion.
 *
 * A scope is created per call and threaded through every evaluator, so
 * compiled entities can be shared between threads.
 */
public final class ResolutionScope {

    private final Context context;
    private final CallerData data;
    private final CompilerOptions options;
    private final Set<Object> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());
    private int depth;

    public ResolutionScope(Context context, CallerData data, CompilerOptions options) {
        this.context = Objects.requireNonNull(context, "Context cannot be null");
        this.data = data != null ? data : CallerData.empty();
        this.options = options != null ? options : CompilerOptions.defaults();
    }

    public Context context() {
        return context;
    }

    public CallerData data() {
        return data;
    }

    public CompilerOptions options() {
        return options;
    }

    /**
     * Marks an interpolated string as being evaluated.
     *
     * @throws CyclicReferenceException if it is already being evaluated in this resolution
     */
    void enterInterpolation(Object node, String description) {
        if (!inProgress.add(node)) {
            throw new CyclicReferenceException("Cyclic reference detected while resolving " + description);
        }
    }

    void exitInterpolation(Object node) {
        inProgress.remove(node);
    }

    /**
     * Counts one nested entity, attribute or macro invocation.
     *
     * @throws CyclicReferenceException when the configured depth is exceeded
     */
    void enter(String description) {
        if (++depth > options.maxResolutionDepth()) {
            depth--;
            throw new CyclicReferenceException("Resolution depth " + options.maxResolutionDepth()
                    + " exceeded while resolving " + description + "; the reference chain is likely cyclic");
        }
    }

    void exit() {
        depth--;
    }
}
