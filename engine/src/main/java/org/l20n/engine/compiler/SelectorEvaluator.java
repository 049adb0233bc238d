package org.l20n.engine.compiler;

/**
 * Common part of array and hash literals: pop one key, pick a branch, then
 * either drive it (resolve mode) or hand it back unevaluated (yield mode).
 */
abstract class SelectorEvaluator implements Evaluator {

    @Override
    public final Value evaluate(Locals locals, ResolutionScope scope, IndexCursor index) {
        Evaluator head = index.head();
        Value key = head != null ? TextResolver.toKey(head, locals, scope) : null;
        Evaluator member = null;
        if (key != null && Values.isTruthy(key)) {
            member = branch(key);
        }
        if (member == null) {
            member = defaultBranch();
        }
        if (locals.resolve()) {
            return member.evaluate(locals, scope, index.tail());
        }
        return new Value.Thunk(member, locals);
    }

    /**
     * @return The branch matching the key, or null when there is none
     */
    abstract Evaluator branch(Value key);

    abstract Evaluator defaultBranch();
}
