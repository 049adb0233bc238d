package org.l20n.engine.compiler;

import org.l20n.dsl.Comment;
import org.l20n.dsl.EntityDefinition;
import org.l20n.dsl.L20nCompileException;
import org.l20n.dsl.MacroDefinition;
import org.l20n.dsl.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point: compiles the top-level definitions of one parsed resource.
 *
 * Entity definitions become {@link Entity}, macro definitions become
 * {@link Macro}; anything else at the top level (comments) is skipped.
 * Duplicate ids follow {@link CompilerOptions#duplicateIds()}.
 */
public final class L20nCompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(L20nCompiler.class);

    private final CompilerOptions options;
    private final ExpressionCompiler expressionCompiler;

    public L20nCompiler() {
        this(CompilerOptions.defaults());
    }

    public L20nCompiler(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.expressionCompiler = new ExpressionCompiler(options);
    }

    public CompilerOptions options() {
        return options;
    }

    /**
     * Compiles a flat sequence of top-level definitions.
     *
     * @param definitions The parser output, in source order
     * @return The compiled entries
     * @throws L20nCompileException if a definition contains a malformed node, or
     *                              an id repeats under {@code REJECT}
     */
    public CompiledResource compile(List<? extends Node> definitions) {
        Objects.requireNonNull(definitions, "Definitions cannot be null");
        Map<String, Value> entries = new LinkedHashMap<>();
        int entities = 0;
        int macros = 0;
        for (Node node : definitions) {
            if (node instanceof EntityDefinition entity) {
                put(entries, entity.id(), compileEntity(entity));
                entities++;
            } else if (node instanceof MacroDefinition macro) {
                put(entries, macro.id(), compileMacro(macro));
                macros++;
            } else if (node instanceof Comment) {
                LOGGER.trace("Skipping comment");
            } else {
                LOGGER.debug("Skipping top-level {}", node == null ? "null" : node.getClass().getSimpleName());
            }
        }
        LOGGER.debug("Compiled {} entities and {} macros into {} entries", entities, macros, entries.size());
        return new CompiledResource(entries);
    }

    private Entity compileEntity(EntityDefinition definition) {
        try {
            return new Entity(definition, expressionCompiler);
        } catch (L20nCompileException e) {
            throw new L20nCompileException("Cannot compile entity '" + definition.id() + "': " + e.getMessage(), e);
        }
    }

    private Macro compileMacro(MacroDefinition definition) {
        try {
            return new Macro(definition, expressionCompiler);
        } catch (L20nCompileException e) {
            throw new L20nCompileException("Cannot compile macro '" + definition.id() + "': " + e.getMessage(), e);
        }
    }

    private void put(Map<String, Value> entries, String id, Value entry) {
        if (entries.containsKey(id)) {
            if (options.duplicateIds() == CompilerOptions.DuplicateIdPolicy.REJECT) {
                throw new L20nCompileException("Duplicate definition of '" + id + "'");
            }
            // the entry keeps the position of the first definition
            LOGGER.warn("Duplicate definition of '{}'; the later one replaces it", id);
        }
        entries.put(id, entry);
    }
}
