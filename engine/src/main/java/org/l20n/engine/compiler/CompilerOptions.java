package org.l20n.engine.compiler;

import org.l20n.dsl.L20nCompileException;

import java.util.Locale;
import java.util.Properties;

/**
 * Compiler configuration, carried into every compiled entity and macro.
 *
 * @param maxResolutionDepth Nested entity, attribute and macro invocations allowed in one resolution
 * @param maxDriveSteps      Thunks a single value may unwrap before it must become text
 * @param duplicateIds       What to do when a resource defines the same id twice
 * @param undefinedInText    What to do when an undefined value is interpolated
 */
public record CompilerOptions(
        int maxResolutionDepth,
        int maxDriveSteps,
        DuplicateIdPolicy duplicateIds,
        UndefinedPolicy undefinedInText) {

    public static final String MAX_RESOLUTION_DEPTH = "l20n.maxResolutionDepth";
    public static final String MAX_DRIVE_STEPS = "l20n.maxDriveSteps";
    public static final String DUPLICATE_IDS = "l20n.duplicateIds";
    public static final String UNDEFINED_IN_TEXT = "l20n.undefinedInText";

    private static final CompilerOptions DEFAULTS =
            new CompilerOptions(256, 64, DuplicateIdPolicy.LAST_WINS, UndefinedPolicy.FAIL);

    public enum DuplicateIdPolicy {
        /** Later definition replaces the earlier one */
        LAST_WINS,
        /** Duplicate ids fail the compile */
        REJECT
    }

    public enum UndefinedPolicy {
        /** Interpolating undefined raises TypeMismatchException */
        FAIL,
        /** Undefined interpolates as the empty string */
        EMPTY
    }

    public CompilerOptions {
        if (maxResolutionDepth < 1) {
            throw new IllegalArgumentException("maxResolutionDepth must be positive: " + maxResolutionDepth);
        }
        if (maxDriveSteps < 1) {
            throw new IllegalArgumentException("maxDriveSteps must be positive: " + maxDriveSteps);
        }
        if (duplicateIds == null) {
            duplicateIds = DuplicateIdPolicy.LAST_WINS;
        }
        if (undefinedInText == null) {
            undefinedInText = UndefinedPolicy.FAIL;
        }
    }

    public static CompilerOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads options from properties, falling back to the defaults for missing keys.
     *
     * @throws L20nCompileException if a value cannot be parsed
     */
    public static CompilerOptions fromProperties(Properties properties) {
        try {
            return new CompilerOptions(
                    intProperty(properties, MAX_RESOLUTION_DEPTH, DEFAULTS.maxResolutionDepth),
                    intProperty(properties, MAX_DRIVE_STEPS, DEFAULTS.maxDriveSteps),
                    enumProperty(properties, DUPLICATE_IDS, DuplicateIdPolicy.class, DEFAULTS.duplicateIds),
                    enumProperty(properties, UNDEFINED_IN_TEXT, UndefinedPolicy.class, DEFAULTS.undefinedInText));
        } catch (IllegalArgumentException e) {
            throw new L20nCompileException("Invalid compiler options: " + e.getMessage(), e);
        }
    }

    public CompilerOptions withMaxResolutionDepth(int depth) {
        return new CompilerOptions(depth, maxDriveSteps, duplicateIds, undefinedInText);
    }

    public CompilerOptions withMaxDriveSteps(int steps) {
        return new CompilerOptions(maxResolutionDepth, steps, duplicateIds, undefinedInText);
    }

    public CompilerOptions withDuplicateIds(DuplicateIdPolicy policy) {
        return new CompilerOptions(maxResolutionDepth, maxDriveSteps, policy, undefinedInText);
    }

    public CompilerOptions withUndefinedInText(UndefinedPolicy policy) {
        return new CompilerOptions(maxResolutionDepth, maxDriveSteps, duplicateIds, policy);
    }

    private static int intProperty(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? fallback : Integer.parseInt(value.trim());
    }

    private static <E extends Enum<E>> E enumProperty(Properties properties, String key, Class<E> type, E fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
