package org.tinycompiler.compiler.api;

import com.typesafe.config.Config;

/**
 * Settings that influence a compilation without changing its semantics.
 *
 * @param verbosity The {@link org.tinycompiler.compiler.diagnostics.CompilerLogger} level the driver applies at startup, or -1 to leave it untouched.
 * @param dumpTrees Whether the intermediate trees are logged after each compilation.
 * @param indent The indentation placed in front of every emitted statement.
 */
public record CompilerOptions(int verbosity, boolean dumpTrees, String indent) {

    /** Options used when no configuration is supplied. */
    public static final CompilerOptions DEFAULT = new CompilerOptions(-1, false, "  ");

    private static final String VERBOSITY_PATH = "tinycompiler.compiler.verbosity";
    private static final String DUMP_TREES_PATH = "tinycompiler.compiler.dump-trees";
    private static final String INDENT_PATH = "tinycompiler.emitter.indent";

    /**
     * Compact constructor rejecting a missing indent.
     */
    public CompilerOptions {
        if (indent == null) {
            throw new IllegalArgumentException("indent must not be null");
        }
    }

    /**
     * Reads the options from the {@code tinycompiler} section of a configuration.
     * Missing keys fall back to {@link #DEFAULT}.
     *
     * @param config The application configuration.
     * @return The options described by the configuration.
     */
    public static CompilerOptions fromConfig(Config config) {
        int verbosity = config.hasPath(VERBOSITY_PATH) ? config.getInt(VERBOSITY_PATH) : DEFAULT.verbosity();
        boolean dumpTrees = config.hasPath(DUMP_TREES_PATH) ? config.getBoolean(DUMP_TREES_PATH) : DEFAULT.dumpTrees();
        String indent = config.hasPath(INDENT_PATH) ? config.getString(INDENT_PATH) : DEFAULT.indent();
        return new CompilerOptions(verbosity, dumpTrees, indent);
    }

    /**
     * @param enabled Whether trees should be dumped.
     * @return A copy of these options with the given tree dump setting.
     */
    public CompilerOptions withDumpTrees(boolean enabled) {
        return new CompilerOptions(verbosity, enabled, indent);
    }
}
