package com.vidnyan.dokita.domain.rule;

/**
 * How strictly a source file is checked.
 */
public enum FileContext {
    /** Reusable crate code under src/, held to the stricter rules. */
    LIBRARY,
    /** Entry points, binaries, build script, crate root, tests, examples and benches. */
    APPLICATION
}
