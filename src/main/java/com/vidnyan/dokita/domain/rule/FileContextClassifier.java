package com.vidnyan.dokita.domain.rule;

import java.nio.file.Path;

/**
 * Classifies source files by path shape alone; never touches the file system.
 *
 * A file is library code when it sits under {@code src/} and is none of:
 * the crate root {@code src/lib.rs}, a {@code main.rs}, anything below a {@code bin}
 * directory, or the {@code build.rs} build script.
 */
public final class FileContextClassifier {

    public static final String SOURCE_DIR = "src";
    public static final String LIBRARY_ROOT = "lib.rs";
    public static final String ENTRY_POINT = "main.rs";
    public static final String BINARIES_DIR = "bin";
    public static final String BUILD_SCRIPT = "build.rs";

    private FileContextClassifier() {
    }

    public static FileContext classify(Path projectRoot, Path file) {
        Path relative = relativize(projectRoot, file);
        if (relative.equals(Path.of(BUILD_SCRIPT))) {
            return FileContext.APPLICATION;
        }
        if (relative.getNameCount() < 2 || !relative.getName(0).toString().equals(SOURCE_DIR)) {
            return FileContext.APPLICATION;
        }
        if (relative.equals(Path.of(SOURCE_DIR, LIBRARY_ROOT))) {
            return FileContext.APPLICATION;
        }
        if (relative.getFileName().toString().equals(ENTRY_POINT)) {
            return FileContext.APPLICATION;
        }
        for (Path component : relative) {
            if (component.toString().equals(BINARIES_DIR)) {
                return FileContext.APPLICATION;
            }
        }
        return FileContext.LIBRARY;
    }

    /**
     * Project-relative form of {@code file}; relative inputs are taken as already relative.
     */
    public static Path relativize(Path projectRoot, Path file) {
        Path normalized = file.normalize();
        if (normalized.isAbsolute() && projectRoot.isAbsolute()) {
            Path root = projectRoot.normalize();
            return normalized.startsWith(root) ? root.relativize(normalized) : normalized;
        }
        return normalized;
    }
}
