package com.vidnyan.dokita.application.port.out;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for enumerating the source files of a project.
 */
public interface SourceFileCollector {

    /**
     * Collect candidate source files under the recognized project directories.
     * Best effort: unreadable entries are skipped, never reported.
     * @param projectRoot canonical project root
     * @return deduplicated file list
     */
    List<Path> collect(Path projectRoot);
}
