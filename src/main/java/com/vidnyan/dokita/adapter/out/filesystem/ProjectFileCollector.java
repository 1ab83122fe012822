package com.vidnyan.dokita.adapter.out.filesystem;

import com.vidnyan.dokita.application.port.out.SourceFileCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Scans a Cargo project for Rust source files.
 * Discovers all .rs files in the source roots (src, tests, examples, benches).
 */
@Slf4j
@Component
public class ProjectFileCollector implements SourceFileCollector {

    public static final List<String> SOURCE_ROOTS = List.of("src", "tests", "examples", "benches");
    public static final String SOURCE_EXTENSION = ".rs";

    @Override
    public List<Path> collect(Path projectRoot) {
        TreeSet<Path> sourceFiles = new TreeSet<>();

        for (Path sourceRoot : discoverSourceRoots(projectRoot)) {
            try {
                Files.walkFileTree(sourceRoot, new SourceFileVisitor(sourceFiles));
            } catch (IOException e) {
                log.debug("Stopped walking {}: {}", sourceRoot, e.getMessage());
            }
        }

        log.debug("Collected {} source files under {}", sourceFiles.size(), projectRoot);
        return List.copyOf(sourceFiles);
    }

    /**
     * Source roots that exist in this project; missing ones are skipped silently.
     */
    List<Path> discoverSourceRoots(Path projectRoot) {
        List<Path> roots = new ArrayList<>();
        for (String name : SOURCE_ROOTS) {
            Path root = projectRoot.resolve(name);
            if (Files.isDirectory(root)) {
                roots.add(root);
            }
        }
        return roots;
    }

    /**
     * Collects regular .rs files; entries that cannot be visited are skipped.
     */
    private static final class SourceFileVisitor extends SimpleFileVisitor<Path> {
        private final TreeSet<Path> sink;

        private SourceFileVisitor(TreeSet<Path> sink) {
            this.sink = sink;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && file.getFileName().toString().endsWith(SOURCE_EXTENSION)) {
                sink.add(file.normalize());
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.debug("Skipping unreadable entry {}: {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }
    }
}
