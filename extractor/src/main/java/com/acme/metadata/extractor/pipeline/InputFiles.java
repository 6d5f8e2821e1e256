package com.acme.metadata.extractor.pipeline;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.logging.Logger;

/**
 * Recursive discovery of line-delimited JSON inputs.
 *
 * <p>Entries that cannot be read (permissions, symlink cycles, races with deletion) are logged
 * and skipped; the rest of the tree is still scanned.</p>
 */
public final class InputFiles {
    private static final Logger LOG = Logger.getLogger(InputFiles.class.getName());
    private static final PathMatcher GZIPPED = FileSystems.getDefault().getPathMatcher("glob:*.jsonl.gz");
    private static final PathMatcher PLAIN = FileSystems.getDefault().getPathMatcher("glob:*.jsonl");

    private InputFiles() {
    }

    /** Sorted {@code *.jsonl.gz} and {@code *.jsonl} files under {@code dir}. */
    public static List<Path> find(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("input is not a directory: " + dir);
        }
        List<Path> found = new ArrayList<>();
        Files.walkFileTree(dir, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
            new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isInput(file)) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    LOG.warning("Skipping unreadable input entry " + file + ": " + e);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException e) {
                    if (e != null) {
                        LOG.warning("Stopped listing " + d + " early: " + e);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        Collections.sort(found);
        return found;
    }

    static boolean isInput(Path file) {
        Path name = file.getFileName();
        return name != null && (GZIPPED.matches(name) || PLAIN.matches(name));
    }

    static boolean isGzip(Path file) {
        return file.getFileName().toString().endsWith(".gz");
    }
}
