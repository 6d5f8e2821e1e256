package com.acme.metadata.extractor.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class InputFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldFindInputsRecursivelyInSortedOrder() throws Exception {
        Path b = touch(tempDir.resolve("2023").resolve("b.jsonl.gz"));
        Path a = touch(tempDir.resolve("2023").resolve("a.jsonl.gz"));
        Path plain = touch(tempDir.resolve("z.jsonl"));
        touch(tempDir.resolve("notes.txt"));
        touch(tempDir.resolve("data.json.gz"));
        Files.createDirectories(tempDir.resolve("dir.jsonl.gz"));

        assertEquals(List.of(a, b, plain), InputFiles.find(tempDir));
    }

    @Test
    void shouldSkipSymlinkCyclesAndDanglingLinks() throws Exception {
        Path a = touch(tempDir.resolve("a.jsonl.gz"));
        Path nested = touch(tempDir.resolve("sub").resolve("b.jsonl"));
        Files.createSymbolicLink(tempDir.resolve("sub").resolve("loop"), tempDir);
        Files.createSymbolicLink(tempDir.resolve("dangling.jsonl.gz"), tempDir.resolve("missing.jsonl.gz"));

        assertEquals(List.of(a, nested), InputFiles.find(tempDir));
    }

    @Test
    void shouldContinuePastUnreadableDirectory() throws Exception {
        Path a = touch(tempDir.resolve("a.jsonl.gz"));
        Path locked = Files.createDirectories(tempDir.resolve("locked"));
        touch(locked.resolve("hidden.jsonl.gz"));
        Path z = touch(tempDir.resolve("z").resolve("z.jsonl.gz"));
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        try {
            // permission bits are not enforced for root
            assumeFalse(Files.isReadable(locked));

            assertEquals(List.of(a, z), InputFiles.find(tempDir));
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    void shouldRejectMissingDirectory() {
        assertThrows(IllegalArgumentException.class, () -> InputFiles.find(tempDir.resolve("missing")));
    }

    private static Path touch(Path file) throws Exception {
        Files.createDirectories(file.getParent());
        return Files.write(file, new byte[0]);
    }
}
