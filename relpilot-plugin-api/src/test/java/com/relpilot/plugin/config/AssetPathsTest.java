package com.relpilot.plugin.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AssetPathsTest {

    @TempDir
    Path tempDir;

    @Test
    void validateAssetPath_returnsRealPathOfFileInsideBase() throws Exception {
        Path base = Files.createDirectory(tempDir.resolve("work"));
        Files.createDirectories(base.resolve("dist"));
        Path file = Files.writeString(base.resolve("dist/app.tar.gz"), "data");

        Path resolved = AssetPaths.validateAssetPath("dist/app.tar.gz", base);
        assertEquals(file.toRealPath(), resolved);
        assertEquals(file.toRealPath(), AssetPaths.validateAssetPath(file.toString(), base));
    }

    @Test
    void validateAssetPath_rejectsTraversalAndEscapes() throws Exception {
        Path base = Files.createDirectory(tempDir.resolve("work"));
        Path outside = Files.writeString(tempDir.resolve("secret.txt"), "s");

        assertTrue(message("../secret.txt", base).startsWith("path traversal not allowed"));
        assertTrue(message("dist/../../secret.txt", base).startsWith("path traversal not allowed"));
        assertTrue(message(outside.toString(), base).startsWith("asset path resolves outside working directory"));
    }

    @Test
    void validateAssetPath_rejectsSymlinkEscapingBase() throws Exception {
        Path base = Files.createDirectory(tempDir.resolve("work"));
        Path outside = Files.writeString(tempDir.resolve("secret.txt"), "s");
        Files.createSymbolicLink(base.resolve("link.txt"), outside);

        assertTrue(message("link.txt", base).startsWith("asset path resolves outside working directory"));
    }

    @Test
    void validateAssetPath_rejectsMissingEmptyAndDirectories() throws Exception {
        Path base = Files.createDirectory(tempDir.resolve("work"));
        Files.createDirectories(base.resolve("dist"));

        assertEquals("asset path cannot be empty", message("", base));
        assertEquals("asset file does not exist: nope.txt", message("nope.txt", base));
        assertEquals("asset path is a directory, not a file: dist", message("dist", base));
    }

    private static String message(String path, Path base) {
        return assertThrows(IllegalArgumentException.class, () -> AssetPaths.validateAssetPath(path, base)).getMessage();
    }
}
