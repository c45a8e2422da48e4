package com.relpilot.plugin.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Validation of file paths a plugin is asked to upload as release assets.
 */
public final class AssetPaths {

    private AssetPaths() {
    }

    /** Validates {@code assetPath} against the current working directory. */
    public static Path validateAssetPath(String assetPath) {
        return validateAssetPath(assetPath, Paths.get("").toAbsolutePath());
    }

    /**
     * Resolves {@code assetPath} (relative to {@code baseDir} unless absolute), follows symlinks and
     * checks the result is an existing regular file inside {@code baseDir}.
     *
     * @return the real path of the asset
     * @throws IllegalArgumentException when the path is empty, contains traversal, escapes
     *                                  {@code baseDir}, does not exist or is a directory
     */
    public static Path validateAssetPath(String assetPath, Path baseDir) {
        if (assetPath == null || assetPath.isEmpty()) {
            throw new IllegalArgumentException("asset path cannot be empty");
        }
        Path clean = Paths.get(assetPath).normalize();
        for (Path part : clean) {
            if ("..".equals(part.toString())) {
                throw new IllegalArgumentException("path traversal not allowed in asset path: " + assetPath);
            }
        }
        Path realBase;
        Path real;
        try {
            realBase = baseDir.toRealPath();
            real = (clean.isAbsolute() ? clean : baseDir.resolve(clean)).toRealPath();
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("asset file does not exist: " + assetPath, e);
        } catch (IOException e) {
            throw new IllegalArgumentException("failed to resolve asset path: " + e.getMessage(), e);
        }
        if (!real.startsWith(realBase)) {
            throw new IllegalArgumentException("asset path resolves outside working directory: " + assetPath);
        }
        if (Files.isDirectory(real)) {
            throw new IllegalArgumentException("asset path is a directory, not a file: " + assetPath);
        }
        return real;
    }
}
