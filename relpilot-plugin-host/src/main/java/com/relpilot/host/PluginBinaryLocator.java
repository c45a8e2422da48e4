package com.relpilot.host;

import com.relpilot.config.PluginConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Resolves plugin binaries. Only binaries whose real path (symlinks followed) lies inside one of
 * the allowed directories are accepted, and they must be regular executable files.
 */
public final class PluginBinaryLocator {

    private static final Logger log = LoggerFactory.getLogger(PluginBinaryLocator.class);

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final List<Path> allowedDirs;

    public PluginBinaryLocator(List<Path> allowedDirs) {
        this.allowedDirs = List.copyOf(Objects.requireNonNull(allowedDirs, "allowedDirs"));
    }

    public List<Path> getAllowedDirs() {
        return allowedDirs;
    }

    /**
     * Finds the binary for {@code config}: its explicit path when set, else a file named like the
     * plugin in the first allowed directory that holds a valid one.
     *
     * @return the real path of the binary
     * @throws PluginLoadException when the name is invalid or no acceptable binary exists
     */
    public Path locate(PluginConfig config) throws PluginLoadException {
        String name = config.getName();
        try {
            validateName(name);
        } catch (IllegalArgumentException e) {
            throw new PluginLoadException(name, "invalid plugin name: " + e.getMessage(), e);
        }

        if (config.getPath() != null) {
            try {
                return validateBinary(Paths.get(config.getPath()));
            } catch (IllegalArgumentException e) {
                throw new PluginLoadException(name, "plugin path validation failed: " + e.getMessage(), e);
            }
        }

        for (Path dir : allowedDirs) {
            Path candidate = dir.resolve(name);
            try {
                return validateBinary(candidate);
            } catch (IllegalArgumentException e) {
                log.debug("Skipping plugin candidate {}: {}", candidate, e.getMessage());
            }
        }
        throw new PluginLoadException(name, "plugin binary not found for " + name + " in allowed directories");
    }

    /**
     * @throws IllegalArgumentException when the name is empty, longer than 64 characters or holds
     *                                  anything but letters, digits, '-' and '_'
     */
    public static void validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("plugin name cannot be empty");
        }
        if (name.length() > 64) {
            throw new IllegalArgumentException("plugin name too long (max 64 characters)");
        }
        if (!VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("plugin name contains invalid characters: " + name);
        }
    }

    /**
     * Checks a binary against the allowed directories.
     *
     * @return the real path
     * @throws IllegalArgumentException with the reason when the binary is not acceptable
     */
    public Path validateBinary(Path path) {
        Path realPath;
        try {
            realPath = path.toAbsolutePath().toRealPath();
        } catch (IOException e) {
            throw new IllegalArgumentException("plugin binary not accessible: " + path);
        }
        if (!isInAllowedDir(realPath)) {
            throw new IllegalArgumentException("plugin binary " + realPath + " is not in an allowed directory");
        }
        if (Files.isDirectory(realPath)) {
            throw new IllegalArgumentException("plugin path is a directory, not a file: " + realPath);
        }
        if (!Files.isRegularFile(realPath)) {
            throw new IllegalArgumentException("plugin binary is not a regular file: " + realPath);
        }
        if (!Files.isExecutable(realPath)) {
            throw new IllegalArgumentException("plugin binary is not executable: " + realPath);
        }
        return realPath;
    }

    private boolean isInAllowedDir(Path realPath) {
        for (Path dir : realAllowedDirs()) {
            if (realPath.startsWith(dir) && !realPath.equals(dir)) {
                return true;
            }
        }
        return false;
    }

    private List<Path> realAllowedDirs() {
        List<Path> out = new ArrayList<>(allowedDirs.size());
        for (Path dir : allowedDirs) {
            try {
                out.add(dir.toAbsolutePath().toRealPath());
            } catch (IOException e) {
                log.trace("Allowed plugin directory {} does not exist", dir);
            }
        }
        return out;
    }
}
