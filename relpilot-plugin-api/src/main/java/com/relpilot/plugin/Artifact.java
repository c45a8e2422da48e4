package com.relpilot.plugin;

/**
 * A file or resource produced by a plugin (uploaded asset, published package URL, ...).
 *
 * @param name     artifact name
 * @param path     local file path or URL
 * @param type     artifact type (file, url, ...)
 * @param size     size in bytes; 0 when unknown
 * @param checksum optional checksum
 */
public record Artifact(
        String name,
        String path,
        String type,
        long size,
        String checksum
) {
    public Artifact {
        name = name != null ? name : "";
        path = path != null ? path : "";
        type = type != null ? type : "";
        checksum = checksum != null ? checksum : "";
    }
}
