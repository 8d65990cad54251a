package com.vibeloop.core.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a shallow workspace listing.
 *
 * @param path  path relative to the workspace root
 * @param isDir whether the entry is a directory
 * @param size  file size in bytes, 0 for directories
 * @param mtime last modification time, epoch seconds
 */
public record FileEntry(
    String path,
    @JsonProperty("is_dir") boolean isDir,
    long size,
    long mtime
) {}
