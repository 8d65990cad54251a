package com.vibeloop.core.storage;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * On-disk layout for runs:
 * <pre>
 * {root}/runs/{runId}/events.jsonl
 * {root}/runs/{runId}/workspace/index.html
 * {root}/runs/{runId}/screenshots/snap_{iteration}.png
 * </pre>
 * Run ids are validated before being turned into paths.
 */
@Component
public class RunPaths {

    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");

    private final Path root;

    @Autowired
    public RunPaths(StorageProperties properties) {
        this(Path.of(properties.getRoot()));
    }

    public RunPaths(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path runsDir() {
        return root.resolve("runs");
    }

    public Path runDir(String runId) {
        if (!isValidRunId(runId)) {
            throw new IllegalArgumentException("Invalid run id: " + runId);
        }
        return runsDir().resolve(runId);
    }

    public Path eventsFile(String runId) {
        return runDir(runId).resolve("events.jsonl");
    }

    public Path workspaceDir(String runId) {
        return createDirectories(runDir(runId).resolve("workspace"));
    }

    public Path screenshotsDir(String runId) {
        return createDirectories(runDir(runId).resolve("screenshots"));
    }

    public Path snapshotFile(String runId, int iteration) {
        return screenshotsDir(runId).resolve(snapshotName(iteration));
    }

    /**
     * URL under which {@link #snapshotFile} is served by the static resource handler.
     */
    public String snapshotUrl(String runId, int iteration) {
        return "/static/runs/" + runId + "/screenshots/" + snapshotName(iteration);
    }

    /**
     * Maps a {@code /static/...} URL back to a file under the storage root, or {@code null}
     * when the URL does not point inside it.
     */
    public Path resolveStaticUrl(String url) {
        if (url == null || !url.startsWith("/static/")) {
            return null;
        }
        Path resolved = root.resolve(url.substring("/static/".length())).normalize();
        return resolved.startsWith(root) ? resolved : null;
    }

    public static boolean isValidRunId(String runId) {
        return runId != null && RUN_ID.matcher(runId).matches() && !runId.contains("..");
    }

    private static String snapshotName(int iteration) {
        return "snap_" + iteration + ".png";
    }

    private static Path createDirectories(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + dir, e);
        }
    }
}
