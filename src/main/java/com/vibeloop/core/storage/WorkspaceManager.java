package com.vibeloop.core.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Maintains the page being iterated on ({@code workspace/index.html}) for each run.
 */
@Component
public class WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    static final String INITIAL_PAGE =
            "<!doctype html><title>Vibe</title><h1>Vibe</h1><div id='app'></div>";

    private static final Pattern HTML_BLOCK =
            Pattern.compile("```html\\s*\\n(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private final RunPaths paths;

    public WorkspaceManager(RunPaths paths) {
        this.paths = paths;
    }

    public Path ensureIndex(String runId) {
        Path index = paths.workspaceDir(runId).resolve("index.html");
        if (!Files.exists(index)) {
            write(index, INITIAL_PAGE);
        }
        return index;
    }

    /**
     * Applies a code response to the workspace page. A fenced {@code html} block replaces
     * the page; anything else appends an iteration marker (once per iteration).
     *
     * @return the page to render
     */
    public Path applyCodeResponse(String runId, int iteration, String responseText) {
        Path index = ensureIndex(runId);
        Optional<String> html = extractHtml(responseText);
        if (html.isPresent()) {
            write(index, html.get());
            log.debug("Replaced workspace page for iteration {} ({} chars)", iteration, html.get().length());
            return index;
        }
        return appendMarker(index, iteration);
    }

    /**
     * Leaves the page content unchanged apart from the iteration marker.
     */
    public Path markIteration(String runId, int iteration) {
        return appendMarker(ensureIndex(runId), iteration);
    }

    /**
     * Shallow listing of a run's workspace, sorted by name, hidden files skipped.
     */
    public List<FileEntry> listFiles(String runId) {
        Path root = paths.runDir(runId).resolve("workspace");
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(root)) {
            List<FileEntry> entries = new ArrayList<>();
            for (Path p : children.sorted(Comparator.comparing(Path::getFileName)).toList()) {
                if (p.getFileName().toString().startsWith(".")) {
                    continue;
                }
                BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
                entries.add(new FileEntry(
                        root.relativize(p).toString(),
                        attrs.isDirectory(),
                        attrs.isDirectory() ? 0 : attrs.size(),
                        attrs.lastModifiedTime().toInstant().getEpochSecond()));
            }
            return entries;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list workspace of run " + runId, e);
        }
    }

    static Optional<String> extractHtml(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = HTML_BLOCK.matcher(text);
        return m.find() ? Optional.of(m.group(1).trim()) : Optional.empty();
    }

    private Path appendMarker(Path index, int iteration) {
        String marker = "\n<!-- iter:" + iteration + " -->\n";
        try {
            String html = Files.readString(index);
            if (!html.contains(marker)) {
                write(index, html + marker);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read workspace page " + index, e);
        }
        return index;
    }

    private static void write(Path file, String content) {
        try {
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write workspace page " + file, e);
        }
    }
}
