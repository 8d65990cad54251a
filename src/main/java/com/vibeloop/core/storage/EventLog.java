package com.vibeloop.core.storage;

import com.vibeloop.core.contracts.EventCodec;
import com.vibeloop.core.contracts.EventCodecException;
import com.vibeloop.core.contracts.RunEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only, newline-delimited JSON log of every event of a run.
 * <p>
 * One file per run ({@code runs/<id>/events.jsonl}). Each append is forced to disk before
 * returning. A failed append is cut back out of the file; a trailing line without a terminating
 * newline (torn write) is ignored by reads and removed by the next append.
 */
@Component
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final RunPaths paths;
    private final EventCodec codec;

    public EventLog(RunPaths paths, EventCodec codec) {
        this.paths = paths;
        this.codec = codec;
    }

    public synchronized void append(RunEvent event) {
        Path file = paths.eventsFile(event.runId());
        byte[] line = (codec.encode(event) + "\n").getBytes(StandardCharsets.UTF_8);
        long committed = -1;
        try {
            Files.createDirectories(file.getParent());
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
                committed = discardTornTail(channel, event.runId());
                channel.position(committed);
                write(channel, ByteBuffer.wrap(line));
                channel.force(false);
            }
        } catch (IOException e) {
            EventLogException failure = new EventLogException("Failed to append event #" + event.seq()
                    + " to log of run " + event.runId(), e);
            if (committed >= 0) {
                truncate(file, committed, failure);
            }
            throw failure;
        }
    }

    void write(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    /**
     * Cuts the file back to its last complete line.
     *
     * @return the size of the file after the cut
     */
    private long discardTornTail(FileChannel channel, String runId) throws IOException {
        long size = channel.size();
        long end = size;
        ByteBuffer one = ByteBuffer.allocate(1);
        while (end > 0) {
            one.clear();
            channel.read(one, end - 1);
            if (one.get(0) == '\n') {
                break;
            }
            end--;
        }
        if (end < size) {
            log.warn("Discarding {} bytes of unterminated data at the end of the log of run {}", size - end, runId);
            channel.truncate(end);
        }
        return end;
    }

    private void truncate(Path file, long size, EventLogException failure) {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            if (channel.size() > size) {
                channel.truncate(size);
                channel.force(false);
            }
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    public List<RunEvent> read(String runId) {
        return read(runId, 0L);
    }

    /**
     * Reads the events of a run with a sequence number greater than {@code afterSeq}.
     *
     * @return events in append order; empty if the run has no log
     */
    public List<RunEvent> read(String runId, long afterSeq) {
        Path file = paths.eventsFile(runId);
        if (!Files.exists(file)) {
            return List.of();
        }

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new EventLogException("Failed to read event log of run " + runId, e);
        }

        List<RunEvent> events = new ArrayList<>();
        int start = 0;
        int lineNo = 0;
        while (start < content.length()) {
            int end = content.indexOf('\n', start);
            if (end < 0) {
                log.warn("Ignoring unterminated trailing line in event log of run {}", runId);
                break;
            }
            lineNo++;
            String line = content.substring(start, end).trim();
            start = end + 1;
            if (line.isEmpty()) {
                continue;
            }
            try {
                RunEvent event = codec.decode(line);
                if (event.seq() > afterSeq) {
                    events.add(event);
                }
            } catch (EventCodecException e) {
                throw new EventLogException("Corrupt event at line " + lineNo
                        + " of run " + runId + ": " + e.getMessage(), e);
            }
        }
        return Collections.unmodifiableList(events);
    }

    public boolean exists(String runId) {
        return RunPaths.isValidRunId(runId) && Files.exists(paths.eventsFile(runId));
    }

    /**
     * Lists run ids that have an event log, oldest first (ids sort by creation time).
     */
    public List<String> listRuns() {
        Path runsDir = paths.runsDir();
        if (!Files.isDirectory(runsDir)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(runsDir)) {
            return dirs.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(this::exists)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new EventLogException("Failed to list runs under " + runsDir, e);
        }
    }
}
