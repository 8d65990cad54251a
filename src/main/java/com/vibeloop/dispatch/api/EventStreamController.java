package com.vibeloop.dispatch.api;

import com.vibeloop.core.contracts.ValidationException;
import com.vibeloop.core.engine.RunManager;
import com.vibeloop.core.storage.RunPaths;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Live event stream over Server-Sent Events.
 * <p>
 * Without {@code run_id} the stream follows the current run; when no run exists yet it
 * follows every run live. {@code Last-Event-ID} resumes after the given sequence number.
 */
@RestController
public class EventStreamController {

    private final SseStreamingService sseStreamingService;
    private final RunManager runManager;

    public EventStreamController(SseStreamingService sseStreamingService, RunManager runManager) {
        this.sseStreamingService = sseStreamingService;
        this.runManager = runManager;
    }

    @GetMapping(value = "/api/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestParam(name = "run_id", required = false) String runId,
                             @RequestHeader(name = "Last-Event-ID", required = false) String lastEventId) {
        String target = runId != null && !runId.isBlank()
                ? runId
                : runManager.currentRunId().orElse(null);
        if (target != null && !RunPaths.isValidRunId(target)) {
            throw new ValidationException("Invalid run_id: " + target);
        }
        return sseStreamingService.createEmitter(target, parseLastEventId(lastEventId));
    }

    static long parseLastEventId(String lastEventId) {
        if (lastEventId == null || lastEventId.isBlank()) {
            return 0L;
        }
        try {
            long seq = Long.parseLong(lastEventId.trim());
            if (seq < 0) {
                throw new ValidationException("Last-Event-ID must not be negative: " + lastEventId);
            }
            return seq;
        } catch (NumberFormatException e) {
            throw new ValidationException("Last-Event-ID is not a sequence number: " + lastEventId);
        }
    }
}
