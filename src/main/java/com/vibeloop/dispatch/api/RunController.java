package com.vibeloop.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.vibeloop.core.contracts.EventCodec;
import com.vibeloop.core.engine.RunManager;
import com.vibeloop.core.engine.RunStatus;
import com.vibeloop.core.storage.EventLog;
import com.vibeloop.core.storage.FileEntry;
import com.vibeloop.core.storage.WorkspaceManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for run lifecycle and run history.
 */
@RestController
@RequestMapping("/api/runs")
public class RunController {

    private final RunManager runManager;
    private final EventLog eventLog;
    private final EventCodec codec;
    private final WorkspaceManager workspaceManager;

    public RunController(RunManager runManager,
                         EventLog eventLog,
                         EventCodec codec,
                         WorkspaceManager workspaceManager) {
        this.runManager = runManager;
        this.eventLog = eventLog;
        this.codec = codec;
        this.workspaceManager = workspaceManager;
    }

    /**
     * POST /api/runs: start a new run. 409 while another run is running or paused.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> start() {
        RunStatus status = runManager.start();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("run_id", status.runId());
        body.put("state", status.state().name());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    /**
     * GET /api/runs: run ids found in storage plus the current run, if any.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> list() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runs", eventLog.listRuns());
        body.put("current", runManager.currentStatus().orElse(null));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/current")
    public ResponseEntity<RunStatus> current() {
        return runManager.currentStatus()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/runs/{id}/events: the full logged history of a run, in wire format.
     */
    @GetMapping("/{runId}/events")
    public ResponseEntity<List<JsonNode>> events(@PathVariable String runId) {
        if (!eventLog.exists(runId)) {
            return ResponseEntity.notFound().build();
        }
        List<JsonNode> events = eventLog.read(runId).stream()
                .<JsonNode>map(codec::toJson)
                .toList();
        return ResponseEntity.ok(events);
    }

    @GetMapping("/{runId}/files")
    public ResponseEntity<List<FileEntry>> files(@PathVariable String runId) {
        if (!eventLog.exists(runId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(workspaceManager.listFiles(runId));
    }
}
