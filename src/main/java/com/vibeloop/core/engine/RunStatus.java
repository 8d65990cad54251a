package com.vibeloop.core.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Point-in-time view of a run, safe to read from any thread.
 *
 * @param runId      the run
 * @param state      lifecycle state
 * @param iteration  number of completed iterations
 * @param lastSeq    sequence number of the last emitted event, 0 if none
 * @param createdAt  run creation time
 */
public record RunStatus(
    @JsonProperty("run_id") String runId,
    RunState state,
    int iteration,
    @JsonProperty("last_seq") long lastSeq,
    @JsonProperty("created_at") Instant createdAt
) {}
