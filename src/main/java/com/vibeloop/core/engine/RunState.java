package com.vibeloop.core.engine;

/**
 * Lifecycle state of a run.
 */
public enum RunState {
    IDLE,
    RUNNING,
    PAUSED,
    STOPPED      // terminal: budget exhausted or fatal error
}
