package com.vibeloop.dispatch.api;

import com.vibeloop.core.contracts.CommandValidator;
import com.vibeloop.core.contracts.ControlCommand;
import com.vibeloop.core.contracts.PromptCommand;
import com.vibeloop.core.contracts.ValidationException;
import com.vibeloop.core.engine.RunManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Inbound commands for the active run. Commands are validated here and only enqueued;
 * the run loop applies them between iterations.
 */
@RestController
@RequestMapping("/api")
public class CommandController {

    private static final Logger log = LoggerFactory.getLogger(CommandController.class);

    private final RunManager runManager;

    public CommandController(RunManager runManager) {
        this.runManager = runManager;
    }

    /**
     * POST /api/control: pause or resume the active run.
     */
    @PostMapping("/control")
    public ResponseEntity<Map<String, Object>> control(@RequestBody(required = false) ControlRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        ControlCommand command = CommandValidator.control(request.action());
        runManager.control(command);
        log.debug("Control command accepted: {}", command.action().wireName());
        return ResponseEntity.ok(Map.of("ok", true));
    }

    /**
     * POST /api/prompt: queue a prompt for the next iteration of the active run.
     */
    @PostMapping("/prompt")
    public ResponseEntity<Map<String, Object>> prompt(@RequestBody(required = false) PromptRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        PromptCommand command = CommandValidator.prompt(request.actor(), request.routeTo(), request.content());
        runManager.prompt(command);
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
