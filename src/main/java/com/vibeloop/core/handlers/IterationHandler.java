package com.vibeloop.core.handlers;

import com.vibeloop.core.browser.ScreenshotCapturer;
import com.vibeloop.core.contracts.PromptCommand;
import com.vibeloop.core.contracts.Route;
import com.vibeloop.core.llm.ModelClient;
import com.vibeloop.core.llm.ModelResponse;
import com.vibeloop.core.storage.RunPaths;
import com.vibeloop.core.storage.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * External work of one iteration: the model exchange, then the workspace update and screenshot.
 * <p>
 * Both collaborator calls go through {@link RetryPolicy}. Results are returned to the run loop,
 * which alone turns them into events; this class never touches the bus or the log.
 */
@Service
public class IterationHandler {

    private static final Logger log = LoggerFactory.getLogger(IterationHandler.class);

    private final ModelClient modelClient;
    private final ScreenshotCapturer screenshotCapturer;
    private final WorkspaceManager workspaceManager;
    private final RunPaths paths;
    private final RetryPolicy retryPolicy;

    public IterationHandler(ModelClient modelClient,
                            ScreenshotCapturer screenshotCapturer,
                            WorkspaceManager workspaceManager,
                            RunPaths paths,
                            RetryPolicy retryPolicy) {
        this.modelClient = modelClient;
        this.screenshotCapturer = screenshotCapturer;
        this.workspaceManager = workspaceManager;
        this.paths = paths;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Sends the prompt to the model it is routed to.
     *
     * @throws FatalCollaboratorException on a non-transient failure or exhausted retries
     */
    public ModelResponse exchange(String runId, int iteration, PromptCommand prompt) {
        String where = "model." + prompt.routeTo().wireName();
        ModelResponse response = retryPolicy.execute(where,
                () -> modelClient.exchange(prompt.routeTo(), prompt.content()));
        log.info("Iteration {}: {} model answered ({} chars)",
                iteration, response.responder().wireName(), response.text().length());
        return response;
    }

    /**
     * Applies the response to the run's workspace page and screenshots it.
     *
     * @return URL of the screenshot under {@code /static}
     * @throws FatalCollaboratorException on a non-transient failure or exhausted retries
     */
    public String capture(String runId, int iteration, ModelResponse response) {
        Path page;
        try {
            page = response.responder() == Route.CODE
                    ? workspaceManager.applyCodeResponse(runId, iteration, response.text())
                    : workspaceManager.markIteration(runId, iteration);
        } catch (UncheckedIOException e) {
            throw new FatalCollaboratorException("workspace", "Failed to update workspace: " + e.getMessage(), e);
        }

        Path output = paths.snapshotFile(runId, iteration);
        retryPolicy.execute("screenshot", () -> {
            screenshotCapturer.capture(page, output);
            return output;
        });
        String url = paths.snapshotUrl(runId, iteration);
        log.info("Iteration {}: screenshot captured at {}", iteration, url);
        return url;
    }
}
