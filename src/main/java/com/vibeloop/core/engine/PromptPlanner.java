package com.vibeloop.core.engine;

import com.vibeloop.core.contracts.Actor;
import com.vibeloop.core.contracts.PromptCommand;
import com.vibeloop.core.contracts.Route;
import com.vibeloop.core.llm.ContentParts;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Derives the default prompt of an iteration from the previous one, alternating models:
 * the code model's page is screenshotted and sent to the vision model, whose critique is
 * sent back to the code model.
 */
@Component
public class PromptPlanner {

    static final String CRITIQUE_INSTRUCTION =
            "Critique the rendered page in this screenshot and list the changes to make next.";

    private final RunProperties properties;

    public PromptPlanner(RunProperties properties) {
        this.properties = properties;
    }

    /**
     * @param previous outcome of the previous iteration, or {@code null} for the first one
     */
    public PromptCommand next(IterationOutcome previous) {
        if (previous == null) {
            return new PromptCommand(Actor.USER, Route.CODE,
                    List.of(ContentParts.textPart(properties.getInitialPrompt())));
        }
        Route answered = previous.response().responder();
        if (answered == Route.CODE) {
            return new PromptCommand(answered.asActor(), answered.opposite(), List.of(
                    ContentParts.textPart(CRITIQUE_INSTRUCTION),
                    ContentParts.imagePart(previous.screenshotUrl())));
        }
        return new PromptCommand(answered.asActor(), answered.opposite(),
                List.of(ContentParts.textPart(previous.response().text())));
    }
}
