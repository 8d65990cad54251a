package com.vibeloop.dispatch.cli;

import com.vibeloop.core.contracts.ControlPaused;
import com.vibeloop.core.contracts.ControlResumed;
import com.vibeloop.core.contracts.ErrorOccurred;
import com.vibeloop.core.contracts.PromptSent;
import com.vibeloop.core.contracts.ResponseReceived;
import com.vibeloop.core.contracts.RunEvent;
import com.vibeloop.core.contracts.RunStarted;
import com.vibeloop.core.contracts.ScreenshotCaptured;
import com.vibeloop.core.llm.ContentParts;
import com.vibeloop.core.storage.EventLog;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: vibeloop log &lt;run-id&gt;
 * <p>
 * Prints the recorded event history of a run in sequence order.
 */
@Command(name = "log", mixinStandardHelpOptions = true, description = "Show a run's event log")
@Component
public class LogCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    private final EventLog eventLog;

    public LogCommand(EventLog eventLog) {
        this.eventLog = eventLog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (!eventLog.exists(runId)) {
            ConsoleOutput.error("No event log found for run: " + runId);
            return;
        }

        List<RunEvent> events = eventLog.read(runId);
        ConsoleOutput.info("Event log for run " + runId + " (" + events.size() + " events)");
        System.out.println();

        for (RunEvent event : events) {
            ConsoleOutput.event(event.seq(), event.type().wireName(), summarize(event));
        }
    }

    static String summarize(RunEvent event) {
        var payload = event.payload();
        if (payload instanceof RunStarted started) {
            return "max iterations " + started.maxIterations();
        } else if (payload instanceof PromptSent sent) {
            return "#" + sent.iteration() + " " + sent.actor().wireName() + " -> " + sent.to().wireName()
                    + ": " + truncate(ContentParts.text(sent.content()), 60);
        } else if (payload instanceof ResponseReceived received) {
            return "#" + received.iteration() + " " + received.actor().wireName() + ": "
                    + truncate(received.text(), 60);
        } else if (payload instanceof ScreenshotCaptured shot) {
            return "#" + shot.iteration() + " " + shot.url();
        } else if (payload instanceof ControlPaused paused) {
            return "after iteration " + paused.iteration();
        } else if (payload instanceof ControlResumed resumed) {
            return "after iteration " + resumed.iteration();
        } else if (payload instanceof ErrorOccurred error) {
            return "[" + error.where() + "] " + error.msg();
        }
        return "";
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String oneLine = s.replace('\n', ' ');
        return oneLine.length() <= max ? oneLine : oneLine.substring(0, max - 3) + "...";
    }
}
