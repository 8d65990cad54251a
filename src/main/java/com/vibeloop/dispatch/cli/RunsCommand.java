package com.vibeloop.dispatch.cli;

import com.vibeloop.core.contracts.RunEvent;
import com.vibeloop.core.contracts.ScreenshotCaptured;
import com.vibeloop.core.storage.EventLog;
import com.vibeloop.core.storage.EventLogException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: vibeloop runs
 * <p>
 * Lists runs found in storage as a table: Run ID | Events | Iterations | Outcome.
 */
@Command(name = "runs", mixinStandardHelpOptions = true, description = "List recorded runs")
@Component
public class RunsCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final EventLog eventLog;

    public RunsCommand(EventLog eventLog) {
        this.eventLog = eventLog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<String> runIds = eventLog.listRuns();
        if (runIds.isEmpty()) {
            ConsoleOutput.info("No runs found.");
            return;
        }

        List<String> display = runIds.size() > limit
                ? runIds.subList(runIds.size() - limit, runIds.size())
                : runIds;

        ConsoleOutput.info("Runs (" + display.size() + " of " + runIds.size() + "):");
        System.out.println();
        System.out.printf("  %-32s %-8s %-11s %s%n", "RUN ID", "EVENTS", "ITERATIONS", "LAST EVENT");
        System.out.println("  " + "-".repeat(72));

        for (String runId : display) {
            try {
                List<RunEvent> events = eventLog.read(runId);
                long iterations = events.stream()
                        .filter(e -> e.payload() instanceof ScreenshotCaptured)
                        .count();
                String last = events.isEmpty() ? "-" : events.get(events.size() - 1).type().wireName();
                System.out.printf("  %-32s %-8d %-11d %s%n", runId, events.size(), iterations, last);
            } catch (EventLogException e) {
                System.out.printf("  %-32s %-8s %-11s %s%n", runId, "?", "?", "unreadable: " + e.getMessage());
            }
        }
    }
}
