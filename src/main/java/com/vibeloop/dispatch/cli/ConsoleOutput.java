package com.vibeloop.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) VIBE LOOP v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [VIBE]|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void event(long seq, String eventType, String summary) {
        String label = switch (eventType) {
            case "run.started" -> "@|bold,fg(cyan) [RUN]|@";
            case "prompt.sent" -> "@|fg(blue) [PROMPT]|@";
            case "response.received" -> "@|fg(magenta) [RESPONSE]|@";
            case "screenshot.captured" -> "@|fg(green) [SCREENSHOT]|@";
            case "control.paused", "control.resumed" -> "@|fg(yellow) [CONTROL]|@";
            case "error" -> "@|fg(red),bold [ERROR]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("  %4d ", seq) + label + " " + summary));
    }
}
