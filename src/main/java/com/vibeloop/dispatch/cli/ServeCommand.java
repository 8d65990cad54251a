package com.vibeloop.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: vibeloop serve
 * <p>
 * Starts the HTTP server exposing the control API and the SSE event stream. The web server is
 * enabled by {@link com.vibeloop.VibeLoopApplication#main} detecting "serve" in args; the banner
 * is printed once the server is listening.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; CliRunner skips picocli when serving.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Server running on port " + port);
        System.out.println();
        System.out.println("  Events:   http://localhost:" + port + "/api/events");
        System.out.println("  Runs:     http://localhost:" + port + "/api/runs");
        System.out.println("  Control:  POST http://localhost:" + port + "/api/control");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
