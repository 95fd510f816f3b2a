package com.tasklane.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: tasklane serve
 * <p>
 * Starts Tasklane as a long-running HTTP server exposing the REST API and SSE event streams.
 * The web server is enabled by {@link com.tasklane.TasklaneApplication#main} detecting "serve"
 * in the arguments; {@link CliRunner} then skips picocli, and the banner is printed once the
 * embedded server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Tasklane HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached for --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Tasklane server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
