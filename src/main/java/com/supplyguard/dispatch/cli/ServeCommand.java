package com.supplyguard.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: supplyguard serve
 * <p>
 * Starts the REST API. The web server is enabled by
 * {@link com.supplyguard.SupplyGuardApplication#main} detecting "serve" in the
 * arguments, and {@link CliRunner} skips picocli in that mode, so the banner is
 * printed from the {@link WebServerInitializedEvent} once the server is up.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 supplyguard serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the SupplyGuard HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("SupplyGuard server running on port " + port);
        System.out.println();
        System.out.println("  Analysis:  POST http://localhost:" + port + "/api/v1/analysis");
        System.out.println("  By agent:  POST http://localhost:" + port + "/api/v1/analysis/agents/{agent}");
        System.out.println("  Country:   POST http://localhost:" + port + "/api/v1/analysis/country/{name}");
        System.out.println("  Events:    GET  http://localhost:" + port + "/api/v1/analysis/events");
        System.out.println("  Agents:    GET  http://localhost:" + port + "/api/v1/analysis/agents");
        System.out.println("  Health:    GET  http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
