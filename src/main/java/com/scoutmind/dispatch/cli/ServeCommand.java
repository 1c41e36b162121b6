package com.scoutmind.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: scoutmind serve
 * <p>
 * Starts Scoutmind as a long-running HTTP server exposing the research API
 * and SSE progress streams. The web server is enabled by
 * {@link com.scoutmind.ScoutmindApplication#main} detecting "serve" in args,
 * and {@link CliRunner} skips picocli in that mode. The startup banner is
 * printed once the embedded server reports its port.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 scoutmind serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Scoutmind HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached via --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Scoutmind server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1/research");
        System.out.println("  Reports:    http://localhost:" + port + "/api/v1/reports");
        System.out.println("  Health:     http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
