package com.ashby.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: ashby serve
 * <p>
 * Runs Ashby as a long-lived server: the variety monitor ticks, and the REST API accepts gaps,
 * status queries and capability invocations. The web server is enabled by
 * {@link com.ashby.AshbyApplication#main} detecting "serve" in args; {@link CliRunner} then skips
 * picocli so the embedded server keeps the JVM alive.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 ashby serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Ashby server (monitor + REST API)")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode; kept for subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Ashby server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
