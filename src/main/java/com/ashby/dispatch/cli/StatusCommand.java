package com.ashby.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.Callable;

/**
 * CLI command: ashby status
 * <p>
 * Shows running processes, routed capabilities and acquisition snapshots of a running server.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show processes, capabilities and acquisitions")
@Component
public class StatusCommand implements Callable<Integer> {

    @Option(names = {"--host"}, defaultValue = "localhost", description = "Server host (default: ${DEFAULT-VALUE})")
    String host;

    @Option(names = {"--port"}, defaultValue = "8080", description = "Server port (default: ${DEFAULT-VALUE})")
    int port;

    private final ObjectMapper objectMapper;

    public StatusCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var client = new ServerClient(host, port, objectMapper);
        try {
            printProcesses(client.get("/processes").body());
            printCapabilities(client.get("/capabilities").body());
            printAcquisitions(client.get("/acquisitions").body());
            return 0;
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Ashby server at " + client.baseUrl());
            ConsoleOutput.info("Start the server first: ashby serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (IOException e) {
            ConsoleOutput.error("Status query failed: " + e.getMessage());
            return 1;
        }
    }

    static void printProcesses(JsonNode processes) {
        ConsoleOutput.section("Processes");
        if (processes.isEmpty()) {
            ConsoleOutput.info("No running processes");
            return;
        }
        System.out.printf("  %-10s %-10s %s%n", "ID", "STATUS", "PACKAGE");
        System.out.println("  " + "-".repeat(56));
        for (JsonNode p : processes) {
            System.out.printf("  %-10s %-10s %s%n",
                    p.path("id").asText(), p.path("status").asText(), p.path("package_name").asText());
        }
    }

    static void printCapabilities(JsonNode capabilities) {
        ConsoleOutput.section("Capabilities");
        if (capabilities.isEmpty()) {
            ConsoleOutput.info("No capabilities routed");
            return;
        }
        for (JsonNode name : capabilities) {
            ConsoleOutput.success(name.asText());
        }
    }

    static void printAcquisitions(JsonNode acquisitions) {
        ConsoleOutput.section("Acquisitions");
        if (acquisitions.isEmpty()) {
            ConsoleOutput.info("No acquisitions yet");
            return;
        }
        System.out.printf("  %-20s %-12s %-8s %s%n", "CAPABILITY", "STAGE", "ATTEMPT", "DETAIL");
        System.out.println("  " + "-".repeat(72));
        for (JsonNode a : acquisitions) {
            JsonNode failure = a.path("failure");
            String detail = failure.isMissingNode() || failure.isNull()
                    ? a.path("package_name").asText("-")
                    : failure.path("kind").asText() + ": " + truncate(failure.path("detail").asText(), 40);
            System.out.printf("  %-20s %-12s %-8d %s%n",
                    a.path("capability").asText(), a.path("stage").asText(), a.path("attempt").asInt(), detail);
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
