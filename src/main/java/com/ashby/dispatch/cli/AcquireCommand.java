package com.ashby.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: ashby acquire &lt;capability&gt;... [--severity] [--wait]
 * <p>
 * Reports a gap to a running server. With {@code --wait}, polls the acquisition status until
 * every named capability is REGISTERED or FAILED.
 */
@Command(name = "acquire", mixinStandardHelpOptions = true,
        description = "Report missing capabilities to a running Ashby server")
@Component
public class AcquireCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Capability names, e.g. memory filesystem")
    List<String> capabilities;

    @Option(names = {"--severity", "-s"}, defaultValue = "NORMAL",
            description = "LOW, NORMAL, HIGH or CRITICAL (default: ${DEFAULT-VALUE})")
    String severity;

    @Option(names = {"--wait", "-w"}, description = "Wait until every capability is registered or failed")
    boolean wait;

    @Option(names = {"--timeout"}, defaultValue = "300",
            description = "Seconds to wait with --wait (default: ${DEFAULT-VALUE})")
    int timeoutSeconds;

    @Option(names = {"--host"}, defaultValue = "localhost", description = "Server host (default: ${DEFAULT-VALUE})")
    String host;

    @Option(names = {"--port"}, defaultValue = "8080", description = "Server port (default: ${DEFAULT-VALUE})")
    int port;

    private final ObjectMapper objectMapper;

    public AcquireCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var client = new ServerClient(host, port, objectMapper);

        Map<String, Object> gap = new LinkedHashMap<>();
        gap.put("required_capabilities", capabilities);
        gap.put("severity", severity);
        gap.put("source", "cli");

        try {
            ServerClient.Response response = client.post("/gaps", gap);
            if (response.status() != 202) {
                ConsoleOutput.error("Gap rejected (HTTP " + response.status() + "): "
                        + response.body().path("error").asText(""));
                return 1;
            }
            ConsoleOutput.success("Gap accepted: " + response.body().path("capabilities"));
            if (!wait) {
                return 0;
            }
            return awaitOutcome(client);
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Ashby server at " + client.baseUrl());
            ConsoleOutput.info("Start the server first: ashby serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
            return 1;
        } catch (IOException e) {
            ConsoleOutput.error("Request failed: " + e.getMessage());
            return 1;
        }
    }

    private int awaitOutcome(ServerClient client) throws IOException, InterruptedException {
        Instant deadline = Instant.now().plus(Duration.ofSeconds(timeoutSeconds));
        Map<String, String> lastStage = new HashMap<>();
        Map<String, JsonNode> terminal = new LinkedHashMap<>();

        while (terminal.size() < capabilities.size() && Instant.now().isBefore(deadline)) {
            for (String capability : capabilities) {
                String key = capability.trim().toLowerCase().replace(' ', '_');
                if (terminal.containsKey(key)) {
                    continue;
                }
                ServerClient.Response response = client.get("/acquisitions/" + key);
                if (response.status() == 404) {
                    // already routed before the gap arrived: nothing to acquire
                    if (isRouted(client, key)) {
                        terminal.put(key, response.body());
                        ConsoleOutput.stage(key, "REGISTERED");
                    }
                    continue;
                }
                String stage = response.body().path("stage").asText();
                if (!stage.equals(lastStage.put(key, stage))) {
                    ConsoleOutput.stage(key, stage);
                }
                if ("REGISTERED".equals(stage) || "FAILED".equals(stage)) {
                    terminal.put(key, response.body());
                }
            }
            if (terminal.size() < capabilities.size()) {
                Thread.sleep(500);
            }
        }

        if (terminal.size() < capabilities.size()) {
            ConsoleOutput.error("Timed out waiting for acquisitions");
            return 1;
        }
        boolean allRegistered = true;
        for (var entry : terminal.entrySet()) {
            JsonNode snapshot = entry.getValue();
            JsonNode failure = snapshot.path("failure");
            if (!failure.isMissingNode() && !failure.isNull()) {
                allRegistered = false;
                ConsoleOutput.error(entry.getKey() + ": " + failure.path("kind").asText()
                        + " at " + failure.path("stage").asText() + ": " + failure.path("detail").asText());
            } else {
                ConsoleOutput.success(entry.getKey() + " → " + snapshot.path("process_id").asText("existing route")
                        + " tool " + snapshot.path("tool").asText("-"));
            }
        }
        return allRegistered ? 0 : 1;
    }

    private boolean isRouted(ServerClient client, String capability) throws IOException, InterruptedException {
        for (JsonNode name : client.get("/capabilities").body()) {
            if (capability.equals(name.asText())) {
                return true;
            }
        }
        return false;
    }
}
