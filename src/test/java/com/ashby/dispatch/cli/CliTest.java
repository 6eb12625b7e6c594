package com.ashby.dispatch.cli;

import com.ashby.core.health.HealthCheckService;
import com.ashby.core.health.HealthStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.ServerSocket;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the Ashby CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private final ObjectMapper objectMapper = new ObjectMapper();

    private CommandLine.IFactory createFactory(List<HealthStatus> health) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == HealthCommand.class) {
                    if (health == null) {
                        return (K) new HealthCommand(null);
                    }
                    HealthCheckService mockHealth = mock(HealthCheckService.class);
                    when(mockHealth.checkAll()).thenReturn(health);
                    return (K) new HealthCommand(mockHealth);
                }
                if (cls == AcquireCommand.class) {
                    return (K) new AcquireCommand(objectMapper);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(objectMapper);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(List.of(), args);
    }

    private CliResult execute(List<HealthStatus> health, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new AshbyCommand(), createFactory(health));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    /** A local port with nothing listening on it. */
    private static int closedPort() throws IOException {
        try (var socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("acquire"), "Help should list 'acquire' subcommand");
            assertTrue(output.contains("status"), "Help should list 'status' subcommand");
            assertTrue(output.contains("health"), "Help should list 'health' subcommand");
            assertTrue(output.contains("serve"), "Help should list 'serve' subcommand");
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Ashby 0.1.0"));
        }

        @Test
        @DisplayName("acquire --help shows acquire options")
        void acquireHelpOutput() {
            CliResult result = execute("acquire", "--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("Report missing capabilities"));
            assertTrue(output.contains("--severity"));
            assertTrue(output.contains("--wait"));
        }

        @Test
        @DisplayName("no subcommand prints usage")
        void noSubcommandPrintsUsage() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage"));
        }
    }

    // =====================================================================
    //  Argument parsing
    // =====================================================================

    @Nested
    @DisplayName("Acquire options")
    class AcquireOptionTests {

        @Test
        @DisplayName("defaults apply when only capabilities are given")
        void defaults() {
            var command = new AcquireCommand(objectMapper);
            new CommandLine(command).parseArgs("memory", "filesystem");

            assertEquals(List.of("memory", "filesystem"), command.capabilities);
            assertEquals("NORMAL", command.severity);
            assertFalse(command.wait);
            assertEquals(300, command.timeoutSeconds);
            assertEquals("localhost", command.host);
            assertEquals(8080, command.port);
        }

        @Test
        @DisplayName("short and long options are parsed")
        void options() {
            var command = new AcquireCommand(objectMapper);
            new CommandLine(command).parseArgs("-s", "HIGH", "-w", "--timeout", "60", "--port", "9090", "memory");

            assertEquals("HIGH", command.severity);
            assertTrue(command.wait);
            assertEquals(60, command.timeoutSeconds);
            assertEquals(9090, command.port);
        }

        @Test
        @DisplayName("acquire without a capability is a usage error")
        void missingCapability() {
            CliResult result = execute("acquire");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    // =====================================================================
    //  Execution against an unreachable server
    // =====================================================================

    @Nested
    @DisplayName("Server unreachable")
    class UnreachableTests {

        @Test
        @DisplayName("acquire exits 1 and tells the user to start the server")
        void acquireWithoutServer() throws IOException {
            CliResult result = execute("acquire", "--port", String.valueOf(closedPort()), "memory");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("ashby serve"));
        }

        @Test
        @DisplayName("status exits 1 without a server")
        void statusWithoutServer() throws IOException {
            CliResult result = execute("status", "--port", String.valueOf(closedPort()));
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Cannot connect") || result.output().contains("failed"));
        }
    }

    // =====================================================================
    //  Health command
    // =====================================================================

    @Nested
    @DisplayName("Health command")
    class HealthTests {

        @Test
        @DisplayName("all components UP exits 0")
        void allUp() {
            CliResult result = execute(List.of(
                    new HealthStatus("monitor", HealthStatus.Status.UP, "Monitor ticking", Map.of()),
                    new HealthStatus("discovery", HealthStatus.Status.UP, "Sources: curated", Map.of())),
                    "health");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("all systems operational"));
        }

        @Test
        @DisplayName("DEGRADED component still exits 0")
        void degraded() {
            CliResult result = execute(List.of(
                    new HealthStatus("monitor", HealthStatus.Status.DEGRADED, "Tick disabled, injection only", Map.of())),
                    "health");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Tick disabled"));
        }

        @Test
        @DisplayName("DOWN component exits 1")
        void down() {
            CliResult result = execute(List.of(
                    new HealthStatus("installRoot", HealthStatus.Status.DOWN, "Not writable: /x", Map.of())),
                    "health");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Not writable"));
        }

        @Test
        @DisplayName("missing health service exits 1")
        void noService() {
            CliResult result = execute((List<HealthStatus>) null, "health");
            assertEquals(1, result.exitCode());
        }
    }

    @Nested
    @DisplayName("Status rendering")
    class StatusRenderingTests {

        @Test
        @DisplayName("processes table shows id, status and package")
        void printProcesses() throws Exception {
            var json = objectMapper.readTree("""
                    [{"id":"proc-1","status":"RUNNING","package_name":"@modelcontextprotocol/server-memory"}]
                    """);
            ByteArrayOutputStream capture = new ByteArrayOutputStream();
            PrintStream originalOut = System.out;
            System.setOut(new PrintStream(capture, true));
            try {
                StatusCommand.printProcesses(json);
            } finally {
                System.setOut(originalOut);
            }
            String output = capture.toString();
            assertTrue(output.contains("proc-1"));
            assertTrue(output.contains("RUNNING"));
            assertTrue(output.contains("@modelcontextprotocol/server-memory"));
        }
    }
}
