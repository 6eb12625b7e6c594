package com.ashby.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link JsonRpcSession} against an in-memory peer.
 */
class JsonRpcSessionTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper mapper = new ObjectMapper();
    private QueueTransport transport;
    private JsonRpcSession session;

    @BeforeEach
    void setUp() {
        transport = new QueueTransport("proc-1");
        session = new JsonRpcSession(transport, mapper, new ProtocolProperties());
        session.start();
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    private JsonNode nextRequest() throws Exception {
        return mapper.readTree(transport.nextSent());
    }

    private void respond(JsonNode request, String resultJson) {
        transport.reply("{\"jsonrpc\":\"2.0\",\"id\":" + request.get("id").asLong() + ",\"result\":" + resultJson + "}");
    }

    private HandshakeResult handshake() throws Exception {
        CompletableFuture<HandshakeResult> result = CompletableFuture.supplyAsync(() -> session.initialize(TIMEOUT));
        JsonNode init = nextRequest();
        respond(init, "{\"protocolVersion\":\"2024-11-05\",\"capabilities\":{\"tools\":{}},"
                + "\"serverInfo\":{\"name\":\"memory\",\"version\":\"0.6.0\"}}");
        HandshakeResult handshake = result.get(5, TimeUnit.SECONDS);
        assertEquals("notifications/initialized", nextRequest().get("method").asText());
        return handshake;
    }

    @Nested
    @DisplayName("handshake")
    class HandshakeTests {

        @Test
        @DisplayName("initialize sends client info and returns the server's answer")
        void initializeExchange() throws Exception {
            CompletableFuture<HandshakeResult> result = CompletableFuture.supplyAsync(() -> session.initialize(TIMEOUT));

            JsonNode init = nextRequest();
            assertEquals("2.0", init.get("jsonrpc").asText());
            assertEquals("initialize", init.get("method").asText());
            assertEquals("2024-11-05", init.at("/params/protocolVersion").asText());
            assertEquals("ashby", init.at("/params/clientInfo/name").asText());

            respond(init, "{\"protocolVersion\":\"2024-11-05\",\"capabilities\":{},"
                    + "\"serverInfo\":{\"name\":\"memory\",\"version\":\"0.6.0\"}}");
            HandshakeResult handshake = result.get(5, TimeUnit.SECONDS);

            assertEquals("memory", handshake.serverName());
            assertEquals("0.6.0", handshake.serverVersion());
            JsonNode initialized = nextRequest();
            assertEquals("notifications/initialized", initialized.get("method").asText());
            assertFalse(initialized.has("id"));
            assertTrue(session.isReady());
        }

        @Test
        @DisplayName("calls before the handshake are rejected without touching the transport")
        void callBeforeInitialize() {
            assertThrows(ProtocolUsageException.class, () -> session.call("tools/list", Map.of(), TIMEOUT));
            assertTrue(transport.nothingSent());
        }

        @Test
        @DisplayName("a second initialize is a usage error")
        void initializeTwice() throws Exception {
            handshake();
            assertThrows(ProtocolUsageException.class, () -> session.initialize(TIMEOUT));
        }

        @Test
        @DisplayName("a result without protocolVersion fails the handshake")
        void invalidInitializeResult() throws Exception {
            CompletableFuture<HandshakeResult> result = CompletableFuture.supplyAsync(() -> session.initialize(TIMEOUT));
            respond(nextRequest(), "{\"serverInfo\":{\"name\":\"x\"}}");

            var e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
            assertInstanceOf(HandshakeException.class, e.getCause());
            assertFalse(session.isReady());
        }

        @Test
        @DisplayName("missing serverInfo fields read as unknown")
        void partialServerInfo() throws Exception {
            CompletableFuture<HandshakeResult> result = CompletableFuture.supplyAsync(() -> session.initialize(TIMEOUT));
            respond(nextRequest(), "{\"protocolVersion\":\"2024-11-05\",\"serverInfo\":{\"name\":\"fetch\"}}");

            HandshakeResult handshake = result.get(5, TimeUnit.SECONDS);
            assertEquals("fetch", handshake.serverName());
            assertEquals("unknown", handshake.serverVersion());
            assertTrue(handshake.capabilities().isEmpty());
        }

        @Test
        @DisplayName("initialize on an unresponsive server times out")
        void initializeTimeout() {
            assertThrows(RpcTimeoutException.class, () -> session.initialize(Duration.ofMillis(100)));
        }
    }

    @Nested
    @DisplayName("request correlation")
    class CorrelationTests {

        @Test
        @DisplayName("responses in reverse order reach the right callers")
        void reverseOrderResponses() throws Exception {
            handshake();

            CompletableFuture<Object> first = CompletableFuture.supplyAsync(() -> session.call("a", Map.of(), TIMEOUT));
            JsonNode requestA = nextRequest();
            CompletableFuture<Object> second = CompletableFuture.supplyAsync(() -> session.call("b", Map.of(), TIMEOUT));
            JsonNode requestB = nextRequest();
            assertNotEquals(requestA.get("id").asLong(), requestB.get("id").asLong());

            respond(requestB, "{\"from\":\"b\"}");
            respond(requestA, "{\"from\":\"a\"}");

            assertEquals(Map.of("from", "a"), first.get(5, TimeUnit.SECONDS));
            assertEquals(Map.of("from", "b"), second.get(5, TimeUnit.SECONDS));
            assertEquals(0, session.pendingCount());
        }

        @Test
        @DisplayName("a late response for a timed-out request is dropped")
        void lateResponseDropped() throws Exception {
            handshake();

            assertThrows(RpcTimeoutException.class, () -> session.call("slow", Map.of(), Duration.ofMillis(100)));
            JsonNode slow = nextRequest();
            assertEquals(0, session.pendingCount());

            respond(slow, "{\"late\":true}");

            CompletableFuture<Object> next = CompletableFuture.supplyAsync(() -> session.call("fast", Map.of(), TIMEOUT));
            JsonNode fast = nextRequest();
            respond(fast, "{\"late\":false}");
            assertEquals(Map.of("late", false), next.get(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("error responses surface as RemoteErrorException")
        void remoteError() throws Exception {
            handshake();

            CompletableFuture<Object> call = CompletableFuture.supplyAsync(
                    () -> session.callTool("read_graph", Map.of(), TIMEOUT));
            JsonNode request = nextRequest();
            assertEquals("tools/call", request.get("method").asText());
            assertEquals("read_graph", request.at("/params/name").asText());
            transport.reply("{\"jsonrpc\":\"2.0\",\"id\":" + request.get("id").asLong()
                    + ",\"error\":{\"code\":-32602,\"message\":\"bad arguments\"}}");

            var e = assertThrows(ExecutionException.class, () -> call.get(5, TimeUnit.SECONDS));
            var remote = assertInstanceOf(RemoteErrorException.class, e.getCause());
            assertEquals(-32602, remote.getCode());
            assertEquals("bad arguments", remote.getRemoteMessage());
        }

        @Test
        @DisplayName("malformed frames are skipped and later frames still delivered")
        void malformedFrameSkipped() throws Exception {
            handshake();

            CompletableFuture<Object> call = CompletableFuture.supplyAsync(() -> session.call("x", Map.of(), TIMEOUT));
            JsonNode request = nextRequest();
            transport.raw("this is not json\n");
            respond(request, "{\"ok\":true}");

            assertEquals(Map.of("ok", true), call.get(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("server notifications do not disturb pending calls")
        void notificationIgnored() throws Exception {
            handshake();

            CompletableFuture<Object> call = CompletableFuture.supplyAsync(() -> session.call("x", Map.of(), TIMEOUT));
            JsonNode request = nextRequest();
            transport.reply("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/message\",\"params\":{\"level\":\"info\"}}");
            respond(request, "{\"ok\":true}");

            assertEquals(Map.of("ok", true), call.get(5, TimeUnit.SECONDS));
            assertEquals(0, session.pendingCount());
        }

        @Test
        @DisplayName("listTools decodes names and descriptions")
        void listTools() throws Exception {
            handshake();

            CompletableFuture<List<ToolDescriptor>> tools = CompletableFuture.supplyAsync(() -> session.listTools(TIMEOUT));
            respond(nextRequest(), "{\"tools\":[{\"name\":\"read_graph\",\"description\":\"Read the graph\"},"
                    + "{\"name\":\"create_entities\"}]}");

            assertEquals(List.of(new ToolDescriptor("read_graph", "Read the graph"),
                    new ToolDescriptor("create_entities", "")), tools.get(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("server ping is answered")
        void answersPing() throws Exception {
            handshake();

            transport.reply("{\"jsonrpc\":\"2.0\",\"id\":\"srv-1\",\"method\":\"ping\"}");

            JsonNode pong = nextRequest();
            assertEquals("srv-1", pong.get("id").asText());
            assertTrue(pong.has("result"));
        }
    }

    @Nested
    @DisplayName("close")
    class CloseTests {

        @Test
        @DisplayName("peer EOF fails every pending request with TransportClosedException")
        void eofFailsPending() throws Exception {
            handshake();

            CompletableFuture<Object> a = CompletableFuture.supplyAsync(() -> session.call("a", Map.of(), TIMEOUT));
            CompletableFuture<Object> b = CompletableFuture.supplyAsync(() -> session.call("b", Map.of(), TIMEOUT));
            nextRequest();
            nextRequest();

            transport.hangUp();

            var ea = assertThrows(ExecutionException.class, () -> a.get(5, TimeUnit.SECONDS));
            var eb = assertThrows(ExecutionException.class, () -> b.get(5, TimeUnit.SECONDS));
            assertInstanceOf(TransportClosedException.class, ea.getCause());
            assertInstanceOf(TransportClosedException.class, eb.getCause());
            assertEquals(0, session.pendingCount());
        }

        @Test
        @DisplayName("calls after close fail fast")
        void callAfterClose() throws Exception {
            handshake();
            session.close();

            assertTrue(session.isClosed());
            assertThrows(TransportClosedException.class, () -> session.call("x", Map.of(), TIMEOUT));
            assertFalse(transport.isOpen());
        }
    }
}
