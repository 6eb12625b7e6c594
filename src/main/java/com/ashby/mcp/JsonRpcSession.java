package com.ashby.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 client bound to a single {@link Transport}.
 * <p>
 * Each call gets the next id from a per-session counter and a {@link PendingRequest} entry; the
 * caller blocks until a response with that id arrives or its deadline passes. Responses are
 * matched strictly by id, so out-of-order delivery is fine. A response for an id that is no longer
 * pending (timed out, or never issued) is logged and dropped. When the transport reaches EOF or is
 * closed, every pending request fails with {@link TransportClosedException}.
 * <p>
 * {@link #initialize} must be the first call on the session and may be issued only once.
 */
public class JsonRpcSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcSession.class);

    static final String METHOD_INITIALIZE = "initialize";
    static final String METHOD_INITIALIZED = "notifications/initialized";
    static final String METHOD_TOOLS_LIST = "tools/list";
    static final String METHOD_TOOLS_CALL = "tools/call";
    static final String METHOD_PING = "ping";

    private static final int METHOD_NOT_FOUND = -32601;

    enum State { NEW, HANDSHAKING, READY, FAILED, CLOSED }

    /**
     * An outstanding call. At most one per id.
     */
    record PendingRequest(long id, String method, Instant deadline, CompletableFuture<Object> result) {}

    private final Transport transport;
    private final ObjectMapper objectMapper;
    private final ProtocolProperties properties;
    private final AtomicLong nextId = new AtomicLong(1);
    private final ConcurrentHashMap<Long, PendingRequest> pending = new ConcurrentHashMap<>();
    private final LineFramer framer;
    private final Object stateLock = new Object();

    private volatile State state = State.NEW;
    private volatile HandshakeResult handshake;
    private Thread reader;

    public JsonRpcSession(Transport transport, ObjectMapper objectMapper, ProtocolProperties properties) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.framer = new LineFramer(properties.getMaxLineBytes());
    }

    /**
     * Starts the reader thread. Must be called once before any request is issued.
     */
    public void start() {
        reader = new Thread(this::readLoop, "rpc-reader-" + transport.id());
        reader.setDaemon(true);
        reader.start();
    }

    public String transportId() {
        return transport.id();
    }

    public boolean isReady() {
        return state == State.READY;
    }

    public boolean isClosed() {
        return state == State.CLOSED;
    }

    public HandshakeResult handshakeResult() {
        return handshake;
    }

    public int pendingCount() {
        return pending.size();
    }

    // -- Handshake ----------------------------------------------------------------

    /**
     * Performs the protocol handshake: {@code initialize} followed by the
     * {@code notifications/initialized} notification.
     *
     * @throws ProtocolUsageException if the session was already initialized (or is being initialized)
     * @throws HandshakeException     if the server's answer is not a valid initialize result
     */
    public HandshakeResult initialize(Duration timeout) {
        synchronized (stateLock) {
            if (state == State.CLOSED) {
                throw new TransportClosedException("Transport " + transport.id() + " is closed");
            }
            if (state != State.NEW) {
                throw new ProtocolUsageException("initialize already issued on transport " + transport.id());
            }
            state = State.HANDSHAKING;
        }

        var params = new LinkedHashMap<String, Object>();
        params.put("protocolVersion", properties.getProtocolVersion());
        params.put("capabilities", Map.of());
        params.put("clientInfo", Map.of(
                "name", properties.getClientName(),
                "version", properties.getClientVersion()));

        try {
            Object result = send(METHOD_INITIALIZE, params, timeout);
            HandshakeResult parsed = parseHandshake(result);
            sendNotification(METHOD_INITIALIZED, null);
            synchronized (stateLock) {
                if (state == State.HANDSHAKING) {
                    state = State.READY;
                }
            }
            handshake = parsed;
            log.info("Handshake with {} complete: server {} {} (protocol {})", transport.id(),
                    parsed.serverName(), parsed.serverVersion(), parsed.protocolVersion());
            return parsed;
        } catch (RuntimeException e) {
            synchronized (stateLock) {
                if (state == State.HANDSHAKING) {
                    state = State.FAILED;
                }
            }
            throw e;
        }
    }

    @SuppressWarnings("unchecked")
    private HandshakeResult parseHandshake(Object result) {
        if (!(result instanceof Map<?, ?> map)) {
            throw new HandshakeException("initialize result from " + transport.id() + " is not an object");
        }
        Object version = map.get("protocolVersion");
        if (!(version instanceof String v) || v.isBlank()) {
            throw new HandshakeException("initialize result from " + transport.id() + " has no protocolVersion");
        }
        String name = "unknown";
        String serverVersion = "unknown";
        if (map.get("serverInfo") instanceof Map<?, ?> info) {
            Object n = info.get("name");
            Object sv = info.get("version");
            name = n != null ? n.toString() : "unknown";
            serverVersion = sv != null ? sv.toString() : "unknown";
        }
        Map<String, Object> caps = map.get("capabilities") instanceof Map<?, ?> c
                ? (Map<String, Object>) c : Map.of();
        return new HandshakeResult(v, name, serverVersion, caps);
    }

    // -- Requests -----------------------------------------------------------------

    /**
     * Issues a request and waits for its response.
     *
     * @return the response's {@code result} value as decoded by Jackson
     * @throws ProtocolUsageException if the handshake has not completed
     * @throws RpcTimeoutException    if no response arrives within {@code timeout}
     * @throws TransportClosedException if the transport closes first
     * @throws RemoteErrorException   if the server answers with an error object
     */
    public Object call(String method, Object params, Duration timeout) {
        if (METHOD_INITIALIZE.equals(method)) {
            throw new ProtocolUsageException("use initialize() for the handshake");
        }
        requireReady();
        return send(method, params, timeout);
    }

    /**
     * Fire-and-forget notification; no pending entry is created.
     */
    public void notify(String method, Object params) {
        requireReady();
        sendNotification(method, params);
    }

    public List<ToolDescriptor> listTools(Duration timeout) {
        Object result = call(METHOD_TOOLS_LIST, Map.of(), timeout);
        var tools = new ArrayList<ToolDescriptor>();
        if (result instanceof Map<?, ?> map && map.get("tools") instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> tool && tool.get("name") instanceof String name) {
                    Object description = tool.get("description");
                    tools.add(new ToolDescriptor(name, description != null ? description.toString() : ""));
                }
            }
        }
        return tools;
    }

    public Object callTool(String toolName, Map<String, Object> arguments, Duration timeout) {
        var params = new LinkedHashMap<String, Object>();
        params.put("name", toolName);
        params.put("arguments", arguments != null ? arguments : Map.of());
        return call(METHOD_TOOLS_CALL, params, timeout);
    }

    private void requireReady() {
        State current = state;
        if (current == State.CLOSED) {
            throw new TransportClosedException("Transport " + transport.id() + " is closed");
        }
        if (current != State.READY) {
            throw new ProtocolUsageException("Transport " + transport.id()
                    + " has not completed the handshake (state " + current + ")");
        }
    }

    private Object send(String method, Object params, Duration timeout) {
        long id = nextId.getAndIncrement();
        var request = new PendingRequest(id, method, Instant.now().plus(timeout), new CompletableFuture<>());
        pending.put(id, request);

        // close() may have drained the table between the state check and the put
        if (state == State.CLOSED) {
            pending.remove(id);
            throw new TransportClosedException("Transport " + transport.id() + " is closed");
        }

        try {
            writeFrame(new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, method, id, params));
        } catch (RuntimeException e) {
            pending.remove(id);
            throw e;
        }

        try {
            return request.result().get(Math.max(timeout.toMillis(), 1), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.remove(id);
            log.warn("Request {} '{}' on {} timed out after {}ms", id, method, transport.id(), timeout.toMillis());
            throw new RpcTimeoutException(method, timeout);
        } catch (InterruptedException e) {
            pending.remove(id);
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted waiting for '" + method + "' on " + transport.id(), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new RpcException("Request '" + method + "' failed", e.getCause());
        }
    }

    private void sendNotification(String method, Object params) {
        writeFrame(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION, method, params));
    }

    private void writeFrame(Object frame) {
        String json;
        try {
            json = objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new RpcException("Cannot encode frame for " + transport.id() + ": " + e.getMessage(), e);
        }
        log.trace("--> {}: {}", transport.id(), json);
        transport.send((json + "\n").getBytes(StandardCharsets.UTF_8));
    }

    // -- Inbound ------------------------------------------------------------------

    private void readLoop() {
        byte[] buffer = new byte[8192];
        String reason = "end of stream";
        try {
            var in = transport.input();
            int n;
            while ((n = in.read(buffer)) != -1) {
                for (String line : framer.feed(buffer, 0, n)) {
                    handleLine(line);
                }
            }
        } catch (IOException e) {
            reason = e.getMessage();
            if (state != State.CLOSED) {
                log.debug("Read from {} failed: {}", transport.id(), e.getMessage());
            }
        } catch (RuntimeException e) {
            reason = e.getMessage();
            log.error("Reader for {} stopped unexpectedly", transport.id(), e);
        }
        closeInternal("transport " + transport.id() + " closed (" + reason + ")");
    }

    /**
     * Dispatches a single inbound line. Malformed frames are discarded.
     */
    void handleLine(String line) {
        if (line.isBlank()) {
            return;
        }
        log.trace("<-- {}: {}", transport.id(), line);
        McpSchema.JSONRPCMessage message;
        try {
            message = McpSchema.deserializeJsonRpcMessage(objectMapper, line);
        } catch (Exception e) {
            log.warn("Discarding malformed frame from {}: {}", transport.id(), abbreviate(line));
            return;
        }

        if (message instanceof McpSchema.JSONRPCResponse response) {
            handleResponse(response);
        } else if (message instanceof McpSchema.JSONRPCRequest request) {
            handleServerRequest(request);
        } else if (message instanceof McpSchema.JSONRPCNotification notification) {
            log.debug("Notification from {}: {}", transport.id(), notification.method());
        }
    }

    private void handleResponse(McpSchema.JSONRPCResponse response) {
        Long id = toId(response.id());
        if (id == null) {
            log.warn("Discarding response without numeric id from {}", transport.id());
            return;
        }
        PendingRequest request = pending.remove(id);
        if (request == null) {
            log.debug("Dropping response for unknown or expired id {} from {}", id, transport.id());
            return;
        }
        if (response.error() != null) {
            var error = response.error();
            request.result().completeExceptionally(
                    new RemoteErrorException(error.code(), error.message(), error.data()));
        } else {
            request.result().complete(response.result());
        }
    }

    private void handleServerRequest(McpSchema.JSONRPCRequest request) {
        try {
            if (METHOD_PING.equals(request.method())) {
                writeFrame(new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), Map.of(), null));
                return;
            }
            log.debug("Rejecting server request '{}' from {}", request.method(), transport.id());
            writeFrame(new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), null,
                    new McpSchema.JSONRPCResponse.JSONRPCError(METHOD_NOT_FOUND,
                            "Method not supported by client: " + request.method(), null)));
        } catch (RpcException e) {
            log.debug("Could not answer server request on {}: {}", transport.id(), e.getMessage());
        }
    }

    private static Long toId(Object raw) {
        if (raw instanceof Number number) {
            return number.longValue();
        }
        if (raw instanceof String s) {
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String abbreviate(String line) {
        return line.length() <= 200 ? line : line.substring(0, 197) + "...";
    }

    // -- Shutdown -----------------------------------------------------------------

    /**
     * Closes the transport and fails every pending request with {@link TransportClosedException}.
     * Idempotent.
     */
    @Override
    public void close() {
        closeInternal("transport " + transport.id() + " closed");
    }

    private void closeInternal(String reason) {
        synchronized (stateLock) {
            if (state == State.CLOSED) {
                return;
            }
            state = State.CLOSED;
        }
        int failed = 0;
        for (Long id : List.copyOf(pending.keySet())) {
            PendingRequest request = pending.remove(id);
            if (request != null) {
                request.result().completeExceptionally(new TransportClosedException(reason));
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("{}: failed {} pending request(s)", reason, failed);
        } else {
            log.debug(reason);
        }
        transport.close();
    }
}
