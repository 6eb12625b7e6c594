package com.ashby.mcp;

import com.ashby.core.events.EventBus;
import com.ashby.core.events.EventTypes;
import com.ashby.core.metrics.AshbyMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Owns one {@link JsonRpcSession} per transport and exposes the protocol operations by transport id.
 * <p>
 * Sessions are opened when the supervisor hands over a transport and closed when the process
 * exits, which fails their outstanding requests with {@link TransportClosedException}.
 */
@Service
public class ProtocolClient {

    private static final Logger log = LoggerFactory.getLogger(ProtocolClient.class);

    private final ObjectMapper objectMapper;
    private final ProtocolProperties properties;
    private final EventBus eventBus;
    private final AshbyMetrics metrics;

    /** transport id → session */
    private final Map<String, JsonRpcSession> sessions = new ConcurrentHashMap<>();

    public ProtocolClient(ObjectMapper objectMapper, ProtocolProperties properties,
                          EventBus eventBus, AshbyMetrics metrics) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    @PostConstruct
    void init() {
        eventBus.subscribe(EventTypes.PROCESS_CRASHED, e -> close(e.processId()));
        eventBus.subscribe(EventTypes.PROCESS_STOPPED, e -> close(e.processId()));
    }

    /**
     * Attaches a new session to the transport and starts reading from it.
     *
     * @throws ProtocolUsageException if a session is already open for this transport
     */
    public JsonRpcSession open(Transport transport) {
        var session = new JsonRpcSession(transport, objectMapper, properties);
        JsonRpcSession existing = sessions.putIfAbsent(transport.id(), session);
        if (existing != null && !existing.isClosed()) {
            throw new ProtocolUsageException("A session is already open on transport " + transport.id());
        }
        if (existing != null) {
            sessions.put(transport.id(), session);
        }
        session.start();
        log.debug("Opened protocol session on {}", transport.id());
        return session;
    }

    public HandshakeResult initialize(String transportId) {
        return initialize(transportId, properties.getHandshakeTimeout());
    }

    public HandshakeResult initialize(String transportId, Duration timeout) {
        return measured("initialize", () -> {
            try {
                return session(transportId).initialize(timeout);
            } catch (RpcTimeoutException e) {
                throw new HandshakeException("Handshake with " + transportId + " timed out", e);
            } catch (RemoteErrorException e) {
                throw new HandshakeException("Handshake with " + transportId + " rejected: "
                        + e.getRemoteMessage(), e);
            }
        });
    }

    public Object call(String transportId, String method, Object params, Duration timeout) {
        return measured(method, () -> session(transportId).call(method, params, timeout));
    }

    public void notify(String transportId, String method, Object params) {
        session(transportId).notify(method, params);
    }

    public List<ToolDescriptor> listTools(String transportId, Duration timeout) {
        return measured(JsonRpcSession.METHOD_TOOLS_LIST, () -> session(transportId).listTools(timeout));
    }

    public Object callTool(String transportId, String toolName, Map<String, Object> arguments, Duration timeout) {
        return measured(JsonRpcSession.METHOD_TOOLS_CALL,
                () -> session(transportId).callTool(toolName, arguments, timeout));
    }

    public Duration defaultTimeout() {
        return properties.getRequestTimeout();
    }

    public Duration handshakeTimeout() {
        return properties.getHandshakeTimeout();
    }

    public boolean hasSession(String transportId) {
        JsonRpcSession session = sessions.get(transportId);
        return session != null && !session.isClosed();
    }

    /**
     * Closes and forgets the session for a transport. Idempotent.
     */
    public void close(String transportId) {
        if (transportId == null) {
            return;
        }
        JsonRpcSession session = sessions.remove(transportId);
        if (session != null) {
            session.close();
            log.info("Protocol session on {} closed", transportId);
        }
    }

    @PreDestroy
    void shutdown() {
        for (String id : List.copyOf(sessions.keySet())) {
            close(id);
        }
    }

    private JsonRpcSession session(String transportId) {
        JsonRpcSession session = sessions.get(transportId);
        if (session == null || session.isClosed()) {
            throw new TransportClosedException("No open session for transport " + transportId);
        }
        return session;
    }

    private <T> T measured(String method, Supplier<T> action) {
        try {
            T result = action.get();
            metrics.recordRpcCall(method, "ok");
            return result;
        } catch (RpcTimeoutException e) {
            metrics.recordRpcCall(method, "timeout");
            throw e;
        } catch (TransportClosedException e) {
            metrics.recordRpcCall(method, "closed");
            throw e;
        } catch (RemoteErrorException e) {
            metrics.recordRpcCall(method, "remote_error");
            throw e;
        } catch (RuntimeException e) {
            metrics.recordRpcCall(method, "error");
            throw e;
        }
    }
}
