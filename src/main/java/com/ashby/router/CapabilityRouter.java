package com.ashby.router;

import com.ashby.core.events.EventBus;
import com.ashby.core.events.EventTypes;
import com.ashby.core.metrics.AshbyMetrics;
import com.ashby.core.model.CapabilityRoute;
import com.ashby.mcp.ProtocolClient;
import com.ashby.mcp.RemoteErrorException;
import com.ashby.mcp.RpcTimeoutException;
import com.ashby.mcp.TransportClosedException;
import com.ashby.supervisor.ProcessSupervisor;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps capability names to the running process and tool that serve them.
 * <p>
 * A route is only valid while its process is running. Routes are removed eagerly when the
 * supervisor reports an exit and lazily when an invocation finds the transport closed.
 * Route table mutations and lookups are serialized on this instance; the remote call itself
 * runs outside the lock.
 */
@Service
public class CapabilityRouter {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRouter.class);

    private final ProtocolClient protocolClient;
    private final ProcessSupervisor supervisor;
    private final EventBus eventBus;
    private final AshbyMetrics metrics;

    private final Map<String, CapabilityRoute> routes = new LinkedHashMap<>();

    public CapabilityRouter(ProtocolClient protocolClient, ProcessSupervisor supervisor,
                            EventBus eventBus, AshbyMetrics metrics) {
        this.protocolClient = protocolClient;
        this.supervisor = supervisor;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    @PostConstruct
    void init() {
        eventBus.subscribe(EventTypes.PROCESS_CRASHED, e -> invalidateProcess(e.processId()));
        eventBus.subscribe(EventTypes.PROCESS_STOPPED, e -> invalidateProcess(e.processId()));
    }

    /**
     * Routes {@code capability} to {@code toolName} on {@code processId}, replacing any previous route.
     *
     * @throws ProcessUnavailableException if the process is not running
     */
    public synchronized CapabilityRoute register(String capability, String processId, String toolName) {
        if (!supervisor.isRunning(processId)) {
            throw new ProcessUnavailableException(processId,
                    "Cannot route " + capability + ": process " + processId + " is not running");
        }
        var route = new CapabilityRoute(capability, processId, toolName, Instant.now());
        CapabilityRoute previous = routes.put(capability, route);
        if (previous != null && !previous.processId().equals(processId)) {
            log.info("Capability {} moved from {} to {}", capability, previous.processId(), processId);
        } else {
            log.info("Capability {} routed to {} tool {}", capability, processId, toolName);
        }
        return route;
    }

    public Object invoke(String capability, Map<String, Object> arguments) {
        return invoke(capability, arguments, protocolClient.defaultTimeout());
    }

    /**
     * Calls the tool serving {@code capability}.
     *
     * @throws UnknownCapabilityException  if no route exists
     * @throws ProcessUnavailableException if the process went away; its routes are dropped
     * @throws RemoteErrorException        the server's error, unchanged
     * @throws RpcTimeoutException         if no response arrived in time
     */
    public Object invoke(String capability, Map<String, Object> arguments, Duration timeout) {
        CapabilityRoute route = resolve(capability);
        try {
            Object result = protocolClient.callTool(route.processId(), route.toolName(),
                    arguments != null ? arguments : Map.of(), timeout);
            metrics.recordInvocation(capability, "ok");
            return result;
        } catch (TransportClosedException e) {
            invalidateProcess(route.processId());
            metrics.recordInvocation(capability, "unavailable");
            throw new ProcessUnavailableException(route.processId(),
                    "Process " + route.processId() + " serving " + capability + " is unavailable", e);
        } catch (RemoteErrorException e) {
            metrics.recordInvocation(capability, "remote_error");
            throw e;
        } catch (RpcTimeoutException e) {
            metrics.recordInvocation(capability, "timeout");
            throw e;
        }
    }

    private synchronized CapabilityRoute resolve(String capability) {
        CapabilityRoute route = routes.get(capability);
        if (route == null) {
            throw new UnknownCapabilityException(capability);
        }
        if (!supervisor.isRunning(route.processId())) {
            removeRoutesOf(route.processId());
            throw new ProcessUnavailableException(route.processId(),
                    "Process " + route.processId() + " serving " + capability + " is not running");
        }
        return route;
    }

    /**
     * Drops every route that points at {@code processId}.
     *
     * @return the capabilities that lost their route
     */
    public synchronized List<String> invalidateProcess(String processId) {
        if (processId == null) {
            return List.of();
        }
        List<String> removed = removeRoutesOf(processId);
        if (!removed.isEmpty()) {
            log.warn("Process {} gone, removed routes {}", processId, removed);
        }
        return removed;
    }

    public synchronized List<String> listCapabilities() {
        return List.copyOf(routes.keySet());
    }

    public synchronized Optional<CapabilityRoute> route(String capability) {
        return Optional.ofNullable(routes.get(capability));
    }

    public synchronized List<CapabilityRoute> routes() {
        return List.copyOf(routes.values());
    }

    private List<String> removeRoutesOf(String processId) {
        List<String> removed = new ArrayList<>();
        routes.entrySet().removeIf(e -> {
            if (e.getValue().processId().equals(processId)) {
                removed.add(e.getKey());
                return true;
            }
            return false;
        });
        return removed;
    }
}
