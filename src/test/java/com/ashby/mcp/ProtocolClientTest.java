package com.ashby.mcp;

import com.ashby.core.events.AshbyEvent;
import com.ashby.core.events.EventBus;
import com.ashby.core.events.EventTypes;
import com.ashby.core.metrics.AshbyMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolClientTest {

    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private ProtocolClient client;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        client = new ProtocolClient(new ObjectMapper(), new ProtocolProperties(), eventBus, new AshbyMetrics(registry));
        client.init();
    }

    @Test
    @DisplayName("calls on an unknown transport fail with TransportClosedException")
    void unknownTransport() {
        assertThrows(TransportClosedException.class,
                () -> client.listTools("proc-9", Duration.ofSeconds(1)));
        assertEquals(1.0, registry.find("ashby.rpc.calls").tag("outcome", "closed").counter().count());
    }

    @Test
    @DisplayName("a second open on a live transport is a usage error")
    void doubleOpen() {
        var transport = new QueueTransport("proc-1");
        client.open(transport);
        assertThrows(ProtocolUsageException.class, () -> client.open(transport));
        client.close("proc-1");
    }

    @Test
    @DisplayName("an unanswered initialize becomes a HandshakeException")
    void handshakeTimeout() {
        client.open(new QueueTransport("proc-1"));
        assertThrows(HandshakeException.class, () -> client.initialize("proc-1", Duration.ofMillis(100)));
    }

    @Test
    @DisplayName("a process crash event closes the session")
    void crashClosesSession() {
        var transport = new QueueTransport("proc-2");
        client.open(transport);
        assertTrue(client.hasSession("proc-2"));

        eventBus.publish(AshbyEvent.of(EventTypes.PROCESS_CRASHED, "proc-2", "proc-2", Map.of()));

        assertFalse(client.hasSession("proc-2"));
        assertFalse(transport.isOpen());
    }
}
