package com.ashby.dispatch.api;

import com.ashby.core.model.CapabilityRoute;
import com.ashby.mcp.ProtocolClient;
import com.ashby.mcp.RemoteErrorException;
import com.ashby.mcp.RpcTimeoutException;
import com.ashby.router.CapabilityRouter;
import com.ashby.router.ProcessUnavailableException;
import com.ashby.router.UnknownCapabilityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CapabilityController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class CapabilityControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CapabilityRouter router;

    @MockitoBean
    private ProtocolClient protocolClient;

    @BeforeEach
    void setUp() {
        when(protocolClient.defaultTimeout()).thenReturn(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("GET /capabilities lists routed capability names")
    void listCapabilities() throws Exception {
        when(router.listCapabilities()).thenReturn(List.of("memory"));

        mockMvc.perform(get("/api/v1/capabilities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("memory"));
    }

    @Test
    @DisplayName("GET /capabilities/routes shows process and tool per capability")
    void routes() throws Exception {
        when(router.routes()).thenReturn(List.of(new CapabilityRoute("memory", "proc-1", "read_graph", Instant.now())));

        mockMvc.perform(get("/api/v1/capabilities/routes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].process_id").value("proc-1"))
                .andExpect(jsonPath("$[0].tool").value("read_graph"));
    }

    @Test
    @DisplayName("POST /capabilities/{name}/invoke returns the tool result")
    void invoke() throws Exception {
        when(router.invoke(eq("memory"), anyMap(), eq(Duration.ofMillis(2000))))
                .thenReturn(Map.of("content", List.of(Map.of("type", "text", "text", "ok"))));

        mockMvc.perform(post("/api/v1/capabilities/memory/invoke")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"arguments\":{\"query\":\"alice\"},\"timeout_ms\":2000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.capability").value("memory"))
                .andExpect(jsonPath("$.result.content[0].text").value("ok"));

        verify(router).invoke("memory", Map.of("query", "alice"), Duration.ofMillis(2000));
    }

    @Test
    @DisplayName("POST /invoke without a body uses empty arguments and the default timeout")
    void invokeWithoutBody() throws Exception {
        when(router.invoke("memory", Map.of(), Duration.ofSeconds(30))).thenReturn(Map.of());

        mockMvc.perform(post("/api/v1/capabilities/memory/invoke"))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("unknown capability → 404")
    void unknown() throws Exception {
        when(router.invoke(eq("nope"), anyMap(), any())).thenThrow(new UnknownCapabilityException("nope"));

        mockMvc.perform(post("/api/v1/capabilities/nope/invoke")
                        .contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("No route for capability: nope"));
    }

    @Test
    @DisplayName("process gone → 503")
    void unavailable() throws Exception {
        when(router.invoke(eq("memory"), anyMap(), any()))
                .thenThrow(new ProcessUnavailableException("proc-1", "Process proc-1 is unavailable"));

        mockMvc.perform(post("/api/v1/capabilities/memory/invoke")
                        .contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("remote error → 502 with code and message")
    void remoteError() throws Exception {
        when(router.invoke(eq("memory"), anyMap(), any()))
                .thenThrow(new RemoteErrorException(-32602, "Invalid params", null));

        mockMvc.perform(post("/api/v1/capabilities/memory/invoke")
                        .contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error.code").value(-32602))
                .andExpect(jsonPath("$.error.message").value("Invalid params"));
    }

    @Test
    @DisplayName("timeout → 504")
    void timeout() throws Exception {
        when(router.invoke(eq("memory"), anyMap(), any()))
                .thenThrow(new RpcTimeoutException("tools/call", Duration.ofSeconds(30)));

        mockMvc.perform(post("/api/v1/capabilities/memory/invoke")
                        .contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isGatewayTimeout());
    }
}
