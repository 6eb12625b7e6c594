package com.ashby.discovery;

import com.ashby.core.model.CandidateServer;
import com.ashby.core.model.SourceOrigin;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NpmRegistrySourceTest {

    private final NpmRegistrySource source = new NpmRegistrySource(new DiscoveryProperties(), new ObjectMapper());

    @Test
    @DisplayName("parses search objects and keeps only MCP servers")
    void parsesSearchResult() throws Exception {
        String body = """
                {"objects":[
                  {"package":{"name":"@modelcontextprotocol/server-memory","version":"0.6.2",
                              "description":"MCP server for enabling memory","keywords":["mcp","memory"]},
                   "score":{"final":0.82}},
                  {"package":{"name":"left-pad","version":"1.3.0","description":"pad strings"},
                   "score":{"final":0.99}},
                  {"package":{"name":"kv-store","version":"2.0.0",
                              "description":"A Model Context Protocol server for key/value data"},
                   "score":{"final":0.40}}
                ],"total":3}
                """;

        List<CandidateServer> result = source.parse(body, "memory");

        assertEquals(List.of("@modelcontextprotocol/server-memory", "kv-store"),
                result.stream().map(CandidateServer::packageName).toList());
        CandidateServer memory = result.get(0);
        assertEquals("0.6.2", memory.version());
        assertEquals(82.0, memory.score(), 0.001);
        assertEquals(Set.of("mcp", "memory"), memory.capabilities());
        assertEquals(SourceOrigin.REGISTRY_SEARCH, memory.sourceOrigin());
    }

    @Test
    @DisplayName("an empty result parses to no candidates")
    void emptyResult() throws Exception {
        assertTrue(source.parse("{\"objects\":[],\"total\":0}", "nonexistent").isEmpty());
    }

    @Test
    @DisplayName("MCP detection looks at name, description and keywords")
    void detection() {
        assertTrue(NpmRegistrySource.looksLikeMcpServer("mcp-server-x", "", Set.of()));
        assertTrue(NpmRegistrySource.looksLikeMcpServer("x", "A Model Context Protocol bridge", Set.of()));
        assertTrue(NpmRegistrySource.looksLikeMcpServer("x", "", Set.of("mcp")));
        assertFalse(NpmRegistrySource.looksLikeMcpServer("express", "web framework", Set.of("http")));
    }

    @Test
    @DisplayName("disabled when the registry is switched off")
    void disabled() {
        var props = new DiscoveryProperties();
        props.getRegistry().setEnabled(false);
        assertFalse(new NpmRegistrySource(props, new ObjectMapper()).isEnabled());
    }
}
