package com.ashby.core.engine;

import com.ashby.mcp.ToolDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ToolSelectorTest {

    private final ToolSelector selector = new ToolSelector();

    @Test
    @DisplayName("a keyword in the tool name beats one in the description")
    void nameBeatsDescription() {
        var tools = List.of(
                new ToolDescriptor("read_file", "Read a file from the filesystem"),
                new ToolDescriptor("filesystem_info", "Describe the sandbox"));

        assertEquals(Optional.of("filesystem_info"), selector.select("filesystem", tools));
    }

    @Test
    @DisplayName("without any keyword hit the first advertised tool is used")
    void fallsBackToFirst() {
        var tools = List.of(new ToolDescriptor("create_entities", ""), new ToolDescriptor("read_graph", ""));
        assertEquals(Optional.of("create_entities"), selector.select("memory", tools));
    }

    @Test
    @DisplayName("ties keep the earlier tool")
    void tiesKeepOrder() {
        var tools = List.of(new ToolDescriptor("query", "sqlite query"), new ToolDescriptor("exec", "sqlite exec"));
        assertEquals(Optional.of("query"), selector.select("sqlite", tools));
    }

    @Test
    @DisplayName("no tools means no selection")
    void noTools() {
        assertTrue(selector.select("memory", List.of()).isEmpty());
        assertTrue(selector.select("memory", null).isEmpty());
    }
}
