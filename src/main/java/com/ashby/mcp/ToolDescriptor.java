package com.ashby.mcp;

/**
 * A tool advertised by a plugin in its {@code tools/list} response.
 */
public record ToolDescriptor(String name, String description) {}
