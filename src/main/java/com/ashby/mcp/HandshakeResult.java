package com.ashby.mcp;

import java.util.Map;

/**
 * Outcome of the {@code initialize} exchange.
 *
 * @param protocolVersion version the server agreed to
 * @param serverName      {@code serverInfo.name}, or "unknown"
 * @param serverVersion   {@code serverInfo.version}, or "unknown"
 * @param capabilities    server capability object as sent
 */
public record HandshakeResult(
    String protocolVersion,
    String serverName,
    String serverVersion,
    Map<String, Object> capabilities
) {}
