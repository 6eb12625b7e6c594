package com.ashby.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for the JSON-RPC client spoken to plugin processes.
 *
 * <pre>
 * ashby:
 *   protocol:
 *     protocol-version: 2024-11-05
 *     request-timeout: 30s
 *     handshake-timeout: 15s
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "ashby.protocol")
public class ProtocolProperties {

    private String protocolVersion = "2024-11-05";
    private String clientName = "ashby";
    private String clientVersion = "0.1.0";
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration handshakeTimeout = Duration.ofSeconds(15);
    private int maxLineBytes = 16 * 1024 * 1024;

    public String getProtocolVersion() { return protocolVersion; }
    public void setProtocolVersion(String protocolVersion) { this.protocolVersion = protocolVersion; }
    public String getClientName() { return clientName; }
    public void setClientName(String clientName) { this.clientName = clientName; }
    public String getClientVersion() { return clientVersion; }
    public void setClientVersion(String clientVersion) { this.clientVersion = clientVersion; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    public Duration getHandshakeTimeout() { return handshakeTimeout; }
    public void setHandshakeTimeout(Duration handshakeTimeout) { this.handshakeTimeout = handshakeTimeout; }
    public int getMaxLineBytes() { return maxLineBytes; }
    public void setMaxLineBytes(int maxLineBytes) { this.maxLineBytes = maxLineBytes; }
}
