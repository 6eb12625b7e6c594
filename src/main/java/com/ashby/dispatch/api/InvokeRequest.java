package com.ashby.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/capabilities/{name}/invoke.
 *
 * @param arguments tool arguments, passed through unchanged
 * @param timeoutMs per-call timeout; nullable, defaults to the protocol request timeout
 */
public record InvokeRequest(
    Map<String, Object> arguments,
    @JsonProperty("timeout_ms") Long timeoutMs
) {}
