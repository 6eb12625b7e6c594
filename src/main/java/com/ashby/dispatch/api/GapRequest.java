package com.ashby.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/gaps.
 *
 * @param requiredCapabilities capability names to acquire
 * @param severity             LOW, NORMAL, HIGH or CRITICAL; nullable, defaults to NORMAL
 * @param source               who reports the gap; nullable, defaults to "api"
 */
public record GapRequest(
    @JsonProperty("required_capabilities") List<String> requiredCapabilities,
    String severity,
    String source
) {}
