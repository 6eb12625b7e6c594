package com.ashby.core.model;

import java.util.Set;

/**
 * An externally discovered package believed to implement a capability.
 * Lives for a single acquisition attempt only.
 *
 * @param packageName  registry package name (e.g. "@modelcontextprotocol/server-memory")
 * @param version      version or dist-tag to install
 * @param description  free-text description from the source, may be empty
 * @param capabilities capability keywords the source attributes to the package
 * @param score        source-provided popularity/quality score, 0-100
 * @param sourceOrigin which source produced it
 */
public record CandidateServer(
    String packageName,
    String version,
    String description,
    Set<String> capabilities,
    double score,
    SourceOrigin sourceOrigin
) {
    public CandidateServer {
        version = version == null || version.isBlank() ? "latest" : version;
        description = description != null ? description : "";
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
    }
}
