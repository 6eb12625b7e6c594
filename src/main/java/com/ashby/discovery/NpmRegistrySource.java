package com.ashby.discovery;

import com.ashby.core.model.CandidateServer;
import com.ashby.core.model.SourceOrigin;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Searches the npm registry ({@code /-/v1/search}) for MCP server packages.
 * <p>
 * Only packages that look like MCP servers are kept: "mcp" in the name, "Model Context Protocol"
 * in the description, or an {@code mcp} keyword. The registry's final score (0..1) is scaled to 0..100.
 */
@Component
public class NpmRegistrySource implements CandidateSource {

    private static final Logger log = LoggerFactory.getLogger(NpmRegistrySource.class);

    private final DiscoveryProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public NpmRegistrySource(DiscoveryProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getRegistry().getTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String name() {
        return "npm-registry";
    }

    @Override
    public boolean isEnabled() {
        return properties.getRegistry().isEnabled();
    }

    @Override
    public List<CandidateServer> search(String capability) {
        var registry = properties.getRegistry();
        String text = URLEncoder.encode("mcp " + capability.replace('_', ' '), StandardCharsets.UTF_8);
        URI uri = URI.create(stripTrailingSlash(registry.getUrl())
                + "/-/v1/search?text=" + text + "&size=" + registry.getSize());

        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(registry.getTimeout())
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new DiscoverySourceException("npm search returned HTTP " + response.statusCode());
            }
            List<CandidateServer> candidates = parse(response.body(), capability);
            log.debug("npm search for '{}' yielded {} MCP packages", capability, candidates.size());
            return candidates;
        } catch (IOException e) {
            throw new DiscoverySourceException("npm search failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiscoverySourceException("npm search interrupted", e);
        }
    }

    List<CandidateServer> parse(String body, String capability) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        List<CandidateServer> result = new ArrayList<>();
        for (JsonNode object : root.path("objects")) {
            JsonNode pkg = object.path("package");
            String name = pkg.path("name").asText("");
            String description = pkg.path("description").asText("");
            Set<String> keywords = new LinkedHashSet<>();
            for (JsonNode keyword : pkg.path("keywords")) {
                keywords.add(keyword.asText().toLowerCase(Locale.ROOT));
            }
            if (name.isEmpty() || !looksLikeMcpServer(name, description, keywords)) {
                continue;
            }
            double score = object.path("score").path("final").asDouble(0.0) * 100.0;
            String version = pkg.path("version").asText("latest");
            result.add(new CandidateServer(name, version, description, keywords,
                    score, SourceOrigin.REGISTRY_SEARCH));
        }
        return result;
    }

    static boolean looksLikeMcpServer(String name, String description, Set<String> keywords) {
        return name.toLowerCase(Locale.ROOT).contains("mcp")
                || description.toLowerCase(Locale.ROOT).contains("model context protocol")
                || keywords.contains("mcp");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
