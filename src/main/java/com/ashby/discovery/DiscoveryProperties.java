package com.ashby.discovery;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Discovery configuration bound from {@code ashby.discovery.*}.
 */
@Component
@ConfigurationProperties(prefix = "ashby.discovery")
public class DiscoveryProperties {

    /**
     * Capability name to known-good packages, best first.
     * Entries from configuration replace the built-in entry for the same capability.
     */
    private Map<String, List<String>> curated = new LinkedHashMap<>();

    private Registry registry = new Registry();

    private Research research = new Research();

    /** Seed the mapping with the official reference servers after binding. */
    @PostConstruct
    public void applyDefaults() {
        curated.putIfAbsent("filesystem", List.of("@modelcontextprotocol/server-filesystem"));
        curated.putIfAbsent("memory", List.of("@modelcontextprotocol/server-memory"));
        curated.putIfAbsent("github", List.of("@modelcontextprotocol/server-github"));
        curated.putIfAbsent("git", List.of("@modelcontextprotocol/server-git"));
        curated.putIfAbsent("gitlab", List.of("@modelcontextprotocol/server-gitlab"));
        curated.putIfAbsent("google_drive", List.of("@modelcontextprotocol/server-google-drive"));
        curated.putIfAbsent("postgres", List.of("@modelcontextprotocol/server-postgres"));
        curated.putIfAbsent("sqlite", List.of("@modelcontextprotocol/server-sqlite", "mcp-server-sqlite"));
        curated.putIfAbsent("slack", List.of("@modelcontextprotocol/server-slack"));
        curated.putIfAbsent("puppeteer", List.of("@modelcontextprotocol/server-puppeteer"));
        curated.putIfAbsent("brave_search", List.of("@modelcontextprotocol/server-brave-search"));
        curated.putIfAbsent("fetch", List.of("@modelcontextprotocol/server-fetch"));
        curated.putIfAbsent("caching", List.of("@modelcontextprotocol/server-memory", "mcp-server-redis"));
        curated.putIfAbsent("file_operations", List.of("@modelcontextprotocol/server-filesystem",
                "@modelcontextprotocol/server-google-drive", "mcp-server-s3"));
        curated.putIfAbsent("database", List.of("@modelcontextprotocol/server-sqlite",
                "@modelcontextprotocol/server-postgres", "mcp-server-mysql"));
        curated.putIfAbsent("api", List.of("@modelcontextprotocol/server-fetch", "mcp-server-graphql"));
    }

    public Map<String, List<String>> getCurated() { return curated; }
    public void setCurated(Map<String, List<String>> curated) { this.curated = curated; }
    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }
    public Research getResearch() { return research; }
    public void setResearch(Research research) { this.research = research; }

    /** Live npm registry search. */
    public static class Registry {
        private boolean enabled = true;
        private String url = "https://registry.npmjs.org";
        /** Results requested per search. */
        private int size = 10;
        private Duration timeout = Duration.ofSeconds(10);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public int getSize() { return size; }
        public void setSize(int size) { this.size = size; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    /** Language-model research source; off unless a model is configured. */
    public static class Research {
        private boolean enabled = false;
        private double score = 40.0;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public double getScore() { return score; }
        public void setScore(double score) { this.score = score; }
    }
}
