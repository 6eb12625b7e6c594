package com.ashby.discovery;

import com.ashby.core.model.CandidateServer;
import com.ashby.core.model.SourceOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks a language model which MCP server packages provide a capability and extracts package
 * names from its reply. Disabled unless {@code ashby.discovery.research.enabled} is set and a
 * {@link ChatClient.Builder} is available.
 */
@Component
public class LlmResearchSource implements CandidateSource {

    private static final Logger log = LoggerFactory.getLogger(LlmResearchSource.class);

    static final Pattern PACKAGE_NAME =
            Pattern.compile("((?:@[\\w-]+/)?(?:mcp-server-|server-)[\\w-]+)");

    private static final String SYSTEM_PROMPT = """
            You are an expert on the Model Context Protocol ecosystem.
            Answer with npm package names of MCP servers only, one per line, best match first.
            Do not invent packages. If you know none, answer NONE.
            """;

    private final DiscoveryProperties properties;
    private final ObjectProvider<ChatClient.Builder> chatClientBuilder;
    private volatile ChatClient chatClient;

    public LlmResearchSource(DiscoveryProperties properties, ObjectProvider<ChatClient.Builder> chatClientBuilder) {
        this.properties = properties;
        this.chatClientBuilder = chatClientBuilder;
    }

    @Override
    public String name() {
        return "llm-research";
    }

    @Override
    public boolean isEnabled() {
        return properties.getResearch().isEnabled() && chatClientBuilder.getIfAvailable() != null;
    }

    @Override
    public List<CandidateServer> search(String capability) {
        log.info("Researching MCP servers for '{}'", capability);
        String reply = client().prompt()
                .system(SYSTEM_PROMPT)
                .user("Which npm packages implement an MCP server providing the capability '"
                        + capability + "'?")
                .call()
                .content();
        List<CandidateServer> candidates = parseReply(reply, capability, properties.getResearch().getScore());
        log.debug("Research for '{}' suggested {}", capability,
                candidates.stream().map(CandidateServer::packageName).toList());
        return candidates;
    }

    static List<CandidateServer> parseReply(String reply, String capability, double score) {
        if (reply == null || reply.isBlank()) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PACKAGE_NAME.matcher(reply);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        List<CandidateServer> result = new ArrayList<>();
        for (String name : names) {
            result.add(new CandidateServer(name, "latest", "Suggested by research for " + capability,
                    Set.of(capability), score, SourceOrigin.EXTERNAL_RESEARCH));
        }
        return result;
    }

    private ChatClient client() {
        ChatClient client = chatClient;
        if (client == null) {
            ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
            if (builder == null) {
                throw new DiscoverySourceException("No chat model configured");
            }
            client = builder.build();
            chatClient = client;
        }
        return client;
    }
}
