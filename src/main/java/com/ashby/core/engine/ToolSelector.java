package com.ashby.core.engine;

import com.ashby.discovery.CandidateMatcher;
import com.ashby.mcp.ToolDescriptor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the advertised tool that best fits a capability: most capability keywords in its
 * name or description, first advertised on ties. Falls back to the first tool.
 */
@Component
public class ToolSelector {

    public Optional<String> select(String capability, List<ToolDescriptor> tools) {
        if (tools == null || tools.isEmpty()) {
            return Optional.empty();
        }
        List<String> keywords = CandidateMatcher.keywords(capability);
        ToolDescriptor best = tools.get(0);
        int bestScore = score(keywords, best);
        for (ToolDescriptor tool : tools.subList(1, tools.size())) {
            int s = score(keywords, tool);
            if (s > bestScore) {
                best = tool;
                bestScore = s;
            }
        }
        return Optional.of(best.name());
    }

    private static int score(List<String> keywords, ToolDescriptor tool) {
        String name = tool.name().toLowerCase(Locale.ROOT);
        String description = tool.description() != null ? tool.description().toLowerCase(Locale.ROOT) : "";
        int score = 0;
        for (String keyword : keywords) {
            if (name.contains(keyword)) {
                score += 2;
            } else if (description.contains(keyword)) {
                score++;
            }
        }
        return score;
    }
}
