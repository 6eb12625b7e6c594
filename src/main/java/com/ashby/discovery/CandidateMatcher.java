package com.ashby.discovery;

import com.ashby.core.model.CandidateServer;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Deterministic ranking of candidates for a capability.
 * <ol>
 *   <li>number of capability keywords found in the candidate's name, declared capabilities or description</li>
 *   <li>source score</li>
 *   <li>shorter package name, then lexical order</li>
 * </ol>
 * Keywords are the capability name split on {@code _} and {@code -}.
 */
@Component
public class CandidateMatcher {

    public List<CandidateServer> rank(String capability, List<CandidateServer> candidates) {
        List<String> keywords = keywords(capability);
        Comparator<CandidateServer> order = Comparator
                .comparingInt((CandidateServer c) -> matchCount(keywords, c)).reversed()
                .thenComparing(Comparator.comparingDouble(CandidateServer::score).reversed())
                .thenComparingInt(c -> c.packageName().length())
                .thenComparing(CandidateServer::packageName);
        return candidates.stream().sorted(order).toList();
    }

    public Optional<CandidateServer> selectBest(String capability, List<CandidateServer> candidates) {
        return rank(capability, candidates).stream().findFirst();
    }

    public static List<String> keywords(String capability) {
        return Arrays.stream(capability.toLowerCase(Locale.ROOT).split("[_\\-]+"))
                .filter(k -> !k.isBlank())
                .distinct()
                .toList();
    }

    static int matchCount(List<String> keywords, CandidateServer candidate) {
        String name = candidate.packageName().toLowerCase(Locale.ROOT);
        String description = candidate.description().toLowerCase(Locale.ROOT);
        List<String> declared = candidate.capabilities().stream()
                .map(c -> c.toLowerCase(Locale.ROOT))
                .toList();
        int count = 0;
        for (String keyword : keywords) {
            boolean hit = name.contains(keyword)
                    || description.contains(keyword)
                    || declared.stream().anyMatch(c -> c.contains(keyword));
            if (hit) {
                count++;
            }
        }
        return count;
    }
}
