package com.ashby.discovery;

import com.ashby.core.model.CandidateServer;
import com.ashby.core.security.PackageAllowlistService;
import com.ashby.core.security.PackageNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a capability name into a ranked list of candidate packages.
 * <p>
 * Queries every enabled {@link CandidateSource}; a failing source contributes nothing.
 * Candidates with invalid or disallowed names are dropped, duplicates are merged keeping the
 * best score, and the survivors are ordered by {@link CandidateMatcher}. An empty list means
 * nothing was found; there is no fallback.
 */
@Service
public class DiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);

    private final List<CandidateSource> sources;
    private final CandidateMatcher matcher;
    private final PackageAllowlistService allowlist;

    public DiscoveryService(List<CandidateSource> sources, CandidateMatcher matcher,
                            PackageAllowlistService allowlist) {
        this.sources = List.copyOf(sources);
        this.matcher = matcher;
        this.allowlist = allowlist;
    }

    public List<CandidateServer> discover(String capability) {
        Map<String, CandidateServer> byPackage = new LinkedHashMap<>();
        for (CandidateSource source : sources) {
            if (!source.isEnabled()) {
                continue;
            }
            List<CandidateServer> found;
            try {
                found = source.search(capability);
            } catch (RuntimeException e) {
                log.warn("Discovery source {} failed for '{}': {}", source.name(), capability, e.getMessage());
                continue;
            }
            for (CandidateServer candidate : found) {
                if (!acceptable(candidate)) {
                    log.debug("Dropping candidate {} from {}", candidate.packageName(), source.name());
                    continue;
                }
                byPackage.merge(candidate.packageName(), candidate, DiscoveryService::better);
            }
        }
        List<CandidateServer> ranked = matcher.rank(capability, new ArrayList<>(byPackage.values()));
        log.info("Discovered {} candidate(s) for '{}'", ranked.size(), capability);
        return ranked;
    }

    public List<String> sourceNames() {
        return sources.stream().filter(CandidateSource::isEnabled).map(CandidateSource::name).toList();
    }

    private boolean acceptable(CandidateServer candidate) {
        return PackageNames.isValidVersion(candidate.version())
                && allowlist.isPackageAllowed(candidate.packageName());
    }

    /** Keeps the higher-scored record and the union of declared capabilities. */
    private static CandidateServer better(CandidateServer a, CandidateServer b) {
        CandidateServer best = b.score() > a.score() ? b : a;
        Set<String> capabilities = new HashSet<>(a.capabilities());
        capabilities.addAll(b.capabilities());
        return new CandidateServer(best.packageName(), best.version(), best.description(),
                capabilities, best.score(), best.sourceOrigin());
    }
}
