package com.ashby.core.engine;

import com.ashby.core.model.Severity;
import com.ashby.core.model.VarietyGap;
import com.ashby.core.security.PackageNames;
import com.ashby.router.CapabilityRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the gap between the configured required capabilities and what the router can serve.
 */
@Component
public class GapDetector {

    private static final Logger log = LoggerFactory.getLogger(GapDetector.class);

    private final MonitorProperties properties;
    private final CapabilityRouter router;

    public GapDetector(MonitorProperties properties, CapabilityRouter router) {
        this.properties = properties;
        this.router = router;
    }

    public Optional<VarietyGap> detect() {
        Set<String> available = Set.copyOf(router.listCapabilities());
        Set<String> missing = new LinkedHashSet<>();
        for (String raw : properties.getRequiredCapabilities()) {
            String capability;
            try {
                capability = PackageNames.normalizeCapability(raw);
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring required capability: {}", e.getMessage());
                continue;
            }
            if (!available.contains(capability)) {
                missing.add(capability);
            }
        }
        if (missing.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(VarietyGap.of(missing, Severity.NORMAL, "monitor"));
    }
}
