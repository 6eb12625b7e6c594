package com.ashby.discovery;

import com.ashby.core.model.CandidateServer;
import com.ashby.core.model.SourceOrigin;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Static capability → package table. Earlier entries in a mapping score higher.
 */
@Component
public class CuratedMappingSource implements CandidateSource {

    static final double TOP_SCORE = 90.0;
    static final double STEP = 10.0;

    private final DiscoveryProperties properties;

    public CuratedMappingSource(DiscoveryProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return "curated";
    }

    @Override
    public List<CandidateServer> search(String capability) {
        List<String> packages = properties.getCurated().getOrDefault(capability, List.of());
        List<CandidateServer> result = new ArrayList<>();
        for (int i = 0; i < packages.size(); i++) {
            double score = Math.max(TOP_SCORE - i * STEP, 0.0);
            result.add(new CandidateServer(packages.get(i), "latest",
                    "Curated server for " + capability, Set.of(capability), score,
                    SourceOrigin.CURATED_MAPPING));
        }
        return result;
    }
}
