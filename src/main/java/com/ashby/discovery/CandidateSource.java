package com.ashby.discovery;

import com.ashby.core.model.CandidateServer;

import java.util.List;

/**
 * A place candidate packages can be found. Implementations may do network I/O and may fail;
 * {@link DiscoveryService} treats a failure as "no results from this source".
 */
public interface CandidateSource {

    String name();

    default boolean isEnabled() {
        return true;
    }

    List<CandidateServer> search(String capability);
}
