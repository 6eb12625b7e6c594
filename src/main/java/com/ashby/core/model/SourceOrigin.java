package com.ashby.core.model;

/**
 * Which discovery source proposed a candidate.
 */
public enum SourceOrigin {
    REGISTRY_SEARCH,
    CURATED_MAPPING,
    EXTERNAL_RESEARCH
}
