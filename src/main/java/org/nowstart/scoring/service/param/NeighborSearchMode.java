package org.nowstart.scoring.service.param;

/**
 * How stability neighbors were searched: exhaustive pairs, or shared quantized buckets above the pairwise limit.
 */
public enum NeighborSearchMode {
    PAIRWISE("pairwise"),
    BUCKETED("bucketed");

    private final String code;

    NeighborSearchMode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
