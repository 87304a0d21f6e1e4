package com.dynop.roadnet.graph;

/**
 * What {@link GraphBuilder} does when an edge is inserted under an address {@code (from, to, key)}
 * that is already taken.
 */
public enum EdgeCollisionPolicy {
    /**
     * The later edge replaces the earlier one. Each collision is logged and counted in
     * {@link RoadGraph#getCollisionCount()}.
     */
    OVERWRITE,
    
    /**
     * The build fails with {@link com.dynop.roadnet.DuplicateEdgeKeyException}.
     */
    REJECT
}
