package com.dynop.roadnet;

import com.dynop.roadnet.model.EdgeKey;

/**
 * Thrown when two edges are inserted under the same {@code (from, to, key)} address and the
 * graph builder is configured to reject collisions.
 */
public class DuplicateEdgeKeyException extends RoadNetworkException {
    
    public static final String ERROR_CODE = "DUPLICATE_EDGE_KEY";
    
    private final long from;
    private final long to;
    private final EdgeKey edgeKey;
    
    public DuplicateEdgeKeyException(long from, long to, EdgeKey edgeKey) {
        super(ERROR_CODE, String.format("edge %d -> %d with key %s inserted twice", from, to, edgeKey));
        this.from = from;
        this.to = to;
        this.edgeKey = edgeKey;
    }
    
    public long getFrom() {
        return from;
    }
    
    public long getTo() {
        return to;
    }
    
    public EdgeKey getEdgeKey() {
        return edgeKey;
    }
}
