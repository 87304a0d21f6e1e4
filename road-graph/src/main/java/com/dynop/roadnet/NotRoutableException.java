package com.dynop.roadnet;

/**
 * Thrown when a graph has no strongly connected component that retains an edge.
 */
public class NotRoutableException extends RoadNetworkException {
    
    public static final String ERROR_CODE = "NOT_ROUTABLE";
    
    public NotRoutableException(String message) {
        super(ERROR_CODE, message);
    }
}
