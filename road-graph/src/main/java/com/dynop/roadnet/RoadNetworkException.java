package com.dynop.roadnet;

/**
 * Base class for failures of the road graph pipeline.
 * 
 * <p>Possible error codes:
 * <ul>
 *   <li>{@code UNSUPPORTED_VINTAGE} - The requested source schema is not registered</li>
 *   <li>{@code SCHEMA_VIOLATION} - A raw record does not match its vintage's required shape</li>
 *   <li>{@code EMPTY_INPUT} - No usable records remain after filtering</li>
 *   <li>{@code DUPLICATE_EDGE_KEY} - Two edges share {@code (from, to, key)} and overwriting is disabled</li>
 *   <li>{@code NOT_ROUTABLE} - No edges survive the strongly connected component reduction</li>
 * </ul>
 * 
 * <p>None of these are retried by the pipeline; callers decide whether to retry with another
 * boundary, vintage, or source.
 */
public class RoadNetworkException extends RuntimeException {
    
    private final String errorCode;
    
    /**
     * @param errorCode Machine readable error code
     * @param message   Human readable detail
     */
    public RoadNetworkException(String errorCode, String message) {
        super(String.format("%s: %s", errorCode, message));
        this.errorCode = errorCode;
    }
    
    /**
     * @param errorCode Machine readable error code
     * @param message   Human readable detail
     * @param cause     Underlying failure
     */
    public RoadNetworkException(String errorCode, String message, Throwable cause) {
        super(String.format("%s: %s", errorCode, message), cause);
        this.errorCode = errorCode;
    }
    
    /**
     * @return Error code (e.g., "NOT_ROUTABLE")
     */
    public String getErrorCode() {
        return errorCode;
    }
}
