package com.dynop.roadnet;

import java.util.Collection;

/**
 * Thrown when a schema vintage is requested that has no registered adapter.
 */
public class UnsupportedVintageException extends RoadNetworkException {
    
    public static final String ERROR_CODE = "UNSUPPORTED_VINTAGE";
    
    private final String vintageTag;
    
    /**
     * @param vintageTag    The rejected tag
     * @param supportedTags Tags that are registered
     */
    public UnsupportedVintageException(String vintageTag, Collection<String> supportedTags) {
        super(ERROR_CODE, String.format("vintage %s not supported; must be one of %s", vintageTag, supportedTags));
        this.vintageTag = vintageTag;
    }
    
    /**
     * @return The vintage tag that was requested
     */
    public String getVintageTag() {
        return vintageTag;
    }
}
