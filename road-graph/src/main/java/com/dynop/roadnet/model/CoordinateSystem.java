package com.dynop.roadnet.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Coordinate reference descriptor attached to a road graph.
 * 
 * <p>Only the authority code is kept (e.g. {@code "EPSG:4326"}). Reprojection happens before records
 * reach the pipeline, so the graph merely records which system its geometries are expressed in.
 */
public final class CoordinateSystem {
    
    /**
     * Geographic lat/lon, the system segment records are stored in.
     */
    public static final CoordinateSystem WGS84 = new CoordinateSystem("EPSG:4326");
    
    /**
     * Projected xy system used when records are delivered in metric coordinates.
     */
    public static final CoordinateSystem WEB_MERCATOR = new CoordinateSystem("EPSG:3857");
    
    private final String code;
    
    private CoordinateSystem(String code) {
        this.code = code;
    }
    
    /**
     * Parse an authority code such as {@code "EPSG:4326"} or {@code "epsg:3857"}.
     * 
     * @param code Authority code
     * @return Coordinate system descriptor
     * @throws IllegalArgumentException if the code is blank or lacks an authority prefix
     */
    public static CoordinateSystem of(String code) {
        Objects.requireNonNull(code, "code");
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        int separator = normalized.indexOf(':');
        if (separator <= 0 || separator == normalized.length() - 1) {
            throw new IllegalArgumentException("Coordinate system must be AUTHORITY:CODE, got: " + code);
        }
        if (WGS84.code.equals(normalized)) {
            return WGS84;
        }
        if (WEB_MERCATOR.code.equals(normalized)) {
            return WEB_MERCATOR;
        }
        return new CoordinateSystem(normalized);
    }
    
    /**
     * @return Authority code (e.g. "EPSG:4326")
     */
    public String getCode() {
        return code;
    }
    
    /**
     * @return true for the geographic lat/lon system
     */
    public boolean isGeographic() {
        return this.equals(WGS84);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return code.equals(((CoordinateSystem) o).code);
    }
    
    @Override
    public int hashCode() {
        return code.hashCode();
    }
    
    @Override
    public String toString() {
        return code;
    }
}
