package com.dynop.roadnet.model;

import org.locationtech.jts.geom.LineString;

import java.util.Objects;

/**
 * Vintage-independent representation of one road segment before directional expansion.
 * 
 * <p>The geometry is in digitized (forward) orientation: its first point is the {@code fromNodeId}
 * junction and its last point the {@code toNodeId} junction. Instances are immutable.
 */
public final class CanonicalEdgeRecord {
    
    private final long fromNodeId;
    private final long toNodeId;
    private final String roadId;
    private final LineString geometry;
    private final double distanceKm;
    private final double forwardMinutes;
    private final double backwardMinutes;
    private final TravelDirection direction;
    
    /**
     * @param fromNodeId      Junction at the first geometry point
     * @param toNodeId        Junction at the last geometry point
     * @param roadId          Road identifier, basis of the edge keys
     * @param geometry        Segment geometry with at least two points
     * @param distanceKm      Segment length in kilometers (&ge; 0)
     * @param forwardMinutes  Travel time from → to in minutes (&ge; 0)
     * @param backwardMinutes Travel time to → from in minutes (&ge; 0)
     * @param direction       Allowed travel direction
     * @throws IllegalArgumentException if a weight is negative or NaN, or the geometry is degenerate
     */
    public CanonicalEdgeRecord(long fromNodeId, long toNodeId, String roadId, LineString geometry,
                               double distanceKm, double forwardMinutes, double backwardMinutes,
                               TravelDirection direction) {
        this.fromNodeId = fromNodeId;
        this.toNodeId = toNodeId;
        this.roadId = Objects.requireNonNull(roadId, "roadId");
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.distanceKm = requireNonNegative(distanceKm, "distanceKm");
        this.forwardMinutes = requireNonNegative(forwardMinutes, "forwardMinutes");
        this.backwardMinutes = requireNonNegative(backwardMinutes, "backwardMinutes");
        this.direction = Objects.requireNonNull(direction, "direction");
        
        if (geometry.getNumPoints() < 2) {
            throw new IllegalArgumentException(
                "Geometry of road " + roadId + " must have at least 2 points, got " + geometry.getNumPoints());
        }
    }
    
    private static double requireNonNegative(double value, String name) {
        if (Double.isNaN(value) || value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, got " + value);
        }
        return value;
    }
    
    public long getFromNodeId() {
        return fromNodeId;
    }
    
    public long getToNodeId() {
        return toNodeId;
    }
    
    public String getRoadId() {
        return roadId;
    }
    
    public LineString getGeometry() {
        return geometry;
    }
    
    public double getDistanceKm() {
        return distanceKm;
    }
    
    public double getForwardMinutes() {
        return forwardMinutes;
    }
    
    public double getBackwardMinutes() {
        return backwardMinutes;
    }
    
    public TravelDirection getDirection() {
        return direction;
    }
    
    @Override
    public String toString() {
        return String.format("CanonicalEdgeRecord{roadId='%s', from=%d, to=%d, km=%.4f, fwd=%.3f, bwd=%.3f, direction=%s}",
                roadId, fromNodeId, toNodeId, distanceKm, forwardMinutes, backwardMinutes, direction);
    }
}
