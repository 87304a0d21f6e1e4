package com.dynop.roadnet.model;

import java.util.Objects;

/**
 * One direction of travel along a road segment.
 * 
 * <p>Addressed in a graph by {@code (from, to, key)}. The geometry in {@link #getAttributes()} is
 * oriented from {@code from} to {@code to}.
 */
public final class DirectedEdge {
    
    private final long from;
    private final long to;
    private final EdgeKey key;
    private final EdgeAttributes attributes;
    
    public DirectedEdge(long from, long to, EdgeKey key, EdgeAttributes attributes) {
        this.from = from;
        this.to = to;
        this.key = Objects.requireNonNull(key, "key");
        this.attributes = Objects.requireNonNull(attributes, "attributes");
    }
    
    public long getFrom() {
        return from;
    }
    
    public long getTo() {
        return to;
    }
    
    public EdgeKey getKey() {
        return key;
    }
    
    public EdgeAttributes getAttributes() {
        return attributes;
    }
    
    /**
     * @return Travel time in minutes
     */
    public double getMinutes() {
        return attributes.getMinutes();
    }
    
    /**
     * @return Distance in kilometers
     */
    public double getDistanceKm() {
        return attributes.getDistanceKm();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DirectedEdge that = (DirectedEdge) o;
        return from == that.from && to == that.to
            && key.equals(that.key) && attributes.equals(that.attributes);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(from, to, key);
    }
    
    @Override
    public String toString() {
        return String.format("DirectedEdge{%d -> %d, key=%s, minutes=%.3f}", from, to, key, getMinutes());
    }
}
