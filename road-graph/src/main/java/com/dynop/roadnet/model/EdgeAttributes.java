package com.dynop.roadnet.model;

import org.locationtech.jts.geom.LineString;

import java.util.LinkedHashMap;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Weights and geometry carried by one directed edge.
 * 
 * <p>Attributes are typed, but can also be read by name through {@link #get(String)} so that
 * consumers driven by graph metadata do not need to know this class.
 * 
 * <table>
 *   <tr><th>Name</th><th>Value</th></tr>
 *   <tr><td>{@code kilometers}</td><td>{@link Double} distance in km</td></tr>
 *   <tr><td>{@code minutes}</td><td>{@link Double} travel time in minutes</td></tr>
 *   <tr><td>{@code geom}</td><td>{@link LineString} oriented from → to</td></tr>
 *   <tr><td>{@code road_id}</td><td>{@link String} source road identifier</td></tr>
 * </table>
 */
public final class EdgeAttributes {
    
    public static final String DISTANCE = "kilometers";
    public static final String TIME = "minutes";
    public static final String GEOMETRY = "geom";
    public static final String ROAD_ID = "road_id";
    
    /**
     * All attribute names understood by {@link #get(String)}.
     */
    public static final Set<String> NAMES = Set.of(DISTANCE, TIME, GEOMETRY, ROAD_ID);
    
    private final double distanceKm;
    private final double minutes;
    private final LineString geometry;
    private final String roadId;
    
    public EdgeAttributes(double distanceKm, double minutes, LineString geometry, String roadId) {
        if (Double.isNaN(distanceKm) || distanceKm < 0) {
            throw new IllegalArgumentException("distanceKm must be >= 0, got " + distanceKm);
        }
        if (Double.isNaN(minutes) || minutes < 0) {
            throw new IllegalArgumentException("minutes must be >= 0, got " + minutes);
        }
        this.distanceKm = distanceKm;
        this.minutes = minutes;
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.roadId = Objects.requireNonNull(roadId, "roadId");
    }
    
    public double getDistanceKm() {
        return distanceKm;
    }
    
    public double getMinutes() {
        return minutes;
    }
    
    public LineString getGeometry() {
        return geometry;
    }
    
    public String getRoadId() {
        return roadId;
    }
    
    /**
     * Look up an attribute by name.
     * 
     * @param name One of {@link #NAMES}
     * @return Attribute value
     * @throws IllegalArgumentException if the name is unknown
     */
    public Object get(String name) {
        switch (name) {
            case DISTANCE:
                return distanceKm;
            case TIME:
                return minutes;
            case GEOMETRY:
                return geometry;
            case ROAD_ID:
                return roadId;
            default:
                throw new IllegalArgumentException("Unknown edge attribute: " + name);
        }
    }
    
    /**
     * @return Attributes as an immutable name → value map, in {@code kilometers, minutes, geom, road_id} order
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(DISTANCE, distanceKm);
        map.put(TIME, minutes);
        map.put(GEOMETRY, geometry);
        map.put(ROAD_ID, roadId);
        return Collections.unmodifiableMap(map);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EdgeAttributes that = (EdgeAttributes) o;
        return Double.compare(that.distanceKm, distanceKm) == 0
            && Double.compare(that.minutes, minutes) == 0
            && geometry.equalsExact(that.geometry)
            && roadId.equals(that.roadId);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(distanceKm, minutes, roadId, geometry.getNumPoints());
    }
    
    @Override
    public String toString() {
        return String.format("EdgeAttributes{km=%.4f, minutes=%.3f, roadId='%s', points=%d}",
                distanceKm, minutes, roadId, geometry.getNumPoints());
    }
}
