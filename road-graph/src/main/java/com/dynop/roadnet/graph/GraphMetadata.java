package com.dynop.roadnet.graph;

import com.dynop.roadnet.model.CoordinateSystem;
import com.dynop.roadnet.model.DirectedEdge;
import org.locationtech.jts.geom.LineString;

import java.util.Objects;

/**
 * Graph-level descriptors: the coordinate system of all geometries and the names of the edge
 * attributes holding distance, time, geometry and road id.
 * 
 * <p>Consumers that read weights through these keys work with any graph this library builds, without
 * knowing the attribute layout:
 * <pre>{@code
 * double km = graph.getMetadata().orElseThrow().distanceOf(edge);
 * }</pre>
 */
public final class GraphMetadata {
    
    private final CoordinateSystem crs;
    private final String distanceKey;
    private final String timeKey;
    private final String geometryKey;
    private final String roadIdKey;
    
    public GraphMetadata(CoordinateSystem crs, String distanceKey, String timeKey,
                         String geometryKey, String roadIdKey) {
        this.crs = Objects.requireNonNull(crs, "crs");
        this.distanceKey = Objects.requireNonNull(distanceKey, "distanceKey");
        this.timeKey = Objects.requireNonNull(timeKey, "timeKey");
        this.geometryKey = Objects.requireNonNull(geometryKey, "geometryKey");
        this.roadIdKey = Objects.requireNonNull(roadIdKey, "roadIdKey");
    }
    
    public CoordinateSystem getCrs() {
        return crs;
    }
    
    /**
     * @return Name of the edge attribute used as distance weight
     */
    public String getDistanceKey() {
        return distanceKey;
    }
    
    /**
     * @return Name of the edge attribute used as time weight
     */
    public String getTimeKey() {
        return timeKey;
    }
    
    public String getGeometryKey() {
        return geometryKey;
    }
    
    public String getRoadIdKey() {
        return roadIdKey;
    }
    
    public double distanceOf(DirectedEdge edge) {
        return ((Number) edge.getAttributes().get(distanceKey)).doubleValue();
    }
    
    public double timeOf(DirectedEdge edge) {
        return ((Number) edge.getAttributes().get(timeKey)).doubleValue();
    }
    
    public LineString geometryOf(DirectedEdge edge) {
        return (LineString) edge.getAttributes().get(geometryKey);
    }
    
    public String roadIdOf(DirectedEdge edge) {
        return String.valueOf(edge.getAttributes().get(roadIdKey));
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphMetadata that = (GraphMetadata) o;
        return crs.equals(that.crs)
            && distanceKey.equals(that.distanceKey)
            && timeKey.equals(that.timeKey)
            && geometryKey.equals(that.geometryKey)
            && roadIdKey.equals(that.roadIdKey);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(crs, distanceKey, timeKey, geometryKey, roadIdKey);
    }
    
    @Override
    public String toString() {
        return String.format("GraphMetadata{crs=%s, distance='%s', time='%s', geometry='%s', roadId='%s'}",
                crs, distanceKey, timeKey, geometryKey, roadIdKey);
    }
}
