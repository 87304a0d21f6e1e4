package com.dynop.roadnet.graph;

import com.dynop.roadnet.model.CoordinateSystem;
import com.dynop.roadnet.model.EdgeAttributes;

import java.util.Objects;

/**
 * Attaches {@link GraphMetadata} to a graph without touching its nodes or edges.
 */
public final class GraphMetadataTagger {
    
    /**
     * @return Copy of {@code graph} carrying the given coordinate system and attribute keys
     * @throws IllegalArgumentException if a key does not name an attribute that edges expose
     */
    public RoadGraph tag(RoadGraph graph, CoordinateSystem crs, String distanceKey, String timeKey,
                         String geometryKey, String roadIdKey) {
        Objects.requireNonNull(graph, "graph");
        GraphMetadata metadata = new GraphMetadata(crs,
            requireKnown(distanceKey, "distanceKey"),
            requireKnown(timeKey, "timeKey"),
            requireKnown(geometryKey, "geometryKey"),
            requireKnown(roadIdKey, "roadIdKey"));
        return graph.withMetadata(metadata);
    }
    
    /**
     * Tag with the standard attribute names {@code kilometers}, {@code minutes}, {@code geom} and {@code road_id}.
     */
    public RoadGraph tagDefaults(RoadGraph graph, CoordinateSystem crs) {
        return tag(graph, crs, EdgeAttributes.DISTANCE, EdgeAttributes.TIME,
            EdgeAttributes.GEOMETRY, EdgeAttributes.ROAD_ID);
    }
    
    private static String requireKnown(String key, String role) {
        Objects.requireNonNull(key, role);
        if (!EdgeAttributes.NAMES.contains(key)) {
            throw new IllegalArgumentException(
                String.format("%s '%s' is not an edge attribute; expected one of %s", role, key, EdgeAttributes.NAMES));
        }
        return key;
    }
}
