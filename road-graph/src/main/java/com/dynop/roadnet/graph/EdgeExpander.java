package com.dynop.roadnet.graph;

import com.dynop.roadnet.model.CanonicalEdgeRecord;
import com.dynop.roadnet.model.DirectedEdge;
import com.dynop.roadnet.model.EdgeAttributes;
import com.dynop.roadnet.model.EdgeKey;
import com.dynop.roadnet.model.TravelDirection;
import org.locationtech.jts.geom.LineString;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expands canonical records into the directed edges implied by their travel direction.
 * 
 * <ul>
 *   <li>{@link TravelDirection#FORWARD} - one edge {@code from -> to} with the forward time</li>
 *   <li>{@link TravelDirection#BACKWARD} - one edge {@code to -> from} with reversed geometry and the backward time</li>
 *   <li>{@link TravelDirection#BOTH} - both of the above</li>
 * </ul>
 * 
 * <p>Expansion looks at one record at a time and never modifies it.
 */
public final class EdgeExpander {
    
    /**
     * @param record Canonical record
     * @return One or two directed edges, forward edge first
     */
    public List<DirectedEdge> expand(CanonicalEdgeRecord record) {
        Objects.requireNonNull(record, "record");
        TravelDirection direction = record.getDirection();
        List<DirectedEdge> edges = new ArrayList<>(2);
        if (direction.allowsForward()) {
            edges.add(forwardEdge(record));
        }
        if (direction.allowsBackward()) {
            edges.add(backwardEdge(record));
        }
        return edges;
    }
    
    /**
     * @param records Canonical records
     * @return Edges of all records, in record order
     */
    public List<DirectedEdge> expandAll(List<CanonicalEdgeRecord> records) {
        List<DirectedEdge> edges = new ArrayList<>(records.size() * 2);
        for (CanonicalEdgeRecord record : records) {
            edges.addAll(expand(record));
        }
        return edges;
    }
    
    private static DirectedEdge forwardEdge(CanonicalEdgeRecord record) {
        EdgeAttributes attributes = new EdgeAttributes(record.getDistanceKm(), record.getForwardMinutes(),
            record.getGeometry(), record.getRoadId());
        return new DirectedEdge(record.getFromNodeId(), record.getToNodeId(),
            EdgeKey.forward(record.getRoadId()), attributes);
    }
    
    private static DirectedEdge backwardEdge(CanonicalEdgeRecord record) {
        LineString reversed = (LineString) record.getGeometry().reverse();
        EdgeAttributes attributes = new EdgeAttributes(record.getDistanceKm(), record.getBackwardMinutes(),
            reversed, record.getRoadId());
        return new DirectedEdge(record.getToNodeId(), record.getFromNodeId(),
            EdgeKey.reverse(record.getRoadId()), attributes);
    }
}
