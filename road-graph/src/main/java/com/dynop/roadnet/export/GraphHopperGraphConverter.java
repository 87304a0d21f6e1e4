package com.dynop.roadnet.export;

import com.dynop.roadnet.graph.GraphMetadata;
import com.dynop.roadnet.graph.RoadGraph;
import com.dynop.roadnet.model.DirectedEdge;
import com.graphhopper.routing.ev.BooleanEncodedValue;
import com.graphhopper.routing.ev.DecimalEncodedValue;
import com.graphhopper.routing.ev.VehicleAccess;
import com.graphhopper.routing.ev.VehicleSpeed;
import com.graphhopper.routing.util.EncodingManager;
import com.graphhopper.storage.BaseGraph;
import com.graphhopper.storage.NodeAccess;
import com.graphhopper.storage.RAMDirectory;
import com.graphhopper.util.EdgeIteratorState;
import com.graphhopper.util.PointList;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Copies a routable {@link RoadGraph} into an in-memory GraphHopper {@link BaseGraph}, so that
 * GraphHopper's routing algorithms can run on it.
 * 
 * <p>Conversion rules:
 * <ul>
 *   <li>Junction ids are mapped to dense GraphHopper node indices in ascending id order</li>
 *   <li>Node coordinates come from the first/last point of the edge geometries (x = lon, y = lat)</li>
 *   <li>Every directed edge becomes one GraphHopper edge, accessible in its own direction only</li>
 *   <li>Distance is stored in meters; speed is distance over time, clamped to the encoder range</li>
 *   <li>Interior geometry points become pillar nodes</li>
 * </ul>
 * 
 * <p>Weights are read through the graph's {@link GraphMetadata}, so the graph must be tagged and its
 * geometries must be geographic (EPSG:4326). Nothing is written to disk.
 */
public final class GraphHopperGraphConverter {
    
    private static final Logger LOGGER = Logger.getLogger(GraphHopperGraphConverter.class.getName());
    
    static final String VEHICLE = "car";
    static final int SPEED_BITS = 7;
    static final double SPEED_FACTOR = 2;
    static final double MAX_SPEED_KMH = ((1 << SPEED_BITS) - 1) * SPEED_FACTOR;
    
    /**
     * @param graph Tagged graph in EPSG:4326
     * @return GraphHopper graph with its encoded values and node index mapping
     * @throws IllegalArgumentException if the graph is untagged or not geographic
     */
    public ConvertedGraph convert(RoadGraph graph) {
        Objects.requireNonNull(graph, "graph");
        GraphMetadata metadata = graph.getMetadata()
            .orElseThrow(() -> new IllegalArgumentException("Graph must be tagged before conversion"));
        if (!metadata.getCrs().isGeographic()) {
            throw new IllegalArgumentException("GraphHopper needs lat/lon coordinates but graph is in " + metadata.getCrs());
        }
        
        BooleanEncodedValue accessEnc = VehicleAccess.create(VEHICLE);
        DecimalEncodedValue speedEnc = VehicleSpeed.create(VEHICLE, SPEED_BITS, SPEED_FACTOR, false);
        EncodingManager encodingManager = EncodingManager.start()
            .add(accessEnc)
            .add(speedEnc)
            .build();
        
        BaseGraph baseGraph = new BaseGraph.Builder(encodingManager)
            .setDir(new RAMDirectory())
            .set3D(false)
            .create();
        
        // Dense node indices
        Map<Long, Integer> nodeIndex = new HashMap<>();
        for (Long junction : graph.getNodes()) {
            nodeIndex.put(junction, nodeIndex.size());
        }
        
        NodeAccess nodeAccess = baseGraph.getNodeAccess();
        Set<Integer> placed = new HashSet<>();
        for (DirectedEdge edge : graph.getEdges()) {
            LineString geometry = metadata.geometryOf(edge);
            placeNode(nodeAccess, placed, nodeIndex.get(edge.getFrom()), geometry.getCoordinateN(0));
            placeNode(nodeAccess, placed, nodeIndex.get(edge.getTo()), geometry.getCoordinateN(geometry.getNumPoints() - 1));
        }
        
        for (DirectedEdge edge : graph.getEdges()) {
            double distanceKm = metadata.distanceOf(edge);
            EdgeIteratorState state = baseGraph.edge(nodeIndex.get(edge.getFrom()), nodeIndex.get(edge.getTo()))
                .setDistance(distanceKm * 1000)
                .set(accessEnc, true, false)
                .set(speedEnc, speedKmh(distanceKm, metadata.timeOf(edge)));
            
            LineString geometry = metadata.geometryOf(edge);
            if (geometry.getNumPoints() > 2) {
                PointList pillars = new PointList(geometry.getNumPoints() - 2, false);
                for (int i = 1; i < geometry.getNumPoints() - 1; i++) {
                    Coordinate c = geometry.getCoordinateN(i);
                    pillars.add(c.y, c.x);
                }
                state.setWayGeometry(pillars);
            }
        }
        
        LOGGER.info(() -> String.format("Converted road graph to GraphHopper: %d nodes, %d edges",
            baseGraph.getNodes(), baseGraph.getEdges()));
        return new ConvertedGraph(baseGraph, accessEnc, speedEnc, nodeIndex);
    }
    
    private static void placeNode(NodeAccess nodeAccess, Set<Integer> placed, int index, Coordinate coordinate) {
        if (placed.add(index)) {
            nodeAccess.setNode(index, coordinate.y, coordinate.x);
        }
    }
    
    /**
     * Average speed over an edge in km/h, clamped to what the speed encoder can store.
     * Zero travel time maps to the maximum speed.
     */
    static double speedKmh(double distanceKm, double minutes) {
        if (minutes <= 0) {
            return MAX_SPEED_KMH;
        }
        double speed = distanceKm / (minutes / 60);
        return Math.min(MAX_SPEED_KMH, Math.max(SPEED_FACTOR, speed));
    }
}
