package com.dynop.roadnet.export;

import com.dynop.roadnet.graph.EdgeExpander;
import com.dynop.roadnet.graph.GraphBuilder;
import com.dynop.roadnet.graph.GraphMetadataTagger;
import com.dynop.roadnet.graph.RoadGraph;
import com.dynop.roadnet.model.CanonicalEdgeRecord;
import com.dynop.roadnet.model.CoordinateSystem;
import com.dynop.roadnet.model.TravelDirection;
import com.graphhopper.routing.util.AllEdgesIterator;
import com.graphhopper.storage.NodeAccess;
import com.graphhopper.util.FetchMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.dynop.roadnet.RoadFixtures.line;
import static org.junit.jupiter.api.Assertions.*;

class GraphHopperGraphConverterTest {

    private final GraphHopperGraphConverter converter = new GraphHopperGraphConverter();

    @Test
    void copiesNodesEdgesAndWeights() {
        // 1 km at 3 min forward (20 km/h) and 4 min back (15 km/h), with one interior point
        CanonicalEdgeRecord record = new CanonicalEdgeRecord(1, 2, "100",
            line(4.90, 52.30, 4.905, 52.302, 4.91, 52.30), 1.0, 3.0, 4.0, TravelDirection.BOTH);
        RoadGraph graph = tagged(List.of(record), CoordinateSystem.WGS84);
        
        try (ConvertedGraph converted = converter.convert(graph)) {
            assertEquals(2, converted.getBaseGraph().getNodes());
            assertEquals(2, converted.getBaseGraph().getEdges());
            
            NodeAccess nodes = converted.getBaseGraph().getNodeAccess();
            int first = converted.getNodeIndex(1);
            assertEquals(52.30, nodes.getLat(first), 1e-5);
            assertEquals(4.90, nodes.getLon(first), 1e-5);
            
            AllEdgesIterator edges = converted.getBaseGraph().getAllEdges();
            int seen = 0;
            while (edges.next()) {
                seen++;
                assertTrue(edges.get(converted.getAccessEnc()));
                assertFalse(edges.getReverse(converted.getAccessEnc()));
                assertEquals(1000, edges.getDistance(), 1);
                assertEquals(1, edges.fetchWayGeometry(FetchMode.PILLAR_ONLY).size());
                
                double expectedSpeed = edges.getBaseNode() == first ? 20 : 15;
                assertEquals(expectedSpeed, edges.get(converted.getSpeedEnc()), GraphHopperGraphConverter.SPEED_FACTOR);
            }
            assertEquals(2, seen);
        }
    }

    @Test
    void unknownJunctionHasNoIndex() {
        RoadGraph graph = tagged(List.of(new CanonicalEdgeRecord(1, 2, "1", line(0, 0, 0.01, 0),
            1.0, 1.0, 1.0, TravelDirection.BOTH)), CoordinateSystem.WGS84);
        
        try (ConvertedGraph converted = converter.convert(graph)) {
            assertThrows(IllegalArgumentException.class, () -> converted.getNodeIndex(3));
        }
    }

    @Test
    void requiresTaggedGraph() {
        RoadGraph untagged = new GraphBuilder().build(new EdgeExpander().expandAll(List.of(
            new CanonicalEdgeRecord(1, 2, "1", line(0, 0, 0.01, 0), 1.0, 1.0, 1.0, TravelDirection.BOTH))));
        
        assertThrows(IllegalArgumentException.class, () -> converter.convert(untagged));
    }

    @Test
    void requiresGeographicCoordinates() {
        RoadGraph projected = tagged(List.of(new CanonicalEdgeRecord(1, 2, "1", line(0, 0, 1000, 0),
            1.0, 1.0, 1.0, TravelDirection.BOTH)), CoordinateSystem.WEB_MERCATOR);
        
        assertThrows(IllegalArgumentException.class, () -> converter.convert(projected));
    }

    @ParameterizedTest
    @CsvSource({
        "1.0, 3.0, 20.0",
        "1.0, 0.0, 254.0",
        "10.0, 1.0, 254.0",
        "0.0, 5.0, 2.0"
    })
    void speedIsClampedToEncoderRange(double km, double minutes, double expected) {
        assertEquals(expected, GraphHopperGraphConverter.speedKmh(km, minutes), 1e-9);
    }

    private static RoadGraph tagged(List<CanonicalEdgeRecord> records, CoordinateSystem crs) {
        RoadGraph graph = new GraphBuilder().build(new EdgeExpander().expandAll(records));
        return new GraphMetadataTagger().tagDefaults(graph, crs);
    }
}
