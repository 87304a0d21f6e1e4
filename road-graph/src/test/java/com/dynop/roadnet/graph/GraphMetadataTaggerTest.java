package com.dynop.roadnet.graph;

import com.dynop.roadnet.model.CoordinateSystem;
import com.dynop.roadnet.model.DirectedEdge;
import com.dynop.roadnet.model.TravelDirection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dynop.roadnet.RoadFixtures.canonical;
import static org.junit.jupiter.api.Assertions.*;

class GraphMetadataTaggerTest {

    private final GraphMetadataTagger tagger = new GraphMetadataTagger();
    private final RoadGraph graph = new GraphBuilder().build(new EdgeExpander().expandAll(
        List.of(canonical(1, 2, "17", TravelDirection.BOTH, 1.5, 3.0, 4.0))));

    @Test
    void tagsDefaultKeys() {
        RoadGraph tagged = tagger.tagDefaults(graph, CoordinateSystem.WGS84);
        GraphMetadata metadata = tagged.getMetadata().orElseThrow();
        
        assertEquals(CoordinateSystem.WGS84, metadata.getCrs());
        assertEquals("kilometers", metadata.getDistanceKey());
        assertEquals("minutes", metadata.getTimeKey());
        assertEquals("geom", metadata.getGeometryKey());
        assertEquals("road_id", metadata.getRoadIdKey());
    }

    @Test
    void leavesNodesAndEdgesUntouched() {
        RoadGraph tagged = tagger.tagDefaults(graph, CoordinateSystem.WGS84);
        
        assertEquals(graph.getNodes(), tagged.getNodes());
        assertEquals(graph.getEdges(), tagged.getEdges());
        assertTrue(graph.getMetadata().isEmpty());
    }

    @Test
    void keysResolveEdgeAttributes() {
        GraphMetadata metadata = tagger.tagDefaults(graph, CoordinateSystem.WGS84).getMetadata().orElseThrow();
        DirectedEdge back = graph.getEdges(2, 1).get(0);
        
        assertEquals(1.5, metadata.distanceOf(back));
        assertEquals(4.0, metadata.timeOf(back));
        assertEquals("17", metadata.roadIdOf(back));
        assertEquals(2, metadata.geometryOf(back).getNumPoints());
    }

    @Test
    void customKeysMayPointAtOtherAttributes() {
        GraphMetadata metadata = tagger.tag(graph, CoordinateSystem.WEB_MERCATOR,
            "kilometers", "kilometers", "geom", "road_id").getMetadata().orElseThrow();
        
        assertEquals(1.5, metadata.timeOf(graph.getEdges().get(0)));
    }

    @Test
    void rejectsUnknownKey() {
        assertThrows(IllegalArgumentException.class,
            () -> tagger.tag(graph, CoordinateSystem.WGS84, "length", "minutes", "geom", "road_id"));
    }
}
