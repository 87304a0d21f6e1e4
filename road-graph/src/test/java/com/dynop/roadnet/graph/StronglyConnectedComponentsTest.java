package com.dynop.roadnet.graph;

import com.dynop.roadnet.model.CanonicalEdgeRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static com.dynop.roadnet.RoadFixtures.oneWay;
import static com.dynop.roadnet.RoadFixtures.twoWay;
import static org.junit.jupiter.api.Assertions.*;

class StronglyConnectedComponentsTest {

    @Test
    void splitsCycleFromTail() {
        // 1 -> 2 -> 3 -> 1, 3 -> 4
        RoadGraph graph = build(List.of(oneWay(1, 2, "a"), oneWay(2, 3, "b"), oneWay(3, 1, "c"), oneWay(3, 4, "d")));
        
        List<SortedSet<Long>> components = StronglyConnectedComponents.of(graph);
        
        assertEquals(Set.of(Set.of(1L, 2L, 3L), Set.of(4L)), asSets(components));
    }

    @Test
    void everyNodeInExactlyOneComponent() {
        RoadGraph graph = build(List.of(twoWay(1, 2, "a"), oneWay(2, 3, "b"), twoWay(3, 4, "c"),
            oneWay(5, 1, "d"), twoWay(6, 7, "e")));
        
        List<SortedSet<Long>> components = StronglyConnectedComponents.of(graph);
        
        SortedSet<Long> union = new TreeSet<>();
        int total = 0;
        for (SortedSet<Long> component : components) {
            union.addAll(component);
            total += component.size();
        }
        assertEquals(graph.getNodes(), union);
        assertEquals(graph.getNodeCount(), total);
        assertEquals(Set.of(Set.of(1L, 2L), Set.of(3L, 4L), Set.of(5L), Set.of(6L, 7L)), asSets(components));
    }

    @Test
    void handlesLongChainsWithoutRecursion() {
        List<CanonicalEdgeRecord> records = new ArrayList<>();
        for (long i = 0; i < 50_000; i++) {
            records.add(twoWay(i, i + 1, "r" + i));
        }
        
        List<SortedSet<Long>> components = StronglyConnectedComponents.of(build(records));
        
        assertEquals(1, components.size());
        assertEquals(50_001, components.get(0).size());
    }

    private static RoadGraph build(List<CanonicalEdgeRecord> records) {
        return new GraphBuilder().build(new EdgeExpander().expandAll(records));
    }

    private static Set<Set<Long>> asSets(List<SortedSet<Long>> components) {
        return components.stream().map(Set::copyOf).collect(Collectors.toSet());
    }
}
