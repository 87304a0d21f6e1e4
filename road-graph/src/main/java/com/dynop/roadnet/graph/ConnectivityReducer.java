package com.dynop.roadnet.graph;

import com.dynop.roadnet.NotRoutableException;
import com.dynop.roadnet.model.DirectedEdge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.logging.Logger;

/**
 * Reduces a graph to its largest strongly connected component, so that every retained junction can
 * reach every other one.
 * 
 * <p>The largest component is the one with the most nodes. Between components of equal size the one
 * containing the lowest node id wins, so the result does not depend on edge insertion order.
 * The induced subgraph keeps exactly the edges whose two endpoints lie in the winning component.
 * Reducing an already reduced graph returns an equal graph.
 */
public final class ConnectivityReducer {
    
    private static final Logger LOGGER = Logger.getLogger(ConnectivityReducer.class.getName());
    
    private static final Comparator<SortedSet<Long>> LARGEST_FIRST =
        Comparator.<SortedSet<Long>>comparingInt(SortedSet::size).reversed()
            .thenComparingLong(SortedSet::first);
    
    /**
     * @param graph Graph to reduce
     * @return Induced subgraph on the largest strongly connected component, with the input's metadata
     * @throws NotRoutableException if the graph has no edges, or no edge survives the reduction
     */
    public RoadGraph reduce(RoadGraph graph) {
        Objects.requireNonNull(graph, "graph");
        if (graph.getEdgeCount() == 0) {
            throw new NotRoutableException(
                "road network has no strongly connected components and is not routable; check polygon boundaries.");
        }
        
        List<SortedSet<Long>> components = StronglyConnectedComponents.of(graph);
        SortedSet<Long> largest = selectLargest(components);
        
        List<DirectedEdge> retained = new ArrayList<>();
        for (DirectedEdge edge : graph.getEdges()) {
            if (largest.contains(edge.getFrom()) && largest.contains(edge.getTo())) {
                retained.add(edge);
            }
        }
        if (retained.isEmpty()) {
            throw new NotRoutableException(String.format(
                "largest strongly connected component of %d node(s) has no edges; road network is not routable",
                largest.size()));
        }
        
        if (components.size() > 1) {
            LOGGER.info(() -> String.format("Kept largest of %d strongly connected components: %d of %d nodes, %d of %d edges",
                components.size(), largest.size(), graph.getNodeCount(), retained.size(), graph.getEdgeCount()));
        }
        return graph.withEdges(retained);
    }
    
    /**
     * @param components Non-empty list of components
     * @return Component with the most nodes, lowest minimum node id on ties
     */
    static SortedSet<Long> selectLargest(List<SortedSet<Long>> components) {
        return components.stream()
            .min(LARGEST_FIRST)
            .orElseThrow(() -> new NotRoutableException("road network has no nodes"));
    }
}
