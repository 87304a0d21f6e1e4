package com.dynop.roadnet.graph;

import com.dynop.roadnet.model.DirectedEdge;
import com.dynop.roadnet.model.EdgeKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable directed multigraph of road junctions.
 * 
 * <p>Nodes are the junction ids referenced by the edges. Edges are addressed by
 * {@code (from, to, key)}; several edges may connect the same ordered pair of junctions as long as
 * their keys differ. Instances are created by {@link GraphBuilder} and derived by
 * {@link ConnectivityReducer} and {@link GraphMetadataTagger}; none of them is ever modified, so a
 * graph may be shared freely between threads.
 */
public final class RoadGraph {
    
    private final SortedSet<Long> nodes;
    private final List<DirectedEdge> edges;
    private final Map<Long, List<DirectedEdge>> outgoing;
    private final GraphMetadata metadata;
    private final int collisionCount;
    
    RoadGraph(Collection<DirectedEdge> edges, GraphMetadata metadata, int collisionCount) {
        this.edges = List.copyOf(edges);
        this.metadata = metadata;
        this.collisionCount = collisionCount;
        
        SortedSet<Long> nodeIds = new TreeSet<>();
        Map<Long, List<DirectedEdge>> out = new HashMap<>();
        for (DirectedEdge edge : this.edges) {
            nodeIds.add(edge.getFrom());
            nodeIds.add(edge.getTo());
            out.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(edge);
        }
        out.replaceAll((node, list) -> Collections.unmodifiableList(list));
        this.nodes = Collections.unmodifiableSortedSet(nodeIds);
        this.outgoing = out;
    }
    
    /**
     * @return Junction ids in ascending order
     */
    public SortedSet<Long> getNodes() {
        return nodes;
    }
    
    public int getNodeCount() {
        return nodes.size();
    }
    
    /**
     * @return All edges in insertion order
     */
    public List<DirectedEdge> getEdges() {
        return edges;
    }
    
    public int getEdgeCount() {
        return edges.size();
    }
    
    public boolean containsNode(long node) {
        return nodes.contains(node);
    }
    
    /**
     * @return Edges leaving {@code node}, empty if none
     */
    public List<DirectedEdge> getOutgoingEdges(long node) {
        return outgoing.getOrDefault(node, List.of());
    }
    
    /**
     * @return Distinct junctions reachable over one edge from {@code node}
     */
    public Set<Long> getSuccessors(long node) {
        Set<Long> successors = new LinkedHashSet<>();
        for (DirectedEdge edge : getOutgoingEdges(node)) {
            successors.add(edge.getTo());
        }
        return successors;
    }
    
    /**
     * @return Parallel edges from {@code from} to {@code to}
     */
    public List<DirectedEdge> getEdges(long from, long to) {
        List<DirectedEdge> result = new ArrayList<>();
        for (DirectedEdge edge : getOutgoingEdges(from)) {
            if (edge.getTo() == to) {
                result.add(edge);
            }
        }
        return result;
    }
    
    public Optional<DirectedEdge> getEdge(long from, long to, EdgeKey key) {
        for (DirectedEdge edge : getOutgoingEdges(from)) {
            if (edge.getTo() == to && edge.getKey().equals(key)) {
                return Optional.of(edge);
            }
        }
        return Optional.empty();
    }
    
    public boolean hasEdge(long from, long to) {
        for (DirectedEdge edge : getOutgoingEdges(from)) {
            if (edge.getTo() == to) {
                return true;
            }
        }
        return false;
    }
    
    /**
     * @return Graph-level metadata, empty until the graph has been tagged
     */
    public Optional<GraphMetadata> getMetadata() {
        return Optional.ofNullable(metadata);
    }
    
    /**
     * @return Number of edges that were overwritten by a later edge with the same address while building
     */
    public int getCollisionCount() {
        return collisionCount;
    }
    
    RoadGraph withMetadata(GraphMetadata newMetadata) {
        return new RoadGraph(edges, newMetadata, collisionCount);
    }
    
    RoadGraph withEdges(Collection<DirectedEdge> retainedEdges) {
        return new RoadGraph(retainedEdges, metadata, collisionCount);
    }
    
    @Override
    public String toString() {
        return String.format("RoadGraph{nodes=%d, edges=%d, metadata=%s}", nodes.size(), edges.size(), metadata);
    }
}
