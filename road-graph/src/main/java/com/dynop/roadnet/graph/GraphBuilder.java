package com.dynop.roadnet.graph;

import com.dynop.roadnet.DuplicateEdgeKeyException;
import com.dynop.roadnet.model.DirectedEdge;
import com.dynop.roadnet.model.EdgeKey;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Folds a stream of directed edges into a {@link RoadGraph}.
 * 
 * <p>Every endpoint becomes a node and every edge is stored under {@code (from, to, key)}. Parallel
 * edges between two junctions are kept when their keys differ. A repeated address is handled
 * according to the {@link EdgeCollisionPolicy}; it is never dropped silently.
 * 
 * <p>Insertion is single-threaded. Each {@link #build(List)} call works on its own assembly state,
 * so one builder may serve several threads.
 */
public final class GraphBuilder {
    
    private static final Logger LOGGER = Logger.getLogger(GraphBuilder.class.getName());
    
    private final EdgeCollisionPolicy collisionPolicy;
    
    public GraphBuilder() {
        this(EdgeCollisionPolicy.OVERWRITE);
    }
    
    public GraphBuilder(EdgeCollisionPolicy collisionPolicy) {
        this.collisionPolicy = Objects.requireNonNull(collisionPolicy, "collisionPolicy");
    }
    
    /**
     * @param edges Directed edges in insertion order
     * @return Graph containing all edges
     * @throws DuplicateEdgeKeyException on a repeated address under {@link EdgeCollisionPolicy#REJECT}
     */
    public RoadGraph build(List<DirectedEdge> edges) {
        Objects.requireNonNull(edges, "edges");
        Map<EdgeAddress, DirectedEdge> assembled = new LinkedHashMap<>(edges.size() * 2);
        int collisions = 0;
        
        for (DirectedEdge edge : edges) {
            EdgeAddress address = new EdgeAddress(edge.getFrom(), edge.getTo(), edge.getKey());
            DirectedEdge previous = assembled.put(address, edge);
            if (previous != null) {
                if (collisionPolicy == EdgeCollisionPolicy.REJECT) {
                    throw new DuplicateEdgeKeyException(edge.getFrom(), edge.getTo(), edge.getKey());
                }
                collisions++;
                LOGGER.warning(() -> String.format("Edge %d -> %d with key %s inserted twice; keeping the later one",
                    edge.getFrom(), edge.getTo(), edge.getKey()));
            }
        }
        
        RoadGraph graph = new RoadGraph(assembled.values(), null, collisions);
        LOGGER.info(() -> String.format("Graph built: %d nodes, %d edges", graph.getNodeCount(), graph.getEdgeCount()));
        return graph;
    }
    
    public EdgeCollisionPolicy getCollisionPolicy() {
        return collisionPolicy;
    }
    
    private static final class EdgeAddress {
        final long from;
        final long to;
        final EdgeKey key;
        
        EdgeAddress(long from, long to, EdgeKey key) {
            this.from = from;
            this.to = to;
            this.key = key;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof EdgeAddress)) return false;
            EdgeAddress that = (EdgeAddress) o;
            return from == that.from && to == that.to && key.equals(that.key);
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(from, to, key);
        }
    }
}
