package com.dynop.roadnet;

import com.dynop.roadnet.graph.ConnectivityReducer;
import com.dynop.roadnet.graph.EdgeCollisionPolicy;
import com.dynop.roadnet.graph.EdgeExpander;
import com.dynop.roadnet.graph.GraphBuilder;
import com.dynop.roadnet.graph.GraphMetadataTagger;
import com.dynop.roadnet.graph.RoadGraph;
import com.dynop.roadnet.model.CoordinateSystem;
import com.dynop.roadnet.model.DirectedEdge;
import com.dynop.roadnet.model.RawSegmentRecord;
import com.dynop.roadnet.schema.NormalizationResult;
import com.dynop.roadnet.schema.SchemaAdapterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Turns raw road segment records into a routable graph.
 * 
 * <p>Stages, in order:
 * <ol>
 *   <li>Normalize records with the schema adapter registered for the vintage</li>
 *   <li>Expand canonical records into directed edges</li>
 *   <li>Assemble the directed multigraph</li>
 *   <li>Reduce it to its largest strongly connected component</li>
 *   <li>Tag the graph with coordinate system and attribute keys</li>
 * </ol>
 * 
 * <p>Either a complete, strongly connected and tagged graph is returned or a
 * {@link RoadNetworkException} is thrown; there is no partial result.
 * 
 * <h2>Usage</h2>
 * <pre>{@code
 * RoadGraph graph = new RoadNetworkPipeline().build(records, "2021", CoordinateSystem.WGS84);
 * }</pre>
 */
public final class RoadNetworkPipeline {
    
    private static final Logger LOGGER = Logger.getLogger(RoadNetworkPipeline.class.getName());
    
    private final SchemaAdapterRegistry adapters;
    private final EdgeExpander expander;
    private final GraphBuilder graphBuilder;
    private final ConnectivityReducer reducer;
    private final GraphMetadataTagger tagger;
    
    public RoadNetworkPipeline() {
        this(SchemaAdapterRegistry.defaults(), EdgeCollisionPolicy.OVERWRITE);
    }
    
    public RoadNetworkPipeline(SchemaAdapterRegistry adapters, EdgeCollisionPolicy collisionPolicy) {
        this(adapters, new EdgeExpander(), new GraphBuilder(collisionPolicy),
            new ConnectivityReducer(), new GraphMetadataTagger());
    }
    
    public RoadNetworkPipeline(SchemaAdapterRegistry adapters, EdgeExpander expander, GraphBuilder graphBuilder,
                               ConnectivityReducer reducer, GraphMetadataTagger tagger) {
        this.adapters = Objects.requireNonNull(adapters, "adapters");
        this.expander = Objects.requireNonNull(expander, "expander");
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.tagger = Objects.requireNonNull(tagger, "tagger");
    }
    
    /**
     * Build a routable graph.
     * 
     * @param rawRecords Raw segment records in source order
     * @param vintageTag Source schema vintage (e.g. "2021")
     * @param crs        Coordinate system the record geometries are expressed in
     * @return Strongly connected, tagged graph
     * @throws UnsupportedVintageException if the vintage is not registered
     * @throws SchemaException             if a record violates its vintage's schema
     * @throws EmptyInputException         if no usable records remain
     * @throws NotRoutableException        if no edges survive the connectivity reduction
     */
    public RoadGraph build(List<RawSegmentRecord> rawRecords, String vintageTag, CoordinateSystem crs) {
        return run(rawRecords, vintageTag, crs).getGraph();
    }
    
    /**
     * Same as {@link #build(List, String, CoordinateSystem)}, additionally returning the
     * normalization bookkeeping and the size of the graph before reduction.
     */
    public PipelineResult run(List<RawSegmentRecord> rawRecords, String vintageTag, CoordinateSystem crs) {
        Objects.requireNonNull(crs, "crs");
        
        NormalizationResult normalized = adapters.normalize(rawRecords, vintageTag);
        List<DirectedEdge> edges = expander.expandAll(normalized.getRecords());
        LOGGER.info(() -> String.format("Expanded %d road links into %d directed edges",
            normalized.getRecords().size(), edges.size()));
        
        RoadGraph assembled = graphBuilder.build(edges);
        RoadGraph reduced = reducer.reduce(assembled);
        RoadGraph tagged = tagger.tagDefaults(reduced, crs);
        
        LOGGER.info(() -> String.format("Routable graph ready: %d nodes, %d edges (vintage %s, crs %s)",
            tagged.getNodeCount(), tagged.getEdgeCount(), normalized.getVintageTag(), crs));
        return new PipelineResult(tagged, normalized, assembled.getNodeCount(), assembled.getEdgeCount());
    }
    
    /**
     * Routable graph plus the figures of the run that produced it.
     */
    public static final class PipelineResult {
        private final RoadGraph graph;
        private final NormalizationResult normalization;
        private final int assembledNodeCount;
        private final int assembledEdgeCount;
        
        PipelineResult(RoadGraph graph, NormalizationResult normalization,
                       int assembledNodeCount, int assembledEdgeCount) {
            this.graph = graph;
            this.normalization = normalization;
            this.assembledNodeCount = assembledNodeCount;
            this.assembledEdgeCount = assembledEdgeCount;
        }
        
        public RoadGraph getGraph() {
            return graph;
        }
        
        public NormalizationResult getNormalization() {
            return normalization;
        }
        
        /**
         * @return Node count before the connectivity reduction
         */
        public int getAssembledNodeCount() {
            return assembledNodeCount;
        }
        
        /**
         * @return Edge count before the connectivity reduction
         */
        public int getAssembledEdgeCount() {
            return assembledEdgeCount;
        }
    }
}
