package com.dynop.roadnet.export;

import com.graphhopper.routing.ev.BooleanEncodedValue;
import com.graphhopper.routing.ev.DecimalEncodedValue;
import com.graphhopper.storage.BaseGraph;

import java.util.Collections;
import java.util.Map;

/**
 * A GraphHopper graph produced by {@link GraphHopperGraphConverter}, together with its encoded values
 * and the mapping from junction ids to GraphHopper node indices.
 */
public final class ConvertedGraph implements AutoCloseable {
    
    private final BaseGraph baseGraph;
    private final BooleanEncodedValue accessEnc;
    private final DecimalEncodedValue speedEnc;
    private final Map<Long, Integer> nodeIndex;
    
    ConvertedGraph(BaseGraph baseGraph, BooleanEncodedValue accessEnc, DecimalEncodedValue speedEnc,
                   Map<Long, Integer> nodeIndex) {
        this.baseGraph = baseGraph;
        this.accessEnc = accessEnc;
        this.speedEnc = speedEnc;
        this.nodeIndex = Collections.unmodifiableMap(nodeIndex);
    }
    
    public BaseGraph getBaseGraph() {
        return baseGraph;
    }
    
    public BooleanEncodedValue getAccessEnc() {
        return accessEnc;
    }
    
    public DecimalEncodedValue getSpeedEnc() {
        return speedEnc;
    }
    
    /**
     * @param junctionId Junction id of the road graph
     * @return GraphHopper node index
     * @throws IllegalArgumentException if the junction is not part of the graph
     */
    public int getNodeIndex(long junctionId) {
        Integer index = nodeIndex.get(junctionId);
        if (index == null) {
            throw new IllegalArgumentException("Junction " + junctionId + " is not part of the graph");
        }
        return index;
    }
    
    @Override
    public void close() {
        baseGraph.close();
    }
}
