package com.dynop.roadnet.builder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Figures of one offline build, written to {@code build_summary.json}.
 */
@JsonPropertyOrder({"vintage", "crs", "raw_record_count", "filtered_record_count", "defaulted_speed_count",
    "assembled_node_count", "assembled_edge_count", "node_count", "edge_count", "edge_collision_count",
    "distance_key", "time_key", "geometry_key", "road_id_key", "build_duration_ms", "build_timestamp"})
public final class BuildSummary {
    
    private final String vintage;
    private final String crs;
    private final int rawRecordCount;
    private final int filteredRecordCount;
    private final int defaultedSpeedCount;
    private final int assembledNodeCount;
    private final int assembledEdgeCount;
    private final int nodeCount;
    private final int edgeCount;
    private final int edgeCollisionCount;
    private final String distanceKey;
    private final String timeKey;
    private final String geometryKey;
    private final String roadIdKey;
    private final long buildDurationMs;
    private final String buildTimestamp;
    
    @JsonCreator
    public BuildSummary(
            @JsonProperty("vintage") String vintage,
            @JsonProperty("crs") String crs,
            @JsonProperty("raw_record_count") int rawRecordCount,
            @JsonProperty("filtered_record_count") int filteredRecordCount,
            @JsonProperty("defaulted_speed_count") int defaultedSpeedCount,
            @JsonProperty("assembled_node_count") int assembledNodeCount,
            @JsonProperty("assembled_edge_count") int assembledEdgeCount,
            @JsonProperty("node_count") int nodeCount,
            @JsonProperty("edge_count") int edgeCount,
            @JsonProperty("edge_collision_count") int edgeCollisionCount,
            @JsonProperty("distance_key") String distanceKey,
            @JsonProperty("time_key") String timeKey,
            @JsonProperty("geometry_key") String geometryKey,
            @JsonProperty("road_id_key") String roadIdKey,
            @JsonProperty("build_duration_ms") long buildDurationMs,
            @JsonProperty("build_timestamp") String buildTimestamp) {
        this.vintage = vintage;
        this.crs = crs;
        this.rawRecordCount = rawRecordCount;
        this.filteredRecordCount = filteredRecordCount;
        this.defaultedSpeedCount = defaultedSpeedCount;
        this.assembledNodeCount = assembledNodeCount;
        this.assembledEdgeCount = assembledEdgeCount;
        this.nodeCount = nodeCount;
        this.edgeCount = edgeCount;
        this.edgeCollisionCount = edgeCollisionCount;
        this.distanceKey = distanceKey;
        this.timeKey = timeKey;
        this.geometryKey = geometryKey;
        this.roadIdKey = roadIdKey;
        this.buildDurationMs = buildDurationMs;
        this.buildTimestamp = buildTimestamp;
    }
    
    @JsonProperty("vintage")
    public String getVintage() {
        return vintage;
    }
    
    @JsonProperty("crs")
    public String getCrs() {
        return crs;
    }
    
    @JsonProperty("raw_record_count")
    public int getRawRecordCount() {
        return rawRecordCount;
    }
    
    @JsonProperty("filtered_record_count")
    public int getFilteredRecordCount() {
        return filteredRecordCount;
    }
    
    @JsonProperty("defaulted_speed_count")
    public int getDefaultedSpeedCount() {
        return defaultedSpeedCount;
    }
    
    @JsonProperty("assembled_node_count")
    public int getAssembledNodeCount() {
        return assembledNodeCount;
    }
    
    @JsonProperty("assembled_edge_count")
    public int getAssembledEdgeCount() {
        return assembledEdgeCount;
    }
    
    @JsonProperty("node_count")
    public int getNodeCount() {
        return nodeCount;
    }
    
    @JsonProperty("edge_count")
    public int getEdgeCount() {
        return edgeCount;
    }
    
    @JsonProperty("edge_collision_count")
    public int getEdgeCollisionCount() {
        return edgeCollisionCount;
    }
    
    @JsonProperty("distance_key")
    public String getDistanceKey() {
        return distanceKey;
    }
    
    @JsonProperty("time_key")
    public String getTimeKey() {
        return timeKey;
    }
    
    @JsonProperty("geometry_key")
    public String getGeometryKey() {
        return geometryKey;
    }
    
    @JsonProperty("road_id_key")
    public String getRoadIdKey() {
        return roadIdKey;
    }
    
    @JsonProperty("build_duration_ms")
    public long getBuildDurationMs() {
        return buildDurationMs;
    }
    
    @JsonProperty("build_timestamp")
    public String getBuildTimestamp() {
        return buildTimestamp;
    }
}
