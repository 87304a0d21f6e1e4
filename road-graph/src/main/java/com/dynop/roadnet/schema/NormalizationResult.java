package com.dynop.roadnet.schema;

import com.dynop.roadnet.model.CanonicalEdgeRecord;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link SchemaAdapter#normalize(List)}.
 * 
 * <p>Besides the canonical records it reports how many raw records the vintage filtered out as
 * unusable and which roads had a missing speed replaced by the default speed.
 */
public final class NormalizationResult {
    
    private final String vintageTag;
    private final List<CanonicalEdgeRecord> records;
    private final int rawRecordCount;
    private final int filteredRecordCount;
    private final List<String> defaultedSpeedRoadIds;
    
    public NormalizationResult(String vintageTag, List<CanonicalEdgeRecord> records,
                               int rawRecordCount, int filteredRecordCount,
                               List<String> defaultedSpeedRoadIds) {
        this.vintageTag = Objects.requireNonNull(vintageTag, "vintageTag");
        this.records = List.copyOf(records);
        this.rawRecordCount = rawRecordCount;
        this.filteredRecordCount = filteredRecordCount;
        this.defaultedSpeedRoadIds = defaultedSpeedRoadIds != null
            ? List.copyOf(defaultedSpeedRoadIds)
            : List.of();
    }
    
    public String getVintageTag() {
        return vintageTag;
    }
    
    /**
     * @return Canonical records in source order
     */
    public List<CanonicalEdgeRecord> getRecords() {
        return records;
    }
    
    /**
     * @return Number of raw records received
     */
    public int getRawRecordCount() {
        return rawRecordCount;
    }
    
    /**
     * @return Number of raw records removed by the vintage's quality filter
     */
    public int getFilteredRecordCount() {
        return filteredRecordCount;
    }
    
    /**
     * @return Road ids whose speed (in either direction) was missing and replaced by the default
     */
    public List<String> getDefaultedSpeedRoadIds() {
        return defaultedSpeedRoadIds;
    }
    
    @Override
    public String toString() {
        return String.format("NormalizationResult{vintage='%s', raw=%d, filtered=%d, records=%d, defaultedSpeeds=%d}",
                vintageTag, rawRecordCount, filteredRecordCount, records.size(), defaultedSpeedRoadIds.size());
    }
}
