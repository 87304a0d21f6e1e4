package com.dynop.roadnet.schema;

import com.dynop.roadnet.EmptyInputException;
import com.dynop.roadnet.model.CanonicalEdgeRecord;
import com.dynop.roadnet.model.RawSegmentRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Shared normalization loop for Multinet vintages.
 * 
 * <p>Subclasses supply the vintage-specific pieces:
 * <ul>
 *   <li>{@link #isRoutable(RawSegmentRecord, int)} - quality filter applied before normalization</li>
 *   <li>{@link #toCanonical(RawSegmentRecord, int, List)} - field mapping of one record</li>
 * </ul>
 */
abstract class AbstractMultinetSchemaAdapter implements SchemaAdapter {
    
    private static final Logger LOGGER = Logger.getLogger(AbstractMultinetSchemaAdapter.class.getName());
    
    /**
     * Speed in km/h assumed when a record carries no usable speed.
     */
    static final double DEFAULT_SPEED_KMH = 20.0;
    
    @Override
    public NormalizationResult normalize(List<RawSegmentRecord> rawRecords) {
        Objects.requireNonNull(rawRecords, "rawRecords");
        if (rawRecords.isEmpty()) {
            throw new EmptyInputException("road network has no links; check boundaries of the record source");
        }
        
        List<CanonicalEdgeRecord> records = new ArrayList<>(rawRecords.size());
        List<String> defaultedSpeedRoadIds = new ArrayList<>();
        int filtered = 0;
        
        for (int i = 0; i < rawRecords.size(); i++) {
            RawSegmentRecord raw = Objects.requireNonNull(rawRecords.get(i), "raw record " + i);
            if (!isRoutable(raw, i)) {
                filtered++;
                continue;
            }
            records.add(toCanonical(raw, i, defaultedSpeedRoadIds));
        }
        
        if (records.isEmpty()) {
            throw new EmptyInputException(String.format(
                "all %d road links were filtered out as unusable for vintage %s", rawRecords.size(), getVintageTag()));
        }
        
        int finalFiltered = filtered;
        LOGGER.info(() -> String.format("Normalized %d of %d road links (vintage %s, %d filtered, %d with default speed)",
            records.size(), rawRecords.size(), getVintageTag(), finalFiltered, defaultedSpeedRoadIds.size()));
        
        return new NormalizationResult(getVintageTag(), records, rawRecords.size(), filtered, defaultedSpeedRoadIds);
    }
    
    /**
     * @param record Raw record
     * @param index  Position in the raw input, for error reporting
     * @return false if the vintage considers the segment unusable for routing
     */
    protected abstract boolean isRoutable(RawSegmentRecord record, int index);
    
    /**
     * Map one raw record that passed {@link #isRoutable(RawSegmentRecord, int)}.
     * 
     * @param record                Raw record
     * @param index                 Position in the raw input, for error reporting
     * @param defaultedSpeedRoadIds Collector for roads whose speed was defaulted
     * @return Canonical record
     */
    protected abstract CanonicalEdgeRecord toCanonical(RawSegmentRecord record, int index,
                                                       List<String> defaultedSpeedRoadIds);
    
    /**
     * Travel time for a distance at a speed, in minutes.
     */
    static double minutes(double distanceKm, double speedKmh) {
        return (distanceKm / speedKmh) * 60;
    }
}
