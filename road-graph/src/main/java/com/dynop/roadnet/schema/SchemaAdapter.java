package com.dynop.roadnet.schema;

import com.dynop.roadnet.model.RawSegmentRecord;

import java.util.List;

/**
 * Maps the raw records of one source schema vintage onto {@link com.dynop.roadnet.model.CanonicalEdgeRecord}s.
 * 
 * <p>One implementation exists per supported vintage. Adapters are selected explicitly by tag through
 * {@link SchemaAdapterRegistry}; they never guess a vintage from the fields a record happens to carry.
 * Implementations are stateless and safe to share between threads.
 */
public interface SchemaAdapter {
    
    /**
     * @return Vintage tag this adapter handles (e.g. "2021")
     */
    String getVintageTag();
    
    /**
     * Normalize a batch of raw records.
     * 
     * @param rawRecords Raw records in source order
     * @return Canonical records plus bookkeeping about filtered and defaulted records
     * @throws com.dynop.roadnet.EmptyInputException if the input, or the filtered input, is empty
     * @throws com.dynop.roadnet.SchemaException     if a record violates the vintage's required shape
     */
    NormalizationResult normalize(List<RawSegmentRecord> rawRecords);
}
