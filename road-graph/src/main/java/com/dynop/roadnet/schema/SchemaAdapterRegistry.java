package com.dynop.roadnet.schema;

import com.dynop.roadnet.UnsupportedVintageException;
import com.dynop.roadnet.model.RawSegmentRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Registry holding one {@link SchemaAdapter} per supported source vintage.
 * 
 * <p>Selection is always by explicit tag:
 * <pre>{@code
 * NormalizationResult result = SchemaAdapterRegistry.defaults().normalize(rawRecords, "2021");
 * }</pre>
 */
public final class SchemaAdapterRegistry {
    
    private static final Logger LOGGER = Logger.getLogger(SchemaAdapterRegistry.class.getName());
    
    private final Map<String, SchemaAdapter> adapters;
    
    /**
     * @param adapters Adapters to register; tags must be unique
     * @throws IllegalArgumentException if two adapters share a vintage tag
     */
    public SchemaAdapterRegistry(List<? extends SchemaAdapter> adapters) {
        Map<String, SchemaAdapter> byTag = new LinkedHashMap<>();
        for (SchemaAdapter adapter : Objects.requireNonNull(adapters, "adapters")) {
            String tag = Objects.requireNonNull(adapter.getVintageTag(), "vintageTag");
            if (byTag.putIfAbsent(tag, adapter) != null) {
                throw new IllegalArgumentException("Duplicate schema adapter for vintage " + tag);
            }
        }
        this.adapters = Collections.unmodifiableMap(byTag);
        LOGGER.fine(() -> "SchemaAdapterRegistry initialized with vintages " + this.adapters.keySet());
    }
    
    /**
     * @return Registry with the Multinet 2021 and 2017 adapters
     */
    public static SchemaAdapterRegistry defaults() {
        return new SchemaAdapterRegistry(List.of(new Multinet2021SchemaAdapter(), new Multinet2017SchemaAdapter()));
    }
    
    /**
     * @param vintageTag Vintage tag (e.g. "2017")
     * @return Adapter for the vintage
     * @throws UnsupportedVintageException if no adapter is registered for the tag
     */
    public SchemaAdapter getAdapter(String vintageTag) {
        SchemaAdapter adapter = vintageTag != null ? adapters.get(vintageTag.trim()) : null;
        if (adapter == null) {
            throw new UnsupportedVintageException(vintageTag, adapters.keySet());
        }
        return adapter;
    }
    
    /**
     * Normalize raw records with the adapter registered for {@code vintageTag}.
     * 
     * @throws UnsupportedVintageException if the tag is unknown; nothing is normalized in that case
     */
    public NormalizationResult normalize(List<RawSegmentRecord> rawRecords, String vintageTag) {
        return getAdapter(vintageTag).normalize(rawRecords);
    }
    
    /**
     * @return Registered vintage tags in registration order
     */
    public Set<String> getSupportedVintages() {
        return adapters.keySet();
    }
}
