package com.dynop.roadnet.model;

import org.locationtech.jts.geom.LineString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One road segment row as delivered by the record source, before any schema mapping.
 * 
 * <p>The record is deliberately untyped: attribute names and value types depend on the source
 * vintage and are interpreted only by the matching {@code SchemaAdapter}. Values are
 * {@link Number}, {@link String} or {@code null}.
 */
public final class RawSegmentRecord {
    
    private final LineString geometry;
    private final Map<String, Object> attributes;
    
    /**
     * @param geometry   Segment geometry (may be null; adapters reject it)
     * @param attributes Attribute values keyed by source column name (copied)
     */
    public RawSegmentRecord(LineString geometry, Map<String, ?> attributes) {
        this.geometry = geometry;
        this.attributes = attributes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
            : Collections.emptyMap();
    }
    
    /**
     * @return Segment geometry, or null if the source row carried none
     */
    public LineString getGeometry() {
        return geometry;
    }
    
    /**
     * @return Immutable view of all attributes
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }
    
    /**
     * @param name Source column name
     * @return Attribute value, or null if absent
     */
    public Object get(String name) {
        return attributes.get(name);
    }
    
    /**
     * @param name Source column name
     * @return true if the attribute is present with a non-null value
     */
    public boolean has(String name) {
        return attributes.get(name) != null;
    }
    
    @Override
    public String toString() {
        return "RawSegmentRecord{attributes=" + attributes + "}";
    }
}
