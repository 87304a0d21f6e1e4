package com.dynop.roadnet.schema;

import com.dynop.roadnet.model.CanonicalEdgeRecord;
import com.dynop.roadnet.model.RawSegmentRecord;
import com.dynop.roadnet.model.TravelDirection;
import org.locationtech.jts.geom.LineString;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Adapter for the TomTom Multinet 2017 table.
 * 
 * <h2>Fields</h2>
 * <table>
 *   <tr><th>Field</th><th>Use</th></tr>
 *   <tr><td>{@code id}</td><td>Road id (required integer)</td></tr>
 *   <tr><td>{@code f_jnctid}, {@code t_jnctid}</td><td>Junction ids (required integers)</td></tr>
 *   <tr><td>{@code meters}</td><td>Length, {@code km = m / 1000}, default 0</td></tr>
 *   <tr><td>{@code minutes}</td><td>Precomputed travel time used for both directions, default 0</td></tr>
 *   <tr><td>{@code oneway}</td><td>Exactly {@code FT} forward, exactly {@code TF} backward, anything else both</td></tr>
 *   <tr><td>{@code rdcond}, {@code frc}</td><td>Quality filter</td></tr>
 * </table>
 * 
 * <p>Only segments with road condition {@code rdcond < 2} (paved or unpaved) and functional road
 * class {@code frc < 8} are routable; segments missing either flag are dropped as well. The
 * remaining records get zero for any missing length or time. {@code backrd}, {@code privaterd}
 * and {@code roughrd} travel along in the raw record but do not affect the graph.
 */
public final class Multinet2017SchemaAdapter extends AbstractMultinetSchemaAdapter {
    
    public static final String VINTAGE_TAG = "2017";
    
    static final String FIELD_ROAD_ID = "id";
    static final String FIELD_FROM = "f_jnctid";
    static final String FIELD_TO = "t_jnctid";
    static final String FIELD_METERS = "meters";
    static final String FIELD_MINUTES = "minutes";
    static final String FIELD_ONEWAY = "oneway";
    static final String FIELD_ROAD_CONDITION = "rdcond";
    static final String FIELD_FUNCTIONAL_CLASS = "frc";
    static final String FIELD_GEOMETRY = "wkb_geometry";
    
    private static final double MAX_ROAD_CONDITION = 2;
    private static final double MAX_FUNCTIONAL_CLASS = 8;
    
    @Override
    public String getVintageTag() {
        return VINTAGE_TAG;
    }
    
    @Override
    protected boolean isRoutable(RawSegmentRecord record, int index) {
        OptionalDouble roadCondition = RawFieldReader.optionalDouble(record, index, FIELD_ROAD_CONDITION);
        OptionalDouble functionalClass = RawFieldReader.optionalDouble(record, index, FIELD_FUNCTIONAL_CLASS);
        return roadCondition.isPresent() && roadCondition.getAsDouble() < MAX_ROAD_CONDITION
            && functionalClass.isPresent() && functionalClass.getAsDouble() < MAX_FUNCTIONAL_CLASS;
    }
    
    @Override
    protected CanonicalEdgeRecord toCanonical(RawSegmentRecord record, int index, List<String> defaultedSpeedRoadIds) {
        String roadId = Long.toString(RawFieldReader.requireLong(record, index, FIELD_ROAD_ID));
        long from = RawFieldReader.requireLong(record, index, FIELD_FROM);
        long to = RawFieldReader.requireLong(record, index, FIELD_TO);
        LineString geometry = RawFieldReader.requireGeometry(record, index, FIELD_GEOMETRY);
        
        double meters = RawFieldReader.requireNonNegative(
            RawFieldReader.optionalDouble(record, index, FIELD_METERS).orElse(0), index, FIELD_METERS);
        double minutes = RawFieldReader.requireNonNegative(
            RawFieldReader.optionalDouble(record, index, FIELD_MINUTES).orElse(0), index, FIELD_MINUTES);
        
        return new CanonicalEdgeRecord(from, to, roadId, geometry, meters / 1000,
            minutes, minutes, parseDirection(record));
    }
    
    private static TravelDirection parseDirection(RawSegmentRecord record) {
        // case-sensitive: "ft" is not a Multinet flag value
        String oneway = RawFieldReader.optionalString(record, FIELD_ONEWAY).orElse("");
        switch (oneway) {
            case "FT":
                return TravelDirection.FORWARD;
            case "TF":
                return TravelDirection.BACKWARD;
            default:
                return TravelDirection.BOTH;
        }
    }
}
