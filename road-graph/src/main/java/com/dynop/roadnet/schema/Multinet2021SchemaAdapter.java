package com.dynop.roadnet.schema;

import com.dynop.roadnet.SchemaException;
import com.dynop.roadnet.model.CanonicalEdgeRecord;
import com.dynop.roadnet.model.RawSegmentRecord;
import com.dynop.roadnet.model.TravelDirection;
import org.locationtech.jts.geom.LineString;

import java.util.List;
import java.util.OptionalDouble;
import java.util.logging.Logger;

/**
 * Adapter for the TomTom Multinet 2021 network table.
 * 
 * <h2>Fields</h2>
 * <table>
 *   <tr><th>Field</th><th>Use</th></tr>
 *   <tr><td>{@code junction_id_from}, {@code junction_id_to}</td><td>Junction ids (required integers)</td></tr>
 *   <tr><td>{@code netw_id}</td><td>Road id (required, integer or text)</td></tr>
 *   <tr><td>{@code centimeters}</td><td>Length, {@code km = cm * 0.00001} (required)</td></tr>
 *   <tr><td>{@code speed_average_pos}, {@code speed_average_neg}</td><td>Average speed per direction in km/h, default 20</td></tr>
 *   <tr><td>{@code simple_traffic_direction}</td><td>{@code 1}/{@code 9} both, {@code 2} forward, {@code 3} backward</td></tr>
 * </table>
 * 
 * <p>This vintage has no quality filter. Direction codes other than the four above are rejected.
 */
public final class Multinet2021SchemaAdapter extends AbstractMultinetSchemaAdapter {
    
    private static final Logger LOGGER = Logger.getLogger(Multinet2021SchemaAdapter.class.getName());
    
    public static final String VINTAGE_TAG = "2021";
    
    static final String FIELD_FROM = "junction_id_from";
    static final String FIELD_TO = "junction_id_to";
    static final String FIELD_ROAD_ID = "netw_id";
    static final String FIELD_CENTIMETERS = "centimeters";
    static final String FIELD_SPEED_POS = "speed_average_pos";
    static final String FIELD_SPEED_NEG = "speed_average_neg";
    static final String FIELD_DIRECTION = "simple_traffic_direction";
    static final String FIELD_GEOMETRY = "geom";
    
    private static final double KILOMETERS_PER_CENTIMETER = 0.00001;
    
    @Override
    public String getVintageTag() {
        return VINTAGE_TAG;
    }
    
    @Override
    protected boolean isRoutable(RawSegmentRecord record, int index) {
        return true;
    }
    
    @Override
    protected CanonicalEdgeRecord toCanonical(RawSegmentRecord record, int index, List<String> defaultedSpeedRoadIds) {
        long from = RawFieldReader.requireLong(record, index, FIELD_FROM);
        long to = RawFieldReader.requireLong(record, index, FIELD_TO);
        String roadId = RawFieldReader.requireRoadId(record, index, FIELD_ROAD_ID);
        LineString geometry = RawFieldReader.requireGeometry(record, index, FIELD_GEOMETRY);
        TravelDirection direction = parseDirection(record, index);
        
        OptionalDouble centimeters = RawFieldReader.optionalDouble(record, index, FIELD_CENTIMETERS);
        if (centimeters.isEmpty()) {
            throw new SchemaException(index, FIELD_CENTIMETERS, "required length is missing");
        }
        double distanceKm = RawFieldReader.requireNonNegative(centimeters.getAsDouble(), index, FIELD_CENTIMETERS)
            * KILOMETERS_PER_CENTIMETER;
        
        OptionalDouble speedPos = RawFieldReader.optionalDouble(record, index, FIELD_SPEED_POS);
        OptionalDouble speedNeg = RawFieldReader.optionalDouble(record, index, FIELD_SPEED_NEG);
        boolean defaulted = !isUsableSpeed(speedPos) || !isUsableSpeed(speedNeg);
        if (defaulted) {
            defaultedSpeedRoadIds.add(roadId);
            LOGGER.fine(() -> "Default speed applied to road " + roadId);
        }
        
        double forwardMinutes = minutes(distanceKm, speedOrDefault(speedPos));
        double backwardMinutes = minutes(distanceKm, speedOrDefault(speedNeg));
        
        return new CanonicalEdgeRecord(from, to, roadId, geometry, distanceKm,
            forwardMinutes, backwardMinutes, direction);
    }
    
    private static TravelDirection parseDirection(RawSegmentRecord record, int index) {
        long code = RawFieldReader.requireLong(record, index, FIELD_DIRECTION);
        if (code == 1 || code == 9) {
            return TravelDirection.BOTH;
        }
        if (code == 2) {
            return TravelDirection.FORWARD;
        }
        if (code == 3) {
            return TravelDirection.BACKWARD;
        }
        throw new SchemaException(index, FIELD_DIRECTION, "unrecognized traffic direction code " + code);
    }
    
    // zero speeds would yield infinite travel times
    private static boolean isUsableSpeed(OptionalDouble speed) {
        return speed.isPresent() && speed.getAsDouble() > 0 && !Double.isInfinite(speed.getAsDouble());
    }
    
    private static double speedOrDefault(OptionalDouble speed) {
        return isUsableSpeed(speed) ? speed.getAsDouble() : DEFAULT_SPEED_KMH;
    }
}
