package com.dynop.roadnet;

import com.dynop.roadnet.model.CanonicalEdgeRecord;
import com.dynop.roadnet.model.RawSegmentRecord;
import com.dynop.roadnet.model.TravelDirection;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;

import java.util.HashMap;
import java.util.Map;

/**
 * Shared builders for geometries and records used across tests.
 */
public final class RoadFixtures {
    
    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();
    
    private RoadFixtures() {
    }
    
    /**
     * @param xy Alternating x and y values
     */
    public static LineString line(double... xy) {
        Coordinate[] coords = new Coordinate[xy.length / 2];
        for (int i = 0; i < coords.length; i++) {
            coords[i] = new Coordinate(xy[2 * i], xy[2 * i + 1]);
        }
        return GEOMETRY_FACTORY.createLineString(coords);
    }
    
    /**
     * Straight two-point segment between two junctions laid out on a 0.01° grid by id.
     */
    public static LineString segment(long from, long to) {
        return line(from * 0.01, 50.0, to * 0.01, 50.0);
    }
    
    public static CanonicalEdgeRecord canonical(long from, long to, String roadId, TravelDirection direction,
                                                double km, double forwardMinutes, double backwardMinutes) {
        return new CanonicalEdgeRecord(from, to, roadId, segment(from, to), km, forwardMinutes, backwardMinutes, direction);
    }
    
    public static CanonicalEdgeRecord twoWay(long from, long to, String roadId) {
        return canonical(from, to, roadId, TravelDirection.BOTH, 1.0, 1.0, 1.0);
    }
    
    public static CanonicalEdgeRecord oneWay(long from, long to, String roadId) {
        return canonical(from, to, roadId, TravelDirection.FORWARD, 1.0, 1.0, 1.0);
    }
    
    /**
     * Multinet 2021 row with 60 km/h in both directions.
     */
    public static Map<String, Object> multinet2021(Object netwId, long from, long to, int direction, double centimeters) {
        Map<String, Object> row = new HashMap<>();
        row.put("netw_id", netwId);
        row.put("junction_id_from", from);
        row.put("junction_id_to", to);
        row.put("simple_traffic_direction", direction);
        row.put("centimeters", centimeters);
        row.put("speed_average_pos", 60.0);
        row.put("speed_average_neg", 60.0);
        return row;
    }
    
    /**
     * Multinet 2017 row on a paved (rdcond 1), major (frc 3) road.
     */
    public static Map<String, Object> multinet2017(long id, long from, long to, String oneway, double meters, double minutes) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("f_jnctid", from);
        row.put("t_jnctid", to);
        row.put("oneway", oneway);
        row.put("meters", meters);
        row.put("minutes", minutes);
        row.put("rdcond", 1);
        row.put("frc", 3);
        return row;
    }
    
    public static RawSegmentRecord raw(Map<String, Object> row, long from, long to) {
        return new RawSegmentRecord(segment(from, to), row);
    }
}
