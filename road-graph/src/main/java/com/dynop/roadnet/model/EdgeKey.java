package com.dynop.roadnet.model;

import java.util.Objects;

/**
 * Key distinguishing parallel edges between the same ordered pair of junctions.
 * 
 * <p>A key combines the road id with the orientation of the edge, so the synthesized reverse copy
 * of a road never collides with the forward edge of another road, whatever ids the source uses.
 */
public final class EdgeKey {
    
    private final String roadId;
    private final EdgeOrientation orientation;
    
    public EdgeKey(String roadId, EdgeOrientation orientation) {
        this.roadId = Objects.requireNonNull(roadId, "roadId");
        this.orientation = Objects.requireNonNull(orientation, "orientation");
    }
    
    public static EdgeKey forward(String roadId) {
        return new EdgeKey(roadId, EdgeOrientation.FORWARD);
    }
    
    public static EdgeKey reverse(String roadId) {
        return new EdgeKey(roadId, EdgeOrientation.REVERSE);
    }
    
    public String getRoadId() {
        return roadId;
    }
    
    public EdgeOrientation getOrientation() {
        return orientation;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EdgeKey edgeKey = (EdgeKey) o;
        return roadId.equals(edgeKey.roadId) && orientation == edgeKey.orientation;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(roadId, orientation);
    }
    
    @Override
    public String toString() {
        return orientation == EdgeOrientation.FORWARD ? roadId : roadId + "~rev";
    }
}
