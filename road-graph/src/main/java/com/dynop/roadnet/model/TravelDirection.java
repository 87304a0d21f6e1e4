package com.dynop.roadnet.model;

/**
 * Canonical travel direction of a road segment relative to its digitized geometry.
 * 
 * <p>Every source vintage encodes direction differently (an integer traffic-direction code in
 * Multinet 2021, a two-letter {@code oneway} string in Multinet 2017). Schema adapters map those
 * encodings onto these three cases.
 */
public enum TravelDirection {
    /**
     * Traversable only from the first geometry point to the last ({@code from -> to}).
     */
    FORWARD,
    
    /**
     * Traversable only from the last geometry point to the first ({@code to -> from}).
     */
    BACKWARD,
    
    /**
     * Traversable in both directions.
     */
    BOTH;
    
    /**
     * @return true if travel along the digitized direction is allowed
     */
    public boolean allowsForward() {
        return this != BACKWARD;
    }
    
    /**
     * @return true if travel against the digitized direction is allowed
     */
    public boolean allowsBackward() {
        return this != FORWARD;
    }
}
