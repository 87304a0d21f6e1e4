package com.dynop.roadnet.model;

/**
 * Orientation of a directed edge relative to the segment it was expanded from.
 */
public enum EdgeOrientation {
    /**
     * Edge follows the digitized geometry order.
     */
    FORWARD,
    
    /**
     * Synthesized edge running against the digitized geometry order.
     */
    REVERSE
}
