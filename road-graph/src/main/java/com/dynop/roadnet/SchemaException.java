package com.dynop.roadnet;

/**
 * Thrown when a raw record violates the shape its vintage requires, e.g. a missing or non-numeric
 * junction id, or an unrecognized direction code.
 */
public class SchemaException extends RoadNetworkException {
    
    public static final String ERROR_CODE = "SCHEMA_VIOLATION";
    
    private final int recordIndex;
    private final String field;
    
    /**
     * @param recordIndex Position of the offending record in the raw input
     * @param field       Offending source field
     * @param detail      What is wrong with it
     */
    public SchemaException(int recordIndex, String field, String detail) {
        super(ERROR_CODE, String.format("record %d, field '%s': %s", recordIndex, field, detail));
        this.recordIndex = recordIndex;
        this.field = field;
    }
    
    public SchemaException(int recordIndex, String field, String detail, Throwable cause) {
        super(ERROR_CODE, String.format("record %d, field '%s': %s", recordIndex, field, detail), cause);
        this.recordIndex = recordIndex;
        this.field = field;
    }
    
    /**
     * @return Index of the offending record in the raw input
     */
    public int getRecordIndex() {
        return recordIndex;
    }
    
    /**
     * @return Name of the offending source field
     */
    public String getField() {
        return field;
    }
}
