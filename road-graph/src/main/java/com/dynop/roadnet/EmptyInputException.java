package com.dynop.roadnet;

/**
 * Thrown when there are no usable segment records, either because the input was empty or because
 * the vintage's filtering removed every record.
 */
public class EmptyInputException extends RoadNetworkException {
    
    public static final String ERROR_CODE = "EMPTY_INPUT";
    
    public EmptyInputException(String message) {
        super(ERROR_CODE, message);
    }
}
