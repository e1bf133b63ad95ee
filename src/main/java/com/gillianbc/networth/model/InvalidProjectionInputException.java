package com.gillianbc.networth.model;

/**
 * Raised before a projection starts when a profile, horizon, model name or
 * scenario delta is not acceptable.
 */
public class InvalidProjectionInputException extends IllegalArgumentException {

    public InvalidProjectionInputException(String message) {
        super(message);
    }
}
