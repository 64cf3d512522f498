package com.ainp.api.common;

/**
 * Rejected caller input, such as an invalid split or a non-participant DID.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
