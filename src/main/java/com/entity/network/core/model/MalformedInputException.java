package com.entity.network.core.model;

/**
 * Thrown when an input record cannot be accepted: an entity kind outside the closed set,
 * or an empty surface name. Ingestion catches it per record and skips the record.
 */
public class MalformedInputException extends RuntimeException {

    public MalformedInputException(String message) {
        super(message);
    }
}
