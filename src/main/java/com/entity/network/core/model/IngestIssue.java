package com.entity.network.core.model;

import java.util.Objects;

/**
 * A single-record problem isolated from the run.
 *
 * @param type     the issue category
 * @param location where the record came from (feed line, document id, ...)
 * @param value    the offending value as read
 * @param message  human readable description
 */
public record IngestIssue(Type type, String location, String value, String message) {

    public enum Type {
        MALFORMED_INPUT,
        UNRESOLVED_REFERENCE
    }

    public IngestIssue {
        Objects.requireNonNull(type, "type is required");
        location = location != null ? location : "";
        value = value != null ? value : "";
        message = message != null ? message : "";
    }

    public static IngestIssue malformed(String location, String value, String message) {
        return new IngestIssue(Type.MALFORMED_INPUT, location, value, message);
    }

    public static IngestIssue unresolved(String location, String value, String message) {
        return new IngestIssue(Type.UNRESOLVED_REFERENCE, location, value, message);
    }
}
