package com.orgchart.resolution.diagnostics;

import java.util.Objects;

/**
 * A single data-quality event.
 *
 * @param type       event kind
 * @param severity   event severity
 * @param entityName name of the record concerned, may be null
 * @param message    human-readable detail
 */
public record Diagnostic(DiagnosticType type, Severity severity, String entityName, String message) {

    public Diagnostic {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(severity, "severity is required");
        message = message != null ? message : "";
    }

    public static Diagnostic of(DiagnosticType type, String entityName, String message) {
        return new Diagnostic(type, type.defaultSeverity(), entityName, message);
    }

    @Override
    public String toString() {
        return severity + " " + type + " name='" + entityName + "': " + message;
    }
}
