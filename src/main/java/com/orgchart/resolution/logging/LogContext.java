package com.orgchart.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper that tags log lines of a build, an import or a match call.
 * Entries are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBuild(buildId)) {
 *     log.info("hierarchy.built nodes={} unattached={}", size, unattached);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String BUILD_ID = "buildId";
    public static final String CORRELATION_ID = "correlationId";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a hierarchy build.
     */
    public static LogContext forBuild(String buildId) {
        LogContext ctx = new LogContext();
        ctx.put(BUILD_ID, buildId);
        ctx.put(OPERATION, "build");
        return ctx;
    }

    /**
     * Creates a log context for a snapshot import.
     */
    public static LogContext forImport(String source) {
        LogContext ctx = new LogContext();
        ctx.put("source", source);
        ctx.put(OPERATION, "import");
        return ctx;
    }

    /**
     * Creates a log context for a cross-dataset match.
     */
    public static LogContext forMatch(String correlationId, String targetName) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put("target", targetName);
        ctx.put(OPERATION, "match");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
