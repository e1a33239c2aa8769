package com.orgchart.resolution.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

/**
 * Collects data-quality events so callers decide how to surface them.
 * Every event is also written to the log at its severity.
 *
 * <p>Not thread-safe; one collector belongs to one build.</p>
 */
public class DiagnosticsCollector {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticsCollector.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Records an event with the type's default severity.
     */
    public Diagnostic report(DiagnosticType type, String entityName, String message) {
        return add(Diagnostic.of(type, entityName, message));
    }

    public Diagnostic add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        switch (diagnostic.severity()) {
            case ERROR -> log.error("diagnostic.{} name='{}' {}",
                    diagnostic.type(), diagnostic.entityName(), diagnostic.message());
            case WARN -> log.warn("diagnostic.{} name='{}' {}",
                    diagnostic.type(), diagnostic.entityName(), diagnostic.message());
            default -> log.info("diagnostic.{} name='{}' {}",
                    diagnostic.type(), diagnostic.entityName(), diagnostic.message());
        }
        return diagnostic;
    }

    public void addAll(Collection<Diagnostic> others) {
        others.forEach(this::add);
    }

    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    public List<Diagnostic> ofType(DiagnosticType type) {
        return filter(d -> d.type() == type);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }

    public int size() {
        return diagnostics.size();
    }

    private List<Diagnostic> filter(Predicate<Diagnostic> predicate) {
        return diagnostics.stream().filter(predicate).toList();
    }
}
