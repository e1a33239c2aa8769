package com.orgchart.resolution.hierarchy;

import com.orgchart.resolution.alias.LookupContext;
import com.orgchart.resolution.diagnostics.Diagnostic;
import com.orgchart.resolution.diagnostics.DiagnosticType;

import java.util.List;
import java.util.Objects;

/**
 * Terminal state of a build: every input record is either in the tree or in {@code unattached}.
 *
 * @param tree        the tree
 * @param unattached  records left out of the tree, in detection order
 * @param diagnostics every data-quality event of the build
 * @param context     lookup context over the root and the non-root records, reusable for matching
 */
public record BuildResult(
        HierarchyTree tree,
        List<UnattachedRecord> unattached,
        List<Diagnostic> diagnostics,
        LookupContext context
) {
    public BuildResult {
        Objects.requireNonNull(tree, "tree is required");
        Objects.requireNonNull(context, "context is required");
        unattached = unattached == null ? List.of() : List.copyOf(unattached);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public boolean isComplete() {
        return unattached.isEmpty();
    }

    public List<Diagnostic> diagnosticsOfType(DiagnosticType type) {
        return diagnostics.stream().filter(d -> d.type() == type).toList();
    }
}
