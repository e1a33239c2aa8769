package com.orgchart.resolution.hierarchy;

import com.orgchart.resolution.alias.AliasIndex;
import com.orgchart.resolution.alias.LookupContext;
import com.orgchart.resolution.core.model.EntityRecord;
import com.orgchart.resolution.diagnostics.DiagnosticType;
import com.orgchart.resolution.diagnostics.DiagnosticsCollector;
import com.orgchart.resolution.rules.DefaultNormalizationRules;
import com.orgchart.resolution.rules.NormalizationEngine;
import com.orgchart.resolution.similarity.FuzzyMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Collator;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reconstructs the organization tree from flat records whose parents are referenced by
 * free text.
 *
 * <p>Levels are processed in ascending order. For a record at level L the parent reference
 * is resolved by, in order:</p>
 * <ol>
 *   <li>exact name</li>
 *   <li>normalized canonical name, then normalized alias</li>
 *   <li>containment among level L-1 records (normalized name or alias contains, or is
 *       contained in, the normalized reference)</li>
 * </ol>
 * A parent must sit at a strictly lower level than its child, so no cycle can form.
 * Records that cannot be placed are reported as unattached, never guessed onto a parent.
 * A parent found only after normalization, such as "Deptt A" for "Dept A", is reported as a
 * fuzzy parent resolution.
 *
 * <p>A level-1 record without any parent reference goes under the root; deeper records
 * without one stay unattached. Siblings are ordered by name with a locale collator.</p>
 *
 * <p>Stateless; each call to {@link #build} owns the structures it creates.</p>
 */
public class HierarchyBuilder {
    private static final Logger log = LoggerFactory.getLogger(HierarchyBuilder.class);

    private static final int ROOT_POSITION = 0;
    private static final int UNRESOLVED = -2;

    private final NormalizationEngine normalizationEngine;
    private final FuzzyMatcher fuzzyMatcher;
    private final HierarchyOptions options;

    public HierarchyBuilder() {
        this(HierarchyOptions.defaults());
    }

    public HierarchyBuilder(HierarchyOptions options) {
        this(DefaultNormalizationRules.createDefaultEngine(), new FuzzyMatcher(), options);
    }

    public HierarchyBuilder(NormalizationEngine normalizationEngine, FuzzyMatcher fuzzyMatcher,
                            HierarchyOptions options) {
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine");
        this.fuzzyMatcher = Objects.requireNonNull(fuzzyMatcher, "fuzzyMatcher");
        this.options = Objects.requireNonNull(options, "options");
    }

    public BuildResult build(List<EntityRecord> records) {
        return build(records, new DiagnosticsCollector());
    }

    /**
     * Builds the tree.
     *
     * @param records     the snapshot, in any order
     * @param diagnostics receives every data-quality event of the build
     */
    public BuildResult build(List<EntityRecord> records, DiagnosticsCollector diagnostics) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(diagnostics, "diagnostics");

        List<UnattachedRecord> unattached = new ArrayList<>();
        EntityRecord root = null;
        for (EntityRecord record : records) {
            if (!record.isRoot()) {
                continue;
            }
            if (root == null) {
                root = record;
            } else {
                String message = "root is already '" + root.name() + "'";
                diagnostics.report(DiagnosticType.DUPLICATE_ROOT, record.name(), message);
                unattached.add(new UnattachedRecord(record, UnattachedReason.DUPLICATE_ROOT, message));
            }
        }
        boolean synthetic = root == null;
        if (synthetic) {
            root = EntityRecord.builder().name(options.getSyntheticRootName()).orgLevel(0).build();
            log.info("hierarchy.synthetic_root name='{}'", root.name());
        }

        // arena positions: the root first, then non-root records in input order
        List<EntityRecord> indexed = new ArrayList<>();
        indexed.add(root);
        records.stream().filter(r -> !r.isRoot()).forEach(indexed::add);

        LookupContext context = LookupContext.builder()
                .normalizationEngine(normalizationEngine)
                .fuzzyMatcher(fuzzyMatcher)
                .records(indexed)
                .diagnostics(diagnostics)
                .build();

        Placement placement = new Placement(indexed, context.getAliasIndex(), diagnostics, unattached);
        TreeMap<Integer, List<Integer>> levels = new TreeMap<>();
        for (int position = 1; position < indexed.size(); position++) {
            levels.computeIfAbsent(indexed.get(position).orgLevel(), k -> new ArrayList<>()).add(position);
        }
        for (Map.Entry<Integer, List<Integer>> level : levels.entrySet()) {
            List<Integer> candidates = level.getKey() == 1
                    ? List.of(ROOT_POSITION)
                    : levels.getOrDefault(level.getKey() - 1, List.of());
            for (int position : level.getValue()) {
                placement.place(position, candidates);
            }
        }

        HierarchyTree tree = layOut(indexed, placement, synthetic);
        log.info("hierarchy.built nodes={} unattached={} levels={} syntheticRoot={}",
                tree.size(), unattached.size(), levels.size(), synthetic);
        return new BuildResult(tree, unattached, diagnostics.getDiagnostics(), context);
    }

    private HierarchyTree layOut(List<EntityRecord> indexed, Placement placement, boolean synthetic) {
        int size = indexed.size();
        List<List<Integer>> children = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            children.add(new ArrayList<>());
        }
        for (int position = 1; position < size; position++) {
            if (placement.attached[position]) {
                children.get(placement.parent[position]).add(position);
            }
        }

        Collator collator = Collator.getInstance(options.getLocale());
        Comparator<Integer> byName = Comparator.<Integer, String>comparing(p -> indexed.get(p).name(), collator);
        // List.sort is stable, so equal names keep input order
        children.forEach(list -> list.sort(byName));

        int[] treeIndex = new int[size];
        Arrays.fill(treeIndex, -1);
        List<Integer> preOrder = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(ROOT_POSITION);
        while (!stack.isEmpty()) {
            int position = stack.pop();
            treeIndex[position] = preOrder.size();
            preOrder.add(position);
            List<Integer> kids = children.get(position);
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(kids.get(i));
            }
        }

        List<HierarchyNode> nodes = new ArrayList<>(preOrder.size());
        for (int position : preOrder) {
            int parentIndex = position == ROOT_POSITION
                    ? HierarchyNode.NO_PARENT
                    : treeIndex[placement.parent[position]];
            List<Integer> childIndices = children.get(position).stream().map(c -> treeIndex[c]).toList();
            nodes.add(new HierarchyNode(treeIndex[position], indexed.get(position), parentIndex, childIndices,
                    synthetic && position == ROOT_POSITION, placement.resolution[position]));
        }
        return new HierarchyTree(nodes);
    }

    private record Resolved(int position, ParentResolution method) {}

    /**
     * Mutable state of one build: parent links by arena position.
     */
    private final class Placement {
        private final List<EntityRecord> indexed;
        private final AliasIndex aliasIndex;
        private final DiagnosticsCollector diagnostics;
        private final List<UnattachedRecord> unattached;
        private final int[] parent;
        private final ParentResolution[] resolution;
        private final boolean[] attached;

        Placement(List<EntityRecord> indexed, AliasIndex aliasIndex, DiagnosticsCollector diagnostics,
                  List<UnattachedRecord> unattached) {
            this.indexed = indexed;
            this.aliasIndex = aliasIndex;
            this.diagnostics = diagnostics;
            this.unattached = unattached;
            this.parent = new int[indexed.size()];
            this.resolution = new ParentResolution[indexed.size()];
            this.attached = new boolean[indexed.size()];
            Arrays.fill(parent, UNRESOLVED);
            parent[ROOT_POSITION] = HierarchyNode.NO_PARENT;
            resolution[ROOT_POSITION] = ParentResolution.ROOT;
            attached[ROOT_POSITION] = true;
        }

        void place(int position, List<Integer> candidates) {
            EntityRecord record = indexed.get(position);
            String reference = record.parentName();

            if (reference == null) {
                if (record.orgLevel() == 1) {
                    link(position, ROOT_POSITION, ParentResolution.DEFAULT_ROOT);
                } else {
                    detach(record, UnattachedReason.MISSING_PARENT_REFERENCE,
                            "no parent reference at level " + record.orgLevel());
                }
                return;
            }

            if (isSelfReference(record)) {
                String message = "parent='" + reference + "' names the record itself";
                diagnostics.report(DiagnosticType.SELF_REFERENCE, record.name(), message);
                unattached.add(new UnattachedRecord(record, UnattachedReason.SELF_REFERENCE, message));
                return;
            }

            Optional<Resolved> resolved = resolve(record, candidates);
            if (resolved.isEmpty()) {
                detach(record, UnattachedReason.UNRESOLVED_PARENT,
                        "parent='" + reference + "' matched no entity");
                return;
            }

            Resolved found = resolved.get();
            EntityRecord parentRecord = indexed.get(found.position());
            if (!attached[found.position()]) {
                detach(record, UnattachedReason.DETACHED_ANCESTOR,
                        "parent '" + parentRecord.name() + "' is not in the tree");
                return;
            }
            link(position, found.position(), found.method());
            if (isApproximate(found.method(), reference, parentRecord)) {
                diagnostics.report(DiagnosticType.FUZZY_PARENT_RESOLUTION, record.name(),
                        "parent='" + reference + "' resolved to '" + parentRecord.name() + "' by "
                                + found.method().name().toLowerCase(Locale.ROOT));
            }
        }

        private Optional<Resolved> resolve(EntityRecord record, List<Integer> candidates) {
            String reference = record.parentName();
            Set<Integer> rejected = new HashSet<>();
            return accept(record, aliasIndex.findByName(reference), ParentResolution.EXACT_NAME, rejected)
                    .or(() -> accept(record, aliasIndex.findByCanonicalName(reference),
                            ParentResolution.CANONICAL_NAME, rejected))
                    .or(() -> accept(record, aliasIndex.findByAlias(reference), ParentResolution.ALIAS, rejected))
                    .or(() -> containment(reference, candidates));
        }

        private Optional<Resolved> accept(EntityRecord child, Optional<AliasIndex.Entry> entry,
                                          ParentResolution method, Set<Integer> rejected) {
            if (entry.isEmpty()) {
                return Optional.empty();
            }
            EntityRecord candidate = entry.get().record();
            if (candidate.orgLevel() >= child.orgLevel()) {
                if (rejected.add(entry.get().position())) {
                    diagnostics.report(DiagnosticType.LEVEL_INVERSION, child.name(),
                            "parent='" + child.parentName() + "' resolves to '" + candidate.name()
                                    + "' at level " + candidate.orgLevel() + ", not above level " + child.orgLevel());
                }
                return Optional.empty();
            }
            return Optional.of(new Resolved(entry.get().position(), method));
        }

        private Optional<Resolved> containment(String reference, List<Integer> candidates) {
            String normalizedReference = normalizationEngine.normalize(reference);
            if (normalizedReference.isEmpty()) {
                return Optional.empty();
            }
            for (int candidate : candidates) {
                for (String form : forms(indexed.get(candidate))) {
                    String normalizedForm = normalizationEngine.normalize(form);
                    if (!normalizedForm.isEmpty()
                            && (normalizedForm.contains(normalizedReference)
                            || normalizedReference.contains(normalizedForm))) {
                        return Optional.of(new Resolved(candidate, ParentResolution.CONTAINMENT));
                    }
                }
            }
            return Optional.empty();
        }

        private boolean isSelfReference(EntityRecord record) {
            return normalizationEngine.areEquivalent(record.parentName(), record.name())
                    || normalizationEngine.areEquivalent(record.parentName(), record.canonicalName());
        }

        private boolean isApproximate(ParentResolution method, String reference, EntityRecord parentRecord) {
            if (method == ParentResolution.CANONICAL_NAME) {
                String literal = reference.trim();
                return !literal.equalsIgnoreCase(parentRecord.name())
                        && !literal.equalsIgnoreCase(parentRecord.canonicalName());
            }
            return method.isApproximate();
        }

        private void link(int child, int parentPosition, ParentResolution method) {
            parent[child] = parentPosition;
            resolution[child] = method;
            attached[child] = true;
        }

        private void detach(EntityRecord record, UnattachedReason reason, String message) {
            diagnostics.report(DiagnosticType.UNATTACHED, record.name(), "reason=" + reason + " " + message);
            unattached.add(new UnattachedRecord(record, reason, message));
        }

        private List<String> forms(EntityRecord record) {
            List<String> forms = new ArrayList<>();
            forms.add(record.name());
            forms.addAll(record.aliases());
            return forms;
        }
    }
}
