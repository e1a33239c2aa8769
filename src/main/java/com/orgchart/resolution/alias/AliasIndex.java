package com.orgchart.resolution.alias;

import com.orgchart.resolution.core.model.EntityRecord;
import com.orgchart.resolution.diagnostics.DiagnosticType;
import com.orgchart.resolution.diagnostics.DiagnosticsCollector;
import com.orgchart.resolution.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lookup structures over a snapshot of entity records: exact names, normalized
 * canonical names and normalized aliases. Built in full from the record list; there
 * is no incremental update.
 *
 * <p>The first registration of a key wins. An alias already claimed by another entity
 * is reported as {@link DiagnosticType#DUPLICATE_ALIAS} and ignored.</p>
 */
public final class AliasIndex {
    private static final Logger log = LoggerFactory.getLogger(AliasIndex.class);

    /**
     * An indexed record and its position in the list the index was built from.
     */
    public record Entry(int position, EntityRecord record) {}

    private final List<EntityRecord> records;
    private final NormalizationEngine normalizationEngine;
    private final Map<String, Integer> byName = new HashMap<>();
    private final Map<String, Integer> byCanonicalName = new HashMap<>();
    private final Map<String, Integer> byAlias = new HashMap<>();

    private AliasIndex(List<EntityRecord> records, NormalizationEngine normalizationEngine) {
        this.records = List.copyOf(records);
        this.normalizationEngine = normalizationEngine;
    }

    /**
     * Builds the index.
     *
     * @param records             the records, in registration order
     * @param normalizationEngine engine used to normalize canonical names and aliases
     * @param diagnostics         receives duplicate-name and duplicate-alias events
     */
    public static AliasIndex build(List<EntityRecord> records, NormalizationEngine normalizationEngine,
                                   DiagnosticsCollector diagnostics) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(normalizationEngine, "normalizationEngine");
        Objects.requireNonNull(diagnostics, "diagnostics");

        AliasIndex index = new AliasIndex(records, normalizationEngine);
        for (int i = 0; i < index.records.size(); i++) {
            index.register(i, index.records.get(i), diagnostics);
        }
        log.debug("alias.index.built records={} names={} canonical={} aliases={}",
                index.records.size(), index.byName.size(), index.byCanonicalName.size(), index.byAlias.size());
        return index;
    }

    private void register(int position, EntityRecord record, DiagnosticsCollector diagnostics) {
        String name = record.name().trim();
        Integer existingName = byName.putIfAbsent(name, position);
        if (existingName != null && existingName != position) {
            diagnostics.report(DiagnosticType.DUPLICATE_NAME, record.name(),
                    "name already registered at position " + existingName + "; first registration wins");
        }

        for (String key : List.of(normalizationEngine.normalize(record.canonicalName()),
                normalizationEngine.normalize(record.name()))) {
            if (!key.isEmpty()) {
                byCanonicalName.putIfAbsent(key, position);
            }
        }

        for (String alias : record.aliases()) {
            String key = normalizationEngine.normalize(alias);
            if (key.isEmpty()) {
                continue;
            }
            Integer owner = byAlias.putIfAbsent(key, position);
            if (owner != null && owner != position) {
                diagnostics.report(DiagnosticType.DUPLICATE_ALIAS, record.name(),
                        "alias '" + alias + "' already registered to '" + records.get(owner).name()
                                + "'; first registration wins");
            }
        }
    }

    /**
     * Exact (trimmed, case-sensitive) name lookup.
     */
    public Optional<Entry> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return entry(byName.get(name.trim()));
    }

    /**
     * Lookup of a normalized canonical name or name.
     */
    public Optional<Entry> findByCanonicalName(String name) {
        return entry(byCanonicalName.get(normalizationEngine.normalize(name)));
    }

    /**
     * Lookup of a normalized alias.
     */
    public Optional<Entry> findByAlias(String name) {
        return entry(byAlias.get(normalizationEngine.normalize(name)));
    }

    /**
     * Exact name, then canonical name, then alias.
     */
    public Optional<Entry> lookup(String name) {
        return findByName(name)
                .or(() -> findByCanonicalName(name))
                .or(() -> findByAlias(name));
    }

    public List<EntityRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public int aliasCount() {
        return byAlias.size();
    }

    public String normalize(String name) {
        return normalizationEngine.normalize(name);
    }

    private Optional<Entry> entry(Integer position) {
        return position == null ? Optional.empty() : Optional.of(new Entry(position, records.get(position)));
    }
}
