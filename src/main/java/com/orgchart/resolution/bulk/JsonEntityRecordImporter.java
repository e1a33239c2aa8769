package com.orgchart.resolution.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgchart.resolution.core.model.DistributionBucket;
import com.orgchart.resolution.core.model.DistributionKind;
import com.orgchart.resolution.core.model.EntityRecord;
import com.orgchart.resolution.core.model.MetricKind;
import com.orgchart.resolution.diagnostics.DiagnosticType;
import com.orgchart.resolution.diagnostics.DiagnosticsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads entity records from JSON with Jackson's tree model.
 *
 * <p>The input is an array of records, or an object with a {@code departments} array:</p>
 * <pre>
 * {"departments": [
 *   {"name": "State Government", "orgLevel": 0},
 *   {"name": "Air Resources Board", "aliases": ["CARB"], "orgLevel": 2,
 *    "parent_agency": "California Environmental Protection Agency", "code": "3900",
 *    "workforce": {
 *      "headCount": {"yearly": {"2023": 1850}},
 *      "wages": {"yearly": {"2023": 190000000}},
 *      "salaryDistribution": {"yearly": {"2023": [{"range": [50000, 60000], "count": 120}]}}
 *    }}
 * ]}
 * </pre>
 *
 * <p>{@code parentName} and {@code budget_code} are accepted as alternative keys. A record
 * without a name or a non-negative integer {@code orgLevel} is skipped with an
 * {@link ImportResult.ImportError}. Bucket entries without a two-number range or a numeric
 * count are skipped with a malformed-distribution diagnostic; null yearly values are ignored.</p>
 */
public class JsonEntityRecordImporter implements EntityRecordImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonEntityRecordImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private static final Map<MetricKind, String> METRIC_FIELDS = new EnumMap<>(Map.of(
            MetricKind.HEADCOUNT, "headCount",
            MetricKind.WAGES, "wages"));
    private static final Map<DistributionKind, String> DISTRIBUTION_FIELDS = new EnumMap<>(Map.of(
            DistributionKind.TENURE, "tenureDistribution",
            DistributionKind.SALARY, "salaryDistribution",
            DistributionKind.AGE, "ageDistribution"));

    private final ObjectMapper objectMapper;

    public JsonEntityRecordImporter() {
        this(new ObjectMapper());
    }

    public JsonEntityRecordImporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ImportResult importRecords(InputStream input, ProgressCallback callback) {
        return importRecords(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    @Override
    public ImportResult importRecords(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;

        JsonNode root;
        try (Reader r = reader) {
            root = objectMapper.readTree(r);
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            return ImportResult.failed("IO error: " + e.getMessage());
        }

        JsonNode array = root != null && root.isArray() ? root : (root != null ? root.path("departments") : null);
        if (array == null || !array.isArray()) {
            log.error("import.failed error=no record array");
            return ImportResult.failed("expected a JSON array or an object with a 'departments' array");
        }

        DiagnosticsCollector diagnostics = new DiagnosticsCollector();
        List<EntityRecord> records = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long total = array.size();

        for (int i = 0; i < array.size(); i++) {
            JsonNode node = array.get(i);
            String name = text(node, "name");
            try {
                records.add(parse(node, diagnostics));
            } catch (IllegalArgumentException e) {
                errors.add(new ImportResult.ImportError(i + 1, name != null ? name : "", e.getMessage()));
                diagnostics.report(DiagnosticType.INVALID_RECORD, name, "record=" + (i + 1) + " " + e.getMessage());
            }
            if ((i + 1) % PROGRESS_INTERVAL == 0) {
                cb.onProgress(i + 1, total, "Processed " + (i + 1) + " records");
            }
        }

        ImportResult result = new ImportResult(total, records, errors, diagnostics.getDiagnostics());
        cb.onProgress(total, total, "Import completed");
        log.info("import.completed result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "json";
    }

    private EntityRecord parse(JsonNode node, DiagnosticsCollector diagnostics) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("record is not a JSON object");
        }
        String name = text(node, "name");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }

        EntityRecord.Builder builder = EntityRecord.builder()
                .name(name)
                .canonicalName(text(node, "canonicalName"))
                .orgLevel(orgLevel(node.get("orgLevel")))
                .parentName(firstText(node, "parent_agency", "parentName"))
                .budgetCode(firstText(node, "code", "budget_code"));

        JsonNode aliases = node.path("aliases");
        if (aliases.isArray()) {
            aliases.forEach(alias -> {
                if (alias.isTextual()) {
                    builder.alias(alias.asText());
                }
            });
        }

        JsonNode workforce = node.path("workforce");
        if (workforce.isObject()) {
            METRIC_FIELDS.forEach((kind, field) -> readMetric(name, workforce.path(field).path("yearly"), kind, builder));
            DISTRIBUTION_FIELDS.forEach((kind, field) ->
                    readDistribution(name, workforce.path(field).path("yearly"), kind, builder, diagnostics));
        }
        return builder.build();
    }

    private static int orgLevel(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("orgLevel is required");
        }
        int level;
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            level = node.asInt();
        } else if (node.isTextual() && node.asText().trim().matches("\\d+")) {
            level = Integer.parseInt(node.asText().trim());
        } else {
            throw new IllegalArgumentException("orgLevel must be an integer, got '" + node.asText() + "'");
        }
        if (level < 0) {
            throw new IllegalArgumentException("orgLevel must be non-negative, got " + level);
        }
        return level;
    }

    private static void readMetric(String name, JsonNode yearly, MetricKind kind, EntityRecord.Builder builder) {
        if (!yearly.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> years = yearly.fields();
        while (years.hasNext()) {
            Map.Entry<String, JsonNode> entry = years.next();
            JsonNode value = entry.getValue();
            if (value.isNumber()) {
                builder.metric(kind, entry.getKey(), value.asDouble());
            } else if (!value.isNull()) {
                log.warn("import.metric_skipped name='{}' kind={} year={} value='{}'",
                        name, kind, entry.getKey(), value.asText());
            }
        }
    }

    private static void readDistribution(String name, JsonNode yearly, DistributionKind kind,
                                         EntityRecord.Builder builder, DiagnosticsCollector diagnostics) {
        if (!yearly.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> years = yearly.fields();
        while (years.hasNext()) {
            Map.Entry<String, JsonNode> entry = years.next();
            String year = entry.getKey();
            JsonNode buckets = entry.getValue();
            if (buckets.isNull()) {
                continue;
            }
            if (!buckets.isArray()) {
                diagnostics.report(DiagnosticType.MALFORMED_DISTRIBUTION, name,
                        "kind=" + kind + " year=" + year + " is not an array");
                continue;
            }
            List<DistributionBucket> parsed = new ArrayList<>();
            for (JsonNode bucket : buckets) {
                DistributionBucket valid = bucket(bucket);
                if (valid != null) {
                    parsed.add(valid);
                } else {
                    diagnostics.report(DiagnosticType.MALFORMED_DISTRIBUTION, name,
                            "kind=" + kind + " year=" + year + " entry=" + bucket + " skipped");
                }
            }
            if (!parsed.isEmpty()) {
                builder.distribution(kind, year, parsed);
            }
        }
    }

    /**
     * Returns the bucket, or null when the entry is malformed.
     */
    private static DistributionBucket bucket(JsonNode node) {
        JsonNode range = node.path("range");
        JsonNode count = node.path("count");
        if (!range.isArray() || range.size() != 2
                || !range.get(0).isNumber() || !range.get(1).isNumber()
                || !count.isNumber()) {
            return null;
        }
        DistributionBucket bucket = DistributionBucket.of(
                range.get(0).asDouble(), range.get(1).asDouble(), count.asLong());
        return bucket.isWellFormed() ? bucket : null;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
