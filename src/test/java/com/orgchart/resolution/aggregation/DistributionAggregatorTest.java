package com.orgchart.resolution.aggregation;

import com.orgchart.resolution.core.model.DistributionBucket;
import com.orgchart.resolution.core.model.DistributionKind;
import com.orgchart.resolution.core.model.EntityRecord;
import com.orgchart.resolution.core.model.MetricKind;
import com.orgchart.resolution.diagnostics.DiagnosticType;
import com.orgchart.resolution.diagnostics.DiagnosticsCollector;
import com.orgchart.resolution.hierarchy.HierarchyBuilder;
import com.orgchart.resolution.hierarchy.HierarchyNode;
import com.orgchart.resolution.hierarchy.HierarchyTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DistributionAggregatorTest {

    private static final String YEAR = "2023";

    private DistributionAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new DistributionAggregator();
    }

    private static HierarchyTree tree(EntityRecord... records) {
        return new HierarchyBuilder().build(List.of(records)).tree();
    }

    private static EntityRecord.Builder record(String name, int level, String parent) {
        return EntityRecord.builder().name(name).orgLevel(level).parentName(parent);
    }

    @Nested
    @DisplayName("Distributions")
    class DistributionTests {

        @Test
        @DisplayName("Should sum bucket counts per identical range across children")
        void testBucketSums() {
            HierarchyTree tree = tree(
                    record("State Government", 0, null).build(),
                    record("Agency", 1, "State Government").build(),
                    record("Office One", 2, "Agency")
                            .bucket(DistributionKind.SALARY, YEAR, 0, 50_000, 10)
                            .build(),
                    record("Office Two", 2, "Agency")
                            .bucket(DistributionKind.SALARY, YEAR, 0, 50_000, 5)
                            .bucket(DistributionKind.SALARY, YEAR, 50_000, 100_000, 3)
                            .build());

            AggregationResult result = aggregator.aggregate(tree);
            NodeAggregate agency = result.get(tree.find("Agency").orElseThrow());

            assertEquals(List.of(DistributionBucket.of(0, 50_000, 15), DistributionBucket.of(50_000, 100_000, 3)),
                    agency.aggregatedDistribution(DistributionKind.SALARY, YEAR));
            assertEquals(agency.aggregatedDistribution(DistributionKind.SALARY, YEAR),
                    result.root().aggregatedDistribution(DistributionKind.SALARY, YEAR));
            assertTrue(agency.aggregatedDistribution(DistributionKind.SALARY, "2022").isEmpty());
        }

        @Test
        @DisplayName("Should sum over the full subtree, not only direct children")
        void testDeepSubtree() {
            HierarchyTree tree = tree(
                    record("State Government", 0, null).build(),
                    record("Agency", 1, "State Government").build(),
                    record("Department", 2, "Agency").bucket(DistributionKind.AGE, YEAR, 30, 40, 2).build(),
                    record("Unit", 3, "Department").bucket(DistributionKind.AGE, YEAR, 30, 40, 7).build());

            NodeAggregate agency = aggregator.aggregate(tree).get(tree.find("Agency").orElseThrow());

            assertEquals(List.of(DistributionBucket.of(30, 40, 9)),
                    agency.aggregatedDistribution(DistributionKind.AGE, YEAR));
        }

        @Test
        @DisplayName("Should keep own and aggregated histograms apart")
        void testOwnVersusAggregated() {
            HierarchyTree tree = tree(
                    record("State Government", 0, null).build(),
                    record("Agency", 1, "State Government")
                            .bucket(DistributionKind.TENURE, YEAR, 0, 5, 4)
                            .build(),
                    record("Office", 2, "Agency").bucket(DistributionKind.TENURE, YEAR, 0, 5, 6).build());

            NodeAggregate agency = aggregator.aggregate(tree).get(tree.find("Agency").orElseThrow());

            assertEquals(List.of(DistributionBucket.of(0, 5, 4)), agency.ownDistribution(DistributionKind.TENURE, YEAR));
            assertEquals(List.of(DistributionBucket.of(0, 5, 6)),
                    agency.aggregatedDistribution(DistributionKind.TENURE, YEAR));
            assertEquals(List.of(DistributionBucket.of(0, 5, 10)),
                    agency.combinedDistribution(DistributionKind.TENURE, YEAR));
            assertEquals(agency.ownDistribution(DistributionKind.TENURE, YEAR),
                    agency.effectiveDistribution(DistributionKind.TENURE, YEAR));
        }

        @Test
        @DisplayName("Should skip and report malformed buckets")
        void testMalformedBuckets() {
            HierarchyTree tree = tree(
                    record("State Government", 0, null).build(),
                    record("Agency", 1, "State Government")
                            .bucket(DistributionKind.SALARY, YEAR, 100_000, 50_000, 2)
                            .bucket(DistributionKind.SALARY, YEAR, 0, 50_000, -3)
                            .bucket(DistributionKind.SALARY, YEAR, 0, 50_000, 8)
                            .build());
            DiagnosticsCollector collector = new DiagnosticsCollector();

            AggregationResult result = aggregator.aggregate(tree, collector);

            assertEquals(2, collector.ofType(DiagnosticType.MALFORMED_DISTRIBUTION).size());
            assertEquals(List.of(DistributionBucket.of(0, 50_000, 8)),
                    result.root().aggregatedDistribution(DistributionKind.SALARY, YEAR));
        }

        @Test
        @DisplayName("Should list years with data in ascending order")
        void testYears() {
            HierarchyTree tree = tree(
                    record("State Government", 0, null).build(),
                    record("Agency", 1, "State Government")
                            .bucket(DistributionKind.AGE, "2023", 20, 30, 1)
                            .bucket(DistributionKind.AGE, "2021", 20, 30, 1)
                            .headCount("2022", 5)
                            .build());

            NodeAggregate root = aggregator.aggregate(tree).root();

            assertEquals(List.of("2021", "2023"), List.copyOf(root.distributionYears(DistributionKind.AGE)));
            assertEquals(List.of("2022"), List.copyOf(root.metricYears(MetricKind.HEADCOUNT)));
        }
    }

    @Nested
    @DisplayName("Metrics")
    class MetricTests {

        private HierarchyTree tree;
        private AggregationResult result;

        @BeforeEach
        void setUp() {
            tree = tree(
                    record("State Government", 0, null).build(),
                    record("Agency A", 1, "State Government").headCount(YEAR, 100).wages(YEAR, 8_000_000).build(),
                    record("Office A1", 2, "Agency A").headCount(YEAR, 40).wages(YEAR, 2_000_000).build(),
                    record("Office A2", 2, "Agency A").headCount(YEAR, 60).wages(YEAR, 3_000_000).build(),
                    record("Agency B", 1, "State Government").build(),
                    record("Office B1", 2, "Agency B").headCount(YEAR, 25).wages(YEAR, 1_500_000).build());
            result = aggregator.aggregate(tree);
        }

        @Test
        @DisplayName("Should prefer own values and fall back to the subtree sum")
        void testEffectiveValues() {
            NodeAggregate agencyA = result.get(tree.find("Agency A").orElseThrow());
            NodeAggregate agencyB = result.get(tree.find("Agency B").orElseThrow());

            assertEquals(100, agencyA.effectiveMetric(MetricKind.HEADCOUNT, YEAR));
            assertFalse(agencyA.usesAggregatedMetric(MetricKind.HEADCOUNT, YEAR));
            assertEquals(200, agencyA.combinedMetric(MetricKind.HEADCOUNT, YEAR));

            assertEquals(0, agencyB.ownMetric(MetricKind.HEADCOUNT, YEAR));
            assertEquals(25, agencyB.effectiveMetric(MetricKind.HEADCOUNT, YEAR));
            assertTrue(agencyB.usesAggregatedMetric(MetricKind.HEADCOUNT, YEAR));
        }

        @Test
        @DisplayName("Aggregated value should equal the children's combined values")
        void testSumInvariant() {
            for (HierarchyNode node : tree.nodes()) {
                NodeAggregate aggregate = result.get(node);
                if (!aggregate.hasDescendants()) {
                    continue;
                }
                double childSum = tree.children(node.index()).stream()
                        .mapToDouble(child -> result.get(child).combinedMetric(MetricKind.HEADCOUNT, YEAR))
                        .sum();
                assertEquals(childSum, aggregate.aggregatedMetric(MetricKind.HEADCOUNT, YEAR), 1e-9);
            }
            assertEquals(225, result.root().aggregatedMetric(MetricKind.HEADCOUNT, YEAR));
        }

        @Test
        @DisplayName("Should count subordinates over the subtree")
        void testSubordinateCount() {
            assertEquals(tree.size() - 1, result.root().subordinateCount());
            assertEquals(2, result.get(tree.find("Agency A").orElseThrow()).subordinateCount());
            assertEquals(0, result.get(tree.find("Office B1").orElseThrow()).subordinateCount());
            assertEquals(tree.size(), result.size());
        }

        @Test
        @DisplayName("Should compute the average wage from effective values")
        void testAverageWage() {
            assertEquals(80_000, result.get(tree.find("Agency A").orElseThrow()).averageWage(YEAR).getAsDouble());
            assertEquals(60_000, result.get(tree.find("Agency B").orElseThrow()).averageWage(YEAR).getAsDouble());
            assertTrue(result.root().averageWage("2019").isEmpty());
        }
    }
}
