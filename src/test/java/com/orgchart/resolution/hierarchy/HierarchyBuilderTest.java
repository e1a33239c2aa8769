package com.orgchart.resolution.hierarchy;

import com.orgchart.resolution.core.model.EntityRecord;
import com.orgchart.resolution.diagnostics.Diagnostic;
import com.orgchart.resolution.diagnostics.DiagnosticType;
import com.orgchart.resolution.diagnostics.DiagnosticsCollector;
import com.orgchart.resolution.diagnostics.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyBuilderTest {

    private static final String ROOT = "State Government";

    private HierarchyBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new HierarchyBuilder();
    }

    private static EntityRecord record(String name, int level, String parent) {
        return EntityRecord.builder().name(name).orgLevel(level).parentName(parent).build();
    }

    private static List<String> childNames(HierarchyTree tree, HierarchyNode node) {
        return tree.children(node.index()).stream().map(HierarchyNode::name).toList();
    }

    @Nested
    @DisplayName("Parent resolution")
    class ParentResolutionTests {

        @Test
        @DisplayName("Should attach records by exact parent name")
        void testExactNames() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept A", 1, ROOT),
                    record("Office B", 2, "Dept A")));

            HierarchyTree tree = result.tree();
            assertTrue(result.isComplete());
            assertEquals(3, tree.size());
            assertEquals(ROOT, tree.root().name());
            assertFalse(tree.root().synthetic());
            assertEquals(List.of("Dept A"), childNames(tree, tree.root()));

            HierarchyNode deptA = tree.find("Dept A").orElseThrow();
            assertEquals(List.of("Office B"), childNames(tree, deptA));
            assertEquals(ParentResolution.EXACT_NAME, tree.find("Office B").orElseThrow().resolution());
            assertEquals(2, tree.descendantCount(HierarchyTree.ROOT_INDEX));
            assertEquals(1, tree.descendantCount(deptA.index()));
        }

        @Test
        @DisplayName("Should resolve a parent through its alias")
        void testAlias() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    EntityRecord.builder().name("Dept A").alias("Dept A Division").orgLevel(1).parentName(ROOT).build(),
                    record("Office B", 2, "Dept A Division")));

            HierarchyNode officeB = result.tree().find("Office B").orElseThrow();
            assertEquals("Dept A", result.tree().parent(officeB.index()).orElseThrow().name());
            assertEquals(ParentResolution.ALIAS, officeB.resolution());
            assertTrue(result.diagnosticsOfType(DiagnosticType.FUZZY_PARENT_RESOLUTION).isEmpty());
        }

        @Test
        @DisplayName("Should resolve a parent through its normalized canonical name")
        void testCanonicalName() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    EntityRecord.builder()
                            .name("Finance")
                            .canonicalName("Department of Finance")
                            .orgLevel(1)
                            .parentName(ROOT)
                            .build(),
                    record("Budget Office", 2, "California Dept. of Finance")));

            HierarchyNode office = result.tree().find("Budget Office").orElseThrow();
            assertEquals(ParentResolution.CANONICAL_NAME, office.resolution());
            assertEquals("Finance", result.tree().parent(office.index()).orElseThrow().name());
        }

        @Test
        @DisplayName("Should resolve a misspelled parent through normalization and report it")
        void testMisspelledParent() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept A", 1, ROOT),
                    record("Office B", 2, "Dept A"),
                    record("Office C", 2, "Deptt A")));

            HierarchyTree tree = result.tree();
            HierarchyNode officeC = tree.find("Office C").orElseThrow();
            assertEquals("Dept A", tree.parent(officeC.index()).orElseThrow().name());
            assertEquals(ParentResolution.CANONICAL_NAME, officeC.resolution());
            assertEquals(List.of("Office B", "Office C"), childNames(tree, tree.find("Dept A").orElseThrow()));

            List<Diagnostic> fuzzy = result.diagnosticsOfType(DiagnosticType.FUZZY_PARENT_RESOLUTION);
            assertEquals(1, fuzzy.size());
            assertEquals("Office C", fuzzy.get(0).entityName());
        }

        @Test
        @DisplayName("Should not attach a reference to a missing department under a similar name")
        void testSimilarNameIsNotGuessed() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept A", 1, ROOT),
                    record("Department of Fish and Wildlife", 1, ROOT),
                    record("Office X", 2, "Dept B"),
                    record("Office Y", 2, "Department of Finance")));

            assertEquals(3, result.tree().size());
            assertEquals(List.of("Office X", "Office Y"),
                    result.unattached().stream().map(UnattachedRecord::name).toList());
            assertTrue(result.unattached().stream()
                    .allMatch(u -> u.reason() == UnattachedReason.UNRESOLVED_PARENT));
            assertTrue(result.diagnosticsOfType(DiagnosticType.FUZZY_PARENT_RESOLUTION).isEmpty());
        }

        @Test
        @DisplayName("Should resolve a parent whose name contains the reference")
        void testContainment() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept A Administration", 1, ROOT),
                    record("Office B", 2, "Dept A")));

            HierarchyNode officeB = result.tree().find("Office B").orElseThrow();
            assertEquals(ParentResolution.CONTAINMENT, officeB.resolution());
            assertEquals("Dept A Administration", result.tree().parent(officeB.index()).orElseThrow().name());
            assertEquals(1, result.diagnosticsOfType(DiagnosticType.FUZZY_PARENT_RESOLUTION).size());
        }

        @Test
        @DisplayName("Exact lookup may skip missing intermediate levels")
        void testLevelGap() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept A", 1, ROOT),
                    record("Unit C", 3, "Dept A")));

            HierarchyNode unitC = result.tree().find("Unit C").orElseThrow();
            assertEquals("Dept A", result.tree().parent(unitC.index()).orElseThrow().name());
        }
    }

    @Nested
    @DisplayName("Unattached records")
    class UnattachedTests {

        @Test
        @DisplayName("Should report an unresolvable parent without guessing")
        void testUnresolvedParent() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept A", 1, ROOT),
                    record("Office X", 2, "Completely Unknown Agency")));

            assertFalse(result.isComplete());
            assertEquals(2, result.tree().size());
            UnattachedRecord unattached = result.unattached().get(0);
            assertEquals("Office X", unattached.name());
            assertEquals(UnattachedReason.UNRESOLVED_PARENT, unattached.reason());

            List<Diagnostic> events = result.diagnosticsOfType(DiagnosticType.UNATTACHED);
            assertEquals(1, events.size());
            assertEquals(Severity.WARN, events.get(0).severity());
            assertTrue(events.get(0).message().startsWith("reason=UNRESOLVED_PARENT"));
        }

        @Test
        @DisplayName("Should reject a record naming itself as parent")
        void testSelfReference() {
            DiagnosticsCollector collector = new DiagnosticsCollector();
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept A", 1, ROOT),
                    record("Office X", 2, "office x")), collector);

            assertEquals(UnattachedReason.SELF_REFERENCE, result.unattached().get(0).reason());
            assertEquals(Severity.ERROR, result.diagnosticsOfType(DiagnosticType.SELF_REFERENCE).get(0).severity());
            assertTrue(collector.hasErrors());
            assertTrue(result.tree().find("Office X").isEmpty());
        }

        @Test
        @DisplayName("Should attach a record whose alias repeats its parent's name")
        void testAliasNamingParent() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept A", 1, ROOT),
                    EntityRecord.builder().name("Office B").alias("Dept A").orgLevel(2).parentName("Dept A").build()));

            HierarchyNode officeB = result.tree().find("Office B").orElseThrow();
            assertEquals("Dept A", result.tree().parent(officeB.index()).orElseThrow().name());
            assertEquals(ParentResolution.EXACT_NAME, officeB.resolution());
            assertTrue(result.diagnosticsOfType(DiagnosticType.SELF_REFERENCE).isEmpty());
            assertTrue(result.unattached().isEmpty());
        }

        @Test
        @DisplayName("Should leave a record without parent reference below level 1 unattached")
        void testMissingParentBelowLevelOne() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept A", 1, ROOT),
                    record("Office B", 2, null)));

            assertEquals(UnattachedReason.MISSING_PARENT_REFERENCE, result.unattached().get(0).reason());
            assertTrue(result.tree().find("Office B").isEmpty());
        }

        /**
         * Records the current behavior rather than asserting it is the right one: a level-1
         * record with no parent reference is placed under the root, while the same record one
         * level deeper is left unattached.
         */
        @Test
        @DisplayName("Level 1 without parent reference defaults to the root, deeper levels do not")
        void testDefaultToRootOnlyAtLevelOne() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept A", 1, null),
                    record("Office B", 2, null)));

            HierarchyNode deptA = result.tree().find("Dept A").orElseThrow();
            assertEquals(ParentResolution.DEFAULT_ROOT, deptA.resolution());
            assertEquals(HierarchyTree.ROOT_INDEX, deptA.parentIndex());

            assertEquals(1, result.unattached().size());
            assertEquals("Office B", result.unattached().get(0).name());
            assertEquals(UnattachedReason.MISSING_PARENT_REFERENCE, result.unattached().get(0).reason());
        }

        @Test
        @DisplayName("A level-1 record with an unresolvable parent should not default to the root")
        void testLevelOneUnresolvedParent() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept A", 1, "Nonexistent Agency")));

            assertEquals(1, result.tree().size());
            assertEquals(UnattachedReason.UNRESOLVED_PARENT, result.unattached().get(0).reason());
        }

        @Test
        @DisplayName("Should not attach a child under an unattached parent")
        void testDetachedAncestor() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept Q", 1, "Nowhere Agency"),
                    record("Office Q", 2, "Dept Q")));

            assertEquals(List.of("Dept Q", "Office Q"),
                    result.unattached().stream().map(UnattachedRecord::name).toList());
            assertEquals(UnattachedReason.DETACHED_ANCESTOR, result.unattached().get(1).reason());
            assertEquals(1, result.tree().size());
        }

        @Test
        @DisplayName("Should refuse a parent at the same or a deeper level")
        void testLevelInversion() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept A", 1, ROOT),
                    record("Office Z", 2, "Dept A"),
                    record("Office Y", 2, "Office Z")));

            assertEquals(1, result.diagnosticsOfType(DiagnosticType.LEVEL_INVERSION).size());
            assertEquals("Office Y", result.unattached().get(0).name());
            assertEquals(UnattachedReason.UNRESOLVED_PARENT, result.unattached().get(0).reason());
        }

        @Test
        @DisplayName("Should keep the first root and report the others")
        void testDuplicateRoot() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Other Government", 0, null),
                    record("Dept A", 1, ROOT)));

            assertEquals(ROOT, result.tree().root().name());
            assertEquals(UnattachedReason.DUPLICATE_ROOT, result.unattached().get(0).reason());
            assertEquals(1, result.diagnosticsOfType(DiagnosticType.DUPLICATE_ROOT).size());
            assertEquals(2, result.tree().size());
        }
    }

    @Nested
    @DisplayName("Tree shape")
    class TreeShapeTests {

        @Test
        @DisplayName("Should fabricate a synthetic root for empty input")
        void testEmptyInput() {
            BuildResult result = builder.build(List.of());

            assertEquals(1, result.tree().size());
            assertTrue(result.tree().root().synthetic());
            assertEquals(ROOT, result.tree().root().name());
            assertTrue(result.unattached().isEmpty());
        }

        @Test
        @DisplayName("Should use the configured synthetic root name")
        void testSyntheticRootName() {
            HierarchyBuilder custom = new HierarchyBuilder(
                    HierarchyOptions.builder().syntheticRootName("Federal Government").build());

            BuildResult result = custom.build(List.of(record("Dept A", 1, null)));

            assertEquals("Federal Government", result.tree().root().name());
            assertEquals(List.of("Dept A"), childNames(result.tree(), result.tree().root()));
        }

        @Test
        @DisplayName("Should sort siblings by name ignoring case")
        void testSiblingOrder() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Zeta Board", 1, ROOT),
                    record("alpha Office", 1, ROOT),
                    record("Beta Commission", 1, ROOT)));

            assertEquals(List.of("alpha Office", "Beta Commission", "Zeta Board"),
                    childNames(result.tree(), result.tree().root()));
        }

        @Test
        @DisplayName("Should build identical trees regardless of input order")
        void testDeterminism() {
            List<EntityRecord> records = new ArrayList<>(List.of(
                    record(ROOT, 0, null),
                    record("Dept A", 1, ROOT),
                    record("Dept B", 1, ROOT),
                    record("Office A1", 2, "Dept A"),
                    record("Office A2", 2, "Deptt A"),
                    record("Office B1", 2, "Dept B"),
                    record("Unit A1x", 3, "Office A1")));

            HierarchyTree first = builder.build(records).tree();
            HierarchyTree second = builder.build(records).tree();
            Collections.reverse(records);
            HierarchyTree reversed = builder.build(records).tree();

            assertEquals(first, second);
            assertEquals(first, reversed);
            assertEquals(first.toString(), reversed.toString());
        }

        @Test
        @DisplayName("Every node should reach the root within its level")
        void testNoCycles() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    record("Dept A", 1, ROOT),
                    record("Office A1", 2, "Dept A"),
                    record("Unit A1x", 3, "Office A1"),
                    record("Unit A1y", 3, "Dept A")));

            HierarchyTree tree = result.tree();
            for (HierarchyNode node : tree.nodes()) {
                assertTrue(tree.depth(node.index()) <= node.orgLevel());
                assertTrue(node.isRoot() || tree.node(node.parentIndex()).orgLevel() < node.orgLevel());
            }
            assertEquals(tree.size() - 1, tree.descendantCount(HierarchyTree.ROOT_INDEX));
        }

        @Test
        @DisplayName("Should expose a lookup context over the built records")
        void testContext() {
            BuildResult result = builder.build(List.of(
                    record(ROOT, 0, null),
                    EntityRecord.builder().name("Air Resources Board").alias("CARB").orgLevel(1).build()));

            assertEquals("Air Resources Board", result.context().find("carb").orElseThrow().name());
            assertEquals(2, result.context().getAliasIndex().size());
        }
    }
}
