package com.dagrun.core.graph;

import com.dagrun.core.TaskGraphFixture;
import com.dagrun.core.task.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GraphBuilderTest {

    private GraphBuilder builder;
    private TaskGraphFixture fixture;

    @BeforeEach
    void setUp() {
        builder = new GraphBuilder();
        fixture = new TaskGraphFixture();
    }

    private Task t(String name) {
        return fixture.task(name);
    }

    private static void assertTopological(Dag dag) {
        for (TaskNode node : dag.nodes()) {
            for (TaskNode dependency : node.dependencies()) {
                assertTrue(dag.indexOf(dependency) < dag.indexOf(node),
                        dependency.task() + " must precede " + node.task());
            }
        }
    }

    // -- Ordering ---------------------------------------------------------------

    @Nested
    @DisplayName("ordering")
    class OrderingTests {

        @Test
        @DisplayName("Chain A<-B<-C built from C yields [A, B, C]")
        void chainOrder() {
            fixture.requires("C", "B").requires("B", "A");

            Dag dag = builder.build(t("C"));

            assertEquals(List.of(t("A"), t("B"), t("C")), dag.topologicalOrder());
        }

        @Test
        @DisplayName("Diamond keeps every dependency before its dependents")
        void diamondIsTopological() {
            fixture.requires("D", "B", "C").requires("B", "A").requires("C", "A");

            Dag dag = builder.build(t("D"));

            assertEquals(4, dag.size());
            assertEquals(t("A"), dag.topologicalOrder().get(0));
            assertEquals(t("D"), dag.topologicalOrder().get(3));
            assertTopological(dag);
        }

        @Test
        @DisplayName("Wide graph with several roots is topological")
        void manyRootsTopological() {
            fixture.requires("R1", "X", "Y")
                    .requires("R2", "Y", "Z")
                    .requires("X", "Base")
                    .requires("Y", "Base", "Z")
                    .requires("Z", "Leaf");

            Dag dag = builder.build(t("R1"), t("R2"));

            assertEquals(7, dag.size());
            assertTopological(dag);
        }

        @Test
        @DisplayName("Empty root list gives an empty DAG")
        void emptyRoots() {
            Dag dag = builder.build(List.of());
            assertTrue(dag.isEmpty());
        }
    }

    // -- Deduplication ----------------------------------------------------------

    @Nested
    @DisplayName("deduplication")
    class DeduplicationTests {

        @Test
        @DisplayName("Shared requirement of two roots becomes one node with two dependents")
        void sharedRequirementIsOneNode() {
            fixture.requires("R1", "Shared").requires("R2", "Shared");

            Dag dag = builder.build(t("R1"), t("R2"));

            assertEquals(3, dag.size());
            TaskNode shared = dag.node(t("Shared")).orElseThrow();
            assertEquals(Set.of(dag.node(t("R1")).orElseThrow(), dag.node(t("R2")).orElseThrow()),
                    shared.dependents());
            assertEquals(1, fixture.count("requires:Shared"));
            assertEquals(1, fixture.count("done:Shared"));
        }

        @Test
        @DisplayName("Equal task instances collapse to one node")
        void equalValuesCollapse() {
            Task first = t("A");
            Task second = t("A");
            assertNotSame(first, second);

            Dag dag = builder.build(first, second);

            assertEquals(1, dag.size());
        }

        @Test
        @DisplayName("Repeated requirement merges the edge but keeps both inputs")
        void repeatedRequirement() {
            fixture.requires("B", "A", "A");

            Dag dag = builder.build(t("B"));

            TaskNode b = dag.node(t("B")).orElseThrow();
            assertEquals(1, b.dependencies().size());
            assertEquals(2, b.requirements().size());
            assertEquals(1, dag.node(t("A")).orElseThrow().dependents().size());
        }
    }

    // -- Pruning ----------------------------------------------------------------

    @Nested
    @DisplayName("pruning done tasks")
    class PruningTests {

        @Test
        @DisplayName("Done task is DONE_ALREADY and its requires() is never called")
        void doneTaskNotExpanded() {
            fixture.requires("C", "B").requires("B", "A").done("B");

            Dag dag = builder.build(t("C"));

            assertEquals(List.of(t("B"), t("C")), dag.topologicalOrder());
            assertEquals(NodeStatus.DONE_ALREADY, dag.node(t("B")).orElseThrow().discoveryStatus());
            assertEquals(0, fixture.count("requires:B"));
            assertTrue(dag.node(t("A")).isEmpty());
        }

        @Test
        @DisplayName("Done root is a single DONE_ALREADY node")
        void doneRoot() {
            fixture.requires("A", "Z").done("A");

            Dag dag = builder.build(t("A"));

            assertEquals(1, dag.size());
            assertTrue(dag.nodes().get(0).isDoneAlready());
            assertEquals(0, dag.pendingCount());
        }

        @Test
        @DisplayName("Pending nodes report PENDING at discovery")
        void pendingStatus() {
            Dag dag = builder.build(t("A"));
            assertEquals(NodeStatus.PENDING, dag.nodes().get(0).discoveryStatus());
        }
    }

    // -- Cycles -----------------------------------------------------------------

    @Nested
    @DisplayName("cycle detection")
    class CycleTests {

        @Test
        @DisplayName("A requires B requires A fails with the chain")
        void twoCycle() {
            fixture.requires("A", "B").requires("B", "A");

            var e = assertThrows(CyclicDependencyException.class, () -> builder.build(t("A")));

            assertEquals(List.of(t("A"), t("B"), t("A")), e.chain());
            assertTrue(e.getMessage().contains("A -> B -> A"));
        }

        @Test
        @DisplayName("Self requirement is a cycle")
        void selfCycle() {
            fixture.requires("A", "A");

            var e = assertThrows(CyclicDependencyException.class, () -> builder.build(t("A")));

            assertEquals(List.of(t("A"), t("A")), e.chain());
        }

        @Test
        @DisplayName("Cycle below an acyclic prefix names only the cycle")
        void cycleBelowPrefix() {
            fixture.requires("Root", "X").requires("X", "Y").requires("Y", "Z").requires("Z", "X");

            var e = assertThrows(CyclicDependencyException.class, () -> builder.build(t("Root")));

            assertEquals(List.of(t("X"), t("Y"), t("Z"), t("X")), e.chain());
        }

        @Test
        @DisplayName("Diamond revisiting a finished node is not a cycle")
        void diamondIsNotCycle() {
            fixture.requires("D", "B", "C").requires("B", "A").requires("C", "A");
            assertDoesNotThrow(() -> builder.build(t("D")));
        }
    }

    // -- Discovery errors -------------------------------------------------------

    @Nested
    @DisplayName("discovery errors")
    class DiscoveryErrorTests {

        record Broken(String name, boolean failDone) implements Task {
            @Override
            public boolean done() {
                if (failDone) {
                    throw new IllegalStateException("cannot stat output");
                }
                return false;
            }

            @Override
            public List<Task> requires() {
                throw new IllegalArgumentException("bad parameters");
            }
        }

        @Test
        @DisplayName("Error from done() is wrapped with the task")
        void doneErrorWrapped() {
            var broken = new Broken("x", true);

            var e = assertThrows(DiscoveryException.class, () -> builder.build(broken));

            assertEquals(broken, e.task());
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }

        @Test
        @DisplayName("Error from requires() is wrapped with the task")
        void requiresErrorWrapped() {
            var broken = new Broken("y", false);

            var e = assertThrows(DiscoveryException.class, () -> builder.build(broken));

            assertEquals(broken, e.task());
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
        }

        @Test
        @DisplayName("JVM errors from done() and requires() are wrapped too")
        void errorsWrapped() {
            record Asserting(String name, boolean failDone) implements Task {
                @Override
                public boolean done() {
                    if (failDone) {
                        throw new AssertionError("done() invariant");
                    }
                    return false;
                }

                @Override
                public List<Task> requires() {
                    throw new StackOverflowError();
                }
            }
            var inDone = new Asserting("d", true);
            var inRequires = new Asserting("r", false);

            var doneError = assertThrows(DiscoveryException.class, () -> builder.build(inDone));
            var requiresError = assertThrows(DiscoveryException.class, () -> builder.build(inRequires));

            assertEquals(inDone, doneError.task());
            assertInstanceOf(AssertionError.class, doneError.getCause());
            assertEquals(inRequires, requiresError.task());
            assertInstanceOf(StackOverflowError.class, requiresError.getCause());
        }

        @Test
        @DisplayName("Null root is rejected")
        void nullRoot() {
            assertThrows(IllegalArgumentException.class, () -> builder.build(java.util.Arrays.asList((Task) null)));
        }
    }
}
