package com.planning.cpm.engine;

import com.planning.cpm.api.PrecedenceEdge;
import com.planning.cpm.api.RelationType;
import com.planning.cpm.error.CyclicDependencyException;
import com.planning.cpm.error.DuplicateActivityException;
import com.planning.cpm.error.InvalidDurationException;
import com.planning.cpm.error.SelfLoopException;
import com.planning.cpm.error.UnknownActivityException;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class ScheduleGraphTest {

    @Test
    public void testEmptyGraph() {
        ScheduleGraph graph = ScheduleGraph.builder().build();
        assertEquals(0, graph.activityCount());
        assertEquals(0, graph.validate().activityCount());
    }

    @Test
    public void testActivitiesKeepInsertionOrder() {
        ScheduleGraph graph = ScheduleGraph.builder()
                .addActivity("B", "Second", 2)
                .addActivity("A", "First", 1)
                .build();

        assertEquals("B", graph.activities().get(0).id());
        assertEquals("A", graph.activities().get(1).id());
        assertEquals("First", graph.activity("A").name());
        assertTrue(graph.contains("A"));
        assertFalse(graph.contains("Z"));
    }

    @Test
    public void testNullNameDefaultsToId() {
        ScheduleGraph graph = ScheduleGraph.builder().addActivity("A", null, 1).build();
        assertEquals("A", graph.activity("A").name());
    }

    @Test
    public void testZeroDurationIsValid() {
        ScheduleGraph graph = ScheduleGraph.builder().addActivity("M", "Milestone", 0).build();
        assertEquals(0, graph.activity("M").duration());
    }

    @Test
    public void testDuplicateActivity() {
        ScheduleGraph.Builder b = ScheduleGraph.builder().addActivity("A", "a", 1);
        try {
            b.addActivity("A", "again", 2);
            fail("Expected DuplicateActivityException");
        } catch (DuplicateActivityException e) {
            assertEquals("A", e.activityId());
        }
    }

    @Test
    public void testNegativeDuration() {
        try {
            ScheduleGraph.builder().addActivity("A", "a", -1);
            fail("Expected InvalidDurationException");
        } catch (InvalidDurationException e) {
            assertEquals("A", e.activityId());
            assertEquals(-1, e.duration());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlankIdRejected() {
        ScheduleGraph.builder().addActivity("  ", "blank", 1);
    }

    @Test
    public void testUnknownPredecessor() {
        ScheduleGraph.Builder b = ScheduleGraph.builder().addActivity("B", "b", 1);
        try {
            b.addEdge("A", "B", RelationType.FS, 0);
            fail("Expected UnknownActivityException");
        } catch (UnknownActivityException e) {
            assertEquals("A", e.activityId());
            assertEquals("A", e.predecessorId());
            assertEquals("B", e.successorId());
        }
    }

    @Test
    public void testUnknownSuccessor() {
        ScheduleGraph.Builder b = ScheduleGraph.builder().addActivity("A", "a", 1);
        try {
            b.addEdge("A", "B", RelationType.SS, 0);
            fail("Expected UnknownActivityException");
        } catch (UnknownActivityException e) {
            assertEquals("B", e.activityId());
        }
    }

    @Test
    public void testSelfLoop() {
        ScheduleGraph.Builder b = ScheduleGraph.builder().addActivity("A", "a", 1);
        try {
            b.addEdge("A", "A", RelationType.FS, 0);
            fail("Expected SelfLoopException");
        } catch (SelfLoopException e) {
            assertEquals("A", e.activityId());
        }
    }

    @Test
    public void testEdgeReplaceOnWrite() {
        ScheduleGraph graph = ScheduleGraph.builder()
                .addActivity("A", "a", 1)
                .addActivity("B", "b", 1)
                .addActivity("C", "c", 1)
                .addEdge("A", "B", RelationType.FS, 1)
                .addEdge("A", "C", RelationType.FS, 0)
                .addEdge("A", "B", RelationType.SS, -2)
                .build();

        assertEquals(2, graph.edgeCount());
        // The replaced edge keeps its original position
        assertEquals(new PrecedenceEdge("A", "B", RelationType.SS, -2), graph.edges().get(0));
        assertEquals(new PrecedenceEdge("A", "C", RelationType.FS, 0), graph.edges().get(1));
    }

    @Test(expected = IllegalStateException.class)
    public void testBuilderRejectsUseAfterBuild() {
        ScheduleGraph.Builder b = ScheduleGraph.builder().addActivity("A", "a", 1);
        b.build();
        b.addActivity("B", "b", 1);
    }

    @Test
    public void testTieBreakIsLexicographic() {
        TopologicalOrder order = ScheduleGraph.builder()
                .addActivity("C", "c", 1)
                .addActivity("B", "b", 1)
                .addActivity("A", "a", 1)
                .build()
                .validate();

        assertEquals(List.of("A", "B", "C"), order.ids());
    }

    @Test
    public void testTieBreakAfterRelease() {
        // Z releases both X and Y; X must still come before Y
        TopologicalOrder order = ScheduleGraph.builder()
                .addActivity("Z", "z", 1)
                .addActivity("Y", "y", 1)
                .addActivity("X", "x", 1)
                .addEdge("Z", "Y", RelationType.FS, 0)
                .addEdge("Z", "X", RelationType.FS, 0)
                .build()
                .validate();

        assertEquals(List.of("Z", "X", "Y"), order.ids());
    }

    @Test
    public void testIsolatedActivitiesAreValid() {
        TopologicalOrder order = ScheduleGraph.builder()
                .addActivity("A", "a", 3)
                .addActivity("B", "b", 4)
                .build()
                .validate();

        assertEquals(2, order.activityCount());
        assertEquals(0, order.parentCount(0));
        assertEquals(0, order.childCount(1));
    }

    @Test
    public void testCycleReportsExactlyTheCycle() {
        ScheduleGraph graph = ScheduleGraph.builder()
                .addActivity("A", "a", 1)
                .addActivity("B", "b", 1)
                .addActivity("C", "c", 1)
                .addActivity("D", "d", 1)
                .addEdge("A", "B", RelationType.FS, 0)
                .addEdge("B", "C", RelationType.SS, 2)
                .addEdge("C", "A", RelationType.FF, -1)
                .addEdge("C", "D", RelationType.FS, 0)
                .build();
        try {
            graph.validate();
            fail("Expected CyclicDependencyException");
        } catch (CyclicDependencyException e) {
            assertEquals(Set.of("A", "B", "C"), new HashSet<>(e.cycle()));
            assertEquals(List.of("A", "B", "C"), e.cycle());
            assertTrue(e.getMessage().contains("A -> B -> C -> A"));
        }
    }

    @Test
    public void testCycleBehindAcyclicPrefix() {
        // R -> P -> Q -> P, with S hanging off Q
        ScheduleGraph graph = ScheduleGraph.builder()
                .addActivity("R", "r", 1)
                .addActivity("P", "p", 1)
                .addActivity("Q", "q", 1)
                .addActivity("S", "s", 1)
                .addEdge("R", "P", RelationType.FS, 0)
                .addEdge("P", "Q", RelationType.FS, 0)
                .addEdge("Q", "P", RelationType.FS, 0)
                .addEdge("Q", "S", RelationType.FS, 0)
                .build();
        try {
            graph.validate();
            fail("Expected CyclicDependencyException");
        } catch (CyclicDependencyException e) {
            assertEquals(List.of("P", "Q"), e.cycle());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownActivityLookup() {
        ScheduleGraph.builder().addActivity("A", "a", 1).build().activity("B");
    }
}
