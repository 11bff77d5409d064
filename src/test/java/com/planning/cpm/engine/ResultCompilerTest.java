package com.planning.cpm.engine;

import com.planning.cpm.api.ActivityTiming;
import com.planning.cpm.api.DateWindow;
import com.planning.cpm.api.RelationType;
import com.planning.cpm.config.DateMode;
import com.planning.cpm.config.EngineConfig;
import com.planning.cpm.error.InvariantViolationException;
import com.planning.cpm.error.TimingOverflowException;
import org.junit.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ResultCompilerTest {

    private static ScheduleResult compile(CompiledSchedule schedule, EngineConfig config) {
        TopologicalOrder order = schedule.graph().validate();
        EarliestTimes earliest = new ForwardPass(order).run();
        LatestTimes latest = new BackwardPass(order, earliest).run();
        return new ResultCompiler(config).compile(schedule, order, earliest, latest);
    }

    private static ScheduleResult compile(ScheduleGraph graph) {
        return compile(CompiledSchedule.of(graph), EngineConfig.defaults());
    }

    @Test
    public void testFloatAndCriticality() {
        ScheduleResult result = compile(ScheduleFixtures.construction());

        assertEquals(0, result.row("A").totalFloat());
        assertEquals(0, result.row("B").totalFloat());
        assertEquals(0, result.row("C").totalFloat());
        assertEquals(2, result.row("D").totalFloat());
        assertEquals(0, result.row("E").totalFloat());
        assertFalse(result.row("D").critical());
        assertTrue(result.row("E").critical());

        assertEquals(15, result.projectDuration());
        assertEquals(List.of("A", "B", "C", "E"), result.criticalPath());
        assertEquals("A -> B -> C -> E", result.summary().criticalPathLabel());
    }

    @Test
    public void testRowsOrderedByStartThenId() {
        ScheduleGraph graph = ScheduleGraph.builder()
                .addActivity("Z", "z", 2)
                .addActivity("Y", "y", 4)
                .addActivity("X", "x", 1)
                .addEdge("X", "Z", RelationType.FS, 0)
                .build();
        ScheduleResult result = compile(graph);

        // X and Y both start at 0; Z at 1
        assertEquals("X", result.rows().get(0).id());
        assertEquals("Y", result.rows().get(1).id());
        assertEquals("Z", result.rows().get(2).id());
    }

    @Test
    public void testCriticalPathIsStartOrderedSetNotWalk() {
        // Two independent critical chains of equal length
        ScheduleGraph graph = ScheduleGraph.builder()
                .addActivity("B1", "b1", 2)
                .addActivity("B2", "b2", 2)
                .addActivity("A1", "a1", 2)
                .addActivity("A2", "a2", 2)
                .addEdge("A1", "A2", RelationType.FS, 0)
                .addEdge("B1", "B2", RelationType.FS, 0)
                .build();
        ScheduleResult result = compile(graph);

        assertEquals(List.of("A1", "B1", "A2", "B2"), result.criticalPath());
    }

    @Test
    public void testRowCarriesAllColumns() {
        ActivityTiming d = compile(ScheduleFixtures.construction()).row("D");
        assertEquals("Electrical", d.name());
        assertEquals(2, d.duration());
        assertEquals(8, d.earlyStart());
        assertEquals(10, d.earlyFinish());
        assertEquals(10, d.lateStart());
        assertEquals(12, d.lateFinish());
        assertNull(d.startDate());
        assertNull(d.endDate());
    }

    @Test
    public void testCalendarAnchor() {
        EngineConfig config = EngineConfig.builder().calendarAnchor(LocalDate.of(2024, 3, 1)).build();
        ScheduleResult result = compile(CompiledSchedule.of(ScheduleFixtures.construction()), config);

        assertEquals(LocalDate.of(2024, 3, 1), result.row("A").startDate());
        assertEquals(LocalDate.of(2024, 3, 6), result.row("A").endDate());
        assertEquals(LocalDate.of(2024, 3, 13), result.row("E").startDate());
        assertEquals(LocalDate.of(2024, 3, 16), result.row("E").endDate());
    }

    @Test
    public void testSuppliedDatesOverrideInSuppliedMode() {
        Map<String, DateWindow> supplied = Map.of(
                "A", new DateWindow(LocalDate.of(2024, 4, 10), null),
                "B", new DateWindow(null, LocalDate.of(2024, 4, 20)),
                "C", new DateWindow(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 9)));
        CompiledSchedule schedule = new CompiledSchedule(ScheduleFixtures.construction(), supplied, Map.of());
        EngineConfig config = EngineConfig.builder()
                .dateMode(DateMode.USE_SUPPLIED_DATES)
                .calendarAnchor(LocalDate.of(2024, 3, 1))
                .build();
        ScheduleResult result = compile(schedule, config);

        assertEquals(LocalDate.of(2024, 4, 10), result.row("A").startDate());
        assertEquals(LocalDate.of(2024, 4, 15), result.row("A").endDate());
        assertEquals(LocalDate.of(2024, 4, 17), result.row("B").startDate());
        assertEquals(LocalDate.of(2024, 4, 20), result.row("B").endDate());
        assertEquals(LocalDate.of(2024, 5, 9), result.row("C").endDate());
        // D has no supplied dates and falls back to the anchor
        assertEquals(LocalDate.of(2024, 3, 9), result.row("D").startDate());
        // Supplied dates never move the computed offsets
        assertEquals(0, result.row("A").earlyStart());
    }

    @Test
    public void testSuppliedDatesIgnoredInComputedMode() {
        Map<String, DateWindow> supplied = Map.of("A", new DateWindow(LocalDate.of(2024, 4, 10), null));
        CompiledSchedule schedule = new CompiledSchedule(ScheduleFixtures.construction(), supplied, Map.of());
        EngineConfig config = EngineConfig.builder().calendarAnchor(LocalDate.of(2024, 3, 1)).build();

        assertEquals(LocalDate.of(2024, 3, 1), compile(schedule, config).row("A").startDate());
    }

    @Test
    public void testSkippedTokensReachSummary() {
        CompiledSchedule schedule = new CompiledSchedule(ScheduleFixtures.construction(), Map.of(),
                Map.of("B", 2, "C", 1));
        assertEquals(3, compile(schedule, EngineConfig.defaults()).summary().skippedTokens());
    }

    @Test
    public void testInconsistentPassResultsFailFast() {
        TopologicalOrder order = ScheduleGraph.builder().addActivity("A", "a", 5).build().validate();
        EarliestTimes earliest = new EarliestTimes(new int[] { 0 }, new int[] { 5 }, 5);
        LatestTimes latest = new LatestTimes(new int[] { 0 }, new int[] { 6 });
        try {
            new ResultCompiler(EngineConfig.defaults())
                    .compile(CompiledSchedule.of(ScheduleGraph.builder().build()), order, earliest, latest);
            fail("Expected InvariantViolationException");
        } catch (InvariantViolationException e) {
            assertEquals("A", e.activityId());
        }
    }

    @Test
    public void testFloatOutsideDayRangeIsRejected() {
        TopologicalOrder order = ScheduleGraph.builder().addActivity("A", "a", 5).build().validate();
        EarliestTimes earliest = new EarliestTimes(new int[] { -2_000_000_000 }, new int[] { -1_999_999_995 }, 5);
        LatestTimes latest = new LatestTimes(new int[] { 1_000_000_000 }, new int[] { 1_000_000_005 });
        try {
            new ResultCompiler(EngineConfig.defaults())
                    .compile(CompiledSchedule.of(ScheduleGraph.builder().build()), order, earliest, latest);
            fail("Expected TimingOverflowException");
        } catch (TimingOverflowException e) {
            assertEquals("A", e.activityId());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownRowLookup() {
        compile(ScheduleFixtures.construction()).row("Q");
    }
}
