package com.planning.cpm.engine;

import com.planning.cpm.api.Activity;
import com.planning.cpm.api.ActivityTiming;
import com.planning.cpm.api.DateWindow;
import com.planning.cpm.config.DateMode;
import com.planning.cpm.config.EngineConfig;
import com.planning.cpm.error.InvariantViolationException;
import com.planning.cpm.error.TimingOverflowException;

import java.time.LocalDate;
import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Joins forward and backward pass results into output rows.
 *
 * <p>
 * Float is LS - ES and must equal LF - EF; a mismatch is an engine defect and
 * fails with {@link InvariantViolationException}. An activity is critical when
 * its float is exactly 0.
 *
 * <p>
 * The passes set EF = ES + d and LS = LF - d, so the two floats always agree
 * for results produced by {@link ForwardPass} and {@link BackwardPass}. The
 * check only catches a future change to either pass that breaks this; it
 * never fires on user input.
 */
public final class ResultCompiler {
    private static final Logger log = LogManager.getLogger(ResultCompiler.class);

    static final Comparator<ActivityTiming> START_ORDER = Comparator
            .comparingInt(ActivityTiming::earlyStart)
            .thenComparing(ActivityTiming::id);

    private final EngineConfig config;

    public ResultCompiler(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public ScheduleResult compile(CompiledSchedule schedule, TopologicalOrder topology,
            EarliestTimes earliest, LatestTimes latest) {
        final int n = topology.activityCount();
        if (earliest.size() != n || latest.size() != n)
            throw new IllegalArgumentException("Pass results do not match the topology");

        List<ActivityTiming> rows = new ArrayList<>(n);
        for (int ti = 0; ti < n; ti++) {
            Activity a = topology.activity(ti);
            int es = earliest.earlyStart(ti);
            int ef = earliest.earlyFinish(ti);
            int ls = latest.lateStart(ti);
            int lf = latest.lateFinish(ti);

            int totalFloat;
            int finishFloat;
            try {
                totalFloat = Math.subtractExact(ls, es);
                finishFloat = Math.subtractExact(lf, ef);
            } catch (ArithmeticException e) {
                throw new TimingOverflowException(a.id(), e);
            }
            if (totalFloat != finishFloat)
                throw new InvariantViolationException(a.id(),
                        "LS-ES=" + totalFloat + " but LF-EF=" + finishFloat);

            LocalDate[] dates = calendarDates(a, es, ef, schedule.suppliedDates().get(a.id()));
            rows.add(new ActivityTiming(a.id(), a.name(), a.duration(), es, ef, ls, lf,
                    totalFloat, totalFloat == 0, dates[0], dates[1]));
        }
        rows.sort(START_ORDER);

        List<String> criticalPath = new ArrayList<>();
        for (ActivityTiming row : rows)
            if (row.critical())
                criticalPath.add(row.id());

        ScheduleSummary summary = new ScheduleSummary(
                earliest.projectDuration(), criticalPath, schedule.totalSkippedTokens());
        return new ScheduleResult(rows, summary, topology);
    }

    private LocalDate[] calendarDates(Activity a, int es, int ef, DateWindow supplied) {
        if (config.dateMode() == DateMode.USE_SUPPLIED_DATES && supplied != null) {
            LocalDate start = supplied.start();
            LocalDate end = supplied.end();
            if (start == null)
                start = end.minusDays(a.duration());
            else if (end == null)
                end = start.plusDays(a.duration());
            else if (!start.plusDays(a.duration()).equals(end))
                log.warn("Supplied dates of {} span {} days but its duration is {}",
                        a.id(), end.toEpochDay() - start.toEpochDay(), a.duration());
            return new LocalDate[] { start, end };
        }
        if (config.hasCalendarAnchor()) {
            LocalDate anchor = config.calendarAnchor();
            return new LocalDate[] { anchor.plusDays(es), anchor.plusDays(ef) };
        }
        return new LocalDate[2];
    }
}
