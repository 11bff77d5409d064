package com.planning.cpm;

import com.planning.cpm.api.ScheduleListener;
import com.planning.cpm.config.EngineConfig;
import com.planning.cpm.engine.CompiledSchedule;
import com.planning.cpm.engine.ScheduleResult;
import com.planning.cpm.engine.SchedulingEngine;
import com.planning.cpm.error.InvalidRecordException;
import com.planning.cpm.io.ActivityRecord;
import com.planning.cpm.io.ScheduleCompiler;
import com.planning.cpm.io.ScheduleDefinition;
import com.planning.cpm.io.ScheduleDefinitionReader;
import com.planning.cpm.util.CompositeScheduleListener;
import com.planning.cpm.util.PassLatencyListener;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * High-level entry point: reads schedule documents or records, compiles them
 * and runs the {@link SchedulingEngine}.
 * <p>
 * Configuration comes from one of two places:
 * <ul>
 * <li>A scheduler created with an explicit {@link EngineConfig} always uses it
 * and ignores settings carried by documents.</li>
 * <li>A scheduler created with {@link #CpmScheduler()} takes dateMode,
 * delimiter, dateFormat and calendarAnchor from each document, falling back to
 * {@link EngineConfig#defaults()}.</li>
 * </ul>
 */
public class CpmScheduler {
    private static final Logger log = LogManager.getLogger(CpmScheduler.class);

    private final EngineConfig explicitConfig;
    private final CompositeScheduleListener compositeListener = new CompositeScheduleListener();

    public CpmScheduler() {
        this.explicitConfig = null;
    }

    public CpmScheduler(EngineConfig config) {
        this.explicitConfig = Objects.requireNonNull(config, "config");
    }

    /**
     * Registers a listener for every subsequent run. Adds to the existing
     * listeners rather than replacing them.
     */
    public void addListener(ScheduleListener listener) {
        compositeListener.addForComposite(listener);
    }

    /** Enables per-pass timing; the returned listener accumulates across runs. */
    public PassLatencyListener enableLatencyTracking() {
        var latencyListener = new PassLatencyListener();
        compositeListener.addForComposite(latencyListener);
        return latencyListener;
    }

    public ScheduleResult schedule(Path jsonPath) throws IOException {
        log.info("Loading schedule from {}", jsonPath);
        return schedule(ScheduleDefinitionReader.parseFile(jsonPath));
    }

    public ScheduleResult schedule(ScheduleDefinition def) {
        EngineConfig config = explicitConfig != null ? explicitConfig : configOf(def);
        CompiledSchedule compiled = new ScheduleCompiler(config).compile(def);
        return newEngine(config).run(compiled);
    }

    public ScheduleResult schedule(List<ActivityRecord> records) {
        EngineConfig config = explicitConfig != null ? explicitConfig : EngineConfig.defaults();
        CompiledSchedule compiled = new ScheduleCompiler(config).compile(records);
        return newEngine(config).run(compiled);
    }

    private SchedulingEngine newEngine(EngineConfig config) {
        SchedulingEngine engine = new SchedulingEngine(config);
        engine.setListener(compositeListener);
        return engine;
    }

    /** Reads the settings carried by a document on top of the defaults. */
    static EngineConfig configOf(ScheduleDefinition def) {
        EngineConfig.Builder b = EngineConfig.defaults().toBuilder();
        ScheduleDefinition.ScheduleInfo info = def.getSchedule();
        if (info == null)
            return b.build();
        if (info.getDateMode() != null)
            b.dateMode(info.getDateMode());
        if (info.getDelimiter() != null)
            b.delimiter(info.getDelimiter());
        if (info.getDateFormat() != null && !info.getDateFormat().isBlank())
            b.dateFormat(info.getDateFormat());
        EngineConfig partial;
        try {
            partial = b.build();
        } catch (IllegalArgumentException e) {
            throw new InvalidRecordException(-1, "dateFormat", "invalid pattern '" + info.getDateFormat() + "'", e);
        }
        if (info.getCalendarAnchor() != null && !info.getCalendarAnchor().isBlank()) {
            try {
                b.calendarAnchor(LocalDate.parse(info.getCalendarAnchor().strip(), partial.dateFormatter()));
            } catch (DateTimeParseException e) {
                throw new InvalidRecordException(-1, "calendarAnchor",
                        "'" + info.getCalendarAnchor() + "' does not match " + partial.dateFormat(), e);
            }
        }
        return b.build();
    }
}
