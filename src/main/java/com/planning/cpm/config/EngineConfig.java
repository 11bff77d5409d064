package com.planning.cpm.config;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Settings for one scheduling invocation.
 *
 * <p>
 * Immutable. Defaults: computed offsets, comma delimiter, no calendar anchor,
 * day-first {@code dd/MM/yyyy} dates.
 */
public final class EngineConfig {
    public static final String DEFAULT_DATE_FORMAT = "dd/MM/yyyy";

    private static final EngineConfig DEFAULTS = builder().build();

    private final DateMode dateMode;
    private final Delimiter delimiter;
    private final LocalDate calendarAnchor;
    private final String dateFormat;
    private final DateTimeFormatter dateFormatter;

    private EngineConfig(Builder b) {
        this.dateMode = b.dateMode;
        this.delimiter = b.delimiter;
        this.calendarAnchor = b.calendarAnchor;
        this.dateFormat = b.dateFormat;
        this.dateFormatter = DateTimeFormatter.ofPattern(b.dateFormat);
    }

    public static EngineConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder seeded with this config's values. */
    public Builder toBuilder() {
        return new Builder()
                .dateMode(dateMode)
                .delimiter(delimiter)
                .calendarAnchor(calendarAnchor)
                .dateFormat(dateFormat);
    }

    public DateMode dateMode() {
        return dateMode;
    }

    public Delimiter delimiter() {
        return delimiter;
    }

    /** The calendar date of day offset 0, or null when no calendar output is wanted. */
    public LocalDate calendarAnchor() {
        return calendarAnchor;
    }

    public boolean hasCalendarAnchor() {
        return calendarAnchor != null;
    }

    public String dateFormat() {
        return dateFormat;
    }

    /** Formatter for supplied (day-first) dates. */
    public DateTimeFormatter dateFormatter() {
        return dateFormatter;
    }

    @Override
    public String toString() {
        return "EngineConfig{dateMode=" + dateMode + ", delimiter=" + delimiter
                + ", calendarAnchor=" + calendarAnchor + ", dateFormat=" + dateFormat + '}';
    }

    public static final class Builder {
        private DateMode dateMode = DateMode.USE_COMPUTED_OFFSETS;
        private Delimiter delimiter = Delimiter.COMMA;
        private LocalDate calendarAnchor;
        private String dateFormat = DEFAULT_DATE_FORMAT;

        private Builder() {
        }

        public Builder dateMode(DateMode dateMode) {
            this.dateMode = Objects.requireNonNull(dateMode, "dateMode");
            return this;
        }

        public Builder delimiter(Delimiter delimiter) {
            this.delimiter = Objects.requireNonNull(delimiter, "delimiter");
            return this;
        }

        /** @param calendarAnchor may be null to disable calendar dates. */
        public Builder calendarAnchor(LocalDate calendarAnchor) {
            this.calendarAnchor = calendarAnchor;
            return this;
        }

        public Builder dateFormat(String dateFormat) {
            this.dateFormat = Objects.requireNonNull(dateFormat, "dateFormat");
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
