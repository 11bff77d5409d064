package com.planning.cpm.io;

import com.planning.cpm.config.DateMode;
import com.planning.cpm.config.Delimiter;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * POJO representation of a schedule document, as read by
 * {@link ScheduleDefinitionReader}. Fields are raw and unvalidated; see
 * {@link RecordValidator}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ScheduleDefinition {
    private ScheduleInfo schedule;

    /** Meta-information and rows of the schedule. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ScheduleInfo {
        private String name;
        private DateMode dateMode;
        private Delimiter delimiter;
        private String calendarAnchor;
        private String dateFormat;
        private List<ActivityRow> activities;
    }

    /** One input row, with the column names used by schedule spreadsheets. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ActivityRow {
        @JsonProperty("ActivityID")
        private String activityId;
        @JsonProperty("ActivityName")
        private String activityName;
        @JsonProperty("Duration")
        private Integer duration;
        @JsonProperty("Predecessors")
        private String predecessors;
        @JsonProperty("Constraint")
        private String constraint;
        @JsonProperty("LogicConstraints")
        private String logicConstraints;
        @JsonProperty("StartDate")
        private String startDate;
        @JsonProperty("EndDate")
        private String endDate;
    }
}
