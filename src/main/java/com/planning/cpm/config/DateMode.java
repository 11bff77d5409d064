package com.planning.cpm.config;

/** How calendar Start/End dates are chosen for output rows. */
public enum DateMode {
    /** Activities carrying StartDate/EndDate keep them; others fall back to computed offsets. */
    USE_SUPPLIED_DATES,
    /** Every activity's dates are the calendar anchor plus its ES/EF offsets. */
    USE_COMPUTED_OFFSETS
}
