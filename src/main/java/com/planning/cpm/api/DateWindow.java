package com.planning.cpm.api;

import java.time.LocalDate;

/**
 * Calendar dates supplied with an input row. Either bound may be null, but not
 * both.
 */
public record DateWindow(LocalDate start, LocalDate end) {
}
