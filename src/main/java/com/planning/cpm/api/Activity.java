package com.planning.cpm.api;

/**
 * A schedulable unit of work. Immutable.
 *
 * @param id       Unique, non-empty identifier.
 * @param name     Display name.
 * @param duration Duration in days, never negative once inside a graph.
 */
public record Activity(String id, String name, int duration) {
}
