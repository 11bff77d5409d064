package com.planning.cpm.error;

import java.util.List;

/**
 * Raised by graph validation when the precedence network is not acyclic.
 *
 * <p>
 * {@link #cycle()} lists the activity ids of one discovered cycle in precedence
 * order (each id is a predecessor of the next, the last one precedes the
 * first). The cycle is the first one found, not necessarily the shortest.
 */
public final class CyclicDependencyException extends ScheduleException {
    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Cycle detected among activities: " + String.join(" -> ", cycle)
                + (cycle.isEmpty() ? "" : " -> " + cycle.get(0)));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
