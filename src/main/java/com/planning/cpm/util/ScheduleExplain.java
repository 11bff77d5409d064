package com.planning.cpm.util;

import com.planning.cpm.api.ActivityTiming;
import com.planning.cpm.engine.ScheduleResult;
import com.planning.cpm.engine.TopologicalOrder;

/**
 * Diagnostic renderings of a computed schedule.
 *
 * <p>
 * Produces human-readable text for a single activity, a dump of the whole
 * precedence network, and a Mermaid flowchart with critical activities
 * highlighted. Intended for debugging and reports; allocates freely.
 */
public final class ScheduleExplain {
    private final ScheduleResult result;
    private final TopologicalOrder topology;

    public ScheduleExplain(ScheduleResult result) {
        this.result = result;
        this.topology = result.topology();
    }

    /**
     * Dumps the timing and neighbours of one activity.
     */
    public String explainActivity(String activityId) {
        int idx = topology.topoIndex(activityId);
        ActivityTiming t = result.row(activityId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Activity: ").append(t.id()).append(" (").append(t.name()).append(")\n")
                .append("  Topo index: ").append(idx).append('\n')
                .append("  Duration: ").append(t.duration()).append('\n')
                .append("  ES/EF: ").append(t.earlyStart()).append('/').append(t.earlyFinish()).append('\n')
                .append("  LS/LF: ").append(t.lateStart()).append('/').append(t.lateFinish()).append('\n')
                .append("  Float: ").append(t.totalFloat()).append(t.critical() ? " (critical)" : "").append('\n');

        int pc = topology.parentCount(idx);
        sb.append("  Predecessors (").append(pc).append("): ");
        for (int pi = topology.parentsStart(idx); pi < topology.parentsEnd(idx); pi++) {
            sb.append(topology.activity(topology.parentAt(pi)).id())
                    .append(' ').append(relationLabel(topology.parentTypeAt(pi).name(), topology.parentLagAt(pi)));
            if (pi < topology.parentsEnd(idx) - 1)
                sb.append(", ");
        }
        sb.append('\n');

        int cc = topology.childCount(idx);
        sb.append("  Successors (").append(cc).append("): ");
        for (int ci = topology.childrenStart(idx); ci < topology.childrenEnd(idx); ci++) {
            sb.append(topology.activity(topology.childAt(ci)).id())
                    .append(' ').append(relationLabel(topology.childTypeAt(ci).name(), topology.childLagAt(ci)));
            if (ci < topology.childrenEnd(idx) - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /** One-line summary of the run. */
    public String explainSummary() {
        return "Activities: " + topology.activityCount()
                + ", Edges: " + topology.edgeCount()
                + ", Duration: " + result.projectDuration() + " days"
                + ", Critical path: " + result.summary().criticalPathLabel();
    }

    /**
     * Dumps the network in topological order.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Schedule (").append(topology.activityCount()).append(" activities):\n");
        for (int i = 0; i < topology.activityCount(); i++) {
            String id = topology.activity(i).id();
            sb.append("  [").append(i).append("] ").append(id);
            if (result.row(id).critical())
                sb.append(" (CRIT)");
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int ci = topology.childrenStart(i); ci < topology.childrenEnd(i); ci++) {
                    sb.append(topology.activity(topology.childAt(ci)).id())
                            .append('[').append(relationLabel(topology.childTypeAt(ci).name(),
                                    topology.childLagAt(ci)))
                            .append(']');
                    if (ci < topology.childrenEnd(i) - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart of the network.
     * <p>
     * Activities are declared in output row order (by ES), then edges labelled
     * with their relation and lag. Critical activities get the {@code critical}
     * class.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");

        for (ActivityTiming t : result.rows()) {
            sb.append("  ").append(sanitize(t.id()))
                    .append("[\"").append(t.id()).append(" - ").append(t.name())
                    .append("<br/>ES ").append(t.earlyStart()).append(" EF ").append(t.earlyFinish())
                    .append("<br/>Float ").append(t.totalFloat()).append("\"]");
            if (t.critical())
                sb.append(":::critical");
            sb.append(";\n");
        }

        for (ActivityTiming t : result.rows()) {
            int i = topology.topoIndex(t.id());
            for (int ci = topology.childrenStart(i); ci < topology.childrenEnd(i); ci++) {
                String child = topology.activity(topology.childAt(ci)).id();
                sb.append("  ").append(sanitize(t.id()))
                        .append(" -- \"").append(relationLabel(topology.childTypeAt(ci).name(),
                                topology.childLagAt(ci)))
                        .append("\" --> ").append(sanitize(child)).append(";\n");
            }
        }
        sb.append("  classDef critical fill:#f66,stroke:#900;\n");
        return sb.toString();
    }

    static String relationLabel(String type, int lag) {
        if (lag == 0)
            return type;
        return type + (lag > 0 ? "+" : "") + lag;
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
