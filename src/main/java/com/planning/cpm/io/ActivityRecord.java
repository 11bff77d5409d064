package com.planning.cpm.io;

import com.planning.cpm.api.DateWindow;

import java.util.List;

/**
 * A validated input row.
 *
 * @param row          Zero-based row index in the source document.
 * @param id           Trimmed, non-blank activity id.
 * @param name         Display name; the id when the row had none.
 * @param duration     Declared duration, checked for sign by the graph.
 * @param relations    Resolved precedence relations onto this activity.
 * @param skipped      Malformed constraint tokens dropped from this row.
 * @param suppliedDates Supplied calendar dates, or null.
 */
public record ActivityRecord(
        int row,
        String id,
        String name,
        int duration,
        List<ConstraintRelation> relations,
        List<String> skipped,
        DateWindow suppliedDates) {

    public ActivityRecord {
        relations = List.copyOf(relations);
        skipped = List.copyOf(skipped);
    }
}
