package com.planning.cpm.io;

import com.planning.cpm.api.RelationType;

/** One parsed precedence relation of an input row, relative to that row's activity. */
public record ConstraintRelation(String predecessorId, RelationType type, int lag) {

    /** A bare predecessor id: finish-to-start with no lag. */
    public static ConstraintRelation finishToStart(String predecessorId) {
        return new ConstraintRelation(predecessorId, RelationType.FS, 0);
    }
}
