package com.planning.cpm.io;

import java.util.List;

/**
 * Result of parsing one constraint expression.
 *
 * @param relations Relations in token order.
 * @param skipped   Tokens that did not match the grammar, trimmed, in order.
 */
public record ParsedConstraints(List<ConstraintRelation> relations, List<String> skipped) {
    public static final ParsedConstraints EMPTY = new ParsedConstraints(List.of(), List.of());

    public ParsedConstraints {
        relations = List.copyOf(relations);
        skipped = List.copyOf(skipped);
    }

    public int skippedCount() {
        return skipped.size();
    }

    public boolean isEmpty() {
        return relations.isEmpty();
    }
}
