package com.planning.cpm.api;

/**
 * A typed, lagged precedence constraint between two activities. A negative lag
 * is a lead.
 */
public record PrecedenceEdge(String predecessorId, String successorId, RelationType type, int lag) {

    @Override
    public String toString() {
        return predecessorId + " -" + type + (lag >= 0 ? "+" : "") + lag + "-> " + successorId;
    }
}
