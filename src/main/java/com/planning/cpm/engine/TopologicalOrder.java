package com.planning.cpm.engine;

import com.planning.cpm.api.Activity;
import com.planning.cpm.api.PrecedenceEdge;
import com.planning.cpm.api.RelationType;

import java.util.*;

/**
 * CSR-encoded, validated precedence network in topological order.
 *
 * <p>
 * Produced only by {@link ScheduleGraph#validate()}. Every activity is
 * addressed by its topological index {@code ti}: iterating 0..N-1 visits every
 * predecessor before its successors, iterating N-1..0 visits every successor
 * before its predecessors.
 *
 * Data layout (one block for successors, a mirrored one for predecessors):
 * - childrenOffset[ti] .. childrenOffset[ti+1] delimits node ti's slice of the
 * flat childrenList / childType / childLag arrays.
 * - Each slot holds the successor's topological index and the relation type and
 * lag of the edge that links them.
 */
public final class TopologicalOrder {
    private final Activity[] topoOrder;
    private final Map<String, Integer> idToIndex;

    private final int[] childrenOffset;
    private final int[] childrenList;
    private final RelationType[] childType;
    private final int[] childLag;

    private final int[] parentsOffset;
    private final int[] parentsList;
    private final RelationType[] parentType;
    private final int[] parentLag;

    private TopologicalOrder(Activity[] topoOrder, Map<String, Integer> idToIndex,
            int[] childrenOffset, int[] childrenList, RelationType[] childType, int[] childLag,
            int[] parentsOffset, int[] parentsList, RelationType[] parentType, int[] parentLag) {
        this.topoOrder = topoOrder;
        this.idToIndex = idToIndex;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.childType = childType;
        this.childLag = childLag;
        this.parentsOffset = parentsOffset;
        this.parentsList = parentsList;
        this.parentType = parentType;
        this.parentLag = parentLag;
    }

    public int activityCount() {
        return topoOrder.length;
    }

    /** Returns the activity at the given topological index. */
    public Activity activity(int ti) {
        return topoOrder[ti];
    }

    /** Resolves an activity id to its topological index. */
    public int topoIndex(String activityId) {
        Integer idx = idToIndex.get(activityId);
        if (idx == null)
            throw new IllegalArgumentException("Unknown activity: " + activityId);
        return idx;
    }

    /** Activity ids in topological order. */
    public List<String> ids() {
        List<String> ids = new ArrayList<>(topoOrder.length);
        for (Activity a : topoOrder)
            ids.add(a.id());
        return ids;
    }

    public int edgeCount() {
        return childrenList.length;
    }

    // ── Successors ──────────────────────────────────────────────

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int childrenStart(int ti) {
        return childrenOffset[ti];
    }

    public int childrenEnd(int ti) {
        return childrenOffset[ti + 1];
    }

    public int childAt(int flatIndex) {
        return childrenList[flatIndex];
    }

    public RelationType childTypeAt(int flatIndex) {
        return childType[flatIndex];
    }

    public int childLagAt(int flatIndex) {
        return childLag[flatIndex];
    }

    // ── Predecessors ────────────────────────────────────────────

    public int parentCount(int ti) {
        return parentsOffset[ti + 1] - parentsOffset[ti];
    }

    public int parentsStart(int ti) {
        return parentsOffset[ti];
    }

    public int parentsEnd(int ti) {
        return parentsOffset[ti + 1];
    }

    public int parentAt(int flatIndex) {
        return parentsList[flatIndex];
    }

    public RelationType parentTypeAt(int flatIndex) {
        return parentType[flatIndex];
    }

    public int parentLagAt(int flatIndex) {
        return parentLag[flatIndex];
    }

    /**
     * Builds the compact arrays.
     *
     * @param ordered  Activities in topological order.
     * @param outgoing Outgoing edges per insertion index.
     * @param incoming Incoming edges per insertion index.
     * @param order    order[ti] is the insertion index of the activity at ti.
     */
    static TopologicalOrder compile(Activity[] ordered, List<List<PrecedenceEdge>> outgoing,
            List<List<PrecedenceEdge>> incoming, int[] order) {
        int n = ordered.length;
        Map<String, Integer> idToIndex = new HashMap<>(n * 2);
        for (int ti = 0; ti < n; ti++)
            idToIndex.put(ordered[ti].id(), ti);

        int totalEdges = 0;
        int[] childOffsets = new int[n + 1];
        int[] parentOffsets = new int[n + 1];
        for (int ti = 0; ti < n; ti++) {
            int children = outgoing.get(order[ti]).size();
            childOffsets[ti + 1] = childOffsets[ti] + children;
            parentOffsets[ti + 1] = parentOffsets[ti] + incoming.get(order[ti]).size();
            totalEdges += children;
        }

        int[] flatChildren = new int[totalEdges];
        RelationType[] childTypes = new RelationType[totalEdges];
        int[] childLags = new int[totalEdges];
        int[] flatParents = new int[totalEdges];
        RelationType[] parentTypes = new RelationType[totalEdges];
        int[] parentLags = new int[totalEdges];

        for (int ti = 0; ti < n; ti++) {
            int base = childOffsets[ti];
            for (PrecedenceEdge e : outgoing.get(order[ti])) {
                flatChildren[base] = idToIndex.get(e.successorId());
                childTypes[base] = e.type();
                childLags[base] = e.lag();
                base++;
            }
            base = parentOffsets[ti];
            for (PrecedenceEdge e : incoming.get(order[ti])) {
                flatParents[base] = idToIndex.get(e.predecessorId());
                parentTypes[base] = e.type();
                parentLags[base] = e.lag();
                base++;
            }
        }
        return new TopologicalOrder(ordered, idToIndex,
                childOffsets, flatChildren, childTypes, childLags,
                parentOffsets, flatParents, parentTypes, parentLags);
    }
}
