package com.planning.cpm.engine;

import com.planning.cpm.api.Activity;
import com.planning.cpm.api.PrecedenceEdge;
import com.planning.cpm.api.RelationType;
import com.planning.cpm.error.CyclicDependencyException;
import com.planning.cpm.error.DuplicateActivityException;
import com.planning.cpm.error.InvalidDurationException;
import com.planning.cpm.error.SelfLoopException;
import com.planning.cpm.error.UnknownActivityException;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable precedence network: the activity set plus at most one typed edge
 * per (predecessor, successor) pair.
 *
 * <p>
 * Instances are produced by {@link Builder}, which enforces the structural
 * rules at insertion time: unique ids, non-negative durations, no edge to or
 * from an undeclared activity, no self-edge. Acyclicity is checked separately
 * by {@link #validate()}, which also fixes the execution order for every pass.
 *
 * <p>
 * Activity and edge iteration order is insertion order. A replaced edge keeps
 * the position of the first edge written for its pair.
 */
@Log4j2
public final class ScheduleGraph {
    private final List<Activity> activities;
    private final Map<String, Integer> indexById;
    private final List<PrecedenceEdge> edges;

    private ScheduleGraph(List<Activity> activities, Map<String, Integer> indexById, List<PrecedenceEdge> edges) {
        this.activities = activities;
        this.indexById = indexById;
        this.edges = edges;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int activityCount() {
        return activities.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /** Activities in insertion order. */
    public List<Activity> activities() {
        return activities;
    }

    /** Edges in insertion order of their (predecessor, successor) pair. */
    public List<PrecedenceEdge> edges() {
        return edges;
    }

    public boolean contains(String activityId) {
        return indexById.containsKey(activityId);
    }

    /**
     * Looks up an activity by id.
     *
     * @throws IllegalArgumentException if the id is not part of the graph.
     */
    public Activity activity(String activityId) {
        Integer idx = indexById.get(activityId);
        if (idx == null)
            throw new IllegalArgumentException("Unknown activity: " + activityId);
        return activities.get(idx);
    }

    /**
     * Checks the graph is acyclic and computes its topological order.
     * <p>
     * Kahn's algorithm. Among activities that are ready at the same time the
     * lexicographically smallest id is taken first, so the order (and every
     * timing derived from it) is identical across runs on identical input.
     *
     * @return the compiled order.
     * @throws CyclicDependencyException if some activities cannot be ordered.
     */
    public TopologicalOrder validate() {
        int n = activities.size();
        List<List<PrecedenceEdge>> outgoing = new ArrayList<>(n);
        List<List<PrecedenceEdge>> incoming = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            outgoing.add(new ArrayList<>());
            incoming.add(new ArrayList<>());
        }
        int[] inDegree = new int[n];
        for (PrecedenceEdge e : edges) {
            int from = indexById.get(e.predecessorId());
            int to = indexById.get(e.successorId());
            outgoing.get(from).add(e);
            incoming.get(to).add(e);
            inDegree[to]++;
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>(
                Math.max(1, n), Comparator.comparing(i -> activities.get(i).id()));
        for (int i = 0; i < n; i++)
            if (inDegree[i] == 0)
                ready.add(i);

        int[] order = new int[n];
        int placed = 0;
        while (!ready.isEmpty()) {
            int curr = ready.poll();
            order[placed++] = curr;
            for (PrecedenceEdge e : outgoing.get(curr)) {
                int child = indexById.get(e.successorId());
                if (--inDegree[child] == 0)
                    ready.add(child);
            }
        }

        if (placed != n) {
            List<String> cycle = findCycle(inDegree, incoming);
            log.debug("Validation stopped after ordering {} of {} activities", placed, n);
            throw new CyclicDependencyException(cycle);
        }

        Activity[] ordered = new Activity[n];
        for (int ti = 0; ti < n; ti++)
            ordered[ti] = activities.get(order[ti]);
        return TopologicalOrder.compile(ordered, outgoing, incoming, order);
    }

    /**
     * Extracts one cycle from the activities Kahn's algorithm could not place.
     * <p>
     * Every unplaced activity still has an unplaced predecessor, so walking
     * predecessors from any unplaced activity must revisit one. The walk starts
     * at the smallest unplaced id and always steps to the smallest unplaced
     * predecessor id.
     */
    private List<String> findCycle(int[] inDegree, List<List<PrecedenceEdge>> incoming) {
        String start = null;
        for (int i = 0; i < activities.size(); i++) {
            String id = activities.get(i).id();
            if (inDegree[i] > 0 && (start == null || id.compareTo(start) < 0))
                start = id;
        }

        List<String> walk = new ArrayList<>();
        Map<String, Integer> seenAt = new HashMap<>();
        String curr = start;
        while (!seenAt.containsKey(curr)) {
            seenAt.put(curr, walk.size());
            walk.add(curr);
            String next = null;
            for (PrecedenceEdge e : incoming.get(indexById.get(curr))) {
                String pred = e.predecessorId();
                if (inDegree[indexById.get(pred)] > 0 && (next == null || pred.compareTo(next) < 0))
                    next = pred;
            }
            curr = next;
        }

        // The walk ran against edge direction; reverse it into precedence order
        List<String> cycle = new ArrayList<>(walk.subList(seenAt.get(curr), walk.size()));
        Collections.reverse(cycle);
        Collections.rotate(cycle, -cycle.indexOf(curr));
        return cycle;
    }

    /**
     * Collects activities and edges, then freezes them into a
     * {@link ScheduleGraph}.
     */
    public static final class Builder {
        private final List<Activity> activities = new ArrayList<>();
        private final Map<String, Integer> indexById = new HashMap<>();
        private final Map<List<String>, PrecedenceEdge> edges = new LinkedHashMap<>();
        private boolean built;

        private Builder() {
        }

        /**
         * Declares an activity.
         *
         * @throws DuplicateActivityException if the id is already declared.
         * @throws InvalidDurationException   if the duration is negative.
         * @throws IllegalArgumentException   if the id is null or blank.
         */
        public Builder addActivity(String id, String name, int duration) {
            checkNotBuilt();
            if (id == null || id.isBlank())
                throw new IllegalArgumentException("Activity id must be non-empty");
            if (indexById.containsKey(id))
                throw new DuplicateActivityException(id);
            if (duration < 0)
                throw new InvalidDurationException(id, duration);
            indexById.put(id, activities.size());
            activities.add(new Activity(id, name == null ? id : name, duration));
            return this;
        }

        /**
         * Adds or replaces the edge for the (pred, succ) pair.
         *
         * @throws UnknownActivityException if either endpoint is undeclared.
         * @throws SelfLoopException        if pred and succ are the same id.
         */
        public Builder addEdge(String pred, String succ, RelationType type, int lag) {
            checkNotBuilt();
            Objects.requireNonNull(type, "type");
            if (!indexById.containsKey(pred))
                throw new UnknownActivityException(pred, pred, succ);
            if (!indexById.containsKey(succ))
                throw new UnknownActivityException(succ, pred, succ);
            if (pred.equals(succ))
                throw new SelfLoopException(pred);
            PrecedenceEdge previous = edges.put(List.of(pred, succ), new PrecedenceEdge(pred, succ, type, lag));
            if (previous != null)
                log.debug("Edge {} -> {} replaced: {} now {}{}", pred, succ, previous, type, lag);
            return this;
        }

        public ScheduleGraph build() {
            checkNotBuilt();
            built = true;
            return new ScheduleGraph(
                    Collections.unmodifiableList(new ArrayList<>(activities)),
                    Map.copyOf(indexById),
                    List.copyOf(edges.values()));
        }

        private void checkNotBuilt() {
            if (built)
                throw new IllegalStateException("Graph already built");
        }
    }
}
