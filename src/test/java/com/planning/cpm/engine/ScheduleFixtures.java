package com.planning.cpm.engine;

import com.planning.cpm.api.RelationType;

/** Shared schedules for engine tests. */
final class ScheduleFixtures {
    private ScheduleFixtures() {
    }

    /**
     * A(5) -> B(3) -> {C(4), D(2)} -> E(3), all finish-to-start. The B -> C
     * edge carries the given lag.
     */
    static ScheduleGraph construction(int lagBC) {
        return ScheduleGraph.builder()
                .addActivity("A", "Excavation", 5)
                .addActivity("B", "Foundation", 3)
                .addActivity("C", "Framing", 4)
                .addActivity("D", "Electrical", 2)
                .addActivity("E", "Roofing", 3)
                .addEdge("A", "B", RelationType.FS, 0)
                .addEdge("B", "C", RelationType.FS, lagBC)
                .addEdge("B", "D", RelationType.FS, 0)
                .addEdge("C", "E", RelationType.FS, 0)
                .addEdge("D", "E", RelationType.FS, 0)
                .build();
    }

    static ScheduleGraph construction() {
        return construction(0);
    }

    /** Two activities joined by a single edge of the given type and lag. */
    static ScheduleGraph pair(int predDuration, int succDuration, RelationType type, int lag) {
        return ScheduleGraph.builder()
                .addActivity("P", "pred", predDuration)
                .addActivity("S", "succ", succDuration)
                .addEdge("P", "S", type, lag)
                .build();
    }
}
