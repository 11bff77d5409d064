package com.planning.cpm.api;

/**
 * The four precedence relation types and their timing arithmetic.
 *
 * <p>
 * Forward pass: each incoming edge contributes a lower bound on the
 * successor's earliest start. Backward pass: each outgoing edge contributes an
 * upper bound on the predecessor's latest finish.
 *
 * <pre>
 *        forward (ES[succ] &gt;=)     backward (LF[pred] &lt;=)
 *   FS   EF[pred] + lag              LS[succ] - lag
 *   SS   ES[pred] + lag              LS[succ] - lag
 *   FF   EF[pred] + lag - d[succ]    LF[succ] - lag
 *   SF   ES[pred] + lag - d[succ]    ES[succ] - lag
 * </pre>
 *
 * <p>
 * All arithmetic is exact and throws {@link ArithmeticException} on int
 * overflow.
 */
public enum RelationType {
    /** Finish-to-Start. */
    FS {
        @Override
        public int earliestStart(int predStart, int predFinish, int lag, int duration) {
            return Math.addExact(predFinish, lag);
        }

        @Override
        public int latestFinish(int succEarlyStart, int succLateStart, int succLateFinish, int lag) {
            return Math.subtractExact(succLateStart, lag);
        }
    },
    /** Start-to-Start. */
    SS {
        @Override
        public int earliestStart(int predStart, int predFinish, int lag, int duration) {
            return Math.addExact(predStart, lag);
        }

        @Override
        public int latestFinish(int succEarlyStart, int succLateStart, int succLateFinish, int lag) {
            return Math.subtractExact(succLateStart, lag);
        }
    },
    /** Finish-to-Finish. */
    FF {
        @Override
        public int earliestStart(int predStart, int predFinish, int lag, int duration) {
            return Math.subtractExact(Math.addExact(predFinish, lag), duration);
        }

        @Override
        public int latestFinish(int succEarlyStart, int succLateStart, int succLateFinish, int lag) {
            return Math.subtractExact(succLateFinish, lag);
        }
    },
    /** Start-to-Finish. */
    SF {
        @Override
        public int earliestStart(int predStart, int predFinish, int lag, int duration) {
            return Math.subtractExact(Math.addExact(predStart, lag), duration);
        }

        @Override
        public int latestFinish(int succEarlyStart, int succLateStart, int succLateFinish, int lag) {
            return Math.subtractExact(succEarlyStart, lag);
        }
    };

    /**
     * Lower bound this relation places on the successor's earliest start.
     *
     * @param predStart  ES of the predecessor.
     * @param predFinish EF of the predecessor.
     * @param lag        Signed lag of the edge.
     * @param duration   Duration of the successor.
     */
    public abstract int earliestStart(int predStart, int predFinish, int lag, int duration);

    /**
     * Upper bound this relation places on the predecessor's latest finish.
     *
     * @param succEarlyStart ES of the successor.
     * @param succLateStart  LS of the successor.
     * @param succLateFinish LF of the successor.
     * @param lag            Signed lag of the edge.
     */
    public abstract int latestFinish(int succEarlyStart, int succLateStart, int succLateFinish, int lag);

    /**
     * Case-sensitive lookup of a two-letter relation code.
     *
     * @return the matching type, or null when the code is not one of FS, SS, FF, SF.
     */
    public static RelationType fromCode(String code) {
        for (RelationType t : values()) {
            if (t.name().equals(code))
                return t;
        }
        return null;
    }
}
