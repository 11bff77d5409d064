package com.planning.cpm.util;

import com.planning.cpm.api.ScheduleListener;

import java.util.Arrays;

/**
 * Fans callbacks out to several {@link ScheduleListener}s, in registration
 * order.
 */
public class CompositeScheduleListener implements ScheduleListener {
    private ScheduleListener[] listeners = new ScheduleListener[0];

    public void addForComposite(ScheduleListener listener) {
        ScheduleListener[] old = listeners;
        ScheduleListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onPassStart(Pass pass, int activityCount) {
        for (ScheduleListener l : listeners)
            l.onPassStart(pass, activityCount);
    }

    @Override
    public void onActivityTimed(Pass pass, int topoIndex, String activityId, int start, int finish) {
        for (ScheduleListener l : listeners)
            l.onActivityTimed(pass, topoIndex, activityId, start, finish);
    }

    @Override
    public void onPassEnd(Pass pass, int activityCount, long durationNanos) {
        for (ScheduleListener l : listeners)
            l.onPassEnd(pass, activityCount, durationNanos);
    }
}
