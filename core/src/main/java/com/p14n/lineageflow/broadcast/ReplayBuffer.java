package com.p14n.lineageflow.broadcast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Bounded history of recent events, oldest evicted first. Not thread safe;
 * the owning {@link EventBroadcaster} serializes access.
 */
public class ReplayBuffer {

    private final int capacity;
    private final ArrayDeque<BroadcastEvent> events;

    public ReplayBuffer(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity cannot be negative");
        }
        this.capacity = capacity;
        this.events = new ArrayDeque<>(Math.max(capacity, 1));
    }

    public void add(BroadcastEvent event) {
        if (capacity == 0) {
            return;
        }
        if (events.size() == capacity) {
            events.removeFirst();
        }
        events.addLast(event);
    }

    /**
     * Returns up to {@code limit} of the most recent events on the given
     * topics, oldest first.
     */
    public List<BroadcastEvent> recent(Set<Topic> topics, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<BroadcastEvent> picked = new ArrayList<>(Math.min(limit, events.size()));
        Iterator<BroadcastEvent> newestFirst = events.descendingIterator();
        while (newestFirst.hasNext() && picked.size() < limit) {
            BroadcastEvent e = newestFirst.next();
            if (topics.contains(e.topic())) {
                picked.add(e);
            }
        }
        Collections.reverse(picked);
        return picked;
    }

    public int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }
}
