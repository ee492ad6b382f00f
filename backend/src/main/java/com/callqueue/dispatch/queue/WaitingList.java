package com.callqueue.dispatch.queue;

import com.callqueue.dispatch.caller.QueueEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Priority-ordered list of waiting callers. Every mutation renumbers positions 1..n before releasing the lock.
 */
public final class WaitingList {

    private final List<QueueEntry> entries = new ArrayList<>();

    /**
     * Inserts behind every caller of equal or higher priority. A requested position is honoured among
     * callers of equal or lower priority.
     *
     * @param requestedPosition 1-based, 0 for none
     * @return the position the entry landed on
     */
    public synchronized int insert(QueueEntry entry, int requestedPosition) {
        var index = entries.size();
        for (int i = 0; i < entries.size(); i++) {
            var cur = entries.get(i);
            if (entry.priority() > cur.priority()) {
                index = i;
                break;
            }
            if (requestedPosition > 0 && entry.priority() >= cur.priority() && requestedPosition <= i + 1) {
                index = i;
                break;
            }
        }
        entries.add(index, entry);
        renumber();
        return index + 1;
    }

    public synchronized boolean remove(QueueEntry entry) {
        var removed = entries.remove(entry);
        if (removed) renumber();
        return removed;
    }

    public synchronized boolean contains(QueueEntry entry) {
        return entries.contains(entry);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized List<QueueEntry> snapshot() {
        return List.copyOf(entries);
    }

    /**
     * Entries ahead of {@code entry} that are not already dialing members; -1 when the entry is not listed.
     */
    public synchronized int countWaitingAhead(QueueEntry entry) {
        var count = 0;
        for (var cur : entries) {
            if (cur == entry) return count;
            if (!cur.isPending()) count++;
        }
        return -1;
    }

    private void renumber() {
        for (int i = 0; i < entries.size(); i++) {
            entries.get(i).assignPosition(i + 1);
        }
    }
}
