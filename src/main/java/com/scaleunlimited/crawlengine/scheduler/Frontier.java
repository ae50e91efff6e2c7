package com.scaleunlimited.crawlengine.scheduler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Priority-ordered queue of waiting requests. Highest priority comes first;
 * within a priority tier, entries come out in insertion order. Entries are
 * also indexed by host (in the same order), so a host's entries can be
 * re-prioritized in place, and its best entry found without a full scan.
 * 
 * Not thread-safe; the {@link Scheduler} guards all access.
 */
public class Frontier {

    public static final Comparator<FrontierEntry> ENTRY_ORDER = new Comparator<FrontierEntry>() {

        @Override
        public int compare(FrontierEntry o1, FrontierEntry o2) {
            // Reverse order on priority, so highest priority is at the front.
            int result = Double.compare(o2.getPriority(), o1.getPriority());
            if (result == 0) {
                result = Long.compare(o1.getSequence(), o2.getSequence());
            }

            return result;
        }
    };

    private final TreeSet<FrontierEntry> _entries;
    private final Map<String, TreeSet<FrontierEntry>> _byHost;

    public Frontier() {
        _entries = new TreeSet<>(ENTRY_ORDER);
        _byHost = new HashMap<>();
    }

    public void add(FrontierEntry entry) {
        if (!_entries.add(entry)) {
            throw new IllegalStateException("Duplicate frontier sequence number: " + entry);
        }

        TreeSet<FrontierEntry> hostEntries = _byHost.get(entry.getHost());
        if (hostEntries == null) {
            hostEntries = new TreeSet<>(ENTRY_ORDER);
            _byHost.put(entry.getHost(), hostEntries);
        }

        hostEntries.add(entry);
    }

    public boolean remove(FrontierEntry entry) {
        if (!_entries.remove(entry)) {
            return false;
        }

        TreeSet<FrontierEntry> hostEntries = _byHost.get(entry.getHost());
        hostEntries.remove(entry);
        if (hostEntries.isEmpty()) {
            _byHost.remove(entry.getHost());
        }

        return true;
    }

    /**
     * Remove and return the first entry (highest priority, oldest).
     */
    public FrontierEntry poll() {
        if (_entries.isEmpty()) {
            return null;
        }

        FrontierEntry result = _entries.first();
        remove(result);
        return result;
    }

    /**
     * @return iterator over entries in dispatch order. Don't modify the frontier
     *         while iterating.
     */
    public Iterator<FrontierEntry> iterator() {
        return Collections.unmodifiableSet(_entries).iterator();
    }

    /**
     * Change the priority of every entry for <host>. Nothing is dropped; entries keep
     * their original sequence numbers, so FIFO order within a tier is preserved.
     * 
     * @return number of entries that were re-prioritized.
     */
    public int reprioritize(String host, PriorityCalculator calculator) {
        TreeSet<FrontierEntry> hostEntries = _byHost.get(host);
        if (hostEntries == null) {
            return 0;
        }

        List<FrontierEntry> entries = new ArrayList<>(hostEntries);
        int result = 0;
        for (FrontierEntry entry : entries) {
            double newPriority = calculator.calculate(entry.getRequest());
            if (newPriority != entry.getPriority()) {
                // Re-insert, since priority is part of the sort key.
                _entries.remove(entry);
                hostEntries.remove(entry);
                entry.setPriority(newPriority);
                _entries.add(entry);
                hostEntries.add(entry);
                result += 1;
            }
        }

        return result;
    }

    /**
     * @return the first entry for <host> (in dispatch order) that isn't held
     *         back past <now>, or null if there's no such entry.
     */
    public FrontierEntry firstReady(String host, long now) {
        TreeSet<FrontierEntry> hostEntries = _byHost.get(host);
        if (hostEntries == null) {
            return null;
        }

        for (FrontierEntry entry : hostEntries) {
            if (entry.getNotBefore() <= now) {
                return entry;
            }
        }

        return null;
    }

    /**
     * @return the earliest time at which some entry for <host> stops being held
     *         back, but never earlier than <floor>. Returns Long.MAX_VALUE if
     *         <host> has no entries.
     */
    public long getEarliestNotBefore(String host, long floor) {
        TreeSet<FrontierEntry> hostEntries = _byHost.get(host);
        if (hostEntries == null) {
            return Long.MAX_VALUE;
        }

        long result = Long.MAX_VALUE;
        for (FrontierEntry entry : hostEntries) {
            result = Math.min(result, entry.getNotBefore());
            if (result <= floor) {
                return floor;
            }
        }

        return result;
    }

    public Set<String> getHosts() {
        return Collections.unmodifiableSet(_byHost.keySet());
    }

    public int getHostSize(String host) {
        Set<FrontierEntry> hostEntries = _byHost.get(host);
        return (hostEntries == null) ? 0 : hostEntries.size();
    }

    public int size() {
        return _entries.size();
    }

    public boolean isEmpty() {
        return _entries.isEmpty();
    }

    public void clear() {
        _entries.clear();
        _byHost.clear();
    }
}
