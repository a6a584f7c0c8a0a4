package com.wildcam.alerts.engine.state;

import com.wildcam.alerts.model.ActivityBaseline;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Component
public class InMemoryActivityStore implements ActivityStore {

    private final ConcurrentMap<String, SpeciesHistory> histories = new ConcurrentHashMap<>();

    @Override
    public boolean append(String species, long timestampMillis) {
        SpeciesHistory history = histories.computeIfAbsent(species, s -> new SpeciesHistory());
        synchronized (history) {
            if (!history.timestamps.isEmpty() && timestampMillis < history.timestamps.peekLast()) {
                return false;
            }
            history.timestamps.addLast(timestampMillis);
            history.hourCounts[hourOf(timestampMillis)]++;
            if (history.firstSeen == 0L || timestampMillis < history.firstSeen) {
                history.firstSeen = timestampMillis;
            }
            return true;
        }
    }

    @Override
    public void evictBefore(String species, long cutoffMillis) {
        SpeciesHistory history = histories.get(species);
        if (history == null) return;
        synchronized (history) {
            while (!history.timestamps.isEmpty() && history.timestamps.peekFirst() < cutoffMillis) {
                long evicted = history.timestamps.removeFirst();
                history.hourCounts[hourOf(evicted)]--;
            }
        }
    }

    @Override
    public ActivityBaseline snapshot(String species) {
        SpeciesHistory history = histories.get(species);
        if (history == null) {
            return ActivityBaseline.empty(species);
        }
        synchronized (history) {
            return new ActivityBaseline(species,
                    new ArrayList<>(history.timestamps),
                    history.hourCounts.clone(),
                    history.firstSeen);
        }
    }

    @Override
    public Set<String> species() {
        return Set.copyOf(histories.keySet());
    }

    static int hourOf(long timestampMillis) {
        return Instant.ofEpochMilli(timestampMillis).atZone(ZoneOffset.UTC).getHour();
    }

    private static final class SpeciesHistory {
        private final Deque<Long> timestamps = new ArrayDeque<>();
        private final int[] hourCounts = new int[24];
        private long firstSeen;
    }
}
