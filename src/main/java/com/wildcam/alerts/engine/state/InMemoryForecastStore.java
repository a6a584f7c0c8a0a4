package com.wildcam.alerts.engine.state;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Component
public class InMemoryForecastStore implements ForecastStore {

    private final ConcurrentMap<String, SpeciesPattern> patterns = new ConcurrentHashMap<>();

    @Override
    public boolean append(String species, int hour, long timestampMillis, double count, int capacity) {
        SpeciesPattern pattern = patterns.computeIfAbsent(species, s -> new SpeciesPattern());
        synchronized (pattern) {
            if (timestampMillis < pattern.lastTimestamp) {
                return false;
            }
            pattern.lastTimestamp = timestampMillis;
            Deque<Double> bucket = pattern.byHour[hour];
            bucket.addLast(count);
            while (bucket.size() > capacity) {
                bucket.removeFirst();
            }
            return true;
        }
    }

    @Override
    public List<Double> samples(String species, int hour) {
        SpeciesPattern pattern = patterns.get(species);
        if (pattern == null) return List.of();
        synchronized (pattern) {
            return new ArrayList<>(pattern.byHour[hour]);
        }
    }

    @Override
    public Set<String> species() {
        return Set.copyOf(patterns.keySet());
    }

    private static final class SpeciesPattern {
        @SuppressWarnings("unchecked")
        private final Deque<Double>[] byHour = new Deque[24];
        private long lastTimestamp = Long.MIN_VALUE;

        SpeciesPattern() {
            for (int h = 0; h < 24; h++) {
                byHour[h] = new ArrayDeque<>();
            }
        }
    }
}
