package com.wildcam.alerts.engine.state;

import com.wildcam.alerts.model.FeatureVector;
import com.wildcam.alerts.model.PatternLabel;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

@Component
public class InMemoryPatternStore implements PatternStore {

    private final Map<PatternLabel, Deque<FeatureVector>> patterns = new EnumMap<>(PatternLabel.class);

    public InMemoryPatternStore() {
        for (PatternLabel label : PatternLabel.values()) {
            patterns.put(label, new ArrayDeque<>());
        }
    }

    @Override
    public void append(PatternLabel label, FeatureVector vector, int capacity) {
        Deque<FeatureVector> deque = patterns.get(label);
        synchronized (deque) {
            deque.addLast(vector);
            while (deque.size() > capacity) {
                deque.removeFirst();
            }
        }
    }

    @Override
    public List<FeatureVector> recent(PatternLabel label, int limit) {
        Deque<FeatureVector> deque = patterns.get(label);
        synchronized (deque) {
            int take = Math.min(limit, deque.size());
            List<FeatureVector> result = new ArrayList<>(take);
            Iterator<FeatureVector> it = deque.descendingIterator();
            while (it.hasNext() && result.size() < take) {
                result.add(it.next());
            }
            Collections.reverse(result);
            return result;
        }
    }

    @Override
    public int size(PatternLabel label) {
        Deque<FeatureVector> deque = patterns.get(label);
        synchronized (deque) {
            return deque.size();
        }
    }
}
