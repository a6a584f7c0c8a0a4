package com.wildcam.alerts.engine.state;

import com.wildcam.alerts.model.FeatureVector;
import com.wildcam.alerts.model.PatternLabel;

import java.util.List;

/**
 * Labelled feature-vector memory used by the pattern matcher.
 * Implementations must make {@link #append} and its eviction atomic per label.
 */
public interface PatternStore {

    /**
     * Append a vector under the label, evicting the oldest entries so the label
     * holds at most {@code capacity} vectors.
     */
    void append(PatternLabel label, FeatureVector vector, int capacity);

    /**
     * Up to {@code limit} most recently appended vectors, oldest first.
     */
    List<FeatureVector> recent(PatternLabel label, int limit);

    int size(PatternLabel label);
}
