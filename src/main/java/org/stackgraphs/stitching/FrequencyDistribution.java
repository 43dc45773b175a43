package org.stackgraphs.stitching;

import java.util.Map;
import java.util.TreeMap;

/**
 * Counts how often each value was recorded.
 *
 * @param <T> the recorded value type
 */
public class FrequencyDistribution<T extends Comparable<T>> {

    private final TreeMap<T, Integer> counts = new TreeMap<>();
    private long total;

    public void record(T value) {
        counts.merge(value, 1, Integer::sum);
        total++;
    }

    public int frequency(T value) {
        return counts.getOrDefault(value, 0);
    }

    public long total() {
        return total;
    }

    public int uniqueValues() {
        return counts.size();
    }

    /**
     * Largest recorded value, or {@code null} if nothing was recorded.
     */
    public T max() {
        return counts.isEmpty() ? null : counts.lastKey();
    }

    public void merge(FrequencyDistribution<T> other) {
        for (Map.Entry<T, Integer> entry : other.counts.entrySet()) {
            counts.merge(entry.getKey(), entry.getValue(), Integer::sum);
        }
        total += other.total;
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
