package org.stackgraphs.stitching;

import com.typesafe.config.Config;

/**
 * Tuning options of a {@link PathStitcher}.
 *
 * @param detectSimilarPaths drop paths equivalent to one seen before
 * @param collectStats       collect {@link StitchingStats}
 * @param maxWorkPerPhase    maximum number of frontier paths extended per phase, {@code 0} for no limit
 */
public record StitcherConfig(boolean detectSimilarPaths, boolean collectStats, int maxWorkPerPhase) {

    public static final StitcherConfig DEFAULT = new StitcherConfig(true, false, 0);

    public StitcherConfig {
        if (maxWorkPerPhase < 0) {
            throw new IllegalArgumentException("maxWorkPerPhase must not be negative: " + maxWorkPerPhase);
        }
    }

    /**
     * Reads the {@code stitcher} block; missing options take their defaults.
     */
    public static StitcherConfig fromConfig(Config options) {
        boolean detectSimilarPaths = options.hasPath("detectSimilarPaths")
            ? options.getBoolean("detectSimilarPaths")
            : DEFAULT.detectSimilarPaths();
        boolean collectStats = options.hasPath("collectStats")
            ? options.getBoolean("collectStats")
            : DEFAULT.collectStats();
        int maxWorkPerPhase = options.hasPath("maxWorkPerPhase")
            ? options.getInt("maxWorkPerPhase")
            : DEFAULT.maxWorkPerPhase();
        return new StitcherConfig(detectSimilarPaths, collectStats, maxWorkPerPhase);
    }
}
