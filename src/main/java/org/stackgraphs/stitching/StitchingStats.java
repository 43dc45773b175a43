package org.stackgraphs.stitching;

/**
 * Counters collected by a {@link PathStitcher} when {@link StitcherConfig#collectStats()} is set.
 */
public class StitchingStats {

    private final FrequencyDistribution<Integer> candidatesPerPath = new FrequencyDistribution<>();
    private final FrequencyDistribution<Integer> extensionsPerPath = new FrequencyDistribution<>();
    private final FrequencyDistribution<Integer> frontierPerPhase = new FrequencyDistribution<>();
    private int rejectedExtensions;
    private int prunedCycles;
    private int similarPaths;

    void recordPath(int candidates, int extensions) {
        candidatesPerPath.record(candidates);
        extensionsPerPath.record(extensions);
    }

    void recordPhase(int frontierSize) {
        frontierPerPhase.record(frontierSize);
    }

    void recordRejected() {
        rejectedExtensions++;
    }

    void recordCycle() {
        prunedCycles++;
    }

    void recordSimilar() {
        similarPaths++;
    }

    public FrequencyDistribution<Integer> candidatesPerPath() {
        return candidatesPerPath;
    }

    public FrequencyDistribution<Integer> extensionsPerPath() {
        return extensionsPerPath;
    }

    public FrequencyDistribution<Integer> frontierPerPhase() {
        return frontierPerPhase;
    }

    public int rejectedExtensions() {
        return rejectedExtensions;
    }

    public int prunedCycles() {
        return prunedCycles;
    }

    public int similarPaths() {
        return similarPaths;
    }

    @Override
    public String toString() {
        return "StitchingStats{phases=" + frontierPerPhase.total()
            + ", paths=" + candidatesPerPath.total()
            + ", rejected=" + rejectedExtensions
            + ", cycles=" + prunedCycles
            + ", similar=" + similarPaths + "}";
    }
}
