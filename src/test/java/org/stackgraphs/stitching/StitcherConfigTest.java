package org.stackgraphs.stitching;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class StitcherConfigTest {

    @Test
    void fromConfig_missingOptionsTakeDefaults() {
        assertThat(StitcherConfig.fromConfig(ConfigFactory.empty())).isEqualTo(StitcherConfig.DEFAULT);
    }

    @Test
    void fromConfig_readsAllOptions() {
        StitcherConfig config = StitcherConfig.fromConfig(ConfigFactory.parseString(
            "detectSimilarPaths = false, collectStats = true, maxWorkPerPhase = 25"));

        assertThat(config).isEqualTo(new StitcherConfig(false, true, 25));
    }

    @Test
    void negativeWorkLimitIsRejected() {
        assertThatThrownBy(() -> new StitcherConfig(true, false, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void frequencyDistribution_countsAndMerges() {
        FrequencyDistribution<Integer> first = new FrequencyDistribution<>();
        first.record(2);
        first.record(2);
        first.record(7);
        FrequencyDistribution<Integer> second = new FrequencyDistribution<>();
        second.record(7);
        second.record(1);

        first.merge(second);

        assertThat(first.total()).isEqualTo(5);
        assertThat(first.uniqueValues()).isEqualTo(3);
        assertThat(first.frequency(2)).isEqualTo(2);
        assertThat(first.frequency(7)).isEqualTo(2);
        assertThat(first.frequency(3)).isZero();
        assertThat(first.max()).isEqualTo(7);
        assertThat(new FrequencyDistribution<Integer>().max()).isNull();
    }
}
