package org.stackgraphs.cancellation;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CancellationFlagTest {

    @Test
    void noCancellationNeverFires() {
        assertThat(NoCancellation.INSTANCE.isCancelled()).isFalse();
        assertThatCode(() -> NoCancellation.INSTANCE.check("anywhere")).doesNotThrowAnyException();
    }

    @Test
    void check_throwsWithLocation() {
        CancellationFlag cancelled = () -> true;

        assertThatThrownBy(() -> cancelled.check("stitching phase 3"))
            .isInstanceOf(CancelledException.class)
            .hasMessage("Cancelled at stitching phase 3")
            .satisfies(e -> assertThat(((CancelledException) e).getLocation()).isEqualTo("stitching phase 3"));
    }

    @Test
    void cancelAfterDuration_firesOnceTheLimitHasPassed() {
        assertThat(new CancelAfterDuration(Duration.ZERO).isCancelled()).isTrue();
        assertThat(new CancelAfterDuration(Duration.ofHours(1)).isCancelled()).isFalse();
    }
}
