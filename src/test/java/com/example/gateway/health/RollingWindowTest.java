package com.example.gateway.health;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RollingWindowTest {

    private static final long T0 = 1_781_344_800_000L;

    @Test
    void shouldCountSamplesInsideWindow() {
        RollingWindow window = new RollingWindow(10);
        window.record(T0, true);
        window.record(T0 + 1_500, false);
        window.record(T0 + 9_999, false);

        assertThat(window.total(T0 + 9_999)).isEqualTo(3);
        assertThat(window.failures(T0 + 9_999)).isEqualTo(2);
        assertThat(window.failureRatio(T0 + 9_999)).isEqualTo(2.0 / 3.0);
    }

    @Test
    void shouldForgetSamplesOlderThanWindow() {
        RollingWindow window = new RollingWindow(10);
        window.record(T0, false);
        window.record(T0 + 5_000, true);

        assertThat(window.total(T0 + 10_000)).isEqualTo(1);
        assertThat(window.failureRatio(T0 + 10_000)).isZero();
    }

    @Test
    void shouldReuseSlotWhenSecondWrapsAround() {
        RollingWindow window = new RollingWindow(2);
        window.record(T0, false);
        window.record(T0 + 2_000, true);

        assertThat(window.successes(T0 + 2_000)).isEqualTo(1);
        assertThat(window.failures(T0 + 2_000)).isZero();
    }

    @Test
    void shouldReportZeroRatioWhenEmptyOrReset() {
        RollingWindow window = new RollingWindow(5);
        assertThat(window.failureRatio(T0)).isZero();

        window.record(T0, false);
        window.reset();

        assertThat(window.total(T0)).isZero();
    }

    @Test
    void shouldRequireAtLeastOneSecond() {
        assertThatThrownBy(() -> new RollingWindow(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
