package com.guildpool.core.round;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoundHistoryTest {

    @Test
    void lookupReturnsLatestValueAtOrBeforeRound() {
        RoundHistory<String> history = new RoundHistory<>();
        history.record(2, "a");
        history.record(5, "b");

        assertThat(history.valueAt(1)).isEmpty();
        assertThat(history.valueAt(2)).contains("a");
        assertThat(history.valueAt(4)).contains("a");
        assertThat(history.valueAt(5)).contains("b");
        assertThat(history.valueAt(100)).contains("b");
        assertThat(history.latestRound()).contains(5L);
    }

    @Test
    void latestRoundCanBeOverwrittenButEarlierRoundsAreFrozen() {
        RoundHistory<String> history = new RoundHistory<>();
        history.record(3, "first");
        history.record(3, "second");

        assertThat(history.valueAt(3)).contains("second");
        assertThatThrownBy(() -> history.record(2, "late")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void manualClockNeverMovesBackwards() {
        ManualRoundClock clock = new ManualRoundClock(4);
        assertThat(clock.advance()).isEqualTo(5);
        assertThat(clock.advanceTo(9)).isEqualTo(9);
        assertThatThrownBy(() -> clock.advanceTo(8)).isInstanceOf(IllegalArgumentException.class);
        assertThat(clock.currentRound()).isEqualTo(9);
    }
}
