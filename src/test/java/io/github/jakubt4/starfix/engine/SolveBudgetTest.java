package io.github.jakubt4.starfix.engine;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SolveBudgetTest {

    @Test
    void zeroBudgetIsExpiredImmediately() {
        final var budget = SolveBudget.startingNow(Duration.ZERO, new CancellationToken());

        assertThat(budget.isExpired()).isTrue();
        assertThat(budget.remaining()).isEqualTo(Duration.ZERO);
        assertThat(budget.shouldStop()).isTrue();
    }

    @Test
    void cancellingTheTokenStopsAnOpenBudget() {
        final var token = new CancellationToken();
        final var budget = SolveBudget.startingNow(Duration.ofMinutes(1), token);
        assertThat(budget.shouldStop()).isFalse();

        assertThat(token.cancel()).isTrue();
        assertThat(token.cancel()).isFalse();

        assertThat(budget.isCancelled()).isTrue();
        assertThat(budget.isExpired()).isFalse();
        assertThat(budget.shouldStop()).isTrue();
    }

    @Test
    void timeoutBeyondNanoRangeIsCapped() {
        final var budget = SolveBudget.startingNow(Duration.ofSeconds(10_000_000_000L), new CancellationToken());

        assertThat(budget.isExpired()).isFalse();
        assertThat(budget.shouldStop()).isFalse();
        assertThat(budget.remaining()).isLessThanOrEqualTo(SolveBudget.MAX_TIMEOUT);
        assertThat(budget.remaining()).isGreaterThan(Duration.ofDays(100 * 365));
    }

    @Test
    void cappedLeavesOrdinaryTimeoutsAlone() {
        assertThat(SolveBudget.capped(Duration.ofSeconds(5))).isEqualTo(Duration.ofSeconds(5));
        assertThat(SolveBudget.capped(Duration.ofSeconds(Long.MAX_VALUE))).isEqualTo(SolveBudget.MAX_TIMEOUT);
    }
}
