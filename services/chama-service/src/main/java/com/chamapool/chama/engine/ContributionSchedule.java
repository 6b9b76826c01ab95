package com.chamapool.chama.engine;

import java.time.Duration;
import java.time.Instant;

/**
 * Period arithmetic for one group. Period 0 starts at the group start date; every period
 * accepts contributions from its start until start + window + grace inclusive.
 */
final class ContributionSchedule {

    private final Instant startDate;
    private final Duration periodDuration;
    private final Duration window;
    private final Duration grace;

    ContributionSchedule(Instant startDate, Duration periodDuration, Duration window, Duration grace) {
        if (periodDuration.isZero() || periodDuration.isNegative()) {
            throw new IllegalArgumentException("Period duration must be positive");
        }
        this.startDate = startDate;
        this.periodDuration = periodDuration;
        this.window = window;
        this.grace = grace;
    }

    long periodAt(Instant now) {
        if (now.isBefore(startDate)) {
            return 0;
        }
        return Duration.between(startDate, now).toMillis() / periodDuration.toMillis();
    }

    Instant periodStart(long period) {
        return startDate.plus(periodDuration.multipliedBy(period));
    }

    Instant deadline(long period) {
        return periodStart(period).plus(window).plus(grace);
    }

    boolean isWindowOpen(Instant now) {
        long period = periodAt(now);
        return !now.isBefore(periodStart(period)) && !now.isAfter(deadline(period));
    }

    boolean isDeadlinePassed(long period, Instant now) {
        return now.isAfter(deadline(period));
    }
}
