package com.guildpool.core.round;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Round clock advanced explicitly by an operator or a test.
 */
public class ManualRoundClock implements RoundClock {

    private static final Logger log = LoggerFactory.getLogger(ManualRoundClock.class);

    private final AtomicLong round;

    public ManualRoundClock(long initialRound) {
        if (initialRound < 0) {
            throw new IllegalArgumentException("Initial round cannot be negative: " + initialRound);
        }
        this.round = new AtomicLong(initialRound);
    }

    @Override
    public long currentRound() {
        return round.get();
    }

    public long advance() {
        long next = round.incrementAndGet();
        log.info("Round advanced to {}", next);
        return next;
    }

    public long advanceTo(long target) {
        long updated = round.accumulateAndGet(target, (current, requested) -> {
            if (requested < current) {
                throw new IllegalArgumentException(
                        "Round cannot move backwards: " + current + " -> " + requested);
            }
            return requested;
        });
        log.info("Round advanced to {}", updated);
        return updated;
    }
}
