package com.guildpool.core.round;

/**
 * Source of the current round. The value only ever moves forwards.
 * Rounds below the current one are closed for writes; the current round is the only writable one.
 */
public interface RoundClock {

    long currentRound();
}
