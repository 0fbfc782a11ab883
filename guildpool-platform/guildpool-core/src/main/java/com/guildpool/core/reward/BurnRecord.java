package com.guildpool.core.reward;

import com.guildpool.core.domain.ActivityKey;

import java.math.BigInteger;

/**
 * Unearned reward for a round. Until {@code burned} is set the amount is a projection.
 */
public record BurnRecord(ActivityKey activity, long round, BigInteger amount, boolean burned) {}
