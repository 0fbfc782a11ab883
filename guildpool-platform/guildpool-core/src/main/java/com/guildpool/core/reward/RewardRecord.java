package com.guildpool.core.reward;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;

import java.math.BigInteger;

/**
 * Reward an account earned as a verifier in a round, and whether it has been claimed.
 */
public record RewardRecord(ActivityKey activity, long round, Address account, BigInteger amount, boolean claimed) {

    RewardRecord markClaimed() {
        return new RewardRecord(activity, round, account, amount, true);
    }
}
