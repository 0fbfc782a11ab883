package com.guildpool.core.external;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;

import java.math.BigInteger;
import java.util.List;

/**
 * Holder of minted service reward. Pays claims out and destroys what nobody earned.
 */
public interface RewardPool {

    /** Reward minted for the round, zero if nothing has been minted yet. */
    BigInteger totalServiceReward(ActivityKey activity, long round);

    /**
     * Pays every transfer or none of them.
     */
    void payout(ActivityKey activity, long round, List<Payout> payouts);

    void burn(ActivityKey activity, long round, BigInteger amount);

    record Payout(Address recipient, BigInteger amount) {}
}
