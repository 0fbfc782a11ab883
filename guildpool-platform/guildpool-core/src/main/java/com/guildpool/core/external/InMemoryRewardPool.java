package com.guildpool.core.external;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.ErrorCode;
import com.guildpool.core.domain.GuildpoolException;
import com.guildpool.core.domain.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reward pool ledger. Minting credits both the round's service reward and the held balance;
 * payouts and burns debit the held balance.
 */
public class InMemoryRewardPool implements RewardPool {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRewardPool.class);

    private final Map<RoundKey, BigInteger> minted = new ConcurrentHashMap<>();
    private final Map<ActivityKey, BigInteger> held = new ConcurrentHashMap<>();
    private final Map<Address, BigInteger> paid = new ConcurrentHashMap<>();
    private final Map<ActivityKey, BigInteger> burned = new ConcurrentHashMap<>();

    public synchronized void mint(ActivityKey activity, long round, BigInteger amount) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Precision.requireNonNegative(amount, "Mint amount");
        minted.merge(new RoundKey(activity, round), amount, BigInteger::add);
        held.merge(activity, amount, BigInteger::add);
        log.info("Minted {} service reward for {} round {}", amount, activity, round);
    }

    @Override
    public BigInteger totalServiceReward(ActivityKey activity, long round) {
        return minted.getOrDefault(new RoundKey(activity, round), BigInteger.ZERO);
    }

    @Override
    public synchronized void payout(ActivityKey activity, long round, List<Payout> payouts) {
        Objects.requireNonNull(payouts, "Payouts cannot be null");
        BigInteger total = BigInteger.ZERO;
        for (Payout payout : payouts) {
            Objects.requireNonNull(payout.recipient(), "Recipient cannot be null");
            total = total.add(Precision.requireNonNegative(payout.amount(), "Payout amount"));
        }
        debit(activity, total);
        for (Payout payout : payouts) {
            paid.merge(payout.recipient(), payout.amount(), BigInteger::add);
            log.debug("Paid {} to {} for {} round {}", payout.amount(), payout.recipient(), activity, round);
        }
    }

    @Override
    public synchronized void burn(ActivityKey activity, long round, BigInteger amount) {
        debit(activity, amount);
        burned.merge(activity, amount, BigInteger::add);
        log.info("Burned {} from {} pool for round {}", amount, activity, round);
    }

    public BigInteger heldBalance(ActivityKey activity) {
        return held.getOrDefault(activity, BigInteger.ZERO);
    }

    public BigInteger balanceOf(Address account) {
        return paid.getOrDefault(account, BigInteger.ZERO);
    }

    public BigInteger totalBurned(ActivityKey activity) {
        return burned.getOrDefault(activity, BigInteger.ZERO);
    }

    private void debit(ActivityKey activity, BigInteger amount) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Precision.requireNonNegative(amount, "Amount");
        BigInteger balance = heldBalance(activity);
        if (balance.compareTo(amount) < 0) {
            throw GuildpoolException.of(ErrorCode.INSUFFICIENT_POOL_BALANCE,
                    "Insufficient pool balance: " + balance + " < " + amount);
        }
        held.put(activity, balance.subtract(amount));
    }

    private record RoundKey(ActivityKey activity, long round) {}
}
