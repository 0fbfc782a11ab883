package com.guildpool.core.reward;

import com.guildpool.core.distrust.DistrustLedger;
import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.ErrorCode;
import com.guildpool.core.domain.GuildpoolException;
import com.guildpool.core.domain.Precision;
import com.guildpool.core.domain.RecipientShare;
import com.guildpool.core.external.RewardPool;
import com.guildpool.core.external.ServiceRoster;
import com.guildpool.core.round.RoundClock;
import com.guildpool.core.verification.GroupVerification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns verified, distrust-adjusted contribution into per-owner rewards, pays claims and burns
 * whatever no eligible owner earned.
 *
 * <p>For a round, each verified group generates {@code verifiedAmount * reduction / ONE}. An owner's reward is
 * the pool's service reward pro rata to what its groups generated, or zero if the owner was not enrolled in the
 * reward service for that round. Eligibility failures always resolve to zero, never to an error.
 */
public class RewardDistributor {

    private static final Logger log = LoggerFactory.getLogger(RewardDistributor.class);

    private final RoundClock roundClock;
    private final GroupVerification verification;
    private final DistrustLedger distrustLedger;
    private final RecipientRegistry recipientRegistry;
    private final ServiceRoster roster;
    private final RewardPool rewardPool;

    private final Map<RecordKey, RewardRecord> claims = new HashMap<>();
    private final Map<RoundKey, BurnRecord> burns = new HashMap<>();

    public RewardDistributor(RoundClock roundClock,
                             GroupVerification verification,
                             DistrustLedger distrustLedger,
                             RecipientRegistry recipientRegistry,
                             ServiceRoster roster,
                             RewardPool rewardPool) {
        this.roundClock = Objects.requireNonNull(roundClock, "Round clock cannot be null");
        this.verification = Objects.requireNonNull(verification, "Group verification cannot be null");
        this.distrustLedger = Objects.requireNonNull(distrustLedger, "Distrust ledger cannot be null");
        this.recipientRegistry = Objects.requireNonNull(recipientRegistry, "Recipient registry cannot be null");
        this.roster = Objects.requireNonNull(roster, "Service roster cannot be null");
        this.rewardPool = Objects.requireNonNull(rewardPool, "Reward pool cannot be null");
    }

    // ==================== Generated reward ====================

    public BigInteger generatedByGroup(ActivityKey activity, long round, long groupId) {
        BigInteger verified = verification.verifiedAmount(activity, groupId, round);
        if (verified.signum() == 0) {
            return BigInteger.ZERO;
        }
        return Precision.mulDiv(verified, distrustLedger.distrustReduction(activity, groupId, round), Precision.ONE);
    }

    public BigInteger generatedByVerifier(ActivityKey activity, long round, Address owner) {
        BigInteger total = BigInteger.ZERO;
        for (Long groupId : verification.groupIdsByVerifier(activity, round, owner)) {
            total = total.add(generatedByGroup(activity, round, groupId));
        }
        return total;
    }

    public BigInteger totalGeneratedReward(ActivityKey activity, long round) {
        BigInteger total = BigInteger.ZERO;
        for (Long groupId : verification.verifiedGroupIds(activity, round)) {
            total = total.add(generatedByGroup(activity, round, groupId));
        }
        return total;
    }

    public BigInteger totalServiceReward(ActivityKey activity, long round) {
        return rewardPool.totalServiceReward(activity, round);
    }

    public boolean isEligible(ActivityKey activity, long round, Address account) {
        return roster.isAccountOnRosterAtRound(activity, account, round)
                && !roster.hasExitedByRound(activity, account, round);
    }

    /**
     * The owner's share of the round's service reward, before recipient splits.
     */
    public BigInteger rewardByVerifier(ActivityKey activity, long round, Address owner) {
        if (!isEligible(activity, round, owner)) {
            return BigInteger.ZERO;
        }
        return Precision.mulDiv(totalServiceReward(activity, round),
                generatedByVerifier(activity, round, owner),
                totalGeneratedReward(activity, round));
    }

    // ==================== Per-group distribution ====================

    /**
     * Splits the owner's reward across its verified groups in proportion to what each generated.
     * Division dust goes to the last group that generated anything, so the parts add up to the whole.
     */
    public Map<Long, BigInteger> rewardByGroup(ActivityKey activity, long round, Address owner) {
        List<Long> groupIds = verification.groupIdsByVerifier(activity, round, owner);
        Map<Long, BigInteger> result = new LinkedHashMap<>();
        BigInteger ownerReward = rewardByVerifier(activity, round, owner);
        BigInteger ownerGenerated = generatedByVerifier(activity, round, owner);
        BigInteger allocated = BigInteger.ZERO;
        Long lastGenerating = null;
        for (Long groupId : groupIds) {
            BigInteger generated = generatedByGroup(activity, round, groupId);
            BigInteger groupReward = Precision.mulDiv(ownerReward, generated, ownerGenerated);
            result.put(groupId, groupReward);
            allocated = allocated.add(groupReward);
            if (generated.signum() > 0) {
                lastGenerating = groupId;
            }
        }
        BigInteger dust = ownerReward.subtract(allocated);
        if (dust.signum() > 0 && lastGenerating != null) {
            result.merge(lastGenerating, dust, BigInteger::add);
        }
        return result;
    }

    public RewardDistribution rewardDistribution(ActivityKey activity, long round, Address owner, long groupId) {
        BigInteger groupReward = rewardByGroup(activity, round, owner).getOrDefault(groupId, BigInteger.ZERO);
        List<RecipientShare> shares = recipientRegistry.recipients(owner, activity, groupId, round);
        List<RewardDistribution.RecipientAmount> amounts = new ArrayList<>(shares.size());
        BigInteger distributed = BigInteger.ZERO;
        for (RecipientShare share : shares) {
            BigInteger amount = Precision.mulDiv(groupReward, share.basisPoints(), Precision.ONE);
            amounts.add(new RewardDistribution.RecipientAmount(share.recipient(), share.basisPoints(), amount));
            distributed = distributed.add(amount);
        }
        return new RewardDistribution(round, owner, groupId, groupReward, amounts, groupReward.subtract(distributed));
    }

    /**
     * What {@code recipient} receives from the owner's group in that round. Asking for the owner returns its residual.
     */
    public BigInteger rewardByRecipient(ActivityKey activity, long round, Address owner, long groupId,
                                        Address recipient) {
        RewardDistribution distribution = rewardDistribution(activity, round, owner, groupId);
        if (recipient.equals(owner)) {
            return distribution.ownerAmount();
        }
        return distribution.recipients().stream()
                .filter(r -> r.recipient().equals(recipient))
                .map(RewardDistribution.RecipientAmount::amount)
                .findFirst()
                .orElse(BigInteger.ZERO);
    }

    // ==================== Claims ====================

    /**
     * The account's verifier reward for the round. A claimed record is returned as stored; otherwise the
     * amount is computed from the current state.
     */
    public synchronized RewardRecord rewardByAccount(ActivityKey activity, long round, Address account) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Objects.requireNonNull(account, "Account cannot be null");
        RewardRecord claimed = claims.get(new RecordKey(activity, round, account));
        if (claimed != null) {
            return claimed;
        }
        return new RewardRecord(activity, round, account, rewardByVerifier(activity, round, account), false);
    }

    /**
     * Pays out the caller's reward for a finished round: each recipient its share, the caller the rest.
     */
    public synchronized RewardRecord claimReward(ActivityKey activity, long round, Address caller) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Objects.requireNonNull(caller, "Caller cannot be null");
        requireFinished(round);
        RewardRecord record = rewardByAccount(activity, round, caller);
        if (record.claimed()) {
            throw GuildpoolException.of(ErrorCode.ALREADY_CLAIMED,
                    caller + " already claimed round " + round + " of " + activity);
        }

        List<RewardPool.Payout> payouts = new ArrayList<>();
        BigInteger ownerTotal = BigInteger.ZERO;
        for (Long groupId : rewardByGroup(activity, round, caller).keySet()) {
            RewardDistribution distribution = rewardDistribution(activity, round, caller, groupId);
            for (RewardDistribution.RecipientAmount recipient : distribution.recipients()) {
                if (recipient.amount().signum() > 0) {
                    payouts.add(new RewardPool.Payout(recipient.recipient(), recipient.amount()));
                }
            }
            ownerTotal = ownerTotal.add(distribution.ownerAmount());
        }
        if (ownerTotal.signum() > 0) {
            payouts.add(new RewardPool.Payout(caller, ownerTotal));
        }
        if (!payouts.isEmpty()) {
            rewardPool.payout(activity, round, payouts);
        }

        RewardRecord claimed = record.markClaimed();
        claims.put(new RecordKey(activity, round, caller), claimed);
        log.info("{} claimed {} for {} round {} ({} transfers)",
                caller, claimed.amount(), activity, round, payouts.size());
        return claimed;
    }

    // ==================== Burn ====================

    /**
     * Service reward for the round that no eligible owner earned. Owners who already claimed count with the
     * amount they were paid, so reward minted after a claim is burned rather than stranded.
     */
    public synchronized BigInteger unearnedReward(ActivityKey activity, long round) {
        BigInteger earned = BigInteger.ZERO;
        for (Address verifier : verification.verifiersAtRound(activity, round)) {
            earned = earned.add(rewardByAccount(activity, round, verifier).amount());
        }
        return totalServiceReward(activity, round).subtract(earned);
    }

    public synchronized BurnRecord burnInfo(ActivityKey activity, long round) {
        BurnRecord burned = burns.get(new RoundKey(activity, round));
        if (burned != null) {
            return burned;
        }
        return new BurnRecord(activity, round, unearnedReward(activity, round), false);
    }

    /**
     * Burns the round's unearned reward once. Later calls for the same round return the stored record.
     */
    public synchronized BurnRecord burnRewardIfNeeded(ActivityKey activity, long round) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        requireFinished(round);
        RoundKey key = new RoundKey(activity, round);
        BurnRecord existing = burns.get(key);
        if (existing != null) {
            log.debug("Round {} of {} already burned", round, activity);
            return existing;
        }
        BigInteger amount = unearnedReward(activity, round);
        if (amount.signum() <= 0) {
            return new BurnRecord(activity, round, BigInteger.ZERO, false);
        }
        rewardPool.burn(activity, round, amount);
        BurnRecord record = new BurnRecord(activity, round, amount, true);
        burns.put(key, record);
        log.info("Burned {} unearned reward for {} round {}", amount, activity, round);
        return record;
    }

    private void requireFinished(long round) {
        long current = roundClock.currentRound();
        if (round >= current) {
            throw GuildpoolException.of(ErrorCode.ROUND_NOT_FINISHED,
                    "Round " + round + " is not finished, current round is " + current);
        }
    }

    private record RecordKey(ActivityKey activity, long round, Address account) {}

    private record RoundKey(ActivityKey activity, long round) {}
}
