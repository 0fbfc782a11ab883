package com.guildpool.core.distrust;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.ErrorCode;
import com.guildpool.core.domain.GuildpoolException;
import com.guildpool.core.domain.Precision;
import com.guildpool.core.external.GovernanceSource;
import com.guildpool.core.round.RoundClock;
import com.guildpool.core.verification.GroupVerification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Distrust votes against group owners and the reward reduction they produce.
 *
 * <p>Votes only accumulate within a round. A voter's total across all targets in a round is capped by the
 * verifier quota governance grants it for that round.
 */
public class DistrustLedger {

    private static final Logger log = LoggerFactory.getLogger(DistrustLedger.class);

    private final GovernanceSource governance;
    private final GroupVerification verification;
    private final RoundClock roundClock;

    private final Map<VoteKey, DistrustVote> votes = new HashMap<>();
    private final Map<TargetKey, Map<Address, BigInteger>> votesByTarget = new HashMap<>();
    private final Map<VoterKey, BigInteger> votesByVoter = new HashMap<>();

    public DistrustLedger(GovernanceSource governance, GroupVerification verification, RoundClock roundClock) {
        this.governance = Objects.requireNonNull(governance, "Governance source cannot be null");
        this.verification = Objects.requireNonNull(verification, "Group verification cannot be null");
        this.roundClock = Objects.requireNonNull(roundClock, "Round clock cannot be null");
    }

    public synchronized DistrustVote distrustVote(ActivityKey activity, Address voter, Address target,
                                                  BigInteger amount, String reason) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Objects.requireNonNull(voter, "Voter cannot be null");
        Objects.requireNonNull(target, "Target cannot be null");
        Precision.requireNonNegative(amount, "Distrust amount");
        if (amount.signum() == 0) {
            throw GuildpoolException.of(ErrorCode.DISTRUST_VOTE_ZERO_AMOUNT, "Distrust amount must be positive");
        }
        if (reason == null || reason.isEmpty()) {
            throw GuildpoolException.of(ErrorCode.INVALID_REASON, "A distrust vote needs a reason");
        }
        if (target.isZero() || target.equals(voter)) {
            throw GuildpoolException.of(ErrorCode.INVALID_TARGET, "Cannot cast distrust against " + target);
        }

        long round = roundClock.currentRound();
        BigInteger quota = governance.verifierQuota(activity, round, voter);
        if (quota.signum() == 0) {
            throw GuildpoolException.of(ErrorCode.VERIFY_VOTES_ZERO,
                    voter + " has no verifier quota in round " + round);
        }
        VoterKey voterKey = new VoterKey(activity, round, voter);
        BigInteger alreadyCast = votesByVoter.getOrDefault(voterKey, BigInteger.ZERO);
        BigInteger cumulative = alreadyCast.add(amount);
        if (cumulative.compareTo(quota) > 0) {
            throw GuildpoolException.of(ErrorCode.DISTRUST_VOTE_EXCEEDS_VERIFY_VOTES,
                    "Distrust " + alreadyCast + " + " + amount + " exceeds quota " + quota);
        }

        VoteKey voteKey = new VoteKey(activity, round, voter, target);
        DistrustVote previous = votes.get(voteKey);
        BigInteger pairTotal = previous == null ? amount : previous.amount().add(amount);
        DistrustVote vote = new DistrustVote(activity, round, voter, target, pairTotal, reason);
        votes.put(voteKey, vote);
        votesByVoter.put(voterKey, cumulative);
        votesByTarget.computeIfAbsent(new TargetKey(activity, round, target), k -> new LinkedHashMap<>())
                .merge(voter, amount, BigInteger::add);
        log.info("{} cast {} distrust against {} in {} round {}: {}", voter, amount, target, activity, round, reason);
        return vote;
    }

    // ==================== Queries ====================

    public synchronized BigInteger distrustVotesByTarget(ActivityKey activity, long round, Address target) {
        Map<Address, BigInteger> byVoter = votesByTarget.get(new TargetKey(activity, round, target));
        return byVoter == null ? BigInteger.ZERO : byVoter.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }

    public synchronized BigInteger distrustVotesByVoterByTarget(ActivityKey activity, long round,
                                                                Address voter, Address target) {
        DistrustVote vote = votes.get(new VoteKey(activity, round, voter, target));
        return vote == null ? BigInteger.ZERO : vote.amount();
    }

    public synchronized BigInteger distrustVotesByVoter(ActivityKey activity, long round, Address voter) {
        return votesByVoter.getOrDefault(new VoterKey(activity, round, voter), BigInteger.ZERO);
    }

    public synchronized Optional<String> distrustReason(ActivityKey activity, long round,
                                                        Address voter, Address target) {
        return Optional.ofNullable(votes.get(new VoteKey(activity, round, voter, target))).map(DistrustVote::reason);
    }

    public synchronized List<Address> distrustVotersByTarget(ActivityKey activity, long round, Address target) {
        Map<Address, BigInteger> byVoter = votesByTarget.get(new TargetKey(activity, round, target));
        return byVoter == null ? List.of() : List.copyOf(byVoter.keySet());
    }

    /**
     * Share of the round's governance votes cast as distrust against the group's verifier.
     * Zero when the group was not verified or nobody voted.
     */
    public synchronized BigInteger distrustRate(ActivityKey activity, long groupId, long round) {
        Optional<Address> verifier = verification.verifierOf(activity, groupId, round);
        if (verifier.isEmpty()) {
            return BigInteger.ZERO;
        }
        BigInteger total = governance.totalVotes(activity, round);
        if (total.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger distrust = distrustVotesByTarget(activity, round, verifier.get()).min(total);
        return Precision.mulDiv(distrust, Precision.ONE, total);
    }

    /**
     * Multiplier applied to the group's generated reward: {@code (total - distrust) / total}.
     * {@link Precision#ONE} when the group was not verified or nobody voted.
     *
     * <p>Computed as the complement of {@link #distrustRate} so that the two always sum to one unit.
     * The direct form {@code (total - distrust) * ONE / total} truncates the other way, so where the division
     * is inexact this value is one precision unit above it: total 3 and distrust 1 give
     * {@code 666666666666666667} here against {@code 666666666666666666}.
     */
    public synchronized BigInteger distrustReduction(ActivityKey activity, long groupId, long round) {
        if (!verification.isVerified(activity, groupId, round)
                || governance.totalVotes(activity, round).signum() == 0) {
            return Precision.ONE;
        }
        return Precision.ONE.subtract(distrustRate(activity, groupId, round));
    }

    private record VoteKey(ActivityKey activity, long round, Address voter, Address target) {}

    private record VoterKey(ActivityKey activity, long round, Address voter) {}

    private record TargetKey(ActivityKey activity, long round, Address target) {}
}
