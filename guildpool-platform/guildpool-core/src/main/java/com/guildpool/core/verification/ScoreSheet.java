package com.guildpool.core.verification;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;

import java.math.BigInteger;
import java.util.Map;

/**
 * Scores submitted for one group in one round, with each member's stake and the group owner frozen
 * at submission time.
 */
public record ScoreSheet(
        ActivityKey activity,
        long groupId,
        long round,
        Address verifier,
        Address submittedBy,
        Map<Address, ScoredMember> scores
) {

    public ScoreSheet {
        scores = Map.copyOf(scores);
    }

    /**
     * Sum of each scored member's stake weighted by its score.
     */
    public BigInteger verifiedAmount() {
        BigInteger weighted = BigInteger.ZERO;
        for (ScoredMember member : scores.values()) {
            weighted = weighted.add(member.stake().multiply(BigInteger.valueOf(member.score())));
        }
        return weighted.divide(BigInteger.valueOf(GroupVerification.MAX_ORIGIN_SCORE));
    }

    public record ScoredMember(int score, BigInteger stake) {}
}
