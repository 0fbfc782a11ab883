package com.guildpool.core.reward;

import com.guildpool.core.domain.Address;

import java.math.BigInteger;
import java.util.List;

/**
 * How one group's reward for a round splits between the owner and its recipients.
 * {@code ownerAmount} absorbs the truncation of every recipient amount.
 */
public record RewardDistribution(
        long round,
        Address owner,
        long groupId,
        BigInteger groupReward,
        List<RecipientAmount> recipients,
        BigInteger ownerAmount
) {

    public RewardDistribution {
        recipients = List.copyOf(recipients);
    }

    public record RecipientAmount(Address recipient, BigInteger basisPoints, BigInteger amount) {}
}
