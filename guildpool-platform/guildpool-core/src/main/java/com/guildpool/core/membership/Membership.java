package com.guildpool.core.membership;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;

import java.math.BigInteger;

/**
 * An account's stake in a group, as of the moment it was read.
 */
public record Membership(
        ActivityKey activity,
        long groupId,
        Address account,
        BigInteger amount,
        long joinedRound
) {}
