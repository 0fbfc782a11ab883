package com.guildpool.core.external;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;

import java.math.BigInteger;
import java.util.List;

/**
 * Group ownership and activation state, owned outside the reward core.
 */
public interface GroupLifecycle {

    boolean isGroupActive(ActivityKey activity, long groupId);

    /**
     * @throws com.guildpool.core.domain.GuildpoolException with {@code GROUP_NOT_FOUND} for an unknown group
     */
    Address ownerOf(long groupId);

    BigInteger minJoinAmount(ActivityKey activity, long groupId);

    /** Zero means unbounded. */
    BigInteger maxJoinAmount(ActivityKey activity, long groupId);

    /** Zero means unbounded. */
    int maxAccounts(ActivityKey activity, long groupId);

    List<Long> activeGroupIdsOwnedBy(ActivityKey activity, Address owner);
}
