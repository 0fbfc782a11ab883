package com.guildpool.core.external;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;

/**
 * Snapshot of which owners had joined the reward service, queried as of a round.
 */
public interface ServiceRoster {

    boolean isAccountOnRosterAtRound(ActivityKey activity, Address account, long round);

    boolean hasExitedByRound(ActivityKey activity, Address account, long round);
}
