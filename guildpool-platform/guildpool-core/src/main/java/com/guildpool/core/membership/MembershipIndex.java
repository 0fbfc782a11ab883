package com.guildpool.core.membership;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.ErrorCode;
import com.guildpool.core.domain.GuildpoolException;
import com.guildpool.core.domain.Precision;
import com.guildpool.core.external.GroupLifecycle;
import com.guildpool.core.round.RoundClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reverse lookups between accounts, groups, activities and assets, kept consistent across joins and exits.
 *
 * <p>Every index is reference counted: an account stays listed under an asset while it is still a member
 * in some activity of that asset, and a group stays listed under an activity while it still has members.
 * Counts are index cardinalities and totals are derived from member stakes; there are no side counters.
 */
public class MembershipIndex {

    private static final Logger log = LoggerFactory.getLogger(MembershipIndex.class);

    private final GroupLifecycle lifecycle;
    private final RoundClock roundClock;

    private final Map<MemberKey, Membership> members = new HashMap<>();
    private final Map<AccountKey, Long> groupByAccount = new HashMap<>();

    private final ReferenceCountedIndex<GroupKey, Address> accountsByGroup = new ReferenceCountedIndex<>();
    private final ReferenceCountedIndex<ActivityKey, Long> groupsByActivity = new ReferenceCountedIndex<>();
    private final ReferenceCountedIndex<ActivityKey, Address> accountsByActivity = new ReferenceCountedIndex<>();
    private final ReferenceCountedIndex<Address, ActivityKey> activitiesByAccount = new ReferenceCountedIndex<>();
    private final ReferenceCountedIndex<Address, Address> accountsByAsset = new ReferenceCountedIndex<>();
    private final ReferenceCountedIndex<Address, Address> assetsByAccount = new ReferenceCountedIndex<>();
    private final ReferenceCountedIndex<Address, Long> activityIdsByAsset = new ReferenceCountedIndex<>();

    public MembershipIndex(GroupLifecycle lifecycle, RoundClock roundClock) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "Group lifecycle cannot be null");
        this.roundClock = Objects.requireNonNull(roundClock, "Round clock cannot be null");
    }

    /**
     * Joins a group or tops up an existing stake in it.
     */
    public synchronized Membership join(ActivityKey activity, long groupId, Address account, BigInteger amount) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Objects.requireNonNull(account, "Account cannot be null");
        Precision.requireNonNegative(amount, "Join amount");
        if (amount.signum() == 0) {
            throw GuildpoolException.of(ErrorCode.ZERO_JOIN_AMOUNT, "Join amount must be positive");
        }
        if (account.isZero()) {
            throw GuildpoolException.of(ErrorCode.ZERO_ADDRESS, "Cannot join as the zero address");
        }
        if (!lifecycle.isGroupActive(activity, groupId)) {
            throw GuildpoolException.of(ErrorCode.GROUP_NOT_ACTIVE,
                    "Group " + groupId + " is not active in " + activity);
        }

        Long currentGroup = groupByAccount.get(new AccountKey(activity, account));
        if (currentGroup != null && currentGroup != groupId) {
            throw GuildpoolException.of(ErrorCode.ALREADY_IN_OTHER_GROUP,
                    account + " already belongs to group " + currentGroup + " in " + activity);
        }

        MemberKey key = new MemberKey(activity, groupId, account);
        Membership existing = members.get(key);
        BigInteger newAmount = existing == null ? amount : existing.amount().add(amount);

        BigInteger min = lifecycle.minJoinAmount(activity, groupId);
        if (newAmount.compareTo(min) < 0) {
            throw GuildpoolException.of(ErrorCode.JOIN_AMOUNT_BELOW_MINIMUM,
                    "Stake " + newAmount + " is below the minimum " + min);
        }
        BigInteger max = lifecycle.maxJoinAmount(activity, groupId);
        if (max.signum() > 0 && newAmount.compareTo(max) > 0) {
            throw GuildpoolException.of(ErrorCode.JOIN_AMOUNT_EXCEEDS_MAXIMUM,
                    "Stake " + newAmount + " exceeds the maximum " + max);
        }
        GroupKey groupKey = new GroupKey(activity, groupId);
        int capacity = lifecycle.maxAccounts(activity, groupId);
        if (existing == null && capacity > 0 && accountsByGroup.count(groupKey) >= capacity) {
            throw GuildpoolException.of(ErrorCode.GROUP_CAPACITY_REACHED,
                    "Group " + groupId + " already has " + capacity + " members");
        }

        Membership membership = new Membership(activity, groupId, account, newAmount,
                existing == null ? roundClock.currentRound() : existing.joinedRound());
        members.put(key, membership);
        if (existing == null) {
            groupByAccount.put(new AccountKey(activity, account), groupId);
            accountsByGroup.acquire(groupKey, account);
            groupsByActivity.acquire(activity, groupId);
            accountsByActivity.acquire(activity, account);
            activitiesByAccount.acquire(account, activity);
            accountsByAsset.acquire(activity.asset(), account);
            assetsByAccount.acquire(account, activity.asset());
            activityIdsByAsset.acquire(activity.asset(), activity.activityId());
            log.info("{} joined group {} in {} with {}", account, groupId, activity, amount);
        } else {
            log.info("{} added {} to group {} in {}, stake now {}", account, amount, groupId, activity, newAmount);
        }
        return membership;
    }

    /**
     * Leaves a group, releasing every index reference the membership held.
     *
     * @return the stake released by the exit
     */
    public synchronized BigInteger exit(ActivityKey activity, long groupId, Address account) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Objects.requireNonNull(account, "Account cannot be null");
        Membership removed = members.remove(new MemberKey(activity, groupId, account));
        if (removed == null) {
            throw GuildpoolException.of(ErrorCode.NOT_GROUP_MEMBER,
                    account + " is not a member of group " + groupId + " in " + activity);
        }
        groupByAccount.remove(new AccountKey(activity, account));
        accountsByGroup.release(new GroupKey(activity, groupId), account);
        groupsByActivity.release(activity, groupId);
        accountsByActivity.release(activity, account);
        activitiesByAccount.release(account, activity);
        accountsByAsset.release(activity.asset(), account);
        assetsByAccount.release(account, activity.asset());
        activityIdsByAsset.release(activity.asset(), activity.activityId());
        log.info("{} exited group {} in {}, released {}", account, groupId, activity, removed.amount());
        return removed.amount();
    }

    // ==================== Member lookups ====================

    public synchronized Optional<Membership> membership(ActivityKey activity, long groupId, Address account) {
        return Optional.ofNullable(members.get(new MemberKey(activity, groupId, account)));
    }

    public synchronized BigInteger joinedAmount(ActivityKey activity, long groupId, Address account) {
        Membership membership = members.get(new MemberKey(activity, groupId, account));
        return membership == null ? BigInteger.ZERO : membership.amount();
    }

    public synchronized boolean isMember(ActivityKey activity, long groupId, Address account) {
        return accountsByGroup.contains(new GroupKey(activity, groupId), account);
    }

    public synchronized Optional<Long> groupIdOf(ActivityKey activity, Address account) {
        return Optional.ofNullable(groupByAccount.get(new AccountKey(activity, account)));
    }

    // ==================== Group level ====================

    public synchronized List<Address> accountsByGroup(ActivityKey activity, long groupId) {
        return accountsByGroup.values(new GroupKey(activity, groupId));
    }

    public synchronized int accountCountByGroup(ActivityKey activity, long groupId) {
        return accountsByGroup.count(new GroupKey(activity, groupId));
    }

    public synchronized BigInteger totalJoinedAmount(ActivityKey activity, long groupId) {
        BigInteger total = BigInteger.ZERO;
        for (Address account : accountsByGroup.values(new GroupKey(activity, groupId))) {
            total = total.add(members.get(new MemberKey(activity, groupId, account)).amount());
        }
        return total;
    }

    /**
     * Total stake across every populated group in the activity owned by {@code owner}.
     */
    public synchronized BigInteger totalJoinedAmountByOwner(ActivityKey activity, Address owner) {
        BigInteger total = BigInteger.ZERO;
        for (Long groupId : groupsByActivity.values(activity)) {
            if (owner.equals(lifecycle.ownerOf(groupId))) {
                total = total.add(totalJoinedAmount(activity, groupId));
            }
        }
        return total;
    }

    // ==================== Activity level ====================

    public synchronized List<Long> groupIdsByActivity(ActivityKey activity) {
        return groupsByActivity.values(activity);
    }

    public synchronized int groupCountByActivity(ActivityKey activity) {
        return groupsByActivity.count(activity);
    }

    public synchronized List<Address> accountsByActivity(ActivityKey activity) {
        return accountsByActivity.values(activity);
    }

    public synchronized int accountCountByActivity(ActivityKey activity) {
        return accountsByActivity.count(activity);
    }

    public synchronized BigInteger totalJoinedAmountByActivity(ActivityKey activity) {
        BigInteger total = BigInteger.ZERO;
        for (Long groupId : groupsByActivity.values(activity)) {
            total = total.add(totalJoinedAmount(activity, groupId));
        }
        return total;
    }

    // ==================== Asset level ====================

    public synchronized List<Address> assets() {
        return activityIdsByAsset.keys().stream().sorted().toList();
    }

    public synchronized List<Long> activityIdsByAsset(Address asset) {
        return activityIdsByAsset.values(asset);
    }

    public synchronized List<Address> accountsByAsset(Address asset) {
        return accountsByAsset.values(asset);
    }

    public synchronized int accountCountByAsset(Address asset) {
        return accountsByAsset.count(asset);
    }

    // ==================== Account level ====================

    public synchronized List<ActivityKey> activitiesByAccount(Address account) {
        return activitiesByAccount.values(account);
    }

    public synchronized List<Address> assetsByAccount(Address account) {
        return assetsByAccount.values(account);
    }

    public synchronized List<Long> activityIdsByAccountByAsset(Address account, Address asset) {
        List<Long> ids = new ArrayList<>();
        for (ActivityKey activity : activitiesByAccount.values(account)) {
            if (activity.asset().equals(asset)) {
                ids.add(activity.activityId());
            }
        }
        return ids;
    }

    /**
     * Every membership the account holds, across all activities.
     */
    public synchronized List<Membership> membershipsOf(Address account) {
        List<Membership> result = new ArrayList<>();
        for (ActivityKey activity : activitiesByAccount.values(account)) {
            Long groupId = groupByAccount.get(new AccountKey(activity, account));
            result.add(members.get(new MemberKey(activity, groupId, account)));
        }
        result.sort(Comparator.comparing((Membership m) -> m.activity().toString())
                .thenComparingLong(Membership::groupId));
        return result;
    }

    private record MemberKey(ActivityKey activity, long groupId, Address account) {}

    private record AccountKey(ActivityKey activity, Address account) {}

    private record GroupKey(ActivityKey activity, long groupId) {}
}
