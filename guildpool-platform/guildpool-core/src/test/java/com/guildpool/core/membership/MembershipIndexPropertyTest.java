package com.guildpool.core.membership;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.ErrorCode;
import com.guildpool.core.domain.GuildpoolException;
import com.guildpool.core.external.InMemoryGroupRegistry;
import com.guildpool.core.round.ManualRoundClock;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.*;
import java.util.stream.Collectors;

import static com.guildpool.core.CoreFixture.account;
import static com.guildpool.core.CoreFixture.amount;
import static com.guildpool.core.CoreFixture.assertRejected;
import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the membership index.
 *
 * After any sequence of joins and exits an account appears in an index exactly when it still holds a
 * membership that populates it.
 */
class MembershipIndexPropertyTest {

    private static final Address ASSET_A = Address.of("0x00000000000000000000000000000000000000a1");
    private static final Address ASSET_B = Address.of("0x00000000000000000000000000000000000000b2");
    private static final List<ActivityKey> ACTIVITIES = List.of(
            new ActivityKey(ASSET_A, 1), new ActivityKey(ASSET_A, 2),
            new ActivityKey(ASSET_B, 1), new ActivityKey(ASSET_B, 7));
    private static final Address OWNER = account(900);

    // ==================== Index consistency ====================

    @Property(tries = 200)
    void indicesMatchRemainingMemberships(@ForAll("operations") List<Operation> operations) {
        ManualRoundClock clock = new ManualRoundClock(1);
        InMemoryGroupRegistry registry = new InMemoryGroupRegistry(clock);
        for (long groupId = 1; groupId <= 3; groupId++) {
            registry.registerGroup(groupId, OWNER);
            for (ActivityKey activity : ACTIVITIES) {
                registry.activate(activity, groupId, OWNER, BigInteger.ZERO, BigInteger.ZERO, 0);
            }
        }
        MembershipIndex index = new MembershipIndex(registry, clock);
        Map<ActivityKey, Map<Address, Long>> model = new HashMap<>();

        for (Operation op : operations) {
            ActivityKey activity = ACTIVITIES.get(op.activity());
            Address account = account(op.account());
            Map<Address, Long> inActivity = model.computeIfAbsent(activity, k -> new HashMap<>());
            Long current = inActivity.get(account);

            if (op.join()) {
                if (current != null && current != op.groupId()) {
                    assertRejected(() -> index.join(activity, op.groupId(), account, amount(op.amount())),
                            ErrorCode.ALREADY_IN_OTHER_GROUP);
                } else {
                    index.join(activity, op.groupId(), account, amount(op.amount()));
                    inActivity.put(account, op.groupId());
                }
            } else {
                if (current != null && current == op.groupId()) {
                    index.exit(activity, op.groupId(), account);
                    inActivity.remove(account);
                } else {
                    assertRejected(() -> index.exit(activity, op.groupId(), account), ErrorCode.NOT_GROUP_MEMBER);
                }
            }
            assertConsistent(index, model);
        }
    }

    private void assertConsistent(MembershipIndex index, Map<ActivityKey, Map<Address, Long>> model) {
        Set<Address> expectedAssets = new HashSet<>();
        for (ActivityKey activity : ACTIVITIES) {
            Map<Address, Long> members = model.getOrDefault(activity, Map.of());
            assertThat(index.accountsByActivity(activity)).containsExactlyInAnyOrderElementsOf(members.keySet());
            assertThat(index.groupIdsByActivity(activity))
                    .containsExactlyInAnyOrderElementsOf(new HashSet<>(members.values()));
            for (long groupId = 1; groupId <= 3; groupId++) {
                long g = groupId;
                Set<Address> inGroup = members.entrySet().stream()
                        .filter(e -> e.getValue() == g)
                        .map(Map.Entry::getKey)
                        .collect(Collectors.toSet());
                assertThat(index.accountsByGroup(activity, groupId)).containsExactlyInAnyOrderElementsOf(inGroup);
                assertThat(index.accountCountByGroup(activity, groupId)).isEqualTo(inGroup.size());
            }
            if (!members.isEmpty()) {
                expectedAssets.add(activity.asset());
            }
        }
        assertThat(index.assets()).containsExactlyInAnyOrderElementsOf(expectedAssets);

        for (Address asset : List.of(ASSET_A, ASSET_B)) {
            Set<Address> accounts = new HashSet<>();
            Set<Long> activityIds = new HashSet<>();
            for (ActivityKey activity : ACTIVITIES) {
                if (activity.asset().equals(asset) && !model.getOrDefault(activity, Map.of()).isEmpty()) {
                    accounts.addAll(model.get(activity).keySet());
                    activityIds.add(activity.activityId());
                }
            }
            assertThat(index.accountsByAsset(asset)).containsExactlyInAnyOrderElementsOf(accounts);
            assertThat(index.activityIdsByAsset(asset)).containsExactlyInAnyOrderElementsOf(activityIds);
        }

        for (int n = 1; n <= 4; n++) {
            Address account = account(n);
            Set<ActivityKey> activities = ACTIVITIES.stream()
                    .filter(a -> model.getOrDefault(a, Map.of()).containsKey(account))
                    .collect(Collectors.toSet());
            assertThat(index.activitiesByAccount(account)).containsExactlyInAnyOrderElementsOf(activities);
            assertThat(index.assetsByAccount(account)).containsExactlyInAnyOrderElementsOf(
                    activities.stream().map(ActivityKey::asset).collect(Collectors.toSet()));
            assertThat(index.membershipsOf(account)).hasSize(activities.size());
        }
    }

    @Provide
    Arbitrary<List<Operation>> operations() {
        Arbitrary<Operation> operation = Combinators.combine(
                Arbitraries.of(true, true, false),
                Arbitraries.integers().between(0, ACTIVITIES.size() - 1),
                Arbitraries.longs().between(1, 3),
                Arbitraries.integers().between(1, 4),
                Arbitraries.longs().between(1, 1_000)
        ).as(Operation::new);
        return operation.list().ofMinSize(1).ofMaxSize(40);
    }

    record Operation(boolean join, int activity, long groupId, int account, long amount) {}

    // ==================== Join and exit rules ====================

    @Property(tries = 50)
    void totalsAreDerivedFromStakes(@ForAll("stakes") List<Long> stakes) {
        ManualRoundClock clock = new ManualRoundClock(1);
        InMemoryGroupRegistry registry = new InMemoryGroupRegistry(clock);
        ActivityKey activity = ACTIVITIES.get(0);
        registry.registerGroup(1, OWNER);
        registry.activate(activity, 1, OWNER, BigInteger.ZERO, BigInteger.ZERO, 0);
        MembershipIndex index = new MembershipIndex(registry, clock);

        long expected = 0;
        for (int i = 0; i < stakes.size(); i++) {
            index.join(activity, 1, account(i + 1), amount(stakes.get(i)));
            expected += stakes.get(i);
        }

        assertThat(index.totalJoinedAmount(activity, 1)).isEqualTo(amount(expected));
        assertThat(index.totalJoinedAmountByOwner(activity, OWNER)).isEqualTo(amount(expected));
        assertThat(index.totalJoinedAmountByActivity(activity)).isEqualTo(amount(expected));
        assertThat(index.accountCountByActivity(activity)).isEqualTo(stakes.size());
    }

    @Provide
    Arbitrary<List<Long>> stakes() {
        return Arbitraries.longs().between(1, 1_000_000).list().ofMinSize(1).ofMaxSize(20);
    }

    @Test
    void joiningTheSameGroupAgainTopsUpTheStake() {
        MembershipIndex index = indexWithGroup(BigInteger.ZERO, BigInteger.ZERO, 0);
        ActivityKey activity = ACTIVITIES.get(0);

        index.join(activity, 1, account(1), amount(10));
        Membership membership = index.join(activity, 1, account(1), amount(5));

        assertThat(membership.amount()).isEqualTo(amount(15));
        assertThat(index.accountCountByGroup(activity, 1)).isEqualTo(1);
        assertThat(index.exit(activity, 1, account(1))).isEqualTo(amount(15));
        assertThat(index.isMember(activity, 1, account(1))).isFalse();
        assertThat(index.groupIdOf(activity, account(1))).isEmpty();
    }

    @Test
    void joinAmountMustRespectBounds() {
        MembershipIndex index = indexWithGroup(amount(10), amount(100), 0);
        ActivityKey activity = ACTIVITIES.get(0);

        assertRejected(() -> index.join(activity, 1, account(1), amount(9)), ErrorCode.JOIN_AMOUNT_BELOW_MINIMUM);
        assertRejected(() -> index.join(activity, 1, account(1), amount(101)), ErrorCode.JOIN_AMOUNT_EXCEEDS_MAXIMUM);
        assertRejected(() -> index.join(activity, 1, account(1), BigInteger.ZERO), ErrorCode.ZERO_JOIN_AMOUNT);

        index.join(activity, 1, account(1), amount(60));
        assertRejected(() -> index.join(activity, 1, account(1), amount(41)), ErrorCode.JOIN_AMOUNT_EXCEEDS_MAXIMUM);
        assertThat(index.joinedAmount(activity, 1, account(1))).isEqualTo(amount(60));
    }

    @Test
    void capacityLimitsNewMembersOnly() {
        MembershipIndex index = indexWithGroup(BigInteger.ZERO, BigInteger.ZERO, 2);
        ActivityKey activity = ACTIVITIES.get(0);

        index.join(activity, 1, account(1), amount(1));
        index.join(activity, 1, account(2), amount(1));

        assertRejected(() -> index.join(activity, 1, account(3), amount(1)), ErrorCode.GROUP_CAPACITY_REACHED);
        index.join(activity, 1, account(2), amount(1));
        assertThat(index.joinedAmount(activity, 1, account(2))).isEqualTo(amount(2));
    }

    @Test
    void inactiveGroupRejectsJoins() {
        ManualRoundClock clock = new ManualRoundClock(1);
        InMemoryGroupRegistry registry = new InMemoryGroupRegistry(clock);
        registry.registerGroup(1, OWNER);
        MembershipIndex index = new MembershipIndex(registry, clock);

        assertThatThrownBy(() -> index.join(ACTIVITIES.get(0), 1, account(1), amount(1)))
                .isInstanceOf(GuildpoolException.IllegalRoundStateException.class)
                .hasMessageContaining("not active");
    }

    @Test
    void assetEntrySurvivesWhileAnotherActivityOfTheAssetRemains() {
        ManualRoundClock clock = new ManualRoundClock(1);
        InMemoryGroupRegistry registry = new InMemoryGroupRegistry(clock);
        registry.registerGroup(1, OWNER);
        registry.activate(ACTIVITIES.get(0), 1, OWNER, BigInteger.ZERO, BigInteger.ZERO, 0);
        registry.activate(ACTIVITIES.get(1), 1, OWNER, BigInteger.ZERO, BigInteger.ZERO, 0);
        MembershipIndex index = new MembershipIndex(registry, clock);
        Address member = account(1);

        index.join(ACTIVITIES.get(0), 1, member, amount(5));
        index.join(ACTIVITIES.get(1), 1, member, amount(5));
        index.exit(ACTIVITIES.get(0), 1, member);

        assertThat(index.assetsByAccount(member)).containsExactly(ASSET_A);
        assertThat(index.accountsByAsset(ASSET_A)).containsExactly(member);
        assertThat(index.activityIdsByAccountByAsset(member, ASSET_A)).containsExactly(2L);

        index.exit(ACTIVITIES.get(1), 1, member);
        assertThat(index.assetsByAccount(member)).isEmpty();
        assertThat(index.assets()).isEmpty();
    }

    private MembershipIndex indexWithGroup(BigInteger min, BigInteger max, int capacity) {
        ManualRoundClock clock = new ManualRoundClock(1);
        InMemoryGroupRegistry registry = new InMemoryGroupRegistry(clock);
        registry.registerGroup(1, OWNER);
        registry.activate(ACTIVITIES.get(0), 1, OWNER, min, max, capacity);
        return new MembershipIndex(registry, clock);
    }
}
