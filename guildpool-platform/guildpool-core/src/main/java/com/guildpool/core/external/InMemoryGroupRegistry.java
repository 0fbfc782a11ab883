package com.guildpool.core.external;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.ErrorCode;
import com.guildpool.core.domain.GuildpoolException;
import com.guildpool.core.domain.Precision;
import com.guildpool.core.round.RoundClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Group registry and activation bookkeeping kept in memory.
 * Groups are registered once with an owner, then activated per activity with join bounds and a capacity.
 */
public class InMemoryGroupRegistry implements GroupLifecycle {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGroupRegistry.class);

    private final RoundClock roundClock;
    private final Map<Long, Address> owners = new ConcurrentHashMap<>();
    private final Map<ActivationKey, Activation> activations = new ConcurrentHashMap<>();

    public InMemoryGroupRegistry(RoundClock roundClock) {
        this.roundClock = Objects.requireNonNull(roundClock, "Round clock cannot be null");
    }

    public synchronized void registerGroup(long groupId, Address owner) {
        Objects.requireNonNull(owner, "Owner cannot be null");
        if (owner.isZero()) {
            throw GuildpoolException.of(ErrorCode.ZERO_ADDRESS, "Group owner cannot be the zero address");
        }
        if (owners.putIfAbsent(groupId, owner) != null) {
            throw new IllegalStateException("Group already registered: " + groupId);
        }
        log.info("Registered group {} owned by {}", groupId, owner);
    }

    public synchronized void transferOwnership(long groupId, Address caller, Address newOwner) {
        Objects.requireNonNull(newOwner, "New owner cannot be null");
        requireOwner(groupId, caller);
        if (newOwner.isZero()) {
            throw GuildpoolException.of(ErrorCode.ZERO_ADDRESS, "Group owner cannot be the zero address");
        }
        owners.put(groupId, newOwner);
        log.info("Group {} ownership transferred from {} to {}", groupId, caller, newOwner);
    }

    public synchronized Activation activate(ActivityKey activity, long groupId, Address caller,
                                            BigInteger minJoinAmount, BigInteger maxJoinAmount, int maxAccounts) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Precision.requireNonNegative(minJoinAmount, "Minimum join amount");
        Precision.requireNonNegative(maxJoinAmount, "Maximum join amount");
        if (maxAccounts < 0) {
            throw new IllegalArgumentException("Max accounts cannot be negative: " + maxAccounts);
        }
        requireOwner(groupId, caller);
        ActivationKey key = new ActivationKey(activity, groupId);
        Activation existing = activations.get(key);
        if (existing != null && existing.active()) {
            throw GuildpoolException.of(ErrorCode.GROUP_ALREADY_ACTIVE,
                    "Group " + groupId + " is already active in " + activity);
        }
        Activation activation = new Activation(activity, groupId, minJoinAmount, maxJoinAmount, maxAccounts,
                true, roundClock.currentRound(), null);
        activations.put(key, activation);
        log.info("Group {} activated in {} at round {}", groupId, activity, activation.activatedRound());
        return activation;
    }

    public synchronized Activation deactivate(ActivityKey activity, long groupId, Address caller) {
        requireOwner(groupId, caller);
        ActivationKey key = new ActivationKey(activity, groupId);
        Activation existing = activations.get(key);
        if (existing == null || !existing.active()) {
            throw GuildpoolException.of(ErrorCode.GROUP_NOT_ACTIVE,
                    "Group " + groupId + " is not active in " + activity);
        }
        Activation deactivated = new Activation(activity, groupId, existing.minJoinAmount(),
                existing.maxJoinAmount(), existing.maxAccounts(), false, existing.activatedRound(),
                roundClock.currentRound());
        activations.put(key, deactivated);
        log.info("Group {} deactivated in {} at round {}", groupId, activity, deactivated.deactivatedRound());
        return deactivated;
    }

    public Optional<Activation> activation(ActivityKey activity, long groupId) {
        return Optional.ofNullable(activations.get(new ActivationKey(activity, groupId)));
    }

    @Override
    public boolean isGroupActive(ActivityKey activity, long groupId) {
        Activation activation = activations.get(new ActivationKey(activity, groupId));
        return activation != null && activation.active();
    }

    @Override
    public Address ownerOf(long groupId) {
        Address owner = owners.get(groupId);
        if (owner == null) {
            throw GuildpoolException.of(ErrorCode.GROUP_NOT_FOUND, "Group not found: " + groupId);
        }
        return owner;
    }

    @Override
    public BigInteger minJoinAmount(ActivityKey activity, long groupId) {
        return activation(activity, groupId).map(Activation::minJoinAmount).orElse(BigInteger.ZERO);
    }

    @Override
    public BigInteger maxJoinAmount(ActivityKey activity, long groupId) {
        return activation(activity, groupId).map(Activation::maxJoinAmount).orElse(BigInteger.ZERO);
    }

    @Override
    public int maxAccounts(ActivityKey activity, long groupId) {
        return activation(activity, groupId).map(Activation::maxAccounts).orElse(0);
    }

    @Override
    public List<Long> activeGroupIdsOwnedBy(ActivityKey activity, Address owner) {
        return activations.values().stream()
                .filter(a -> a.activity().equals(activity) && a.active())
                .map(Activation::groupId)
                .filter(groupId -> owner.equals(owners.get(groupId)))
                .sorted()
                .toList();
    }

    private void requireOwner(long groupId, Address caller) {
        Objects.requireNonNull(caller, "Caller cannot be null");
        if (!ownerOf(groupId).equals(caller)) {
            throw GuildpoolException.of(ErrorCode.ONLY_GROUP_OWNER,
                    "Only the owner of group " + groupId + " may do this");
        }
    }

    private record ActivationKey(ActivityKey activity, long groupId) {}

    /**
     * Activation state of a group within one activity.
     */
    public record Activation(
            ActivityKey activity,
            long groupId,
            BigInteger minJoinAmount,
            BigInteger maxJoinAmount,
            int maxAccounts,
            boolean active,
            long activatedRound,
            Long deactivatedRound
    ) {}
}
