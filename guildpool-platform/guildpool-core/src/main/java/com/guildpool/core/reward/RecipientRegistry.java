package com.guildpool.core.reward;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.ErrorCode;
import com.guildpool.core.domain.GuildpoolException;
import com.guildpool.core.domain.Precision;
import com.guildpool.core.domain.RecipientShare;
import com.guildpool.core.external.GroupLifecycle;
import com.guildpool.core.round.RoundClock;
import com.guildpool.core.round.RoundHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Owner-chosen splits of a group's reward, versioned by round. The owner keeps whatever the shares leave.
 */
public class RecipientRegistry {

    private static final Logger log = LoggerFactory.getLogger(RecipientRegistry.class);

    public static final int DEFAULT_MAX_RECIPIENTS = 10;

    private final GroupLifecycle lifecycle;
    private final RoundClock roundClock;
    private final int maxRecipients;
    private final Map<SplitKey, RoundHistory<List<RecipientShare>>> splits = new HashMap<>();

    public RecipientRegistry(GroupLifecycle lifecycle, RoundClock roundClock, int maxRecipients) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "Group lifecycle cannot be null");
        this.roundClock = Objects.requireNonNull(roundClock, "Round clock cannot be null");
        if (maxRecipients <= 0) {
            throw new IllegalArgumentException("Max recipients must be positive: " + maxRecipients);
        }
        this.maxRecipients = maxRecipients;
    }

    /**
     * Sets the split for the current round. A later call in the same round replaces it.
     */
    public synchronized List<RecipientShare> setRecipients(ActivityKey activity, long groupId, Address caller,
                                                           List<Address> recipients, List<BigInteger> basisPoints) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Objects.requireNonNull(caller, "Caller cannot be null");
        Objects.requireNonNull(recipients, "Recipients cannot be null");
        Objects.requireNonNull(basisPoints, "Basis points cannot be null");

        Address owner = lifecycle.ownerOf(groupId);
        if (!owner.equals(caller)) {
            throw GuildpoolException.of(ErrorCode.NOT_GROUP_OWNER,
                    caller + " does not own group " + groupId);
        }
        if (recipients.size() != basisPoints.size()) {
            throw GuildpoolException.of(ErrorCode.ARRAY_LENGTH_MISMATCH,
                    "Got " + recipients.size() + " recipients but " + basisPoints.size() + " shares");
        }
        if (recipients.size() > maxRecipients) {
            throw GuildpoolException.of(ErrorCode.TOO_MANY_RECIPIENTS,
                    recipients.size() + " recipients exceeds the limit of " + maxRecipients);
        }

        List<RecipientShare> shares = new ArrayList<>(recipients.size());
        Set<Address> seen = new HashSet<>();
        BigInteger sum = BigInteger.ZERO;
        for (int i = 0; i < recipients.size(); i++) {
            Address recipient = Objects.requireNonNull(recipients.get(i), "Recipient cannot be null");
            BigInteger share = Precision.requireNonNegative(basisPoints.get(i), "Basis points");
            if (recipient.isZero()) {
                throw GuildpoolException.of(ErrorCode.ZERO_ADDRESS, "Recipient cannot be the zero address");
            }
            if (share.signum() == 0) {
                throw GuildpoolException.of(ErrorCode.ZERO_BASIS_POINTS, "Share for " + recipient + " is zero");
            }
            if (recipient.equals(owner)) {
                throw GuildpoolException.of(ErrorCode.RECIPIENT_CANNOT_BE_SELF,
                        "The owner keeps the remainder and cannot be listed as a recipient");
            }
            if (!seen.add(recipient)) {
                throw GuildpoolException.of(ErrorCode.DUPLICATE_RECIPIENT, recipient + " is listed twice");
            }
            sum = sum.add(share);
            shares.add(new RecipientShare(recipient, share));
        }
        if (sum.compareTo(Precision.ONE) > 0) {
            throw GuildpoolException.of(ErrorCode.INVALID_BASIS_POINTS,
                    "Shares sum to " + sum + ", more than " + Precision.ONE);
        }

        List<RecipientShare> frozen = List.copyOf(shares);
        long round = roundClock.currentRound();
        splits.computeIfAbsent(new SplitKey(owner, activity, groupId), k -> new RoundHistory<>())
                .record(round, frozen);
        log.info("{} set {} recipients for group {} in {} at round {}",
                owner, frozen.size(), groupId, activity, round);
        return frozen;
    }

    /**
     * The split in effect at the given round: the latest one set at or before it.
     */
    public synchronized List<RecipientShare> recipients(Address owner, ActivityKey activity, long groupId, long round) {
        RoundHistory<List<RecipientShare>> history = splits.get(new SplitKey(owner, activity, groupId));
        return history == null ? List.of() : history.valueAt(round).orElse(List.of());
    }

    public synchronized List<RecipientShare> recipientsLatest(Address owner, ActivityKey activity, long groupId) {
        RoundHistory<List<RecipientShare>> history = splits.get(new SplitKey(owner, activity, groupId));
        return history == null ? List.of() : history.latest().orElse(List.of());
    }

    public int getMaxRecipients() {
        return maxRecipients;
    }

    private record SplitKey(Address owner, ActivityKey activity, long groupId) {}
}
