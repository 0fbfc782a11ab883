package com.guildpool.core.verification;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.ErrorCode;
import com.guildpool.core.domain.GuildpoolException;
import com.guildpool.core.external.GroupLifecycle;
import com.guildpool.core.membership.MembershipIndex;
import com.guildpool.core.round.RoundClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-round member scoring by group owners and their single delegate.
 *
 * <p>A group is verified in a round once a score sheet exists for it; every submission in the same round
 * replaces the previous sheet wholesale. Sheets for earlier rounds are never touched again.
 */
public class GroupVerification {

    private static final Logger log = LoggerFactory.getLogger(GroupVerification.class);

    public static final int MAX_ORIGIN_SCORE = 100;

    private final GroupLifecycle lifecycle;
    private final MembershipIndex membershipIndex;
    private final RoundClock roundClock;

    private final Map<GroupKey, Address> delegates = new HashMap<>();
    private final Map<SheetKey, ScoreSheet> sheets = new HashMap<>();
    private final Map<RoundKey, Set<Long>> verifiedGroups = new HashMap<>();

    public GroupVerification(GroupLifecycle lifecycle, MembershipIndex membershipIndex, RoundClock roundClock) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "Group lifecycle cannot be null");
        this.membershipIndex = Objects.requireNonNull(membershipIndex, "Membership index cannot be null");
        this.roundClock = Objects.requireNonNull(roundClock, "Round clock cannot be null");
    }

    // ==================== Delegation ====================

    /**
     * Replaces the group's delegate. The zero address revokes it.
     */
    public synchronized void setDelegate(ActivityKey activity, long groupId, Address caller, Address delegate) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Objects.requireNonNull(caller, "Caller cannot be null");
        Objects.requireNonNull(delegate, "Delegate cannot be null");
        if (!lifecycle.ownerOf(groupId).equals(caller)) {
            throw GuildpoolException.of(ErrorCode.ONLY_GROUP_OWNER,
                    "Only the owner of group " + groupId + " may set its delegate");
        }
        GroupKey key = new GroupKey(activity, groupId);
        if (delegate.isZero()) {
            Address revoked = delegates.remove(key);
            if (revoked != null) {
                log.info("Delegate {} revoked for group {} in {}", revoked, groupId, activity);
            }
            return;
        }
        Address previous = delegates.put(key, delegate);
        if (!delegate.equals(previous)) {
            log.info("Delegate for group {} in {} set to {} (was {})", groupId, activity, delegate, previous);
        }
    }

    public synchronized Optional<Address> delegateOf(ActivityKey activity, long groupId) {
        return Optional.ofNullable(delegates.get(new GroupKey(activity, groupId)));
    }

    public synchronized boolean canVerify(ActivityKey activity, long groupId, Address account) {
        return lifecycle.ownerOf(groupId).equals(account)
                || account.equals(delegates.get(new GroupKey(activity, groupId)));
    }

    // ==================== Scoring ====================

    /**
     * Records origin scores for the current round, replacing any earlier submission in the same round.
     */
    public synchronized ScoreSheet submitScores(ActivityKey activity, long groupId, Address caller,
                                                List<Address> accounts, List<Integer> scores) {
        Objects.requireNonNull(activity, "Activity cannot be null");
        Objects.requireNonNull(caller, "Caller cannot be null");
        Objects.requireNonNull(accounts, "Accounts cannot be null");
        Objects.requireNonNull(scores, "Scores cannot be null");

        Address owner = lifecycle.ownerOf(groupId);
        if (!canVerify(activity, groupId, caller)) {
            throw GuildpoolException.of(ErrorCode.NOT_VERIFIER,
                    caller + " is neither owner nor delegate of group " + groupId);
        }
        if (accounts.size() != scores.size()) {
            throw GuildpoolException.of(ErrorCode.ARRAY_LENGTH_MISMATCH,
                    "Got " + accounts.size() + " accounts but " + scores.size() + " scores");
        }
        if (!lifecycle.isGroupActive(activity, groupId)) {
            throw GuildpoolException.of(ErrorCode.GROUP_NOT_ACTIVE,
                    "Group " + groupId + " is not active in " + activity);
        }

        Map<Address, ScoreSheet.ScoredMember> scored = new LinkedHashMap<>();
        for (int i = 0; i < accounts.size(); i++) {
            Address account = Objects.requireNonNull(accounts.get(i), "Account cannot be null");
            int score = Objects.requireNonNull(scores.get(i), "Score cannot be null");
            if (score < 0) {
                throw new IllegalArgumentException("Score cannot be negative: " + score);
            }
            if (score > MAX_ORIGIN_SCORE) {
                throw GuildpoolException.of(ErrorCode.SCORE_OVERFLOW,
                        "Score " + score + " exceeds " + MAX_ORIGIN_SCORE);
            }
            BigInteger stake = membershipIndex.membership(activity, groupId, account)
                    .orElseThrow(() -> GuildpoolException.of(ErrorCode.NOT_GROUP_MEMBER,
                            account + " is not a member of group " + groupId))
                    .amount();
            scored.put(account, new ScoreSheet.ScoredMember(score, stake));
        }

        long round = roundClock.currentRound();
        ScoreSheet sheet = new ScoreSheet(activity, groupId, round, owner, caller, scored);
        sheets.put(new SheetKey(activity, round, groupId), sheet);
        verifiedGroups.computeIfAbsent(new RoundKey(activity, round), k -> new LinkedHashSet<>()).add(groupId);
        log.info("{} scored {} members of group {} in {} round {}, verified amount {}",
                caller, scored.size(), groupId, activity, round, sheet.verifiedAmount());
        return sheet;
    }

    // ==================== Queries ====================

    public synchronized Optional<ScoreSheet> scoreSheet(ActivityKey activity, long groupId, long round) {
        return Optional.ofNullable(sheets.get(new SheetKey(activity, round, groupId)));
    }

    public synchronized boolean isVerified(ActivityKey activity, long groupId, long round) {
        return sheets.containsKey(new SheetKey(activity, round, groupId));
    }

    public synchronized int originScore(ActivityKey activity, long groupId, long round, Address account) {
        ScoreSheet sheet = sheets.get(new SheetKey(activity, round, groupId));
        if (sheet == null) {
            return 0;
        }
        ScoreSheet.ScoredMember member = sheet.scores().get(account);
        return member == null ? 0 : member.score();
    }

    public synchronized BigInteger verifiedAmount(ActivityKey activity, long groupId, long round) {
        ScoreSheet sheet = sheets.get(new SheetKey(activity, round, groupId));
        return sheet == null ? BigInteger.ZERO : sheet.verifiedAmount();
    }

    /**
     * The group owner recorded when the group was verified in that round.
     */
    public synchronized Optional<Address> verifierOf(ActivityKey activity, long groupId, long round) {
        return scoreSheet(activity, groupId, round).map(ScoreSheet::verifier);
    }

    public synchronized List<Long> verifiedGroupIds(ActivityKey activity, long round) {
        Set<Long> ids = verifiedGroups.get(new RoundKey(activity, round));
        return ids == null ? List.of() : List.copyOf(ids);
    }

    public synchronized List<Address> verifiersAtRound(ActivityKey activity, long round) {
        Set<Address> verifiers = new LinkedHashSet<>();
        for (Long groupId : verifiedGroupIds(activity, round)) {
            verifiers.add(sheets.get(new SheetKey(activity, round, groupId)).verifier());
        }
        return List.copyOf(verifiers);
    }

    public synchronized List<Long> groupIdsByVerifier(ActivityKey activity, long round, Address verifier) {
        List<Long> ids = new ArrayList<>();
        for (Long groupId : verifiedGroupIds(activity, round)) {
            if (sheets.get(new SheetKey(activity, round, groupId)).verifier().equals(verifier)) {
                ids.add(groupId);
            }
        }
        return ids;
    }

    private record GroupKey(ActivityKey activity, long groupId) {}

    private record SheetKey(ActivityKey activity, long round, long groupId) {}

    private record RoundKey(ActivityKey activity, long round) {}
}
