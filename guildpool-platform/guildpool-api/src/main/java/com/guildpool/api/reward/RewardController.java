package com.guildpool.api.reward;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.RecipientShare;
import com.guildpool.core.external.GroupLifecycle;
import com.guildpool.core.reward.BurnRecord;
import com.guildpool.core.reward.RecipientRegistry;
import com.guildpool.core.reward.RewardDistribution;
import com.guildpool.core.reward.RewardDistributor;
import com.guildpool.core.reward.RewardRecord;
import com.guildpool.core.reward.ServiceEnrollment;
import com.guildpool.core.round.RoundClock;
import com.guildpool.core.verification.GroupVerification;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * Reward REST API.
 * - Recipient splits per group
 * - Reward service enrollment
 * - Per-account rewards, claims and burns of unearned reward
 */
@RestController
@RequestMapping("/api/v1/activities/{asset}/{activityId}")
public class RewardController {

    private final RewardDistributor rewardDistributor;
    private final RecipientRegistry recipientRegistry;
    private final ServiceEnrollment serviceEnrollment;
    private final GroupLifecycle groupLifecycle;
    private final GroupVerification groupVerification;
    private final RoundClock roundClock;

    public RewardController(RewardDistributor rewardDistributor,
                            RecipientRegistry recipientRegistry,
                            ServiceEnrollment serviceEnrollment,
                            GroupLifecycle groupLifecycle,
                            GroupVerification groupVerification,
                            RoundClock roundClock) {
        this.rewardDistributor = rewardDistributor;
        this.recipientRegistry = recipientRegistry;
        this.serviceEnrollment = serviceEnrollment;
        this.groupLifecycle = groupLifecycle;
        this.groupVerification = groupVerification;
        this.roundClock = roundClock;
    }

    // ==================== Recipients ====================

    /**
     * Set the group's recipient split for the current round.
     * PUT /api/v1/activities/{asset}/{activityId}/groups/{groupId}/recipients
     */
    @PutMapping("/groups/{groupId}/recipients")
    public ResponseEntity<RecipientsResponse> setRecipients(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long groupId,
            @RequestHeader("X-Caller") String caller,
            @Valid @RequestBody RecipientsRequest request) {
        Address owner = Address.of(caller);
        List<Address> recipients = request.recipients().stream().map(Address::of).toList();
        List<RecipientShare> shares = recipientRegistry.setRecipients(
                ActivityKey.of(asset, activityId), groupId, owner, recipients, request.basisPoints());
        return ResponseEntity.ok(RecipientsResponse.from(groupId, owner, roundClock.currentRound(), shares));
    }

    /**
     * Split in effect at {@code round}, or the latest split when no round is given.
     * Splits are kept per owner: without an explicit {@code owner}, a past round resolves to the owner
     * that verified the group in that round, and anything else to the current owner.
     * GET /api/v1/activities/{asset}/{activityId}/groups/{groupId}/recipients
     */
    @GetMapping("/groups/{groupId}/recipients")
    public ResponseEntity<RecipientsResponse> recipients(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long groupId,
            @RequestParam(required = false) Long round,
            @RequestParam(required = false) String owner) {
        ActivityKey activity = ActivityKey.of(asset, activityId);
        Address splitOwner = resolveSplitOwner(activity, groupId, round, owner);
        List<RecipientShare> shares = round == null
                ? recipientRegistry.recipientsLatest(splitOwner, activity, groupId)
                : recipientRegistry.recipients(splitOwner, activity, groupId, round);
        return ResponseEntity.ok(RecipientsResponse.from(groupId, splitOwner, round, shares));
    }

    private Address resolveSplitOwner(ActivityKey activity, long groupId, Long round, String owner) {
        if (owner != null) {
            return Address.of(owner);
        }
        if (round != null) {
            return groupVerification.verifierOf(activity, groupId, round)
                    .orElseGet(() -> groupLifecycle.ownerOf(groupId));
        }
        return groupLifecycle.ownerOf(groupId);
    }

    // ==================== Enrollment ====================

    @PostMapping("/service/join")
    public ResponseEntity<EnrollmentResponse> joinService(
            @PathVariable String asset,
            @PathVariable long activityId,
            @RequestHeader("X-Caller") String caller) {
        Address account = Address.of(caller);
        boolean joined = serviceEnrollment.join(ActivityKey.of(asset, activityId), account);
        return ResponseEntity.ok(new EnrollmentResponse(account.value(), true, joined, roundClock.currentRound()));
    }

    @PostMapping("/service/exit")
    public ResponseEntity<EnrollmentResponse> exitService(
            @PathVariable String asset,
            @PathVariable long activityId,
            @RequestHeader("X-Caller") String caller) {
        Address account = Address.of(caller);
        serviceEnrollment.exit(ActivityKey.of(asset, activityId), account);
        return ResponseEntity.ok(new EnrollmentResponse(account.value(), false, true, roundClock.currentRound()));
    }

    // ==================== Rewards ====================

    @GetMapping("/rounds/{round}/summary")
    public ResponseEntity<RoundSummaryResponse> summary(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long round) {
        ActivityKey activity = ActivityKey.of(asset, activityId);
        return ResponseEntity.ok(new RoundSummaryResponse(
                round,
                rewardDistributor.totalServiceReward(activity, round),
                rewardDistributor.totalGeneratedReward(activity, round),
                rewardDistributor.unearnedReward(activity, round)));
    }

    @GetMapping("/rounds/{round}/rewards/{account}")
    public ResponseEntity<RewardResponse> reward(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long round,
            @PathVariable String account) {
        RewardRecord record = rewardDistributor.rewardByAccount(
                ActivityKey.of(asset, activityId), round, Address.of(account));
        return ResponseEntity.ok(RewardResponse.from(record));
    }

    @GetMapping("/rounds/{round}/distribution/{owner}/{groupId}")
    public ResponseEntity<DistributionResponse> distribution(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long round,
            @PathVariable String owner,
            @PathVariable long groupId) {
        RewardDistribution distribution = rewardDistributor.rewardDistribution(
                ActivityKey.of(asset, activityId), round, Address.of(owner), groupId);
        return ResponseEntity.ok(DistributionResponse.from(distribution));
    }

    @GetMapping("/rounds/{round}/distribution/{owner}/{groupId}/{recipient}")
    public ResponseEntity<RecipientRewardResponse> recipientReward(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long round,
            @PathVariable String owner,
            @PathVariable long groupId,
            @PathVariable String recipient) {
        Address recipientAddress = Address.of(recipient);
        BigInteger amount = rewardDistributor.rewardByRecipient(
                ActivityKey.of(asset, activityId), round, Address.of(owner), groupId, recipientAddress);
        return ResponseEntity.ok(new RecipientRewardResponse(round, groupId, recipientAddress.value(), amount));
    }

    /**
     * Claim the caller's reward for a finished round.
     * POST /api/v1/activities/{asset}/{activityId}/rounds/{round}/claim
     */
    @PostMapping("/rounds/{round}/claim")
    public ResponseEntity<RewardResponse> claim(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long round,
            @RequestHeader("X-Caller") String caller) {
        RewardRecord record = rewardDistributor.claimReward(
                ActivityKey.of(asset, activityId), round, Address.of(caller));
        return ResponseEntity.ok(RewardResponse.from(record));
    }

    @GetMapping("/rounds/{round}/burn")
    public ResponseEntity<BurnResponse> burnInfo(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long round) {
        return ResponseEntity.ok(BurnResponse.from(
                rewardDistributor.burnInfo(ActivityKey.of(asset, activityId), round)));
    }

    /**
     * Burn the round's unearned reward. Repeating the call returns the recorded burn.
     * POST /api/v1/activities/{asset}/{activityId}/rounds/{round}/burn
     */
    @PostMapping("/rounds/{round}/burn")
    public ResponseEntity<BurnResponse> burn(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long round) {
        return ResponseEntity.ok(BurnResponse.from(
                rewardDistributor.burnRewardIfNeeded(ActivityKey.of(asset, activityId), round)));
    }

    // DTOs
    public record RecipientsRequest(@NotNull List<String> recipients, @NotNull List<BigInteger> basisPoints) {}

    public record ShareResponse(String recipient, BigInteger basisPoints) {}

    public record RecipientsResponse(long groupId, String owner, Long round, List<ShareResponse> shares) {
        static RecipientsResponse from(long groupId, Address owner, Long round, List<RecipientShare> shares) {
            return new RecipientsResponse(groupId, owner.value(), round, shares.stream()
                .map(s -> new ShareResponse(s.recipient().value(), s.basisPoints()))
                .toList());
        }
    }

    public record EnrollmentResponse(String account, boolean enrolled, boolean changed, long round) {}

    public record RoundSummaryResponse(long round, BigInteger totalServiceReward,
                                       BigInteger totalGeneratedReward, BigInteger unearnedReward) {}

    public record RewardResponse(long round, String account, BigInteger amount, boolean claimed) {
        static RewardResponse from(RewardRecord record) {
            return new RewardResponse(record.round(), record.account().value(), record.amount(), record.claimed());
        }
    }

    public record RecipientAmountResponse(String recipient, BigInteger basisPoints, BigInteger amount) {}

    public record DistributionResponse(long round, String owner, long groupId, BigInteger groupReward,
                                       List<RecipientAmountResponse> recipients, BigInteger ownerAmount) {
        static DistributionResponse from(RewardDistribution d) {
            return new DistributionResponse(d.round(), d.owner().value(), d.groupId(), d.groupReward(),
                d.recipients().stream()
                    .map(r -> new RecipientAmountResponse(r.recipient().value(), r.basisPoints(), r.amount()))
                    .toList(),
                d.ownerAmount());
        }
    }

    public record RecipientRewardResponse(long round, long groupId, String recipient, BigInteger amount) {}

    public record BurnResponse(long round, BigInteger amount, boolean burned) {
        static BurnResponse from(BurnRecord record) {
            return new BurnResponse(record.round(), record.amount(), record.burned());
        }
    }
}
