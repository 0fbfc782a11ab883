package com.guildpool.api.membership;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.membership.Membership;
import com.guildpool.core.membership.MembershipIndex;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * Membership REST API.
 * - Join and exit groups with a stake
 * - Browse members by group, activity and account
 */
@RestController
@RequestMapping("/api/v1")
public class MembershipController {

    private final MembershipIndex membershipIndex;

    public MembershipController(MembershipIndex membershipIndex) {
        this.membershipIndex = membershipIndex;
    }

    /**
     * Join a group, or add to the stake in a group already joined.
     * POST /api/v1/activities/{asset}/{activityId}/groups/{groupId}/members
     */
    @PostMapping("/activities/{asset}/{activityId}/groups/{groupId}/members")
    public ResponseEntity<MembershipResponse> join(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long groupId,
            @RequestHeader("X-Caller") String caller,
            @Valid @RequestBody JoinRequest request) {
        Membership membership = membershipIndex.join(
                ActivityKey.of(asset, activityId), groupId, Address.of(caller), request.amount());
        return ResponseEntity.status(HttpStatus.CREATED).body(MembershipResponse.from(membership));
    }

    /**
     * Leave a group and release the stake.
     * DELETE /api/v1/activities/{asset}/{activityId}/groups/{groupId}/members
     */
    @DeleteMapping("/activities/{asset}/{activityId}/groups/{groupId}/members")
    public ResponseEntity<ExitResponse> exit(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long groupId,
            @RequestHeader("X-Caller") String caller) {
        Address account = Address.of(caller);
        BigInteger released = membershipIndex.exit(ActivityKey.of(asset, activityId), groupId, account);
        return ResponseEntity.ok(new ExitResponse(account.value(), groupId, released));
    }

    @GetMapping("/activities/{asset}/{activityId}/groups/{groupId}/members")
    public ResponseEntity<GroupMembersResponse> members(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long groupId) {
        ActivityKey activity = ActivityKey.of(asset, activityId);
        List<MemberResponse> members = membershipIndex.accountsByGroup(activity, groupId).stream()
                .map(account -> new MemberResponse(account.value(),
                        membershipIndex.joinedAmount(activity, groupId, account)))
                .toList();
        return ResponseEntity.ok(new GroupMembersResponse(
                groupId,
                membershipIndex.accountCountByGroup(activity, groupId),
                membershipIndex.totalJoinedAmount(activity, groupId),
                members));
    }

    @GetMapping("/activities/{asset}/{activityId}")
    public ResponseEntity<ActivitySummaryResponse> activity(
            @PathVariable String asset,
            @PathVariable long activityId) {
        ActivityKey activity = ActivityKey.of(asset, activityId);
        return ResponseEntity.ok(new ActivitySummaryResponse(
                activity.asset().value(),
                activityId,
                membershipIndex.groupIdsByActivity(activity),
                membershipIndex.accountCountByActivity(activity),
                membershipIndex.totalJoinedAmountByActivity(activity)));
    }

    @GetMapping("/activities/{asset}/{activityId}/owners/{owner}/joined")
    public ResponseEntity<OwnerStakeResponse> joinedByOwner(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable String owner) {
        Address ownerAddress = Address.of(owner);
        return ResponseEntity.ok(new OwnerStakeResponse(ownerAddress.value(),
                membershipIndex.totalJoinedAmountByOwner(ActivityKey.of(asset, activityId), ownerAddress)));
    }

    @GetMapping("/assets/{asset}")
    public ResponseEntity<AssetSummaryResponse> asset(@PathVariable String asset) {
        Address assetAddress = Address.of(asset);
        return ResponseEntity.ok(new AssetSummaryResponse(
                assetAddress.value(),
                membershipIndex.activityIdsByAsset(assetAddress),
                membershipIndex.accountCountByAsset(assetAddress)));
    }

    @GetMapping("/accounts/{account}/memberships")
    public ResponseEntity<List<MembershipResponse>> memberships(@PathVariable String account) {
        return ResponseEntity.ok(membershipIndex.membershipsOf(Address.of(account)).stream()
                .map(MembershipResponse::from)
                .toList());
    }

    // DTOs
    public record JoinRequest(@NotNull BigInteger amount) {}

    public record MembershipResponse(
        String asset,
        long activityId,
        long groupId,
        String account,
        BigInteger amount,
        long joinedRound
    ) {
        static MembershipResponse from(Membership membership) {
            return new MembershipResponse(
                membership.activity().asset().value(),
                membership.activity().activityId(),
                membership.groupId(),
                membership.account().value(),
                membership.amount(),
                membership.joinedRound());
        }
    }

    public record ExitResponse(String account, long groupId, BigInteger releasedAmount) {}
    public record MemberResponse(String account, BigInteger amount) {}
    public record GroupMembersResponse(long groupId, int accountCount, BigInteger totalJoinedAmount,
                                       List<MemberResponse> members) {}
    public record ActivitySummaryResponse(String asset, long activityId, List<Long> groupIds,
                                          int accountCount, BigInteger totalJoinedAmount) {}
    public record OwnerStakeResponse(String owner, BigInteger totalJoinedAmount) {}
    public record AssetSummaryResponse(String asset, List<Long> activityIds, int accountCount) {}
}
