package com.guildpool.api.admin;

import com.guildpool.blockchain.service.OnChainRewardPool;
import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.external.InMemoryGovernanceLedger;
import com.guildpool.core.external.InMemoryGroupRegistry;
import com.guildpool.core.round.ManualRoundClock;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * Operator API driving the simulated collaborators: group lifecycle, round clock,
 * governance votes and pool minting.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final InMemoryGroupRegistry groupRegistry;
    private final ManualRoundClock roundClock;
    private final InMemoryGovernanceLedger governanceLedger;
    private final OnChainRewardPool rewardPool;

    public AdminController(InMemoryGroupRegistry groupRegistry,
                           ManualRoundClock roundClock,
                           InMemoryGovernanceLedger governanceLedger,
                           OnChainRewardPool rewardPool) {
        this.groupRegistry = groupRegistry;
        this.roundClock = roundClock;
        this.governanceLedger = governanceLedger;
        this.rewardPool = rewardPool;
    }

    // ==================== Groups ====================

    @PostMapping("/groups")
    public ResponseEntity<GroupResponse> registerGroup(@Valid @RequestBody RegisterGroupRequest request) {
        Address owner = Address.of(request.owner());
        groupRegistry.registerGroup(request.groupId(), owner);
        return ResponseEntity.status(HttpStatus.CREATED).body(new GroupResponse(request.groupId(), owner.value()));
    }

    @PostMapping("/groups/{groupId}/transfer")
    public ResponseEntity<GroupResponse> transferOwnership(
            @PathVariable long groupId,
            @RequestHeader("X-Caller") String caller,
            @Valid @RequestBody TransferRequest request) {
        Address newOwner = Address.of(request.newOwner());
        groupRegistry.transferOwnership(groupId, Address.of(caller), newOwner);
        return ResponseEntity.ok(new GroupResponse(groupId, newOwner.value()));
    }

    @PostMapping("/activities/{asset}/{activityId}/groups/{groupId}/activate")
    public ResponseEntity<ActivationResponse> activate(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long groupId,
            @RequestHeader("X-Caller") String caller,
            @Valid @RequestBody ActivateRequest request) {
        InMemoryGroupRegistry.Activation activation = groupRegistry.activate(
                ActivityKey.of(asset, activityId), groupId, Address.of(caller),
                request.minJoinAmount(), request.maxJoinAmount(), request.maxAccounts());
        return ResponseEntity.status(HttpStatus.CREATED).body(ActivationResponse.from(activation));
    }

    @PostMapping("/activities/{asset}/{activityId}/groups/{groupId}/deactivate")
    public ResponseEntity<ActivationResponse> deactivate(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long groupId,
            @RequestHeader("X-Caller") String caller) {
        InMemoryGroupRegistry.Activation activation = groupRegistry.deactivate(
                ActivityKey.of(asset, activityId), groupId, Address.of(caller));
        return ResponseEntity.ok(ActivationResponse.from(activation));
    }

    // ==================== Rounds ====================

    @GetMapping("/rounds/current")
    public ResponseEntity<RoundResponse> currentRound() {
        return ResponseEntity.ok(new RoundResponse(roundClock.currentRound()));
    }

    @PostMapping("/rounds/advance")
    public ResponseEntity<RoundResponse> advanceRound(@RequestParam(required = false) Long to) {
        long round = to == null ? roundClock.advance() : roundClock.advanceTo(to);
        return ResponseEntity.ok(new RoundResponse(round));
    }

    // ==================== Governance and pool ====================

    @PostMapping("/activities/{asset}/{activityId}/rounds/{round}/votes")
    public ResponseEntity<VotesResponse> recordVotes(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long round,
            @Valid @RequestBody VotesRequest request) {
        ActivityKey activity = ActivityKey.of(asset, activityId);
        Address voter = Address.of(request.voter());
        governanceLedger.recordVotes(activity, round, voter, request.amount());
        return ResponseEntity.ok(new VotesResponse(round, voter.value(),
                governanceLedger.verifierQuota(activity, round, voter),
                governanceLedger.totalVotes(activity, round)));
    }

    @PostMapping("/activities/{asset}/{activityId}/rounds/{round}/mint")
    public ResponseEntity<PoolResponse> mint(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long round,
            @Valid @RequestBody MintRequest request) {
        ActivityKey activity = ActivityKey.of(asset, activityId);
        rewardPool.mint(activity, round, request.amount());
        return pool(asset, activityId, round);
    }

    @GetMapping("/activities/{asset}/{activityId}/rounds/{round}/pool")
    public ResponseEntity<PoolResponse> pool(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long round) {
        ActivityKey activity = ActivityKey.of(asset, activityId);
        return ResponseEntity.ok(new PoolResponse(
                round,
                rewardPool.totalServiceReward(activity, round),
                rewardPool.heldBalance(activity),
                rewardPool.totalBurned(activity),
                rewardPool.isMirroring()));
    }

    @GetMapping("/accounts/{account}/balance")
    public ResponseEntity<BalanceResponse> balance(@PathVariable String account) {
        Address address = Address.of(account);
        return ResponseEntity.ok(new BalanceResponse(address.value(), rewardPool.balanceOf(address),
                rewardPool.onChainBalanceOf(address).orElse(null)));
    }

    // DTOs
    public record RegisterGroupRequest(long groupId, @NotBlank String owner) {}
    public record TransferRequest(@NotBlank String newOwner) {}
    public record ActivateRequest(
        @NotNull @PositiveOrZero BigInteger minJoinAmount,
        @NotNull @PositiveOrZero BigInteger maxJoinAmount,
        @PositiveOrZero int maxAccounts
    ) {}
    public record VotesRequest(@NotBlank String voter, @NotNull @PositiveOrZero BigInteger amount) {}
    public record MintRequest(@NotNull @PositiveOrZero BigInteger amount) {}

    public record GroupResponse(long groupId, String owner) {}
    public record RoundResponse(long currentRound) {}
    public record VotesResponse(long round, String voter, BigInteger quota, BigInteger totalVotes) {}
    public record PoolResponse(long round, BigInteger totalServiceReward, BigInteger heldBalance,
                               BigInteger totalBurned, boolean onChainMirroring) {}
    public record BalanceResponse(String account, BigInteger paid, BigInteger onChainBalance) {}

    public record ActivationResponse(
        String asset,
        long activityId,
        long groupId,
        BigInteger minJoinAmount,
        BigInteger maxJoinAmount,
        int maxAccounts,
        boolean active,
        long activatedRound,
        Long deactivatedRound
    ) {
        static ActivationResponse from(InMemoryGroupRegistry.Activation a) {
            return new ActivationResponse(a.activity().asset().value(), a.activity().activityId(), a.groupId(),
                a.minJoinAmount(), a.maxJoinAmount(), a.maxAccounts(), a.active(), a.activatedRound(),
                a.deactivatedRound());
        }
    }
}
