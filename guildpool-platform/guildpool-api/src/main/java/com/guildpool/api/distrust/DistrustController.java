package com.guildpool.api.distrust;

import com.guildpool.core.distrust.DistrustLedger;
import com.guildpool.core.distrust.DistrustVote;
import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * Distrust voting REST API.
 */
@RestController
@RequestMapping("/api/v1/activities/{asset}/{activityId}")
public class DistrustController {

    private final DistrustLedger distrustLedger;

    public DistrustController(DistrustLedger distrustLedger) {
        this.distrustLedger = distrustLedger;
    }

    /**
     * Cast distrust against a group owner in the current round.
     * POST /api/v1/activities/{asset}/{activityId}/distrust
     */
    @PostMapping("/distrust")
    public ResponseEntity<DistrustVoteResponse> distrustVote(
            @PathVariable String asset,
            @PathVariable long activityId,
            @RequestHeader("X-Caller") String caller,
            @Valid @RequestBody DistrustRequest request) {
        ActivityKey activity = ActivityKey.of(asset, activityId);
        Address voter = Address.of(caller);
        DistrustVote vote = distrustLedger.distrustVote(
                activity, voter, Address.of(request.target()), request.amount(), request.reason());
        return ResponseEntity.status(HttpStatus.CREATED).body(new DistrustVoteResponse(
                vote.round(),
                voter.value(),
                vote.target().value(),
                vote.amount(),
                distrustLedger.distrustVotesByVoter(activity, vote.round(), voter),
                vote.reason()));
    }

    /**
     * Distrust rate and the reward multiplier it leaves for a group.
     * GET /api/v1/activities/{asset}/{activityId}/groups/{groupId}/rounds/{round}/distrust
     */
    @GetMapping("/groups/{groupId}/rounds/{round}/distrust")
    public ResponseEntity<GroupDistrustResponse> groupDistrust(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long groupId,
            @PathVariable long round) {
        ActivityKey activity = ActivityKey.of(asset, activityId);
        return ResponseEntity.ok(new GroupDistrustResponse(
                groupId,
                round,
                distrustLedger.distrustRate(activity, groupId, round),
                distrustLedger.distrustReduction(activity, groupId, round)));
    }

    @GetMapping("/rounds/{round}/distrust/{target}")
    public ResponseEntity<TargetDistrustResponse> targetDistrust(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long round,
            @PathVariable String target) {
        ActivityKey activity = ActivityKey.of(asset, activityId);
        Address targetAddress = Address.of(target);
        List<VoterResponse> voters = distrustLedger.distrustVotersByTarget(activity, round, targetAddress).stream()
                .map(voter -> new VoterResponse(
                        voter.value(),
                        distrustLedger.distrustVotesByVoterByTarget(activity, round, voter, targetAddress),
                        distrustLedger.distrustReason(activity, round, voter, targetAddress).orElse(null)))
                .toList();
        return ResponseEntity.ok(new TargetDistrustResponse(
                targetAddress.value(),
                round,
                distrustLedger.distrustVotesByTarget(activity, round, targetAddress),
                voters));
    }

    // DTOs
    public record DistrustRequest(@NotBlank String target, @NotNull BigInteger amount, String reason) {}

    public record DistrustVoteResponse(
        long round,
        String voter,
        String target,
        BigInteger amountAgainstTarget,
        BigInteger voterTotal,
        String reason
    ) {}

    public record GroupDistrustResponse(long groupId, long round, BigInteger distrustRate,
                                        BigInteger distrustReduction) {}

    public record VoterResponse(String voter, BigInteger amount, String reason) {}

    public record TargetDistrustResponse(String target, long round, BigInteger total, List<VoterResponse> voters) {}
}
