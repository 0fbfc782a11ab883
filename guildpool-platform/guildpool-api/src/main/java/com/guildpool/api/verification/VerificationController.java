package com.guildpool.api.verification;

import com.guildpool.core.domain.ActivityKey;
import com.guildpool.core.domain.Address;
import com.guildpool.core.verification.GroupVerification;
import com.guildpool.core.verification.ScoreSheet;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Verification REST API.
 * - Owner assigns a delegate verifier
 * - Owner or delegate submits origin scores for the current round
 */
@RestController
@RequestMapping("/api/v1/activities/{asset}/{activityId}/groups/{groupId}")
public class VerificationController {

    private final GroupVerification groupVerification;

    public VerificationController(GroupVerification groupVerification) {
        this.groupVerification = groupVerification;
    }

    /**
     * Replace the group's delegate. The zero address revokes it.
     * PUT /api/v1/activities/{asset}/{activityId}/groups/{groupId}/delegate
     */
    @PutMapping("/delegate")
    public ResponseEntity<DelegateResponse> setDelegate(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long groupId,
            @RequestHeader("X-Caller") String caller,
            @Valid @RequestBody DelegateRequest request) {
        ActivityKey activity = ActivityKey.of(asset, activityId);
        groupVerification.setDelegate(activity, groupId, Address.of(caller), Address.of(request.delegate()));
        return delegate(asset, activityId, groupId);
    }

    @GetMapping("/delegate")
    public ResponseEntity<DelegateResponse> delegate(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long groupId) {
        String delegate = groupVerification.delegateOf(ActivityKey.of(asset, activityId), groupId)
                .map(Address::value)
                .orElse(null);
        return ResponseEntity.ok(new DelegateResponse(groupId, delegate));
    }

    /**
     * Submit origin scores for the current round, replacing any earlier submission in that round.
     * POST /api/v1/activities/{asset}/{activityId}/groups/{groupId}/scores
     */
    @PostMapping("/scores")
    public ResponseEntity<VerificationResponse> submitScores(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long groupId,
            @RequestHeader("X-Caller") String caller,
            @Valid @RequestBody ScoresRequest request) {
        List<Address> accounts = request.accounts().stream().map(Address::of).toList();
        ScoreSheet sheet = groupVerification.submitScores(
                ActivityKey.of(asset, activityId), groupId, Address.of(caller), accounts, request.scores());
        return ResponseEntity.status(HttpStatus.CREATED).body(VerificationResponse.from(groupId, sheet.round(), sheet));
    }

    @GetMapping("/rounds/{round}/verification")
    public ResponseEntity<VerificationResponse> verification(
            @PathVariable String asset,
            @PathVariable long activityId,
            @PathVariable long groupId,
            @PathVariable long round) {
        ScoreSheet sheet = groupVerification.scoreSheet(ActivityKey.of(asset, activityId), groupId, round)
                .orElse(null);
        return ResponseEntity.ok(VerificationResponse.from(groupId, round, sheet));
    }

    // DTOs
    public record DelegateRequest(@NotBlank String delegate) {}

    public record ScoresRequest(@NotNull List<String> accounts, @NotNull List<Integer> scores) {}

    public record DelegateResponse(long groupId, String delegate) {}

    public record ScoreResponse(String account, int score, BigInteger stake) {}

    public record VerificationResponse(
        long groupId,
        long round,
        boolean verified,
        String verifier,
        String submittedBy,
        BigInteger verifiedAmount,
        List<ScoreResponse> scores
    ) {
        static VerificationResponse from(long groupId, long round, ScoreSheet sheet) {
            if (sheet == null) {
                return new VerificationResponse(groupId, round, false, null, null, BigInteger.ZERO, List.of());
            }
            List<ScoreResponse> scores = sheet.scores().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> new ScoreResponse(e.getKey().value(), e.getValue().score(), e.getValue().stake()))
                .toList();
            return new VerificationResponse(groupId, round, true, sheet.verifier().value(),
                sheet.submittedBy().value(), sheet.verifiedAmount(), scores);
        }
    }
}
