package com.guildpool.core.verification;

import com.guildpool.core.CoreFixture;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.ErrorCode;
import com.guildpool.core.domain.Precision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static com.guildpool.core.CoreFixture.ACTIVITY;
import static com.guildpool.core.CoreFixture.account;
import static com.guildpool.core.CoreFixture.amount;
import static com.guildpool.core.CoreFixture.assertRejected;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Score submission and single-delegate authorization.
 */
class GroupVerificationTest {

    private final Address owner = account(1);
    private final Address delegate = account(2);
    private final Address member = account(3);
    private final Address other = account(4);

    private CoreFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new CoreFixture();
        fixture.openGroup(1, owner);
        fixture.membership.join(ACTIVITY, 1, member, amount(10));
    }

    @Test
    void scoredMemberProducesVerifiedAmountWithoutReduction() {
        fixture.verification.submitScores(ACTIVITY, 1, owner, List.of(member), List.of(80));

        assertThat(fixture.verification.isVerified(ACTIVITY, 1, 1)).isTrue();
        assertThat(fixture.verification.verifiedAmount(ACTIVITY, 1, 1)).isEqualTo(amount(8));
        assertThat(fixture.verification.originScore(ACTIVITY, 1, 1, member)).isEqualTo(80);
        assertThat(fixture.distrust.distrustReduction(ACTIVITY, 1, 1)).isEqualTo(Precision.ONE);
    }

    @Test
    void groupIsUnverifiedInANewRoundUntilScored() {
        fixture.verification.submitScores(ACTIVITY, 1, owner, List.of(member), List.of(80));
        fixture.clock.advance();

        assertThat(fixture.verification.isVerified(ACTIVITY, 1, 2)).isFalse();
        assertThat(fixture.verification.verifiedAmount(ACTIVITY, 1, 2)).isZero();
        assertThat(fixture.verification.isVerified(ACTIVITY, 1, 1)).isTrue();
    }

    @Test
    void resubmissionInTheSameRoundReplacesTheWholeSheet() {
        Address second = account(5);
        fixture.membership.join(ACTIVITY, 1, second, amount(20));
        fixture.verification.submitScores(ACTIVITY, 1, owner, List.of(member, second), List.of(100, 100));

        fixture.verification.submitScores(ACTIVITY, 1, owner, List.of(second), List.of(50));

        assertThat(fixture.verification.originScore(ACTIVITY, 1, 1, member)).isZero();
        assertThat(fixture.verification.originScore(ACTIVITY, 1, 1, second)).isEqualTo(50);
        assertThat(fixture.verification.verifiedAmount(ACTIVITY, 1, 1)).isEqualTo(amount(10));
    }

    @Test
    void pastScoresAreFrozenAgainstLaterExits() {
        fixture.verification.submitScores(ACTIVITY, 1, owner, List.of(member), List.of(100));
        fixture.clock.advance();
        fixture.membership.exit(ACTIVITY, 1, member);

        assertThat(fixture.verification.verifiedAmount(ACTIVITY, 1, 1)).isEqualTo(amount(10));
        assertThat(fixture.verification.verifierOf(ACTIVITY, 1, 1)).contains(owner);
    }

    @Test
    void delegateMayScoreUntilReplaced() {
        fixture.verification.setDelegate(ACTIVITY, 1, owner, delegate);
        fixture.verification.submitScores(ACTIVITY, 1, delegate, List.of(member), List.of(70));
        assertThat(fixture.verification.scoreSheet(ACTIVITY, 1, 1).orElseThrow().submittedBy()).isEqualTo(delegate);

        fixture.verification.setDelegate(ACTIVITY, 1, owner, other);

        assertRejected(() -> fixture.verification.submitScores(ACTIVITY, 1, delegate, List.of(member), List.of(70)),
                ErrorCode.NOT_VERIFIER);
        fixture.verification.submitScores(ACTIVITY, 1, other, List.of(member), List.of(60));
        fixture.verification.submitScores(ACTIVITY, 1, owner, List.of(member), List.of(50));
        assertThat(fixture.verification.originScore(ACTIVITY, 1, 1, member)).isEqualTo(50);
    }

    @Test
    void zeroAddressRevokesTheDelegate() {
        fixture.verification.setDelegate(ACTIVITY, 1, owner, delegate);
        fixture.verification.setDelegate(ACTIVITY, 1, owner, Address.ZERO);

        assertThat(fixture.verification.delegateOf(ACTIVITY, 1)).isEmpty();
        assertRejected(() -> fixture.verification.submitScores(ACTIVITY, 1, delegate, List.of(member), List.of(1)),
                ErrorCode.NOT_VERIFIER);
    }

    @Test
    void onlyTheOwnerSetsTheDelegate() {
        assertRejected(() -> fixture.verification.setDelegate(ACTIVITY, 1, other, delegate),
                ErrorCode.ONLY_GROUP_OWNER);
        assertThat(fixture.verification.delegateOf(ACTIVITY, 1)).isEmpty();
    }

    @Test
    void malformedSubmissionsLeaveNoTrace() {
        assertRejected(() -> fixture.verification.submitScores(ACTIVITY, 1, owner, List.of(member), List.of(1, 2)),
                ErrorCode.ARRAY_LENGTH_MISMATCH);
        assertRejected(() -> fixture.verification.submitScores(ACTIVITY, 1, owner, List.of(member), List.of(101)),
                ErrorCode.SCORE_OVERFLOW);
        assertRejected(() -> fixture.verification.submitScores(ACTIVITY, 1, owner, List.of(other), List.of(10)),
                ErrorCode.NOT_GROUP_MEMBER);

        assertThat(fixture.verification.isVerified(ACTIVITY, 1, 1)).isFalse();
        assertThat(fixture.verification.verifiedGroupIds(ACTIVITY, 1)).isEmpty();
    }

    @Test
    void deactivatedGroupCannotBeScored() {
        fixture.groups.deactivate(ACTIVITY, 1, owner);

        assertRejected(() -> fixture.verification.submitScores(ACTIVITY, 1, owner, List.of(member), List.of(10)),
                ErrorCode.GROUP_NOT_ACTIVE);
    }

    @Test
    void verifiersAreListedOncePerRound() {
        fixture.openGroup(2, owner);
        Address secondMember = account(6);
        fixture.membership.join(ACTIVITY, 2, secondMember, BigInteger.TEN);

        fixture.verification.submitScores(ACTIVITY, 1, owner, List.of(member), List.of(100));
        fixture.verification.submitScores(ACTIVITY, 2, owner, List.of(secondMember), List.of(100));

        assertThat(fixture.verification.verifiersAtRound(ACTIVITY, 1)).containsExactly(owner);
        assertThat(fixture.verification.groupIdsByVerifier(ACTIVITY, 1, owner)).containsExactly(1L, 2L);
    }
}
