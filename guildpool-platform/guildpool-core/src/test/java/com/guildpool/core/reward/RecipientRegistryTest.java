package com.guildpool.core.reward;

import com.guildpool.core.CoreFixture;
import com.guildpool.core.domain.Address;
import com.guildpool.core.domain.ErrorCode;
import com.guildpool.core.domain.Precision;
import com.guildpool.core.domain.RecipientShare;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.guildpool.core.CoreFixture.ACTIVITY;
import static com.guildpool.core.CoreFixture.account;
import static com.guildpool.core.CoreFixture.assertRejected;
import static org.assertj.core.api.Assertions.*;

class RecipientRegistryTest {

    private static final Address OWNER = account(1);
    private static final Address R1 = account(11);
    private static final Address R2 = account(12);
    private static final BigInteger THIRTY_PERCENT = percent(30);
    private static final BigInteger TWENTY_PERCENT = percent(20);

    private CoreFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new CoreFixture();
        fixture.openGroup(1, OWNER);
    }

    @Test
    void ownerSetsSplitForCurrentRound() {
        List<RecipientShare> shares = fixture.recipients.setRecipients(ACTIVITY, 1, OWNER,
                List.of(R1, R2), List.of(THIRTY_PERCENT, TWENTY_PERCENT));

        assertThat(shares).containsExactly(
                new RecipientShare(R1, THIRTY_PERCENT),
                new RecipientShare(R2, TWENTY_PERCENT));
        assertThat(fixture.recipients.recipients(OWNER, ACTIVITY, 1, 1)).isEqualTo(shares);
        assertThat(fixture.recipients.recipientsLatest(OWNER, ACTIVITY, 1)).isEqualTo(shares);
    }

    @Test
    void lastWriteWinsWithinRoundAndHistoryIsKept() {
        fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, List.of(R1), List.of(THIRTY_PERCENT));
        fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, List.of(R2), List.of(TWENTY_PERCENT));
        fixture.clock.advanceTo(4);
        fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, List.of(R1, R2), List.of(THIRTY_PERCENT, THIRTY_PERCENT));

        assertThat(fixture.recipients.recipients(OWNER, ACTIVITY, 1, 1))
                .containsExactly(new RecipientShare(R2, TWENTY_PERCENT));
        assertThat(fixture.recipients.recipients(OWNER, ACTIVITY, 1, 3))
                .containsExactly(new RecipientShare(R2, TWENTY_PERCENT));
        assertThat(fixture.recipients.recipients(OWNER, ACTIVITY, 1, 4)).hasSize(2);
        assertThat(fixture.recipients.recipientsLatest(OWNER, ACTIVITY, 1)).hasSize(2);
    }

    @Test
    void emptyListClearsSplitFromThisRound() {
        fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, List.of(R1), List.of(THIRTY_PERCENT));
        fixture.clock.advance();
        fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, List.of(), List.of());

        assertThat(fixture.recipients.recipients(OWNER, ACTIVITY, 1, 1)).hasSize(1);
        assertThat(fixture.recipients.recipients(OWNER, ACTIVITY, 1, 2)).isEmpty();
    }

    @Test
    void unknownSplitIsEmpty() {
        assertThat(fixture.recipients.recipients(OWNER, ACTIVITY, 1, 1)).isEmpty();
        assertThat(fixture.recipients.recipientsLatest(OWNER, ACTIVITY, 7)).isEmpty();
    }

    @Test
    void fullUnitIsAccepted() {
        fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, List.of(R1), List.of(Precision.ONE));

        assertThat(fixture.recipients.recipientsLatest(OWNER, ACTIVITY, 1))
                .containsExactly(new RecipientShare(R1, Precision.ONE));
    }

    @Test
    void invalidSplitsAreRejected() {
        assertRejected(() -> fixture.recipients.setRecipients(ACTIVITY, 1, R1, List.of(R2), List.of(THIRTY_PERCENT)),
                ErrorCode.NOT_GROUP_OWNER);
        assertRejected(() -> fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, List.of(R1, R2), List.of(THIRTY_PERCENT)),
                ErrorCode.ARRAY_LENGTH_MISMATCH);
        assertRejected(() -> fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, List.of(Address.ZERO), List.of(THIRTY_PERCENT)),
                ErrorCode.ZERO_ADDRESS);
        assertRejected(() -> fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, List.of(R1), List.of(BigInteger.ZERO)),
                ErrorCode.ZERO_BASIS_POINTS);
        assertRejected(() -> fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, List.of(OWNER), List.of(THIRTY_PERCENT)),
                ErrorCode.RECIPIENT_CANNOT_BE_SELF);
        assertRejected(() -> fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, List.of(R1, R1), List.of(THIRTY_PERCENT, THIRTY_PERCENT)),
                ErrorCode.DUPLICATE_RECIPIENT);
        assertRejected(() -> fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, List.of(R1, R2), List.of(Precision.ONE, BigInteger.ONE)),
                ErrorCode.INVALID_BASIS_POINTS);

        assertThat(fixture.recipients.recipientsLatest(OWNER, ACTIVITY, 1)).isEmpty();
    }

    @Test
    void recipientCountIsBounded() {
        RecipientRegistry registry = new RecipientRegistry(fixture.groups, fixture.clock, 2);
        List<Address> three = List.of(R1, R2, account(13));
        List<BigInteger> shares = List.of(BigInteger.ONE, BigInteger.ONE, BigInteger.ONE);

        assertRejected(() -> registry.setRecipients(ACTIVITY, 1, OWNER, three, shares), ErrorCode.TOO_MANY_RECIPIENTS);
        assertThat(registry.getMaxRecipients()).isEqualTo(2);
    }

    @Test
    void defaultLimitAllowsTenRecipients() {
        List<Address> accounts = new ArrayList<>();
        List<BigInteger> shares = new ArrayList<>();
        for (int i = 0; i < RecipientRegistry.DEFAULT_MAX_RECIPIENTS + 1; i++) {
            accounts.add(account(100 + i));
            shares.add(percent(5));
        }

        assertRejected(() -> fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, accounts, shares),
                ErrorCode.TOO_MANY_RECIPIENTS);
        fixture.recipients.setRecipients(ACTIVITY, 1, OWNER, accounts.subList(0, 10), shares.subList(0, 10));
        assertThat(fixture.recipients.recipientsLatest(OWNER, ACTIVITY, 1)).hasSize(10);
    }

    @Test
    void nonPositiveLimitIsRejected() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new RecipientRegistry(fixture.groups, fixture.clock, 0));
    }

    static BigInteger percent(long value) {
        return Precision.ONE.multiply(BigInteger.valueOf(value)).divide(BigInteger.valueOf(100));
    }
}
