package com.guildpool.core.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A recipient and the fraction of a group's reward routed to it, in {@link Precision#ONE} units.
 */
public record RecipientShare(Address recipient, BigInteger basisPoints) {

    public RecipientShare {
        Objects.requireNonNull(recipient, "Recipient cannot be null");
        Objects.requireNonNull(basisPoints, "Basis points cannot be null");
    }
}
