package com.guildpool.core.domain;

/**
 * Every reason an operation can be rejected. Rejections never leave partial state behind.
 */
public enum ErrorCode {

    // Authorization
    ONLY_GROUP_OWNER(Category.AUTHORIZATION),
    NOT_VERIFIER(Category.AUTHORIZATION),
    NOT_GROUP_OWNER(Category.AUTHORIZATION),

    // Validation
    ARRAY_LENGTH_MISMATCH(Category.VALIDATION),
    TOO_MANY_RECIPIENTS(Category.VALIDATION),
    ZERO_ADDRESS(Category.VALIDATION),
    ZERO_BASIS_POINTS(Category.VALIDATION),
    INVALID_BASIS_POINTS(Category.VALIDATION),
    RECIPIENT_CANNOT_BE_SELF(Category.VALIDATION),
    DUPLICATE_RECIPIENT(Category.VALIDATION),
    DISTRUST_VOTE_ZERO_AMOUNT(Category.VALIDATION),
    INVALID_REASON(Category.VALIDATION),
    INVALID_TARGET(Category.VALIDATION),
    SCORE_OVERFLOW(Category.VALIDATION),
    ZERO_JOIN_AMOUNT(Category.VALIDATION),
    JOIN_AMOUNT_BELOW_MINIMUM(Category.VALIDATION),
    JOIN_AMOUNT_EXCEEDS_MAXIMUM(Category.VALIDATION),

    // Quota / state
    VERIFY_VOTES_ZERO(Category.STATE),
    DISTRUST_VOTE_EXCEEDS_VERIFY_VOTES(Category.STATE),
    NO_ACTIVE_GROUPS(Category.STATE),
    ROUND_NOT_FINISHED(Category.STATE),
    ALREADY_CLAIMED(Category.STATE),
    GROUP_NOT_ACTIVE(Category.STATE),
    GROUP_NOT_FOUND(Category.STATE),
    GROUP_ALREADY_ACTIVE(Category.STATE),
    GROUP_CAPACITY_REACHED(Category.STATE),
    ALREADY_IN_OTHER_GROUP(Category.STATE),
    NOT_GROUP_MEMBER(Category.STATE),
    NOT_JOINED(Category.STATE),
    INSUFFICIENT_POOL_BALANCE(Category.STATE);

    public enum Category {
        AUTHORIZATION,
        VALIDATION,
        STATE
    }

    private final Category category;

    ErrorCode(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
