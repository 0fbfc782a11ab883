package com.guildpool.core.domain;

import java.util.Objects;

/**
 * Base type for rejected operations. The error code identifies the rejection; the message is for humans.
 */
public class GuildpoolException extends RuntimeException {

    private final ErrorCode code;

    protected GuildpoolException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "Error code cannot be null");
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * Builds the exception subtype matching the code's category.
     */
    public static GuildpoolException of(ErrorCode code, String message) {
        return switch (code.category()) {
            case AUTHORIZATION -> new UnauthorizedCallerException(code, message);
            case VALIDATION -> new InvalidRequestException(code, message);
            case STATE -> new IllegalRoundStateException(code, message);
        };
    }

    /**
     * Caller lacks the role the operation requires.
     */
    public static class UnauthorizedCallerException extends GuildpoolException {
        public UnauthorizedCallerException(ErrorCode code, String message) {
            super(code, message);
        }
    }

    /**
     * Malformed input, rejected before any state change.
     */
    public static class InvalidRequestException extends GuildpoolException {
        public InvalidRequestException(ErrorCode code, String message) {
            super(code, message);
        }
    }

    /**
     * Well-formed request that is illegal given the current state.
     */
    public static class IllegalRoundStateException extends GuildpoolException {
        public IllegalRoundStateException(ErrorCode code, String message) {
            super(code, message);
        }
    }
}
