package com.guildpool.api.error;

import com.guildpool.core.domain.GuildpoolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine rejections to HTTP responses: authorization failures to 403,
 * malformed requests to 400 and operations the current state does not allow to 409.
 */
@RestControllerAdvice
public class GuildpoolExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GuildpoolExceptionHandler.class);

    @ExceptionHandler(GuildpoolException.class)
    public ResponseEntity<ErrorResponse> handleRejected(GuildpoolException e) {
        HttpStatus status = switch (e.getCode().category()) {
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case STATE -> HttpStatus.CONFLICT;
        };
        log.debug("Rejected with {}: {}", e.getCode(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.getCode().name(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("CONFLICT", e.getMessage()));
    }
}
