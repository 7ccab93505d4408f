package com.flagship.pawn_ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure classes of ledger operations.
 *
 * VALIDATION, REFERENTIAL and STATE_CONFLICT are raised before anything is
 * written and are safe to correct and resubmit. CONSISTENCY means an internal
 * invariant broke; the surrounding transaction is rolled back.
 */
public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST),
    REFERENTIAL(HttpStatus.NOT_FOUND),
    STATE_CONFLICT(HttpStatus.CONFLICT),
    CONSISTENCY(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
