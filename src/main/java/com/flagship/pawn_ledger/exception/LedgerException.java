package com.flagship.pawn_ledger.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * Base exception for ledger operations.
 *
 * Carries a machine-readable {@code errorCode} and the {@link ErrorKind} that
 * decides how the failure is reported to callers.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;
    private final String errorCode;
    private final Map<String, String> details;

    protected LedgerException(ErrorKind kind, String errorCode, String message) {
        this(kind, errorCode, message, Collections.emptyMap());
    }

    protected LedgerException(ErrorKind kind, String errorCode, String message, Map<String, String> details) {
        super(message);
        this.kind = kind;
        this.errorCode = errorCode;
        this.details = details == null ? Collections.emptyMap() : Map.copyOf(details);
    }

    protected LedgerException(ErrorKind kind, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.errorCode = errorCode;
        this.details = Collections.emptyMap();
    }
}
