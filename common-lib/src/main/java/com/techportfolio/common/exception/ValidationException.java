package com.techportfolio.common.exception;

/**
 * Caller input or requested state transition violates a domain invariant.
 * {@code conflict} marks violations caused by existing state (duplicate names,
 * dependents still attached) rather than by malformed input.
 */
public class ValidationException extends PortfolioException {

    private final boolean conflict;

    public ValidationException(String message) {
        this(message, false);
    }

    public ValidationException(String message, boolean conflict) {
        super(ErrorKind.VALIDATION, message);
        this.conflict = conflict;
    }

    protected ValidationException(String message, boolean conflict, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
        this.conflict = conflict;
    }

    public boolean isConflict() {
        return conflict;
    }
}
