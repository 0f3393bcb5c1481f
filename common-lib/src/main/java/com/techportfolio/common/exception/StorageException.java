package com.techportfolio.common.exception;

public class StorageException extends PortfolioException {

    private final String operation;
    private final long attempts;

    public StorageException(String operation, long attempts, Throwable cause) {
        super(ErrorKind.STORAGE,
              "Storage operation '" + operation + "' failed after " + attempts + " attempt(s)", cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public long getAttempts() {
        return attempts;
    }
}
