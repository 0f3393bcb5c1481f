package com.techportfolio.common.exception;

public abstract class PortfolioException extends RuntimeException {

    private final ErrorKind kind;

    protected PortfolioException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PortfolioException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
