package com.techportfolio.common.exception;

public class OverflowException extends PortfolioException {

    private final int capacity;

    public OverflowException(int capacity, Throwable cause) {
        super(ErrorKind.OVERFLOW, "Subscriber buffer of " + capacity + " item(s) exceeded", cause);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
