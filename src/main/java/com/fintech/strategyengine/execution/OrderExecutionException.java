package com.fintech.strategyengine.execution;

/**
 * Order placement failed at the broker or in transport.
 */
public class OrderExecutionException extends RuntimeException {

    public OrderExecutionException(String message) {
        super(message);
    }

    public OrderExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
