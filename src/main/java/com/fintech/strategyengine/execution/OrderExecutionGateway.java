package com.fintech.strategyengine.execution;

import com.fintech.strategyengine.domain.OrderRequest;

/**
 * Broker-side order placement. Implementations may block on network I/O.
 */
public interface OrderExecutionGateway {

    /**
     * Places a market order.
     *
     * @return broker order id
     * @throws OrderExecutionException if the broker rejects or cannot be reached
     */
    String placeOrder(OrderRequest request);
}
