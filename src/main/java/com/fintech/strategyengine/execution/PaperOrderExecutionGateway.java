package com.fintech.strategyengine.execution;

import com.fintech.strategyengine.domain.OrderRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Gateway used when no broker integration is configured: logs the order and
 * returns a locally generated id.
 */
public class PaperOrderExecutionGateway implements OrderExecutionGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperOrderExecutionGateway.class);

    private final AtomicLong sequence = new AtomicLong(0);

    @Override
    public String placeOrder(OrderRequest request) {
        String orderId = "PAPER-" + sequence.incrementAndGet();
        log.info("Paper order placed: id={}, instrument={}, side={}, quantity={}",
                 orderId, request.instrumentId(), request.side(), request.quantity());
        return orderId;
    }
}
