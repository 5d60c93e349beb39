package com.fintech.strategyengine.execution;

import com.fintech.strategyengine.domain.Signal;

/**
 * Fire-and-forget consumer of strategy signals.
 * Implementations must return quickly and never throw back into the dispatcher.
 */
public interface SignalSink {

    void emit(String instrumentId, Signal signal);
}
