package com.fintech.strategyengine.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Explicit map of strategy identifiers to implementations, built once at startup from every
 * {@link TradingStrategy} bean. Lookups are case-sensitive.
 */
@Component
public class StrategyCatalog {

    private static final Logger log = LoggerFactory.getLogger(StrategyCatalog.class);

    private final Map<String, TradingStrategy> strategies;

    public StrategyCatalog(List<TradingStrategy> implementations) {
        Map<String, TradingStrategy> byId = new TreeMap<>();
        for (TradingStrategy strategy : implementations) {
            TradingStrategy previous = byId.putIfAbsent(strategy.id(), strategy);
            if (previous != null) {
                throw new IllegalStateException(
                    "Duplicate strategy id '" + strategy.id() + "': "
                        + previous.getClass().getName() + " and " + strategy.getClass().getName()
                );
            }
        }
        this.strategies = Collections.unmodifiableMap(byId);
        log.info("Strategy catalog loaded: {}", strategies.keySet());
    }

    /**
     * Resolves a strategy by identifier.
     *
     * @throws UnknownStrategyException if no strategy has that identifier
     */
    public TradingStrategy resolve(String strategyId) {
        TradingStrategy strategy = strategies.get(strategyId);
        if (strategy == null) {
            throw new UnknownStrategyException(strategyId, strategies.keySet());
        }
        return strategy;
    }

    public boolean contains(String strategyId) {
        return strategies.containsKey(strategyId);
    }

    public Set<String> ids() {
        return strategies.keySet();
    }

    /**
     * No strategy is registered under the requested identifier.
     */
    public static class UnknownStrategyException extends RuntimeException {
        public UnknownStrategyException(String strategyId, Set<String> known) {
            super("Unknown strategy '" + strategyId + "'. Known strategies: " + known);
        }
    }
}
