package com.fintech.strategyengine.dispatch;

import com.fintech.strategyengine.domain.SeriesKey;
import com.fintech.strategyengine.domain.StrategyRegistration;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Table of active strategy registrations, at most one per series key.
 *
 * Copy-on-write: every mutation publishes a new immutable map through a volatile field,
 * so {@link #find} never locks and always sees a whole table, either before or after
 * a given mutation.
 */
@Component
public class StrategyRegistry {

    private final ReentrantLock mutationLock = new ReentrantLock();
    private volatile Map<SeriesKey, StrategyRegistration> registrations = Map.of();

    public Optional<StrategyRegistration> find(SeriesKey key) {
        return Optional.ofNullable(registrations.get(key));
    }

    /**
     * Inserts or replaces the registration for its key.
     *
     * @return the registration it replaced, if any
     */
    public Optional<StrategyRegistration> put(StrategyRegistration registration) {
        mutationLock.lock();
        try {
            Map<SeriesKey, StrategyRegistration> next = new HashMap<>(registrations);
            StrategyRegistration previous = next.put(registration.key(), registration);
            registrations = Collections.unmodifiableMap(next);
            return Optional.ofNullable(previous);
        } finally {
            mutationLock.unlock();
        }
    }

    public Optional<StrategyRegistration> remove(SeriesKey key) {
        mutationLock.lock();
        try {
            if (!registrations.containsKey(key)) {
                return Optional.empty();
            }
            Map<SeriesKey, StrategyRegistration> next = new HashMap<>(registrations);
            StrategyRegistration previous = next.remove(key);
            registrations = Collections.unmodifiableMap(next);
            return Optional.ofNullable(previous);
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Drops every registration in one step.
     *
     * @return the number of registrations removed
     */
    public int clear() {
        mutationLock.lock();
        try {
            int removed = registrations.size();
            registrations = Map.of();
            return removed;
        } finally {
            mutationLock.unlock();
        }
    }

    /** Returns registrations ordered by key. */
    public List<StrategyRegistration> list() {
        List<StrategyRegistration> snapshot = new ArrayList<>(registrations.values());
        snapshot.sort((a, b) -> a.key().compareTo(b.key()));
        return snapshot;
    }

    public int size() {
        return registrations.size();
    }
}
