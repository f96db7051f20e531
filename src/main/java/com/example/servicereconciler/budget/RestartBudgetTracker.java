package com.example.servicereconciler.budget;

import com.example.servicereconciler.domain.RestartBudget;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Sliding-window rate limiter for corrective actions, keyed by wall-clock time.
 * An action recorded at {@code t} stops counting once {@code now - t >= window}, so budget comes
 * back one action at a time rather than all at once at a boundary.
 * <p>
 * Mutated only by the thread running the current tick; methods are synchronized so the
 * operator API can read a consistent view.
 */
@Component
public class RestartBudgetTracker {

    private final Map<String, RestartBudget> budgets = new HashMap<>();
    private final Map<String, Deque<Instant>> history = new HashMap<>();

    public synchronized void configure(String serviceId, RestartBudget budget) {
        budgets.put(serviceId, budget);
        history.computeIfAbsent(serviceId, k -> new ArrayDeque<>());
    }

    /** Forgets services that are no longer registered. */
    public synchronized void retainOnly(Collection<String> serviceIds) {
        budgets.keySet().retainAll(serviceIds);
        history.keySet().retainAll(serviceIds);
    }

    public synchronized void record(String serviceId, Instant timestamp) {
        history.computeIfAbsent(serviceId, k -> new ArrayDeque<>()).addLast(timestamp);
    }

    public synchronized int remaining(String serviceId, Instant now) {
        RestartBudget budget = budgetOf(serviceId);
        Deque<Instant> entries = prune(serviceId, now, budget);
        return Math.max(0, budget.maxActions() - entries.size());
    }

    public synchronized boolean isQuarantined(String serviceId, Instant now) {
        return remaining(serviceId, now) == 0;
    }

    /** When the oldest counted action leaves the window, if any action is counted at all. */
    public synchronized Optional<Instant> nextRelease(String serviceId, Instant now) {
        RestartBudget budget = budgetOf(serviceId);
        Deque<Instant> entries = prune(serviceId, now, budget);
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.peekFirst().plus(budget.window()));
    }

    public synchronized int used(String serviceId, Instant now) {
        return prune(serviceId, now, budgetOf(serviceId)).size();
    }

    public synchronized void reset(String serviceId) {
        Deque<Instant> entries = history.get(serviceId);
        if (entries != null) entries.clear();
    }

    private Deque<Instant> prune(String serviceId, Instant now, RestartBudget budget) {
        Deque<Instant> entries = history.computeIfAbsent(serviceId, k -> new ArrayDeque<>());
        Instant cutoff = now.minus(budget.window());
        while (!entries.isEmpty() && !entries.peekFirst().isAfter(cutoff)) {
            entries.removeFirst();
        }
        return entries;
    }

    private RestartBudget budgetOf(String serviceId) {
        RestartBudget budget = budgets.get(serviceId);
        if (budget == null) {
            throw new IllegalStateException("No restart budget configured for service " + serviceId);
        }
        return budget;
    }
}
