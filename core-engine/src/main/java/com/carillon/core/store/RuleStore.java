package com.carillon.core.store;

import com.carillon.core.model.ChimeRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered, live-editable collection of {@link ChimeRule}s shared by the
 * editor and the playout loop.
 *
 * <p>
 * Positions are 1-based, matching the line numbers the operator sees.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Every operation runs under a single {@link ReentrantLock}, so mutations are
 * applied in the order they are issued and never partially. Readers iterate
 * the copy returned by {@link #snapshot()}, never the live list. The lock is
 * never held while calling out of this class.
 * </p>
 *
 * <p>
 * The store does not validate rule contents; callers hand it rules that were
 * already validated.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleStore {

    private static final Logger LOG = LoggerFactory.getLogger(RuleStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<ChimeRule> rules = new ArrayList<>();

    public RuleStore() {
    }

    /**
     * @param initialRules rules to seed the store with, in order
     */
    public RuleStore(List<ChimeRule> initialRules) {
        replaceAll(initialRules);
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * Return a point-in-time copy of all rules in position order.
     *
     * @return unmodifiable copy; later mutations do not affect it
     */
    public List<ChimeRule> snapshot() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(rules));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return current number of rules
     */
    public int size() {
        lock.lock();
        try {
            return rules.size();
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Mutations
    // ---------------------------------------------------------------

    /**
     * Insert or replace a rule.
     *
     * <p>
     * A position past the end appends; any other position replaces the rule
     * found there.
     * </p>
     *
     * @param position 1-based position; must be &gt;= 1
     * @param rule     the rule; must not be {@code null}
     * @throws IllegalArgumentException if {@code position} &lt; 1
     */
    public void upsertAt(int position, ChimeRule rule) {
        Objects.requireNonNull(rule, "Rule must not be null");
        if (position < 1) {
            throw new IllegalArgumentException("Position must be >= 1, got: " + position);
        }
        lock.lock();
        try {
            if (position > rules.size()) {
                rules.add(rule);
                LOG.debug("Appended rule at line {}: {}", rules.size(), rule);
            } else {
                ChimeRule previous = rules.set(position - 1, rule);
                LOG.debug("Replaced line {}: {} -> {}", position, previous, rule);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Delete the rule at a position. Later rules move up by one.
     *
     * @param position 1-based position
     * @return the deleted rule
     * @throws RuleNotFoundException if the store is empty or {@code position}
     *                               does not address a rule; the store is
     *                               left unchanged
     */
    public ChimeRule deleteAt(int position) throws RuleNotFoundException {
        lock.lock();
        try {
            if (position < 1 || position > rules.size()) {
                throw new RuleNotFoundException(position, rules.size());
            }
            ChimeRule removed = rules.remove(position - 1);
            LOG.debug("Deleted line {}: {}", position, removed);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Best-effort removal of a rule that failed at playout time.
     *
     * <p>
     * Removes the rule at {@code lastKnownPosition} if that slot still holds
     * the very same instance. Otherwise positions have shifted since the
     * snapshot was taken, and the first slot holding that instance is removed
     * instead. Rules are compared by identity so an equal rule entered
     * separately by the operator is left alone.
     * </p>
     *
     * @param lastKnownPosition 1-based position in the snapshot that was
     *                          evaluated
     * @param rule              the failing rule instance
     * @return {@code true} if a rule was removed, {@code false} if it was
     *         already gone
     */
    public boolean removeFaulted(int lastKnownPosition, ChimeRule rule) {
        lock.lock();
        try {
            int index = lastKnownPosition - 1;
            if (index >= 0 && index < rules.size() && rules.get(index) == rule) {
                rules.remove(index);
                return true;
            }
            for (int i = 0; i < rules.size(); i++) {
                if (rules.get(i) == rule) {
                    rules.remove(i);
                    LOG.debug("Faulted rule moved from line {} to line {} before removal",
                            lastKnownPosition, i + 1);
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the whole content of the store, as done once at startup.
     *
     * @param newRules rules in position order; must not be {@code null}
     */
    public void replaceAll(List<ChimeRule> newRules) {
        Objects.requireNonNull(newRules, "Rules list must not be null");
        List<ChimeRule> copy = new ArrayList<>(newRules);
        copy.forEach(r -> Objects.requireNonNull(r, "Rule must not be null"));
        lock.lock();
        try {
            rules.clear();
            rules.addAll(copy);
        } finally {
            lock.unlock();
        }
        LOG.info("Rule store seeded with {} rule(s)", copy.size());
    }
}
