package org.operaton.activslot.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Serializes plan writes per date and stamps each generation with an epoch.
 * <p>
 * A generation may only commit if no newer generation for the same date has committed before it
 * and no invalidation happened after it started.
 */
@Component
@Slf4j
public class PlanGenerationGuard {

    private final AtomicLong epochs = new AtomicLong();
    private final ConcurrentMap<LocalDate, Long> committedEpochs = new ConcurrentHashMap<>();
    private final ConcurrentMap<LocalDate, Object> locks = new ConcurrentHashMap<>();
    private volatile long invalidatedBefore;

    /**
     * Start a generation and return its epoch.
     */
    public long begin(LocalDate date) {
        long epoch = epochs.incrementAndGet();
        log.debug("Plan generation {} started for {}", epoch, date);
        return epoch;
    }

    /**
     * Run {@code writer} if the generation is still current.
     *
     * @return true if the write happened
     */
    public boolean commit(LocalDate date, long epoch, Runnable writer) {
        synchronized (lockFor(date)) {
            long committed = committedEpochs.getOrDefault(date, 0L);
            if (epoch <= committed || epoch <= invalidatedBefore) {
                log.warn("Discarding stale plan generation {} for {} (committed={}, invalidated before={})",
                    epoch, date, committed, invalidatedBefore);
                return false;
            }
            writer.run();
            committedEpochs.put(date, epoch);
            return true;
        }
    }

    /**
     * Run an in-place update of a stored plan while holding the date's lock.
     */
    public <T> T withLock(LocalDate date, Supplier<T> action) {
        synchronized (lockFor(date)) {
            return action.get();
        }
    }

    /**
     * Make every generation started so far uncommittable, e.g. after the preferences changed.
     */
    public void invalidateInFlight() {
        invalidatedBefore = epochs.get();
        log.debug("Invalidated plan generations up to epoch {}", invalidatedBefore);
    }

    /**
     * Drop commit history and locks for dates before {@code cutoff}.
     */
    public void forgetBefore(LocalDate cutoff) {
        committedEpochs.keySet().removeIf(date -> date.isBefore(cutoff));
        locks.keySet().removeIf(date -> date.isBefore(cutoff));
    }

    int trackedDates() {
        return locks.size();
    }

    private Object lockFor(LocalDate date) {
        return locks.computeIfAbsent(date, d -> new Object());
    }
}
