package com.codewarden.core.scheduler;

import com.codewarden.core.metrics.CodewardenMetrics;
import com.codewarden.core.model.ChangeType;
import com.codewarden.core.watch.WatchProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Collapses bursts of change events per key into one delayed job.
 * <p>
 * Every event for a key re-arms its timer and replaces the pending change
 * type, so the job sees the last type observed. Per key there is at most one
 * pending timer or one running job: events that arrive while the job runs
 * mark the key dirty and the timer is re-armed when the job finishes.
 * Different keys fire independently: timers fire on a dedicated thread and
 * jobs run on a separate worker pool, so a slow job never delays another
 * key's timer.
 */
@Component
public class DebounceScheduler {

    private static final Logger log = LoggerFactory.getLogger(DebounceScheduler.class);

    /** The work to run once a key has been quiet for the delay. */
    @FunctionalInterface
    public interface Job {
        void run(String key, ChangeType type);
    }

    private static final class Entry {
        ScheduledFuture<?> timer;
        ChangeType type;
        Job job;
        long generation;
        boolean running;
        boolean dirty;
    }

    private final long delayMs;
    private final CodewardenMetrics metrics;
    private final ScheduledExecutorService timers;
    private final ExecutorService workers;
    private final Map<String, Entry> entries = new HashMap<>();
    private boolean shutdown;

    @Autowired
    public DebounceScheduler(WatchProperties properties, CodewardenMetrics metrics) {
        this(properties.getDebounceMs(), metrics);
    }

    DebounceScheduler(long delayMs, CodewardenMetrics metrics) {
        this.delayMs = delayMs;
        this.metrics = metrics;
        this.timers = Executors.newSingleThreadScheduledExecutor(daemonThreads("debounce-timer"));
        this.workers = Executors.newCachedThreadPool(daemonThreads("debounce-worker"));
    }

    /**
     * Records an event for {@code key} and (re-)arms its timer.
     */
    public synchronized void schedule(String key, ChangeType type, Job job) {
        if (shutdown) {
            log.debug("Scheduler stopped; dropping {} for {}", type, key);
            return;
        }
        Entry entry = entries.get(key);
        if (entry == null) {
            entry = new Entry();
            entries.put(key, entry);
        } else if (entry.timer != null || entry.running) {
            metrics.recordDebounceCollapse();
        }
        entry.type = type;
        entry.job = job;
        if (entry.running) {
            entry.dirty = true;
            return;
        }
        arm(key, entry);
    }

    /**
     * Drops the pending timer for {@code key}. A job already running completes
     * but is not re-armed unless a new event arrives meanwhile.
     */
    public synchronized void cancel(String key) {
        Entry entry = entries.get(key);
        if (entry != null) {
            disarm(entry);
            if (!entry.running) {
                entries.remove(key);
            }
        }
    }

    /**
     * Cancels every key accepted by {@code filter}, as {@link #cancel(String)} does.
     */
    public synchronized int cancelMatching(Predicate<String> filter) {
        var keys = new ArrayList<String>();
        for (String key : entries.keySet()) {
            if (filter.test(key)) {
                keys.add(key);
            }
        }
        keys.forEach(this::cancel);
        return keys.size();
    }

    /**
     * Drops every pending timer. Returns how many keys were pending or running.
     */
    public synchronized int cancelAll() {
        int cancelled = entries.size();
        entries.values().forEach(DebounceScheduler::disarm);
        entries.values().removeIf(entry -> !entry.running);
        return cancelled;
    }

    public synchronized boolean isPending(String key) {
        return entries.containsKey(key);
    }

    public synchronized int pendingCount() {
        return entries.size();
    }

    @PreDestroy
    public void shutdown() {
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            cancelAll();
        }
        timers.shutdownNow();
        workers.shutdownNow();
        log.info("Debounce scheduler stopped");
    }

    private void arm(String key, Entry entry) {
        long generation = ++entry.generation;
        entry.timer = timers.schedule(() -> fire(key, entry, generation), delayMs, TimeUnit.MILLISECONDS);
    }

    private static void disarm(Entry entry) {
        entry.generation++;
        entry.dirty = false;
        if (entry.timer != null) {
            entry.timer.cancel(false);
            entry.timer = null;
        }
    }

    private synchronized void fire(String key, Entry entry, long generation) {
        if (entries.get(key) != entry || entry.generation != generation) {
            return;
        }
        entry.timer = null;
        entry.running = true;
        Job job = entry.job;
        ChangeType type = entry.type;
        try {
            workers.execute(() -> runJob(key, entry, job, type));
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler stopped; dropping {} for {}", type, key);
            entry.running = false;
            entries.remove(key);
        }
    }

    private void runJob(String key, Entry entry, Job job, ChangeType type) {
        try {
            job.run(key, type);
        } catch (RuntimeException e) {
            log.error("Debounced job failed for {}: {}", key, e.getMessage(), e);
        } finally {
            synchronized (this) {
                entry.running = false;
                if (entry.dirty && !shutdown) {
                    entry.dirty = false;
                    arm(key, entry);
                } else {
                    entries.remove(key);
                }
            }
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
