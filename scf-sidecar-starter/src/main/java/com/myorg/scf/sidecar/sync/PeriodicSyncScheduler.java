package com.myorg.scf.sidecar.sync;

import com.myorg.scf.contracts.core.exception.StoreNotConfiguredException;
import com.myorg.scf.sidecar.config.ServiceSettings;
import com.myorg.scf.sidecar.config.SyncProperties;
import com.myorg.scf.sidecar.observability.SyncMdc;
import com.myorg.scf.sidecar.observability.SyncMetrics;
import com.myorg.scf.sidecar.registry.ServiceRegistrar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background loop: warm-up, bootstrap once, settle, then rounds of config sync, secret sync and
 * dependent runtime start, each followed by a pause drawn from {@code [0.9 * max, max]}.
 *
 * <p>A failing step is logged and the loop goes on. {@link #stop()} wakes a sleeping or backing-off worker
 * at once; a call already in flight is allowed to finish, and no further call is made after that.
 */
@Slf4j
public class PeriodicSyncScheduler implements SmartLifecycle {

    private final ServiceRegistrar registrar;
    private final SettingsSynchronizer synchronizer;
    private final List<DependentRuntime> runtimes;
    private final ServiceSettings settings;
    private final SyncProperties props;
    private final SyncMetrics metrics; // may be null
    private final Random random;

    private final AtomicLong rounds = new AtomicLong();
    private Worker worker;
    // worker that outlived the shutdown timeout of the previous stop()
    private Thread straggler;

    // each worker owns its latch so a restart never revives a cancelled one
    private static final class Worker {
        final CountDownLatch cancel = new CountDownLatch(1);
        Thread thread;
    }

    public PeriodicSyncScheduler(ServiceRegistrar registrar,
                                 SettingsSynchronizer synchronizer,
                                 List<DependentRuntime> runtimes,
                                 ServiceSettings settings,
                                 SyncProperties props,
                                 SyncMetrics metrics,
                                 Random random) {
        this.registrar = registrar;
        this.synchronizer = synchronizer;
        this.runtimes = List.copyOf(runtimes);
        this.settings = settings;
        this.props = props;
        this.metrics = metrics;
        this.random = random;
    }

    @Override
    public synchronized void start() {
        if (worker != null) return;
        if (straggler != null && straggler.isAlive()) {
            throw new IllegalStateException("Previous periodic sync worker is still running, cannot start another");
        }
        straggler = null;
        Duration max = settings.getMaxSyncInterval();
        if (max == null || max.isZero() || max.isNegative()) {
            throw new IllegalStateException("scf.service.max-sync-interval must be positive, was " + max);
        }
        Worker w = new Worker();
        Thread t = new Thread(() -> run(w.cancel), "scf-periodic-sync");
        t.setDaemon(true);
        w.thread = t;
        worker = w;
        t.start();
        log.info("Periodic sync started serviceId={} maxInterval={}", settings.getName(), max);
    }

    /**
     * Cancels the worker and waits up to the shutdown timeout. A blocking sidecar call in flight completes;
     * retry waits are interrupted and nothing new is issued afterwards.
     */
    @Override
    public void stop() {
        Worker w;
        synchronized (this) {
            w = worker;
            if (w == null) return;
            worker = null;
            w.cancel.countDown();
            w.thread.interrupt();
        }
        try {
            w.thread.join(props.getShutdownTimeout().toMillis());
            if (w.thread.isAlive()) {
                log.warn("Periodic sync still busy after {}, leaving it behind", props.getShutdownTimeout());
                synchronized (this) {
                    straggler = w.thread;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        for (DependentRuntime r : runtimes) {
            try {
                r.shutdown();
            } catch (RuntimeException e) {
                log.warn("Runtime {} shutdown failed", r.name(), e);
            }
        }
        synchronizer.close();
        log.info("Periodic sync stopped after {} round(s)", rounds.get());
    }

    @Override
    public synchronized boolean isRunning() {
        return worker != null;
    }

    @Override
    public boolean isAutoStartup() {
        return props.isEnabled();
    }

    public long completedRounds() {
        return rounds.get();
    }

    private static boolean isCancelled(CountDownLatch cancel) {
        return cancel.getCount() == 0 || Thread.currentThread().isInterrupted();
    }

    void run(CountDownLatch cancel) {
        if (!pause(cancel, props.getWarmUpDelay())) return;

        step(cancel, "bootstrap", () -> registrar.bootstrap(props.isRegister(), () -> isCancelled(cancel)));

        if (!pause(cancel, props.getSettleDelay())) return;

        while (!isCancelled(cancel)) {
            long round = rounds.get() + 1;
            SyncMdc.put(settings.getName(), round);
            try {
                runRound(cancel);
            } finally {
                SyncMdc.clear();
            }
            rounds.incrementAndGet();

            Duration next = nextInterval();
            log.debug("Next sync round in {}", next);
            if (!pause(cancel, next)) return;
        }
    }

    private void runRound(CountDownLatch cancel) {
        // order within a round: config, secrets, runtimes
        if (!step(cancel, "config", synchronizer::syncConfigurations)) return;
        if (!step(cancel, "secrets", synchronizer::syncSecrets)) return;

        for (DependentRuntime r : runtimes) {
            if (isCancelled(cancel)) return;
            try {
                r.start();
            } catch (Exception e) {
                if (metrics != null) metrics.incStepFailed("runtime");
                log.warn("Runtime {} failed to start, will try again next round", r.name(), e);
            }
        }
    }

    /** @return false when cancelled before the step could run */
    private boolean step(CountDownLatch cancel, String name, Runnable action) {
        if (isCancelled(cancel)) return false;
        try {
            action.run();
        } catch (StoreNotConfiguredException e) {
            log.debug("Skip {} step: {}", name, e.getMessage());
        } catch (RuntimeException e) {
            if (isCancelled(cancel)) {
                log.info("Sync step {} abandoned on shutdown: {}", name, e.toString());
                return false;
            }
            if (metrics != null) metrics.incStepFailed(name);
            log.warn("Sync step {} failed: {}", name, e.toString(), e);
        }
        return true;
    }

    Duration nextInterval() {
        long maxMs = settings.getMaxSyncInterval().toMillis();
        long minMs = (long) (maxMs * 0.9);
        return Duration.ofMillis(minMs + (long) (random.nextDouble() * (maxMs - minMs)));
    }

    /** @return false when woken by cancellation */
    private static boolean pause(CountDownLatch cancel, Duration d) {
        try {
            return !cancel.await(Math.max(0, d.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
