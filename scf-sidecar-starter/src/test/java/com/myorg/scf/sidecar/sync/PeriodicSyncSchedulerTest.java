package com.myorg.scf.sidecar.sync;

import com.myorg.scf.contracts.core.exception.DiscoveryException;
import com.myorg.scf.contracts.core.exception.StoreUnavailableException;
import com.myorg.scf.contracts.registry.ServiceMetadataRecord;
import com.myorg.scf.sidecar.FakeCoordinationClient;
import com.myorg.scf.sidecar.config.ServiceSecrets;
import com.myorg.scf.sidecar.config.ServiceSettings;
import com.myorg.scf.sidecar.config.SyncProperties;
import com.myorg.scf.sidecar.observability.SyncMetrics;
import com.myorg.scf.sidecar.registry.ServiceRegistrar;
import com.myorg.scf.sidecar.retry.RetryPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class PeriodicSyncSchedulerTest {

    private FakeCoordinationClient client;
    private ServiceSettings settings;
    private ServiceSecrets secrets;
    private SyncProperties props;
    private SimpleMeterRegistry meters;
    private PeriodicSyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        client = new FakeCoordinationClient();
        client.discovery = () -> ServiceMetadataRecord.builder()
                .serviceId("svc")
                .configStoreName("configstore")
                .secretStoreName("secretstore")
                .stateStoreName("statestore")
                .build();

        settings = new ServiceSettings();
        settings.setName("svc");
        settings.setMaxSyncInterval(Duration.ofMillis(20));
        secrets = new ServiceSecrets();
        secrets.setName("svc");

        props = new SyncProperties();
        props.setWarmUpDelay(Duration.ZERO);
        props.setSettleDelay(Duration.ZERO);
        props.setShutdownTimeout(Duration.ofSeconds(5));

        meters = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) scheduler.stop();
    }

    private PeriodicSyncScheduler scheduler(List<DependentRuntime> runtimes) {
        return scheduler(runtimes, RetryPolicy.builder()
                .name("discovery")
                .maxAttempts(1)
                .retryOn(StoreUnavailableException.class)
                .build());
    }

    private PeriodicSyncScheduler scheduler(List<DependentRuntime> runtimes, RetryPolicy discovery) {
        SyncMetrics metrics = new SyncMetrics(meters, "svc");
        metrics.preRegister();
        ServiceRegistrar registrar = new ServiceRegistrar(client, settings, discovery, metrics);
        SettingsSynchronizer synchronizer = new SettingsSynchronizer(client, settings, secrets,
                ServiceSettings.syncFields(), ServiceSecrets.syncFields(), props, metrics);
        return new PeriodicSyncScheduler(registrar, synchronizer, runtimes, settings, props, metrics, new Random(42));
    }

    private DependentRuntime recordingRuntime(String name, AtomicInteger starts, boolean failing) {
        return new DependentRuntime() {
            @Override public String name() { return name; }

            @Override public void start() {
                starts.incrementAndGet();
                client.calls.add("runtime:" + name);
                if (failing) throw new IllegalStateException("sidecar not ready");
            }
        };
    }

    @Test
    void firstRound_runsBootstrapThenConfigThenSecretsThenRuntimes() {
        AtomicInteger starts = new AtomicInteger();
        scheduler = scheduler(List.of(recordingRuntime("workflow", starts, false)));

        scheduler.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> scheduler.completedRounds() >= 2);

        assertThat(client.callsSnapshot().subList(0, 7)).containsExactly(
                "discover", "register", "config", "secrets", "runtime:workflow", "config", "secrets");
        assertThat(settings.getConfigstoreName()).isEqualTo("configstore");
    }

    @Test
    void stopWhileSleeping_issuesNoFurtherCalls() {
        settings.setMaxSyncInterval(Duration.ofHours(1));
        scheduler = scheduler(List.of());

        scheduler.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> scheduler.completedRounds() == 1);

        long t0 = System.nanoTime();
        scheduler.stop();
        assertThat(Duration.ofNanos(System.nanoTime() - t0)).isLessThan(Duration.ofSeconds(2));
        assertThat(scheduler.isRunning()).isFalse();

        List<String> afterStop = client.callsSnapshot();
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1))
                .until(() -> client.calls.size() == afterStop.size());
        assertThat(afterStop).containsExactly("discover", "register", "config", "secrets");
    }

    @Test
    void stopDuringWarmUp_neverTouchesSidecar() {
        props.setWarmUpDelay(Duration.ofHours(1));
        scheduler = scheduler(List.of());

        scheduler.start();
        scheduler.stop();

        assertThat(client.calls).isEmpty();
    }

    @Test
    void stopDuringDiscoveryBackoff_abandonsRetriesAndNeverRegisters() {
        AtomicInteger attempts = new AtomicInteger();
        ServiceMetadataRecord ready = client.discovery.get();
        client.discovery = () -> {
            if (attempts.incrementAndGet() <= 2) throw new StoreUnavailableException("Discovery: sidecar unreachable");
            return ready;
        };
        scheduler = scheduler(List.of(), RetryPolicy.builder()
                .name("discovery")
                .maxAttempts(10)
                .baseDelay(Duration.ofMillis(500))
                .backoffFactor(2.0)
                .retryOn(StoreUnavailableException.class)
                .build());

        scheduler.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> client.calls.contains("discover"));

        long t0 = System.nanoTime();
        scheduler.stop();
        assertThat(Duration.ofNanos(System.nanoTime() - t0)).isLessThan(Duration.ofMillis(400));

        await().during(Duration.ofMillis(1_500)).atMost(Duration.ofSeconds(3))
                .until(() -> client.calls.size() == 1);
        assertThat(client.calls).containsExactly("discover");
        assertThat(client.registered).isEmpty();
        assertThat(meters.get(SyncMetrics.STEP_FAILED).tag("step", "bootstrap").counter().count()).isZero();
    }

    @Test
    void restartAfterTimedOutStop_keepsASingleWorker() throws Exception {
        props.setShutdownTimeout(Duration.ofMillis(100));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean blocking = new AtomicBoolean(true);
        DependentRuntime stuck = new DependentRuntime() {
            @Override public String name() { return "stuck"; }

            @Override public void start() {
                if (!blocking.get()) return;
                entered.countDown();
                boolean interrupted = false;
                while (true) {
                    try {
                        release.await();
                        break;
                    } catch (InterruptedException e) {
                        interrupted = true;
                    }
                }
                if (interrupted) Thread.currentThread().interrupt();
            }
        };
        scheduler = scheduler(List.of(stuck));

        scheduler.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        scheduler.stop();

        assertThat(scheduler.isRunning()).isFalse();
        assertThatThrownBy(scheduler::start).isInstanceOf(IllegalStateException.class);
        assertThat(syncWorkers()).isEqualTo(1);

        blocking.set(false);
        release.countDown();
        await().atMost(Duration.ofSeconds(5)).until(() -> syncWorkers() == 0);
        // the released worker was already cancelled and issued nothing more
        assertThat(client.callsSnapshot()).containsExactly("discover", "register", "config", "secrets");

        scheduler.start();
        long before = scheduler.completedRounds();
        await().atMost(Duration.ofSeconds(5)).until(() -> scheduler.completedRounds() >= before + 3);
        assertThat(syncWorkers()).isEqualTo(1);
        assertThat(client.callsSnapshot().stream().filter("discover"::equals).count()).isEqualTo(2);
    }

    private static long syncWorkers() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(t -> t.isAlive() && "scf-periodic-sync".equals(t.getName()))
                .count();
    }

    @Test
    void failingRuntime_doesNotStopTheLoop() {
        AtomicInteger starts = new AtomicInteger();
        scheduler = scheduler(List.of(recordingRuntime("workflow", starts, true)));

        scheduler.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> starts.get() >= 3);

        assertThat(meters.get(SyncMetrics.STEP_FAILED).tag("step", "runtime").counter().count()).isGreaterThanOrEqualTo(3.0);
    }

    @Test
    void failedBootstrap_degradesToLocalDefaults() {
        client.discovery = () -> { throw new DiscoveryException("Metadata parse error: missing 'components'"); };
        scheduler = scheduler(List.of());

        scheduler.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> scheduler.completedRounds() >= 3);

        // no store discovered: the sync steps are skipped, not retried
        assertThat(client.calls).containsExactly("discover");
        assertThat(settings.getDebug()).isNull();
        assertThat(meters.get(SyncMetrics.STEP_FAILED).tag("step", "bootstrap").counter().count()).isEqualTo(1.0);
    }

    @Test
    void syncedValues_reachSettings() {
        client.config.put("svc_DEBUG", "yes");
        client.secrets.put("PSQL_PASSWORD", "s3cret");
        scheduler = scheduler(List.of());

        scheduler.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> scheduler.completedRounds() >= 1);

        assertThat(settings.isDebugEnabled()).isTrue();
        assertThat(secrets.getDatabasePassword()).isEqualTo("s3cret");
        assertThat(meters.get(SyncMetrics.CONFIG_SYNCED).counter().count()).isGreaterThanOrEqualTo(1.0);
    }

    @Test
    void nextInterval_staysWithinNinetyToHundredPercentOfMax() {
        settings.setMaxSyncInterval(Duration.ofSeconds(100));
        scheduler = scheduler(List.of());

        List<Duration> samples = new ArrayList<>();
        for (int i = 0; i < 1_000; i++) samples.add(scheduler.nextInterval());

        assertThat(samples).allSatisfy(d -> assertThat(d)
                .isGreaterThanOrEqualTo(Duration.ofSeconds(90))
                .isLessThanOrEqualTo(Duration.ofSeconds(100)));
        assertThat(samples.stream().distinct().count()).isGreaterThan(1);
    }

    @Test
    void nonPositiveInterval_isRejectedOnStart() {
        settings.setMaxSyncInterval(Duration.ZERO);
        PeriodicSyncScheduler s = scheduler(List.of());

        assertThatThrownBy(s::start).isInstanceOf(IllegalStateException.class);
        assertThat(s.isRunning()).isFalse();
    }
}
