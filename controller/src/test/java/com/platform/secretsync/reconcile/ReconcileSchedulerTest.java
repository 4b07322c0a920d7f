package com.platform.secretsync.reconcile;

import com.platform.secretsync.TestSpecs;
import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.crd.SecretManagerConfig;
import com.platform.secretsync.crd.SyncTargetKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReconcileSchedulerTest {

    private static final SyncTargetKey TARGET = new SyncTargetKey("team-a", "billing");

    private ThreadPoolTaskScheduler taskScheduler;
    private ReconciliationEngine engine;
    private ReconcileScheduler scheduler;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(4);
        taskScheduler.setThreadNamePrefix("reconcile-test-");
        taskScheduler.initialize();

        SecretSyncProperties properties = new SecretSyncProperties();
        properties.getReconciler().setInitialBackoff(Duration.ofMillis(50));
        properties.getReconciler().setMaxBackoff(Duration.ofMillis(200));
        engine = mock(ReconciliationEngine.class);
        scheduler = new ReconcileScheduler(taskScheduler, engine, new SyncTargetValidator(), properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        taskScheduler.shutdown();
    }

    @Test
    void wakeupsDuringRunCollapseIntoOneFollowUp() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        AtomicInteger runs = new AtomicInteger();
        when(engine.reconcile(any())).thenAnswer(invocation -> {
            maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
            try {
                if (runs.incrementAndGet() == 1) {
                    started.countDown();
                    release.await(5, TimeUnit.SECONDS);
                }
                return ReconcileOutcome.synced(true, 0, "in sync");
            } finally {
                concurrent.decrementAndGet();
            }
        });

        scheduler.upsert(resource(1, null));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        scheduler.wake(TARGET, ReconcileScheduler.WakeReason.SOURCE_CHANGED);
        scheduler.wake(TARGET, ReconcileScheduler.WakeReason.MANUAL);
        scheduler.wake(TARGET, ReconcileScheduler.WakeReason.CREDENTIAL_CHANGED);
        assertThat(scheduler.isRunning(TARGET)).isTrue();
        release.countDown();

        verify(engine, timeout(5000).times(2)).reconcile(any());
        verify(engine, after(300).times(2)).reconcile(any());
        assertThat(maxConcurrent.get()).isEqualTo(1);
        assertThat(scheduler.awaitIdle(Duration.ofSeconds(5))).isTrue();
    }

    @Test
    void transientFailureIsRetriedWithBackoff() {
        when(engine.reconcile(any()))
            .thenReturn(ReconcileOutcome.of(ReconcileOutcome.Result.RETRY, false, "source not ready"));

        scheduler.upsert(resource(1, null));

        verify(engine, timeout(5000).atLeast(3)).reconcile(any());
    }

    @Test
    void targetWithoutSpecRunsOnceWithoutRescheduling() throws InterruptedException {
        when(engine.reconcile(any())).thenReturn(ReconcileOutcome.synced(true, 0, "in sync"));
        SecretManagerConfig resource = resource(1, null);
        resource.setSpec(null);

        scheduler.upsert(resource);

        verify(engine, timeout(5000).times(1)).reconcile(any());
        verify(engine, after(300).times(1)).reconcile(any());
        assertThat(scheduler.awaitIdle(Duration.ofSeconds(5))).isTrue();
    }

    @Test
    void configurationErrorWaitsForSpecChange() {
        when(engine.reconcile(any()))
            .thenReturn(ReconcileOutcome.of(ReconcileOutcome.Result.CONFIG_ERROR, false, "bad interval"));

        scheduler.upsert(resource(1, null));
        verify(engine, after(500).times(1)).reconcile(any());

        scheduler.upsert(resource(2, null));
        verify(engine, timeout(5000).times(2)).reconcile(any());
    }

    @Test
    void upsertWakesOnlyOnGenerationOrReconcileRequest() {
        when(engine.reconcile(any())).thenReturn(ReconcileOutcome.synced(true, 0, "in sync"));

        scheduler.upsert(resource(1, null));
        verify(engine, timeout(5000).times(1)).reconcile(any());

        scheduler.upsert(resource(1, null));
        verify(engine, after(300).times(1)).reconcile(any());

        scheduler.upsert(resource(1, "2024-05-01T10:00:00Z"));
        verify(engine, timeout(5000).times(2)).reconcile(any());
    }

    @Test
    void credentialChangeReusesSnapshotWhileSourceChangeForcesPull() {
        when(engine.reconcile(any())).thenReturn(ReconcileOutcome.synced(true, 0, "in sync"));
        scheduler.upsert(resource(1, null));
        verify(engine, timeout(5000).times(1)).reconcile(any());

        scheduler.wake(TARGET, ReconcileScheduler.WakeReason.CREDENTIAL_CHANGED);
        verify(engine, timeout(5000).times(2)).reconcile(any());
        scheduler.wake(TARGET, ReconcileScheduler.WakeReason.SOURCE_CHANGED);
        verify(engine, timeout(5000).times(3)).reconcile(any());

        ArgumentCaptor<ReconcileRequest> captor = ArgumentCaptor.forClass(ReconcileRequest.class);
        verify(engine, timeout(5000).times(3)).reconcile(captor.capture());
        List<ReconcileRequest> requests = captor.getAllValues();
        assertThat(requests).extracting(ReconcileRequest::pullDue).containsExactly(true, false, true);
    }

    @Test
    void removeCancelsAndForgetsAfterRunningTask() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(engine.reconcile(any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            ReconcileRequest request = invocation.getArgument(0);
            return request.token().isCancelled()
                ? ReconcileOutcome.of(ReconcileOutcome.Result.CANCELLED, false, "cancelled")
                : ReconcileOutcome.synced(true, 0, "in sync");
        });
        scheduler.upsert(resource(1, null));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        scheduler.remove(TARGET);
        verify(engine, never()).forget(TARGET);
        release.countDown();

        verify(engine, timeout(5000)).forget(TARGET);
        assertThat(scheduler.knownTargets()).isEmpty();
        assertThat(scheduler.wake(TARGET, ReconcileScheduler.WakeReason.MANUAL)).isFalse();
    }

    @Test
    void stoppedSchedulerRejectsWakeups() {
        when(engine.reconcile(any())).thenReturn(ReconcileOutcome.synced(true, 0, "in sync"));
        scheduler.upsert(resource(1, null));
        verify(engine, timeout(5000).times(1)).reconcile(any());

        scheduler.stop();

        assertThat(scheduler.wake(TARGET, ReconcileScheduler.WakeReason.MANUAL)).isFalse();
        assertThat(scheduler.targetsMatching(resource -> true)).containsExactly(TARGET);
    }

    private static SecretManagerConfig resource(long generation, String reconcileRequest) {
        SecretManagerConfig resource = TestSpecs.resource(TARGET.namespace(), TARGET.name(), generation,
            TestSpecs.gcp("prod"));
        if (reconcileRequest != null) {
            resource.getMetadata().setAnnotations(Map.of(SecretManagerConfig.RECONCILE_ANNOTATION, reconcileRequest));
        }
        return resource;
    }
}
