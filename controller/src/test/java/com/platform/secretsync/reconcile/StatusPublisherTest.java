package com.platform.secretsync.reconcile;

import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.crd.SyncTargetStatus;
import com.platform.secretsync.observability.MetricsRegistry;
import com.platform.secretsync.state.SyncPhase;
import com.platform.secretsync.state.SyncStateMachine;
import com.platform.secretsync.state.SyncTargetContext;
import io.fabric8.kubernetes.api.model.Condition;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class StatusPublisherTest {

    private static final SyncTargetKey TARGET = new SyncTargetKey("team-a", "billing");

    private StatusWriter writer;
    private SyncStateMachine stateMachine;
    private StatusPublisher publisher;

    @BeforeEach
    void setUp() {
        writer = mock(StatusWriter.class);
        stateMachine = new SyncStateMachine(new MetricsRegistry(new SimpleMeterRegistry()));
        publisher = new StatusPublisher(writer, stateMachine);
        stateMachine.initialize(TARGET);
    }

    @Test
    void writesStatusOnEveryTransition() {
        publisher.record(TARGET, StatusPublisher.Details.of(3L)
            .withDecryption(List.of(), DecryptionStatus.SUCCESS, true));

        stateMachine.transition(TARGET, SyncPhase.PULLING, "Pulling source");

        ArgumentCaptor<SyncTargetStatus> captor = ArgumentCaptor.forClass(SyncTargetStatus.class);
        verify(writer, atLeastOnce()).write(eq(TARGET), captor.capture());
        SyncTargetStatus status = captor.getValue();
        assertThat(status.getPhase()).isEqualTo("Pulling");
        assertThat(status.getDescription()).isEqualTo("Pulling source");
        assertThat(status.getObservedGeneration()).isEqualTo(3L);
        assertThat(status.getDecryptionStatus()).isEqualTo("Success");
        assertThat(status.getSopsKeyAvailable()).isTrue();
        assertThat(status.getConditions()).singleElement()
            .satisfies(condition -> assertThat(condition.getStatus()).isEqualTo("Unknown"));
    }

    @Test
    void syncedWithoutFailedFilesIsReady() {
        Condition ready = StatusPublisher.readyCondition(synced(), StatusPublisher.Details.of(1L));

        assertThat(ready.getType()).isEqualTo(StatusPublisher.READY);
        assertThat(ready.getStatus()).isEqualTo("True");
        assertThat(ready.getReason()).isEqualTo("Synced");
        assertThat(ready.getObservedGeneration()).isEqualTo(1L);
    }

    @Test
    void syncedWithFailedFilesIsNotReady() {
        StatusPublisher.Details details = StatusPublisher.Details.of(1L).withDecryption(
            List.of(new SyncTargetStatus.FailedFile("billing/profiles/prod/application.secrets.env", "MAC mismatch")),
            DecryptionStatus.PERMANENT_FAILURE, true);

        Condition ready = StatusPublisher.readyCondition(synced(), details);
        SyncTargetStatus status = StatusPublisher.toStatus(synced(), details);

        assertThat(ready.getStatus()).isEqualTo("False");
        assertThat(ready.getReason()).isEqualTo("FilesFailed");
        assertThat(status.getFailedFiles()).hasSize(1);
        assertThat(status.getDecryptionStatus()).isEqualTo("PermanentFailure");
    }

    @Test
    void failureReasonsArePrioritized() {
        SyncTargetContext error = SyncTargetContext.initial(TARGET).withFailure(SyncPhase.ERROR, "boom", false);
        SyncTargetContext degraded = SyncTargetContext.initial(TARGET).withFailure(SyncPhase.PENDING, "slow", true);
        StatusPublisher.Details configError = StatusPublisher.Details.of(2L).withConfigError(true);

        assertThat(StatusPublisher.readyCondition(error, StatusPublisher.Details.of(2L)).getReason()).isEqualTo("Error");
        assertThat(StatusPublisher.readyCondition(error, configError).getReason()).isEqualTo("ConfigurationError");
        assertThat(StatusPublisher.readyCondition(degraded, configError).getReason()).isEqualTo("Degraded");
    }

    @Test
    void forgetDropsDetails() {
        publisher.record(TARGET, StatusPublisher.Details.of(5L));
        publisher.forget(TARGET);

        assertThat(publisher.details(TARGET).observedGeneration()).isNull();
    }

    private static SyncTargetContext synced() {
        return SyncTargetContext.initial(TARGET).withSuccess("Synced 2 secrets", "main@sha1:abc", "abc", 2);
    }
}
