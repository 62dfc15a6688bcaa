package com.ottoai.analysis.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ottoai.analysis.JobFixtures;
import com.ottoai.analysis.config.AnalysisProperties;
import com.ottoai.analysis.external.AnalysisServiceClient;
import com.ottoai.analysis.external.AnalysisServiceException;
import com.ottoai.analysis.lock.InMemoryJobLock;
import com.ottoai.analysis.model.*;
import com.ottoai.analysis.repository.AnalysisJobRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetrySupervisorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock AnalysisJobRepository jobRepo;
    @Mock AnalysisJobService    jobService;
    @Mock CompletionCoordinator coordinator;

    AnalysisProperties properties = new AnalysisProperties();
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    RetrySupervisor supervisor;

    @BeforeEach
    void setUp() {
        supervisor = new RetrySupervisor(jobRepo, jobService, coordinator, clock, properties);
    }

    // ------------------------------------------------------------------
    // Pass 1: lifetime
    // ------------------------------------------------------------------

    @Test
    void expire_overdueJob_completedAsTimeoutThroughCoordinator() {
        AnalysisJob job = JobFixtures.job(JobStatus.RUNNING);
        when(jobRepo.findByStatusInAndAttemptStartedAtBefore(
                eq(JobStatus.ACTIVE), eq(NOW.minus(Duration.ofHours(24))), any()))
                .thenReturn(List.of(job));
        when(coordinator.complete(any(), any(), any())).thenReturn(CompletionOutcome.APPLIED);

        supervisor.expireOverdueJobs();

        ArgumentCaptor<CompletionCandidate> captor = ArgumentCaptor.forClass(CompletionCandidate.class);
        verify(coordinator).complete(eq(JobRef.of(job)), captor.capture(), eq(CompletionSource.SUPERVISOR));
        assertThat(captor.getValue().status()).isEqualTo(JobStatus.TIMEOUT);
        assertThat(captor.getValue().output()).isNull();
    }

    @Test
    void expire_oneJobThrows_restOfPassContinues() {
        AnalysisJob first  = JobFixtures.job(JobStatus.RUNNING);
        AnalysisJob second = JobFixtures.job(JobStatus.PENDING);
        when(jobRepo.findByStatusInAndAttemptStartedAtBefore(any(), any(), any()))
                .thenReturn(List.of(first, second));
        when(coordinator.complete(eq(JobRef.of(first)), any(), any())).thenThrow(new IllegalStateException("db down"));
        when(coordinator.complete(eq(JobRef.of(second)), any(), any())).thenReturn(CompletionOutcome.APPLIED);

        supervisor.expireOverdueJobs();

        verify(coordinator).complete(eq(JobRef.of(second)), any(), any());
    }

    // ------------------------------------------------------------------
    // Pass 2: failed submissions
    // ------------------------------------------------------------------

    @Test
    void resubmit_claimed_incrementsAndDispatches() {
        AnalysisJob job = JobFixtures.job(JobStatus.PENDING);
        JobFixtures.set(job, "retryCount", 1);
        when(jobRepo.findByStatusAndExternalJobIdIsNullAndNextAttemptAtLessThanEqual(eq(JobStatus.PENDING), eq(NOW), any()))
                .thenReturn(List.of(job));
        when(jobRepo.claimResubmission(job.getId(), 1, NOW)).thenReturn(1);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));

        supervisor.resubmitFailedSubmissions();

        verify(jobService).dispatch(job);
        verifyNoInteractions(coordinator);
    }

    @Test
    void resubmit_claimLostToAnotherHost_noDispatch() {
        AnalysisJob job = JobFixtures.job(JobStatus.PENDING);
        when(jobRepo.findByStatusAndExternalJobIdIsNullAndNextAttemptAtLessThanEqual(any(), any(), any()))
                .thenReturn(List.of(job));
        when(jobRepo.claimResubmission(job.getId(), 0, NOW)).thenReturn(0);

        supervisor.resubmitFailedSubmissions();

        verifyNoInteractions(jobService);
    }

    @Test
    void resubmit_retriesExhausted_failsThroughCoordinator() {
        AnalysisJob job = JobFixtures.job(JobStatus.PENDING);
        JobFixtures.set(job, "retryCount", 3);
        JobFixtures.set(job, "lastError", "submit failed: HTTP 503: busy");
        when(jobRepo.findByStatusAndExternalJobIdIsNullAndNextAttemptAtLessThanEqual(any(), any(), any()))
                .thenReturn(List.of(job));
        when(coordinator.complete(any(), any(), any())).thenReturn(CompletionOutcome.APPLIED);

        supervisor.resubmitFailedSubmissions();

        ArgumentCaptor<CompletionCandidate> captor = ArgumentCaptor.forClass(CompletionCandidate.class);
        verify(coordinator).complete(eq(JobRef.of(job)), captor.capture(), eq(CompletionSource.SUPERVISOR));
        assertThat(captor.getValue().status()).isEqualTo(JobStatus.FAILED);
        assertThat(captor.getValue().error()).isEqualTo("submit failed: HTTP 503: busy");
        verify(jobRepo, never()).claimResubmission(any(), anyInt(), any());
        verifyNoInteractions(jobService);
    }

    // ------------------------------------------------------------------
    // Pass 3: FAILED / TIMEOUT → PENDING
    // ------------------------------------------------------------------

    @Test
    void retry_dueFailedJob_resetAndDispatched() {
        AnalysisJob failed = JobFixtures.job(JobStatus.FAILED);
        when(jobRepo.findByStatusInAndRetryableTrueAndRetryCountLessThanAndNextAttemptAtLessThanEqual(
                eq(JobStatus.RETRYABLE), eq(3), eq(NOW), any()))
                .thenReturn(List.of(failed));
        when(jobRepo.resetForRetry(failed.getId(), JobStatus.FAILED, 0, NOW)).thenReturn(1);
        AnalysisJob reset = JobFixtures.job(JobStatus.PENDING);
        when(jobRepo.findById(failed.getId())).thenReturn(Optional.of(reset));

        supervisor.retryFailedJobs();

        verify(jobService).dispatch(reset);
    }

    @Test
    void retry_claimLost_noDispatch() {
        AnalysisJob timedOut = JobFixtures.job(JobStatus.TIMEOUT);
        when(jobRepo.findByStatusInAndRetryableTrueAndRetryCountLessThanAndNextAttemptAtLessThanEqual(
                any(), anyInt(), any(), any()))
                .thenReturn(List.of(timedOut));
        when(jobRepo.resetForRetry(timedOut.getId(), JobStatus.TIMEOUT, 0, NOW)).thenReturn(0);

        supervisor.retryFailedJobs();

        verifyNoInteractions(jobService);
    }

    @Test
    void retry_newerSubmissionActive_markedSupersededNotReset() {
        AnalysisJob failed = JobFixtures.job(JobStatus.FAILED);
        AnalysisJob newer  = JobFixtures.job(JobStatus.RUNNING);
        when(jobRepo.findByStatusInAndRetryableTrueAndRetryCountLessThanAndNextAttemptAtLessThanEqual(
                any(), anyInt(), any(), any()))
                .thenReturn(List.of(failed));
        when(jobRepo.findFirstByTenantIdAndSubjectIdAndJobKindAndStatusIn(
                "t1", "call-42", JobKind.CSR_CALL, JobStatus.ACTIVE))
                .thenReturn(Optional.of(newer));

        supervisor.retryFailedJobs();

        verify(jobRepo).markSuperseded(failed.getId(), NOW);
        verify(jobRepo, never()).resetForRetry(any(), any(), anyInt(), any());
        verifyNoInteractions(jobService);
    }

    // ------------------------------------------------------------------
    // Bounded retries, end to end through the real submitter and coordinator
    // ------------------------------------------------------------------

    @Test
    void alwaysTransientlyFailingJob_retriedMaxTimesThenPermanentlyFailed() {
        AnalysisServiceClient client = mock(AnalysisServiceClient.class);
        ApplicationEventPublisher events = mock(ApplicationEventPublisher.class);
        ObjectMapper mapper = new ObjectMapper();
        // Zero backoff: every failed submission is due again immediately.
        BackoffPolicy backoff = new BackoffPolicy(Duration.ZERO, Duration.ZERO, () -> 1.0);
        CompletionCoordinator realCoordinator = new CompletionCoordinator(jobRepo, new InMemoryJobLock(),
                TransactionOperations.withoutTransaction(), new OutputHasher(mapper), backoff, events,
                new SimpleMeterRegistry(), mapper, clock, properties);
        AnalysisJobService realService = new AnalysisJobService(jobRepo, client, realCoordinator, backoff, mapper, clock);
        RetrySupervisor realSupervisor = new RetrySupervisor(jobRepo, realService, realCoordinator, clock, properties);

        AnalysisJob job = JobFixtures.job(JobStatus.PENDING);
        when(client.submit(any())).thenThrow(new AnalysisServiceException(
                AnalysisServiceException.Kind.TRANSIENT, "submit failed: HTTP 503: busy", 503, null));
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        when(jobRepo.lockByIdAndTenantId(job.getId(), "t1")).thenReturn(Optional.of(job));
        when(jobRepo.findByStatusInAndAttemptStartedAtBefore(any(), any(), any())).thenReturn(List.of());
        when(jobRepo.findByStatusInAndRetryableTrueAndRetryCountLessThanAndNextAttemptAtLessThanEqual(
                any(), anyInt(), any(), any())).thenReturn(List.of());
        when(jobRepo.findByStatusAndExternalJobIdIsNullAndNextAttemptAtLessThanEqual(any(), any(), any()))
                .thenAnswer(inv -> job.getStatus() == JobStatus.PENDING && job.getNextAttemptAt() != null
                        ? List.of(job) : List.of());
        when(jobRepo.recordSubmissionFailure(eq(job.getId()), any(), any(), any())).thenAnswer(inv -> {
            JobFixtures.set(job, "lastError", inv.getArgument(1));
            JobFixtures.set(job, "nextAttemptAt", inv.getArgument(2));
            return 1;
        });
        when(jobRepo.claimResubmission(eq(job.getId()), anyInt(), any())).thenAnswer(inv -> {
            int expected = inv.getArgument(1);
            if (job.getRetryCount() != expected) return 0;
            JobFixtures.set(job, "retryCount", job.getRetryCount() + 1);
            JobFixtures.set(job, "nextAttemptAt", null);
            return 1;
        });

        realService.dispatch(job);
        for (int sweep = 0; sweep < 6; sweep++) {
            realSupervisor.sweep();
        }

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getRetryCount()).isEqualTo(properties.getJobs().getMaxRetries());
        assertThat(job.getLastError()).isEqualTo("submit failed: HTTP 503: busy");
        // One initial attempt plus max-retries resubmissions.
        verify(client, times(1 + properties.getJobs().getMaxRetries())).submit(any());

        ArgumentCaptor<JobCompletedEvent> captor = ArgumentCaptor.forClass(JobCompletedEvent.class);
        verify(events, times(1)).publishEvent(captor.capture());
        assertThat(captor.getValue().permanent()).isTrue();
    }
}
