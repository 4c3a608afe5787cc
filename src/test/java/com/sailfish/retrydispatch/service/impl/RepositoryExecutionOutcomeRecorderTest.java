package com.sailfish.retrydispatch.service.impl;

import com.sailfish.retrydispatch.model.ExecutionRecord;
import com.sailfish.retrydispatch.model.ExecutionStatus;
import com.sailfish.retrydispatch.model.IntegrationPolicy;
import com.sailfish.retrydispatch.repository.ExecutionRecordRepository;
import com.sailfish.retrydispatch.retry.PolicyRetryStrategy;
import com.sailfish.retrydispatch.worker.WorkerContext;
import com.sailfish.retrydispatch.worker.WorkerOutcome;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.sailfish.retrydispatch.RecordFixtures.failedExecution;
import static com.sailfish.retrydispatch.RecordFixtures.policy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RepositoryExecutionOutcomeRecorderTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 10, 0);

    @Mock
    private ExecutionRecordRepository recordRepository;

    private RepositoryExecutionOutcomeRecorder recorder;
    private IntegrationPolicy orders;

    @BeforeEach
    void setUp() {
        when(recordRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));
        recorder = new RepositoryExecutionOutcomeRecorder(recordRepository, new PolicyRetryStrategy(), CLOCK);
        orders = policy(1L, "orders", "orderExport");
    }

    @Test
    void freshRunThatDeliveredEverythingSucceeds() {
        ExecutionRecord execution = runningExecution("A", "B");

        recorder.recordOutcome(WorkerContext.fresh("orderExport", execution, execution.getRetryIds()),
                WorkerOutcome.builder().succeeded("A", 200).succeeded("B", 200).build());

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(execution.hasRetryIds()).isFalse();
        assertThat(execution.getLastStatusCode()).isEqualTo(200);
        assertThat(execution.getLastError()).isNull();
        assertThat(execution.getLastAttemptAt()).isEqualTo(NOW);
    }

    @Test
    void freshRunWithFailuresKeepsFailedIdsForRetry() {
        ExecutionRecord execution = runningExecution("A", "B", "C");

        recorder.recordOutcome(WorkerContext.fresh("orderExport", execution, execution.getRetryIds()),
                WorkerOutcome.builder().succeeded("A", 200).failed("B", "busy", 503).failed("C", "timeout", null).build());

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.getRetryIds()).containsExactly("B", "C");
        assertThat(execution.getLastStatusCode()).isEqualTo(503);
        assertThat(execution.getLastError()).isEqualTo("busy");
    }

    @Test
    void successfulRetryClosesChildAndParent() {
        ExecutionRecord parent = failedExecution(5L, orders, "B", "C");
        parent.incrementRetriesAttempted();
        ExecutionRecord child = ExecutionRecord.newRetryChild(parent);

        recorder.recordOutcome(WorkerContext.retry("orderExport", child, parent.getRetryIds(), parent),
                WorkerOutcome.builder().succeeded("B", 200).succeeded("C", 200).build());

        assertThat(child.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(parent.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(parent.hasRetryIds()).isFalse();
        assertThat(parent.getRetriesAttempted()).isEqualTo(1);
        assertThat(parent.getLastAttemptAt()).isEqualTo(NOW);

        InOrder order = inOrder(recordRepository);
        order.verify(recordRepository).save(child);
        order.verify(recordRepository).save(parent);
    }

    @Test
    void retryFailingOnTheLastAttemptExhaustsTheParent() {
        ExecutionRecord parent = failedExecution(5L, orders, "B", "C");
        parent.setRetriesAttempted(3);
        ExecutionRecord child = ExecutionRecord.newRetryChild(parent);

        recorder.recordOutcome(WorkerContext.retry("orderExport", child, parent.getRetryIds(), parent),
                WorkerOutcome.builder().succeeded("B", 200).failed("C", "busy", 503).build());

        assertThat(child.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(child.getRetryIds()).containsExactly("C");
        assertThat(parent.getStatus()).isEqualTo(ExecutionStatus.EXHAUSTED);
        assertThat(parent.getRetryIds()).containsExactly("C");
    }

    @Test
    void retryFailingWithAttemptsLeftStaysEligible() {
        ExecutionRecord parent = failedExecution(5L, orders, "B");
        parent.incrementRetriesAttempted();
        ExecutionRecord child = ExecutionRecord.newRetryChild(parent);

        recorder.recordOutcome(WorkerContext.retry("orderExport", child, parent.getRetryIds(), parent),
                WorkerOutcome.allFailed(parent.getRetryIds(), "connection refused"));

        assertThat(parent.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(parent.getRetriesAttempted()).isEqualTo(1);
        assertThat(parent.getLastError()).isEqualTo("connection refused");
    }

    @Test
    void longErrorsAreTruncatedToTheColumn() {
        ExecutionRecord execution = runningExecution("A");
        char[] error = new char[3_000];
        Arrays.fill(error, 'e');

        recorder.recordOutcome(WorkerContext.fresh("orderExport", execution, execution.getRetryIds()),
                WorkerOutcome.allFailed(execution.getRetryIds(), new String(error)));

        assertThat(execution.getLastError()).hasSize(2_000).endsWith("...");
    }

    private ExecutionRecord runningExecution(String... ids) {
        ExecutionRecord execution = new ExecutionRecord();
        execution.setId(1L);
        execution.setPolicy(orders);
        execution.setStatus(ExecutionStatus.RUNNING);
        execution.setRetryIds(Arrays.asList(ids));
        return execution;
    }
}
