package com.sailfish.retrydispatch.service.impl;

import com.sailfish.retrydispatch.dispatch.CandidateSelector;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetrySelectionSchedulerTest {

    @Mock
    private CandidateSelector candidateSelector;

    @Mock
    private ScheduledExecutorService schedulerExecutor;

    @Test
    void schedulesSelectionEveryFifteenMinutesByDefault() {
        new RetrySelectionScheduler(candidateSelector, schedulerExecutor).start();

        long fifteenMinutes = TimeUnit.MINUTES.toMillis(15);
        verify(schedulerExecutor).scheduleAtFixedRate(any(Runnable.class), eq(fifteenMinutes), eq(fifteenMinutes), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void doesNotStartOnAShutDownExecutor() {
        when(schedulerExecutor.isShutdown()).thenReturn(true);

        new RetrySelectionScheduler(candidateSelector, schedulerExecutor).start();

        verify(schedulerExecutor, never()).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
    }

    @Test
    void failingCycleDoesNotEscape() {
        when(candidateSelector.publishCandidates()).thenThrow(new IllegalStateException("database unavailable"));
        RetrySelectionScheduler scheduler = new RetrySelectionScheduler(candidateSelector, schedulerExecutor);

        assertThatCode(scheduler::runSelectionCycle).doesNotThrowAnyException();
        verify(candidateSelector).publishCandidates();
    }
}
