package com.sailfish.retrydispatch.worker;

import com.sailfish.retrydispatch.RetryableWorker;
import com.sailfish.retrydispatch.budget.SemaphoreDispatchBudget;
import com.sailfish.retrydispatch.model.ExecutionRecord;

import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkerExecutionWrapperTest {

    @Mock
    private RetryableWorker worker;

    private SemaphoreDispatchBudget budget;

    @BeforeEach
    void setUp() {
        budget = new SemaphoreDispatchBudget(2);
        budget.tryAcquire();
        when(worker.getContext()).thenReturn(WorkerContext.fresh("orderExport", new ExecutionRecord(), Collections.singleton("A")));
    }

    @Test
    void releasesSlotWhenWorkerFinishes() {
        new WorkerExecutionWrapper(worker, budget).run();

        verify(worker).run();
        assertThat(budget.availableSlots()).isEqualTo(2);
    }

    @Test
    void releasesSlotWhenWorkerThrows() {
        doThrow(new IllegalStateException("boom")).when(worker).run();

        assertThatCode(() -> new WorkerExecutionWrapper(worker, budget).run()).doesNotThrowAnyException();
        assertThat(budget.availableSlots()).isEqualTo(2);
    }
}
