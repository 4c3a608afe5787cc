package com.sailfish.retrydispatch.handler;

import com.sailfish.retrydispatch.RetryableWorker;
import com.sailfish.retrydispatch.model.ExecutionRecord;
import com.sailfish.retrydispatch.model.IntegrationPolicy;
import com.sailfish.retrydispatch.worker.WorkerContext;
import com.sailfish.retrydispatch.worker.WorkerMode;
import com.sailfish.retrydispatch.worker.WorkerState;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.sailfish.retrydispatch.RecordFixtures.failedExecution;
import static com.sailfish.retrydispatch.RecordFixtures.policy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MapHandlerRegistryTest {

    private MapHandlerRegistry registry;
    private ExecutionRecord parent;

    @BeforeEach
    void setUp() {
        registry = new MapHandlerRegistry();
        IntegrationPolicy orders = policy(1L, "orders", "orderExport");
        parent = failedExecution(10L, orders, "A-1");
    }

    @Test
    void createsFreshWorkerBoundToFreshContext() {
        registry.registerHandler("orderExport", StubWorker::new);
        ExecutionRecord execution = new ExecutionRecord();

        RetryableWorker worker = registry.newFreshWorker("orderExport", execution, Arrays.asList("A-1", "A-2"));

        WorkerContext context = worker.getContext();
        assertThat(context.getMode()).isEqualTo(WorkerMode.FRESH);
        assertThat(context.getExecution()).isSameAs(execution);
        assertThat(context.getRecordIds()).containsExactly("A-1", "A-2");
        assertThat(context.getParent()).isEmpty();
    }

    @Test
    void createsRetryWorkerBoundToRetryContext() {
        registry.registerHandler("orderExport", StubWorker::new);
        ExecutionRecord child = ExecutionRecord.newRetryChild(parent);

        RetryableWorker worker = registry.newRetryWorker("orderExport", child, parent.getRetryIds(), parent);

        assertThat(worker.getContext().isRetry()).isTrue();
        assertThat(worker.getContext().getExecution()).isSameAs(child);
        assertThat(worker.getContext().getParent()).containsSame(parent);
    }

    @Test
    void unknownOrMissingNameIsNotFound() {
        assertThatThrownBy(() -> registry.newFreshWorker("nope", new ExecutionRecord(), Collections.singleton("A")))
                .isInstanceOf(HandlerNotFoundException.class)
                .extracting(e -> ((HandlerResolutionException) e).getHandlerName())
                .isEqualTo("nope");
        assertThatThrownBy(() -> registry.newFreshWorker(null, new ExecutionRecord(), Collections.singleton("A")))
                .isInstanceOf(HandlerNotFoundException.class);
        assertThat(registry.isRegistered("nope")).isFalse();
    }

    @Test
    void nameBoundToNonFactoryIsNotCompatible() {
        registry.registerBean("legacyExport", new Object());

        assertThat(registry.isRegistered("legacyExport")).isTrue();
        assertThatThrownBy(() -> registry.newRetryWorker("legacyExport", ExecutionRecord.newRetryChild(parent),
                parent.getRetryIds(), parent))
                .isInstanceOf(HandlerNotCompatibleException.class)
                .hasMessageContaining("legacyExport");
    }

    @Test
    void factoryReturningNothingIsNotCompatible() {
        registry.registerHandler("orderExport", context -> null);

        assertThatThrownBy(() -> registry.newFreshWorker("orderExport", new ExecutionRecord(), Collections.singleton("A")))
                .isInstanceOf(HandlerNotCompatibleException.class);
    }

    @Test
    void workerBoundToAnotherContextIsNotCompatible() {
        WorkerContext foreign = WorkerContext.fresh("orderExport", new ExecutionRecord(), Collections.singleton("X"));
        registry.registerHandler("orderExport", context -> new StubWorker(foreign));

        assertThatThrownBy(() -> registry.newFreshWorker("orderExport", new ExecutionRecord(), Collections.singleton("A")))
                .isInstanceOf(HandlerNotCompatibleException.class)
                .hasMessageContaining("FRESH");
    }

    @Test
    void workerAlreadyStartedIsNotCompatible() {
        registry.registerHandler("orderExport", context -> {
            StubWorker worker = new StubWorker(context);
            worker.state = WorkerState.COMPLETED;
            return worker;
        });

        assertThatThrownBy(() -> registry.newFreshWorker("orderExport", new ExecutionRecord(), Collections.singleton("A")))
                .isInstanceOf(HandlerNotCompatibleException.class)
                .hasMessageContaining("COMPLETED");
    }

    @Test
    void rejectsBlankNamesAndNullFactories() {
        assertThatThrownBy(() -> registry.registerHandler(" ", StubWorker::new))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.registerHandler("orderExport", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class StubWorker implements RetryableWorker {

        private final WorkerContext context;
        private WorkerState state = WorkerState.INITIALIZED;

        private StubWorker(WorkerContext context) {
            this.context = context;
        }

        @Override
        public WorkerContext getContext() {
            return context;
        }

        @Override
        public WorkerState getState() {
            return state;
        }

        @Override
        public void run() {
            state = WorkerState.COMPLETED;
        }
    }
}
