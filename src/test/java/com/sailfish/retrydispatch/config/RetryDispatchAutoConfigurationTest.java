package com.sailfish.retrydispatch.config;

import com.sailfish.retrydispatch.budget.DispatchBudget;
import com.sailfish.retrydispatch.dispatch.CandidateSelector;
import com.sailfish.retrydispatch.dispatch.DispatchMessageChunker;
import com.sailfish.retrydispatch.dispatch.DispatchQueue;
import com.sailfish.retrydispatch.dispatch.RetryDispatcher;
import com.sailfish.retrydispatch.handler.HandlerRegistry;
import com.sailfish.retrydispatch.handler.RetryableWorkerFactory;
import com.sailfish.retrydispatch.repository.ExecutionRecordRepository;
import com.sailfish.retrydispatch.repository.IntegrationPolicyRepository;
import com.sailfish.retrydispatch.service.ExecutionOutcomeRecorder;
import com.sailfish.retrydispatch.service.IntegrationRunService;
import com.sailfish.retrydispatch.service.impl.DispatchQueueConsumer;
import com.sailfish.retrydispatch.service.impl.RetrySelectionScheduler;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class RetryDispatchAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RetryDispatchAutoConfiguration.class));

    private final ApplicationContextRunner withRepositories = contextRunner
            .withBean(ExecutionRecordRepository.class, () -> mock(ExecutionRecordRepository.class))
            .withBean(IntegrationPolicyRepository.class, () -> mock(IntegrationPolicyRepository.class));

    @Test
    void providesBuildingBlocksWithoutRepositories() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(DispatchBudget.class);
            assertThat(context).hasSingleBean(DispatchQueue.class);
            assertThat(context).hasSingleBean(DispatchMessageChunker.class);
            assertThat(context).hasSingleBean(HandlerRegistry.class);
            assertThat(context).doesNotHaveBean(RetryDispatcher.class);
            assertThat(context).doesNotHaveBean(IntegrationRunService.class);
        });
    }

    @Test
    void wiresDispatchPipelineOnceRepositoriesExist() {
        withRepositories.run(context -> {
            assertThat(context).hasSingleBean(RetryDispatcher.class);
            assertThat(context).hasSingleBean(CandidateSelector.class);
            assertThat(context).hasSingleBean(IntegrationRunService.class);
            assertThat(context).hasSingleBean(ExecutionOutcomeRecorder.class);
            assertThat(context).doesNotHaveBean(RetrySelectionScheduler.class);
            assertThat(context).doesNotHaveBean(DispatchQueueConsumer.class);
        });
    }

    @Test
    void bindsLimitsFromProperties() {
        contextRunner
                .withPropertyValues(
                        "retry.dispatch.budget.max-concurrent-workers=7",
                        "retry.dispatch.transport.max-message-length=4096",
                        "retry.dispatch.transport.max-ids-per-message=100")
                .run(context -> {
                    assertThat(context.getBean(DispatchBudget.class).capacity()).isEqualTo(7);
                    DispatchMessageChunker chunker = context.getBean(DispatchMessageChunker.class);
                    assertThat(chunker.getMaxMessageLength()).isEqualTo(4096);
                    assertThat(chunker.getMaxIdsPerMessage()).isEqualTo(100);
                });
    }

    @Test
    void registersWorkerFactoriesUnderTheirBeanNames() {
        contextRunner
                .withBean("orderExport", RetryableWorkerFactory.class, () -> workerContext -> null)
                .run(context -> {
                    HandlerRegistry registry = context.getBean(HandlerRegistry.class);
                    assertThat(registry.isRegistered("orderExport")).isTrue();
                    assertThat(registry.isRegistered("invoiceExport")).isFalse();
                });
    }

    @Test
    void startsSchedulersWhenEnabled() {
        withRepositories
                .withPropertyValues(
                        "retry.dispatch.selection.enabled=true",
                        "retry.dispatch.selection.interval=30m",
                        "retry.dispatch.consumer.enabled=true",
                        "retry.dispatch.consumer.poll-interval=2s")
                .run(context -> {
                    assertThat(context).hasSingleBean(RetrySelectionScheduler.class);
                    assertThat(context).hasSingleBean(DispatchQueueConsumer.class);
                    assertThat(context.getBean(RetrySelectionScheduler.class).getSelectionInterval())
                            .isEqualTo(Duration.ofMinutes(30));
                    assertThat(context.getBean(DispatchQueueConsumer.class).getPollInterval())
                            .isEqualTo(Duration.ofSeconds(2));
                });
    }
}
