package com.sailfish.retrydispatch.config;

import com.sailfish.retrydispatch.audit.ExecutionAuditLog;
import com.sailfish.retrydispatch.audit.Slf4jExecutionAuditLog;
import com.sailfish.retrydispatch.budget.DispatchBudget;
import com.sailfish.retrydispatch.budget.SemaphoreDispatchBudget;
import com.sailfish.retrydispatch.dispatch.CandidateSelector;
import com.sailfish.retrydispatch.dispatch.DispatchMessageChunker;
import com.sailfish.retrydispatch.dispatch.DispatchQueue;
import com.sailfish.retrydispatch.dispatch.InMemoryDispatchQueue;
import com.sailfish.retrydispatch.dispatch.OverflowRepublisher;
import com.sailfish.retrydispatch.dispatch.RetryDispatcher;
import com.sailfish.retrydispatch.handler.HandlerRegistry;
import com.sailfish.retrydispatch.handler.MapHandlerRegistry;
import com.sailfish.retrydispatch.handler.RetryableWorkerFactory;
import com.sailfish.retrydispatch.repository.ExecutionRecordRepository;
import com.sailfish.retrydispatch.repository.IntegrationPolicyRepository;
import com.sailfish.retrydispatch.retry.PolicyRetryStrategy;
import com.sailfish.retrydispatch.retry.RetryStrategy;
import com.sailfish.retrydispatch.service.ExecutionOutcomeRecorder;
import com.sailfish.retrydispatch.service.IntegrationRunService;
import com.sailfish.retrydispatch.service.impl.DispatchQueueConsumer;
import com.sailfish.retrydispatch.service.impl.IntegrationRunServiceImpl;
import com.sailfish.retrydispatch.service.impl.RepositoryExecutionOutcomeRecorder;
import com.sailfish.retrydispatch.service.impl.RetrySelectionScheduler;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for the retry dispatch engine.
 *
 * <p>The building blocks (budget, queue, chunker, registry, audit log) are always available. The dispatcher,
 * selector and run service are created once the application provides an {@link ExecutionRecordRepository}
 * (and, for selection and fresh runs, an {@link IntegrationPolicyRepository}), e.g. by declaring the JPA
 * implementations as beans.</p>
 *
 * <p>Every {@link RetryableWorkerFactory} bean is registered as a handler under its bean name, which is the
 * name integration policies refer to.</p>
 *
 * <p>The periodic selection and the queue consumer start only when
 * {@code retry.dispatch.selection.enabled} and {@code retry.dispatch.consumer.enabled} are set.</p>
 *
 * @see RetryDispatchProperties
 */
@AutoConfiguration
@EnableConfigurationProperties(RetryDispatchProperties.class)
public class RetryDispatchAutoConfiguration {

    private final RetryDispatchProperties properties;

    public RetryDispatchAutoConfiguration(RetryDispatchProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchMessageChunker dispatchMessageChunker() {
        RetryDispatchProperties.TransportConfig transport = properties.getTransport();
        return new DispatchMessageChunker(transport.getMaxMessageLength(), transport.getMaxIdsPerMessage());
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchBudget dispatchBudget() {
        return new SemaphoreDispatchBudget(properties.getBudget().getMaxConcurrentWorkers());
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchQueue dispatchQueue() {
        RetryDispatchProperties.QueueConfig queue = properties.getQueue();
        return new InMemoryDispatchQueue(queue.getCapacity(), queue.getOfferTimeout(), properties.getTransport().getMaxMessageLength());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryStrategy retryStrategy() {
        return new PolicyRetryStrategy();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionAuditLog executionAuditLog() {
        return new Slf4jExecutionAuditLog();
    }

    /**
     * Registers every worker factory bean under its bean name.
     *
     * @param beanFactory the factory holding the worker factory beans
     * @return the registry
     */
    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry(ListableBeanFactory beanFactory) {
        MapHandlerRegistry registry = new MapHandlerRegistry();
        Map<String, RetryableWorkerFactory> factories = beanFactory.getBeansOfType(RetryableWorkerFactory.class);
        factories.forEach(registry::registerHandler);
        return registry;
    }

    /**
     * Pool the workers run on. Sized to the budget, which is what actually limits concurrency.
     *
     * @return the worker executor
     */
    @Bean(name = "retryWorkerExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "retryWorkerExecutor")
    public ExecutorService retryWorkerExecutor() {
        return Executors.newFixedThreadPool(properties.getBudget().getMaxConcurrentWorkers(), namedThreads("retry-worker-"));
    }

    @Bean(name = "retrySchedulerExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "retrySchedulerExecutor")
    public ScheduledExecutorService retrySchedulerExecutor() {
        return Executors.newScheduledThreadPool(properties.getSchedulerThreads(), namedThreads("retry-scheduler-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public OverflowRepublisher overflowRepublisher(DispatchMessageChunker chunker, DispatchQueue dispatchQueue) {
        return new OverflowRepublisher(chunker, dispatchQueue);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ExecutionRecordRepository.class)
    public ExecutionOutcomeRecorder executionOutcomeRecorder(ExecutionRecordRepository recordRepository, RetryStrategy retryStrategy) {
        return new RepositoryExecutionOutcomeRecorder(recordRepository, retryStrategy);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ExecutionRecordRepository.class)
    public RetryDispatcher retryDispatcher(ExecutionRecordRepository recordRepository,
                                           HandlerRegistry handlerRegistry,
                                           DispatchBudget dispatchBudget,
                                           @Qualifier("retryWorkerExecutor") ExecutorService workerExecutor,
                                           OverflowRepublisher overflowRepublisher) {
        return new RetryDispatcher(recordRepository, handlerRegistry, dispatchBudget, workerExecutor, overflowRepublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ExecutionRecordRepository.class, IntegrationPolicyRepository.class})
    public CandidateSelector candidateSelector(IntegrationPolicyRepository policyRepository,
                                               ExecutionRecordRepository recordRepository,
                                               RetryStrategy retryStrategy,
                                               DispatchMessageChunker chunker,
                                               DispatchQueue dispatchQueue) {
        return new CandidateSelector(policyRepository, recordRepository, retryStrategy, chunker, dispatchQueue);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ExecutionRecordRepository.class, IntegrationPolicyRepository.class})
    public IntegrationRunService integrationRunService(IntegrationPolicyRepository policyRepository,
                                                       ExecutionRecordRepository recordRepository,
                                                       HandlerRegistry handlerRegistry,
                                                       DispatchBudget dispatchBudget,
                                                       @Qualifier("retryWorkerExecutor") ExecutorService workerExecutor) {
        return new IntegrationRunServiceImpl(policyRepository, recordRepository, handlerRegistry, dispatchBudget, workerExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "retry.dispatch.selection", name = "enabled", havingValue = "true")
    @ConditionalOnBean({ExecutionRecordRepository.class, IntegrationPolicyRepository.class})
    public RetrySelectionScheduler retrySelectionScheduler(CandidateSelector candidateSelector,
                                                           @Qualifier("retrySchedulerExecutor") ScheduledExecutorService schedulerExecutor) {
        return new RetrySelectionScheduler(candidateSelector, schedulerExecutor, properties.getSelection().getInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "retry.dispatch.consumer", name = "enabled", havingValue = "true")
    @ConditionalOnBean(ExecutionRecordRepository.class)
    public DispatchQueueConsumer dispatchQueueConsumer(DispatchQueue dispatchQueue,
                                                       RetryDispatcher retryDispatcher,
                                                       @Qualifier("retrySchedulerExecutor") ScheduledExecutorService schedulerExecutor) {
        RetryDispatchProperties.ConsumerConfig consumer = properties.getConsumer();
        return new DispatchQueueConsumer(dispatchQueue, retryDispatcher, schedulerExecutor,
                consumer.getPollInterval(), consumer.getMaxMessagesPerCycle());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
