package com.sailfish.retrydispatch.handler;

import com.sailfish.retrydispatch.RetryableWorker;
import com.sailfish.retrydispatch.model.ExecutionRecord;
import com.sailfish.retrydispatch.worker.WorkerContext;
import com.sailfish.retrydispatch.worker.WorkerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link HandlerRegistry} backed by a Map from handler name to {@link RetryableWorkerFactory}.
 * Handlers should be registered during application startup.
 * <p>
 * {@link #registerBean(String, Object)} accepts arbitrary objects looked up by name, e.g. from a DI container.
 * Binding a name to something that is not a factory is not rejected at registration; it surfaces as a
 * {@link HandlerNotCompatibleException} for the runs that use that name, leaving other handlers unaffected.
 */
public class MapHandlerRegistry implements HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(MapHandlerRegistry.class);

    private final Map<String, Object> handlers = new ConcurrentHashMap<>();

    /**
     * Registers a worker factory under a handler name.
     *
     * @param handlerName The unique handler name, as referenced by integration policies.
     * @param factory The factory creating one worker per run.
     */
    public void registerHandler(String handlerName, RetryableWorkerFactory factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        registerBean(handlerName, factory);
    }

    /**
     * Binds a handler name to an object of unknown type.
     *
     * @param handlerName The unique handler name.
     * @param handler The object bound to the name.
     */
    public void registerBean(String handlerName, Object handler) {
        if (handlerName == null || handlerName.trim().isEmpty()) {
            throw new IllegalArgumentException("handlerName cannot be blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        Object previous = handlers.put(handlerName, handler);
        if (previous != null && previous != handler) {
            log.warn("Handler '{}' re-registered: {} replaces {}", handlerName, handler.getClass().getName(), previous.getClass().getName());
        } else {
            log.info("Registering handler '{}': {}", handlerName, handler.getClass().getName());
        }
    }

    @Override
    public RetryableWorker newFreshWorker(String handlerName, ExecutionRecord execution, Collection<String> recordIds) {
        return create(handlerName, WorkerContext.fresh(handlerName, execution, recordIds));
    }

    @Override
    public RetryableWorker newRetryWorker(String handlerName, ExecutionRecord child, Collection<String> recordIds,
                                          ExecutionRecord parent) {
        return create(handlerName, WorkerContext.retry(handlerName, child, recordIds, parent));
    }

    @Override
    public boolean isRegistered(String handlerName) {
        return handlerName != null && handlers.containsKey(handlerName);
    }

    private RetryableWorker create(String handlerName, WorkerContext context) {
        Object handler = handlerName == null ? null : handlers.get(handlerName);
        if (handler == null) {
            throw new HandlerNotFoundException(handlerName);
        }
        if (!(handler instanceof RetryableWorkerFactory)) {
            throw new HandlerNotCompatibleException(handlerName,
                    handler.getClass().getName() + " does not implement " + RetryableWorkerFactory.class.getSimpleName());
        }

        RetryableWorker worker = ((RetryableWorkerFactory) handler).create(context);
        if (worker == null) {
            throw new HandlerNotCompatibleException(handlerName, "factory returned no worker");
        }
        if (worker.getContext() != context) {
            throw new HandlerNotCompatibleException(handlerName, "worker is not bound to the " + context.getMode() + " context it was created with");
        }
        if (worker.getState() != WorkerState.INITIALIZED) {
            throw new HandlerNotCompatibleException(handlerName, "factory returned a worker in state " + worker.getState());
        }
        log.debug("Resolved handler '{}' to {} for {}", handlerName, worker.getClass().getName(), context);
        return worker;
    }
}
