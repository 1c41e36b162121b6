package com.scoutmind.core.tasks;

import com.scoutmind.core.engine.ResearchProperties;
import com.scoutmind.core.logging.MdcContext;
import com.scoutmind.core.metrics.ScoutmindMetrics;
import com.scoutmind.core.model.ActionType;
import com.scoutmind.core.model.TaskResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Maps action names to handlers and runs them inside an error boundary.
 * <p>
 * Whatever happens inside a handler, {@link #execute} returns a result: an
 * unknown action, a thrown exception, a {@code null} return and an expired
 * timeout all come back as a result carrying {@code error}.
 */
@Component
public class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final Map<ActionType, TaskHandler> handlers;
    private final ResearchProperties properties;
    private final ScoutmindMetrics metrics;
    private final ExecutorService workers;

    public TaskRegistry(List<TaskHandler> handlers, ResearchProperties properties, ScoutmindMetrics metrics) {
        var byAction = new EnumMap<ActionType, TaskHandler>(ActionType.class);
        for (TaskHandler handler : handlers) {
            TaskHandler previous = byAction.put(handler.action(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for action " + handler.action().wireName()
                        + ": " + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        this.handlers = Collections.unmodifiableMap(byAction);
        this.properties = properties;
        this.metrics = metrics;
        var counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "task-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Task registry initialized with actions {}", byAction.keySet());
    }

    public Optional<TaskHandler> handlerFor(String action) {
        return ActionType.fromName(action).map(handlers::get);
    }

    /**
     * Runs the handler for the invocation's task.
     *
     * @return the handler's result, or an error result; never {@code null}
     */
    public TaskResult execute(TaskInvocation invocation) {
        String action = invocation.task().action();
        Optional<TaskHandler> handler = handlerFor(action);
        if (handler.isEmpty()) {
            log.warn("Task {} has unknown action '{}'", invocation.taskIndex(), action);
            record(action, "unknown", 0);
            return TaskResult.error("Unknown action: " + action);
        }

        long start = System.currentTimeMillis();
        TaskResult result;
        String outcome;
        if (properties.hasTaskTimeout()) {
            result = runWithTimeout(handler.get(), invocation);
            outcome = result.error().filter(e -> e.startsWith("Task timed out")).isPresent()
                    ? "timeout" : outcomeOf(result);
        } else {
            result = runGuarded(handler.get(), invocation);
            outcome = outcomeOf(result);
        }
        long elapsed = System.currentTimeMillis() - start;
        record(action, outcome, elapsed);
        log.info("Task {} [{}] finished in {}ms ({})", invocation.taskIndex(), action, elapsed, outcome);
        return result;
    }

    private TaskResult runGuarded(TaskHandler handler, TaskInvocation invocation) {
        try {
            TaskResult result = handler.execute(invocation);
            if (result == null) {
                log.warn("Handler {} returned no result", handler.getClass().getSimpleName());
                return TaskResult.error("Handler returned no result");
            }
            return result;
        } catch (Exception e) {
            log.warn("Task {} [{}] failed: {}", invocation.taskIndex(), invocation.task().action(), e.getMessage(), e);
            return TaskResult.error(messageOf(e));
        }
    }

    private TaskResult runWithTimeout(TaskHandler handler, TaskInvocation invocation) {
        long timeoutMs = properties.getTaskTimeout().toMillis();
        Future<TaskResult> future = workers.submit(() -> {
            MdcContext.setTask(invocation.runId(), invocation.taskIndex(), invocation.task().action());
            try {
                return runGuarded(handler, invocation);
            } finally {
                MdcContext.clear();
            }
        });
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            long seconds = Math.max(1, TimeUnit.MILLISECONDS.toSeconds(timeoutMs));
            log.warn("Task {} [{}] timed out after {}ms", invocation.taskIndex(), invocation.task().action(), timeoutMs);
            return TaskResult.error("Task timed out after " + seconds + "s");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return TaskResult.error("Task interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return TaskResult.error(messageOf(cause));
        }
    }

    private void record(String action, String outcome, long ms) {
        if (metrics != null) {
            metrics.recordTaskExecution(action == null ? "none" : action, outcome, ms);
        }
    }

    private static String outcomeOf(TaskResult result) {
        return result.isError() ? "error" : "success";
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }
}
