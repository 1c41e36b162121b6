package com.scoutmind.dispatch.api;

import com.scoutmind.core.events.EventBus;
import com.scoutmind.core.events.ResearchEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * Each emitter subscribes to one run and forwards its events as named SSE
 * frames. The emitter completes after the run's terminal event. If the client
 * goes away before that, the optional disconnect callback runs, which the
 * streaming endpoint uses to cancel the run.
 * <p>
 * Heartbeats are sent as SSE comments every 30 seconds so idle proxies keep
 * the connection open while a long task runs.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks do the cleanup
                log.debug("Heartbeat failed for run {} (connection likely closed): {}",
                        registration.runId, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for run {} (emitter not active)", registration.runId);
            }
        }
    }

    /**
     * Creates an SSE emitter that streams events for the given run.
     */
    public SseEmitter createEmitter(String runId) {
        return createEmitter(runId, null);
    }

    /**
     * Creates an SSE emitter that streams events for the given run.
     *
     * @param runId        the run to stream events for
     * @param onDisconnect invoked when the stream ends before the run's terminal
     *                     event (client disconnect, timeout, error); nullable
     */
    public SseEmitter createEmitter(String runId, Runnable onDisconnect) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        AtomicBoolean finished = new AtomicBoolean(false);

        EventBus.Subscription subscription = eventBus.subscribe(runId, event -> sendEvent(emitter, event, finished));

        var registration = new EmitterRegistration(runId, emitter, subscription, finished, onDisconnect);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for run {}", runId);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for run {}", runId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for run {}: {}", runId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial heartbeat for run {}: {}", runId, e.getMessage());
        }

        log.info("SSE emitter created for run {} (timeout={}ms)", runId, timeoutMs);
        return emitter;
    }

    /**
     * Creates an emitter for a run that has already finished: it carries the
     * given terminal event and completes. Nothing is subscribed.
     */
    public SseEmitter createFinishedEmitter(ResearchEvent terminal) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        sendEvent(emitter, terminal, new AtomicBoolean(false));
        log.info("Replayed {} for finished run {}", terminal.eventType(), terminal.runId());
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    static Map<String, Object> frameData(ResearchEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("run_id", event.runId());
        if (event.taskIndex() != null) {
            data.put("task_index", event.taskIndex());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private void sendEvent(SseEmitter emitter, ResearchEvent event, AtomicBoolean finished) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(frameData(event)));
        } catch (IOException e) {
            log.debug("Failed to send SSE event {} for run {}: {}",
                    event.eventType(), event.runId(), e.getMessage());
        } catch (IllegalStateException e) {
            log.debug("SSE event {} for run {} dropped (emitter not active)", event.eventType(), event.runId());
        }
        if (event.isTerminal() && finished.compareAndSet(false, true)) {
            emitter.complete();
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (!activeRegistrations.remove(registration)) {
            return;
        }
        registration.subscription.unsubscribe();
        if (registration.onDisconnect != null && registration.finished.compareAndSet(false, true)) {
            log.info("SSE client for run {} disconnected before the run finished", registration.runId);
            try {
                registration.onDisconnect.run();
            } catch (Exception e) {
                log.warn("Disconnect handler failed for run {}: {}", registration.runId, e.getMessage());
            }
        }
        log.debug("Cleaned up SSE registration for run {}", registration.runId);
    }

    private record EmitterRegistration(
            String runId,
            SseEmitter emitter,
            EventBus.Subscription subscription,
            AtomicBoolean finished,
            Runnable onDisconnect
    ) {}
}
