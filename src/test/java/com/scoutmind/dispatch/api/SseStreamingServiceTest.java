package com.scoutmind.dispatch.api;

import com.scoutmind.core.events.EventBus;
import com.scoutmind.core.events.ResearchEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = spy(new EventBus());
        service = new SseStreamingService(eventBus);
        service.startHeartbeat();
    }

    @AfterEach
    void tearDown() {
        service.stopHeartbeat();
    }

    private static ResearchEvent event(String type, String runId) {
        return new ResearchEvent(type, runId, null, Map.of("progress", 50), Instant.now());
    }

    // -- Emitter creation tests -----------------------------------------------

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("creates a distinct emitter per call")
        void distinctEmitters() {
            SseEmitter first = service.createEmitter("run-1");
            SseEmitter second = service.createEmitter("run-1");
            assertNotNull(first);
            assertNotSame(first, second);
        }

        @Test
        @DisplayName("each emitter subscribes to its run on the event bus")
        void subscribesToRun() {
            service.createEmitter("run-1");
            service.createEmitter("run-1", () -> {});
            service.createEmitter("run-2");

            verify(eventBus, times(2)).subscribe(eq("run-1"), any());
            verify(eventBus).subscribe(eq("run-2"), any());
            assertEquals(3, service.activeEmitterCount());
        }
    }

    // -- Event forwarding tests -----------------------------------------------

    @Nested
    @DisplayName("event forwarding")
    class EventForwardingTests {

        @Test
        @DisplayName("publishing step and terminal events to an emitter does not throw")
        void forwardsEvents() {
            service.createEmitter("run-1");

            assertDoesNotThrow(() -> {
                eventBus.publish(event(ResearchEvent.RUN_CREATED, "run-1"));
                eventBus.publish(new ResearchEvent(ResearchEvent.STEP, "run-1", 0, Map.of("progress", 40), Instant.now()));
                eventBus.publish(event(ResearchEvent.RUN_COMPLETED, "run-1"));
            });
        }

        @Test
        @DisplayName("events for other runs leave the emitter registered")
        void noCrossDelivery() {
            service.createEmitter("run-1");

            eventBus.publish(event(ResearchEvent.RUN_COMPLETED, "run-2"));

            assertEquals(1, service.activeEmitterCount());
        }

        @Test
        @DisplayName("frame data carries run id, task index, payload and timestamp")
        void frameData() {
            Instant at = Instant.parse("2026-01-02T03:04:05Z");
            var step = new ResearchEvent(ResearchEvent.STEP, "run-1", 3, Map.of("progress", 60), at);

            Map<String, Object> data = SseStreamingService.frameData(step);

            assertEquals(Map.of("run_id", "run-1", "task_index", 3, "progress", 60,
                    "timestamp", "2026-01-02T03:04:05Z"), data);
            assertFalse(SseStreamingService.frameData(event(ResearchEvent.RUN_CREATED, "r")).containsKey("task_index"));
        }
    }

    // -- Finished runs ----------------------------------------------------------

    @Nested
    @DisplayName("createFinishedEmitter")
    class FinishedEmitterTests {

        @Test
        @DisplayName("replays the terminal event without subscribing or registering")
        void noSubscription() {
            SseEmitter emitter = service.createFinishedEmitter(event(ResearchEvent.RUN_COMPLETED, "run-done"));

            assertNotNull(emitter);
            verify(eventBus, never()).subscribe(anyString(), any());
            assertEquals(0, service.activeEmitterCount());
        }
    }

    // -- Concurrent publish tests ---------------------------------------------

    @Nested
    @DisplayName("concurrent operations")
    class ConcurrentTests {

        @Test
        @DisplayName("concurrent event publishing does not throw")
        void concurrentPublishDoesNotThrow() throws InterruptedException {
            service.createEmitter("run-1");

            int threadCount = 5;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                new Thread(() -> {
                    for (int i = 0; i < 20; i++) {
                        eventBus.publish(event(ResearchEvent.STEP, "run-1"));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
    }
}
