package com.taskforge.dispatch.api;

import com.taskforge.core.events.EventBus;
import com.taskforge.core.events.TaskforgeEvent;
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

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        service = new SseStreamingService(eventBus, 60_000L);
    }

    @AfterEach
    void tearDown() {
        service.stopHeartbeat();
    }

    // -- createEmitter --------------------------------------------------------

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("creates a distinct emitter per call")
        void distinctEmitters() {
            SseEmitter first = service.createEmitter("task_1");
            SseEmitter second = service.createEmitter("task_1");

            assertNotNull(first);
            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("starts with no active emitters")
        void startsEmpty() {
            assertEquals(0, service.activeEmitterCount());
        }
    }

    // -- Event forwarding -----------------------------------------------------

    @Nested
    @DisplayName("event forwarding")
    class EventForwardingTests {

        @Test
        @DisplayName("publishing for a streamed run does not fail the publisher")
        void publishToStreamedRun() {
            service.createEmitter("task_1");

            assertDoesNotThrow(() -> eventBus.publish(new TaskforgeEvent(
                    "task.progress", "task_1", Map.of("progress", 10, "step", 1), Instant.now())));
            assertEquals(1, service.activeEmitterCount());
        }

        @Test
        @DisplayName("events for other runs leave emitters untouched")
        void otherRunsIgnored() {
            service.createEmitter("task_1");
            service.createEmitter("session_2");

            eventBus.publish(TaskforgeEvent.of("session.started", "session_2", Map.of()));

            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("concurrent publishing does not throw")
        void concurrentPublish() throws InterruptedException {
            service.createEmitter("task_1");

            int threads = 4;
            CountDownLatch latch = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                final int id = t;
                new Thread(() -> {
                    for (int i = 0; i < 25; i++) {
                        eventBus.publish(TaskforgeEvent.of("task.progress", "task_1",
                                Map.of("step", id * 100 + i)));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
    }
}
