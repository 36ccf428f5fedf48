package com.calypso.dispatch.api;

import com.calypso.core.build.BuildService;
import com.calypso.core.events.BuildEvent;
import com.calypso.core.events.EventBus;
import com.calypso.core.model.BuildOutput;
import com.calypso.core.model.BuildStatus;
import com.calypso.core.model.GeneratedFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private EventBus eventBus;
    private BuildService buildService;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        buildService = mock(BuildService.class);
        service = new SseStreamingService(eventBus, buildService, 60_000L);
    }

    private static BuildOutput build(String id) {
        return BuildOutput.generating(id, "p1", "cfg", Instant.parse("2026-03-01T12:00:00Z"));
    }

    @Nested
    @DisplayName("running builds")
    class RunningTests {

        @BeforeEach
        void running() {
            when(buildService.isRunning("b1")).thenReturn(true);
        }

        @Test
        @DisplayName("subscribes each emitter to the build's events")
        void subscribes() {
            SseEmitter emitter1 = service.createEmitter(build("b1"));
            SseEmitter emitter2 = service.createEmitter(build("b1"));

            assertNotSame(emitter1, emitter2);
            assertEquals(2, service.activeEmitterCount());
            assertEquals(2, eventBus.subscriberCount("b1"));
            verify(buildService, never()).findBuild("p1", "b1");
        }

        @Test
        @DisplayName("forwarding events never cancels the build")
        void forwards() {
            service.createEmitter(build("b1"));

            eventBus.publish(BuildEvent.of(BuildEvent.FILE_START, "b1", Map.of("path", "a.txt")));
            eventBus.publish(BuildEvent.of(BuildEvent.DONE, "b1", Map.of("buildId", "b1")));
            eventBus.publish(BuildEvent.of(BuildEvent.FILE_START, "b1", Map.of("path", "late.txt")));

            verify(buildService, never()).cancel("b1");
        }

        @Test
        @DisplayName("heartbeats to live emitters are harmless")
        void heartbeats() {
            service.createEmitter(build("b1"));

            assertDoesNotThrow(service::sendHeartbeats);
            assertEquals(1, service.activeEmitterCount());
        }
    }

    @Nested
    @DisplayName("finished builds")
    class FinishedTests {

        @Test
        @DisplayName("replays the stored outcome instead of waiting")
        void replays() {
            var done = build("b1").withFiles(List.of(new GeneratedFile("a.txt", "a")))
                    .withStatus(BuildStatus.COMPLETE, null);
            when(buildService.isRunning("b1")).thenReturn(false);
            when(buildService.findBuild("p1", "b1")).thenReturn(Optional.of(done));

            assertNotNull(service.createEmitter(build("b1")));

            verify(buildService).findBuild("p1", "b1");
            verify(buildService, never()).cancel("b1");
        }

        @Test
        @DisplayName("falls back to the given snapshot when the store has nothing newer")
        void snapshotFallback() {
            when(buildService.findBuild("p1", "b1")).thenReturn(Optional.empty());

            assertDoesNotThrow(() -> service.createEmitter(build("b1").withStatus(BuildStatus.FAILED, "boom")));
        }
    }

    @Test
    @DisplayName("starts with no active emitters")
    void startsEmpty() {
        assertEquals(0, service.activeEmitterCount());
    }
}
