package com.calypso.dispatch.api;

import com.calypso.core.build.BuildService;
import com.calypso.core.events.BuildEvent;
import com.calypso.core.events.EventBus;
import com.calypso.core.model.BuildOutput;
import com.calypso.core.model.BuildStatus;
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
 * The SSE event name is the build event type and the data is its JSON payload. The
 * emitter completes after {@code done} or {@code error}. A client connecting to a
 * build that already finished receives the terminal event straight away.
 * <p>
 * When the last client of a running build disconnects, the build is cancelled.
 * Heartbeats are sent as SSE comments so idle proxies keep the connection open
 * while the model is thinking.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Longer than the build budget plus repair rounds. */
    private static final long DEFAULT_TIMEOUT_MS = 10 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 20;

    private final EventBus eventBus;
    private final BuildService buildService;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, BuildService buildService) {
        this(eventBus, buildService, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, BuildService buildService, long timeoutMs) {
        this.eventBus = eventBus;
        this.buildService = buildService;
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
    }

    void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                log.debug("Heartbeat failed for build {}: {}", registration.buildId, e.getMessage());
                disconnected(registration);
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for build {} (emitter not active)", registration.buildId);
            }
        }
    }

    /**
     * Creates an SSE emitter streaming the events of {@code build}.
     *
     * @param build the build as currently stored
     */
    public SseEmitter createEmitter(BuildOutput build) {
        String buildId = build.id();
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var registration = new EmitterRegistration(buildId, emitter);
        registration.subscription = eventBus.subscribe(buildId, event -> forward(registration, event));
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for build {}", buildId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for build {}: {}", buildId, ex.getMessage());
            disconnected(registration);
        });

        // Subscribed before this check, so a build finishing in between is still seen once.
        if (!buildService.isRunning(buildId) && registration.terminated.compareAndSet(false, true)) {
            replayTerminalState(emitter, build);
            emitter.complete();
            return emitter;
        }

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send initial comment for build {}: {}", buildId, e.getMessage());
        }
        log.info("SSE emitter created for build {}", buildId);
        return emitter;
    }

    private void forward(EmitterRegistration registration, BuildEvent event) {
        if (registration.terminated.get()) {
            return;
        }
        if (!sendEvent(registration.emitter, event.eventType(), event.payload(), registration.buildId)) {
            disconnected(registration);
            return;
        }
        if (event.isTerminal() && registration.terminated.compareAndSet(false, true)) {
            registration.emitter.complete();
        }
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void replayTerminalState(SseEmitter emitter, BuildOutput build) {
        String buildId = build.id();
        BuildOutput latest = buildService.findBuild(build.projectId(), buildId).orElse(build);
        if (latest.status() == BuildStatus.COMPLETE) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("buildId", latest.id());
            payload.put("files", latest.files());
            payload.put("fileCount", latest.files().size());
            payload.put("verified", latest.verified());
            sendEvent(emitter, BuildEvent.DONE, payload, buildId);
        } else {
            String message = latest.error() != null ? latest.error() : "Build is not running";
            sendEvent(emitter, BuildEvent.ERROR, Map.of("message", message), buildId);
        }
    }

    private boolean sendEvent(SseEmitter emitter, String type, Map<String, Object> payload, String buildId) {
        try {
            emitter.send(SseEmitter.event()
                    .name(type)
                    .data(payload));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for build {}: {}", type, buildId, e.getMessage());
            return false;
        }
    }

    /**
     * The client went away. A running build nobody watches any more is cancelled;
     * its persisted files stay available for download.
     */
    private void disconnected(EmitterRegistration registration) {
        cleanup(registration);
        if (eventBus.subscriberCount(registration.buildId) == 0 && buildService.cancel(registration.buildId)) {
            log.info("Last client of build {} disconnected, cancelling", registration.buildId);
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (registration.subscription != null) {
            registration.subscription.unsubscribe();
        }
        activeRegistrations.remove(registration);
    }

    private static final class EmitterRegistration {
        private final String buildId;
        private final SseEmitter emitter;
        private final AtomicBoolean terminated = new AtomicBoolean(false);
        private volatile EventBus.Subscription subscription;

        private EmitterRegistration(String buildId, SseEmitter emitter) {
            this.buildId = buildId;
            this.emitter = emitter;
        }
    }
}
