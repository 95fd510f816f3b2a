package com.tasklane.dispatch.api;

import com.tasklane.core.events.EngineEvent;
import com.tasklane.core.events.EventBus;
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

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances.
 * <p>
 * Each connected client gets an emitter subscribed to one run's lane, or to every lane when no
 * run ID is given. Emitter completion, timeout and error all release the subscription.
 * Periodic SSE comments keep idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Long enough for a multi-wave run. */
    private static final long DEFAULT_TIMEOUT_MS = 60 * 60 * 1000L;

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

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError / onCompletion callbacks do the cleanup
                log.debug("Heartbeat failed for {} (connection likely closed): {}",
                        registration.lane(), e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for {} (emitter not active)", registration.lane());
            }
        }
    }

    /**
     * Creates an emitter streaming the events of one run.
     */
    public SseEmitter createEmitter(String runId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = eventBus.subscribe(runId, event -> sendEvent(emitter, event));
        return register(new EmitterRegistration(runId, emitter, subscription));
    }

    /**
     * Creates an emitter streaming events of every run plus list-level events.
     */
    public SseEmitter createGlobalEmitter() {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = eventBus.subscribeAll(event -> sendEvent(emitter, event));
        return register(new EmitterRegistration(null, emitter, subscription));
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private SseEmitter register(EmitterRegistration registration) {
        activeRegistrations.add(registration);
        SseEmitter emitter = registration.emitter();
        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for {}", registration.lane());
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", registration.lane(), ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to confirm SSE connection for {}: {}", registration.lane(), e.getMessage());
        }
        log.info("SSE emitter created for {} (timeout={}ms)", registration.lane(), timeoutMs);
        return emitter;
    }

    private void sendEvent(SseEmitter emitter, EngineEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            if (event.runId() != null) {
                data.put("runId", event.runId());
            }
            if (event.taskId() != null) {
                data.put("taskId", event.taskId());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(data));
        } catch (IOException e) {
            log.debug("Failed to send SSE event {} for run {}: {}",
                    event.eventType(), event.runId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            String runId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {
        String lane() {
            return runId != null ? "run " + runId : "all runs";
        }
    }
}
