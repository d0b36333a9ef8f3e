package me.golemcore.presence.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.presence.domain.model.AwayInterval;
import me.golemcore.presence.domain.model.DayBoundaryDecision;
import me.golemcore.presence.domain.model.PresenceEvent;
import me.golemcore.presence.domain.model.PresenceEventKind;
import me.golemcore.presence.domain.model.PresenceSnapshot;
import me.golemcore.presence.domain.model.PresenceState;
import me.golemcore.presence.domain.model.PresenceStateKind;
import me.golemcore.presence.infrastructure.config.PresenceProperties;
import me.golemcore.presence.port.inbound.IdleSignalUnavailableException;
import me.golemcore.presence.port.inbound.IdleTimePort;
import me.golemcore.presence.port.outbound.TelemetryStoreException;
import me.golemcore.presence.port.outbound.TelemetryStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Drives the presence state machine from idle readings and fans returns out
 * to the sleep recorder and the day-boundary resolver.
 *
 * <p>
 * The poll loop is the single writer of presence events. Events are appended
 * before the new state is committed, so a failed write leaves the state where
 * it was and the transition is retried on the next poll. A returned away
 * interval whose sleep record could not be written is kept and classified
 * again at the start of every following poll until the write succeeds.
 */
@Service
@Slf4j
public class PresenceMonitorService {

    private final IdleTimePort idleTimePort;
    private final TelemetryStorePort telemetryStore;
    private final SleepWakeRecorder recorder;
    private final DayBoundaryResolver dayBoundaryResolver;
    private final PresenceStateMachine stateMachine;
    private final Duration awayRecoveryMaxAge;
    private final Clock clock;
    private final Deque<AwayInterval> unrecordedAways = new ArrayDeque<>();

    private volatile PresenceState state = PresenceState.initial();
    private volatile double lastIdleSeconds;
    private volatile Instant lastCheckedAt;
    private volatile boolean degraded;

    public PresenceMonitorService(IdleTimePort idleTimePort, TelemetryStorePort telemetryStore,
            SleepWakeRecorder recorder, DayBoundaryResolver dayBoundaryResolver, PresenceThresholds thresholds,
            PresenceProperties properties, Clock clock) {
        this.idleTimePort = idleTimePort;
        this.telemetryStore = telemetryStore;
        this.recorder = recorder;
        this.dayBoundaryResolver = dayBoundaryResolver;
        this.stateMachine = new PresenceStateMachine(thresholds);
        this.awayRecoveryMaxAge = Duration.ofHours(Math.max(0, properties.getMonitor().getAwayRecoveryMaxHours()));
        this.clock = clock;
    }

    // ==================== Polling ====================

    /**
     * Reads the idle command and polls with the current time. A failing idle command
     * holds the last state.
     */
    public PresenceState pollIdleTime() {
        Instant now = clock.instant();
        double idleSeconds;
        try {
            idleSeconds = idleTimePort.currentIdleSeconds();
        } catch (IdleSignalUnavailableException e) {
            markDegraded(now, e.getMessage());
            return state;
        }
        return poll(idleSeconds, now);
    }

    /**
     * Advances the state machine with one idle reading.
     *
     * @throws me.golemcore.presence.port.outbound.TelemetryStoreException
     *             if an event or segment could not be persisted
     */
    public synchronized PresenceState poll(double idleSeconds, Instant now) {
        if (Double.isNaN(idleSeconds) || Double.isInfinite(idleSeconds)) {
            markDegraded(now, "idle reading " + idleSeconds);
            return state;
        }
        double idle = Math.max(0, idleSeconds);
        if (degraded) {
            degraded = false;
            log.info("[Presence] Idle signal recovered, state {}", state.getKind());
        }
        lastIdleSeconds = idle;
        lastCheckedAt = now;
        retryUnrecordedAways();

        PresenceTransition transition = stateMachine.transition(state, idle, now);
        for (PresenceEvent event : transition.events()) {
            telemetryStore.appendPresenceEvent(event);
        }
        PresenceState previous = state;
        state = transition.state();
        if (previous.getKind() != state.getKind()) {
            log.info("[Presence] {} -> {} (idle {}s)", previous.getKind(), state.getKind(), Math.round(idle));
        }

        boolean awayStarted = transition.events().stream()
                .anyMatch(event -> event.getKind() == PresenceEventKind.CONFIRMED_AWAY);
        if (awayStarted) {
            dayBoundaryResolver.onAwayStarted(state.getAwaySince(), now);
        }
        Optional<AwayInterval> returned = transition.returned();
        if (returned.isPresent()) {
            handleReturn(returned.get(), now);
        }
        if (state.getKind() == PresenceStateKind.ACTIVE) {
            dayBoundaryResolver.onActivePoll(now);
        }
        return state;
    }

    private void handleReturn(AwayInterval away, Instant now) {
        log.info("[Presence] Returned after {} min away (since {})", Math.round(away.durationMinutes()),
                away.start());
        try {
            recorder.classifyAndRecord(away.start(), away.end());
        } catch (TelemetryStoreException e) {
            unrecordedAways.addLast(away);
            log.error("[Presence] Failed to record away {} -> {}, retrying on next poll", away.start(),
                    away.end());
            throw e;
        } finally {
            DayBoundaryDecision decision = dayBoundaryResolver.onAwayReturn(away.start(), away.end(), now);
            log.debug("[Presence] Day boundary decision: {}", decision);
        }
    }

    private void retryUnrecordedAways() {
        while (!unrecordedAways.isEmpty()) {
            AwayInterval away = unrecordedAways.peekFirst();
            try {
                recorder.classifyAndRecord(away.start(), away.end());
            } catch (TelemetryStoreException e) {
                log.warn("[Presence] Away {} -> {} still unrecorded ({} pending): {}", away.start(), away.end(),
                        unrecordedAways.size(), e.getMessage());
                return;
            }
            unrecordedAways.pollFirst();
            log.info("[Presence] Recorded away {} -> {} on retry", away.start(), away.end());
        }
    }

    private void markDegraded(Instant now, String reason) {
        lastCheckedAt = now;
        if (!degraded) {
            degraded = true;
            log.warn("[Presence] Idle signal unavailable ({}), holding state {}", reason, state.getKind());
        }
    }

    // ==================== Restart recovery ====================

    /**
     * Resumes a confirmed away interval that was still open when the process
     * stopped, so the next return pairs with it. Older intervals are dropped.
     */
    public synchronized PresenceState recover(Instant now) {
        Optional<PresenceEvent> latest = telemetryStore.findLatestPresenceEvent();
        if (latest.isEmpty()) {
            return state;
        }
        PresenceEvent event = latest.get();
        Instant at = event.getTimestamp();
        if (event.getKind() == PresenceEventKind.CONFIRMED_AWAY
                && !at.isBefore(now.minus(awayRecoveryMaxAge))) {
            state = PresenceState.builder()
                    .kind(PresenceStateKind.CONFIRMED_AWAY)
                    .graceStart(at)
                    .awaySince(at)
                    .lastEventTimestamp(at)
                    .build();
            log.info("[Presence] Resumed away interval open since {}", at);
        } else {
            state = state.toBuilder().lastEventTimestamp(at).build();
            if (event.getKind() == PresenceEventKind.CONFIRMED_AWAY) {
                log.info("[Presence] Unmatched away since {} is older than {}h, starting active", at,
                        awayRecoveryMaxAge.toHours());
            }
        }
        return state;
    }

    // ==================== Queries ====================

    public PresenceState getState() {
        return state;
    }

    public PresenceSnapshot getPresenceState() {
        PresenceState current = state;
        return PresenceSnapshot.builder()
                .state(current.getKind())
                .awaySince(current.getAwaySince())
                .graceStart(current.getGraceStart())
                .idleSeconds(lastIdleSeconds)
                .lastCheckedAt(lastCheckedAt)
                .degraded(degraded)
                .build();
    }

    public synchronized int getUnrecordedAwayCount() {
        return unrecordedAways.size();
    }

    public boolean isDegraded() {
        return degraded;
    }
}
