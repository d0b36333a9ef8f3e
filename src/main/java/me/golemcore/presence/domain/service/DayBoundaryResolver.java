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
import me.golemcore.presence.domain.model.DayBoundaryDecision;
import me.golemcore.presence.domain.model.Durations;
import me.golemcore.presence.domain.model.SleepSegment;
import me.golemcore.presence.domain.model.SleepWindow;
import me.golemcore.presence.port.outbound.DayStartPort;
import me.golemcore.presence.port.outbound.TelemetryStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decides when the user's day starts.
 *
 * <p>
 * An away return starts the day only if the away interval covered part of a
 * sleep-window occurrence that has not produced a day start yet, and lasted
 * at least the real-wake grace period. A return early in the window, before
 * the wake divider and after less than a minimum sleep inside it, is only a
 * break. A return while the window is still
 * open is held as a pending wake and confirmed later, once the user stays
 * active for the grace period or the window closes. Leaving again before
 * that turns the pending wake into a brief-activity wake segment.
 *
 * <p>
 * On process start the resolver runs once to tell a restart (recent sleep
 * segments exist) from a true cold start (synthesize one).
 */
@Service
@Slf4j
public class DayBoundaryResolver {

    private final TelemetryStorePort telemetryStore;
    private final SleepWakeRecorder recorder;
    private final DayStartPort dayStartPort;
    private final SleepSettings settings;
    private final Clock clock;

    private final AtomicBoolean startupResolved = new AtomicBoolean(false);
    private volatile Instant currentDayStart;
    private volatile PendingWake pendingWake;

    public DayBoundaryResolver(TelemetryStorePort telemetryStore, SleepWakeRecorder recorder,
            DayStartPort dayStartPort, SleepSettings settings, Clock clock) {
        this.telemetryStore = telemetryStore;
        this.recorder = recorder;
        this.dayStartPort = dayStartPort;
        this.settings = settings;
        this.clock = clock;
    }

    // ==================== Away returns ====================

    public synchronized DayBoundaryDecision onAwayReturn(Instant awayStart, Instant awayEnd, Instant now) {
        double awayMinutes = Durations.minutesBetween(awayStart, awayEnd);
        if (awayMinutes < settings.getRealWakeGraceMinutes()) {
            log.debug("[DayBoundary] Away of {} min is a brief interruption", Math.round(awayMinutes));
            return DayBoundaryDecision.NOT_A_DAY_START;
        }

        SleepWindow window = settings.getWindow();
        ZoneId zone = clock.getZone();
        ZonedDateTime opening = window.latestOpening(awayEnd, zone);
        ZonedDateTime closing = window.closingAfter(opening);
        boolean coversWindow = awayStart.isBefore(closing.toInstant()) && opening.toInstant().isBefore(awayEnd);
        if (!coversWindow) {
            log.debug("[DayBoundary] Away {} -> {} did not touch the sleep window", awayStart, awayEnd);
            return DayBoundaryDecision.NOT_A_DAY_START;
        }
        Instant dayStart = currentDayStart;
        if (dayStart != null && !opening.toInstant().isAfter(dayStart)) {
            log.debug("[DayBoundary] Day already started at {} for the window opened {}", dayStart, opening);
            return DayBoundaryDecision.NOT_A_DAY_START;
        }
        if (!reachedWakeSide(awayStart, awayEnd, opening, closing)) {
            log.debug("[DayBoundary] Return at {} is too early in the window opened {} to start the day",
                    awayEnd, opening);
            return DayBoundaryDecision.NOT_A_DAY_START;
        }

        if (awayEnd.isBefore(closing.toInstant())) {
            pendingWake = new PendingWake(awayEnd, closing.toInstant());
            log.info("[DayBoundary] Returned at {} inside the sleep window, awaiting confirmation until {}",
                    awayEnd, closing.toInstant());
            return DayBoundaryDecision.AWAITING_CONFIRMATION;
        }

        confirmDayStart(awayEnd, now);
        return DayBoundaryDecision.CONFIRMED_DAY_START;
    }

    /**
     * Called on every poll that observed the user active. Confirms a pending
     * wake once it has lasted the grace period or the window has closed.
     *
     * @return the confirmed wake instant, if this poll confirmed one
     */
    public synchronized Optional<Instant> onActivePoll(Instant now) {
        PendingWake pending = pendingWake;
        if (pending == null || !pending.isConfirmedBy(now, settings.getRealWakeGraceMinutes())) {
            return Optional.empty();
        }
        pendingWake = null;
        confirmDayStart(pending.returnedAt(), now);
        return Optional.of(pending.returnedAt());
    }

    /**
     * Called when a new away interval starts at {@code awayStart}. A pending
     * wake that did not qualify by then was only brief activity.
     */
    public synchronized void onAwayStarted(Instant awayStart, Instant now) {
        PendingWake pending = pendingWake;
        if (pending == null) {
            return;
        }
        pendingWake = null;
        if (pending.isConfirmedBy(awayStart, settings.getRealWakeGraceMinutes())) {
            confirmDayStart(pending.returnedAt(), now);
            return;
        }
        log.info("[DayBoundary] Pending wake at {} abandoned, user left again at {}", pending.returnedAt(),
                awayStart);
        if (awayStart.isAfter(pending.returnedAt())) {
            recorder.recordBriefActivity(pending.returnedAt(), awayStart);
        }
    }

    /**
     * A return can start the day once it happens at or after the wake divider
     * of this window occurrence, or after an away that spent at least the
     * minimum sleep duration inside the window.
     */
    private boolean reachedWakeSide(Instant awayStart, Instant awayEnd, ZonedDateTime opening,
            ZonedDateTime closing) {
        ZonedDateTime divider = ZonedDateTime.of(opening.toLocalDate(), settings.getWakeDivider(),
                opening.getZone());
        if (!divider.isAfter(opening)) {
            divider = divider.plusDays(1);
        }
        Instant dividerAt = divider.isAfter(closing) ? closing.toInstant() : divider.toInstant();
        if (!awayEnd.isBefore(dividerAt)) {
            return true;
        }
        Instant insideFrom = awayStart.isAfter(opening.toInstant()) ? awayStart : opening.toInstant();
        Instant insideTo = awayEnd.isBefore(closing.toInstant()) ? awayEnd : closing.toInstant();
        return Durations.minutesBetween(insideFrom, insideTo) >= settings.getMinSleepMinutes();
    }

    private void confirmDayStart(Instant wakeInstant, Instant now) {
        currentDayStart = wakeInstant;
        log.info("[DayBoundary] Day started at {} (confirmed {})", wakeInstant, now);
        try {
            dayStartPort.onDayStart(wakeInstant);
        } catch (RuntimeException e) {
            log.error("[DayBoundary] Day-start collaborator failed for {}", wakeInstant, e);
        }
    }

    // ==================== Startup ====================

    /**
     * Distinguishes restart from cold start. Runs once per process; later
     * calls return the current day start untouched.
     *
     * @throws me.golemcore.presence.port.outbound.TelemetryStoreException
     *             if the synthetic cold-start segment could not be stored; the
     *             day start is set regardless
     */
    public Instant resolveStartup(Instant now) {
        if (!startupResolved.compareAndSet(false, true)) {
            return currentDayStart;
        }

        Optional<Instant> latestEnd = telemetryStore
                .findSleepSegmentsTouching(now.minus(settings.getLookback()), now).stream()
                .map(SleepSegment::getEnd)
                .filter(Objects::nonNull)
                .filter(end -> !end.isAfter(now))
                .max(Comparator.naturalOrder());
        if (latestEnd.isPresent()) {
            currentDayStart = latestEnd.get();
            log.info("[DayBoundary] Restart detected, day start restored to {}", currentDayStart);
            return currentDayStart;
        }

        ZoneId zone = clock.getZone();
        ZonedDateTime wake = now.atZone(zone).toLocalDate().atTime(settings.getTypicalWakeTime()).atZone(zone);
        if (wake.toInstant().isAfter(now)) {
            wake = wake.minusDays(1);
        }
        ZonedDateTime bedtime = wake.toLocalDate().atTime(settings.getTypicalBedtime()).atZone(zone);
        if (!bedtime.isBefore(wake)) {
            bedtime = bedtime.minusDays(1);
        }
        currentDayStart = wake.toInstant();
        log.info("[DayBoundary] Cold start, assuming sleep {} -> {}", bedtime, wake);
        recorder.recordAssumedColdStart(bedtime.toInstant(), wake.toInstant());
        return currentDayStart;
    }

    public boolean isStartupResolved() {
        return startupResolved.get();
    }

    public Optional<Instant> getCurrentDayStart() {
        return Optional.ofNullable(currentDayStart);
    }

    public Optional<Instant> getPendingWake() {
        PendingWake pending = pendingWake;
        return pending != null ? Optional.of(pending.returnedAt()) : Optional.empty();
    }

    private record PendingWake(Instant returnedAt, Instant windowClosesAt) {

        boolean isConfirmedBy(Instant instant, double graceMinutes) {
            return !instant.isBefore(windowClosesAt)
                    || Durations.minutesBetween(returnedAt, instant) >= graceMinutes;
        }
    }
}
