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
import me.golemcore.presence.domain.model.Durations;
import me.golemcore.presence.domain.model.SleepSegment;
import me.golemcore.presence.domain.model.SleepSource;
import me.golemcore.presence.domain.model.SleepWindow;
import me.golemcore.presence.domain.model.WakeSegment;
import me.golemcore.presence.port.outbound.TelemetryStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns away intervals and user statements into sleep and wake records.
 *
 * <p>
 * An away interval becomes a {@code presence_inferred} sleep segment only when
 * it lasts at least the minimum sleep duration <b>and</b> both of its
 * endpoints fall inside the sleep window, compared at minute resolution in
 * the clock's zone. User-stated intervals bypass the classifier entirely.
 */
@Service
@Slf4j
public class SleepWakeRecorder {

    static final String BRIEF_ACTIVITY_NOTE = "brief activity during sleep window";

    private final TelemetryStorePort telemetryStore;
    private final SleepSettings settings;
    private final Clock clock;

    public SleepWakeRecorder(TelemetryStorePort telemetryStore, SleepSettings settings, Clock clock) {
        this.telemetryStore = telemetryStore;
        this.settings = settings;
        this.clock = clock;
    }

    // ==================== Classification ====================

    /**
     * Records the away interval as sleep when it qualifies.
     *
     * @return the stored segment, or empty when the interval is not sleep
     * @throws me.golemcore.presence.port.outbound.TelemetryStoreException
     *             if the segment could not be persisted
     */
    public Optional<SleepSegment> classifyAndRecord(Instant awayStart, Instant awayEnd) {
        if (awayStart == null || awayEnd == null || !awayEnd.isAfter(awayStart)) {
            log.warn("[Sleep] Ignoring malformed away interval {} -> {}", awayStart, awayEnd);
            return Optional.empty();
        }
        if (!isSleepInterval(awayStart, awayEnd)) {
            log.debug("[Sleep] Away {} -> {} ({} min) is not sleep", awayStart, awayEnd,
                    Math.round(Durations.minutesBetween(awayStart, awayEnd)));
            return Optional.empty();
        }

        SleepSegment segment = SleepSegment.builder()
                .id(newId())
                .start(awayStart)
                .end(awayEnd)
                .source(SleepSource.PRESENCE_INFERRED)
                .recordedAt(clock.instant())
                .build();
        telemetryStore.appendSleepSegment(segment);
        log.info("[Sleep] Recorded inferred sleep {} -> {} ({} min)", awayStart, awayEnd,
                Math.round(segment.getDurationMinutes()));
        return Optional.of(segment);
    }

    /**
     * Conjunction test: long enough, start in window, end in window.
     */
    public boolean isSleepInterval(Instant awayStart, Instant awayEnd) {
        if (Durations.minutesBetween(awayStart, awayEnd) < settings.getMinSleepMinutes()) {
            return false;
        }
        SleepWindow window = settings.getWindow();
        ZoneId zone = clock.getZone();
        return window.contains(awayStart, zone) && window.contains(awayEnd, zone);
    }

    // ==================== Explicit records ====================

    public SleepSegment recordUserStatedInterval(Instant start, Instant end, String note) {
        requireInterval(start, end);
        SleepSegment segment = SleepSegment.builder()
                .id(newId())
                .start(start)
                .end(end)
                .source(SleepSource.USER_STATED)
                .rawNote(note)
                .recordedAt(clock.instant())
                .build();
        telemetryStore.appendSleepSegment(segment);
        log.info("[Sleep] Recorded user-stated sleep {} -> {}", start, end);
        return segment;
    }

    public WakeSegment recordWakeInterval(Instant start, Instant end, String notes) {
        return recordWakeInterval(start, end, notes, SleepSource.USER_STATED);
    }

    public WakeSegment recordWakeInterval(Instant start, Instant end, String notes, SleepSource source) {
        requireInterval(start, end);
        WakeSegment segment = WakeSegment.builder()
                .id(newId())
                .start(start)
                .end(end)
                .source(source)
                .notes(notes)
                .recordedAt(clock.instant())
                .build();
        telemetryStore.appendWakeSegment(segment);
        log.info("[Sleep] Recorded {} wake {} -> {}{}", source.getWireName(), start, end,
                notes != null ? " (" + notes + ")" : "");
        return segment;
    }

    /**
     * Wake interval whose end is unknown; reconciliation treats it as
     * {@code [start, start + durationMinutes)}.
     */
    public WakeSegment recordEstimatedWakeInterval(Instant start, double durationMinutes, String notes) {
        if (start == null) {
            throw new IllegalArgumentException("Wake start is required");
        }
        if (!(durationMinutes > 0)) {
            throw new IllegalArgumentException("Wake duration must be positive: " + durationMinutes);
        }
        WakeSegment segment = WakeSegment.builder()
                .id(newId())
                .start(start)
                .durationMinutes(durationMinutes)
                .source(SleepSource.USER_STATED)
                .notes(notes)
                .recordedAt(clock.instant())
                .build();
        telemetryStore.appendWakeSegment(segment);
        log.info("[Sleep] Recorded estimated wake at {} (~{} min)", start, Math.round(durationMinutes));
        return segment;
    }

    /**
     * Recorded when the wake gap between two away intervals was too short to
     * count as getting up.
     */
    public WakeSegment recordBriefActivity(Instant start, Instant end) {
        return recordWakeInterval(start, end, BRIEF_ACTIVITY_NOTE, SleepSource.PRESENCE_INFERRED);
    }

    public SleepSegment recordAssumedColdStart(Instant bedtime, Instant wakeTime) {
        requireInterval(bedtime, wakeTime);
        SleepSegment segment = SleepSegment.builder()
                .id(newId())
                .start(bedtime)
                .end(wakeTime)
                .source(SleepSource.ASSUMED_COLD_START)
                .rawNote("synthesized on first start")
                .recordedAt(clock.instant())
                .build();
        telemetryStore.appendSleepSegment(segment);
        log.info("[Sleep] Recorded assumed cold-start sleep {} -> {}", bedtime, wakeTime);
        return segment;
    }

    private static void requireInterval(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Interval start and end are required");
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Interval end " + end + " must be after start " + start);
        }
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
