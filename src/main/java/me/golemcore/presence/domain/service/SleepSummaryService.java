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
import me.golemcore.presence.domain.model.ReconciledNight;
import me.golemcore.presence.domain.model.SleepSegment;
import me.golemcore.presence.domain.model.WakeSegment;
import me.golemcore.presence.port.outbound.TelemetryStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reconciled sleep summary over the trailing lookback window. Segments still
 * open at query time are treated as ending now.
 */
@Service
@Slf4j
public class SleepSummaryService {

    private final TelemetryStorePort telemetryStore;
    private final ReconciliationEngine reconciliationEngine;
    private final SleepSettings settings;
    private final Clock clock;

    public SleepSummaryService(TelemetryStorePort telemetryStore, ReconciliationEngine reconciliationEngine,
            SleepSettings settings, Clock clock) {
        this.telemetryStore = telemetryStore;
        this.reconciliationEngine = reconciliationEngine;
        this.settings = settings;
        this.clock = clock;
    }

    public ReconciledNight getReconciledNight() {
        return getReconciledNight(clock.instant());
    }

    public ReconciledNight getReconciledNight(Instant now) {
        Instant from = now.minus(settings.getLookback());

        List<SleepSegment> sleep;
        List<WakeSegment> wake;
        try {
            sleep = telemetryStore.findSleepSegmentsTouching(from, now);
            wake = telemetryStore.findWakeSegmentsTouching(from, now);
        } catch (RuntimeException e) {
            log.warn("[Sleep] Could not read sleep telemetry, returning an empty night: {}", e.getMessage());
            return ReconciledNight.empty(now);
        }

        ReconciledNight night = reconciliationEngine.reconcile(closeOngoingSleep(sleep, now),
                closeOngoingWake(wake, now));
        return night.toBuilder().computedAt(now).build();
    }

    private static List<SleepSegment> closeOngoingSleep(List<SleepSegment> segments, Instant now) {
        List<SleepSegment> closed = new ArrayList<>(segments.size());
        for (SleepSegment segment : segments) {
            if (segment.isOngoing() && segment.getStart() != null && segment.getStart().isBefore(now)) {
                closed.add(SleepSegment.builder()
                        .id(segment.getId())
                        .start(segment.getStart())
                        .end(now)
                        .source(segment.getSource())
                        .rawNote(segment.getRawNote())
                        .recordedAt(segment.getRecordedAt())
                        .build());
            } else {
                closed.add(segment);
            }
        }
        return closed;
    }

    private static List<WakeSegment> closeOngoingWake(List<WakeSegment> segments, Instant now) {
        List<WakeSegment> closed = new ArrayList<>(segments.size());
        for (WakeSegment segment : segments) {
            if (segment.getEffectiveEnd() == null && segment.getStart() != null && segment.getStart().isBefore(now)) {
                closed.add(WakeSegment.builder()
                        .id(segment.getId())
                        .start(segment.getStart())
                        .end(now)
                        .source(segment.getSource())
                        .notes(segment.getNotes())
                        .recordedAt(segment.getRecordedAt())
                        .build());
            } else {
                closed.add(segment);
            }
        }
        return closed;
    }
}
