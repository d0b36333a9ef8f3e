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

import me.golemcore.presence.domain.model.Durations;
import me.golemcore.presence.domain.model.PresenceEvent;
import me.golemcore.presence.domain.model.PresenceEventKind;
import me.golemcore.presence.domain.model.PresenceStatistics;
import me.golemcore.presence.port.outbound.TelemetryStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Active and away totals since a day start, replayed from the presence event
 * log. Away intervals are confirmed-away to returned pairs clipped to
 * {@code [dayStart, now]}; an away still open runs until now.
 */
@Service
public class PresenceStatisticsService {

    private final TelemetryStorePort telemetryStore;
    private final Clock clock;

    public PresenceStatisticsService(TelemetryStorePort telemetryStore, Clock clock) {
        this.telemetryStore = telemetryStore;
        this.clock = clock;
    }

    public PresenceStatistics getPresenceStatistics(Instant dayStart) {
        return getPresenceStatistics(dayStart, clock.instant());
    }

    public PresenceStatistics getPresenceStatistics(Instant dayStart, Instant now) {
        if (dayStart == null || dayStart.isAfter(now)) {
            return PresenceStatistics.empty(dayStart, now);
        }

        Optional<PresenceEvent> before = telemetryStore.findLastPresenceEventBefore(dayStart);
        List<PresenceEvent> events = telemetryStore.findPresenceEventsSince(dayStart);

        Instant awayStart = before.filter(event -> event.getKind() == PresenceEventKind.CONFIRMED_AWAY)
                .map(event -> dayStart)
                .orElse(null);
        Instant lastReturn = null;
        double awayMinutes = 0;
        double longestAway = 0;
        int awayCount = 0;

        for (PresenceEvent event : events) {
            Instant at = event.getTimestamp();
            if (at.isAfter(now)) {
                break;
            }
            if (event.getKind() == PresenceEventKind.CONFIRMED_AWAY && awayStart == null) {
                awayStart = at;
            } else if (event.getKind() == PresenceEventKind.RETURNED) {
                Instant start = awayStart != null ? awayStart : pairedStart(event, dayStart);
                double minutes = Durations.nonNegativeMinutes(start, at);
                awayMinutes += minutes;
                longestAway = Math.max(longestAway, minutes);
                awayCount++;
                awayStart = null;
                lastReturn = at;
            }
        }

        boolean currentlyAway = awayStart != null;
        double currentAway = 0;
        if (currentlyAway) {
            currentAway = Durations.nonNegativeMinutes(awayStart, now);
            awayMinutes += currentAway;
            longestAway = Math.max(longestAway, currentAway);
            awayCount++;
        }

        double elapsed = Durations.nonNegativeMinutes(dayStart, now);
        double currentSession = currentlyAway
                ? 0
                : Durations.nonNegativeMinutes(lastReturn != null ? lastReturn : dayStart, now);

        return PresenceStatistics.builder()
                .totalActiveMinutes(Math.max(0, elapsed - awayMinutes))
                .totalAwayMinutes(awayMinutes)
                .awayCount(awayCount)
                .longestAwayMinutes(longestAway)
                .currentSessionMinutes(currentSession)
                .currentAwayMinutes(currentAway)
                .currentlyAway(currentlyAway)
                .since(dayStart)
                .computedAt(now)
                .build();
    }

    /**
     * Start of a return whose away-start is no longer retained, derived from
     * the recorded duration.
     */
    private static Instant pairedStart(PresenceEvent returned, Instant dayStart) {
        Double duration = returned.getDurationMinutes();
        if (duration == null) {
            return returned.getTimestamp();
        }
        Instant start = returned.getTimestamp().minus(Durations.ofMinutes(duration));
        return start.isBefore(dayStart) ? dayStart : start;
    }
}
