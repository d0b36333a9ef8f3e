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

import me.golemcore.presence.domain.model.AwayInterval;
import me.golemcore.presence.domain.model.PresenceEvent;
import me.golemcore.presence.domain.model.PresenceState;
import me.golemcore.presence.domain.model.PresenceStateKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Pure three-state presence machine: Active, PotentiallyAway, ConfirmedAway.
 *
 * <ul>
 * <li>Active to PotentiallyAway once idle reaches the grace threshold; the
 * grace start is {@code now - idle}</li>
 * <li>PotentiallyAway to ConfirmedAway once idle reaches the confirm
 * threshold; the away interval begins at the grace start, not at the
 * crossing</li>
 * <li>PotentiallyAway back to Active without an event when idle resets
 * first</li>
 * <li>ConfirmedAway to Active with a Returned event when idle resets</li>
 * </ul>
 *
 * <p>
 * Idle counts as reset when it drops below the grace threshold. Away-start
 * timestamps are clamped to the previous event so the log stays
 * non-decreasing.
 */
public class PresenceStateMachine {

    private final PresenceThresholds thresholds;

    public PresenceStateMachine(PresenceThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public PresenceThresholds getThresholds() {
        return thresholds;
    }

    public PresenceTransition transition(PresenceState state, double idleSeconds, Instant now) {
        return switch (state.getKind()) {
        case ACTIVE -> fromActive(state, idleSeconds, now);
        case POTENTIALLY_AWAY -> fromPotentiallyAway(state, idleSeconds, now);
        case CONFIRMED_AWAY -> fromConfirmedAway(state, idleSeconds, now);
        };
    }

    private PresenceTransition fromActive(PresenceState state, double idleSeconds, Instant now) {
        if (idleSeconds < thresholds.getGraceSeconds()) {
            return PresenceTransition.unchanged(state);
        }

        Instant graceStart = backdate(now, idleSeconds, state.getLastEventTimestamp());
        List<PresenceEvent> events = new ArrayList<>();
        events.add(PresenceEvent.potentiallyAway(graceStart, idleSeconds, now));
        PresenceState potentiallyAway = state.toBuilder()
                .kind(PresenceStateKind.POTENTIALLY_AWAY)
                .graceStart(graceStart)
                .awaySince(null)
                .lastEventTimestamp(graceStart)
                .build();

        if (idleSeconds < thresholds.getConfirmSeconds()) {
            return new PresenceTransition(potentiallyAway, List.copyOf(events), null);
        }

        // Idle jumped past both thresholds in one poll.
        events.add(PresenceEvent.confirmedAway(graceStart, idleSeconds, now));
        return new PresenceTransition(confirm(potentiallyAway), List.copyOf(events), null);
    }

    private PresenceTransition fromPotentiallyAway(PresenceState state, double idleSeconds, Instant now) {
        if (idleSeconds < thresholds.getGraceSeconds()) {
            PresenceState active = state.toBuilder()
                    .kind(PresenceStateKind.ACTIVE)
                    .graceStart(null)
                    .build();
            return PresenceTransition.unchanged(active);
        }
        if (idleSeconds < thresholds.getConfirmSeconds()) {
            return PresenceTransition.unchanged(state);
        }
        PresenceEvent confirmed = PresenceEvent.confirmedAway(state.getGraceStart(), idleSeconds, now);
        return new PresenceTransition(confirm(state), List.of(confirmed), null);
    }

    private PresenceTransition fromConfirmedAway(PresenceState state, double idleSeconds, Instant now) {
        if (idleSeconds >= thresholds.getGraceSeconds()) {
            return PresenceTransition.unchanged(state);
        }
        Instant awaySince = state.getAwaySince();
        Instant returnedAt = awaySince.isAfter(now) ? awaySince : now;
        PresenceEvent returned = PresenceEvent.returned(awaySince, returnedAt, idleSeconds);
        PresenceState active = PresenceState.builder()
                .kind(PresenceStateKind.ACTIVE)
                .activeSince(returnedAt)
                .lastEventTimestamp(returnedAt)
                .build();
        return new PresenceTransition(active, List.of(returned), new AwayInterval(awaySince, returnedAt));
    }

    private static PresenceState confirm(PresenceState potentiallyAway) {
        return potentiallyAway.toBuilder()
                .kind(PresenceStateKind.CONFIRMED_AWAY)
                .awaySince(potentiallyAway.getGraceStart())
                .lastEventTimestamp(potentiallyAway.getGraceStart())
                .build();
    }

    private static Instant backdate(Instant now, double idleSeconds, Instant lastEventTimestamp) {
        Instant graceStart = now.minusMillis(Math.round(idleSeconds * 1000.0));
        if (lastEventTimestamp != null && graceStart.isBefore(lastEventTimestamp)) {
            return lastEventTimestamp;
        }
        return graceStart;
    }
}
