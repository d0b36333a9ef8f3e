package me.golemcore.presence.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Immutable presence transition. Away-start events are backdated to the
 * moment idling began; {@code durationMinutes} is only set on
 * {@link PresenceEventKind#RETURNED}.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PresenceEvent {

    Instant timestamp;
    PresenceEventKind kind;
    double idleSeconds;
    Double durationMinutes;

    /** Wall-clock instant the event was emitted, which may differ from a backdated timestamp. */
    Instant recordedAt;

    public static PresenceEvent potentiallyAway(Instant graceStart, double idleSeconds, Instant now) {
        return PresenceEvent.builder()
                .timestamp(graceStart)
                .kind(PresenceEventKind.POTENTIALLY_AWAY)
                .idleSeconds(idleSeconds)
                .recordedAt(now)
                .build();
    }

    public static PresenceEvent confirmedAway(Instant graceStart, double idleSeconds, Instant now) {
        return PresenceEvent.builder()
                .timestamp(graceStart)
                .kind(PresenceEventKind.CONFIRMED_AWAY)
                .idleSeconds(idleSeconds)
                .recordedAt(now)
                .build();
    }

    public static PresenceEvent returned(Instant awaySince, Instant now, double idleSeconds) {
        return PresenceEvent.builder()
                .timestamp(now)
                .kind(PresenceEventKind.RETURNED)
                .idleSeconds(idleSeconds)
                .durationMinutes(Durations.nonNegativeMinutes(awaySince, now))
                .recordedAt(now)
                .build();
    }
}
