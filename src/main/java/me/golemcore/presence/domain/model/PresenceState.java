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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of the presence state machine, threaded from one poll to the next.
 * {@code graceStart} is set once idling crosses the grace threshold;
 * {@code awaySince} is the backdated start of a confirmed away interval.
 */
@Value
@Builder(toBuilder = true)
public class PresenceState {

    PresenceStateKind kind;
    Instant graceStart;
    Instant awaySince;
    Instant activeSince;
    Instant lastEventTimestamp;

    public static PresenceState initial() {
        return PresenceState.builder().kind(PresenceStateKind.ACTIVE).build();
    }
}
