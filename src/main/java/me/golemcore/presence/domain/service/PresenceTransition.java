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

import java.util.List;
import java.util.Optional;

/**
 * Result of one poll: the next state, the events to append in order, and the
 * away interval that just ended, if the poll observed a return.
 */
public record PresenceTransition(PresenceState state, List<PresenceEvent> events, AwayInterval returnedFrom) {

    public static PresenceTransition unchanged(PresenceState state) {
        return new PresenceTransition(state, List.of(), null);
    }

    public Optional<AwayInterval> returned() {
        return Optional.ofNullable(returnedFrom);
    }
}
