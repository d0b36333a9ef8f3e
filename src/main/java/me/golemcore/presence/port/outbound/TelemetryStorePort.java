package me.golemcore.presence.port.outbound;

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

import me.golemcore.presence.domain.model.PresenceEvent;
import me.golemcore.presence.domain.model.SleepSegment;
import me.golemcore.presence.domain.model.WakeSegment;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only telemetry logs for presence events and sleep/wake segments.
 *
 * <p>
 * Appends either persist or throw {@link TelemetryStoreException}. Queries
 * never throw; if part of the history could not be loaded they answer from
 * what is available. Results are snapshots, safe to use without locking.
 */
public interface TelemetryStorePort {

    void appendPresenceEvent(PresenceEvent event);

    /**
     * Events with {@code timestamp >= since}, ordered by timestamp.
     */
    List<PresenceEvent> findPresenceEventsSince(Instant since);

    /**
     * Most recent event with {@code timestamp < before}, if retained.
     */
    Optional<PresenceEvent> findLastPresenceEventBefore(Instant before);

    Optional<PresenceEvent> findLatestPresenceEvent();

    void appendSleepSegment(SleepSegment segment);

    void appendWakeSegment(WakeSegment segment);

    /**
     * Sleep segments touching {@code [from, to]}, ongoing ones included,
     * ordered by start.
     */
    List<SleepSegment> findSleepSegmentsTouching(Instant from, Instant to);

    /**
     * Wake segments touching {@code [from, to]}, ordered by start.
     */
    List<WakeSegment> findWakeSegmentsTouching(Instant from, Instant to);

    /**
     * Drops presence events older than {@code cutoff}. Sleep and wake segments
     * are kept forever.
     *
     * @return number of events dropped
     */
    int prunePresenceEventsBefore(Instant cutoff);
}
