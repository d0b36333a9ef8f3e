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
 * Append-only sleep record. Never edited in place; a reconciliation run may
 * exclude it when a higher-priority source overlaps it.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SleepSegment {

    String id;
    Instant start;

    /** Null while the segment is ongoing. */
    Instant end;

    SleepSource source;
    String rawNote;
    Instant recordedAt;

    /**
     * Derived duration, or null while the segment is ongoing.
     */
    public Double getDurationMinutes() {
        if (start == null || end == null) {
            return null;
        }
        return Durations.nonNegativeMinutes(start, end);
    }

    public boolean isOngoing() {
        return end == null;
    }

    /**
     * Half-open overlap test: {@code a.start < b.end AND b.start < a.end}.
     */
    public boolean overlaps(SleepSegment other) {
        if (start == null || end == null || other.start == null || other.end == null) {
            return false;
        }
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean touches(Instant from, Instant to) {
        if (start == null || start.isAfter(to)) {
            return false;
        }
        return end == null || !end.isBefore(from);
    }
}
