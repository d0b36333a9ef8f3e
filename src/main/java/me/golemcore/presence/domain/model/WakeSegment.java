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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Period of wakefulness nested inside a sleep window, for example a bathroom
 * break. When {@code end} is unknown the stated duration gives an estimated
 * end.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class WakeSegment {

    String id;
    Instant start;
    Instant end;
    Double durationMinutes;
    SleepSource source;
    String notes;
    Instant recordedAt;

    /**
     * Duration derived from the bounds when both are known, otherwise the
     * stated duration.
     */
    public Double getDurationMinutes() {
        if (start != null && end != null) {
            return Durations.nonNegativeMinutes(start, end);
        }
        return durationMinutes;
    }

    public boolean isEstimated() {
        return end == null;
    }

    /**
     * End used for reconciliation: the recorded end, or start plus the stated
     * duration. Null when neither is usable.
     */
    @JsonIgnore
    public Instant getEffectiveEnd() {
        if (end != null) {
            return end;
        }
        if (start == null || durationMinutes == null || durationMinutes <= 0) {
            return null;
        }
        return start.plus(Durations.ofMinutes(durationMinutes));
    }

    public boolean touches(Instant from, Instant to) {
        Instant effectiveEnd = getEffectiveEnd();
        if (start == null || start.isAfter(to)) {
            return false;
        }
        return effectiveEnd == null || !effectiveEnd.isBefore(from);
    }
}
