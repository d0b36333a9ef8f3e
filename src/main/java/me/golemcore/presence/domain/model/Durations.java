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

import java.time.Duration;
import java.time.Instant;

/**
 * Minute arithmetic shared by the presence and sleep models.
 */
public final class Durations {

    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private Durations() {
    }

    /**
     * Signed minutes from {@code start} to {@code end}.
     */
    public static double minutesBetween(Instant start, Instant end) {
        return Duration.between(start, end).toMillis() / MILLIS_PER_MINUTE;
    }

    /**
     * Minutes from {@code start} to {@code end}, never negative.
     */
    public static double nonNegativeMinutes(Instant start, Instant end) {
        return Math.max(0.0, minutesBetween(start, end));
    }

    public static Duration ofMinutes(double minutes) {
        return Duration.ofMillis(Math.round(minutes * MILLIS_PER_MINUTE));
    }
}
