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
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Conflict-resolved sleep summary. Computed per query and never stored.
 */
@Value
@Builder(toBuilder = true)
public class ReconciledNight {

    double totalSleepMinutes;
    double totalWakeMinutes;

    @Singular
    List<SleepPeriod> sleepPeriods;

    @Singular
    List<WakeInterruption> wakeInterruptions;

    boolean fragmented;
    double primarySleepMinutes;
    double timeInBedMinutes;

    @Singular("sourceMinutes")
    Map<SleepSource, Double> sourceBreakdown;

    @Singular
    List<String> discardedSegmentIds;

    SleepQuality quality;
    Instant computedAt;

    public static ReconciledNight empty(Instant computedAt) {
        return ReconciledNight.builder()
                .quality(SleepQuality.NONE)
                .computedAt(computedAt)
                .build();
    }
}
