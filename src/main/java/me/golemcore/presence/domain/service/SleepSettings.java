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

import me.golemcore.presence.domain.model.SleepWindow;
import me.golemcore.presence.infrastructure.config.PresenceProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalTime;

/**
 * Validated sleep tracking parameters. Built once from
 * {@link PresenceProperties.SleepProperties}; every invalid value is replaced
 * by its default and reported a single time.
 */
@Value
@Builder(toBuilder = true)
@Slf4j
public class SleepSettings {

    static final String DEFAULT_WINDOW_START = "22:30";
    static final String DEFAULT_WINDOW_END = "09:00";
    static final String DEFAULT_TYPICAL_WAKE = "07:00";
    static final String DEFAULT_TYPICAL_BEDTIME = "22:30";
    static final String DEFAULT_WAKE_DIVIDER = "05:30";
    static final double DEFAULT_MIN_SLEEP_MINUTES = 120;
    static final double DEFAULT_REAL_WAKE_GRACE_MINUTES = 15;
    static final double DEFAULT_MERGE_GAP_MINUTES = 2;
    static final int DEFAULT_LOOKBACK_HOURS = 24;
    static final double DEFAULT_GOOD_MINUTES = 420;
    static final double DEFAULT_FAIR_MINUTES = 360;

    SleepWindow window;
    double minSleepMinutes;
    LocalTime typicalWakeTime;
    LocalTime typicalBedtime;

    /** Clock time from which a return inside the sleep window may start the day. */
    LocalTime wakeDivider;

    double realWakeGraceMinutes;
    double mergeGapMinutes;
    Duration lookback;
    double goodMinutes;
    double fairMinutes;

    public static SleepSettings defaults() {
        return from(new PresenceProperties.SleepProperties());
    }

    public static SleepSettings from(PresenceProperties.SleepProperties sleep) {
        SleepWindow window;
        try {
            window = SleepWindow.parse(sleep.getWindowStart(), sleep.getWindowEnd());
        } catch (IllegalArgumentException e) {
            log.warn("[Sleep] Sleep window '{}'-'{}' is missing or invalid, using default {}-{}",
                    sleep.getWindowStart(), sleep.getWindowEnd(), DEFAULT_WINDOW_START, DEFAULT_WINDOW_END);
            window = SleepWindow.parse(DEFAULT_WINDOW_START, DEFAULT_WINDOW_END);
        }

        double goodMinutes = nonNegative("quality.good-minutes", sleep.getQuality().getGoodMinutes(),
                DEFAULT_GOOD_MINUTES);
        double fairMinutes = nonNegative("quality.fair-minutes", sleep.getQuality().getFairMinutes(),
                DEFAULT_FAIR_MINUTES);
        if (fairMinutes > goodMinutes) {
            log.warn("[Sleep] quality.fair-minutes {} exceeds quality.good-minutes {}, using defaults",
                    fairMinutes, goodMinutes);
            goodMinutes = DEFAULT_GOOD_MINUTES;
            fairMinutes = DEFAULT_FAIR_MINUTES;
        }

        int lookbackHours = sleep.getLookbackHours();
        if (lookbackHours <= 0) {
            log.warn("[Sleep] lookback-hours {} is not positive, using default {}", lookbackHours,
                    DEFAULT_LOOKBACK_HOURS);
            lookbackHours = DEFAULT_LOOKBACK_HOURS;
        }

        return SleepSettings.builder()
                .window(window)
                .minSleepMinutes(nonNegative("min-sleep-minutes", sleep.getMinSleepMinutes(),
                        DEFAULT_MIN_SLEEP_MINUTES))
                .typicalWakeTime(clockTime("typical-wake-time", sleep.getTypicalWakeTime(), DEFAULT_TYPICAL_WAKE))
                .typicalBedtime(clockTime("typical-bedtime", sleep.getTypicalBedtime(), DEFAULT_TYPICAL_BEDTIME))
                .wakeDivider(clockTime("wake-divider", sleep.getWakeDivider(), DEFAULT_WAKE_DIVIDER))
                .realWakeGraceMinutes(nonNegative("real-wake-grace-minutes", sleep.getRealWakeGraceMinutes(),
                        DEFAULT_REAL_WAKE_GRACE_MINUTES))
                .mergeGapMinutes(nonNegative("merge-gap-minutes", sleep.getMergeGapMinutes(),
                        DEFAULT_MERGE_GAP_MINUTES))
                .lookback(Duration.ofHours(lookbackHours))
                .goodMinutes(goodMinutes)
                .fairMinutes(fairMinutes)
                .build();
    }

    private static LocalTime clockTime(String key, String value, String fallback) {
        try {
            return SleepWindow.parseClockTime(value);
        } catch (IllegalArgumentException e) {
            log.warn("[Sleep] {} '{}' is missing or invalid, using default {}", key, value, fallback);
            return SleepWindow.parseClockTime(fallback);
        }
    }

    private static double nonNegative(String key, double value, double fallback) {
        if (Double.isNaN(value) || value < 0) {
            log.warn("[Sleep] {} {} is invalid, using default {}", key, value, fallback);
            return fallback;
        }
        return value;
    }
}
