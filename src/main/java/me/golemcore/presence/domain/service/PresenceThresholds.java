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

import me.golemcore.presence.infrastructure.config.PresenceProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Idle thresholds driving the presence state machine.
 */
@Value
@Builder
@Slf4j
public class PresenceThresholds {

    public static final double DEFAULT_GRACE_SECONDS = 60;
    public static final double DEFAULT_CONFIRM_SECONDS = 180;

    double graceSeconds;
    double confirmSeconds;

    public static PresenceThresholds defaults() {
        return new PresenceThresholds(DEFAULT_GRACE_SECONDS, DEFAULT_CONFIRM_SECONDS);
    }

    /**
     * Builds thresholds from configuration. A non-positive grace threshold or a
     * confirm threshold not above it falls back to the defaults.
     */
    public static PresenceThresholds from(PresenceProperties.MonitorProperties monitor) {
        double grace = monitor.getGraceThresholdSeconds();
        double confirm = monitor.getConfirmThresholdSeconds();
        if (!(grace > 0) || !(confirm > grace)) {
            log.warn("[Presence] Invalid thresholds grace={}s confirm={}s, using defaults {}s/{}s",
                    grace, confirm, DEFAULT_GRACE_SECONDS, DEFAULT_CONFIRM_SECONDS);
            return defaults();
        }
        return new PresenceThresholds(grace, confirm);
    }
}
