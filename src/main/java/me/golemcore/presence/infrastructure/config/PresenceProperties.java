package me.golemcore.presence.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for presence detection and sleep
 * tracking, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code presence.*} prefix:
 * <ul>
 * <li>{@link MonitorProperties} - poll cadence and away thresholds</li>
 * <li>{@link IdleCommandProperties} - the OS idle-time command</li>
 * <li>{@link SleepProperties} - sleep window, typical wake time and
 * reconciliation tuning</li>
 * <li>{@link StorageProperties} - workspace location and retention</li>
 * </ul>
 *
 * <p>
 * Values that fail validation are replaced by the defaults declared here when
 * {@code PresenceThresholds} and {@code SleepSettings} are built.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "presence")
@Data
public class PresenceProperties {

    private MonitorProperties monitor = new MonitorProperties();
    private IdleCommandProperties idleCommand = new IdleCommandProperties();
    private SleepProperties sleep = new SleepProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class MonitorProperties {
        private boolean enabled = true;
        private int pollIntervalSeconds = 5;
        private double graceThresholdSeconds = 60;
        private double confirmThresholdSeconds = 180;
        private int awayRecoveryMaxHours = 16;
    }

    @Data
    public static class IdleCommandProperties {
        private String command = "xprintidle";
        private IdleUnit unit = IdleUnit.MILLISECONDS;
        private long timeoutMillis = 2000;
    }

    public enum IdleUnit {
        MILLISECONDS, SECONDS
    }

    @Data
    public static class SleepProperties {
        private String windowStart = "22:30";
        private String windowEnd = "09:00";
        private double minSleepMinutes = 120;
        private String typicalWakeTime = "07:00";
        private String typicalBedtime = "22:30";
        private String wakeDivider = "05:30";
        private double realWakeGraceMinutes = 15;
        private double mergeGapMinutes = 2;
        private int lookbackHours = 24;
        private QualityProperties quality = new QualityProperties();
    }

    @Data
    public static class QualityProperties {
        private double goodMinutes = 420;
        private double fairMinutes = 360;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private int presenceRetentionDays = 30;
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/presence";
    }
}
