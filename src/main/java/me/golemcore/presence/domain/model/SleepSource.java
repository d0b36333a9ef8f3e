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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Origin of a sleep or wake record. User statements outrank anything the
 * system inferred on its own.
 */
public enum SleepSource {

    USER_STATED("user_stated", 3),
    PRESENCE_INFERRED("presence_inferred", 2),
    ASSUMED_COLD_START("assumed_cold_start", 1);

    private final String wireName;
    private final int priority;

    SleepSource(String wireName, int priority) {
        this.wireName = wireName;
        this.priority = priority;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isSystem() {
        return this != USER_STATED;
    }

    @JsonCreator
    public static SleepSource fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Sleep source must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SleepSource source : values()) {
            if (source.wireName.equals(normalized) || source.name().equalsIgnoreCase(normalized)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown sleep source: " + value);
    }
}
