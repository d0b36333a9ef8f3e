package me.golemcore.presence.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.presence.domain.model.PresenceSnapshot;
import me.golemcore.presence.domain.model.PresenceStatistics;
import me.golemcore.presence.domain.service.DayBoundaryResolver;
import me.golemcore.presence.domain.service.PresenceMonitorService;
import me.golemcore.presence.domain.service.PresenceStatisticsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Presence status and statistics endpoints.
 */
@RestController
@RequestMapping("/api/presence")
@RequiredArgsConstructor
public class PresenceController {

    private final PresenceMonitorService monitorService;
    private final PresenceStatisticsService statisticsService;
    private final DayBoundaryResolver dayBoundaryResolver;
    private final Clock clock;

    @GetMapping("/state")
    public Mono<ResponseEntity<PresenceSnapshot>> getState() {
        return Mono.just(ResponseEntity.ok(monitorService.getPresenceState()));
    }

    /**
     * Statistics since {@code since} (ISO-8601 instant), or since the current
     * day start, or since local midnight before any day start is known.
     */
    @GetMapping("/statistics")
    public Mono<ResponseEntity<PresenceStatistics>> getStatistics(
            @RequestParam(required = false) String since) {
        Instant now = clock.instant();
        Instant from = since != null && !since.isBlank()
                ? parseInstant(since)
                : dayBoundaryResolver.getCurrentDayStart().orElseGet(() -> startOfToday(now));
        return Mono.just(ResponseEntity.ok(statisticsService.getPresenceStatistics(from, now)));
    }

    private Instant startOfToday(Instant now) {
        return LocalDate.ofInstant(now, clock.getZone()).atStartOfDay(clock.getZone()).toInstant();
    }

    private static Instant parseInstant(String value) {
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid instant: " + value, e);
        }
    }
}
