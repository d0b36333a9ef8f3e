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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.presence.adapter.inbound.web.dto.DayStartResponse;
import me.golemcore.presence.adapter.inbound.web.dto.SleepSegmentRequest;
import me.golemcore.presence.adapter.inbound.web.dto.WakeSegmentRequest;
import me.golemcore.presence.domain.model.ReconciledNight;
import me.golemcore.presence.domain.model.SleepSegment;
import me.golemcore.presence.domain.model.WakeSegment;
import me.golemcore.presence.domain.service.DayBoundaryResolver;
import me.golemcore.presence.domain.service.SleepSummaryService;
import me.golemcore.presence.domain.service.SleepWakeRecorder;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Sleep summary and stated sleep/wake intervals. Callers supply already
 * structured time ranges; free-text parsing happens upstream.
 */
@RestController
@RequestMapping("/api/sleep")
@RequiredArgsConstructor
@Slf4j
public class SleepController {

    private final SleepSummaryService sleepSummaryService;
    private final SleepWakeRecorder recorder;
    private final DayBoundaryResolver dayBoundaryResolver;

    @GetMapping("/night")
    public Mono<ResponseEntity<ReconciledNight>> getNight() {
        return Mono.just(ResponseEntity.ok(sleepSummaryService.getReconciledNight()));
    }

    @GetMapping("/day-start")
    public Mono<ResponseEntity<DayStartResponse>> getDayStart() {
        DayStartResponse response = DayStartResponse.builder()
                .dayStart(dayBoundaryResolver.getCurrentDayStart().orElse(null))
                .pendingWake(dayBoundaryResolver.getPendingWake().orElse(null))
                .startupResolved(dayBoundaryResolver.isStartupResolved())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @PostMapping("/segments")
    public Mono<ResponseEntity<SleepSegment>> recordSleep(@RequestBody SleepSegmentRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        log.info("[API] Stated sleep {} -> {}", request.getStart(), request.getEnd());
        SleepSegment segment = recorder.recordUserStatedInterval(request.getStart(), request.getEnd(),
                request.getNote());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(segment));
    }

    @PostMapping("/wake-segments")
    public Mono<ResponseEntity<WakeSegment>> recordWake(@RequestBody WakeSegmentRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        log.info("[API] Stated wake at {}", request.getStart());
        WakeSegment segment;
        if (request.getEnd() != null) {
            segment = recorder.recordWakeInterval(request.getStart(), request.getEnd(), request.getNotes());
        } else if (request.getDurationMinutes() != null) {
            segment = recorder.recordEstimatedWakeInterval(request.getStart(), request.getDurationMinutes(),
                    request.getNotes());
        } else {
            throw new IllegalArgumentException("Either end or durationMinutes is required");
        }
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(segment));
    }
}
