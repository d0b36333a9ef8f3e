package me.golemcore.presence.monitor;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.presence.domain.service.DayBoundaryResolver;
import me.golemcore.presence.domain.service.PresenceMonitorService;
import me.golemcore.presence.infrastructure.config.PresenceProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The single periodic task driving presence detection.
 *
 * <p>
 * On startup it resolves restart versus cold start, resumes any away
 * interval left open by the previous process, then polls the idle command at
 * the configured interval. A tick that overlaps a slow previous one is
 * skipped. Failures are logged and never stop the schedule.
 *
 * @since 1.0
 * @see PresenceMonitorService
 * @see DayBoundaryResolver
 */
@Component
@Slf4j
public class PresenceMonitorScheduler {

    private final PresenceMonitorService monitorService;
    private final DayBoundaryResolver dayBoundaryResolver;
    private final PresenceProperties properties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public PresenceMonitorScheduler(PresenceMonitorService monitorService, DayBoundaryResolver dayBoundaryResolver,
            PresenceProperties properties, Clock clock) {
        this.monitorService = monitorService;
        this.dayBoundaryResolver = dayBoundaryResolver;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!properties.getMonitor().isEnabled()) {
            log.info("[Presence] Monitor disabled");
            return;
        }

        startup(clock.instant());

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "presence-monitor");
            t.setDaemon(true);
            return t;
        });

        int pollIntervalSeconds = Math.max(1, properties.getMonitor().getPollIntervalSeconds());
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                pollIntervalSeconds,
                pollIntervalSeconds,
                TimeUnit.SECONDS);

        log.info("[Presence] Monitor started with poll interval: {}s", pollIntervalSeconds);
    }

    void startup(Instant now) {
        try {
            Instant dayStart = dayBoundaryResolver.resolveStartup(now);
            log.info("[Presence] Current day start: {}", dayStart);
        } catch (RuntimeException e) {
            log.error("[Presence] Startup day-boundary resolution failed: {}", e.getMessage(), e);
        }
        try {
            monitorService.recover(now);
        } catch (RuntimeException e) {
            log.error("[Presence] Restart recovery failed: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Presence] Monitor shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Presence] Tick skipped: previous poll still in progress");
            return;
        }
        try {
            monitorService.pollIdleTime();
        } catch (Exception e) {
            log.error("[Presence] Poll failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }
}
