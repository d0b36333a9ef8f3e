package me.golemcore.presence.adapter.outbound.storage;

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

import me.golemcore.presence.domain.model.PresenceEvent;
import me.golemcore.presence.domain.model.SleepSegment;
import me.golemcore.presence.domain.model.WakeSegment;
import me.golemcore.presence.infrastructure.config.PresenceProperties;
import me.golemcore.presence.port.outbound.StoragePort;
import me.golemcore.presence.port.outbound.TelemetryStoreException;
import me.golemcore.presence.port.outbound.TelemetryStorePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * {@link TelemetryStorePort} backed by JSONL files in {@link StoragePort}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>One JSON object per line, appended and never rewritten</li>
 * <li>Presence events split into one file per UTC day
 * ({@code presence/events-YYYY-MM-DD.jsonl})</li>
 * <li>Sleep and wake segments in {@code sleep/sleep-segments.jsonl} and
 * {@code sleep/wake-segments.jsonl}, kept forever</li>
 * <li>In-memory index loaded on startup; copy-on-write lists let readers run
 * without locks</li>
 * <li>Hourly eviction of presence events beyond the retention window</li>
 * </ul>
 *
 * <p>
 * A record reaches the in-memory index only after its append succeeded, so
 * readers never see telemetry that is not on disk.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class JsonlTelemetryStore implements TelemetryStorePort {

    static final String PRESENCE_DIR = "presence";
    static final String SLEEP_DIR = "sleep";
    static final String PRESENCE_FILE_PREFIX = "events-";
    static final String SLEEP_SEGMENTS_FILE = "sleep-segments.jsonl";
    static final String WAKE_SEGMENTS_FILE = "wake-segments.jsonl";

    private static final String LOG_PREFIX = "[Telemetry]";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";
    private static final int EVICTION_INTERVAL_HOURS = 1;
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration presenceRetention;

    private final List<PresenceEvent> presenceEvents = new CopyOnWriteArrayList<>();
    private final List<SleepSegment> sleepSegments = new CopyOnWriteArrayList<>();
    private final List<WakeSegment> wakeSegments = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService evictionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "presence-eviction");
        t.setDaemon(true);
        return t;
    });

    public JsonlTelemetryStore(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            PresenceProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.presenceRetention = Duration.ofDays(Math.max(1, properties.getStorage().getPresenceRetentionDays()));
    }

    @PostConstruct
    void init() {
        load();
        evictionExecutor.scheduleAtFixedRate(this::evictExpiredPresenceEvents,
                EVICTION_INTERVAL_HOURS, EVICTION_INTERVAL_HOURS, TimeUnit.HOURS);
    }

    @PreDestroy
    void destroy() {
        evictionExecutor.shutdownNow();
        try {
            evictionExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void load() {
        Instant cutoff = clock.instant().minus(presenceRetention);
        List<PresenceEvent> loadedEvents = new ArrayList<>();
        for (String file : listFiles(PRESENCE_DIR, PRESENCE_FILE_PREFIX)) {
            for (PresenceEvent event : readLines(PRESENCE_DIR, file, PresenceEvent.class)) {
                if (event.getTimestamp() != null && !event.getTimestamp().isBefore(cutoff)) {
                    loadedEvents.add(event);
                }
            }
        }
        loadedEvents.sort(Comparator.comparing(PresenceEvent::getTimestamp));
        presenceEvents.addAll(loadedEvents);

        sleepSegments.addAll(readLines(SLEEP_DIR, SLEEP_SEGMENTS_FILE, SleepSegment.class));
        wakeSegments.addAll(readLines(SLEEP_DIR, WAKE_SEGMENTS_FILE, WakeSegment.class));

        log.info("{} Loaded {} presence events (last {}d), {} sleep segments, {} wake segments",
                LOG_PREFIX, presenceEvents.size(), presenceRetention.toDays(),
                sleepSegments.size(), wakeSegments.size());
    }

    // ==================== Presence events ====================

    @Override
    public synchronized void appendPresenceEvent(PresenceEvent event) {
        String file = presenceFileFor(event.getTimestamp());
        append(PRESENCE_DIR, file, event);

        int index = presenceEvents.size();
        while (index > 0 && presenceEvents.get(index - 1).getTimestamp().isAfter(event.getTimestamp())) {
            index--;
        }
        presenceEvents.add(index, event);
        log.debug("{} Appended {} at {}", LOG_PREFIX, event.getKind(), event.getTimestamp());
    }

    @Override
    public List<PresenceEvent> findPresenceEventsSince(Instant since) {
        return presenceEvents.stream()
                .filter(e -> !e.getTimestamp().isBefore(since))
                .toList();
    }

    @Override
    public Optional<PresenceEvent> findLastPresenceEventBefore(Instant before) {
        PresenceEvent last = null;
        for (PresenceEvent event : presenceEvents) {
            if (!event.getTimestamp().isBefore(before)) {
                break;
            }
            last = event;
        }
        return Optional.ofNullable(last);
    }

    @Override
    public Optional<PresenceEvent> findLatestPresenceEvent() {
        List<PresenceEvent> snapshot = List.copyOf(presenceEvents);
        return snapshot.isEmpty() ? Optional.empty() : Optional.of(snapshot.get(snapshot.size() - 1));
    }

    @Override
    public synchronized int prunePresenceEventsBefore(Instant cutoff) {
        int before = presenceEvents.size();
        presenceEvents.removeIf(e -> e.getTimestamp().isBefore(cutoff));
        int pruned = before - presenceEvents.size();

        LocalDate cutoffDate = cutoff.atZone(ZoneOffset.UTC).toLocalDate();
        for (String file : listFiles(PRESENCE_DIR, PRESENCE_FILE_PREFIX)) {
            Optional<LocalDate> fileDate = presenceFileDate(file);
            if (fileDate.isPresent() && fileDate.get().isBefore(cutoffDate)) {
                try {
                    storagePort.deleteObject(PRESENCE_DIR, file).join();
                    log.debug("{} Deleted expired presence file {}", LOG_PREFIX, file);
                } catch (CompletionException | IllegalStateException e) {
                    log.warn("{} Failed to delete expired presence file {}: {}", LOG_PREFIX, file,
                            e.getMessage());
                }
            }
        }
        return pruned;
    }

    private void evictExpiredPresenceEvents() {
        try {
            int pruned = prunePresenceEventsBefore(clock.instant().minus(presenceRetention));
            if (pruned > 0) {
                log.info("{} Evicted {} presence events beyond {}d retention", LOG_PREFIX, pruned,
                        presenceRetention.toDays());
            }
        } catch (RuntimeException e) {
            log.warn("{} Presence event eviction failed", LOG_PREFIX, e);
        }
    }

    // ==================== Sleep and wake segments ====================

    @Override
    public synchronized void appendSleepSegment(SleepSegment segment) {
        append(SLEEP_DIR, SLEEP_SEGMENTS_FILE, segment);
        sleepSegments.add(segment);
    }

    @Override
    public synchronized void appendWakeSegment(WakeSegment segment) {
        append(SLEEP_DIR, WAKE_SEGMENTS_FILE, segment);
        wakeSegments.add(segment);
    }

    @Override
    public List<SleepSegment> findSleepSegmentsTouching(Instant from, Instant to) {
        return sleepSegments.stream()
                .filter(s -> s.touches(from, to))
                .sorted(Comparator.comparing(SleepSegment::getStart))
                .toList();
    }

    @Override
    public List<WakeSegment> findWakeSegmentsTouching(Instant from, Instant to) {
        return wakeSegments.stream()
                .filter(w -> w.touches(from, to))
                .sorted(Comparator.comparing(WakeSegment::getStart))
                .toList();
    }

    // ==================== JSONL plumbing ====================

    private void append(String directory, String file, Object record) {
        String line;
        try {
            line = objectMapper.writeValueAsString(record) + NEWLINE;
        } catch (JsonProcessingException e) {
            throw new TelemetryStoreException("Failed to serialize " + record.getClass().getSimpleName(), e);
        }
        try {
            storagePort.appendText(directory, file, line).join();
        } catch (CompletionException | IllegalStateException e) {
            log.error("{} Failed to append to {}/{}: {}", LOG_PREFIX, directory, file, e.getMessage());
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TelemetryStoreException("Failed to append to " + directory + "/" + file, cause);
        }
    }

    private List<String> listFiles(String directory, String prefix) {
        try {
            List<String> files = storagePort.listObjects(directory, prefix).join();
            return files != null ? files : List.of();
        } catch (CompletionException | IllegalStateException e) {
            log.warn("{} Failed to list {}: {}", LOG_PREFIX, directory, e.getMessage());
            return List.of();
        }
    }

    private <T> List<T> readLines(String directory, String file, Class<T> type) {
        String content;
        try {
            content = storagePort.getText(directory, file).join();
        } catch (CompletionException | IllegalStateException e) {
            log.warn("{} Failed to read {}/{}: {}", LOG_PREFIX, directory, file, e.getMessage());
            return List.of();
        }
        if (content == null || content.isBlank()) {
            return List.of();
        }
        return parseLines(file, content, line -> {
            try {
                return objectMapper.readValue(line, type);
            } catch (JsonProcessingException e) {
                log.debug("{} Skipping malformed line in {}: {}", LOG_PREFIX, file, e.getMessage());
                return null;
            }
        });
    }

    private static <T> List<T> parseLines(String file, String content, Function<String, T> parser) {
        List<T> records = new ArrayList<>();
        for (String line : content.split(NEWLINE)) {
            if (line.isBlank()) {
                continue;
            }
            T parsed = parser.apply(line);
            if (parsed != null) {
                records.add(parsed);
            }
        }
        log.debug("{} Parsed {} records from {}", LOG_PREFIX, records.size(), file);
        return records;
    }

    static String presenceFileFor(Instant timestamp) {
        return PRESENCE_FILE_PREFIX + timestamp.atZone(ZoneOffset.UTC).toLocalDate() + JSONL_EXTENSION;
    }

    static Optional<LocalDate> presenceFileDate(String file) {
        if (!file.startsWith(PRESENCE_FILE_PREFIX) || !file.endsWith(JSONL_EXTENSION)) {
            return Optional.empty();
        }
        String date = file.substring(PRESENCE_FILE_PREFIX.length(), file.length() - JSONL_EXTENSION.length());
        try {
            return Optional.of(LocalDate.parse(date));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
