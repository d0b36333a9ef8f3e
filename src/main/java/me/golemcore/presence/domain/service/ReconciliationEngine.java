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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.presence.domain.model.Durations;
import me.golemcore.presence.domain.model.ReconciledNight;
import me.golemcore.presence.domain.model.SleepPeriod;
import me.golemcore.presence.domain.model.SleepQuality;
import me.golemcore.presence.domain.model.SleepSegment;
import me.golemcore.presence.domain.model.SleepSource;
import me.golemcore.presence.domain.model.WakeInterruption;
import me.golemcore.presence.domain.model.WakeSegment;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges sleep and wake records into one conflict-free night.
 *
 * <ol>
 * <li>Conflict filtering: a system segment overlapping a segment of a
 * higher-priority source is discarded. User-stated segments are never
 * discarded, not even against each other.</li>
 * <li>Timeline: the surviving sleep segments and all wake segments become a
 * stream of start and end boundaries. At equal instants ends sort before
 * starts.</li>
 * <li>Walk: time is asleep while at least one sleep segment is open and no
 * accepted wake is open. A wake starting with no open sleep is skipped along
 * with its end. A wake still open when the last sleep closes is clipped
 * there.</li>
 * <li>Aggregate: periods separated by at most the merge gap with no
 * interruption between them are joined, then totals are summed.</li>
 * </ol>
 *
 * <p>
 * Pure and stateless: the same input always yields the same night, and
 * {@code computedAt} is left for the caller to stamp.
 */
@Component
@Slf4j
public class ReconciliationEngine {

    private static final Comparator<SleepSegment> SLEEP_ORDER = Comparator
            .comparing(SleepSegment::getStart)
            .thenComparing(SleepSegment::getEnd)
            .thenComparing(segment -> String.valueOf(segment.getId()));

    private static final Comparator<WakeSegment> WAKE_ORDER = Comparator
            .comparing(WakeSegment::getStart)
            .thenComparing(WakeSegment::getEffectiveEnd)
            .thenComparing(segment -> String.valueOf(segment.getId()));

    private final SleepSettings settings;

    public ReconciliationEngine(SleepSettings settings) {
        this.settings = settings;
    }

    public ReconciledNight reconcile(Collection<SleepSegment> sleepSegments, Collection<WakeSegment> wakeSegments) {
        List<SleepSegment> validSleep = validSleep(sleepSegments);
        List<WakeSegment> validWake = validWake(wakeSegments);

        List<String> discarded = new ArrayList<>();
        List<SleepSegment> surviving = filterConflicts(validSleep, discarded);

        Walk walk = new Walk();
        walk.run(timeline(surviving, validWake));
        List<SleepPeriod> periods = mergeAdjacent(walk.periods, walk.interruptions, walk.sourceMinutes);

        return aggregate(surviving, periods, walk.interruptions, walk.sourceMinutes, discarded);
    }

    // ==================== Step 0: validation and conflicts ====================

    private static List<SleepSegment> validSleep(Collection<SleepSegment> segments) {
        List<SleepSegment> valid = new ArrayList<>();
        if (segments == null) {
            return valid;
        }
        for (SleepSegment segment : segments) {
            if (segment == null || segment.getStart() == null || segment.getEnd() == null
                    || segment.getSource() == null) {
                log.warn("[Reconcile] Skipping incomplete sleep segment {}", segment);
                continue;
            }
            if (segment.getEnd().isBefore(segment.getStart())) {
                log.warn("[Reconcile] Skipping sleep segment {} ending before it starts", segment.getId());
                continue;
            }
            valid.add(segment);
        }
        valid.sort(SLEEP_ORDER);
        return valid;
    }

    private static List<WakeSegment> validWake(Collection<WakeSegment> segments) {
        List<WakeSegment> valid = new ArrayList<>();
        if (segments == null) {
            return valid;
        }
        for (WakeSegment segment : segments) {
            Instant effectiveEnd = segment != null ? segment.getEffectiveEnd() : null;
            if (effectiveEnd == null || segment.getStart() == null) {
                log.warn("[Reconcile] Skipping wake segment {} without a usable interval", segment);
                continue;
            }
            if (!effectiveEnd.isAfter(segment.getStart())) {
                log.warn("[Reconcile] Skipping wake segment {} with non-positive duration", segment.getId());
                continue;
            }
            valid.add(segment);
        }
        valid.sort(WAKE_ORDER);
        return valid;
    }

    /**
     * Visits segments from the highest-priority source down. A system segment
     * survives unless it overlaps a survivor of strictly higher priority.
     */
    private static List<SleepSegment> filterConflicts(List<SleepSegment> segments, List<String> discarded) {
        List<SleepSegment> byPriority = new ArrayList<>(segments);
        byPriority.sort(Comparator.comparingInt((SleepSegment s) -> -s.getSource().getPriority())
                .thenComparing(SLEEP_ORDER));

        List<SleepSegment> surviving = new ArrayList<>();
        for (SleepSegment candidate : byPriority) {
            SleepSegment winner = null;
            if (candidate.getSource().isSystem()) {
                for (SleepSegment kept : surviving) {
                    if (kept.getSource().getPriority() > candidate.getSource().getPriority()
                            && kept.overlaps(candidate)) {
                        winner = kept;
                        break;
                    }
                }
            }
            if (winner != null) {
                log.debug("[Reconcile] Discarding {} segment {} overlapped by {} segment {}",
                        candidate.getSource().getWireName(), candidate.getId(),
                        winner.getSource().getWireName(), winner.getId());
                discarded.add(candidate.getId());
            } else {
                surviving.add(candidate);
            }
        }
        surviving.sort(SLEEP_ORDER);
        discarded.sort(Comparator.nullsFirst(Comparator.naturalOrder()));
        return surviving;
    }

    // ==================== Step 1: timeline ====================

    private enum BoundaryType {
        SLEEP_END, WAKE_END, SLEEP_START, WAKE_START
    }

    private record Boundary(Instant at, BoundaryType type, int index, SleepSegment sleep, WakeSegment wake) {
    }

    private static final Comparator<Boundary> BOUNDARY_ORDER = Comparator
            .comparing(Boundary::at)
            .thenComparing(Boundary::type)
            .thenComparingInt(Boundary::index);

    private static List<Boundary> timeline(List<SleepSegment> sleep, List<WakeSegment> wake) {
        List<Boundary> boundaries = new ArrayList<>();
        for (int i = 0; i < sleep.size(); i++) {
            SleepSegment segment = sleep.get(i);
            boundaries.add(new Boundary(segment.getStart(), BoundaryType.SLEEP_START, i, segment, null));
            boundaries.add(new Boundary(segment.getEnd(), BoundaryType.SLEEP_END, i, segment, null));
        }
        for (int i = 0; i < wake.size(); i++) {
            WakeSegment segment = wake.get(i);
            boundaries.add(new Boundary(segment.getStart(), BoundaryType.WAKE_START, i, null, segment));
            boundaries.add(new Boundary(segment.getEffectiveEnd(), BoundaryType.WAKE_END, i, null, segment));
        }
        boundaries.sort(BOUNDARY_ORDER);
        return boundaries;
    }

    // ==================== Step 2: state walk ====================

    private static final class Walk {

        private final Map<SleepSource, Integer> openSleep = new EnumMap<>(SleepSource.class);
        private final Map<Integer, WakeSegment> openWake = new LinkedHashMap<>();
        private final Set<Integer> acceptedWake = new HashSet<>();

        private final List<SleepPeriod> periods = new ArrayList<>();
        private final List<WakeInterruption> interruptions = new ArrayList<>();
        private final Map<SleepSource, Double> sourceMinutes = new EnumMap<>(SleepSource.class);

        private Instant cursor;
        private Instant lastSleepEnd;
        private Instant periodStart;
        private final Map<SleepSource, Double> periodMinutes = new EnumMap<>(SleepSource.class);
        private Instant interruptionStart;
        private WakeSegment interruptionWake;
        private boolean interruptionEstimated;

        void run(List<Boundary> boundaries) {
            for (Boundary boundary : boundaries) {
                advanceTo(boundary.at());
                apply(boundary);
            }
        }

        private int sleepDepth() {
            int depth = 0;
            for (int count : openSleep.values()) {
                depth += count;
            }
            return depth;
        }

        private boolean asleep() {
            return sleepDepth() > 0 && openWake.isEmpty();
        }

        private SleepSource dominantOpenSource() {
            SleepSource best = null;
            for (Map.Entry<SleepSource, Integer> entry : openSleep.entrySet()) {
                if (entry.getValue() > 0 && (best == null || entry.getKey().getPriority() > best.getPriority())) {
                    best = entry.getKey();
                }
            }
            return best;
        }

        private void advanceTo(Instant at) {
            if (cursor != null && at.isAfter(cursor) && asleep()) {
                double minutes = Durations.minutesBetween(cursor, at);
                SleepSource source = dominantOpenSource();
                sourceMinutes.merge(source, minutes, Double::sum);
                periodMinutes.merge(source, minutes, Double::sum);
            }
            cursor = at;
        }

        private void apply(Boundary boundary) {
            boolean wasAsleep = asleep();
            boolean wasInterrupted = interruptionStart != null;
            Instant at = boundary.at();

            switch (boundary.type()) {
            case SLEEP_START -> openSleep.merge(boundary.sleep().getSource(), 1, Integer::sum);
            case SLEEP_END -> {
                openSleep.computeIfPresent(boundary.sleep().getSource(), (source, count) -> count - 1);
                lastSleepEnd = at;
                if (sleepDepth() == 0 && !openWake.isEmpty()) {
                    // Wake outlived every sleep segment around it.
                    openWake.clear();
                }
            }
            case WAKE_START -> {
                if (sleepDepth() == 0 && at.equals(lastSleepEnd)) {
                    log.debug("[Reconcile] Ignoring wake segment {} starting where sleep ended at {}",
                            boundary.wake().getId(), at);
                } else if (sleepDepth() == 0) {
                    log.warn("[Reconcile] Ignoring wake segment {} at {} with no enclosing sleep",
                            boundary.wake().getId(), at);
                } else {
                    acceptedWake.add(boundary.index());
                    openWake.put(boundary.index(), boundary.wake());
                }
            }
            case WAKE_END -> {
                if (acceptedWake.contains(boundary.index())) {
                    openWake.remove(boundary.index());
                }
            }
            }

            boolean nowAsleep = asleep();
            boolean nowInterrupted = sleepDepth() > 0 && !openWake.isEmpty();
            if (wasAsleep && !nowAsleep) {
                closePeriod(at);
            }
            if (wasInterrupted && !nowInterrupted) {
                closeInterruption(at);
            }
            if (!wasAsleep && nowAsleep) {
                periodStart = at;
                periodMinutes.clear();
            }
            if (nowInterrupted) {
                if (!wasInterrupted) {
                    interruptionStart = at;
                    interruptionWake = openWake.values().iterator().next();
                    interruptionEstimated = false;
                }
                for (WakeSegment open : openWake.values()) {
                    interruptionEstimated |= open.isEstimated();
                }
            }
        }

        private void closePeriod(Instant at) {
            if (periodStart != null && at.isAfter(periodStart)) {
                periods.add(SleepPeriod.builder()
                        .start(periodStart)
                        .end(at)
                        .source(largestShare(periodMinutes))
                        .build());
            }
            periodStart = null;
            periodMinutes.clear();
        }

        private void closeInterruption(Instant at) {
            if (at.isAfter(interruptionStart)) {
                interruptions.add(WakeInterruption.builder()
                        .start(interruptionStart)
                        .end(at)
                        .source(interruptionWake.getSource())
                        .notes(interruptionWake.getNotes())
                        .estimated(interruptionEstimated)
                        .build());
            }
            interruptionStart = null;
            interruptionWake = null;
            interruptionEstimated = false;
        }
    }

    private static SleepSource largestShare(Map<SleepSource, Double> minutes) {
        SleepSource best = null;
        double bestMinutes = -1;
        for (Map.Entry<SleepSource, Double> entry : minutes.entrySet()) {
            double value = entry.getValue();
            if (value > bestMinutes
                    || (value == bestMinutes && entry.getKey().getPriority() > best.getPriority())) {
                best = entry.getKey();
                bestMinutes = value;
            }
        }
        return best;
    }

    // ==================== Step 3: merge and aggregate ====================

    private List<SleepPeriod> mergeAdjacent(List<SleepPeriod> periods, List<WakeInterruption> interruptions,
            Map<SleepSource, Double> sourceMinutes) {
        List<SleepPeriod> merged = new ArrayList<>();
        for (SleepPeriod period : periods) {
            if (merged.isEmpty()) {
                merged.add(period);
                continue;
            }
            SleepPeriod previous = merged.get(merged.size() - 1);
            double gap = Durations.minutesBetween(previous.getEnd(), period.getStart());
            if (gap <= settings.getMergeGapMinutes()
                    && !interruptedBetween(previous.getEnd(), period.getStart(), interruptions)) {
                SleepSource source = previous.getDurationMinutes() >= period.getDurationMinutes()
                        ? previous.getSource()
                        : period.getSource();
                if (gap > 0) {
                    sourceMinutes.merge(source, gap, Double::sum);
                }
                merged.set(merged.size() - 1, previous.toBuilder().end(period.getEnd()).source(source).build());
            } else {
                merged.add(period);
            }
        }
        return merged;
    }

    private static boolean interruptedBetween(Instant from, Instant to, List<WakeInterruption> interruptions) {
        for (WakeInterruption interruption : interruptions) {
            if (!interruption.getStart().isBefore(from) && !interruption.getEnd().isAfter(to)) {
                return true;
            }
        }
        return false;
    }

    private ReconciledNight aggregate(List<SleepSegment> surviving, List<SleepPeriod> periods,
            List<WakeInterruption> interruptions, Map<SleepSource, Double> sourceMinutes, List<String> discarded) {
        double totalSleep = 0;
        double primary = 0;
        for (SleepPeriod period : periods) {
            totalSleep += period.getDurationMinutes();
            primary = Math.max(primary, period.getDurationMinutes());
        }
        double totalWake = 0;
        for (WakeInterruption interruption : interruptions) {
            totalWake += interruption.getDurationMinutes();
        }

        double timeInBed = 0;
        if (!surviving.isEmpty()) {
            Instant earliest = surviving.get(0).getStart();
            Instant latest = earliest;
            for (SleepSegment segment : surviving) {
                if (segment.getEnd().isAfter(latest)) {
                    latest = segment.getEnd();
                }
            }
            timeInBed = Durations.nonNegativeMinutes(earliest, latest);
        }

        ReconciledNight.ReconciledNightBuilder builder = ReconciledNight.builder()
                .totalSleepMinutes(totalSleep)
                .totalWakeMinutes(totalWake)
                .sleepPeriods(periods)
                .wakeInterruptions(interruptions)
                .fragmented(periods.size() > 1)
                .primarySleepMinutes(primary)
                .timeInBedMinutes(timeInBed)
                .discardedSegmentIds(discarded)
                .quality(grade(totalSleep, periods.isEmpty()));
        for (SleepSource source : SleepSource.values()) {
            Double minutes = sourceMinutes.get(source);
            if (minutes != null && minutes > 0) {
                builder.sourceMinutes(source, minutes);
            }
        }

        ReconciledNight night = builder.build();
        log.debug("[Reconcile] {} period(s), {} min sleep, {} min awake, {} discarded",
                periods.size(), Math.round(totalSleep), Math.round(totalWake), discarded.size());
        return night;
    }

    private SleepQuality grade(double totalSleepMinutes, boolean noSleep) {
        if (noSleep) {
            return SleepQuality.NONE;
        }
        if (totalSleepMinutes >= settings.getGoodMinutes()) {
            return SleepQuality.GOOD;
        }
        if (totalSleepMinutes >= settings.getFairMinutes()) {
            return SleepQuality.FAIR;
        }
        return SleepQuality.POOR;
    }
}
