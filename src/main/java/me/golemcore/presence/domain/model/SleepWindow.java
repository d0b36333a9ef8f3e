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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Clock-time range {@code [start, end)} during which long away intervals may
 * count as sleep. The range wraps midnight when {@code start > end}.
 *
 * <p>
 * Membership compares minutes since midnight, never whole hours: 22:17 is
 * outside a window opening at 22:30.
 */
public final class SleepWindow {

    private static final int MINUTES_PER_DAY = 24 * 60;
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final LocalTime start;
    private final LocalTime end;

    private SleepWindow(LocalTime start, LocalTime end) {
        this.start = start;
        this.end = end;
    }

    public static SleepWindow of(LocalTime start, LocalTime end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Sleep window bounds must not be null");
        }
        return new SleepWindow(start.withSecond(0).withNano(0), end.withSecond(0).withNano(0));
    }

    /**
     * Parses {@code "HH:MM"} bounds.
     *
     * @throws IllegalArgumentException
     *             if either bound is blank or not a valid clock time
     */
    public static SleepWindow parse(String start, String end) {
        return of(parseClockTime(start), parseClockTime(end));
    }

    public static LocalTime parseClockTime(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Clock time must not be blank");
        }
        try {
            return LocalTime.parse(value.trim(), HH_MM);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid HH:MM clock time: " + value, e);
        }
    }

    public LocalTime getStart() {
        return start;
    }

    public LocalTime getEnd() {
        return end;
    }

    public boolean wrapsMidnight() {
        return minuteOfDay(start) > minuteOfDay(end);
    }

    public boolean contains(LocalTime time) {
        return containsMinute(minuteOfDay(time));
    }

    public boolean contains(Instant instant, ZoneId zone) {
        return contains(instant.atZone(zone).toLocalTime());
    }

    /**
     * Membership for a minute-of-day value in {@code [0, 1440)}.
     */
    public boolean containsMinute(int minuteOfDay) {
        int windowStart = minuteOfDay(start);
        int windowEnd = minuteOfDay(end);
        if (windowStart > windowEnd) {
            return minuteOfDay >= windowStart || minuteOfDay < windowEnd;
        }
        return windowStart <= minuteOfDay && minuteOfDay < windowEnd;
    }

    /**
     * Latest window opening at or before {@code instant}.
     */
    public ZonedDateTime latestOpening(Instant instant, ZoneId zone) {
        ZonedDateTime local = instant.atZone(zone);
        ZonedDateTime opening = atClockTime(local.toLocalDate(), start, zone);
        if (opening.toInstant().isAfter(instant)) {
            opening = atClockTime(local.toLocalDate().minusDays(1), start, zone);
        }
        return opening;
    }

    /**
     * Closing instant of the window occurrence that opens at {@code opening}.
     */
    public ZonedDateTime closingAfter(ZonedDateTime opening) {
        LocalDate closingDate = wrapsMidnight() || start.equals(end)
                ? opening.toLocalDate().plusDays(1)
                : opening.toLocalDate();
        return atClockTime(closingDate, end, opening.getZone());
    }

    public static int minuteOfDay(LocalTime time) {
        return (time.getHour() * 60 + time.getMinute()) % MINUTES_PER_DAY;
    }

    private static ZonedDateTime atClockTime(LocalDate date, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(date, time, zone);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SleepWindow other)) {
            return false;
        }
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return 31 * start.hashCode() + end.hashCode();
    }

    @Override
    public String toString() {
        return HH_MM.format(start) + "-" + HH_MM.format(end);
    }
}
