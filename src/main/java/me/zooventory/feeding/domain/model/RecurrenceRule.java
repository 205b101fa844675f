package me.zooventory.feeding.domain.model;

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

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Recurrence policy of a feeding schedule, one implementation per
 * {@link FeedingFrequency}.
 *
 * <p>
 * Rules are pure: {@link #next(Instant, Instant, ZoneId)} depends only on its
 * arguments. Wall-clock times are resolved with
 * {@link ZonedDateTime#of(LocalDate, LocalTime, ZoneId)}, so a local time inside
 * a DST overlap maps to the earlier instant and a local time inside a DST gap is
 * shifted forward by the length of the gap. Day arithmetic moves the local date
 * and resolves the wall-clock time again, which keeps a 09:00 feeding at 09:00
 * across offset changes.
 */
public interface RecurrenceRule {

    int DAYS_PER_WEEK = 7;

    /**
     * Interval used by a daily rule that has no time of day to anchor to.
     */
    Duration UNANCHORED_DAILY_INTERVAL = Duration.ofHours(24);

    FeedingFrequency frequency();

    /**
     * Compute the next due instant.
     *
     * @param previousDue
     *            the due instant that just fired, may be {@code null} for a
     *            schedule that was never seeded
     * @param now
     *            the current instant, injected by the caller
     * @param zone
     *            zone used for every wall-clock combination
     */
    Instant next(Instant previousDue, Instant now, ZoneId zone);

    /**
     * Build the rule for a stored schedule.
     *
     * @throws ScheduleConfigurationException
     *             if the fields required by the schedule's frequency are missing
     *             or invalid
     */
    static RecurrenceRule from(FeedingSchedule schedule) {
        Objects.requireNonNull(schedule, "schedule");
        String id = schedule.getId();
        FeedingFrequency frequency = schedule.getFrequency();
        if (frequency == null) {
            throw new ScheduleConfigurationException(id, "frequency is missing");
        }

        switch (frequency) {
        case EVERY_X_HOURS:
            Integer hours = schedule.getHoursInterval();
            if (hours == null) {
                throw new ScheduleConfigurationException(id, "hoursInterval is required for " + frequency.getCode());
            }
            if (hours <= 0) {
                throw new ScheduleConfigurationException(id, "hoursInterval must be positive, got " + hours);
            }
            return new EveryXHours(hours);
        case WEEKLY:
            if (schedule.getDayOfWeek() == null) {
                throw new ScheduleConfigurationException(id, "dayOfWeek is required for " + frequency.getCode());
            }
            if (schedule.getTimeOfDay() == null) {
                throw new ScheduleConfigurationException(id, "timeOfDay is required for " + frequency.getCode());
            }
            return new Weekly(schedule.getDayOfWeek(), schedule.getTimeOfDay());
        case DAILY:
        default:
            return new Daily(schedule.getTimeOfDay());
        }
    }

    private static Instant atLocal(LocalDate date, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(date, time, zone).toInstant();
    }

    /**
     * Fixed cadence anchored on the previous due instant, so poller latency never
     * shifts the grid.
     */
    record EveryXHours(int hoursInterval) implements RecurrenceRule {

        public EveryXHours {
            if (hoursInterval <= 0) {
                throw new IllegalArgumentException("hoursInterval must be positive");
            }
        }

        @Override
        public FeedingFrequency frequency() {
            return FeedingFrequency.EVERY_X_HOURS;
        }

        @Override
        public Instant next(Instant previousDue, Instant now, ZoneId zone) {
            Instant anchor = previousDue != null ? previousDue : now;
            return anchor.plus(Duration.ofHours(hoursInterval));
        }
    }

    /**
     * Today at {@code timeOfDay} if that is still ahead, otherwise tomorrow. Without
     * a time of day the rule degrades to a 24 hour interval from {@code now}.
     */
    record Daily(LocalTime timeOfDay) implements RecurrenceRule {

        @Override
        public FeedingFrequency frequency() {
            return FeedingFrequency.DAILY;
        }

        @Override
        public Instant next(Instant previousDue, Instant now, ZoneId zone) {
            if (timeOfDay == null) {
                return now.plus(UNANCHORED_DAILY_INTERVAL);
            }
            LocalDate today = now.atZone(zone).toLocalDate();
            Instant candidate = atLocal(today, timeOfDay, zone);
            if (candidate.isAfter(now)) {
                return candidate;
            }
            return atLocal(today.plusDays(1), timeOfDay, zone);
        }
    }

    /**
     * The next {@code dayOfWeek} at {@code timeOfDay}. When today is the target day
     * and the slot has already passed, the following week's slot is used.
     */
    record Weekly(DayOfWeek dayOfWeek, LocalTime timeOfDay) implements RecurrenceRule {

        public Weekly {
            Objects.requireNonNull(dayOfWeek, "dayOfWeek");
            Objects.requireNonNull(timeOfDay, "timeOfDay");
        }

        @Override
        public FeedingFrequency frequency() {
            return FeedingFrequency.WEEKLY;
        }

        @Override
        public Instant next(Instant previousDue, Instant now, ZoneId zone) {
            LocalDate today = now.atZone(zone).toLocalDate();
            int daysAhead = Math.floorMod(dayOfWeek.getValue() - today.getDayOfWeek().getValue(), DAYS_PER_WEEK);
            Instant candidate = atLocal(today.plusDays(daysAhead), timeOfDay, zone);
            if (daysAhead == 0 && !candidate.isAfter(now)) {
                return atLocal(today.plusDays(DAYS_PER_WEEK), timeOfDay, zone);
            }
            return candidate;
        }
    }
}
