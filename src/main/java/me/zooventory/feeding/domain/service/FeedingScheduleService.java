package me.zooventory.feeding.domain.service;

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

import me.zooventory.feeding.domain.model.FeedingFrequency;
import me.zooventory.feeding.domain.model.FeedingSchedule;
import me.zooventory.feeding.domain.model.RecurrenceRule;
import me.zooventory.feeding.domain.model.ScheduleConfigurationException;
import me.zooventory.feeding.port.outbound.AnimalRegistryPort;
import me.zooventory.feeding.port.outbound.ScheduleStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Create, edit and delete flows for feeding schedules.
 *
 * <p>
 * Every write validates the recurrence fields against the frequency, clears
 * the fields the frequency ignores, and recomputes {@code nextDue} through
 * {@link RecurrenceService} so an edited schedule never waits for a poller tick
 * to pick up its new cadence. Writes run under the schedule's lock in
 * {@link ScheduleLocks}.
 */
@Service
@Slf4j
public class FeedingScheduleService {

    private final ScheduleStorePort scheduleStore;
    private final AnimalRegistryPort animalRegistry;
    private final RecurrenceService recurrenceService;
    private final ScheduleLocks scheduleLocks;
    private final Clock clock;

    public FeedingScheduleService(ScheduleStorePort scheduleStore, AnimalRegistryPort animalRegistry,
            RecurrenceService recurrenceService, ScheduleLocks scheduleLocks, Clock clock) {
        this.scheduleStore = scheduleStore;
        this.animalRegistry = animalRegistry;
        this.recurrenceService = recurrenceService;
        this.scheduleLocks = scheduleLocks;
        this.clock = clock;
    }

    /**
     * Create a schedule for an animal and seed its first due instant.
     *
     * @throws IllegalArgumentException
     *             if the animal is unknown or the recurrence fields do not fit
     *             the frequency
     */
    public FeedingSchedule createSchedule(String subjectId, FeedingFrequency frequency, LocalTime timeOfDay,
            DayOfWeek dayOfWeek, Integer hoursInterval) {
        if (subjectId == null || animalRegistry.findAnimal(subjectId).isEmpty()) {
            throw new IllegalArgumentException("Animal not found: " + subjectId);
        }

        Instant now = clock.instant();
        FeedingSchedule schedule = FeedingSchedule.builder()
                .id("feed-" + UUID.randomUUID().toString().substring(0, 8))
                .subjectId(subjectId)
                .frequency(frequency)
                .timeOfDay(timeOfDay)
                .dayOfWeek(dayOfWeek)
                .hoursInterval(hoursInterval)
                .createdAt(now)
                .updatedAt(now)
                .build();
        normalize(schedule);
        schedule.setNextDue(recurrenceService.computeNext(schedule, now));

        scheduleStore.save(schedule);
        log.info("[FeedingSchedule] Created {} schedule {} for animal {}, next due {}",
                schedule.getFrequency().getCode(), schedule.getId(), subjectId, schedule.getNextDue());
        return schedule;
    }

    /**
     * Replace the recurrence fields of an existing schedule and recompute its next
     * due instant the same way the poller would.
     *
     * @throws IllegalArgumentException
     *             if the schedule is unknown or the new fields do not fit the
     *             frequency
     */
    public FeedingSchedule updateRecurrence(String id, FeedingFrequency frequency, LocalTime timeOfDay,
            DayOfWeek dayOfWeek, Integer hoursInterval) {
        return scheduleLocks.callExclusively(id, () -> {
            FeedingSchedule schedule = scheduleStore.findById(id)
                    .orElseThrow(() -> new IllegalArgumentException("Schedule not found: " + id));

            FeedingSchedule edited = schedule.toBuilder()
                    .frequency(frequency)
                    .timeOfDay(timeOfDay)
                    .dayOfWeek(dayOfWeek)
                    .hoursInterval(hoursInterval)
                    .build();
            normalize(edited);

            Instant now = clock.instant();
            edited.setNextDue(recurrenceService.computeNext(edited, now));
            edited.setUpdatedAt(now);

            scheduleStore.save(edited);
            log.info("[FeedingSchedule] Updated schedule {}: {}, next due {}",
                    id, edited.getFrequency().getCode(), edited.getNextDue());
            return edited;
        });
    }

    public Optional<FeedingSchedule> findSchedule(String id) {
        return scheduleStore.findById(id);
    }

    public List<FeedingSchedule> findSchedulesForAnimal(String subjectId) {
        return scheduleStore.findBySubject(subjectId);
    }

    /**
     * Delete a schedule by ID.
     *
     * @throws IllegalArgumentException
     *             if not found
     */
    public void deleteSchedule(String id) {
        boolean removed = scheduleLocks.callExclusively(id, () -> scheduleStore.delete(id));
        if (!removed) {
            throw new IllegalArgumentException("Schedule not found: " + id);
        }
        scheduleLocks.forget(id);
        log.info("[FeedingSchedule] Deleted schedule: {}", id);
    }

    /**
     * Reject a schedule whose fields do not fit its frequency, then clear the
     * fields the frequency ignores.
     *
     * @throws IllegalArgumentException
     *             if the fields are inconsistent
     */
    static void normalize(FeedingSchedule schedule) {
        RecurrenceRule rule;
        try {
            rule = RecurrenceRule.from(schedule);
        } catch (ScheduleConfigurationException e) {
            throw new IllegalArgumentException("Invalid feeding schedule: " + e.getReason(), e);
        }

        if (schedule.getTimeOfDay() != null) {
            schedule.setTimeOfDay(schedule.getTimeOfDay().truncatedTo(ChronoUnit.MINUTES));
        }
        switch (rule.frequency()) {
        case EVERY_X_HOURS:
            schedule.setTimeOfDay(null);
            schedule.setDayOfWeek(null);
            break;
        case WEEKLY:
            schedule.setHoursInterval(null);
            break;
        case DAILY:
        default:
            schedule.setDayOfWeek(null);
            schedule.setHoursInterval(null);
            break;
        }
    }
}
