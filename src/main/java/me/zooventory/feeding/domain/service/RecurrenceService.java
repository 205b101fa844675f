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

import me.zooventory.feeding.domain.model.FeedingSchedule;
import me.zooventory.feeding.domain.model.RecurrenceRule;
import me.zooventory.feeding.domain.model.ScheduleConfigurationException;
import me.zooventory.feeding.infrastructure.config.ZooventoryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Computes the next due instant of a feeding schedule.
 *
 * <p>
 * {@link #computeNext(FeedingSchedule, Instant)} is side-effect free apart from
 * logging: the caller supplies "now", and the schedule is not modified. It is
 * used by the poller after each occurrence and by the create/edit flow to seed
 * or refresh {@code nextDue}.
 *
 * <p>
 * A schedule whose fields do not fit its frequency never stalls: it is moved
 * {@code zooventory.schedule.fallback-delay} (24 hours by default) past now and
 * a warning is logged.
 */
@Service
@Slf4j
public class RecurrenceService {

    private final ZoneId zone;
    private final Duration fallbackDelay;

    public RecurrenceService(ZooventoryProperties properties) {
        this.zone = resolveZone(properties.getSchedule().getZoneId());
        Duration fallbackDelay = properties.getSchedule().getFallbackDelay();
        if (fallbackDelay == null || fallbackDelay.isZero() || fallbackDelay.isNegative()) {
            throw new IllegalArgumentException("fallbackDelay must be > 0");
        }
        this.fallbackDelay = fallbackDelay;
    }

    /**
     * Compute the next occurrence of {@code schedule} as of {@code now}.
     *
     * @return the next due instant; never {@code null}
     */
    public Instant computeNext(FeedingSchedule schedule, Instant now) {
        Objects.requireNonNull(now, "now");
        try {
            RecurrenceRule rule = RecurrenceRule.from(schedule);
            return rule.next(schedule.getNextDue(), now, zone);
        } catch (ScheduleConfigurationException e) {
            Instant fallback = now.plus(fallbackDelay);
            log.warn("[Recurrence] Schedule {} misconfigured ({}), falling back to {}",
                    e.getScheduleId(), e.getReason(), fallback);
            return fallback;
        }
    }

    private static ZoneId resolveZone(String zoneId) {
        if (zoneId == null || zoneId.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(zoneId.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid zooventory.schedule.zone-id: " + zoneId, e);
        }
    }
}
