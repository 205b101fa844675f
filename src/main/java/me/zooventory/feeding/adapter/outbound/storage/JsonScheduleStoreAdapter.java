package me.zooventory.feeding.adapter.outbound.storage;

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
import me.zooventory.feeding.port.outbound.ScheduleStoreException;
import me.zooventory.feeding.port.outbound.ScheduleStorePort;
import me.zooventory.feeding.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Schedule store kept in {@code feeding/schedules.json}.
 *
 * <p>
 * The file is loaded on first access and cached. Every write replaces the
 * whole file atomically; the cache is only updated after the write succeeded,
 * so a failed save leaves both the file and the cached {@code nextDue}
 * unchanged. Returned schedules are copies.
 */
@Component
@Slf4j
public class JsonScheduleStoreAdapter implements ScheduleStorePort {

    static final String DIRECTORY = "feeding";
    static final String SCHEDULES_FILE = "schedules.json";
    private static final TypeReference<List<FeedingSchedule>> SCHEDULE_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final JsonDocument<FeedingSchedule> document;

    private List<FeedingSchedule> schedulesCache;

    public JsonScheduleStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper) {
        this.document = new JsonDocument<>(storagePort, objectMapper, DIRECTORY, SCHEDULES_FILE,
                SCHEDULE_LIST_TYPE_REF, ScheduleStoreException::new);
    }

    @Override
    public synchronized List<FeedingSchedule> findDue(Instant now) {
        return schedules().stream()
                .filter(s -> s.getNextDue() != null && !s.getNextDue().isAfter(now))
                .map(JsonScheduleStoreAdapter::copy)
                .toList();
    }

    @Override
    public synchronized void save(FeedingSchedule schedule) {
        Objects.requireNonNull(schedule.getId(), "schedule id");
        List<FeedingSchedule> updated = new ArrayList<>(schedules());
        boolean replaced = false;
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).getId().equals(schedule.getId())) {
                updated.set(i, copy(schedule));
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            updated.add(copy(schedule));
        }
        document.write(updated);
        schedulesCache = updated;
        log.debug("[ScheduleStore] Saved schedule {} (next due {})", schedule.getId(), schedule.getNextDue());
    }

    @Override
    public synchronized Optional<FeedingSchedule> findById(String id) {
        return schedules().stream()
                .filter(s -> s.getId().equals(id))
                .findFirst()
                .map(JsonScheduleStoreAdapter::copy);
    }

    @Override
    public synchronized List<FeedingSchedule> findBySubject(String subjectId) {
        return schedules().stream()
                .filter(s -> Objects.equals(s.getSubjectId(), subjectId))
                .map(JsonScheduleStoreAdapter::copy)
                .toList();
    }

    @Override
    public synchronized boolean delete(String id) {
        List<FeedingSchedule> updated = new ArrayList<>(schedules());
        if (!updated.removeIf(s -> s.getId().equals(id))) {
            return false;
        }
        document.write(updated);
        schedulesCache = updated;
        return true;
    }

    private List<FeedingSchedule> schedules() {
        if (schedulesCache == null) {
            List<FeedingSchedule> loaded = document.read();
            loaded.removeIf(s -> {
                if (s.getId() == null) {
                    log.warn("[ScheduleStore] Dropping schedule without id from {}", document.location());
                    return true;
                }
                return false;
            });
            schedulesCache = loaded;
        }
        return schedulesCache;
    }

    private static FeedingSchedule copy(FeedingSchedule schedule) {
        return schedule.toBuilder().build();
    }
}
