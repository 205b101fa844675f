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

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-schedule mutual exclusion. The poller and the edit flow both mutate
 * {@code nextDue}; holding the schedule's lock keeps each notify-then-advance
 * step and each user edit atomic with respect to one another.
 */
@Component
public class ScheduleLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Run {@code action} under the schedule's lock if the lock is free.
     *
     * @return the action's result, or empty if another writer holds the lock
     */
    public <T> Optional<T> tryCallExclusively(String scheduleId, Supplier<T> action) {
        ReentrantLock lock = lockFor(scheduleId);
        if (!lock.tryLock()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(action.get());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run {@code action} under the schedule's lock, waiting for it if needed.
     */
    public <T> T callExclusively(String scheduleId, Supplier<T> action) {
        ReentrantLock lock = lockFor(scheduleId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop the lock of a deleted schedule unless somebody is still using it.
     */
    public void forget(String scheduleId) {
        locks.computeIfPresent(scheduleId, (id, lock) -> lock.isLocked() ? lock : null);
    }

    boolean isTracked(String scheduleId) {
        return locks.containsKey(scheduleId);
    }

    boolean isLocked(String scheduleId) {
        ReentrantLock lock = locks.get(scheduleId);
        return lock != null && lock.isLocked();
    }

    private ReentrantLock lockFor(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId");
        return locks.computeIfAbsent(scheduleId, id -> new ReentrantLock());
    }
}
