package me.zooventory.feeding.port.outbound;

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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Port for the durable store of feeding schedules. Calls are synchronous and
 * may block; implementations report failures as {@link ScheduleStoreException}.
 */
public interface ScheduleStorePort {

    /**
     * All schedules whose {@code nextDue} is at or before {@code now}.
     */
    List<FeedingSchedule> findDue(Instant now);

    /**
     * Persist the full record, inserting it when the id is new.
     */
    void save(FeedingSchedule schedule);

    Optional<FeedingSchedule> findById(String id);

    /**
     * Schedules feeding the given animal.
     */
    List<FeedingSchedule> findBySubject(String subjectId);

    /**
     * Delete a schedule.
     *
     * @return true if a schedule was removed
     */
    boolean delete(String id);
}
