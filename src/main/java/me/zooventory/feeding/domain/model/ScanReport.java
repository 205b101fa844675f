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

import java.time.Instant;

/**
 * Outcome counters of one poller tick.
 *
 * @param startedAt
 *            instant the tick used as "now"
 * @param due
 *            distinct due schedules observed
 * @param fired
 *            schedules notified and advanced
 * @param failed
 *            schedules left unchanged because a collaborator failed
 * @param skipped
 *            schedules left for the next tick because another writer held
 *            their lock
 */
public record ScanReport(Instant startedAt, int due, int fired, int failed, int skipped) {

    public static ScanReport empty(Instant startedAt) {
        return new ScanReport(startedAt, 0, 0, 0, 0);
    }

    public boolean hasWork() {
        return due > 0;
    }
}
