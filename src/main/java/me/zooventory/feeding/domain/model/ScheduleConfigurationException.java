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

/**
 * A schedule's frequency-specific fields are missing or invalid for its
 * declared frequency.
 */
public class ScheduleConfigurationException extends IllegalStateException {

    private final String scheduleId;
    private final String reason;

    public ScheduleConfigurationException(String scheduleId, String reason) {
        super("Schedule " + scheduleId + ": " + reason);
        this.scheduleId = scheduleId;
        this.reason = reason;
    }

    public String getScheduleId() {
        return scheduleId;
    }

    public String getReason() {
        return reason;
    }
}
