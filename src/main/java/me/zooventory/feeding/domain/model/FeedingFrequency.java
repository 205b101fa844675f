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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Recurrence policy of a feeding schedule. Exactly one policy is active per
 * schedule; the fields a policy needs are listed on each constant.
 */
public enum FeedingFrequency {

    /** Once a day at {@code timeOfDay}, or every 24 hours when no time is set. */
    DAILY("daily", "Daily"),

    /** Once a week on {@code dayOfWeek} at {@code timeOfDay}. */
    WEEKLY("weekly", "Weekly"),

    /** Every {@code hoursInterval} hours on a fixed grid. */
    EVERY_X_HOURS("every_x_hours", "Every X Hours");

    private final String code;
    private final String label;

    FeedingFrequency(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Parse a stored frequency value. Accepts the storage code, the enum name
     * and the display label, ignoring case.
     *
     * @throws IllegalArgumentException
     *             if the value matches no frequency
     */
    public static FeedingFrequency fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Frequency cannot be empty");
        }
        String trimmed = value.trim();
        for (FeedingFrequency frequency : values()) {
            if (frequency.code.equalsIgnoreCase(trimmed)
                    || frequency.name().equalsIgnoreCase(trimmed)
                    || frequency.label.equalsIgnoreCase(trimmed)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("Unknown feeding frequency: " + value.toLowerCase(Locale.ROOT));
    }

    /**
     * Lenient variant used when reading stored records: an unknown or empty value
     * reads as {@code null}, so the schedule is treated as misconfigured rather
     * than breaking the whole store.
     */
    @JsonCreator
    public static FeedingFrequency fromStoredValue(String value) {
        try {
            return fromCode(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
