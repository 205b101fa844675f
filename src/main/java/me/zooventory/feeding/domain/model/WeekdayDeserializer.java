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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.time.DayOfWeek;
import java.util.Locale;

/**
 * Reads a weekday written either as a full {@link DayOfWeek} name
 * ({@code WEDNESDAY}) or as a three-letter storage code ({@code wed}). An
 * unrecognized value reads as {@code null}, which leaves the schedule
 * misconfigured instead of failing the whole document.
 */
public class WeekdayDeserializer extends StdDeserializer<DayOfWeek> {

    private static final int CODE_LENGTH = 3;

    public WeekdayDeserializer() {
        super(DayOfWeek.class);
    }

    @Override
    public DayOfWeek deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        String value = parser.getValueAsString();
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return parse(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Parse a weekday code or name, ignoring case.
     *
     * @throws IllegalArgumentException
     *             if the value names no weekday
     */
    public static DayOfWeek parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.length() >= CODE_LENGTH) {
            for (DayOfWeek day : DayOfWeek.values()) {
                if (day.name().equals(normalized) || day.name().substring(0, CODE_LENGTH).equals(normalized)) {
                    return day;
                }
            }
        }
        throw new IllegalArgumentException("Unknown weekday: " + value);
    }
}
