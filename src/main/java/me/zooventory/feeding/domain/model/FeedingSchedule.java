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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;

/**
 * Stored feeding schedule of one animal. This is the flat record as the
 * schedule store keeps it; {@link RecurrenceRule#from(FeedingSchedule)} turns
 * it into the policy that is actually evaluated.
 *
 * <p>
 * The owner is not stored here. It is always resolved through
 * {@code subjectId}, so ownership cannot diverge from the animal record.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FeedingSchedule {

    private String id;
    private String subjectId;

    @Builder.Default
    private FeedingFrequency frequency = FeedingFrequency.DAILY;

    private LocalTime timeOfDay;

    @JsonDeserialize(using = WeekdayDeserializer.class)
    private DayOfWeek dayOfWeek;

    private Integer hoursInterval;
    private Instant nextDue;
    private Instant createdAt;
    private Instant updatedAt;
}
