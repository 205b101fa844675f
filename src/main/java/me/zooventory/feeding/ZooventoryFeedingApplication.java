package me.zooventory.feeding;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Zooventory feeding scheduler.
 *
 * <p>
 * The scheduler keeps every animal's feeding schedule moving: it decides when
 * the next feeding is due, notifies the owner once per occurrence and derives
 * the following due instant.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Driver             → FeedingSchedulePoller (fixed-cadence tick)
 * Domain Layer       → RecurrenceRule, RecurrenceService, FeedingScheduleService, NotificationService
 * Infrastructure     → Schedule store, animal registry and notification inbox adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code zooventory.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ZooventoryFeedingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZooventoryFeedingApplication.class, args);
    }

}
