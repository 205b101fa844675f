package me.zooventory.feeding.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the feeding scheduler, bound from
 * application.properties under the {@code zooventory.*} prefix.
 *
 * <ul>
 * <li>{@link PollerProperties} - tick cadence and fan-out</li>
 * <li>{@link ScheduleProperties} - calendar zone and fallback delay</li>
 * <li>{@link NotificationProperties} - inbox views</li>
 * <li>{@link StorageProperties} - workspace location</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "zooventory")
@Data
public class ZooventoryProperties {

    private PollerProperties poller = new PollerProperties();
    private ScheduleProperties schedule = new ScheduleProperties();
    private NotificationProperties notifications = new NotificationProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class PollerProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(1);
        private Duration initialDelay = Duration.ofSeconds(5);
        private int parallelism = 1;
        private Duration shutdownTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class ScheduleProperties {
        private String zoneId = "UTC";
        private Duration fallbackDelay = Duration.ofHours(24);
    }

    @Data
    public static class NotificationProperties {
        private int recentLimit = 5;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.zooventory/workspace";
    }
}
