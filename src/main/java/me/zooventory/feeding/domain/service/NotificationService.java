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

import me.zooventory.feeding.domain.model.Animal;
import me.zooventory.feeding.domain.model.Notification;
import me.zooventory.feeding.infrastructure.config.ZooventoryProperties;
import me.zooventory.feeding.port.outbound.NotificationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Owner notification inbox: emits feeding-due notifications and serves the
 * unread views shown to the owner.
 */
@Service
@Slf4j
public class NotificationService {

    private static final Comparator<Notification> NEWEST_FIRST = Comparator
            .comparing(Notification::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final NotificationPort notificationPort;
    private final ZooventoryProperties properties;

    public NotificationService(NotificationPort notificationPort, ZooventoryProperties properties) {
        this.notificationPort = notificationPort;
        this.properties = properties;
    }

    /**
     * Append the "time to feed" notification for an animal to its owner's inbox.
     */
    public Notification notifyFeedingDue(Animal animal) {
        Notification notification = notificationPort.append(animal.getOwnerId(), feedingMessage(animal));
        log.debug("[Notification] Feeding due for {} sent to owner {}", animal.getName(), animal.getOwnerId());
        return notification;
    }

    /**
     * All unread notifications of the owner, newest first.
     */
    public List<Notification> getUnread(String ownerId) {
        return notificationPort.findByOwner(ownerId).stream()
                .filter(n -> !n.isRead())
                .sorted(NEWEST_FIRST)
                .toList();
    }

    /**
     * The most recent unread notifications, capped at
     * {@code zooventory.notifications.recent-limit}.
     */
    public List<Notification> getRecentUnread(String ownerId) {
        return getUnread(ownerId).stream()
                .limit(Math.max(0, properties.getNotifications().getRecentLimit()))
                .toList();
    }

    /**
     * Mark a notification as read.
     *
     * @throws IllegalArgumentException
     *             if not found
     */
    public void markRead(String notificationId) {
        if (!notificationPort.markRead(notificationId)) {
            throw new IllegalArgumentException("Notification not found: " + notificationId);
        }
    }

    static String feedingMessage(Animal animal) {
        return "It's time to feed " + animal.getName();
    }
}
