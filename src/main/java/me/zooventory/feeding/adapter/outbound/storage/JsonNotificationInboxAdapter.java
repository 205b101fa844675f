package me.zooventory.feeding.adapter.outbound.storage;

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

import me.zooventory.feeding.domain.model.Notification;
import me.zooventory.feeding.port.outbound.NotificationDeliveryException;
import me.zooventory.feeding.port.outbound.NotificationPort;
import me.zooventory.feeding.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Notification inbox kept in {@code notifications/inbox.json}, cached after the
 * first read and rewritten atomically on every change.
 */
@Component
@Slf4j
public class JsonNotificationInboxAdapter implements NotificationPort {

    static final String DIRECTORY = "notifications";
    static final String INBOX_FILE = "inbox.json";
    private static final TypeReference<List<Notification>> NOTIFICATION_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final JsonDocument<Notification> document;
    private final Clock clock;

    private List<Notification> inboxCache;

    public JsonNotificationInboxAdapter(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.document = new JsonDocument<>(storagePort, objectMapper, DIRECTORY, INBOX_FILE,
                NOTIFICATION_LIST_TYPE_REF, NotificationDeliveryException::new);
        this.clock = clock;
    }

    @Override
    public synchronized Notification append(String ownerId, String message) {
        if (ownerId == null) {
            throw new NotificationDeliveryException("Notification owner is missing");
        }
        Notification notification = Notification.builder()
                .id("notif-" + UUID.randomUUID().toString().substring(0, 8))
                .ownerId(ownerId)
                .message(message)
                .createdAt(clock.instant())
                .read(false)
                .build();

        List<Notification> updated = new ArrayList<>(inbox());
        updated.add(notification);
        document.write(updated);
        inboxCache = updated;
        log.debug("[Inbox] Appended {} for owner {}", notification.getId(), ownerId);
        return copy(notification);
    }

    @Override
    public synchronized List<Notification> findByOwner(String ownerId) {
        return inbox().stream()
                .filter(n -> Objects.equals(n.getOwnerId(), ownerId))
                .map(JsonNotificationInboxAdapter::copy)
                .toList();
    }

    @Override
    public synchronized boolean markRead(String id) {
        List<Notification> updated = new ArrayList<>(inbox().size());
        boolean found = false;
        for (Notification notification : inbox()) {
            if (Objects.equals(notification.getId(), id)) {
                Notification read = copy(notification);
                read.setRead(true);
                updated.add(read);
                found = true;
            } else {
                updated.add(notification);
            }
        }
        if (!found) {
            return false;
        }
        document.write(updated);
        inboxCache = updated;
        return true;
    }

    private List<Notification> inbox() {
        if (inboxCache == null) {
            inboxCache = document.read();
        }
        return inboxCache;
    }

    private static Notification copy(Notification notification) {
        return Notification.builder()
                .id(notification.getId())
                .ownerId(notification.getOwnerId())
                .message(notification.getMessage())
                .createdAt(notification.getCreatedAt())
                .read(notification.isRead())
                .build();
    }
}
