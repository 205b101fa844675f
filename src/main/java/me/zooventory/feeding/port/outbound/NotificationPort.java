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

import me.zooventory.feeding.domain.model.Notification;

import java.util.List;

/**
 * Port for the owner notification inbox. Implementations report failures as
 * {@link NotificationDeliveryException}.
 */
public interface NotificationPort {

    /**
     * Append an unread notification for the owner.
     *
     * @return the stored notification
     */
    Notification append(String ownerId, String message);

    /**
     * All notifications of an owner, in no particular order.
     */
    List<Notification> findByOwner(String ownerId);

    /**
     * Set the read flag of a notification.
     *
     * @return true if the notification exists
     */
    boolean markRead(String id);
}
