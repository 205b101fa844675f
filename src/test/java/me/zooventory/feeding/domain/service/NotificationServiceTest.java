package me.zooventory.feeding.domain.service;

import me.zooventory.feeding.domain.model.Animal;
import me.zooventory.feeding.domain.model.Notification;
import me.zooventory.feeding.infrastructure.config.ZooventoryProperties;
import me.zooventory.feeding.port.outbound.NotificationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotificationServiceTest {

    private static final String OWNER_ID = "owner-1";
    private static final Instant BASE_TIME = Instant.parse("2026-02-11T10:00:00Z");

    private NotificationPort notificationPort;
    private ZooventoryProperties properties;
    private NotificationService service;

    @BeforeEach
    void setUp() {
        notificationPort = mock(NotificationPort.class);
        properties = new ZooventoryProperties();
        service = new NotificationService(notificationPort, properties);
    }

    @Test
    void shouldAppendFeedingNotificationToOwner() {
        Notification stored = notification("n-1", 0, false);
        when(notificationPort.append(anyString(), anyString())).thenReturn(stored);
        Animal animal = Animal.builder().id("animal-1").ownerId(OWNER_ID).name("Rex").build();

        Notification result = service.notifyFeedingDue(animal);

        assertSame(stored, result);
        verify(notificationPort).append(OWNER_ID, "It's time to feed Rex");
    }

    @Test
    void shouldListUnreadNewestFirst() {
        when(notificationPort.findByOwner(OWNER_ID)).thenReturn(List.of(
                notification("n-1", 1, false),
                notification("n-2", 3, true),
                notification("n-3", 2, false)));

        List<Notification> unread = service.getUnread(OWNER_ID);

        assertEquals(List.of("n-3", "n-1"), unread.stream().map(Notification::getId).toList());
    }

    @Test
    void shouldCapRecentUnreadAtConfiguredLimit() {
        List<Notification> inbox = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            inbox.add(notification("n-" + i, i, false));
        }
        when(notificationPort.findByOwner(OWNER_ID)).thenReturn(inbox);

        List<Notification> recent = service.getRecentUnread(OWNER_ID);

        assertEquals(List.of("n-6", "n-5", "n-4", "n-3", "n-2"),
                recent.stream().map(Notification::getId).toList());

        properties.getNotifications().setRecentLimit(2);
        assertEquals(2, service.getRecentUnread(OWNER_ID).size());
    }

    @Test
    void shouldMarkNotificationRead() {
        when(notificationPort.markRead("n-1")).thenReturn(true);

        service.markRead("n-1");

        verify(notificationPort).markRead("n-1");
    }

    @Test
    void shouldRejectMarkingUnknownNotification() {
        when(notificationPort.markRead("missing")).thenReturn(false);

        assertThrows(IllegalArgumentException.class, () -> service.markRead("missing"));
    }

    private static Notification notification(String id, int minutesAfterBase, boolean read) {
        return Notification.builder()
                .id(id)
                .ownerId(OWNER_ID)
                .message("It's time to feed Rex")
                .createdAt(BASE_TIME.plusSeconds(60L * minutesAfterBase))
                .read(read)
                .build();
    }
}
