package me.zooventory.feeding.infrastructure.config;

import me.zooventory.feeding.auto.FeedingSchedulePoller;
import me.zooventory.feeding.domain.model.FeedingFrequency;
import me.zooventory.feeding.domain.model.FeedingSchedule;
import me.zooventory.feeding.domain.model.Notification;
import me.zooventory.feeding.domain.model.ScanReport;
import me.zooventory.feeding.domain.service.FeedingScheduleService;
import me.zooventory.feeding.domain.service.NotificationService;
import me.zooventory.feeding.port.outbound.ScheduleStorePort;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class AutoConfigurationTest {

    @TempDir
    static Path workspace;

    @DynamicPropertySource
    static void storageProperties(DynamicPropertyRegistry registry) {
        registry.add("zooventory.storage.base-path", () -> workspace.toString());
    }

    @Autowired
    private ZooventoryProperties properties;

    @Autowired
    private FeedingSchedulePoller poller;

    @Autowired
    private FeedingScheduleService feedingScheduleService;

    @Autowired
    private NotificationService notificationService;

    @Autowired
    private ScheduleStorePort scheduleStore;

    @Autowired
    private Clock clock;

    @Test
    void shouldBindPropertiesFromTestProfile() {
        assertFalse(properties.getPoller().isEnabled());
        assertEquals("UTC", properties.getSchedule().getZoneId());
        assertEquals(Duration.ofMinutes(1), properties.getPoller().getInterval());
        assertEquals(Duration.ofHours(24), properties.getSchedule().getFallbackDelay());
        assertEquals(workspace.toString(), properties.getStorage().getBasePath());
    }

    @Test
    void shouldNotStartPollerWhenDisabled() {
        assertFalse(poller.isAutoStartup());
        assertFalse(poller.isRunning());
    }

    @Test
    void shouldFireCreatedScheduleThroughWiredPorts() throws Exception {
        Files.writeString(workspace.resolve("feeding").resolve("animals.json"),
                "[{\"id\": \"animal-ctx\", \"ownerId\": \"owner-ctx\", \"name\": \"Rex\"}]");
        FeedingSchedule created = feedingScheduleService.createSchedule("animal-ctx", FeedingFrequency.DAILY,
                LocalTime.of(9, 0), null, null);
        assertNotNull(created.getNextDue());

        // force the schedule due
        scheduleStore.save(created.toBuilder().nextDue(clock.instant().minusSeconds(1)).build());
        ScanReport report = poller.tick().orElseThrow();

        assertEquals(1, report.fired());
        assertTrue(scheduleStore.findById(created.getId()).orElseThrow().getNextDue().isAfter(clock.instant()));
        List<Notification> unread = notificationService.getUnread("owner-ctx");
        assertEquals(1, unread.size());
        assertEquals("It's time to feed Rex", unread.get(0).getMessage());
    }
}
