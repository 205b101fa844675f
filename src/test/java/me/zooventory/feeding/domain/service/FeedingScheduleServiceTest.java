package me.zooventory.feeding.domain.service;

import me.zooventory.feeding.domain.model.Animal;
import me.zooventory.feeding.domain.model.FeedingFrequency;
import me.zooventory.feeding.domain.model.FeedingSchedule;
import me.zooventory.feeding.infrastructure.config.ZooventoryProperties;
import me.zooventory.feeding.port.outbound.AnimalRegistryPort;
import me.zooventory.feeding.port.outbound.ScheduleStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FeedingScheduleServiceTest {

    // 2026-02-11 is a Wednesday
    private static final Instant FIXED_NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final String ANIMAL_ID = "animal-1";
    private static final String SCHEDULE_ID = "feed-1";
    private static final LocalTime NINE_AM = LocalTime.of(9, 0);

    private ScheduleStorePort scheduleStore;
    private AnimalRegistryPort animalRegistry;
    private ScheduleLocks scheduleLocks;
    private FeedingScheduleService service;

    @BeforeEach
    void setUp() {
        scheduleStore = mock(ScheduleStorePort.class);
        animalRegistry = mock(AnimalRegistryPort.class);
        scheduleLocks = new ScheduleLocks();

        ZooventoryProperties properties = new ZooventoryProperties();
        properties.getSchedule().setZoneId("UTC");
        RecurrenceService recurrenceService = new RecurrenceService(properties);
        Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);

        when(animalRegistry.findAnimal(ANIMAL_ID)).thenReturn(Optional.of(Animal.builder()
                .id(ANIMAL_ID)
                .ownerId("owner-1")
                .name("Rex")
                .build()));

        service = new FeedingScheduleService(scheduleStore, animalRegistry, recurrenceService, scheduleLocks, clock);
    }

    @Test
    void shouldCreateDailyScheduleSeededWithFirstOccurrence() {
        FeedingSchedule schedule = service.createSchedule(ANIMAL_ID, FeedingFrequency.DAILY, NINE_AM, null, null);

        assertTrue(schedule.getId().startsWith("feed-"));
        assertEquals(ANIMAL_ID, schedule.getSubjectId());
        assertEquals(Instant.parse("2026-02-12T09:00:00Z"), schedule.getNextDue());
        assertEquals(FIXED_NOW, schedule.getCreatedAt());
        assertEquals(FIXED_NOW, schedule.getUpdatedAt());
        verify(scheduleStore).save(schedule);
    }

    @Test
    void shouldSeedEveryXHoursScheduleOneIntervalFromNow() {
        FeedingSchedule schedule = service.createSchedule(ANIMAL_ID, FeedingFrequency.EVERY_X_HOURS,
                NINE_AM, DayOfWeek.MONDAY, 6);

        assertEquals(Instant.parse("2026-02-11T16:00:00Z"), schedule.getNextDue());
        assertNull(schedule.getTimeOfDay());
        assertNull(schedule.getDayOfWeek());
        assertEquals(6, schedule.getHoursInterval());
    }

    @Test
    void shouldNormalizeFieldsIgnoredByFrequency() {
        FeedingSchedule schedule = service.createSchedule(ANIMAL_ID, FeedingFrequency.DAILY,
                LocalTime.of(9, 0, 42), DayOfWeek.FRIDAY, 3);

        assertEquals(NINE_AM, schedule.getTimeOfDay());
        assertNull(schedule.getDayOfWeek());
        assertNull(schedule.getHoursInterval());
    }

    @Test
    void shouldRejectWeeklyScheduleWithoutDayOfWeek() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> service.createSchedule(ANIMAL_ID, FeedingFrequency.WEEKLY, NINE_AM, null, null));

        assertTrue(e.getMessage().contains("dayOfWeek"));
        verify(scheduleStore, never()).save(any());
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> service.createSchedule(ANIMAL_ID, FeedingFrequency.EVERY_X_HOURS, null, null, 0));
        verify(scheduleStore, never()).save(any());
    }

    @Test
    void shouldRejectUnknownAnimal() {
        when(animalRegistry.findAnimal("ghost")).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class,
                () -> service.createSchedule("ghost", FeedingFrequency.DAILY, NINE_AM, null, null));
        verify(scheduleStore, never()).save(any());
    }

    @Test
    void shouldRecomputeNextDueWhenRecurrenceIsEdited() {
        FeedingSchedule existing = FeedingSchedule.builder()
                .id(SCHEDULE_ID)
                .subjectId(ANIMAL_ID)
                .frequency(FeedingFrequency.DAILY)
                .timeOfDay(NINE_AM)
                .nextDue(Instant.parse("2026-02-12T09:00:00Z"))
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
        when(scheduleStore.findById(SCHEDULE_ID)).thenReturn(Optional.of(existing));

        FeedingSchedule edited = service.updateRecurrence(SCHEDULE_ID, FeedingFrequency.WEEKLY,
                LocalTime.of(18, 0), DayOfWeek.FRIDAY, null);

        ArgumentCaptor<FeedingSchedule> captor = ArgumentCaptor.forClass(FeedingSchedule.class);
        verify(scheduleStore).save(captor.capture());
        FeedingSchedule saved = captor.getValue();
        assertEquals(Instant.parse("2026-02-13T18:00:00Z"), saved.getNextDue());
        assertEquals(FeedingFrequency.WEEKLY, saved.getFrequency());
        assertEquals(FIXED_NOW, saved.getUpdatedAt());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), saved.getCreatedAt());
        assertEquals(saved, edited);
    }

    @Test
    void shouldRejectInvalidEditWithoutTouchingStoredSchedule() {
        FeedingSchedule existing = FeedingSchedule.builder()
                .id(SCHEDULE_ID)
                .subjectId(ANIMAL_ID)
                .frequency(FeedingFrequency.DAILY)
                .timeOfDay(NINE_AM)
                .nextDue(Instant.parse("2026-02-12T09:00:00Z"))
                .build();
        when(scheduleStore.findById(SCHEDULE_ID)).thenReturn(Optional.of(existing));

        assertThrows(IllegalArgumentException.class, () -> service.updateRecurrence(SCHEDULE_ID,
                FeedingFrequency.EVERY_X_HOURS, null, null, null));

        assertEquals(FeedingFrequency.DAILY, existing.getFrequency());
        verify(scheduleStore, never()).save(any());
        assertFalse(scheduleLocks.isLocked(SCHEDULE_ID));
    }

    @Test
    void shouldRejectEditOfUnknownSchedule() {
        when(scheduleStore.findById("missing")).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> service.updateRecurrence("missing",
                FeedingFrequency.DAILY, NINE_AM, null, null));
    }

    @Test
    void shouldListSchedulesForAnimal() {
        FeedingSchedule schedule = FeedingSchedule.builder().id(SCHEDULE_ID).subjectId(ANIMAL_ID).build();
        when(scheduleStore.findBySubject(ANIMAL_ID)).thenReturn(List.of(schedule));

        assertEquals(List.of(schedule), service.findSchedulesForAnimal(ANIMAL_ID));
    }

    @Test
    void shouldDeleteSchedule() {
        when(scheduleStore.delete(SCHEDULE_ID)).thenReturn(true);

        service.deleteSchedule(SCHEDULE_ID);

        verify(scheduleStore).delete(SCHEDULE_ID);
    }

    @Test
    void shouldRejectDeleteOfUnknownSchedule() {
        when(scheduleStore.delete("missing")).thenReturn(false);

        assertThrows(IllegalArgumentException.class, () -> service.deleteSchedule("missing"));
    }
}
