package me.zooventory.feeding.auto;

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
import me.zooventory.feeding.domain.model.FeedingSchedule;
import me.zooventory.feeding.domain.model.PollerState;
import me.zooventory.feeding.domain.model.ScanReport;
import me.zooventory.feeding.domain.service.NotificationService;
import me.zooventory.feeding.domain.service.RecurrenceService;
import me.zooventory.feeding.domain.service.ScheduleLocks;
import me.zooventory.feeding.infrastructure.config.ZooventoryProperties;
import me.zooventory.feeding.port.outbound.AnimalRegistryPort;
import me.zooventory.feeding.port.outbound.NotificationDeliveryException;
import me.zooventory.feeding.port.outbound.ScheduleStoreException;
import me.zooventory.feeding.port.outbound.ScheduleStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Poller that periodically fires due feeding schedules.
 *
 * <p>
 * On every tick it:
 * <ul>
 * <li>Fetches the schedules due at or before now from {@link ScheduleStorePort}</li>
 * <li>Appends one "time to feed" notification to the animal owner's inbox</li>
 * <li>Recomputes {@code nextDue} via {@link RecurrenceService} and saves the
 * schedule</li>
 * </ul>
 *
 * <p>
 * The notification is always appended before the schedule is advanced. If the
 * save fails the stored {@code nextDue} is unchanged, so the occurrence is
 * detected and notified again on the next tick: delivery is at-least-once and a
 * due feeding is never dropped. A failure only affects its own schedule; the
 * rest of the batch continues.
 *
 * <p>
 * Ticks do not overlap: if a scan is still running when the next tick fires,
 * that tick is skipped. Each schedule fires at most once per tick and is
 * processed under its {@link ScheduleLocks} lock.
 *
 * <p>
 * The poller is started and stopped explicitly, by the Spring lifecycle when
 * {@code zooventory.poller.enabled} is true, or by calling {@link #start()} and
 * {@link #stop()}. {@link #tick()} can be invoked directly without starting it.
 *
 * @since 1.0
 * @see RecurrenceService
 */
@Component
@Slf4j
public class FeedingSchedulePoller implements SmartLifecycle {

    private final ScheduleStorePort scheduleStore;
    private final AnimalRegistryPort animalRegistry;
    private final NotificationService notificationService;
    private final RecurrenceService recurrenceService;
    private final ScheduleLocks scheduleLocks;
    private final ZooventoryProperties.PollerProperties pollerProperties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private volatile PollerState state = PollerState.IDLE;
    private volatile boolean running;

    private ScheduledExecutorService scheduler;
    private ExecutorService workers;
    private ScheduledFuture<?> tickTask;

    public FeedingSchedulePoller(ScheduleStorePort scheduleStore, AnimalRegistryPort animalRegistry,
            NotificationService notificationService, RecurrenceService recurrenceService,
            ScheduleLocks scheduleLocks, ZooventoryProperties properties, Clock clock) {
        this.scheduleStore = scheduleStore;
        this.animalRegistry = animalRegistry;
        this.notificationService = notificationService;
        this.recurrenceService = recurrenceService;
        this.scheduleLocks = scheduleLocks;
        this.pollerProperties = properties.getPoller();
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        Duration interval = pollerProperties.getInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalStateException("zooventory.poller.interval must be > 0");
        }
        Duration initialDelay = pollerProperties.getInitialDelay() != null
                ? pollerProperties.getInitialDelay()
                : Duration.ZERO;

        scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("feeding-schedule-poller"));
        int parallelism = pollerProperties.getParallelism();
        if (parallelism > 1) {
            workers = Executors.newFixedThreadPool(parallelism, daemonThreads("feeding-schedule-worker"));
        }

        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                initialDelay.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS);
        running = true;

        log.info("[Poller] Started with tick interval: {}, parallelism: {}", interval, Math.max(1, parallelism));
    }

    @Override
    public synchronized void stop() {
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        awaitShutdown(scheduler);
        awaitShutdown(workers);
        scheduler = null;
        workers = null;
        if (running) {
            running = false;
            log.info("[Poller] Shut down");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return pollerProperties.isEnabled();
    }

    public PollerState getState() {
        return state;
    }

    /**
     * Run one scan.
     *
     * @return the scan report, or empty if the tick was skipped because a previous
     *         scan is still in progress
     */
    public Optional<ScanReport> tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Poller] Tick skipped: previous scan still in progress");
            return Optional.empty();
        }

        Instant now = clock.instant();
        try {
            state = PollerState.SCANNING;
            return Optional.of(scan(now));
        } catch (RuntimeException e) {
            log.error("[Poller] Tick failed: {}", e.getMessage(), e);
            return Optional.of(ScanReport.empty(now));
        } finally {
            state = PollerState.IDLE;
            executing.set(false);
        }
    }

    private ScanReport scan(Instant now) {
        List<FeedingSchedule> dueSchedules;
        try {
            dueSchedules = scheduleStore.findDue(now);
        } catch (ScheduleStoreException e) {
            log.error("[Poller] Failed to fetch due schedules: {}", e.getMessage(), e);
            return ScanReport.empty(now);
        }
        if (dueSchedules == null || dueSchedules.isEmpty()) {
            return ScanReport.empty(now);
        }

        Map<String, FeedingSchedule> distinct = new LinkedHashMap<>();
        for (FeedingSchedule schedule : dueSchedules) {
            if (schedule.getId() == null) {
                log.warn("[Poller] Ignoring due schedule without id for animal {}", schedule.getSubjectId());
                continue;
            }
            distinct.putIfAbsent(schedule.getId(), schedule);
        }

        List<Outcome> outcomes = processAll(distinct.values(), now);
        ScanReport report = new ScanReport(now, distinct.size(),
                count(outcomes, Outcome.FIRED),
                count(outcomes, Outcome.FAILED),
                count(outcomes, Outcome.SKIPPED));

        if (report.hasWork()) {
            log.info("[Poller] Tick: {} due, {} fired, {} failed, {} skipped",
                    report.due(), report.fired(), report.failed(), report.skipped());
        }
        return report;
    }

    private List<Outcome> processAll(Collection<FeedingSchedule> schedules, Instant now) {
        ExecutorService pool = workers;
        List<Outcome> outcomes = new ArrayList<>(schedules.size());
        if (pool == null) {
            for (FeedingSchedule schedule : schedules) {
                outcomes.add(processSchedule(schedule, now));
            }
            return outcomes;
        }

        List<CompletableFuture<Outcome>> futures = new ArrayList<>(schedules.size());
        for (FeedingSchedule schedule : schedules) {
            futures.add(CompletableFuture.supplyAsync(() -> processSchedule(schedule, now), pool));
        }
        for (CompletableFuture<Outcome> future : futures) {
            outcomes.add(future.join());
        }
        return outcomes;
    }

    private Outcome processSchedule(FeedingSchedule schedule, Instant now) {
        String id = schedule.getId();
        try {
            Optional<Outcome> outcome = scheduleLocks.tryCallExclusively(id, () -> fireIfStillDue(id, now));
            if (outcome.isEmpty()) {
                log.debug("[Poller] Schedule {} is locked by another writer, retrying next tick", id);
                return Outcome.SKIPPED;
            }
            return outcome.get();
        } catch (RuntimeException e) {
            log.error("[Poller] Failed to process schedule {}: {}", id, e.getMessage(), e);
            return Outcome.FAILED;
        }
    }

    private Outcome fireIfStillDue(String id, Instant now) {
        FeedingSchedule current;
        try {
            current = scheduleStore.findById(id).orElse(null);
        } catch (ScheduleStoreException e) {
            log.error("[Poller] Failed to reload schedule {}: {}", id, e.getMessage());
            return Outcome.FAILED;
        }
        if (current == null || current.getNextDue() == null || current.getNextDue().isAfter(now)) {
            log.debug("[Poller] Schedule {} changed since the scan started, skipping", id);
            return Outcome.SKIPPED;
        }
        return fire(current, now);
    }

    private Outcome fire(FeedingSchedule schedule, Instant now) {
        String id = schedule.getId();

        Optional<Animal> animal;
        try {
            animal = animalRegistry.findAnimal(schedule.getSubjectId());
        } catch (ScheduleStoreException e) {
            log.error("[Poller] Failed to resolve animal {} for schedule {}: {}",
                    schedule.getSubjectId(), id, e.getMessage());
            return Outcome.FAILED;
        }
        if (animal.isEmpty()) {
            log.warn("[Poller] Animal {} for schedule {} not found, leaving schedule due",
                    schedule.getSubjectId(), id);
            return Outcome.FAILED;
        }

        try {
            notificationService.notifyFeedingDue(animal.get());
        } catch (NotificationDeliveryException e) {
            log.error("[Poller] Failed to notify owner of schedule {}: {}", id, e.getMessage());
            return Outcome.FAILED;
        }

        Instant nextDue = recurrenceService.computeNext(schedule, now);
        FeedingSchedule advanced = schedule.toBuilder()
                .nextDue(nextDue)
                .updatedAt(now)
                .build();
        try {
            scheduleStore.save(advanced);
        } catch (ScheduleStoreException e) {
            log.error("[Poller] Schedule {} notified but not advanced, it will fire again next tick: {}",
                    id, e.getMessage());
            return Outcome.FAILED;
        }

        if (!nextDue.isAfter(now)) {
            log.warn("[Poller] Schedule {} is still overdue after advancing to {}", id, nextDue);
        } else {
            log.debug("[Poller] Schedule {} fired, next due {}", id, nextDue);
        }
        return Outcome.FIRED;
    }

    private void awaitShutdown(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        Duration timeout = pollerProperties.getShutdownTimeout() != null
                ? pollerProperties.getShutdownTimeout()
                : Duration.ofSeconds(5);
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static int count(List<Outcome> outcomes, Outcome kind) {
        return (int) outcomes.stream().filter(o -> o == kind).count();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private enum Outcome {
        FIRED, FAILED, SKIPPED
    }
}
