package me.zooventory.feeding.domain.service;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleLocksTest {

    private final ScheduleLocks scheduleLocks = new ScheduleLocks();

    @Test
    void shouldRunActionWhenLockIsFree() {
        Optional<String> result = scheduleLocks.tryCallExclusively("feed-1", () -> "done");

        assertEquals(Optional.of("done"), result);
        assertFalse(scheduleLocks.isLocked("feed-1"));
    }

    @Test
    void shouldSkipActionWhileAnotherThreadHoldsLock() throws InterruptedException {
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> scheduleLocks.callExclusively("feed-1", () -> {
            locked.countDown();
            awaitQuietly(release);
            return null;
        }));
        holder.start();
        assertTrue(locked.await(5, TimeUnit.SECONDS));

        Optional<String> blocked = scheduleLocks.tryCallExclusively("feed-1", () -> "ran");
        Optional<String> other = scheduleLocks.tryCallExclusively("feed-2", () -> "ran");

        release.countDown();
        holder.join(5000);
        assertTrue(blocked.isEmpty());
        assertEquals(Optional.of("ran"), other);
    }

    @Test
    void shouldReleaseLockWhenActionThrows() {
        assertThrows(IllegalStateException.class, () -> scheduleLocks.callExclusively("feed-1", () -> {
            throw new IllegalStateException("boom");
        }));

        assertFalse(scheduleLocks.isLocked("feed-1"));
        assertEquals(Optional.of(1), scheduleLocks.tryCallExclusively("feed-1", () -> 1));
    }

    @Test
    void shouldForgetUnusedLock() {
        scheduleLocks.callExclusively("feed-1", () -> true);

        scheduleLocks.forget("feed-1");

        assertFalse(scheduleLocks.isTracked("feed-1"));
    }

    @Test
    void shouldKeepLockThatIsHeldWhenForgotten() throws InterruptedException {
        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> scheduleLocks.callExclusively("feed-1", () -> {
            acquired.countDown();
            awaitQuietly(release);
            return null;
        }));
        holder.start();
        assertTrue(acquired.await(5, TimeUnit.SECONDS));

        scheduleLocks.forget("feed-1");

        assertTrue(scheduleLocks.isTracked("feed-1"));
        assertTrue(scheduleLocks.tryCallExclusively("feed-1", () -> "raced").isEmpty());

        release.countDown();
        holder.join(5000);
        scheduleLocks.forget("feed-1");
        assertFalse(scheduleLocks.isTracked("feed-1"));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
