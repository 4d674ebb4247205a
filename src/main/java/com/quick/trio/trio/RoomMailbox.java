package com.quick.trio.trio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Single-writer queue for one room. Tasks run one at a time, in submission
 * order, on the shared scheduler; different rooms drain concurrently.
 * <p>
 * A running task may {@link #holdFor hold} the mailbox: its continuation runs
 * after the delay and nothing queued behind it starts before that.
 */
public class RoomMailbox {

    private static final Logger log = LoggerFactory.getLogger(RoomMailbox.class);

    private final String roomId;
    private final ScheduledExecutorService scheduler;

    private final Object lock = new Object();
    private final Queue<Runnable> queue = new ArrayDeque<>();
    private boolean draining;   // guarded by lock

    // set only by the task currently running
    private Hold pendingHold;

    public RoomMailbox(String roomId, ScheduledExecutorService scheduler) {
        this.roomId = roomId;
        this.scheduler = scheduler;
    }

    public void submit(Runnable task) {
        synchronized (lock) {
            if (draining) {
                queue.add(task);
                return;
            }
            draining = true;
        }
        scheduler.execute(() -> drainFrom(task));
    }

    /**
     * Must be called from inside a task of this mailbox. Only one hold per task.
     */
    public void holdFor(long delayMs, Runnable continuation) {
        if (pendingHold != null) {
            throw new IllegalStateException("Room " + roomId + " already holds a pending continuation");
        }
        pendingHold = new Hold(delayMs, continuation);
    }

    private void drainFrom(Runnable first) {
        Runnable task = first;
        while (task != null) {
            runSafely(task);

            Hold hold = pendingHold;
            if (hold != null) {
                pendingHold = null;
                log.debug("room={} mailbox held for {}ms", roomId, hold.delayMs());
                scheduler.schedule(() -> drainFrom(hold.continuation()), hold.delayMs(), TimeUnit.MILLISECONDS);
                return;
            }

            synchronized (lock) {
                task = queue.poll();
                if (task == null) {
                    draining = false;
                }
            }
        }
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("room={} task failed", roomId, e);
        }
    }

    private record Hold(long delayMs, Runnable continuation) {
    }
}
