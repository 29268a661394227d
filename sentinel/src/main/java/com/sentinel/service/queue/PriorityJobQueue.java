package com.sentinel.service.queue;

import com.sentinel.domain.job.Job;
import com.sentinel.domain.job.JobPriority;
import com.sentinel.domain.job.JobType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe priority queue with delayed availability.
 *
 * Ready jobs are ordered by (priority desc, createdAt asc, sequence asc). Jobs whose
 * availableAt lies in the future wait in a separate heap ordered by availableAt and
 * are promoted to the ready heap once due, so a delayed high-priority job never
 * blocks ready lower-priority work.
 *
 * Only {@link JobManager} touches this class.
 */
final class PriorityJobQueue {

    static final Comparator<Job> READY_ORDER = Comparator
        .comparingInt((Job j) -> j.getPriority().weight()).reversed()
        .thenComparing(Job::getCreatedAt)
        .thenComparingLong(Job::getSequence);

    private static final Comparator<Job> DELAYED_ORDER = Comparator
        .comparing(Job::getAvailableAt)
        .thenComparing(READY_ORDER);

    // Upper bound on a single wait so a clock that jumps (tests, NTP) is noticed
    private static final long MAX_WAIT_NANOS = TimeUnit.MILLISECONDS.toNanos(250);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<Job> ready = new PriorityQueue<>(READY_ORDER);
    private final PriorityQueue<Job> delayed = new PriorityQueue<>(DELAYED_ORDER);
    private final Clock clock;
    private final int capacity;

    private boolean closed = false;

    PriorityJobQueue(Clock clock, int capacity) {
        this.clock = clock;
        this.capacity = capacity;
    }

    void add(Job job) {
        lock.lock();
        try {
            insert(job);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Add unless a job of the same type is already waiting.
     *
     * @return true if added
     */
    boolean addIfNotPending(Job job) {
        lock.lock();
        try {
            if (containsTypeLocked(job.getType())) {
                return false;
            }
            insert(job);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until a ready job exists or the queue is closed.
     *
     * @return the highest-priority ready job, or null once closed
     */
    Job take() throws InterruptedException {
        return poll(null);
    }

    /**
     * Like {@link #take()} but gives up after the timeout.
     *
     * @param timeout max wait, or null to wait indefinitely
     * @return the job, or null on timeout or close
     */
    Job poll(Duration timeout) throws InterruptedException {
        long remaining = timeout == null ? Long.MAX_VALUE : timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                if (closed) {
                    return null;
                }
                Instant now = clock.instant();
                promoteDue(now);
                Job job = ready.poll();
                if (job != null) {
                    changed.signalAll();
                    return job;
                }
                if (remaining <= 0) {
                    return null;
                }

                long wait = Math.min(remaining, MAX_WAIT_NANOS);
                Job next = delayed.peek();
                if (next != null) {
                    long untilDue = Duration.between(now, next.getAvailableAt()).toNanos();
                    wait = Math.max(1, Math.min(wait, untilDue));
                }
                long slept = wait - changed.awaitNanos(wait);
                if (timeout != null) {
                    remaining -= Math.max(slept, 0);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Non-blocking dequeue.
     *
     * @return the highest-priority ready job, or null if none is ready
     */
    Job pollReady() {
        lock.lock();
        try {
            if (closed) {
                return null;
            }
            promoteDue(clock.instant());
            return ready.poll();
        } finally {
            lock.unlock();
        }
    }

    boolean containsType(JobType type) {
        lock.lock();
        try {
            return containsTypeLocked(type);
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return ready.size() + delayed.size();
        } finally {
            lock.unlock();
        }
    }

    Map<JobPriority, Integer> countsByPriority() {
        lock.lock();
        try {
            Map<JobPriority, Integer> counts = new EnumMap<>(JobPriority.class);
            for (JobPriority p : JobPriority.values()) {
                counts.put(p, 0);
            }
            ready.forEach(j -> counts.merge(j.getPriority(), 1, Integer::sum));
            delayed.forEach(j -> counts.merge(j.getPriority(), 1, Integer::sum));
            return counts;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pending jobs in dequeue order (ready first, then delayed by due time).
     */
    List<Job> snapshot() {
        lock.lock();
        try {
            List<Job> readyJobs = new ArrayList<>(ready);
            readyJobs.sort(READY_ORDER);
            List<Job> delayedJobs = new ArrayList<>(delayed);
            delayedJobs.sort(DELAYED_ORDER);
            readyJobs.addAll(delayedJobs);
            return readyJobs;
        } finally {
            lock.unlock();
        }
    }

    void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private void insert(Job job) {
        if (closed) {
            throw new QueueClosedException(job);
        }
        if (capacity > 0 && ready.size() + delayed.size() >= capacity) {
            throw new QueueFullException(job, capacity);
        }
        if (job.isReady(clock.instant())) {
            ready.add(job);
        } else {
            delayed.add(job);
        }
        changed.signalAll();
    }

    private void promoteDue(Instant now) {
        Job head;
        while ((head = delayed.peek()) != null && head.isReady(now)) {
            ready.add(delayed.poll());
        }
    }

    private boolean containsTypeLocked(JobType type) {
        for (Job job : ready) {
            if (job.getType().equals(type)) return true;
        }
        for (Job job : delayed) {
            if (job.getType().equals(type)) return true;
        }
        return false;
    }
}
