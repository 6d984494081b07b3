package com.platform.paas.queue;

import com.platform.paas.error.ResourceNotFoundException;
import com.platform.paas.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process priority queue for reconciliation work.
 *
 * <p>Three bands, each FIFO by acceptance order. A task is claimed by at most one
 * worker and stays claimed until it is acked, nacked, failed or abandoned, or until
 * its claim goes stale and it is redelivered. Every claim carries its own delivery
 * token; a late settlement from a worker whose claim was redelivered is ignored.
 *
 * Failure handling mirrors the outbox dispatcher:
 * - Exponential backoff between attempts
 * - Dead-task list after the attempt limit or a fatal error
 * - Manual retry of dead tasks
 */
@Slf4j
public class ReconciliationQueue {
    
    private static final Comparator<ReconciliationTask> BY_READY_TIME =
        Comparator.comparing(ReconciliationTask::notBefore)
            .thenComparingLong(ReconciliationTask::sequence);
    
    private final Map<Band, Lane> lanes = new EnumMap<>(Band.class);
    private final Map<String, Claim> claims = new ConcurrentHashMap<>();
    private final Map<String, DeadTask> dead = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong deliveries = new AtomicLong();
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final int maxDepth;
    private final MetricsRegistry metricsRegistry;
    
    private volatile boolean closed;
    
    public ReconciliationQueue(Clock clock, RetryPolicy retryPolicy, int maxDepth, MetricsRegistry metricsRegistry) {
        this.clock = clock;
        this.retryPolicy = retryPolicy;
        this.maxDepth = maxDepth;
        this.metricsRegistry = metricsRegistry;
        for (Band band : Band.values()) {
            lanes.put(band, new Lane());
            metricsRegistry.registerGauge("controlplane.queue.depth", "Tasks waiting in a band",
                () -> depth(band), "band", band.tag());
            metricsRegistry.registerGauge("controlplane.queue.inflight", "Tasks claimed by workers",
                () -> inFlight(band), "band", band.tag());
        }
        metricsRegistry.registerGauge("controlplane.queue.dead", "Tasks in the dead-task list", dead::size);
        log.info("Reconciliation queue initialized (maxAttempts={}, baseDelay={}, maxDelay={}, maxDepth={})",
            retryPolicy.maxAttempts(), retryPolicy.baseDelay(), retryPolicy.maxDelay(), maxDepth);
    }
    
    /**
     * Accept a task into its band.
     *
     * @return the accepted task with its enqueue time and sequence assigned
     * @throws QueueUnavailableException if the queue is closed or the band is full
     */
    public ReconciliationTask enqueue(ReconciliationTask task) {
        return accept(task, clock.instant());
    }
    
    private ReconciliationTask accept(ReconciliationTask task, Instant enqueuedAt) {
        if (closed) {
            throw new QueueUnavailableException("Queue is closed");
        }
        Lane lane = lanes.get(task.band());
        lane.lock.lock();
        try {
            if (closed) {
                throw new QueueUnavailableException("Queue is closed");
            }
            if (maxDepth > 0 && lane.size() >= maxDepth) {
                throw new QueueUnavailableException(
                    "Band " + task.band().tag() + " is at capacity (" + maxDepth + ")");
            }
            ReconciliationTask accepted = task.withEnqueue(enqueuedAt, sequence.incrementAndGet());
            lane.ready.addLast(accepted);
            lane.available.signal();
            metricsRegistry.recordEnqueue(accepted.kind().wireName(), accepted.band().tag());
            log.debug("Enqueued {} task {} on {} (scope={}, stamp={})",
                accepted.kind(), accepted.id(), accepted.band().tag(), accepted.scope(), accepted.stamp());
            return accepted;
        } finally {
            lane.lock.unlock();
        }
    }
    
    /**
     * Claim the oldest ready task of a band, waiting up to {@code timeout}.
     *
     * @return the claimed task, or empty on timeout or once the queue is closed and the band is drained
     */
    public Optional<ReconciliationTask> dequeue(Band band, Duration timeout) throws InterruptedException {
        Lane lane = lanes.get(band);
        long remaining = timeout.toNanos();
        lane.lock.lockInterruptibly();
        try {
            while (true) {
                Instant now = clock.instant();
                lane.promoteDue(now);
                ReconciliationTask next = lane.ready.pollFirst();
                if (next != null) {
                    return Optional.of(claim(next, now));
                }
                if (remaining <= 0 || (closed && lane.delayed.isEmpty())) {
                    return Optional.empty();
                }
                long wait = remaining;
                ReconciliationTask soonest = lane.delayed.peek();
                if (soonest != null) {
                    long untilDue = Duration.between(now, soonest.notBefore()).toNanos();
                    wait = Math.max(1, Math.min(wait, untilDue));
                }
                remaining -= wait - lane.available.awaitNanos(wait);
            }
        } finally {
            lane.lock.unlock();
        }
    }
    
    /**
     * Claim the oldest ready task of a band without waiting.
     */
    public Optional<ReconciliationTask> poll(Band band) {
        Lane lane = lanes.get(band);
        lane.lock.lock();
        try {
            Instant now = clock.instant();
            lane.promoteDue(now);
            ReconciliationTask next = lane.ready.pollFirst();
            return next == null ? Optional.empty() : Optional.of(claim(next, now));
        } finally {
            lane.lock.unlock();
        }
    }
    
    /**
     * Claim the oldest ready task of the highest non-empty band.
     */
    public Optional<ReconciliationTask> pollHighest() {
        for (Band band : Band.values()) {
            Optional<ReconciliationTask> task = poll(band);
            if (task.isPresent()) {
                return task;
            }
        }
        return Optional.empty();
    }
    
    /**
     * Mark a claimed task as done.
     *
     * @return false if the claim was no longer held (already settled or redelivered)
     */
    public boolean ack(ReconciliationTask task) {
        if (release(task) == null) {
            return false;
        }
        metricsRegistry.recordTaskOutcome(task.kind().wireName(), task.band().tag(), "succeeded");
        return true;
    }
    
    /**
     * Release a claimed task whose generation was superseded. The task is dropped without retry.
     */
    public boolean abandon(ReconciliationTask task, String reason) {
        if (release(task) == null) {
            return false;
        }
        log.info("Abandoned {} task {} ({}): {}", task.kind(), task.id(), task.stamp(), reason);
        metricsRegistry.recordTaskOutcome(task.kind().wireName(), task.band().tag(), "abandoned");
        return true;
    }
    
    /**
     * Report a retryable failure. The task is redelivered after backoff or moved to the
     * dead-task list once it has used all its attempts.
     */
    public NackOutcome nack(ReconciliationTask task, String reason) {
        Claim claim = release(task);
        if (claim == null) {
            log.warn("Ignoring nack for task {}: claim no longer held", task.id());
            return NackOutcome.IGNORED;
        }
        Instant now = clock.instant();
        int attempt = claim.task().attempts() + 1;
        if (retryPolicy.isExhausted(attempt)) {
            bury(claim.task().withFailure(reason, null), reason, false, now);
            return NackOutcome.DEAD;
        }
        Duration delay = retryPolicy.delayFor(attempt);
        ReconciliationTask retry = claim.task().withFailure(reason, now.plus(delay));
        Lane lane = lanes.get(task.band());
        lane.lock.lock();
        try {
            lane.delayed.add(retry);
            lane.available.signal();
        } finally {
            lane.lock.unlock();
        }
        log.warn("Task {} ({}) failed attempt {}/{}, retrying in {}ms: {}",
            task.id(), task.kind(), attempt, retryPolicy.maxAttempts(), delay.toMillis(), reason);
        metricsRegistry.recordTaskOutcome(task.kind().wireName(), task.band().tag(), "retried");
        return NackOutcome.RETRY_SCHEDULED;
    }
    
    /**
     * Report a non-retryable failure. The task goes straight to the dead-task list.
     */
    public boolean fail(ReconciliationTask task, String reason) {
        Claim claim = release(task);
        if (claim == null) {
            log.warn("Ignoring failure for task {}: claim no longer held", task.id());
            return false;
        }
        bury(claim.task().withFailure(reason, null), reason, true, clock.instant());
        return true;
    }
    
    /**
     * Return claims older than {@code visibility} to the head of their band.
     * Covers workers that died or hung without settling their task.
     *
     * @return number of redelivered tasks
     */
    public int requeueStaleClaims(Duration visibility) {
        Instant cutoff = clock.instant().minus(visibility);
        List<Claim> stale = new ArrayList<>();
        for (Claim claim : claims.values()) {
            if (claim.claimedAt().isBefore(cutoff)) {
                stale.add(claim);
            }
        }
        int redelivered = 0;
        for (Claim claim : stale) {
            if (!claims.remove(claim.task().id(), claim)) {
                continue;
            }
            Lane lane = lanes.get(claim.task().band());
            lane.lock.lock();
            try {
                lane.ready.addFirst(claim.task());
                lane.available.signal();
            } finally {
                lane.lock.unlock();
            }
            redelivered++;
            log.warn("Redelivering task {} ({}): claim held since {}",
                claim.task().id(), claim.task().kind(), claim.claimedAt());
            metricsRegistry.recordTaskOutcome(claim.task().kind().wireName(), claim.task().band().tag(), "redelivered");
        }
        return redelivered;
    }
    
    /**
     * Dead tasks, oldest first.
     */
    public List<DeadTask> deadTasks() {
        List<DeadTask> result = new ArrayList<>(dead.values());
        result.sort(Comparator.comparing(DeadTask::diedAt));
        return result;
    }
    
    /**
     * Move a dead task back to the tail of its band with a fresh attempt budget.
     * The task keeps its original enqueue time, which fixes its metering period.
     */
    public ReconciliationTask retryDead(String taskId) {
        DeadTask deadTask = dead.remove(taskId);
        if (deadTask == null) {
            throw ResourceNotFoundException.deadTask(taskId);
        }
        try {
            ReconciliationTask original = deadTask.task();
            ReconciliationTask requeued = accept(original.withAttemptsReset(), original.enqueuedAt());
            log.info("Dead task {} ({}) manually requeued", taskId, requeued.kind());
            return requeued;
        } catch (QueueUnavailableException e) {
            dead.put(taskId, deadTask);
            throw e;
        }
    }
    
    /**
     * Tasks waiting in a band, ready or backing off.
     */
    public int depth(Band band) {
        Lane lane = lanes.get(band);
        lane.lock.lock();
        try {
            return lane.size();
        } finally {
            lane.lock.unlock();
        }
    }
    
    /**
     * Tasks in a band that could be claimed right now.
     */
    public int readyDepth(Band band) {
        Lane lane = lanes.get(band);
        lane.lock.lock();
        try {
            lane.promoteDue(clock.instant());
            return lane.ready.size();
        } finally {
            lane.lock.unlock();
        }
    }
    
    public int inFlight(Band band) {
        int count = 0;
        for (Claim claim : claims.values()) {
            if (claim.task().band() == band) {
                count++;
            }
        }
        return count;
    }
    
    public QueueStats stats() {
        Map<Band, Integer> ready = new EnumMap<>(Band.class);
        Map<Band, Integer> delayed = new EnumMap<>(Band.class);
        Map<Band, Integer> inFlight = new EnumMap<>(Band.class);
        for (Band band : Band.values()) {
            Lane lane = lanes.get(band);
            lane.lock.lock();
            try {
                lane.promoteDue(clock.instant());
                ready.put(band, lane.ready.size());
                delayed.put(band, lane.delayed.size());
            } finally {
                lane.lock.unlock();
            }
            inFlight.put(band, inFlight(band));
        }
        return new QueueStats(isAvailable(), Map.copyOf(ready), Map.copyOf(delayed), Map.copyOf(inFlight), dead.size());
    }
    
    public boolean isAvailable() {
        return !closed;
    }
    
    /**
     * Stop accepting new tasks and wake every waiting consumer.
     * Tasks already queued can still be claimed.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Lane lane : lanes.values()) {
            lane.lock.lock();
            try {
                lane.available.signalAll();
            } finally {
                lane.lock.unlock();
            }
        }
        log.info("Reconciliation queue closed");
    }
    
    private ReconciliationTask claim(ReconciliationTask task, Instant now) {
        ReconciliationTask delivered = task.withDelivery(deliveries.incrementAndGet());
        claims.put(delivered.id(), new Claim(delivered, now));
        return delivered;
    }
    
    private Claim release(ReconciliationTask task) {
        Claim claim = claims.get(task.id());
        if (claim == null || claim.task().delivery() != task.delivery()) {
            return null;
        }
        return claims.remove(task.id(), claim) ? claim : null;
    }
    
    private void bury(ReconciliationTask task, String reason, boolean fatal, Instant now) {
        dead.put(task.id(), new DeadTask(task, reason, fatal, now));
        log.error("Task {} ({}) moved to dead-task list after {} attempt(s){}: {}",
            task.id(), task.kind(), task.attempts(), fatal ? " (fatal)" : "", reason);
        metricsRegistry.recordTaskOutcome(task.kind().wireName(), task.band().tag(), "dead");
    }
    
    private record Claim(ReconciliationTask task, Instant claimedAt) {
    }
    
    private static final class Lane {
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition available = lock.newCondition();
        private final ArrayDeque<ReconciliationTask> ready = new ArrayDeque<>();
        private final PriorityQueue<ReconciliationTask> delayed = new PriorityQueue<>(BY_READY_TIME);
        
        // Promoted retries join the tail so they never overtake tasks accepted before them became due.
        void promoteDue(Instant now) {
            while (!delayed.isEmpty() && delayed.peek().isReady(now)) {
                ready.addLast(delayed.poll());
            }
        }
        
        int size() {
            return ready.size() + delayed.size();
        }
    }
}
