package io.doat4j.internal.mongo;

import io.doat4j.DoAt;
import io.doat4j.Messenger;
import io.doat4j.config.DoAtProperties;
import io.doat4j.core.CancelResult;
import io.doat4j.core.DeliveryException;
import io.doat4j.core.Job;
import io.doat4j.core.Replies;
import io.doat4j.core.ScheduleRequest;
import io.doat4j.core.ScheduleResult;
import io.doat4j.internal.TenantScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DoAt is a Mongo-backed per-tenant scheduler &amp; wake runner.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One-off and daily jobs kept in one persisted job set per tenant</li>
 *   <li>One alarm per tenant, always pointing at the earliest job</li>
 *   <li>Distributed-safe wakes via atomic claim/lock on the alarm document</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * doAt.start();
 *
 * doAt.schedule(ScheduleRequest.builder()
 *         .tenantId("guild-1")
 *         .channelId("42")
 *         .kind(JobKind.CHANNEL_MESSAGE)
 *         .subject("standup")
 *         .timestamp(1767225600L)
 *         .repeatsDaily(true)
 *         .build());
 *
 * doAt.stop();
 * }</pre>
 */
public class MongoDoAt implements DoAt {
    private static final Logger log = LoggerFactory.getLogger(MongoDoAt.class);
    private final DoAtProperties props;
    private final MongoAlarmClock alarmClock;
    private final TenantScheduler scheduler;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutorService workerPool;

    private Thread pollerThread;
    private Thread dispatcherThread;

    private final DelayQueue<DelayedWake> queue = new DelayQueue<>();
    private final ConcurrentHashMap<String, Boolean> enqueued = new ConcurrentHashMap<>();

    private final Semaphore refillSignal = new Semaphore(0);

    private final Semaphore globalSem;
    private int systemErrorCount = 0;

    private final String workerId;

    private final class DelayedWake implements Delayed {
        private final String tenantId;
        private final Instant wakeAt;

        private DelayedWake(String tenantId, Instant wakeAt) {
            this.tenantId = tenantId;
            this.wakeAt = wakeAt;
        }

        private String key() {
            return enqueueKey(tenantId, wakeAt);
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = wakeAt.toEpochMilli() - clock.millis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof DelayedWake o) {
                return this.wakeAt.compareTo(o.wakeAt);
            }
            long d1 = this.getDelay(TimeUnit.MILLISECONDS);
            long d2 = other.getDelay(TimeUnit.MILLISECONDS);
            return Long.compare(d1, d2);
        }
    }

    public MongoDoAt(DoAtProperties props,
                     MongoTenantStorage storage,
                     MongoAlarmClock alarmClock,
                     Messenger messenger,
                     Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.alarmClock = Objects.requireNonNull(alarmClock, "alarmClock must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.scheduler = new TenantScheduler(
                Objects.requireNonNull(storage, "storage must not be null"),
                alarmClock,
                Objects.requireNonNull(messenger, "messenger must not be null"),
                clock,
                props.getDedupRetention()
        );
        this.globalSem = new Semaphore(props.getMaxConcurrency());
        this.workerId = resolveWorkerId(props.getWorkerId());
        this.alarmClock.addListener(this::offerIfNear);
    }

    /**
     * Start polling alarms and running due wakes. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "doat.processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("doat.processEvery must be a positive duration");
        }

        Duration lockLifetime = Objects.requireNonNull(props.getLockLifetime(), "doat.lockLifetime must not be null");
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("doat.lockLifetime must be a positive duration");
        }

        log.info("DoAt starting with processEvery={}, lockLifetime={}, workerId={}, maxConcurrency={}, batchSize={}",
                props.getProcessEvery(),
                props.getLockLifetime(),
                workerId,
                props.getMaxConcurrency(),
                props.getBatchSize());

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("doat.workerPool");
                t.setDaemon(true);
                return t;
            });
        }

        if (dispatcherThread == null) {
            dispatcherThread = new Thread(this::dispatchLoop);
            dispatcherThread.setName("doat.dispatcher");
            dispatcherThread.setDaemon(true);
            dispatcherThread.start();
        }

        if (pollerThread == null) {
            pollerThread = new Thread(this::pollerLoop);
            pollerThread.setName("doat.poller");
            pollerThread.setDaemon(true);
            pollerThread.start();
        }
        log.info("DoAt started successfully.");
    }

    /**
     * Stop polling and running wakes. Idempotent. Alarms stay persisted and are picked up on the
     * next start (by this or any other worker).
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("DoAt stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getLockLifetime().toSeconds(), TimeUnit.SECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        queue.clear();
        enqueued.clear();
        refillSignal.drainPermits();
        log.info("DoAt stopped successfully.");
    }

    @Override
    public ScheduleResult schedule(ScheduleRequest request) {
        return scheduler.schedule(request);
    }

    @Override
    public List<Job> list(String tenantId) {
        return scheduler.list(tenantId);
    }

    /**
     * The tenant's jobs rendered as a reply, capped at {@code doat.list-limit} lines.
     */
    public String listReply(String tenantId) {
        return Replies.listing(list(tenantId), props.getListLimit());
    }

    @Override
    public CancelResult cancel(String tenantId, String jobId) {
        return scheduler.cancel(tenantId, jobId);
    }

    /**
     * Runs a wake now, under the same tenant claim as scheduled wakes, so it never overlaps a
     * wake running in this or another process.
     */
    @Override
    public int wake(String tenantId) throws DeliveryException {
        Objects.requireNonNull(tenantId, "tenantId must not be null");

        AlarmDocument claimed = alarmClock.claimAny(tenantId, props.getLockLifetime(), workerId);
        if (claimed == null) {
            log.debug("doat manual wake skipped, tenant claimed elsewhere tenant={}", tenantId);
            return 0;
        }

        Instant startedAt = clock.instant();
        try {
            int sent = scheduler.wake(tenantId);
            finishWake(tenantId, claimed, startedAt);
            return sent;
        } catch (DeliveryException | RuntimeException e) {
            failWake(tenantId, claimed, e);
            throw e;
        }
    }

    @Override
    public boolean isStarted() {
        return started.get();
    }

    public String getWorkerId() {
        return workerId;
    }

    private String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "doat4j";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("doat hostname lookup failed, using default msg={}", e.getMessage());
        }

        String pid = String.valueOf(ProcessHandle.current().pid());

        String generated = host + "-" + pid + "-" + java.util.UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }

    private static String enqueueKey(String tenantId, Instant at) {
        return tenantId + "@" + at.toEpochMilli();
    }

    // Alarms set in this process are queued right away instead of waiting for the next poll.
    private void offerIfNear(String tenantId, Instant at) {
        if (!started.get() || at == null) {
            return;
        }
        Instant horizon = clock.instant().plus(props.getProcessEvery());
        if (!at.isAfter(horizon)) {
            offer(tenantId, at);
        }
    }

    private boolean offer(String tenantId, Instant at) {
        DelayedWake wake = new DelayedWake(tenantId, at);
        if (enqueued.putIfAbsent(wake.key(), Boolean.TRUE) == null) {
            queue.offer(wake);
            return true;
        }
        return false;
    }

    private void pollerLoop() {
        while (started.get()) {
            boolean backlog;
            try {
                backlog = pollOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("doat pollOnce failed msg={}", e.getMessage(), e);
                if (systemErrorCount >= 30) {
                    log.error("DoAt stopped due to repeated system failures...");
                    stop();
                    break;
                }

                try {
                    Duration sleep = (systemErrorCount >= 10)
                            ? Duration.ofSeconds(60)
                            : backoff(systemErrorCount);

                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (backlog) {
                    // a finished wake frees room for the rest of the batch
                    refillSignal.tryAcquire(props.getProcessEvery().toMillis(), TimeUnit.MILLISECONDS);
                } else {
                    Thread.sleep(props.getProcessEvery().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll-loop failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * Wake retry delay after a failed delivery.
     * attempt starts from 1 (first failure).
     * 10s, 20s, 40s, 80s, 160s... capped at 10 minutes.
     */
    static Duration retryDelay(int attempt) {
        int exp = Math.max(0, attempt - 1);
        exp = Math.min(exp, 20); // avoid overflow
        long ms = Math.min(10_000L * (1L << exp), 600_000L);
        return Duration.ofMillis(ms);
    }

    private boolean pollOnce() {
        Instant windowEnd = clock.instant().plus(props.getProcessEvery());
        int batchSize = Math.max(1, props.getBatchSize());

        List<AlarmDocument> alarms = alarmClock.findUpcoming(windowEnd, batchSize);
        int offered = 0;
        for (AlarmDocument alarm : alarms) {
            if (offer(alarm.getTenantId(), alarm.getAlarmAt())) {
                offered++;
            }
        }

        log.debug("DoAt polled alarms count={} offered={} windowEnd={}", alarms.size(), offered, windowEnd);
        return alarms.size() >= batchSize;
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                DelayedWake wake = queue.take();
                enqueued.remove(wake.key());
                submitToWorker(wake.tenantId);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("doat dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void submitToWorker(String tenantId) {
        globalSem.acquireUninterruptibly();

        try {
            workerPool.submit(() -> {
                try {
                    runWake(tenantId);
                } finally {
                    globalSem.release();
                    refillSignal.release();
                }
            });
        } catch (RuntimeException e) {
            globalSem.release();
            throw e;
        }
    }

    private void runWake(String tenantId) {
        AlarmDocument claimed;
        try {
            claimed = alarmClock.claim(tenantId, props.getLockLifetime(), workerId);
        } catch (Exception e) {
            log.error("doat alarm claim failed tenant={} msg={}", tenantId, e.getMessage(), e);
            return;
        }
        if (claimed == null) {
            // moved, consumed, or held by another worker
            log.debug("doat wake skipped tenant={} workerId={}", tenantId, workerId);
            return;
        }

        Instant startedAt = clock.instant();
        try {
            log.debug("doat wake started tenant={} alarmAt={} At={}", tenantId, claimed.getAlarmAt(), startedAt);
            int sent = scheduler.wake(tenantId);
            log.debug("doat wake succeeded tenant={} sent={}", tenantId, sent);
            finishWake(tenantId, claimed, startedAt);
        } catch (Exception e) {
            failWake(tenantId, claimed, e);
        }
    }

    private void finishWake(String tenantId, AlarmDocument claimed, Instant startedAt) {
        Instant finishedAt = clock.instant();
        // only an alarm that was due when claimed is consumed; a future one still belongs to a job
        Instant consumable = claimed.getAlarmAt() != null && !claimed.getAlarmAt().isAfter(startedAt)
                ? claimed.getAlarmAt()
                : null;
        var r = alarmClock.markSuccess(tenantId, workerId, consumable, finishedAt);
        if (r.getMatchedCount() == 0) {
            log.warn("doat wake finished after claim expired tenant={} workerId={}", tenantId, workerId);
        }

        // the alarm set during the wake could not be claimed while we held the lock
        alarmClock.getAlarm(tenantId).ifPresent(next -> offerIfNear(tenantId, next));
    }

    private void failWake(String tenantId, AlarmDocument claimed, Exception e) {
        if (e instanceof DeliveryException de) {
            log.error("doat wake failed tenant={} jobId={} status={} msg={}",
                    tenantId, de.getJobId(), de.getStatusCode(), e.getMessage());
        } else {
            log.error("doat wake failed tenant={} msg={}", tenantId, e.getMessage(), e);
        }

        Instant failedAt = clock.instant();
        int nextAttempt = claimed.getFailCount() + 1;
        Instant retryAt = failedAt.plus(retryDelay(nextAttempt));
        log.warn("doat wake rescheduled tenant={} attempt={} retryAt={}", tenantId, nextAttempt, retryAt);

        try {
            alarmClock.markFailure(tenantId, workerId, failedAt, retryAt);
        } catch (Exception storeEx) {
            log.error("doat markFailure failed tenant={} msg={}", tenantId, storeEx.getMessage(), storeEx);
        }
    }
}
