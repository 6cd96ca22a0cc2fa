package io.doat4j.internal;

import io.doat4j.core.DeliveryException;
import io.doat4j.core.Job;
import io.doat4j.core.JobKind;
import io.doat4j.core.SendResult;
import io.doat4j.utils.DailyRepeat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryEngineTest {

    private static final String TENANT = "guild-1";
    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private InMemoryTenantStorage storage;
    private ManualAlarmClock alarms;
    private RecordingMessenger messenger;
    private JobStore jobStore;
    private DeliveryEngine engine;
    private long now;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        storage = new InMemoryTenantStorage();
        alarms = new ManualAlarmClock();
        messenger = new RecordingMessenger();
        jobStore = new JobStore(storage, clock);
        AlarmCoordinator coordinator = new AlarmCoordinator(jobStore, alarms);
        engine = new DeliveryEngine(storage, jobStore, coordinator, messenger, clock, DedupCache.DEFAULT_RETENTION);
        now = START.getEpochSecond();
    }

    @Test
    void retriedWakeAfterCrashSendsOnceAndStillCompletes() throws DeliveryException {
        Job job = job("a", JobKind.PING_ROLE, now - 5, false);
        jobStore.insert(TENANT, job);

        // The send succeeds, then the job-set write fails: the invocation dies mid-way.
        storage.failNextUpdates(1);
        assertThrows(IllegalStateException.class, () -> engine.onAlarm(TENANT));
        assertEquals(1, messenger.sent().size());
        assertEquals(List.of(job), jobStore.snapshot(TENANT));
        assertTrue(storage.loadDelivered(TENANT).containsKey(job.occurrenceKey()));

        int sent = engine.onAlarm(TENANT);

        assertEquals(0, sent);
        assertEquals(1, messenger.sent().size());
        assertTrue(jobStore.snapshot(TENANT).isEmpty());
        assertTrue(alarms.getAlarm(TENANT).isEmpty());
    }

    @Test
    void retriedWakeOfRepeatingJobReschedulesExactlyOnce() throws DeliveryException {
        Job job = job("daily", JobKind.CHANNEL_MESSAGE, now - 5, true);
        jobStore.insert(TENANT, job);

        storage.failNextUpdates(1);
        assertThrows(IllegalStateException.class, () -> engine.onAlarm(TENANT));
        engine.onAlarm(TENANT);
        engine.onAlarm(TENANT);

        assertEquals(1, messenger.sent().size());
        List<Job> jobs = jobStore.snapshot(TENANT);
        assertEquals(1, jobs.size());
        assertEquals(job.dueUnix() + DailyRepeat.DAY_SECONDS, jobs.get(0).dueUnix());
    }

    @Test
    void failedSendKeepsJobAndDoesNotMarkIt() throws DeliveryException {
        Job job = job("a", JobKind.PING_USER, now - 1, false);
        jobStore.insert(TENANT, job);
        messenger.enqueue(SendResult.failure(503, "busy"));

        DeliveryException ex = assertThrows(DeliveryException.class, () -> engine.onAlarm(TENANT));

        assertEquals(503, ex.getStatusCode());
        assertEquals("a", ex.getJobId());
        assertEquals(List.of(job), jobStore.snapshot(TENANT));
        assertFalse(storage.loadDelivered(TENANT).containsKey(job.occurrenceKey()));
        assertTrue(storage.deliveredWrites() > 0);

        assertEquals(1, engine.onAlarm(TENANT));
        assertEquals(2, messenger.sent().size());
        assertTrue(jobStore.snapshot(TENANT).isEmpty());
    }

    @Test
    void messengerExceptionIsReportedAsDeliveryFailure() {
        Job job = job("a", JobKind.PING_USER, now - 1, false);
        jobStore.insert(TENANT, job);
        DeliveryEngine throwing = new DeliveryEngine(storage, jobStore,
                new AlarmCoordinator(jobStore, alarms),
                (channelId, content, mentions) -> {
                    throw new IllegalStateException("connection reset");
                },
                clock, DedupCache.DEFAULT_RETENTION);

        DeliveryException ex = assertThrows(DeliveryException.class, () -> throwing.onAlarm(TENANT));

        assertEquals(-1, ex.getStatusCode());
        assertEquals(List.of(job), jobStore.snapshot(TENANT));
    }

    @Test
    void overlappingWakesOfOneTenantSendOnce() throws Exception {
        jobStore.insert(TENANT, job("a", JobKind.CHANNEL_MESSAGE, now - 1, false));
        CountDownLatch sending = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger sends = new AtomicInteger();
        DeliveryEngine slow = new DeliveryEngine(storage, jobStore,
                new AlarmCoordinator(jobStore, alarms),
                (channelId, content, mentions) -> {
                    sends.incrementAndGet();
                    sending.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return SendResult.success(200);
                },
                clock, DedupCache.DEFAULT_RETENTION);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> first = pool.submit(() -> slow.onAlarm(TENANT));
            assertTrue(sending.await(5, TimeUnit.SECONDS));

            assertEquals(0, slow.onAlarm(TENANT));

            release.countDown();
            assertEquals(1, first.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, sends.get());
        assertTrue(jobStore.snapshot(TENANT).isEmpty());

        // the guard is released: a later wake runs again
        jobStore.insert(TENANT, job("b", JobKind.CHANNEL_MESSAGE, now - 1, false));
        release.countDown();
        assertEquals(1, slow.onAlarm(TENANT));
    }

    @Test
    void drainsEveryDueJobInOneWake() throws DeliveryException {
        jobStore.insert(TENANT, job("c", JobKind.CHANNEL_MESSAGE, now - 1, false));
        jobStore.insert(TENANT, job("a", JobKind.CHANNEL_MESSAGE, now - 300, false));
        jobStore.insert(TENANT, job("b", JobKind.CHANNEL_MESSAGE, now, false));
        Job future = job("later", JobKind.CHANNEL_MESSAGE, now + 60, false);
        jobStore.insert(TENANT, future);

        int sent = engine.onAlarm(TENANT);

        assertEquals(3, sent);
        assertEquals(List.of("msg-a", "msg-c", "msg-b"),
                messenger.sent().stream().map(RecordingMessenger.Sent::content).toList());
        assertEquals(List.of(future), jobStore.snapshot(TENANT));
        assertEquals(Optional.of(Instant.ofEpochMilli(future.dueAtMs())), alarms.getAlarm(TENANT));
    }

    @Test
    void nothingDueOnlyResyncs() throws DeliveryException {
        Job future = job("later", JobKind.CHANNEL_MESSAGE, now + 60, false);
        jobStore.insert(TENANT, future);

        assertEquals(0, engine.onAlarm(TENANT));
        assertTrue(messenger.sent().isEmpty());
        assertEquals(Optional.of(Instant.ofEpochMilli(future.dueAtMs())), alarms.getAlarm(TENANT));
    }

    @Test
    void unknownKindIsPurgedWithoutSending() throws DeliveryException {
        Job corrupt = new Job("x", TENANT, "channel-1", "ping-everyone", "hi", now - 10, (now - 10) * 1000, true, null);
        Job valid = job("ok", JobKind.CHANNEL_MESSAGE, now - 5, false);
        storage.seed(TENANT, List.of(valid, corrupt));

        int sent = engine.onAlarm(TENANT);

        assertEquals(1, sent);
        assertEquals("msg-ok", messenger.sent().get(0).content());
        assertTrue(jobStore.snapshot(TENANT).isEmpty());
    }

    @Test
    void overdueDailyJobIsDeliveredOnceAndMovedToNextFutureSlot() throws DeliveryException {
        long due = now;
        jobStore.insert(TENANT, job("daily", JobKind.PING_ROLE, due, true));

        clock.set(START.plus(Duration.ofHours(84))); // 3.5 days late
        int sent = engine.onAlarm(TENANT);

        assertEquals(1, sent);
        Job next = jobStore.snapshot(TENANT).get(0);
        assertEquals(due + 4 * DailyRepeat.DAY_SECONDS, next.dueUnix());
        assertTrue(next.dueAtMs() > clock.millis());
        assertEquals(Optional.of(Instant.ofEpochMilli(next.dueAtMs())), alarms.getAlarm(TENANT));
    }

    @Test
    void occurrenceAlreadyInCacheIsCompletedWithoutSending() throws DeliveryException {
        Job job = job("a", JobKind.CHANNEL_MESSAGE, now - 5, false);
        jobStore.insert(TENANT, job);
        storage.saveDelivered(TENANT, Map.of(job.occurrenceKey(), clock.millis() - 1000));

        assertEquals(0, engine.onAlarm(TENANT));
        assertTrue(messenger.sent().isEmpty());
        assertTrue(jobStore.snapshot(TENANT).isEmpty());
    }

    @Test
    void previousOccurrenceKeyDoesNotSuppressNextDay() throws DeliveryException {
        Job job = job("daily", JobKind.CHANNEL_MESSAGE, now - 5, true);
        jobStore.insert(TENANT, job);
        storage.saveDelivered(TENANT, Map.of("daily:" + (job.dueUnix() - DailyRepeat.DAY_SECONDS), clock.millis() - 1000));

        assertEquals(1, engine.onAlarm(TENANT));
    }

    @Test
    void expiredCacheEntriesArePrunedOnWake() throws DeliveryException {
        long nowMs = clock.millis();
        storage.saveDelivered(TENANT, Map.of(
                "old:1", nowMs - Duration.ofDays(15).toMillis(),
                "recent:2", nowMs - Duration.ofDays(1).toMillis()
        ));

        engine.onAlarm(TENANT);

        assertEquals(Map.of("recent:2", nowMs - Duration.ofDays(1).toMillis()), storage.loadDelivered(TENANT));
    }

    private Job job(String id, JobKind kind, long dueUnix, boolean daily) {
        String subject = kind == JobKind.CHANNEL_MESSAGE ? "msg-" + id : "123456789";
        return Job.of(id, TENANT, "channel-1", kind, subject, dueUnix, daily, null);
    }
}
