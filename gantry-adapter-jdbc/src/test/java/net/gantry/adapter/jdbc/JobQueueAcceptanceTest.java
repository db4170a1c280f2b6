package net.gantry.adapter.jdbc;

import net.gantry.core.dispatch.JobWorker;
import net.gantry.core.dispatch.WorkerSettings;
import net.gantry.core.error.JobMaxAttemptsExceededException;
import net.gantry.core.error.JobNotFoundException;
import net.gantry.core.maintenance.ReclaimService;
import net.gantry.core.model.AuditEvent;
import net.gantry.core.model.Job;
import net.gantry.core.model.StreamMessage;
import net.gantry.core.service.JobQueueService;
import net.gantry.core.service.LeaseRequest;
import net.gantry.core.service.PoolRequest;
import net.gantry.core.service.Streams;
import net.gantry.core.service.SubmitResult;
import net.gantry.core.spi.JobHandler;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 잡 큐 + 워커 인수 테스트
 * - 워커는 runOnce 로 한 건씩 구동
 * - 크래시는 read/claim 후 ack 없이 버리는 것으로 연출
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class JobQueueAcceptanceTest extends TestSupport {

    private Fixture f;

    @BeforeAll
    void initAll() {
        f = new Fixture(ds);
    }

    private JobWorker worker(String consumer, JobHandler handler) {
        WorkerSettings s = WorkerSettings.of("inference", null, consumer).withLease(1_000, false);
        return new JobWorker(s, f.queue, f.leases, f.pools, f.transport, f.tx, f.clock, handler);
    }

    private static JobHandler handler(AtomicInteger calls) {
        return new JobHandler() {
            @Override public String type() { return "inference"; }
            @Override public void handle(Job job) { calls.incrementAndGet(); }
        };
    }

    private static JobHandler failing() {
        return new JobHandler() {
            @Override public String type() { return "inference"; }
            @Override public void handle(Job job) { throw new IllegalStateException("boom"); }
        };
    }

    @Test
    void a1_submit_thenWorkerCompletes() throws Exception {
        f.resources.register(0, "gpu0", 24_000, 24_000);
        SubmitResult r = f.queue.submit("job-42", "inference", "{\"prompt\":\"hi\"}");
        assertTrue(r.accepted());
        assertEquals(Job.Status.PENDING, f.queue.get("job-42").status());

        AtomicInteger calls = new AtomicInteger();
        JobWorker w = worker("w1", handler(calls));
        try {
            assertEquals(JobWorker.Outcome.DONE, w.runOnce());
        } finally {
            w.stop();
        }

        Job done = f.queue.get("job-42");
        assertEquals(Job.Status.DONE, done.status());
        assertEquals(0, done.attempts());
        assertEquals(1, calls.get());
        assertTrue(f.leases.list().isEmpty(), "lease released after execution");

        var actions = f.tx.required(() -> f.auditRepo.findByEntity(AuditEvent.JOB, "job-42"))
                .stream().map(AuditEvent::action).toList();
        assertEquals(List.of("submit", "claim", "start", "complete"), actions);
    }

    @Test
    void a2_duplicateSubmit_isIgnored() throws Exception {
        assertTrue(f.queue.submit("dup-1", "inference", "a").accepted());
        SubmitResult again = f.queue.submit("dup-1", "inference", "b");

        assertFalse(again.accepted());
        assertEquals(Job.Status.PENDING, again.status());
        assertEquals("a", f.queue.get("dup-1").payload());
        assertEquals(1, f.tx.required(() -> f.transport.entries(Streams.jobs("inference"), 10)).size());
    }

    @Test
    void a3_failures_retryThenDeadLetter() throws Exception {
        f.resources.register(0, "gpu0", 24_000, 24_000);
        f.queue.submit("bad-1", "inference", null);
        JobWorker w = worker("w1", failing());
        try {
            assertEquals(JobWorker.Outcome.FAILED, w.runOnce());
            Job afterFirst = f.queue.get("bad-1");
            assertEquals(Job.Status.PENDING, afterFirst.status());
            assertEquals(1, afterFirst.attempts());
            assertTrue(afterFirst.lastError().contains("boom"));

            // 백오프 전에는 보이지 않는다
            assertEquals(JobWorker.Outcome.IDLE, w.runOnce());

            f.clock.advance(Duration.ofSeconds(6));
            assertEquals(JobWorker.Outcome.FAILED, w.runOnce());
            f.clock.advance(Duration.ofSeconds(6));
            assertEquals(JobWorker.Outcome.FAILED, w.runOnce());
        } finally {
            w.stop();
        }

        Job dead = f.queue.get("bad-1");
        assertEquals(Job.Status.DEAD_LETTER, dead.status());
        assertEquals(3, dead.attempts());
        assertTrue(dead.lastError().startsWith(JobQueueService.MAX_ATTEMPTS_EXCEEDED));

        var dlq = f.tx.required(() -> f.transport.entries(Streams.deadLetter("inference"), 10));
        assertEquals(1, dlq.size());
        assertEquals("3", dlq.get(0).fields().get("attempts"));
        assertEquals(List.of("bad-1"), f.queue.deadLetters("inference", 10).stream().map(Job::jobId).toList());

        assertThrows(JobMaxAttemptsExceededException.class, () -> f.queue.fail("bad-1", "again", null));
    }

    @Test
    void a4_crashedWorker_isReclaimed_andSecondWorkerCompletes() throws Exception {
        f.resources.register(0, "gpu0", 24_000, 24_000);
        f.queue.submit("job-42", "inference", "{}");

        // 워커 1: 읽고 선점한 뒤 죽음
        String group = Streams.group("inference", null);
        StreamMessage taken = f.tx.required(() ->
                f.transport.read(Streams.jobs("inference"), group, "crashed", f.clock.now())).orElseThrow();
        assertTrue(f.queue.claim(taken, null));

        // idle 임계치 전에는 회수하지 않는다
        f.clock.advance(Duration.ofSeconds(30));
        assertEquals(0, f.reclaimer.runOnce().requeued);

        f.clock.advance(Duration.ofSeconds(31));
        ReclaimService.ReclaimReport report = f.reclaimer.runOnce();
        assertEquals(1, report.requeued);

        Job requeued = f.queue.get("job-42");
        assertEquals(Job.Status.PENDING, requeued.status());
        assertEquals(1, requeued.attempts());
        assertNull(requeued.ownerPool());

        f.clock.advance(Duration.ofSeconds(6));
        AtomicInteger calls = new AtomicInteger();
        JobWorker second = worker("w2", handler(calls));
        try {
            assertEquals(JobWorker.Outcome.DONE, second.runOnce());
        } finally {
            second.stop();
        }
        Job done = f.queue.get("job-42");
        assertEquals(Job.Status.DONE, done.status());
        assertEquals(1, done.attempts());
    }

    @Test
    void a5_leaseDenied_defersWithoutConsumingAttempt() throws Exception {
        f.resources.register(0, "gpu0", 8_000, 8_000);
        var blocker = f.leases.request(LeaseRequest.gpu("other", 1_000, 3_600));
        f.queue.submit("wait-1", "inference", null);

        AtomicInteger calls = new AtomicInteger();
        JobWorker w = worker("w1", handler(calls));
        try {
            assertEquals(JobWorker.Outcome.DEFERRED, w.runOnce());
            Job deferred = f.queue.get("wait-1");
            assertEquals(Job.Status.PENDING, deferred.status());
            assertEquals(0, deferred.attempts());

            f.leases.release(blocker.token());
            f.clock.advance(Duration.ofSeconds(3));
            assertEquals(JobWorker.Outcome.DONE, w.runOnce());
        } finally {
            w.stop();
        }
        assertEquals(1, calls.get());
        assertEquals(0, f.queue.get("wait-1").attempts());
    }

    @Test
    void a6_transitions_areIdempotent() throws Exception {
        f.queue.submit("cas-1", "inference", null);

        assertTrue(f.queue.claim("cas-1", null));
        assertFalse(f.queue.claim("cas-1", null), "second claim must not apply");
        assertTrue(f.queue.start("cas-1"));
        assertFalse(f.queue.start("cas-1"));
        assertTrue(f.queue.complete("cas-1", null));
        assertFalse(f.queue.complete("cas-1", null));
        assertEquals(Job.Status.DONE, f.queue.get("cas-1").status());

        assertThrows(JobNotFoundException.class, () -> f.queue.get("nope"));
    }

    @Test
    void a7_orphanedPending_isRepublished() throws Exception {
        f.queue.submit("orphan-1", "inference", null);
        // 발행 누락 연출: 엔트리 정산
        f.tx.required(() -> {
            for (var e : f.transport.entries(Streams.jobs("inference"), 10)) f.transport.settle(e.entryId(), f.clock.now());
            return null;
        });

        f.clock.advance(Duration.ofSeconds(31));
        assertEquals(1, f.reclaimer.runOnce().republished);
        assertTrue(f.tx.required(() -> f.transport.hasLiveEntry(Streams.jobs("inference"), "orphan-1")));
        assertEquals(0, f.reclaimer.runOnce().republished);
    }

    @Test
    void a8_staleDeliveryOfOtherGroup_isAckedOnly() throws Exception {
        f.pools.create(new PoolRequest("inference", "m", null, 1, 600L, "poolA", Map.of()));
        f.pools.create(new PoolRequest("inference", "m", null, 1, 600L, "poolB", Map.of()));
        f.queue.submit("j1", "inference", null);

        // 두 그룹이 같은 엔트리를 읽고 A 만 선점
        String groupA = Streams.group("inference", "poolA");
        String groupB = Streams.group("inference", "poolB");
        StreamMessage msgA = f.tx.required(() ->
                f.transport.read(Streams.jobs("inference"), groupA, "a-1", f.clock.now())).orElseThrow();
        StreamMessage msgB = f.tx.required(() ->
                f.transport.read(Streams.jobs("inference"), groupB, "b-1", f.clock.now())).orElseThrow();
        assertEquals(msgA.entryId(), msgB.entryId());
        assertTrue(f.queue.claim(msgA, "poolA"));
        assertFalse(f.queue.claim(msgB, "poolB"));
        assertTrue(f.queue.start("j1"));

        f.clock.advance(Duration.ofSeconds(50));
        assertTrue(f.tx.required(() -> f.transport.touch(groupA, msgA.entryId(), f.clock.now())));

        f.clock.advance(Duration.ofSeconds(15));
        ReclaimService.ReclaimReport report = f.reclaimer.runOnce();
        assertEquals(0, report.requeued);
        assertEquals(1, report.acked);

        Job running = f.queue.get("j1");
        assertEquals(Job.Status.RUNNING, running.status());
        assertEquals(0, running.attempts());
        assertEquals("poolA", running.ownerPool());

        // 선점 전달이 멈추면 그때 회수
        f.clock.advance(Duration.ofSeconds(61));
        assertEquals(1, f.reclaimer.runOnce().requeued);
        Job requeued = f.queue.get("j1");
        assertEquals(Job.Status.PENDING, requeued.status());
        assertEquals(1, requeued.attempts());
        assertNull(requeued.claimEntry());
    }

    @Test
    void a9_ownerStillRunning_completesAfterOtherGroupReclaimed() throws Exception {
        f.pools.create(new PoolRequest("inference", "m", null, 1, 600L, "poolA", Map.of()));
        f.queue.submit("j2", "inference", null);

        String groupA = Streams.group("inference", "poolA");
        String groupB = Streams.group("inference", "poolB");
        StreamMessage msgA = f.tx.required(() ->
                f.transport.read(Streams.jobs("inference"), groupA, "a-1", f.clock.now())).orElseThrow();
        f.tx.required(() -> f.transport.read(Streams.jobs("inference"), groupB, "b-1", f.clock.now())).orElseThrow();
        assertTrue(f.queue.claim(msgA, "poolA"));
        assertTrue(f.queue.start("j2"));

        f.clock.advance(Duration.ofSeconds(40));
        f.tx.required(() -> f.transport.touch(groupA, msgA.entryId(), f.clock.now()));
        f.clock.advance(Duration.ofSeconds(25));
        assertEquals(1, f.reclaimer.runOnce().acked);

        assertTrue(f.queue.complete("j2", msgA));
        assertEquals(Job.Status.DONE, f.queue.get("j2").status());
        assertEquals(0, f.queue.get("j2").attempts());
    }

    // ========== 같은 잡 동시 선점: 한 번만 성공 ==========
    @Test
    void b1_concurrentClaim_onlyOneWins() throws Exception {
        f.queue.submit("race-1", "inference", null);

        int threads = 6;
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(es.submit(() -> {
                start.await();
                return f.queue.claim("race-1", null);
            }));
        }
        start.countDown();

        int wins = 0;
        for (Future<Boolean> fut : futures) wins += fut.get(30, TimeUnit.SECONDS) ? 1 : 0;
        es.shutdown();

        assertEquals(1, wins);
        assertEquals(Job.Status.CLAIMED, f.queue.get("race-1").status());
    }
}
