package net.gantry.adapter.jdbc;

import net.gantry.core.error.PoolNotFoundException;
import net.gantry.core.model.AuditEvent;
import net.gantry.core.model.Job;
import net.gantry.core.model.WorkerPool;
import net.gantry.core.service.LeaseRequest;
import net.gantry.core.service.PoolPolicy;
import net.gantry.core.service.PoolRequest;
import net.gantry.core.service.QueuedWorkerLauncher;
import net.gantry.core.service.WorkerPoolService;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkerPoolService 인수 테스트
 * - 총량 상한 4, 드레인 타임아웃 60초
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class WorkerPoolAcceptanceTest extends TestSupport {

    private Fixture f;

    @BeforeAll
    void initAll() {
        f = new Fixture(ds, new PoolPolicy(1, 4, Duration.ofSeconds(60), 300, 100), 3);
    }

    private static PoolRequest pool(String id, int desired, long hold) {
        return new PoolRequest("summarizer", "mistral-7b", null, desired, hold, id, Map.of());
    }

    @Test
    void a1_create_isIdempotent_andSubmitsPreload() throws Exception {
        WorkerPool first = f.pools.create(pool("mistral-warm", 2, 600));
        WorkerPool again = f.pools.create(pool("mistral-warm", 2, 600));

        assertEquals(WorkerPool.Status.STARTING, first.status());
        assertEquals(first.startedAt(), again.startedAt());
        assertEquals(1, f.pools.list().size());

        Job preload = f.queue.get("preload:mistral-warm");
        assertEquals(WorkerPoolService.PRELOAD_JOB_TYPE, preload.type());
        assertTrue(preload.payload().contains("model=mistral-7b"));
    }

    @Test
    void a2_defaultPoolId_derivedFromAgentAndAdapter() throws Exception {
        WorkerPool p = f.pools.create(new PoolRequest("chat", "llama", "lora-a", 1, null, null, null));
        assertEquals("chat-lora-a", p.poolId());
        assertEquals(300, p.holdSeconds());
    }

    @Test
    void a3_heartbeat_movesStartingToRunning() throws Exception {
        f.pools.create(pool("p1", 2, 600));

        assertEquals(WorkerPool.Status.RUNNING, f.pools.heartbeat("p1", 5));
        WorkerPool p = f.pools.get("p1");
        assertEquals(WorkerPool.Status.RUNNING, p.status());
        assertEquals(2, p.spawnedWorkers(), "spawned is capped at desired");
        assertEquals(f.clock.now(), p.lastHeartbeat());

        assertThrows(PoolNotFoundException.class, () -> f.pools.heartbeat("missing", null));
    }

    @Test
    void a4_idlePool_isEvicted_andItsLeasesReleased() throws Exception {
        f.resources.register(0, "gpu0", 24_000, 24_000);
        f.pools.create(pool("mistral-warm", 1, 600));
        var lease = f.leases.request(new LeaseRequest("summarizer", 1_000, 3_600L, null, false,
                "mistral-warm", Map.of()));

        f.clock.advance(Duration.ofSeconds(599));
        assertEquals(0, f.pools.evictIdle());

        f.clock.advance(Duration.ofSeconds(51));
        assertEquals(1, f.reclaimer.runOnce().evictedPools);

        assertEquals(WorkerPool.Status.EVICTED, f.pools.get("mistral-warm").status());
        assertTrue(f.leases.list().isEmpty());
        var leaseEvents = f.tx.required(() -> f.auditRepo.findByEntity(AuditEvent.LEASE, lease.token()));
        assertEquals("release", leaseEvents.get(leaseEvents.size() - 1).action());
    }

    @Test
    void a5_drain_stopsWhenNoInFlightJobs_andRejectsNewClaims() throws Exception {
        f.pools.create(pool("busy", 1, 600));
        f.pools.heartbeat("busy", 1);
        f.queue.submit("j-1", "inference", null);
        f.queue.submit("j-2", "inference", null);
        assertTrue(f.queue.claim("j-1", "busy"));

        assertEquals(WorkerPool.Status.DRAINING, f.pools.drain("busy"));
        assertFalse(f.queue.claim("j-2", "busy"), "draining pool accepts no new work");
        assertEquals(0, f.pools.finishDrains());

        f.queue.start("j-1");
        f.queue.complete("j-1", null);
        assertEquals(1, f.pools.finishDrains());
        assertEquals(WorkerPool.Status.STOPPED, f.pools.get("busy").status());

        // 종료된 풀 id 재사용 금지
        assertThrows(IllegalStateException.class, () -> f.pools.create(pool("busy", 1, 600)));
    }

    @Test
    void a6_drain_timesOut() throws Exception {
        f.pools.create(pool("stuck", 1, 600));
        f.queue.submit("j-stuck", "inference", null);
        assertTrue(f.queue.claim("j-stuck", "stuck"));
        f.pools.drain("stuck");

        f.clock.advance(Duration.ofSeconds(61));
        assertEquals(1, f.pools.finishDrains());
        assertEquals(WorkerPool.Status.STOPPED, f.pools.get("stuck").status());
    }

    @Test
    void a7_drain_withoutWork_stopsImmediately() throws Exception {
        f.pools.create(pool("quiet", 1, 600));
        assertEquals(WorkerPool.Status.STOPPED, f.pools.drain("quiet"));
        assertEquals(WorkerPool.Status.STOPPED, f.pools.drain("quiet"));
    }

    @Test
    void a8_overTotalLimit_evictsOldestFirst() throws Exception {
        f.pools.create(pool("old", 3, 600));
        f.clock.advance(Duration.ofSeconds(1));
        f.pools.create(pool("new", 3, 600));

        assertEquals(1, f.pools.enforceTotalLimit());
        assertEquals(WorkerPool.Status.EVICTED, f.pools.get("old").status());
        assertEquals(WorkerPool.Status.STARTING, f.pools.get("new").status());
    }

    @Test
    void a9_reconcile_launchesMissingWorkers() throws Exception {
        f.pools.create(pool("grow", 2, 600));

        WorkerPoolService.ReconcileReport r = f.pools.reconcile();

        assertEquals(2, r.launchedWorkers);
        assertEquals(2, f.pools.get("grow").spawnedWorkers());
        Job spawn = f.queue.get("spawn:grow:1");
        assertEquals(QueuedWorkerLauncher.SPAWN_JOB_TYPE, spawn.type());
        assertEquals(0, f.pools.reconcile().launchedWorkers);

        List<String> actions = f.tx.required(() -> f.auditRepo.findByEntity(AuditEvent.POOL, "grow"))
                .stream().map(AuditEvent::action).toList();
        assertEquals(List.of("create", "spawn"), actions);
    }

    // ========== 워커 유실 후 재기동: 순번 재사용 없음 ==========
    @Test
    void b1_lostWorker_isRespawnedWithFreshOrdinal() throws Exception {
        f.pools.create(pool("respawn", 2, 600));
        assertEquals(2, f.pools.reconcile().launchedWorkers);

        f.pools.heartbeat("respawn", 2);
        f.pools.heartbeat("respawn", 1);
        assertEquals(1, f.pools.get("respawn").spawnedWorkers());

        assertEquals(1, f.pools.reconcile().launchedWorkers);
        WorkerPool p = f.pools.get("respawn");
        assertEquals(2, p.spawnedWorkers());
        assertEquals(3, p.spawnSeq());
        assertEquals(QueuedWorkerLauncher.SPAWN_JOB_TYPE, f.queue.get("spawn:respawn:3").type());
        assertEquals(0, f.pools.reconcile().launchedWorkers);
    }

    @Test
    void b2_policyUpdate_appliesToNextReconcile() throws Exception {
        PoolPolicy initial = f.pools.policy();
        f.pools.create(pool("first", 2, 600));
        f.clock.advance(Duration.ofSeconds(1));
        f.pools.create(pool("second", 2, 600));
        assertEquals(0, f.pools.enforceTotalLimit());

        try {
            f.pools.updatePolicy(new PoolPolicy(0, 3, Duration.ofSeconds(60), 300, 100));
            assertEquals(1, f.pools.enforceTotalLimit());
            assertEquals(WorkerPool.Status.EVICTED, f.pools.get("first").status());

            assertThrows(IllegalArgumentException.class,
                    () -> f.pools.updatePolicy(new PoolPolicy(0, 3, Duration.ofSeconds(60), 300, 0)));
            assertEquals(3, f.pools.policy().maxTotalWorkers());

            List<AuditEvent> events = f.tx.required(() -> f.auditRepo.findByEntity(AuditEvent.POLICY, "pool"));
            assertEquals(1, events.size());
            assertEquals("update", events.get(0).action());
        } finally {
            f.pools.updatePolicy(initial);
        }
    }
}
