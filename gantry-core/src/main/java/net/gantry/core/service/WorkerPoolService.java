package net.gantry.core.service;

import net.gantry.core.error.PoolNotFoundException;
import net.gantry.core.model.AuditEvent;
import net.gantry.core.model.WorkerPool;
import net.gantry.core.spi.Clock;
import net.gantry.core.spi.TxRunner;
import net.gantry.core.spi.WorkerLauncher;
import net.gantry.core.spi.WorkerPoolRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * 워커 풀 수명주기.
 * starting → running → draining → stopped, 어느 비종료 상태든 → evicted.
 */
public final class WorkerPoolService {
    private static final Logger log = LoggerFactory.getLogger(WorkerPoolService.class);

    public static final String PRELOAD_JOB_TYPE = "preload";

    private final WorkerPoolRepository pools;
    private final JobQueueService queue;
    private final LeaseService leases;
    private final AuditLog audit;
    private final TxRunner tx;
    private final Clock clock;
    private volatile PoolPolicy policy;
    private final WorkerLauncher launcher;

    public WorkerPoolService(WorkerPoolRepository pools,
                             JobQueueService queue,
                             LeaseService leases,
                             AuditLog audit,
                             TxRunner tx,
                             Clock clock,
                             PoolPolicy policy,
                             WorkerLauncher launcher) {
        this.pools = pools;
        this.queue = queue;
        this.leases = leases;
        this.audit = audit;
        this.tx = tx;
        this.clock = clock;
        this.policy = policy;
        this.launcher = launcher != null ? launcher : new QueuedWorkerLauncher(queue);
    }

    public PoolPolicy policy() {
        return policy;
    }

    /** 실행 중 풀 정책 교체. 다음 조정 바퀴부터 적용, 변경 내역은 감사 로그에 */
    public PoolPolicy updatePolicy(PoolPolicy next) throws Exception {
        next.validate();
        return tx.required(() -> {
            PoolPolicy prev = policy;
            audit.record(AuditEvent.POLICY, "pool", "update", null, null, prev + " -> " + next);
            this.policy = next;
            log.info("pool policy updated: {} -> {}", prev, next);
            return next;
        });
    }

    /**
     * 풀 생성. 같은 id 의 활성 풀이 있으면 그대로 돌려준다.
     * 종료된 풀의 id 재사용은 거절.
     */
    public WorkerPool create(PoolRequest req) throws Exception {
        if (req.agent() == null || req.agent().isBlank()) throw new IllegalArgumentException("agent is required");
        if (req.model() == null || req.model().isBlank()) throw new IllegalArgumentException("model is required");
        if (req.desiredWorkers() < 1) throw new IllegalArgumentException("desired_workers must be >= 1");
        long hold = req.holdSeconds() != null ? req.holdSeconds() : policy.defaultHoldSeconds();
        if (hold <= 0) throw new IllegalArgumentException("hold_seconds must be > 0");
        String poolId = req.resolvedPoolId();

        boolean[] created = {false};
        WorkerPool pool = tx.required(() -> {
            var existing = pools.lockById(poolId);
            if (existing.isPresent()) return reuse(existing.get());

            Instant now = clock.now();
            WorkerPool p = new WorkerPool(poolId, req.agent(), req.model(), req.adapter(),
                    req.desiredWorkers(), 0, now, null, WorkerPool.Status.STARTING, hold, null,
                    req.metadata() == null ? Map.of() : req.metadata(), now, 0);
            if (!pools.insert(p)) {
                return reuse(pools.findById(poolId).orElseThrow(() -> new PoolNotFoundException(poolId)));
            }
            audit.record(AuditEvent.POOL, poolId, "create", null, WorkerPool.Status.STARTING.code(),
                    "model=" + req.model() + " desired=" + req.desiredWorkers());
            created[0] = true;
            return p;
        });

        if (created[0]) {
            log.info("worker pool created: {} model={} adapter={} desired={} hold={}s",
                    poolId, req.model(), req.adapter(), req.desiredWorkers(), hold);
            // 프리로드 이벤트 (풀 에이전트가 소비)
            queue.submit("preload:" + poolId, PRELOAD_JOB_TYPE,
                    "pool_id=" + poolId + " model=" + req.model()
                            + (req.adapter() == null ? "" : " adapter=" + req.adapter()));
        }
        return pool;
    }

    private static WorkerPool reuse(WorkerPool existing) {
        if (existing.status().terminal()) {
            throw new IllegalStateException("pool id " + existing.poolId() + " belongs to a "
                    + existing.status().code().toLowerCase() + " pool");
        }
        log.debug("pool {} already running", existing.poolId());
        return existing;
    }

    public WorkerPool get(String poolId) throws Exception {
        return tx.required(() -> pools.findById(poolId).orElseThrow(() -> new PoolNotFoundException(poolId)));
    }

    public List<WorkerPool> list() throws Exception {
        return tx.required(pools::findAll);
    }

    /**
     * 풀 하트비트. 첫 하트비트에서 starting → running.
     * spawnedWorkers 는 desired 를 넘지 않게 자른다. 종료된 풀은 상태만 돌려준다.
     */
    public WorkerPool.Status heartbeat(String poolId, Integer spawnedWorkers) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            WorkerPool p = pools.lockById(poolId).orElseThrow(() -> new PoolNotFoundException(poolId));
            if (p.status().terminal()) return p.status();

            WorkerPool.Status status = p.status();
            if (status == WorkerPool.Status.STARTING
                    && pools.transition(poolId, EnumSet.of(WorkerPool.Status.STARTING), WorkerPool.Status.RUNNING, now)) {
                audit.record(AuditEvent.POOL, poolId, "ready", status.code(), WorkerPool.Status.RUNNING.code(), null);
                status = WorkerPool.Status.RUNNING;
            }
            int spawned = spawnedWorkers == null ? p.spawnedWorkers()
                    : Math.max(0, Math.min(spawnedWorkers, p.desiredWorkers()));
            pools.heartbeat(poolId, spawned, now);
            audit.record(AuditEvent.POOL, poolId, "heartbeat", status.code(), status.code(), "spawned=" + spawned);
            return status;
        });
    }

    /**
     * 드레인 시작. 이 풀이 가진 진행 중 잡이 없으면 곧바로 stopped.
     * 이후 완료/타임아웃은 {@link #finishDrains()} 가 마무리.
     */
    public WorkerPool.Status drain(String poolId) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            WorkerPool p = pools.lockById(poolId).orElseThrow(() -> new PoolNotFoundException(poolId));
            if (p.status().terminal()) return p.status();
            if (p.status() != WorkerPool.Status.DRAINING) {
                pools.markDraining(poolId, now);
                audit.record(AuditEvent.POOL, poolId, "drain", p.status().code(), WorkerPool.Status.DRAINING.code(), null);
                log.info("pool {} draining", poolId);
            }
            if (queue.countInFlight(poolId) == 0) {
                stop(poolId, WorkerPool.Status.DRAINING, "drained", now);
                return WorkerPool.Status.STOPPED;
            }
            return WorkerPool.Status.DRAINING;
        });
    }

    /** 강제 축출. 풀의 임차도 즉시 반납 */
    public WorkerPool.Status evict(String poolId, String reason) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            WorkerPool p = pools.lockById(poolId).orElseThrow(() -> new PoolNotFoundException(poolId));
            if (p.status().terminal()) return p.status();
            pools.transition(poolId, WorkerPool.Status.ACTIVE, WorkerPool.Status.EVICTED, now);
            audit.record(AuditEvent.POOL, poolId, "evict", p.status().code(), WorkerPool.Status.EVICTED.code(), reason);
            leases.releaseForPool(poolId, reason);
            log.info("pool {} evicted ({})", poolId, reason);
            return WorkerPool.Status.EVICTED;
        });
    }

    // 바깥 트랜잭션 안에서만 호출
    private void stop(String poolId, WorkerPool.Status from, String reason, Instant now) throws Exception {
        if (!pools.transition(poolId, EnumSet.of(from), WorkerPool.Status.STOPPED, now)) return;
        audit.record(AuditEvent.POOL, poolId, "stop", from.code(), WorkerPool.Status.STOPPED.code(), reason);
        leases.releaseForPool(poolId, reason);
        log.info("pool {} stopped ({})", poolId, reason);
    }

    /** hold_seconds 동안 생존 신호 없는 풀 축출 */
    public int evictIdle() throws Exception {
        Instant now = clock.now();
        int batch = policy.batchSize();
        List<WorkerPool> idle = new ArrayList<>();
        for (WorkerPool p : tx.required(() -> pools.findByStatuses(WorkerPool.Status.ACCEPTING))) {
            if (p.idleAt(now)) idle.add(p);
            if (idle.size() >= batch) break;
        }
        int n = 0;
        for (WorkerPool p : idle) {
            if (evictIfStillIdle(p.poolId())) n++;
        }
        return n;
    }

    private boolean evictIfStillIdle(String poolId) throws Exception {
        return tx.required(() -> {
            var locked = pools.lockById(poolId);
            if (locked.isEmpty() || !locked.get().acceptsWork() || !locked.get().idleAt(clock.now())) return false;
            evict(poolId, "idle_timeout");
            return true;
        });
    }

    /** 드레인 완료(진행 중 잡 0) 또는 drainTimeout 경과 풀을 stopped 로 */
    public int finishDrains() throws Exception {
        Duration drainTimeout = policy.drainTimeout();
        int n = 0;
        for (WorkerPool p : tx.required(() -> pools.findByStatuses(EnumSet.of(WorkerPool.Status.DRAINING)))) {
            boolean stopped = tx.required(() -> {
                Instant now = clock.now();
                var locked = pools.lockById(p.poolId());
                if (locked.isEmpty() || locked.get().status() != WorkerPool.Status.DRAINING) return false;
                WorkerPool d = locked.get();
                boolean empty = queue.countInFlight(d.poolId()) == 0;
                boolean timedOut = d.drainStartedAt() != null
                        && !d.drainStartedAt().plus(drainTimeout).isAfter(now);
                if (!empty && !timedOut) return false;
                stop(d.poolId(), WorkerPool.Status.DRAINING, empty ? "drained" : "drain_timeout", now);
                return true;
            });
            if (stopped) n++;
        }
        return n;
    }

    /**
     * 총 워커 수 상한 강제: 오래된 풀부터 축출.
     * 1차로 minWarm 이하 풀은 건너뛰고, 그래도 넘치면 무조건 축출.
     */
    public int enforceTotalLimit() throws Exception {
        int maxTotal = policy.maxTotalWorkers();
        int minWarm = policy.minWarmWorkers();
        if (maxTotal <= 0) return 0;
        List<WorkerPool> active = tx.required(() -> pools.findByStatuses(WorkerPool.Status.ACCEPTING));
        int total = active.stream().mapToInt(WorkerPool::desiredWorkers).sum();
        int n = 0;
        List<WorkerPool> remaining = new ArrayList<>(active);
        for (WorkerPool p : active) {
            if (total <= maxTotal) return n;
            if (p.desiredWorkers() <= minWarm) continue;
            if (evict(p.poolId(), "over_total") == WorkerPool.Status.EVICTED) {
                total -= p.desiredWorkers();
                remaining.remove(p);
                n++;
            }
        }
        for (WorkerPool p : remaining) {
            if (total <= maxTotal) return n;
            if (evict(p.poolId(), "over_total_force") == WorkerPool.Status.EVICTED) {
                total -= p.desiredWorkers();
                n++;
            }
        }
        return n;
    }

    private record SpawnBatch(WorkerPool pool, long firstOrdinal, int count) {}

    /**
     * desired 대비 부족한 워커를 launcher 로 띄우고 spawned 반영.
     * 순번은 launch 전에 풀 행 락 아래에서 spawn_seq 로 예약한다.
     */
    public int launchShortfall() throws Exception {
        int launched = 0;
        for (WorkerPool p : tx.required(() -> pools.findByStatuses(WorkerPool.Status.ACCEPTING))) {
            if (p.desiredWorkers() - p.spawnedWorkers() <= 0) continue;
            SpawnBatch batch = tx.required(() -> {
                var locked = pools.lockById(p.poolId());
                if (locked.isEmpty() || !locked.get().acceptsWork()) return null;
                WorkerPool cur = locked.get();
                int missing = cur.desiredWorkers() - cur.spawnedWorkers();
                if (missing <= 0) return null;
                pools.advanceSpawnSeq(cur.poolId(), missing, clock.now());
                return new SpawnBatch(cur, cur.spawnSeq() + 1, missing);
            });
            if (batch == null) continue;
            int n = Math.min(batch.count(), launcher.launch(batch.pool(), batch.firstOrdinal(), batch.count()));
            if (n <= 0) continue;
            tx.required(() -> {
                var locked = pools.lockById(p.poolId());
                if (locked.isEmpty() || !locked.get().acceptsWork()) return null;
                int spawned = Math.min(locked.get().desiredWorkers(), locked.get().spawnedWorkers() + n);
                pools.updateSpawned(p.poolId(), spawned, clock.now());
                audit.record(AuditEvent.POOL, p.poolId(), "spawn", locked.get().status().code(),
                        locked.get().status().code(), "spawned=" + spawned);
                return null;
            });
            launched += n;
        }
        return launched;
    }

    /** 리더 전용 조정 한 바퀴. 리더 확인은 호출자 몫 */
    public ReconcileReport reconcile() throws Exception {
        ReconcileReport r = new ReconcileReport();
        r.evictedIdle = evictIdle();
        r.stoppedDrains = finishDrains();
        r.evictedOverLimit = enforceTotalLimit();
        r.launchedWorkers = launchShortfall();
        r.timestamp = clock.now();
        if (r.changed()) log.info("{}", r);
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class ReconcileReport {
        public Instant timestamp;
        public int evictedIdle;
        public int stoppedDrains;
        public int evictedOverLimit;
        public int launchedWorkers;

        public boolean changed() {
            return evictedIdle + stoppedDrains + evictedOverLimit + launchedWorkers > 0;
        }

        @Override public String toString() {
            return "ReconcileReport{" +
                    "timestamp=" + timestamp +
                    ", evictedIdle=" + evictedIdle +
                    ", stoppedDrains=" + stoppedDrains +
                    ", evictedOverLimit=" + evictedOverLimit +
                    ", launchedWorkers=" + launchedWorkers +
                    '}';
        }
    }
}
