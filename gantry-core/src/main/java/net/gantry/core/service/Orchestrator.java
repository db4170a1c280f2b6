package net.gantry.core.service;

import net.gantry.core.maintenance.ReclaimService;
import net.gantry.core.model.Job;
import net.gantry.core.model.Lease;
import net.gantry.core.model.WorkerPool;

import java.util.List;

/**
 * API 진입점. 승인 제어 → 서비스 호출 순서를 고정하고 리더 전용 작업을 막는다.
 */
public final class Orchestrator {
    private final LeaseService leases;
    private final WorkerPoolService pools;
    private final JobQueueService queue;
    private final AdmissionController admission;
    private final LeaderElector leader;
    private final ReclaimService reclaimer;

    public Orchestrator(LeaseService leases,
                        WorkerPoolService pools,
                        JobQueueService queue,
                        AdmissionController admission,
                        LeaderElector leader,
                        ReclaimService reclaimer) {
        this.leases = leases;
        this.pools = pools;
        this.queue = queue;
        this.admission = admission;
        this.leader = leader;
        this.reclaimer = reclaimer;
    }

    // --- leases ---

    public LeaseGrant requestLease(LeaseRequest req) throws Exception {
        var kind = req.effectiveMode() == Lease.Mode.CPU
                ? AdmissionController.Kind.CPU_LEASE : AdmissionController.Kind.GPU_LEASE;
        admission.check(req.agent(), kind);
        return leases.request(req);
    }

    public LeaseService.HeartbeatResult heartbeatLease(String token) throws Exception {
        return leases.heartbeat(token);
    }

    public void releaseLease(String token) throws Exception {
        leases.release(token);
    }

    public List<Lease> leases() throws Exception {
        return leases.list();
    }

    // --- pools ---

    public WorkerPool createPool(PoolRequest req) throws Exception {
        return pools.create(req);
    }

    public WorkerPool.Status poolHeartbeat(String poolId, Integer spawnedWorkers) throws Exception {
        return pools.heartbeat(poolId, spawnedWorkers);
    }

    public WorkerPool.Status drainPool(String poolId) throws Exception {
        return pools.drain(poolId);
    }

    public WorkerPool pool(String poolId) throws Exception {
        return pools.get(poolId);
    }

    public List<WorkerPool> pools() throws Exception {
        return pools.list();
    }

    // --- jobs ---

    /** agent 가 없으면 잡 type 단위로 속도 제한 */
    public SubmitResult submitJob(String jobId, String type, String payload, String agent) throws Exception {
        admission.check(agent != null ? agent : "type:" + type, AdmissionController.Kind.JOB_SUBMIT);
        return queue.submit(jobId, type, payload);
    }

    public Job job(String jobId) throws Exception {
        return queue.get(jobId);
    }

    public List<Job> deadLetters(String type, int limit) throws Exception {
        return queue.deadLetters(type, limit);
    }

    // --- leader-gated control ---

    public WorkerPool.Status evictPool(String poolId) throws Exception {
        leader.requireLeader();
        return pools.evict(poolId, "admin");
    }

    public WorkerPoolService.ReconcileReport reconcile() throws Exception {
        leader.requireLeader();
        return pools.reconcile();
    }

    public ReclaimService.ReclaimReport reclaim() throws Exception {
        leader.requireLeader();
        return reclaimer.runOnce();
    }
}
