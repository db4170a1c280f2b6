package net.gantry.app.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import net.gantry.core.model.Resource;
import net.gantry.core.service.LeaderElector;
import net.gantry.core.service.LeasePolicy;
import net.gantry.core.service.LeaseService;
import net.gantry.core.service.MetricsService;
import net.gantry.core.service.PoolPolicy;
import net.gantry.core.service.ResourceService;
import net.gantry.core.service.WorkerPoolService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 자원 인벤토리, 현재 리더, 지표, 실행 중 정책.
 * 정책 변경은 이 레플리카 메모리에만 반영되고 감사 로그에 남는다.
 */
@RestController
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class ClusterController {

    private final ResourceService resources;
    private final LeaderElector leader;
    private final MetricsService metrics;
    private final LeaseService leases;
    private final WorkerPoolService pools;

    public ClusterController(ResourceService resources, LeaderElector leader, MetricsService metrics,
                             LeaseService leases, WorkerPoolService pools) {
        this.resources = resources;
        this.leader = leader;
        this.metrics = metrics;
        this.leases = leases;
        this.pools = pools;
    }

    public record ObserveBody(@NotNull @Min(0) Long freeCapacity) {}

    /** 빠진 필드는 현재 값 유지 */
    public record LeasePolicyBody(@Min(1) Long defaultTtl, Long maxCapacityPerAgent, Boolean safeMode) {}

    public record PoolPolicyBody(@Min(0) Integer minWarmWorkers,
                                 Integer maxTotalWorkers,
                                 @Min(0) Long drainTimeout,
                                 @Min(1) Long defaultHoldSeconds,
                                 @Min(1) Integer batchSize) {}

    public record LeasePolicyView(long defaultTtl, long maxCapacityPerAgent, boolean safeMode) {
        static LeasePolicyView of(LeasePolicy p) {
            return new LeasePolicyView(p.defaultTtl().toSeconds(), p.maxCapacityPerAgent(), p.safeMode());
        }
    }

    public record PoolPolicyView(int minWarmWorkers, int maxTotalWorkers, long drainTimeout,
                                 long defaultHoldSeconds, int batchSize) {
        static PoolPolicyView of(PoolPolicy p) {
            return new PoolPolicyView(p.minWarmWorkers(), p.maxTotalWorkers(), p.drainTimeout().toSeconds(),
                    p.defaultHoldSeconds(), p.batchSize());
        }
    }

    @GetMapping("/resources")
    public List<Resource> resources() throws Exception {
        return resources.list();
    }

    @PostMapping(path = "/resources/{index}/observe", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Resource observe(@PathVariable int index, @Valid @RequestBody ObserveBody body) throws Exception {
        return resources.observe(index, body.freeCapacity());
    }

    @GetMapping("/leader")
    public Map<String, Object> leader() throws Exception {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("replica_id", leader.replicaId());
        out.put("is_leader", leader.isLeader());
        leader.currentLeader().ifPresentOrElse(l -> {
            out.put("leader", l.holder());
            out.put("leader_hint", l.holderHint());
            out.put("fencing_token", l.fencingToken());
            out.put("expires_at", l.expiresAt());
        }, () -> out.put("leader", null));
        return out;
    }

    @GetMapping("/metrics")
    public MetricsService.Snapshot metrics() throws Exception {
        return metrics.snapshot();
    }

    @GetMapping("/policy")
    public LeasePolicyView leasePolicy() {
        return LeasePolicyView.of(leases.policy());
    }

    @PostMapping(path = "/policy", consumes = MediaType.APPLICATION_JSON_VALUE)
    public LeasePolicyView updateLeasePolicy(@Valid @RequestBody LeasePolicyBody body) throws Exception {
        LeasePolicy next = leases.policy();
        if (body.defaultTtl() != null) next = next.withDefaultTtl(Duration.ofSeconds(body.defaultTtl()));
        if (body.maxCapacityPerAgent() != null) next = next.withMaxCapacityPerAgent(body.maxCapacityPerAgent());
        if (body.safeMode() != null) next = next.withSafeMode(body.safeMode());
        return LeasePolicyView.of(leases.updatePolicy(next));
    }

    @GetMapping("/workers/policy")
    public PoolPolicyView poolPolicy() {
        return PoolPolicyView.of(pools.policy());
    }

    @PostMapping(path = "/workers/policy", consumes = MediaType.APPLICATION_JSON_VALUE)
    public PoolPolicyView updatePoolPolicy(@Valid @RequestBody PoolPolicyBody body) throws Exception {
        PoolPolicy cur = pools.policy();
        PoolPolicy next = new PoolPolicy(
                body.minWarmWorkers() != null ? body.minWarmWorkers() : cur.minWarmWorkers(),
                body.maxTotalWorkers() != null ? body.maxTotalWorkers() : cur.maxTotalWorkers(),
                body.drainTimeout() != null ? Duration.ofSeconds(body.drainTimeout()) : cur.drainTimeout(),
                body.defaultHoldSeconds() != null ? body.defaultHoldSeconds() : cur.defaultHoldSeconds(),
                body.batchSize() != null ? body.batchSize() : cur.batchSize());
        return PoolPolicyView.of(pools.updatePolicy(next));
    }
}
