package net.gantry.core.service;

import net.gantry.core.error.BackpressureRejectedException;
import net.gantry.core.spi.Clock;
import net.gantry.core.spi.JobTransport;
import net.gantry.core.spi.ResourceRepository;
import net.gantry.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 에이전트별 토큰 버킷 + 전역 워터마크.
 * GPU 임차는 관측 사용률, 잡 제출은 큐 깊이로 거른다.
 */
public final class AdmissionController {
    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    public enum Kind { GPU_LEASE, CPU_LEASE, JOB_SUBMIT }

    /** 추적 중인 에이전트 버킷이 이 수에 닿으면 다 찬 버킷을 비운다 */
    public static final int SWEEP_THRESHOLD = 1024;

    public record Decision(boolean allowed, String reason) {
        static final Decision ALLOW = new Decision(true, null);
        static Decision reject(String reason) { return new Decision(false, reason); }
    }

    private final ResourceRepository resources;
    private final JobTransport transport;
    private final TxRunner tx;
    private final Clock clock;
    private final AdmissionPolicy policy;
    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    public AdmissionController(ResourceRepository resources,
                               JobTransport transport,
                               TxRunner tx,
                               Clock clock,
                               AdmissionPolicy policy) {
        this.resources = resources;
        this.transport = transport;
        this.tx = tx;
        this.clock = clock;
        this.policy = policy;
    }

    public Decision admit(String agent, Kind kind) throws Exception {
        if (!policy.enabled()) return Decision.ALLOW;

        if (kind == Kind.GPU_LEASE && policy.utilizationWatermark() > 0) {
            double util = ResourceService.utilization(tx.required(resources::findAll));
            if (util >= policy.utilizationWatermark()) {
                return Decision.reject(String.format("utilization %.1f%% >= %.1f%%", util, policy.utilizationWatermark()));
            }
        }
        if (kind == Kind.JOB_SUBMIT && policy.queueDepthWatermark() > 0) {
            long depth = queueDepth();
            if (depth >= policy.queueDepthWatermark()) {
                return Decision.reject("queue depth " + depth + " >= " + policy.queueDepthWatermark());
            }
        }

        String key = agent == null ? "" : agent;
        if (buckets.size() >= SWEEP_THRESHOLD && !buckets.containsKey(key)) evictIdleBuckets();
        TokenBucket bucket = buckets.computeIfAbsent(key, a -> {
            AdmissionPolicy.Limit l = policy.limitFor(a);
            return new TokenBucket(l.ratePerSecond(), l.burst(), clock.now());
        });
        if (!bucket.tryTake(clock.now())) return Decision.reject("rate limit for agent " + key);
        return Decision.ALLOW;
    }

    /** @throws BackpressureRejectedException 거절 시 */
    public void check(String agent, Kind kind) throws Exception {
        Decision d = admit(agent, kind);
        if (!d.allowed()) {
            log.info("admission rejected: agent={} kind={} reason={}", agent, kind, d.reason());
            throw new BackpressureRejectedException(d.reason());
        }
    }

    /** 다 찬(쉬고 있는) 에이전트 버킷 제거. 제거한 수 반환 */
    public int evictIdleBuckets() {
        var now = clock.now();
        int before = buckets.size();
        buckets.values().removeIf(b -> b.isFullAt(now));
        int n = before - buckets.size();
        if (n > 0) log.debug("evicted {} idle admission buckets, {} tracked", n, buckets.size());
        return Math.max(0, n);
    }

    public int trackedAgents() {
        return buckets.size();
    }

    private long queueDepth() throws Exception {
        long depth = 0;
        for (var e : tx.required(transport::depths).entrySet()) {
            if (!Streams.isDeadLetter(e.getKey())) depth += e.getValue();
        }
        return depth;
    }
}
