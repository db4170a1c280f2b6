package net.gantry.core.service;

import net.gantry.core.error.LeaseDeniedException;
import net.gantry.core.error.LeaseNotFoundException;
import net.gantry.core.model.AuditEvent;
import net.gantry.core.model.Lease;
import net.gantry.core.model.Resource;
import net.gantry.core.spi.Clock;
import net.gantry.core.spi.LeaseRepository;
import net.gantry.core.spi.ResourceRepository;
import net.gantry.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/** GPU(또는 CPU fallback) 용량 임차 부여/하트비트/반납 */
public final class LeaseService {
    private static final Logger log = LoggerFactory.getLogger(LeaseService.class);

    public enum HeartbeatResult { OK, EXPIRED }

    private final ResourceRepository resources;
    private final LeaseRepository leases;
    private final AuditLog audit;
    private final TxRunner tx;
    private final Clock clock;
    private volatile LeasePolicy policy;

    public LeaseService(ResourceRepository resources,
                        LeaseRepository leases,
                        AuditLog audit,
                        TxRunner tx,
                        Clock clock,
                        LeasePolicy policy) {
        this.resources = resources;
        this.leases = leases;
        this.audit = audit;
        this.tx = tx;
        this.clock = clock;
        this.policy = policy;
    }

    public LeasePolicy policy() {
        return policy;
    }

    /**
     * 실행 중 정책 교체. 변경 내역은 감사 로그에 남는다.
     *
     * @throws IllegalArgumentException defaultTtl 이 양수가 아님
     */
    public LeasePolicy updatePolicy(LeasePolicy next) throws Exception {
        if (next.defaultTtl() == null || next.defaultTtl().isZero() || next.defaultTtl().isNegative()) {
            throw new IllegalArgumentException("default_ttl must be positive");
        }
        return tx.required(() -> {
            LeasePolicy prev = policy;
            audit.record(AuditEvent.POLICY, "lease", "update", null, null, prev + " -> " + next);
            this.policy = next;
            log.info("lease policy updated: {} -> {}", prev, next);
            return next;
        });
    }

    /**
     * 임차 요청.
     * 용량 테이블 전체를 잠근 뒤, 살아있는 임차가 없는 가장 낮은 인덱스 중
     * free >= minCapacity 인 자원을 부여한다. 없으면 fallback 허용 시 CPU 임차.
     *
     * @throws LeaseDeniedException 맞는 자원이 없거나 정책상 거절
     */
    public LeaseGrant request(LeaseRequest req) throws Exception {
        validate(req);
        LeasePolicy p = policy;
        if (p.safeMode()) throw new LeaseDeniedException("safe_mode");
        if (p.maxCapacityPerAgent() > 0 && req.minCapacity() > p.maxCapacityPerAgent()) {
            throw new LeaseDeniedException("exceeds_agent_limit");
        }
        long ttl = req.ttlSeconds() != null ? req.ttlSeconds() : p.defaultTtl().toSeconds();

        return tx.required(() -> {
            Instant now = clock.now();
            if (req.effectiveMode() == Lease.Mode.CPU) {
                return LeaseGrant.of(insert(req, null, Lease.Mode.CPU, ttl, now));
            }

            List<Resource> all = resources.lockAll();
            Set<Integer> busy = leases.activeResourceIndexes(now);
            for (Resource r : all) {
                if (busy.contains(r.resourceIndex())) continue;
                if (r.freeCapacity() < req.minCapacity()) continue;
                int purged = leases.deleteExpiredOn(r.resourceIndex(), now);
                if (purged > 0) {
                    log.debug("dropped {} expired lease(s) on resource {}", purged, r.resourceIndex());
                }
                return LeaseGrant.of(insert(req, r.resourceIndex(), Lease.Mode.GPU, ttl, now));
            }

            if (req.allowCpuFallback()) {
                return LeaseGrant.of(insert(req, null, Lease.Mode.CPU, ttl, now));
            }
            throw new LeaseDeniedException("no_capacity");
        });
    }

    private Lease insert(LeaseRequest req, Integer index, Lease.Mode mode, long ttl, Instant now) throws Exception {
        Lease l = new Lease(
                UUID.randomUUID().toString(),
                req.agent(),
                index,
                mode,
                req.poolId(),
                ttl,
                now,
                now.plusSeconds(ttl),
                now,
                req.metadata() == null ? Map.of() : req.metadata());
        leases.insert(l);
        audit.record(AuditEvent.LEASE, l.token(), "grant", null, "active",
                "agent=" + l.agentName() + " mode=" + mode.code().toLowerCase() + " resource=" + index);
        log.info("lease granted: agent={} token={} resource={} mode={} ttl={}s",
                l.agentName(), l.token(), index, mode, ttl);
        return l;
    }

    private static void validate(LeaseRequest req) {
        if (req.agent() == null || req.agent().isBlank()) {
            throw new IllegalArgumentException("agent is required");
        }
        if (req.minCapacity() < 0) {
            throw new IllegalArgumentException("min_capacity must be >= 0");
        }
        if (req.ttlSeconds() != null && req.ttlSeconds() <= 0) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
    }

    /**
     * 하트비트: 살아있으면 expires_at = now + ttl.
     * 만료됐지만 아직 purge 안 된 임차는 EXPIRED (예외 아님).
     */
    public HeartbeatResult heartbeat(String token) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            Lease l = leases.findByToken(token).orElseThrow(() -> new LeaseNotFoundException(token));
            if (l.expiredAt(now)) return HeartbeatResult.EXPIRED;
            if (!leases.extend(token, now.plusSeconds(l.ttlSeconds()), now)) return HeartbeatResult.EXPIRED;
            audit.record(AuditEvent.LEASE, token, "heartbeat", "active", "active", null);
            return HeartbeatResult.OK;
        });
    }

    /** 반납. 자원을 비우는 유일한 정상 경로 */
    public void release(String token) throws Exception {
        tx.required(() -> {
            if (!leases.delete(token)) throw new LeaseNotFoundException(token);
            audit.record(AuditEvent.LEASE, token, "release", "active", "released", null);
            log.info("lease released: token={}", token);
            return null;
        });
    }

    /** 풀 정지/축출 시 그 풀의 임차 일괄 반납. 바깥 트랜잭션에 참여 */
    public int releaseForPool(String poolId, String reason) throws Exception {
        return tx.required(() -> {
            int n = 0;
            for (Lease l : leases.findByPool(poolId)) {
                if (leases.delete(l.token())) {
                    audit.record(AuditEvent.LEASE, l.token(), "release", "active", "released",
                            "pool=" + poolId + " reason=" + reason);
                    n++;
                }
            }
            if (n > 0) log.info("released {} lease(s) of pool {} ({})", n, poolId, reason);
            return n;
        });
    }

    /** 만료 임차 정리 (한 번에 limit 건) */
    public int purgeExpired(int limit) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            int n = 0;
            for (Lease l : leases.findExpired(now, limit)) {
                if (leases.deleteIfExpired(l.token(), now)) {
                    audit.record(AuditEvent.LEASE, l.token(), "expire", "active", "expired",
                            "agent=" + l.agentName());
                    n++;
                }
            }
            if (n > 0) log.info("purged {} expired lease(s)", n);
            return n;
        });
    }

    public List<Lease> list() throws Exception {
        return tx.required(leases::findAll);
    }

    public Lease get(String token) throws Exception {
        return tx.required(() -> leases.findByToken(token).orElseThrow(() -> new LeaseNotFoundException(token)));
    }
}
