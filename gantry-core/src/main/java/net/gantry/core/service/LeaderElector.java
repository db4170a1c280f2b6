package net.gantry.core.service;

import net.gantry.core.error.LeaderNotElectedException;
import net.gantry.core.model.AuditEvent;
import net.gantry.core.model.LeaderLease;
import net.gantry.core.spi.Clock;
import net.gantry.core.spi.DistributedLock;
import net.gantry.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 분산 락으로 리더 하나를 뽑는다.
 * tick() 을 ttl 보다 짧은 주기로 호출해 획득/갱신한다. 로컬 플래그는 참고용이며
 * 마지막으로 확인한 만료 시각이 지나면 리더가 아닌 것으로 본다.
 */
public final class LeaderElector {
    private static final Logger log = LoggerFactory.getLogger(LeaderElector.class);

    private final DistributedLock lock;
    private final TxRunner tx;
    private final Clock clock;
    private final AuditLog audit;
    private final String lockName;
    private final String replicaId;
    private final String hint;
    private final Duration ttl;

    private volatile LeaderLease held;

    public LeaderElector(DistributedLock lock,
                         TxRunner tx,
                         Clock clock,
                         AuditLog audit,
                         String lockName,
                         String replicaId,
                         String hint,
                         Duration ttl) {
        this.lock = lock;
        this.tx = tx;
        this.clock = clock;
        this.audit = audit;
        this.lockName = lockName;
        this.replicaId = replicaId;
        this.hint = hint;
        this.ttl = ttl;
    }

    /** 획득 또는 갱신 시도. 리더면 true */
    public boolean tick() throws Exception {
        boolean was = isLeader();
        Optional<LeaderLease> got = tx.requiresNew(() -> {
            Optional<LeaderLease> r = lock.tryAcquire(lockName, replicaId, hint, ttl, clock.now());
            if (r.isPresent() && (held == null || held.fencingToken() != r.get().fencingToken())) {
                audit.record(AuditEvent.LEADER, lockName, "acquire", null, replicaId,
                        "fencing_token=" + r.get().fencingToken());
            }
            return r;
        });
        held = got.orElse(null);
        boolean now = isLeader();
        if (now && !was) log.info("leadership acquired: lock={} replica={} token={}", lockName, replicaId, held.fencingToken());
        if (!now && was) log.warn("leadership lost: lock={} replica={}", lockName, replicaId);
        return now;
    }

    public boolean isLeader() {
        LeaderLease h = held;
        return h != null && h.liveAt(clock.now());
    }

    /** @throws LeaderNotElectedException 리더가 아니면 (알면 현재 리더 힌트 포함) */
    public void requireLeader() throws Exception {
        if (isLeader()) return;
        String leaderHint = currentLeader().map(l -> l.holderHint() != null ? l.holderHint() : l.holder()).orElse(null);
        throw new LeaderNotElectedException(leaderHint);
    }

    public Optional<LeaderLease> currentLeader() throws Exception {
        Instant now = clock.now();
        return tx.required(() -> lock.current(lockName)).filter(l -> l.liveAt(now));
    }

    /** 종료 시 반납해 다음 레플리카가 ttl 을 기다리지 않게 */
    public void release() throws Exception {
        if (held == null) return;
        tx.requiresNew(() -> {
            if (lock.release(lockName, replicaId, clock.now())) {
                audit.record(AuditEvent.LEADER, lockName, "release", replicaId, null, null);
            }
            return null;
        });
        held = null;
        log.info("leadership released: lock={} replica={}", lockName, replicaId);
    }

    public String replicaId() {
        return replicaId;
    }

    public Optional<LeaderLease> held() {
        return Optional.ofNullable(held);
    }
}
