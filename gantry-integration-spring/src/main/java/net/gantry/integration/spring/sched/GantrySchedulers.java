package net.gantry.integration.spring.sched;

import net.gantry.core.maintenance.ReclaimService;
import net.gantry.core.service.LeaderElector;
import net.gantry.core.service.WorkerPoolService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 주기 루프. 리더 선출은 모든 레플리카, 조정/회수는 리더만.
 * 루프끼리는 DB 로만 통신하므로 어느 레플리카든 이어받을 수 있다.
 */
public class GantrySchedulers {
    private static final Logger log = LoggerFactory.getLogger(GantrySchedulers.class);

    private final LeaderElector leader;
    private final WorkerPoolService pools;
    private final ReclaimService reclaimer;

    private Duration maxJitter = Duration.ofMillis(500);

    public GantrySchedulers(LeaderElector leader, WorkerPoolService pools, ReclaimService reclaimer) {
        this.leader = leader;
        this.pools = pools;
        this.reclaimer = reclaimer;
    }

    @Scheduled(initialDelay = 0, fixedDelayString = "${gantry.scheduler.leader-delay-ms:5000}")
    public void leaderTick() {
        try {
            leader.tick();
        } catch (Exception e) {
            log.warn("leader tick failed, next pass retries", e);
        }
    }

    @Scheduled(fixedDelayString = "${gantry.scheduler.reconcile-delay-ms:10000}")
    public void reconcile() {
        if (!jitter() || !leader.isLeader()) return;
        try {
            pools.reconcile();
        } catch (Exception e) {
            log.warn("reconcile pass failed, next pass retries", e);
        }
    }

    @Scheduled(fixedDelayString = "${gantry.scheduler.reclaim-delay-ms:15000}")
    public void reclaim() {
        if (!jitter() || !leader.isLeader()) return;
        try {
            reclaimer.runOnce();
        } catch (Exception e) {
            log.warn("reclaim pass failed, next pass retries", e);
        }
    }

    /** 종료 시 리더 반납 */
    public void shutdown() {
        try {
            leader.release();
        } catch (Exception e) {
            log.warn("leader release on shutdown failed, lock expires by ttl", e);
        }
    }

    // 레플리카들이 같은 박자로 돌지 않게. 인터럽트면 이번 회차 건너뜀
    private boolean jitter() {
        long bound = maxJitter.toMillis();
        if (bound <= 0) return true;
        try {
            Thread.sleep(ThreadLocalRandom.current().nextLong(bound + 1));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void setMaxJitter(Duration maxJitter) {
        this.maxJitter = maxJitter;
    }
}
