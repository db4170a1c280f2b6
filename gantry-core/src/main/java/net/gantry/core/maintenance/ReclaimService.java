package net.gantry.core.maintenance;

import net.gantry.core.model.StreamMessage;
import net.gantry.core.service.JobQueueService;
import net.gantry.core.service.LeaseService;
import net.gantry.core.service.WorkerPoolService;
import net.gantry.core.spi.Clock;
import net.gantry.core.spi.JobTransport;
import net.gantry.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** 리더 전용 회수 루프. 한 번 돌 때 단계마다 batchSize 만큼만 처리 */
public final class ReclaimService {
    private static final Logger log = LoggerFactory.getLogger(ReclaimService.class);

    private final LeaseService leases;
    private final WorkerPoolService pools;
    private final JobQueueService queue;
    private final JobTransport transport;
    private final TxRunner tx;
    private final Clock clock;
    private final Settings settings;

    /**
     * @param idleThreshold    미확인 전달을 회수하기까지의 대기
     * @param orphanGrace      엔트리 없는 PENDING 을 재발행하기까지의 대기
     * @param settledRetention 정산된 엔트리 보관 기간
     * @param batchSize        단계별 최대 처리 건수
     */
    public record Settings(Duration idleThreshold, Duration orphanGrace, Duration settledRetention, int batchSize) {
        public static Settings defaults() {
            return new Settings(Duration.ofSeconds(60), Duration.ofSeconds(30), Duration.ofHours(24), 100);
        }
    }

    public ReclaimService(LeaseService leases,
                          WorkerPoolService pools,
                          JobQueueService queue,
                          JobTransport transport,
                          TxRunner tx,
                          Clock clock,
                          Settings settings) {
        this.leases = leases;
        this.pools = pools;
        this.queue = queue;
        this.transport = transport;
        this.tx = tx;
        this.clock = clock;
        this.settings = settings;
    }

    /**
     * 주기 점검 메인 루틴.
     * - 만료 임차 정리
     * - idle 풀 축출
     * - 멈춘 전달 회수 → 재발행 / dead-letter
     * - 고아 PENDING 재발행
     * - 오래된 정산 엔트리 삭제
     */
    public ReclaimReport runOnce() throws Exception {
        Instant now = clock.now();
        ReclaimReport r = new ReclaimReport();

        // 1) 만료 임차
        r.purgedLeases = leases.purgeExpired(settings.batchSize());

        // 2) hold 지난 풀
        r.evictedPools = pools.evictIdle();

        // 3) idle 전달 회수 (건별 트랜잭션)
        List<StreamMessage> stale = tx.required(() ->
                transport.pending(now.minus(settings.idleThreshold()), settings.batchSize()));
        for (StreamMessage m : stale) {
            var out = queue.reclaim(m);
            if (out == JobQueueService.ReclaimOutcome.REQUEUED) r.requeued++;
            else if (out == JobQueueService.ReclaimOutcome.DEAD_LETTERED) r.deadLettered++;
            else if (out == JobQueueService.ReclaimOutcome.ACKED) r.acked++;
        }

        // 4) 발행 누락 PENDING
        r.republished = queue.republishOrphans(settings.orphanGrace(), settings.batchSize());

        // 5) 정산 엔트리 보관 기간 정리
        r.trimmed = tx.required(() ->
                transport.trimSettled(now.minus(settings.settledRetention()), settings.batchSize()));

        r.timestamp = now;
        if (r.changed()) log.info("{}", r);
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class ReclaimReport {
        public Instant timestamp;
        public int purgedLeases;
        public int evictedPools;
        public int requeued;
        public int deadLettered;
        public int acked;
        public int republished;
        public int trimmed;

        public boolean changed() {
            return purgedLeases + evictedPools + requeued + deadLettered + acked + republished + trimmed > 0;
        }

        @Override public String toString() {
            return "ReclaimReport{" +
                    "timestamp=" + timestamp +
                    ", purgedLeases=" + purgedLeases +
                    ", evictedPools=" + evictedPools +
                    ", requeued=" + requeued +
                    ", deadLettered=" + deadLettered +
                    ", acked=" + acked +
                    ", republished=" + republished +
                    ", trimmed=" + trimmed +
                    '}';
        }
    }
}
