package net.gantry.core.service;

import net.gantry.core.error.JobAlreadyExistsException;
import net.gantry.core.error.JobMaxAttemptsExceededException;
import net.gantry.core.error.JobNotFoundException;
import net.gantry.core.model.AuditEvent;
import net.gantry.core.model.Job;
import net.gantry.core.model.StreamMessage;
import net.gantry.core.model.WorkerPool;
import net.gantry.core.spi.Clock;
import net.gantry.core.spi.JobRepository;
import net.gantry.core.spi.JobTransport;
import net.gantry.core.spi.TxRunner;
import net.gantry.core.spi.WorkerPoolRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 잡 큐: 멱등 제출, CAS 기반 상태 전이, 재시도/dead-letter 판정.
 * 모든 전이는 조건부 UPDATE 라 같은 job_id 로 두 번 적용돼도 안전하다.
 */
public final class JobQueueService {
    private static final Logger log = LoggerFactory.getLogger(JobQueueService.class);

    public static final String MAX_ATTEMPTS_EXCEEDED = "max_attempts_exceeded";

    public enum FailOutcome { REQUEUED, DEAD_LETTERED, IGNORED }

    public enum ReclaimOutcome { REQUEUED, DEAD_LETTERED, ACKED, SKIPPED }

    private final JobRepository jobs;
    private final WorkerPoolRepository pools;
    private final JobTransport transport;
    private final AuditLog audit;
    private final TxRunner tx;
    private final Clock clock;
    private final RetryPolicy retry;
    private final int maxAttempts;
    private final Duration deferBackoff;

    public JobQueueService(JobRepository jobs,
                           WorkerPoolRepository pools,
                           JobTransport transport,
                           AuditLog audit,
                           TxRunner tx,
                           Clock clock,
                           RetryPolicy retry,
                           int maxAttempts,
                           Duration deferBackoff) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.jobs = jobs;
        this.pools = pools;
        this.transport = transport;
        this.audit = audit;
        this.tx = tx;
        this.clock = clock;
        this.retry = retry;
        this.maxAttempts = maxAttempts;
        this.deferBackoff = deferBackoff;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * 제출: (1) PENDING 행 + 감사 이벤트 커밋 (2) jobs:&lt;type&gt; 로 발행.
     * (2)가 실패하면 고아 PENDING 으로 남고 reclaimer 가 재발행한다.
     */
    public SubmitResult submit(String jobId, String type, String payload) throws Exception {
        if (jobId == null || jobId.isBlank()) throw new IllegalArgumentException("job_id is required");
        if (type == null || type.isBlank()) throw new IllegalArgumentException("type is required");

        Job inserted;
        try {
            inserted = tx.required(() -> {
                Instant now = clock.now();
                Job j = new Job(jobId, type, payload, Job.Status.PENDING, null, 0, now, now, now, null, null, null);
                if (!jobs.insert(j)) throw new JobAlreadyExistsException(jobId);
                audit.record(AuditEvent.JOB, jobId, "submit", null, Job.Status.PENDING.code(), "type=" + type);
                return j;
            });
        } catch (JobAlreadyExistsException dup) {
            Job existing = get(jobId);
            log.debug("duplicate submission ignored: {} ({})", jobId, existing.status());
            return new SubmitResult(false, jobId, existing.status());
        }

        try {
            tx.required(() -> transport.publish(Streams.jobs(type), jobId, type, Map.of(),
                    inserted.availableAt(), clock.now()));
        } catch (Exception e) {
            log.warn("publish failed for job {}, left for orphan recovery: {}", jobId, e.toString());
        }
        return new SubmitResult(true, jobId, Job.Status.PENDING);
    }

    public Job get(String jobId) throws Exception {
        return tx.required(() -> jobs.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId)));
    }

    public Optional<Job> find(String jobId) throws Exception {
        return tx.required(() -> jobs.findById(jobId));
    }

    /**
     * 전달 msg 를 통해 PENDING → CLAIMED. 선점한 (그룹, 엔트리)를 함께 기록해
     * 다른 그룹의 멈춘 전달이 이 잡을 회수하지 못하게 한다.
     */
    public boolean claim(StreamMessage msg, String poolId) throws Exception {
        return claim(msg.jobId(), poolId, msg.group(), msg.entryId());
    }

    /**
     * 전달 없이 PENDING → CLAIMED. poolId 가 있으면 풀 행을 잠그고 STARTING/RUNNING 일 때만 선점.
     * drain 과 같은 풀 행 락으로 직렬화되므로 draining 풀은 새 잡을 받지 않는다.
     */
    public boolean claim(String jobId, String poolId) throws Exception {
        return claim(jobId, poolId, null, null);
    }

    private boolean claim(String jobId, String poolId, String group, Long entryId) throws Exception {
        return tx.required(() -> {
            if (poolId != null) {
                Optional<WorkerPool> pool = pools.lockById(poolId);
                if (pool.isEmpty() || !pool.get().acceptsWork()) return false;
            }
            if (!jobs.claim(jobId, poolId, group, entryId, clock.now())) return false;
            audit.record(AuditEvent.JOB, jobId, "claim", Job.Status.PENDING.code(), Job.Status.CLAIMED.code(),
                    poolId == null ? null : "pool=" + poolId);
            return true;
        });
    }

    /** CLAIMED → RUNNING */
    public boolean start(String jobId) throws Exception {
        return tx.required(() -> {
            if (!jobs.start(jobId, clock.now())) return false;
            audit.record(AuditEvent.JOB, jobId, "start", Job.Status.CLAIMED.code(), Job.Status.RUNNING.code(), null);
            return true;
        });
    }

    /** RUNNING → DONE, 엔트리 ack + settle */
    public boolean complete(String jobId, StreamMessage msg) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            boolean done = jobs.complete(jobId, now);
            if (done) {
                audit.record(AuditEvent.JOB, jobId, "complete", Job.Status.RUNNING.code(), Job.Status.DONE.code(), null);
            } else {
                log.warn("job {} was no longer running at completion, result dropped", jobId);
            }
            settle(msg, now);
            return done;
        });
    }

    /**
     * 핸들러 실패: RUNNING → FAILED(attempts+1) 후
     * attempts &lt; maxAttempts 면 백오프 뒤 PENDING 으로 재발행, 아니면 DEAD_LETTER.
     *
     * @throws JobMaxAttemptsExceededException 이미 dead_letter 인 잡
     */
    public FailOutcome fail(String jobId, String error, StreamMessage msg) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            Job current = jobs.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (current.status() == Job.Status.DEAD_LETTER) {
                throw new JobMaxAttemptsExceededException(jobId, current.attempts());
            }
            if (!jobs.markFailed(jobId, error, now)) {
                settle(msg, now);
                return FailOutcome.IGNORED;
            }
            audit.record(AuditEvent.JOB, jobId, "fail", Job.Status.RUNNING.code(), Job.Status.FAILED.code(), error);
            Job failed = jobs.findById(jobId).orElseThrow();
            FailOutcome out = retryOrDeadLetter(failed, EnumSet.of(Job.Status.FAILED), false, error, now);
            settle(msg, now);
            return out;
        });
    }

    /** 임차 거절: 시도 횟수 소모 없이 CLAIMED → PENDING, deferBackoff 뒤 재노출 */
    public boolean defer(String jobId, String reason, StreamMessage msg) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            Optional<Job> j = jobs.findById(jobId);
            boolean reverted = j.isPresent() && jobs.requeue(jobId, EnumSet.of(Job.Status.CLAIMED),
                    now.plus(deferBackoff), reason, false, now);
            if (reverted) {
                audit.record(AuditEvent.JOB, jobId, "defer", Job.Status.CLAIMED.code(), Job.Status.PENDING.code(), reason);
                transport.publish(Streams.jobs(j.get().type()), jobId, j.get().type(), Map.of(),
                        now.plus(deferBackoff), now);
            }
            settle(msg, now);
            return reverted;
        });
    }

    /** 선점 실패 등으로 이 그룹에서 처리하지 않는 엔트리 확인 */
    public void skip(StreamMessage msg) throws Exception {
        tx.required(() -> transport.ack(msg.group(), msg.entryId(), clock.now()));
    }

    /**
     * idle 임계치를 넘긴 미확인 전달 회수.
     * 종료 상태 잡이면 ack 만. 선점된 잡은 그 선점 전달이 멈췄을 때만 되찾고
     * (attempts+1 후 재발행 또는 dead-letter), 다른 그룹의 전달이면 ack 만 한다.
     */
    public ReclaimOutcome reclaim(StreamMessage msg) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            if (!transport.ack(msg.group(), msg.entryId(), now)) return ReclaimOutcome.SKIPPED;

            Optional<Job> found = jobs.findById(msg.jobId());
            if (found.isEmpty() || found.get().status().terminal()) {
                transport.settle(msg.entryId(), now);
                return ReclaimOutcome.ACKED;
            }
            Job j = found.get();
            if (!Job.Status.RECLAIMABLE.contains(j.status())) {
                return ReclaimOutcome.ACKED;
            }
            if (Job.Status.IN_FLIGHT.contains(j.status()) && !j.claimedThrough(msg.group(), msg.entryId())) {
                log.debug("stale delivery {}#{} of job {} owned by {}#{}, acked only",
                        msg.group(), msg.entryId(), j.jobId(), j.claimGroup(), j.claimEntry());
                return ReclaimOutcome.ACKED;
            }
            FailOutcome out = retryOrDeadLetter(j, Job.Status.RECLAIMABLE, true,
                    "reclaimed: delivery to " + msg.consumer() + " idle", now);
            transport.settle(msg.entryId(), now);
            log.info("reclaimed job {} from {} ({})", j.jobId(), msg.consumer(), out);
            return out == FailOutcome.DEAD_LETTERED ? ReclaimOutcome.DEAD_LETTERED : ReclaimOutcome.REQUEUED;
        });
    }

    /** 살아있는 엔트리가 없는 오래된 PENDING 재발행 */
    public int republishOrphans(Duration grace, int limit) throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            int n = 0;
            for (Job j : jobs.findStalePending(now.minus(grace), now, limit)) {
                String stream = Streams.jobs(j.type());
                if (transport.hasLiveEntry(stream, j.jobId())) continue;
                transport.publish(stream, j.jobId(), j.type(), Map.of(), now, now);
                audit.record(AuditEvent.JOB, j.jobId(), "republish", j.status().code(), j.status().code(), null);
                n++;
            }
            if (n > 0) log.info("republished {} orphaned job(s)", n);
            return n;
        });
    }

    public List<Job> deadLetters(String type, int limit) throws Exception {
        return tx.required(() -> jobs.findByStatus(Job.Status.DEAD_LETTER, type, limit));
    }

    public int countInFlight(String poolId) throws Exception {
        return tx.required(() -> jobs.countInFlightByPool(poolId));
    }

    // 바깥 트랜잭션 안에서만 호출
    private FailOutcome retryOrDeadLetter(Job j, Collection<Job.Status> from, boolean increment,
                                          String error, Instant now) throws Exception {
        int attempts = increment ? j.attempts() + 1 : j.attempts();
        if (attempts < maxAttempts) {
            Instant at = now.plus(retry.nextBackoff(attempts));
            if (!jobs.requeue(j.jobId(), from, at, error, increment, now)) return FailOutcome.IGNORED;
            audit.record(AuditEvent.JOB, j.jobId(), "requeue", j.status().code(), Job.Status.PENDING.code(),
                    "attempts=" + attempts);
            transport.publish(Streams.jobs(j.type()), j.jobId(), j.type(), Map.of(), at, now);
            return FailOutcome.REQUEUED;
        }
        String lastError = MAX_ATTEMPTS_EXCEEDED + (error == null ? "" : ": " + error);
        if (!jobs.deadLetter(j.jobId(), from, lastError, increment, now)) return FailOutcome.IGNORED;
        audit.record(AuditEvent.JOB, j.jobId(), "dead_letter", j.status().code(), Job.Status.DEAD_LETTER.code(),
                "attempts=" + attempts);
        transport.publish(Streams.deadLetter(j.type()), j.jobId(), j.type(),
                Map.of("attempts", String.valueOf(attempts), "last_error", lastError), now, now);
        log.warn("job {} dead-lettered after {} attempt(s): {}", j.jobId(), attempts, error);
        return FailOutcome.DEAD_LETTERED;
    }

    private void settle(StreamMessage msg, Instant now) throws Exception {
        if (msg == null) return;
        transport.ack(msg.group(), msg.entryId(), now);
        transport.settle(msg.entryId(), now);
    }
}
