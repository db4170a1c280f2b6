package net.gantry.core.dispatch;

import net.gantry.core.error.JobMaxAttemptsExceededException;
import net.gantry.core.error.LeaseDeniedException;
import net.gantry.core.error.LeaseExpiredException;
import net.gantry.core.error.LeaseNotFoundException;
import net.gantry.core.model.Job;
import net.gantry.core.model.Lease;
import net.gantry.core.model.StreamMessage;
import net.gantry.core.model.WorkerPool;
import net.gantry.core.service.JobQueueService;
import net.gantry.core.service.LeaseRequest;
import net.gantry.core.service.LeaseService;
import net.gantry.core.service.Streams;
import net.gantry.core.service.WorkerPoolService;
import net.gantry.core.spi.Clock;
import net.gantry.core.spi.JobHandler;
import net.gantry.core.spi.JobTransport;
import net.gantry.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 컨슈머 그룹 하나의 워커 루프.
 * 읽기 → 잡 선점(실패 시 ack 후 skip) → 임차 → 실행 → done/failed 보고 → 임차 반납 → ack.
 */
public final class JobWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);
    private static final int MAX_ERROR_LENGTH = 1000;

    public enum Outcome { IDLE, PAUSED, SKIPPED, DEFERRED, DONE, FAILED }

    private final WorkerSettings settings;
    private final JobQueueService queue;
    private final LeaseService leases;
    private final WorkerPoolService pools;
    private final JobTransport transport;
    private final TxRunner tx;
    private final Clock clock;
    private final JobHandler handler;
    private final ExecutorService executor;
    private final String stream;
    private final String group;

    private volatile boolean groupReady;
    private volatile boolean running;

    public JobWorker(WorkerSettings settings,
                     JobQueueService queue,
                     LeaseService leases,
                     WorkerPoolService pools,
                     JobTransport transport,
                     TxRunner tx,
                     Clock clock,
                     JobHandler handler) {
        this.settings = settings;
        this.queue = queue;
        this.leases = leases;
        this.pools = pools;
        this.transport = transport;
        this.tx = tx;
        this.clock = clock;
        this.handler = handler;
        this.stream = Streams.jobs(settings.jobType());
        this.group = Streams.group(settings.jobType(), settings.poolId());
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "gantry-handler-" + settings.consumer());
            t.setDaemon(true);
            return t;
        });
    }

    public String group() {
        return group;
    }

    /** 그룹 생성 (멱등) */
    public void init() throws Exception {
        if (groupReady) return;
        boolean created = tx.requiresNew(() -> transport.ensureGroup(stream, group, settings.poolId(), clock.now()));
        if (created) log.info("consumer group created: {} on {}", group, stream);
        groupReady = true;
    }

    /** 엔트리 하나 처리. 읽을 게 없으면 IDLE */
    public Outcome runOnce() throws Exception {
        init();
        if (settings.poolId() != null) {
            WorkerPool pool = pools.get(settings.poolId());
            if (!pool.acceptsWork()) return Outcome.PAUSED;
        }

        Optional<StreamMessage> read = tx.required(() -> transport.read(stream, group, settings.consumer(), clock.now()));
        if (read.isEmpty()) return Outcome.IDLE;
        StreamMessage msg = read.get();
        String jobId = msg.jobId();

        // 1) 선점: 다른 그룹이 가져갔거나 종료된 잡이면 ack 후 skip
        if (!queue.claim(msg, settings.poolId())) {
            queue.skip(msg);
            log.debug("skip {}: claim lost", jobId);
            return Outcome.SKIPPED;
        }

        // 2) 임차
        String token = null;
        if (settings.requireLease()) {
            try {
                token = leases.request(new LeaseRequest(settings.agent(), settings.minCapacity(),
                        settings.leaseTtl().toSeconds(), Lease.Mode.GPU, settings.allowCpuFallback(),
                        settings.poolId(), Map.of("job_id", jobId))).token();
            } catch (LeaseDeniedException denied) {
                queue.defer(jobId, "lease_denied: " + denied.reason(), msg);
                log.info("job {} deferred: {}", jobId, denied.reason());
                return Outcome.DEFERRED;
            }
        }

        // 3) 실행
        try {
            if (!queue.start(jobId)) {
                queue.skip(msg);
                return Outcome.SKIPPED;
            }
            Job job = queue.get(jobId);
            try {
                execute(job, token, msg);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                queue.fail(jobId, "interrupted", msg);
                return Outcome.FAILED;
            } catch (Exception e) {
                String err = describe(e);
                log.warn("job {} failed (attempt {}): {}", jobId, job.attempts() + 1, err);
                try {
                    queue.fail(jobId, err, msg);
                } catch (JobMaxAttemptsExceededException already) {
                    log.warn("job {} was dead-lettered meanwhile: {}", jobId, already.getMessage());
                }
                return Outcome.FAILED;
            }
            queue.complete(jobId, msg);
            log.debug("job {} done", jobId);
            return Outcome.DONE;
        } finally {
            if (token != null) releaseLease(token);
        }
    }

    @Override
    public void run() {
        running = true;
        log.info("worker {} started on {} ({})", settings.consumer(), stream, group);
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Outcome o = runOnce();
                if (o == Outcome.IDLE || o == Outcome.PAUSED) Thread.sleep(settings.pollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.warn("worker {} loop error, retrying after {}", settings.consumer(), settings.pollInterval(), e);
                try {
                    Thread.sleep(settings.pollInterval().toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        log.info("worker {} stopped", settings.consumer());
    }

    public void stop() {
        running = false;
        executor.shutdownNow();
    }

    private void execute(Job job, String token, StreamMessage msg) throws Exception {
        Future<?> f = executor.submit(() -> {
            handler.handle(job);
            return null;
        });
        long deadline = System.nanoTime() + settings.executionTimeout().toNanos();
        long slice = settings.heartbeatInterval().toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                f.cancel(true);
                throw new TimeoutException("execution_timeout after " + settings.executionTimeout());
            }
            try {
                f.get(Math.min(remaining, slice), TimeUnit.NANOSECONDS);
                return;
            } catch (TimeoutException stillRunning) {
                keepAlive(token, msg, f);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception ex) throw ex;
                throw e;
            } catch (InterruptedException ie) {
                f.cancel(true);
                throw ie;
            }
        }
    }

    // 하트비트 부재가 유일한 취소 신호: 임차가 죽었으면 실행도 중단
    private void keepAlive(String token, StreamMessage msg, Future<?> f) throws Exception {
        try {
            if (token != null && leases.heartbeat(token) == LeaseService.HeartbeatResult.EXPIRED) {
                throw new LeaseExpiredException(token);
            }
        } catch (LeaseExpiredException | LeaseNotFoundException dead) {
            f.cancel(true);
            throw dead;
        }
        tx.required(() -> transport.touch(msg.group(), msg.entryId(), clock.now()));
    }

    private void releaseLease(String token) {
        try {
            leases.release(token);
        } catch (LeaseNotFoundException gone) {
            log.debug("lease {} already gone", token);
        } catch (Exception e) {
            log.warn("lease release failed for {}, left to expiry", token, e);
        }
    }

    private static String describe(Exception e) {
        String s = e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
        return s.length() > MAX_ERROR_LENGTH ? s.substring(0, MAX_ERROR_LENGTH) : s;
    }
}
