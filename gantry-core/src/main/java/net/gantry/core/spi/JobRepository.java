package net.gantry.core.spi;

import net.gantry.core.model.Job;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface JobRepository {
    /** job_id 중복이면 false (멱등 제출) */
    boolean insert(Job job) throws Exception;

    Optional<Job> findById(String jobId) throws Exception;

    /** PENDING → CLAIMED, owner_pool 과 선점 전달(claimGroup, claimEntry, 둘 다 null 가능) 기록 */
    boolean claim(String jobId, String ownerPool, String claimGroup, Long claimEntry, Instant now) throws Exception;

    /** CLAIMED → RUNNING */
    boolean start(String jobId, Instant now) throws Exception;

    /** RUNNING → DONE */
    boolean complete(String jobId, Instant now) throws Exception;

    /** RUNNING → FAILED, attempts+1, last_error */
    boolean markFailed(String jobId, String error, Instant now) throws Exception;

    /** from → PENDING, owner_pool 과 선점 전달 해제, available_at 재설정 (incrementAttempts면 attempts+1) */
    boolean requeue(String jobId, Collection<Job.Status> from, Instant availableAt, String error,
                    boolean incrementAttempts, Instant now) throws Exception;

    /** from → DEAD_LETTER */
    boolean deadLetter(String jobId, Collection<Job.Status> from, String error,
                       boolean incrementAttempts, Instant now) throws Exception;

    int countInFlightByPool(String poolId) throws Exception;

    int countByStatus(Job.Status status) throws Exception;

    /** type 이 null 이면 전체, updated_at 내림차순 */
    List<Job> findByStatus(Job.Status status, String type, int limit) throws Exception;

    /** PENDING 이면서 updated_at <= olderThan, available_at <= now 인 것 */
    List<Job> findStalePending(Instant olderThan, Instant now, int limit) throws Exception;

    /** since 이후 DONE 된 잡 (지연시간 계산용) */
    List<Job> findCompletedSince(Instant since, int limit) throws Exception;
}
