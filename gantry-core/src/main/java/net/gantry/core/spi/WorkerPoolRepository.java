package net.gantry.core.spi;

import net.gantry.core.model.WorkerPool;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface WorkerPoolRepository {
    /** pool_id 중복이면 false */
    boolean insert(WorkerPool pool) throws Exception;

    Optional<WorkerPool> findById(String poolId) throws Exception;

    /** 상태 전이 직렬화용 FOR UPDATE 조회 */
    Optional<WorkerPool> lockById(String poolId) throws Exception;

    List<WorkerPool> findAll() throws Exception;

    /** started_at 오름차순 */
    List<WorkerPool> findByStatuses(Collection<WorkerPool.Status> statuses) throws Exception;

    /** CAS 전이: 현재 상태가 from 중 하나일 때만 */
    boolean transition(String poolId, Collection<WorkerPool.Status> from, WorkerPool.Status to, Instant now) throws Exception;

    /** STARTING/RUNNING → DRAINING, drain_started_at 기록 */
    boolean markDraining(String poolId, Instant now) throws Exception;

    boolean heartbeat(String poolId, int spawnedWorkers, Instant now) throws Exception;

    boolean updateSpawned(String poolId, int spawnedWorkers, Instant now) throws Exception;

    /** spawn_seq += count. 호출자가 lockById 로 잡은 행에서 이전 값을 읽는다 */
    boolean advanceSpawnSeq(String poolId, int count, Instant now) throws Exception;
}
