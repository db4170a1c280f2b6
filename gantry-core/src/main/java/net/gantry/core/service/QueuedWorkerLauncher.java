package net.gantry.core.service;

import net.gantry.core.model.WorkerPool;
import net.gantry.core.spi.WorkerLauncher;

/**
 * 기본 launcher: 워커 하나당 pool-spawn 잡을 큐에 넣는다.
 * job_id 가 spawn:&lt;pool&gt;:&lt;순번&gt; 이라 같은 순번은 한 번만 접수된다.
 * 순번은 풀의 spawn_seq 에서 발급되므로 워커를 잃은 뒤 다시 띄울 때도 겹치지 않는다.
 */
public final class QueuedWorkerLauncher implements WorkerLauncher {
    public static final String SPAWN_JOB_TYPE = "pool-spawn";

    private final JobQueueService queue;

    public QueuedWorkerLauncher(JobQueueService queue) {
        this.queue = queue;
    }

    @Override
    public int launch(WorkerPool pool, long firstOrdinal, int count) throws Exception {
        int accepted = 0;
        for (int i = 0; i < count; i++) {
            long ordinal = firstOrdinal + i;
            var r = queue.submit("spawn:" + pool.poolId() + ":" + ordinal, SPAWN_JOB_TYPE,
                    "pool_id=" + pool.poolId() + " model=" + pool.modelId() + " ordinal=" + ordinal);
            if (r.accepted()) accepted++;
        }
        return accepted;
    }
}
