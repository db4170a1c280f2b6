package net.gantry.core.spi;

import net.gantry.core.model.WorkerPool;

/**
 * 풀의 부족한 워커를 띄우는 경계. 실제 띄운 수를 반환.
 * 순번 firstOrdinal .. firstOrdinal+count-1 은 이 호출에만 발급된 값이다.
 */
public interface WorkerLauncher {
    int launch(WorkerPool pool, long firstOrdinal, int count) throws Exception;
}
