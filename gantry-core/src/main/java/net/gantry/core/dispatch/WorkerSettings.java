package net.gantry.core.dispatch;

import java.time.Duration;

/**
 * 워커 루프 설정.
 *
 * @param jobType           소비할 잡 type (스트림 jobs:&lt;type&gt;)
 * @param poolId            소속 풀, null 이면 default 그룹
 * @param consumer          그룹 안에서의 컨슈머 이름
 * @param agent             임차 요청 시 agent 이름
 * @param minCapacity       임차 최소 용량
 * @param leaseTtl          임차 ttl (실행 중 heartbeatInterval 마다 연장)
 * @param executionTimeout  핸들러 실행 제한. 넘기면 실패 처리
 * @param allowCpuFallback  GPU 가 없으면 CPU 임차 허용
 * @param requireLease      false 면 임차 없이 실행
 * @param pollInterval      빈 큐일 때 대기
 * @param heartbeatInterval 실행 중 임차/전달 갱신 주기
 */
public record WorkerSettings(
        String jobType,
        String poolId,
        String consumer,
        String agent,
        long minCapacity,
        Duration leaseTtl,
        Duration executionTimeout,
        boolean allowCpuFallback,
        boolean requireLease,
        Duration pollInterval,
        Duration heartbeatInterval
) {
    public static WorkerSettings of(String jobType, String poolId, String consumer) {
        return new WorkerSettings(jobType, poolId, consumer, consumer, 0,
                Duration.ofMinutes(2), Duration.ofMinutes(5), true, true,
                Duration.ofMillis(500), Duration.ofSeconds(10));
    }

    public WorkerSettings withLease(long minCapacity, boolean allowCpuFallback) {
        return new WorkerSettings(jobType, poolId, consumer, agent, minCapacity, leaseTtl, executionTimeout,
                allowCpuFallback, true, pollInterval, heartbeatInterval);
    }
}
