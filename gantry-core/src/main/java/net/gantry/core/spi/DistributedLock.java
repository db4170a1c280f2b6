package net.gantry.core.spi;

import net.gantry.core.model.LeaderLease;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/** TTL 기반 분산 락. 획득과 갱신은 같은 호출 */
public interface DistributedLock {
    /** 비어있거나, 만료됐거나, 내가 가진 락이면 holder 로 잡고(또는 연장) 결과 반환 */
    Optional<LeaderLease> tryAcquire(String lockName, String holder, String holderHint,
                                     Duration ttl, Instant now) throws Exception;

    boolean release(String lockName, String holder, Instant now) throws Exception;

    Optional<LeaderLease> current(String lockName) throws Exception;
}
