package net.gantry.core.spi;

import net.gantry.core.model.Lease;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface LeaseRepository {
    void insert(Lease lease) throws Exception;

    Optional<Lease> findByToken(String token) throws Exception;

    List<Lease> findAll() throws Exception;

    List<Lease> findByPool(String poolId) throws Exception;

    /** 만료되지 않은 임차가 잡고 있는 resource_index 집합 */
    Set<Integer> activeResourceIndexes(Instant now) throws Exception;

    /** 해당 인덱스에 남아있는 만료 임차 제거 (재할당 직전) */
    int deleteExpiredOn(int resourceIndex, Instant now) throws Exception;

    /** 살아있는 임차만 연장: expires_at > now 조건부 */
    boolean extend(String token, Instant newExpiresAt, Instant now) throws Exception;

    boolean delete(String token) throws Exception;

    /** 만료된 경우에만 삭제 (purge 경합 대비 CAS) */
    boolean deleteIfExpired(String token, Instant now) throws Exception;

    List<Lease> findExpired(Instant now, int limit) throws Exception;

    int countActive(Instant now) throws Exception;
}
