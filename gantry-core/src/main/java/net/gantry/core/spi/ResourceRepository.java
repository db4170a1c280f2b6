package net.gantry.core.spi;

import net.gantry.core.model.Resource;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ResourceRepository {
    /** 설정 기반 시드: 없으면 INSERT, 있으면 이름/총량/가용량 갱신 */
    void upsert(Resource r) throws Exception;

    /** 전체 용량 행을 인덱스 순으로 FOR UPDATE (임차 할당 직렬화) */
    List<Resource> lockAll() throws Exception;

    List<Resource> findAll() throws Exception;

    Optional<Resource> findByIndex(int resourceIndex) throws Exception;

    /** 관측된 가용량 반영 */
    boolean updateFree(int resourceIndex, long freeCapacity, Instant now) throws Exception;
}
