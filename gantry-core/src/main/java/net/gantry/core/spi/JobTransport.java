package net.gantry.core.spi;

import net.gantry.core.model.ConsumerGroup;
import net.gantry.core.model.StreamEntry;
import net.gantry.core.model.StreamMessage;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 컨슈머 그룹을 갖는 내구성 스트림.
 * 한 그룹 안에서 엔트리는 기록 순서대로 한 컨슈머에게만 전달된다.
 * settle 된 엔트리는 어느 그룹에도 다시 전달되지 않는다.
 */
public interface JobTransport {
    long publish(String stream, String jobId, String jobType, Map<String, String> fields,
                 Instant visibleAt, Instant now) throws Exception;

    /** 이미 있으면 false */
    boolean ensureGroup(String stream, String group, String poolId, Instant now) throws Exception;

    /** visible_at 이 지난 미정산 엔트리 중 그룹이 아직 받지 않은 가장 오래된 것 */
    Optional<StreamMessage> read(String stream, String group, String consumer, Instant now) throws Exception;

    boolean ack(String group, long entryId, Instant now) throws Exception;

    /** 실행 중 전달 시각 갱신 (reclaim 대상에서 제외) */
    boolean touch(String group, long entryId, Instant now) throws Exception;

    boolean settle(long entryId, Instant now) throws Exception;

    /** delivered_at <= idleBefore 인 미확인 전달 (전체 그룹) */
    List<StreamMessage> pending(Instant idleBefore, int limit) throws Exception;

    boolean hasLiveEntry(String stream, String jobId) throws Exception;

    /** 스트림별 미정산 엔트리 수 */
    Map<String, Long> depths() throws Exception;

    List<StreamEntry> entries(String stream, int limit) throws Exception;

    List<ConsumerGroup> groups() throws Exception;

    /** settled_at <= olderThan 인 엔트리와 그 전달 기록 삭제 */
    int trimSettled(Instant olderThan, int limit) throws Exception;
}
