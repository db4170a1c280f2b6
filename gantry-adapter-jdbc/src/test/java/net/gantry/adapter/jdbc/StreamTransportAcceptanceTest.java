package net.gantry.adapter.jdbc;

import net.gantry.core.model.StreamMessage;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/** 스트림 전달 순서, 그룹 독립성, 정산/회수/정리 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class StreamTransportAcceptanceTest extends TestSupport {

    private static final String STREAM = "jobs:embed";

    private Fixture f;

    @BeforeAll
    void initAll() {
        f = new Fixture(ds);
    }

    private Optional<StreamMessage> read(String group, String consumer) throws Exception {
        return f.tx.required(() -> f.transport.read(STREAM, group, consumer, f.clock.now()));
    }

    private long publish(String jobId) throws Exception {
        return f.tx.required(() -> f.transport.publish(STREAM, jobId, "embed", Map.of(), f.clock.now(), f.clock.now()));
    }

    @Test
    void a1_entriesDeliveredInOrder_oncePerGroup() throws Exception {
        long e1 = publish("j1");
        long e2 = publish("j2");
        assertTrue(e2 > e1);

        assertTrue(f.tx.required(() -> f.transport.ensureGroup(STREAM, "g1", null, f.clock.now())));
        assertFalse(f.tx.required(() -> f.transport.ensureGroup(STREAM, "g1", null, f.clock.now())));

        assertEquals("j1", read("g1", "c1").orElseThrow().jobId());
        assertEquals("j2", read("g1", "c2").orElseThrow().jobId());
        assertTrue(read("g1", "c1").isEmpty());

        // 다른 그룹은 처음부터 받는다
        assertEquals(e1, read("g2", "c1").orElseThrow().entryId());
        assertEquals(2, f.tx.required(() -> f.transport.groups()).size());
    }

    @Test
    void a2_invisibleAndSettledEntries_areNotDelivered() throws Exception {
        f.tx.required(() -> f.transport.publish(STREAM, "later", "embed", Map.of(),
                f.clock.now().plusSeconds(10), f.clock.now()));
        long settled = publish("gone");
        f.tx.required(() -> f.transport.settle(settled, f.clock.now()));

        assertTrue(read("g", "c").isEmpty());
        f.clock.advance(Duration.ofSeconds(10));
        assertEquals("later", read("g", "c").orElseThrow().jobId());
        assertEquals(Map.of(STREAM, 1L), f.tx.required(() -> f.transport.depths()));
    }

    @Test
    void a3_pendingListsIdleUnackedDeliveries_touchResetsIdle() throws Exception {
        publish("p1");
        publish("p2");
        StreamMessage m1 = read("g", "c").orElseThrow();
        StreamMessage m2 = read("g", "c").orElseThrow();
        assertTrue(f.tx.required(() -> f.transport.ack("g", m2.entryId(), f.clock.now())));
        assertFalse(f.tx.required(() -> f.transport.ack("g", m2.entryId(), f.clock.now())));

        f.clock.advance(Duration.ofSeconds(60));
        var pending = f.tx.required(() -> f.transport.pending(f.clock.now().minusSeconds(30), 10));
        assertEquals(1, pending.size());
        assertEquals(m1.entryId(), pending.get(0).entryId());

        f.tx.required(() -> f.transport.touch("g", m1.entryId(), f.clock.now()));
        assertTrue(f.tx.required(() -> f.transport.pending(f.clock.now().minusSeconds(30), 10)).isEmpty());
    }

    @Test
    void a4_trimSettled_deletesOldEntriesOnly() throws Exception {
        long old = publish("old");
        read("g", "c");
        f.tx.required(() -> f.transport.settle(old, f.clock.now()));
        f.clock.advance(Duration.ofHours(25));
        long fresh = publish("fresh");
        f.tx.required(() -> f.transport.settle(fresh, f.clock.now()));

        assertEquals(1, f.tx.required(() -> f.transport.trimSettled(f.clock.now().minus(Duration.ofHours(24)), 100)));
        var left = f.tx.required(() -> f.transport.entries(STREAM, 10));
        assertEquals(1, left.size());
        assertEquals("fresh", left.get(0).jobId());
        assertTrue(left.get(0).settled());
    }
}
