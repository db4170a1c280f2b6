package net.gantry.adapter.jdbc;

import net.gantry.core.service.LeaseRequest;
import net.gantry.core.service.MetricsService;
import net.gantry.core.service.PoolRequest;
import net.gantry.core.service.Streams;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsAcceptanceTest extends TestSupport {

    private Fixture f;
    private MetricsService metrics;

    @BeforeAll
    void initAll() {
        f = new Fixture(ds);
        metrics = new MetricsService(f.leaseRepo, f.resourceRepo, f.poolRepo, f.jobRepo, f.transport,
                f.tx, f.clock, Duration.ofMinutes(15));
    }

    @Test
    void snapshot_reportsLeasesPoolsQueuesAndLatency() throws Exception {
        f.resources.register(0, "gpu0", 10_000, 5_000);
        f.resources.register(1, "gpu1", 10_000, 10_000);
        f.leases.request(LeaseRequest.gpu("a", 1_000, 600));
        f.pools.create(new PoolRequest("chat", "llama", null, 2, 600L, "chat-base", Map.of()));
        f.pools.heartbeat("chat-base", 2);

        f.queue.submit("m-1", "inference", null);
        f.queue.claim("m-1", null);
        f.queue.start("m-1");
        f.clock.advance(Duration.ofMillis(1500));
        f.queue.complete("m-1", null);
        f.queue.submit("m-2", "inference", null);

        MetricsService.Snapshot s = metrics.snapshot();

        assertEquals(1, s.activeLeases());
        assertEquals(1, s.freeResources());
        assertEquals(25.0, s.utilizationPercent(), 0.001);
        assertEquals(1, s.workerPools());
        assertEquals(2, s.workersPerPool().get("chat-base"));
        // m-1 엔트리는 complete 에서 정산하지 않았으므로(메시지 없음) 둘 다 남는다
        assertEquals(2L, s.queueDepth().get(Streams.jobs("inference")));
        assertEquals(1500.0, s.meanLatencyMsByType().get("inference"), 0.001);
        assertEquals(0, s.deadLetters());
    }
}
