package net.gantry.core.service;

import net.gantry.core.model.Job;
import net.gantry.core.model.Resource;
import net.gantry.core.model.WorkerPool;
import net.gantry.core.spi.Clock;
import net.gantry.core.spi.JobRepository;
import net.gantry.core.spi.JobTransport;
import net.gantry.core.spi.LeaseRepository;
import net.gantry.core.spi.ResourceRepository;
import net.gantry.core.spi.TxRunner;
import net.gantry.core.spi.WorkerPoolRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class MetricsService {
    private final LeaseRepository leases;
    private final ResourceRepository resources;
    private final WorkerPoolRepository pools;
    private final JobRepository jobs;
    private final JobTransport transport;
    private final TxRunner tx;
    private final Clock clock;
    private final Duration latencyWindow;

    public MetricsService(LeaseRepository leases,
                          ResourceRepository resources,
                          WorkerPoolRepository pools,
                          JobRepository jobs,
                          JobTransport transport,
                          TxRunner tx,
                          Clock clock,
                          Duration latencyWindow) {
        this.leases = leases;
        this.resources = resources;
        this.pools = pools;
        this.jobs = jobs;
        this.transport = transport;
        this.tx = tx;
        this.clock = clock;
        this.latencyWindow = latencyWindow;
    }

    public record Snapshot(
            Instant timestamp,
            int activeLeases,
            int freeResources,
            double utilizationPercent,
            int workerPools,
            Map<String, Integer> workersPerPool,
            Map<String, Long> queueDepth,
            Map<String, Double> meanLatencyMsByType,
            int deadLetters
    ) {}

    public Snapshot snapshot() throws Exception {
        return tx.required(() -> {
            Instant now = clock.now();
            List<Resource> all = resources.findAll();
            var busy = leases.activeResourceIndexes(now);
            int free = (int) all.stream().filter(r -> !busy.contains(r.resourceIndex())).count();

            Map<String, Integer> perPool = new LinkedHashMap<>();
            for (WorkerPool p : pools.findByStatuses(WorkerPool.Status.ACTIVE)) {
                perPool.put(p.poolId(), p.spawnedWorkers());
            }

            Map<String, long[]> sums = new TreeMap<>();   // type → {총 ms, 건수}
            for (Job j : jobs.findCompletedSince(now.minus(latencyWindow), 1000)) {
                long[] s = sums.computeIfAbsent(j.type(), t -> new long[2]);
                s[0] += Duration.between(j.createdAt(), j.updatedAt()).toMillis();
                s[1]++;
            }
            Map<String, Double> latency = new TreeMap<>();
            sums.forEach((type, s) -> latency.put(type, (double) s[0] / s[1]));

            return new Snapshot(
                    now,
                    leases.countActive(now),
                    free,
                    ResourceService.utilization(all),
                    perPool.size(),
                    perPool,
                    new TreeMap<>(transport.depths()),
                    latency,
                    jobs.countByStatus(Job.Status.DEAD_LETTER));
        });
    }
}
