package net.gantry.adapter.jdbc;

import net.gantry.adapter.jdbc.lock.JdbcDistributedLock;
import net.gantry.adapter.jdbc.repo.JdbcAuditRepository;
import net.gantry.adapter.jdbc.repo.JdbcJobRepository;
import net.gantry.adapter.jdbc.repo.JdbcLeaseRepository;
import net.gantry.adapter.jdbc.repo.JdbcResourceRepository;
import net.gantry.adapter.jdbc.repo.JdbcWorkerPoolRepository;
import net.gantry.adapter.jdbc.transport.JdbcStreamTransport;
import net.gantry.core.maintenance.ReclaimService;
import net.gantry.core.service.AuditLog;
import net.gantry.core.service.JobQueueService;
import net.gantry.core.service.LeasePolicy;
import net.gantry.core.service.LeaseService;
import net.gantry.core.service.PoolPolicy;
import net.gantry.core.service.ResourceService;
import net.gantry.core.service.RetryPolicy;
import net.gantry.core.service.WorkerPoolService;
import net.gantry.core.spi.AuditRepository;
import net.gantry.core.spi.DistributedLock;
import net.gantry.core.spi.JobRepository;
import net.gantry.core.spi.JobTransport;
import net.gantry.core.spi.LeaseRepository;
import net.gantry.core.spi.ResourceRepository;
import net.gantry.core.spi.TxRunner;
import net.gantry.core.spi.WorkerPoolRepository;

import javax.sql.DataSource;
import java.time.Duration;

/** 테스트 공용 조립. 실제 JDBC 어댑터 + 가짜 시계 */
final class Fixture {
    final MutableClock clock = MutableClock.startingAt("2026-03-01T00:00:00Z");
    final TxRunner tx;
    final ResourceRepository resourceRepo;
    final LeaseRepository leaseRepo;
    final WorkerPoolRepository poolRepo;
    final JobRepository jobRepo;
    final AuditRepository auditRepo;
    final JobTransport transport;
    final DistributedLock lock;

    final AuditLog audit;
    final ResourceService resources;
    final LeaseService leases;
    final JobQueueService queue;
    final WorkerPoolService pools;
    final ReclaimService reclaimer;

    Fixture(DataSource ds) {
        this(ds, PoolPolicy.defaults(), 3);
    }

    Fixture(DataSource ds, PoolPolicy poolPolicy, int maxAttempts) {
        tx = new JdbcTxRunner(ds);
        resourceRepo = new JdbcResourceRepository(ds);
        leaseRepo = new JdbcLeaseRepository(ds);
        poolRepo = new JdbcWorkerPoolRepository(ds);
        jobRepo = new JdbcJobRepository(ds);
        auditRepo = new JdbcAuditRepository(ds);
        transport = new JdbcStreamTransport(ds);
        lock = new JdbcDistributedLock(ds);

        audit = new AuditLog(auditRepo, clock, "test-replica");
        resources = new ResourceService(resourceRepo, tx, clock);
        leases = new LeaseService(resourceRepo, leaseRepo, audit, tx, clock, LeasePolicy.defaults());
        queue = new JobQueueService(jobRepo, poolRepo, transport, audit, tx, clock,
                RetryPolicy.fixed(Duration.ofSeconds(5)), maxAttempts, Duration.ofSeconds(2));
        pools = new WorkerPoolService(poolRepo, queue, leases, audit, tx, clock, poolPolicy, null);
        reclaimer = new ReclaimService(leases, pools, queue, transport, tx, clock,
                ReclaimService.Settings.defaults());
    }
}
