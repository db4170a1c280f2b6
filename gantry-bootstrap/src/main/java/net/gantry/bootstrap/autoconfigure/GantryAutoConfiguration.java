package net.gantry.bootstrap.autoconfigure;

import net.gantry.bootstrap.inventory.ResourceRegistrar;
import net.gantry.bootstrap.props.GantryProperties;
import net.gantry.core.dispatch.JobWorker;
import net.gantry.core.dispatch.WorkerSettings;
import net.gantry.core.maintenance.ReclaimService;
import net.gantry.core.service.*;
import net.gantry.core.spi.*;
import net.gantry.integration.spring.GantrySpringConfig;
import net.gantry.integration.spring.sched.GantrySchedulers;
import net.gantry.integration.spring.worker.GantryWorkers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@AutoConfiguration
@EnableConfigurationProperties(GantryProperties.class)
@Import(GantrySpringConfig.class) // integration-spring: repos/tx/transport/lock/clock
public class GantryAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(GantryAutoConfiguration.class);

    // --- 레플리카 식별 ---

    static String resolveReplicaId(GantryProperties props) {
        if (props.getReplicaId() != null && !props.getReplicaId().isBlank()) return props.getReplicaId();
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("hostname lookup failed, using 'replica' as replica id prefix", e);
            host = "replica";
        }
        return host + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public AuditLog auditLog(AuditRepository repo, Clock clock, GantryProperties props) {
        return new AuditLog(repo, clock, resolveReplicaId(props));
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceService resourceService(ResourceRepository resources, TxRunner tx, Clock clock) {
        return new ResourceService(resources, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public LeaseService leaseService(ResourceRepository resources,
                                     LeaseRepository leases,
                                     AuditLog audit,
                                     TxRunner tx,
                                     Clock clock,
                                     GantryProperties props) {
        var l = props.getLease();
        var policy = new LeasePolicy(l.getDefaultTtl(), l.getMaxCapacityPerAgent(), l.isSafeMode());
        return new LeaseService(resources, leases, audit, tx, clock, policy);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(GantryProperties props) {
        var r = props.getJob().getRetry();
        if ("fixed".equalsIgnoreCase(r.getStrategy())) return RetryPolicy.fixed(r.getBase());
        if ("exponential".equalsIgnoreCase(r.getStrategy())) {
            return RetryPolicy.exponential(r.getBase(), r.getMax(), r.getJitter());
        }
        throw new IllegalArgumentException("gantry.job.retry.strategy must be fixed or exponential: " + r.getStrategy());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobQueueService jobQueueService(JobRepository jobs,
                                           WorkerPoolRepository pools,
                                           JobTransport transport,
                                           AuditLog audit,
                                           TxRunner tx,
                                           Clock clock,
                                           RetryPolicy retry,
                                           GantryProperties props) {
        var j = props.getJob();
        return new JobQueueService(jobs, pools, transport, audit, tx, clock, retry,
                j.getMaxAttempts(), j.getDeferBackoff());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerLauncher workerLauncher(JobQueueService queue) {
        return new QueuedWorkerLauncher(queue);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerPoolService workerPoolService(WorkerPoolRepository pools,
                                               JobQueueService queue,
                                               LeaseService leases,
                                               AuditLog audit,
                                               TxRunner tx,
                                               Clock clock,
                                               WorkerLauncher launcher,
                                               GantryProperties props) {
        var p = props.getPool();
        var policy = new PoolPolicy(p.getMinWarmWorkers(), p.getMaxTotalWorkers(), p.getDrainTimeout(),
                p.getDefaultHoldSeconds(), p.getBatchSize());
        return new WorkerPoolService(pools, queue, leases, audit, tx, clock, policy, launcher);
    }

    @Bean
    @ConditionalOnMissingBean
    public LeaderElector leaderElector(DistributedLock lock,
                                       TxRunner tx,
                                       Clock clock,
                                       AuditLog audit,
                                       GantryProperties props) {
        var l = props.getLeader();
        String hint = props.getAdvertisedUrl() == null || props.getAdvertisedUrl().isBlank()
                ? null : props.getAdvertisedUrl();
        return new LeaderElector(lock, tx, clock, audit, l.getLockName(), audit.actor(), hint, l.getTtl());
    }

    @Bean
    @ConditionalOnMissingBean
    public AdmissionController admissionController(ResourceRepository resources,
                                                   JobTransport transport,
                                                   TxRunner tx,
                                                   Clock clock,
                                                   GantryProperties props) {
        var a = props.getAdmission();
        Map<String, AdmissionPolicy.Limit> limits = new LinkedHashMap<>();
        a.getAgents().forEach((agent, lim) ->
                limits.put(agent, new AdmissionPolicy.Limit(lim.getRatePerSecond(), lim.getBurst())));
        var policy = new AdmissionPolicy(a.isEnabled(), a.getRatePerSecond(), a.getBurst(), limits,
                a.getUtilizationWatermark(), a.getQueueDepthWatermark());
        return new AdmissionController(resources, transport, tx, clock, policy);
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsService metricsService(LeaseRepository leases,
                                         ResourceRepository resources,
                                         WorkerPoolRepository pools,
                                         JobRepository jobs,
                                         JobTransport transport,
                                         TxRunner tx,
                                         Clock clock,
                                         GantryProperties props) {
        return new MetricsService(leases, resources, pools, jobs, transport, tx, clock,
                props.getMetrics().getLatencyWindow());
    }

    @Bean
    @ConditionalOnMissingBean
    public ReclaimService reclaimService(LeaseService leases,
                                         WorkerPoolService pools,
                                         JobQueueService queue,
                                         JobTransport transport,
                                         TxRunner tx,
                                         Clock clock,
                                         GantryProperties props) {
        var r = props.getReclaim();
        var settings = new ReclaimService.Settings(r.getIdleThreshold(), r.getOrphanGrace(),
                r.getSettledRetention(), r.getBatchSize());
        return new ReclaimService(leases, pools, queue, transport, tx, clock, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public Orchestrator orchestrator(LeaseService leases,
                                     WorkerPoolService pools,
                                     JobQueueService queue,
                                     AdmissionController admission,
                                     LeaderElector leader,
                                     ReclaimService reclaimer) {
        return new Orchestrator(leases, pools, queue, admission, leader, reclaimer);
    }

    // --- 스케줄러 (주기는 gantry.scheduler.*-delay-ms 에서 읽힘) ---

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "gantry.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public GantrySchedulers gantrySchedulers(LeaderElector leader,
                                             WorkerPoolService pools,
                                             ReclaimService reclaimer,
                                             GantryProperties props) {
        var s = new GantrySchedulers(leader, pools, reclaimer);
        s.setMaxJitter(props.getScheduler().getMaxJitter());
        return s;
    }

    // --- 워커 루프 ---

    @Bean
    @ConditionalOnMissingBean
    public GantryWorkers gantryWorkers(GantryProperties props,
                                       ObjectProvider<JobHandler> handlerBeans,
                                       JobQueueService queue,
                                       LeaseService leases,
                                       WorkerPoolService pools,
                                       JobTransport transport,
                                       TxRunner tx,
                                       Clock clock,
                                       AuditLog audit) {
        Map<String, JobHandler> handlers = new LinkedHashMap<>();
        handlerBeans.orderedStream().forEach(h -> {
            JobHandler prev = handlers.putIfAbsent(h.type(), h);
            if (prev != null) throw new IllegalStateException("duplicate JobHandler for type: " + h.type());
        });

        List<JobWorker> workers = new ArrayList<>();
        for (var def : props.getWorkers()) {
            if (def.getJobType() == null || def.getJobType().isBlank()) {
                throw new IllegalArgumentException("gantry.workers[].job-type is required");
            }
            JobHandler handler = handlers.get(def.getJobType());
            if (handler == null) {
                throw new IllegalStateException("no JobHandler bean for job type: " + def.getJobType());
            }
            for (int i = 0; i < Math.max(1, def.getCount()); i++) {
                String consumer = def.getConsumer() != null
                        ? def.getConsumer() + (def.getCount() > 1 ? "-" + i : "")
                        : audit.actor() + "-" + def.getJobType() + "-" + i;
                var settings = new WorkerSettings(
                        def.getJobType(),
                        def.getPoolId(),
                        consumer,
                        def.getAgent() != null ? def.getAgent() : consumer,
                        def.getMinCapacity(),
                        def.getLeaseTtl(),
                        def.getExecutionTimeout(),
                        def.isAllowCpuFallback(),
                        def.isRequireLease(),
                        def.getPollInterval(),
                        def.getHeartbeatInterval());
                workers.add(new JobWorker(settings, queue, leases, pools, transport, tx, clock, handler));
            }
        }
        log.info("Workers configured: {}", props.getWorkers());
        return new GantryWorkers(workers);
    }

    // --- 자원 인벤토리 ---

    @Bean
    public ResourceRegistrar resourceRegistrar(ResourceService resources) {
        return new ResourceRegistrar(resources);
    }

    @Bean
    public ApplicationRunner resourceRunner(ResourceRegistrar registrar, GantryProperties props) {
        return args -> registrar.register(props.getResources());
    }
}
