package net.gantry.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("gantry")
public class GantryProperties {
    private String replicaId;                 // 비우면 hostname + 난수
    private String advertisedUrl;             // 팔로워가 돌려줄 리더 주소
    private Lease lease = new Lease();
    private Pool pool = new Pool();
    private Job job = new Job();
    private Reclaim reclaim = new Reclaim();
    private Leader leader = new Leader();
    private Admission admission = new Admission();
    private Metrics metrics = new Metrics();
    private Scheduler scheduler = new Scheduler();
    private List<ResourceDef> resources = new ArrayList<>();
    private List<WorkerDef> workers = new ArrayList<>();

    public String getReplicaId() {
        return replicaId;
    }

    public void setReplicaId(String replicaId) {
        this.replicaId = replicaId;
    }

    public String getAdvertisedUrl() {
        return advertisedUrl;
    }

    public void setAdvertisedUrl(String advertisedUrl) {
        this.advertisedUrl = advertisedUrl;
    }

    public Lease getLease() {
        return lease;
    }

    public void setLease(Lease lease) {
        this.lease = lease;
    }

    public Pool getPool() {
        return pool;
    }

    public void setPool(Pool pool) {
        this.pool = pool;
    }

    public Job getJob() {
        return job;
    }

    public void setJob(Job job) {
        this.job = job;
    }

    public Reclaim getReclaim() {
        return reclaim;
    }

    public void setReclaim(Reclaim reclaim) {
        this.reclaim = reclaim;
    }

    public Leader getLeader() {
        return leader;
    }

    public void setLeader(Leader leader) {
        this.leader = leader;
    }

    public Admission getAdmission() {
        return admission;
    }

    public void setAdmission(Admission admission) {
        this.admission = admission;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public List<ResourceDef> getResources() {
        return resources;
    }

    public void setResources(List<ResourceDef> resources) {
        this.resources = resources;
    }

    public List<WorkerDef> getWorkers() {
        return workers;
    }

    public void setWorkers(List<WorkerDef> workers) {
        this.workers = workers;
    }

    public static class Lease {
        private Duration defaultTtl = Duration.ofHours(1);
        private long maxCapacityPerAgent = 0;   // 0 이하 무제한
        private boolean safeMode = false;

        public Duration getDefaultTtl() {
            return defaultTtl;
        }

        public void setDefaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
        }

        public long getMaxCapacityPerAgent() {
            return maxCapacityPerAgent;
        }

        public void setMaxCapacityPerAgent(long maxCapacityPerAgent) {
            this.maxCapacityPerAgent = maxCapacityPerAgent;
        }

        public boolean isSafeMode() {
            return safeMode;
        }

        public void setSafeMode(boolean safeMode) {
            this.safeMode = safeMode;
        }
    }

    public static class Pool {
        private int minWarmWorkers = 0;
        private int maxTotalWorkers = 8;
        private Duration drainTimeout = Duration.ofMinutes(5);
        private long defaultHoldSeconds = 300;
        private int batchSize = 100;

        public int getMinWarmWorkers() {
            return minWarmWorkers;
        }

        public void setMinWarmWorkers(int minWarmWorkers) {
            this.minWarmWorkers = minWarmWorkers;
        }

        public int getMaxTotalWorkers() {
            return maxTotalWorkers;
        }

        public void setMaxTotalWorkers(int maxTotalWorkers) {
            this.maxTotalWorkers = maxTotalWorkers;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }

        public long getDefaultHoldSeconds() {
            return defaultHoldSeconds;
        }

        public void setDefaultHoldSeconds(long defaultHoldSeconds) {
            this.defaultHoldSeconds = defaultHoldSeconds;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Job {
        private int maxAttempts = 3;
        private Duration deferBackoff = Duration.ofSeconds(5);
        private Retry retry = new Retry();

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getDeferBackoff() {
            return deferBackoff;
        }

        public void setDeferBackoff(Duration deferBackoff) {
            this.deferBackoff = deferBackoff;
        }

        public Retry getRetry() {
            return retry;
        }

        public void setRetry(Retry retry) {
            this.retry = retry;
        }
    }

    public static class Retry {
        private String strategy = "exponential";  // fixed | exponential
        private Duration base = Duration.ofSeconds(2);
        private Duration max = Duration.ofMinutes(1);
        private double jitter = 0.5;

        public String getStrategy() {
            return strategy;
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }

        public Duration getBase() {
            return base;
        }

        public void setBase(Duration base) {
            this.base = base;
        }

        public Duration getMax() {
            return max;
        }

        public void setMax(Duration max) {
            this.max = max;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    public static class Reclaim {
        private Duration idleThreshold = Duration.ofSeconds(60);
        private Duration orphanGrace = Duration.ofSeconds(30);
        private Duration settledRetention = Duration.ofHours(24);
        private int batchSize = 100;

        public Duration getIdleThreshold() {
            return idleThreshold;
        }

        public void setIdleThreshold(Duration idleThreshold) {
            this.idleThreshold = idleThreshold;
        }

        public Duration getOrphanGrace() {
            return orphanGrace;
        }

        public void setOrphanGrace(Duration orphanGrace) {
            this.orphanGrace = orphanGrace;
        }

        public Duration getSettledRetention() {
            return settledRetention;
        }

        public void setSettledRetention(Duration settledRetention) {
            this.settledRetention = settledRetention;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Leader {
        private String lockName = "gantry-leader";
        private Duration ttl = Duration.ofSeconds(15);

        public String getLockName() {
            return lockName;
        }

        public void setLockName(String lockName) {
            this.lockName = lockName;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Admission {
        private boolean enabled = true;
        private double ratePerSecond = 50;
        private int burst = 100;
        private double utilizationWatermark = 90.0;   // %
        private long queueDepthWatermark = 0;         // 0 이면 끔
        private Map<String, AgentLimit> agents = new LinkedHashMap<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getRatePerSecond() {
            return ratePerSecond;
        }

        public void setRatePerSecond(double ratePerSecond) {
            this.ratePerSecond = ratePerSecond;
        }

        public int getBurst() {
            return burst;
        }

        public void setBurst(int burst) {
            this.burst = burst;
        }

        public double getUtilizationWatermark() {
            return utilizationWatermark;
        }

        public void setUtilizationWatermark(double utilizationWatermark) {
            this.utilizationWatermark = utilizationWatermark;
        }

        public long getQueueDepthWatermark() {
            return queueDepthWatermark;
        }

        public void setQueueDepthWatermark(long queueDepthWatermark) {
            this.queueDepthWatermark = queueDepthWatermark;
        }

        public Map<String, AgentLimit> getAgents() {
            return agents;
        }

        public void setAgents(Map<String, AgentLimit> agents) {
            this.agents = agents;
        }
    }

    public static class AgentLimit {
        private double ratePerSecond;
        private int burst = 1;

        public double getRatePerSecond() {
            return ratePerSecond;
        }

        public void setRatePerSecond(double ratePerSecond) {
            this.ratePerSecond = ratePerSecond;
        }

        public int getBurst() {
            return burst;
        }

        public void setBurst(int burst) {
            this.burst = burst;
        }
    }

    public static class Metrics {
        private Duration latencyWindow = Duration.ofMinutes(15);

        public Duration getLatencyWindow() {
            return latencyWindow;
        }

        public void setLatencyWindow(Duration latencyWindow) {
            this.latencyWindow = latencyWindow;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long leaderDelayMs = 5000;
        private long reconcileDelayMs = 10000;
        private long reclaimDelayMs = 15000;
        private Duration maxJitter = Duration.ofMillis(500);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getLeaderDelayMs() {
            return leaderDelayMs;
        }

        public void setLeaderDelayMs(long leaderDelayMs) {
            this.leaderDelayMs = leaderDelayMs;
        }

        public long getReconcileDelayMs() {
            return reconcileDelayMs;
        }

        public void setReconcileDelayMs(long reconcileDelayMs) {
            this.reconcileDelayMs = reconcileDelayMs;
        }

        public long getReclaimDelayMs() {
            return reclaimDelayMs;
        }

        public void setReclaimDelayMs(long reclaimDelayMs) {
            this.reclaimDelayMs = reclaimDelayMs;
        }

        public Duration getMaxJitter() {
            return maxJitter;
        }

        public void setMaxJitter(Duration maxJitter) {
            this.maxJitter = maxJitter;
        }
    }

    /** 시작 시 시드할 자원 한 건 */
    public static class ResourceDef {
        private int index;
        private String name;
        private long totalCapacity;
        private Long freeCapacity;   // 비우면 total

        public int getIndex() {
            return index;
        }

        public void setIndex(int index) {
            this.index = index;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public long getTotalCapacity() {
            return totalCapacity;
        }

        public void setTotalCapacity(long totalCapacity) {
            this.totalCapacity = totalCapacity;
        }

        public Long getFreeCapacity() {
            return freeCapacity;
        }

        public void setFreeCapacity(Long freeCapacity) {
            this.freeCapacity = freeCapacity;
        }

        @Override
        public String toString() {
            return "ResourceDef{" +
                    "index=" + index +
                    ", name='" + name + '\'' +
                    ", totalCapacity=" + totalCapacity +
                    ", freeCapacity=" + freeCapacity +
                    '}';
        }
    }

    /** 이 레플리카에서 돌릴 워커 루프 한 개 */
    public static class WorkerDef {
        private String jobType;
        private String poolId;
        private String consumer;
        private String agent;
        private long minCapacity = 0;
        private Duration leaseTtl = Duration.ofMinutes(2);
        private Duration executionTimeout = Duration.ofMinutes(5);
        private boolean allowCpuFallback = true;
        private boolean requireLease = true;
        private Duration pollInterval = Duration.ofMillis(500);
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private int count = 1;

        public String getJobType() {
            return jobType;
        }

        public void setJobType(String jobType) {
            this.jobType = jobType;
        }

        public String getPoolId() {
            return poolId;
        }

        public void setPoolId(String poolId) {
            this.poolId = poolId;
        }

        public String getConsumer() {
            return consumer;
        }

        public void setConsumer(String consumer) {
            this.consumer = consumer;
        }

        public String getAgent() {
            return agent;
        }

        public void setAgent(String agent) {
            this.agent = agent;
        }

        public long getMinCapacity() {
            return minCapacity;
        }

        public void setMinCapacity(long minCapacity) {
            this.minCapacity = minCapacity;
        }

        public Duration getLeaseTtl() {
            return leaseTtl;
        }

        public void setLeaseTtl(Duration leaseTtl) {
            this.leaseTtl = leaseTtl;
        }

        public Duration getExecutionTimeout() {
            return executionTimeout;
        }

        public void setExecutionTimeout(Duration executionTimeout) {
            this.executionTimeout = executionTimeout;
        }

        public boolean isAllowCpuFallback() {
            return allowCpuFallback;
        }

        public void setAllowCpuFallback(boolean allowCpuFallback) {
            this.allowCpuFallback = allowCpuFallback;
        }

        public boolean isRequireLease() {
            return requireLease;
        }

        public void setRequireLease(boolean requireLease) {
            this.requireLease = requireLease;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }

        @Override
        public String toString() {
            return "WorkerDef{" +
                    "jobType='" + jobType + '\'' +
                    ", poolId='" + poolId + '\'' +
                    ", consumer='" + consumer + '\'' +
                    ", count=" + count +
                    '}';
        }
    }
}
