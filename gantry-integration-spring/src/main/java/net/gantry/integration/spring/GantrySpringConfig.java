package net.gantry.integration.spring;

import net.gantry.adapter.jdbc.lock.JdbcDistributedLock;
import net.gantry.adapter.jdbc.repo.*;
import net.gantry.adapter.jdbc.transport.JdbcStreamTransport;
import net.gantry.core.spi.*;
import net.gantry.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Instant;

@Configuration
public class GantrySpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public ResourceRepository resourceRepository(DataSource ds) { return new JdbcResourceRepository(ds); }
    @Bean public LeaseRepository leaseRepository(DataSource ds) { return new JdbcLeaseRepository(ds); }
    @Bean public WorkerPoolRepository workerPoolRepository(DataSource ds) { return new JdbcWorkerPoolRepository(ds); }
    @Bean public JobRepository jobRepository(DataSource ds) { return new JdbcJobRepository(ds); }
    @Bean public AuditRepository auditRepository(DataSource ds) { return new JdbcAuditRepository(ds); }

    // 잡 전송/리더 락도 같은 DB 위에서
    @Bean public JobTransport jobTransport(DataSource ds) { return new JdbcStreamTransport(ds); }
    @Bean public DistributedLock distributedLock(DataSource ds) { return new JdbcDistributedLock(ds); }

    @Bean public Clock systemClock() { return Instant::now; }
}
