package net.gantry.bootstrap.autoconfigure;

import net.gantry.bootstrap.inventory.ResourceRegistrar;
import net.gantry.bootstrap.props.GantryProperties;
import net.gantry.core.model.Job;
import net.gantry.core.model.Resource;
import net.gantry.core.service.*;
import net.gantry.core.spi.JobHandler;
import net.gantry.integration.spring.sched.GantrySchedulers;
import net.gantry.integration.spring.worker.GantryWorkers;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GantryAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(GantryAutoConfiguration.class))
            .withUserConfiguration(H2Config.class)
            .withPropertyValues("gantry.replica-id=replica-a", "gantry.advertised-url=http://replica-a:8080");

    @Configuration
    static class H2Config {
        @Bean
        DataSource dataSource() {
            var ds = new DriverManagerDataSource("jdbc:h2:mem:" + UUID.randomUUID()
                    + ";MODE=PostgreSQL;DATABASE_TO_UPPER=TRUE;DB_CLOSE_DELAY=-1", "sa", "");
            new ResourceDatabasePopulator(new ClassPathResource("db/migration/common/V1__gantry_schema.sql"),
                    new ClassPathResource("db/migration/common/V2__claim_delivery_and_spawn_seq.sql")).execute(ds);
            return ds;
        }

        @Bean
        PlatformTransactionManager transactionManager(DataSource ds) {
            return new DataSourceTransactionManager(ds);
        }
    }

    @Configuration
    static class EmbedHandlerConfig {
        @Bean
        JobHandler embedHandler() {
            return new JobHandler() {
                @Override
                public String type() {
                    return "embed";
                }

                @Override
                public void handle(Job job) {
                }
            };
        }
    }

    @Test
    void defaults_wireCoreServicesAndSchedulers() {
        runner.run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx).hasSingleBean(Orchestrator.class);
            assertThat(ctx).hasSingleBean(GantrySchedulers.class);
            assertThat(ctx.getBean(LeaderElector.class).replicaId()).isEqualTo("replica-a");
            assertThat(ctx.getBean(AuditLog.class).actor()).isEqualTo("replica-a");

            var pools = ctx.getBean(WorkerPoolService.class).policy();
            assertThat(pools.maxTotalWorkers()).isEqualTo(8);
            assertThat(pools.drainTimeout()).isEqualTo(Duration.ofMinutes(5));
            assertThat(ctx.getBean(LeaseService.class).policy().defaultTtl()).isEqualTo(Duration.ofHours(1));
            assertThat(ctx.getBean(JobQueueService.class).maxAttempts()).isEqualTo(3);
            assertThat(ctx.getBean(GantryWorkers.class).workers()).isEmpty();
        });
    }

    @Test
    void properties_overridePolicies() {
        runner.withPropertyValues(
                "gantry.lease.safe-mode=true",
                "gantry.lease.max-capacity-per-agent=4096",
                "gantry.pool.max-total-workers=2",
                "gantry.job.max-attempts=5",
                "gantry.job.retry.strategy=fixed",
                "gantry.job.retry.base=7s",
                "gantry.scheduler.enabled=false"
        ).run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx).doesNotHaveBean(GantrySchedulers.class);
            var lease = ctx.getBean(LeaseService.class).policy();
            assertThat(lease.safeMode()).isTrue();
            assertThat(lease.maxCapacityPerAgent()).isEqualTo(4096);
            assertThat(ctx.getBean(WorkerPoolService.class).policy().maxTotalWorkers()).isEqualTo(2);
            assertThat(ctx.getBean(JobQueueService.class).maxAttempts()).isEqualTo(5);
            assertThat(ctx.getBean(RetryPolicy.class).nextBackoff(4)).isEqualTo(Duration.ofSeconds(7));
        });
    }

    @Test
    void unknownRetryStrategy_failsStartup() {
        runner.withPropertyValues("gantry.job.retry.strategy=linear")
                .run(ctx -> assertThat(ctx).hasFailed());
    }

    @Test
    void workerWithoutHandler_failsStartup() {
        runner.withPropertyValues(
                "gantry.scheduler.enabled=false",
                "gantry.workers[0].job-type=transcribe"
        ).run(ctx -> {
            assertThat(ctx).hasFailed();
            assertThat(ctx.getStartupFailure()).hasStackTraceContaining("no JobHandler bean for job type: transcribe");
        });
    }

    @Test
    void workersAreBuiltPerCountWithMatchingHandler() {
        runner.withUserConfiguration(EmbedHandlerConfig.class)
                .withPropertyValues(
                        "gantry.scheduler.enabled=false",
                        "gantry.workers[0].job-type=embed",
                        "gantry.workers[0].consumer=embedder",
                        "gantry.workers[0].count=2",
                        "gantry.workers[0].require-lease=false"
                ).run(ctx -> {
                    assertThat(ctx).hasNotFailed();
                    var workers = ctx.getBean(GantryWorkers.class);
                    assertThat(workers.workers()).hasSize(2);
                    assertThat(workers.isRunning()).isTrue();
                });
    }

    @Test
    void registrar_seedsResourcesAndRejectsDuplicates() {
        runner.withPropertyValues("gantry.scheduler.enabled=false").run(ctx -> {
            var registrar = ctx.getBean(ResourceRegistrar.class);
            var a = new GantryProperties.ResourceDef();
            a.setIndex(0);
            a.setTotalCapacity(16_000);
            var b = new GantryProperties.ResourceDef();
            b.setIndex(1);
            b.setName("a100-1");
            b.setTotalCapacity(80_000);
            b.setFreeCapacity(40_000L);
            registrar.register(List.of(a, b));

            List<Resource> all = ctx.getBean(ResourceService.class).list();
            assertThat(all).extracting(Resource::name).containsExactly("gpu-0", "a100-1");
            assertThat(all).extracting(Resource::freeCapacity).containsExactly(16_000L, 40_000L);

            var dup = new GantryProperties.ResourceDef();
            dup.setIndex(0);
            dup.setTotalCapacity(1);
            assertThatThrownBy(() -> registrar.register(List.of(dup, dup)))
                    .isInstanceOf(IllegalArgumentException.class);
        });
    }
}
