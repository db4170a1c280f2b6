package net.gantry.integration.spring.tx;

import net.gantry.adapter.jdbc.TxContext;
import net.gantry.adapter.jdbc.repo.JdbcResourceRepository;
import net.gantry.core.model.Resource;
import net.gantry.core.spi.ResourceRepository;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SpringTxRunnerTest {

    private DriverManagerDataSource ds;
    private SpringTxRunner tx;
    private ResourceRepository resources;

    @BeforeAll
    void setup() {
        ds = new DriverManagerDataSource("jdbc:h2:mem:" + UUID.randomUUID()
                + ";MODE=PostgreSQL;DATABASE_TO_UPPER=TRUE;DB_CLOSE_DELAY=-1", "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("db/migration/common/V1__gantry_schema.sql"),
                    new ClassPathResource("db/migration/common/V2__claim_delivery_and_spawn_seq.sql")).execute(ds);
        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
        resources = new JdbcResourceRepository(ds);
    }

    @BeforeEach
    void clean() throws Exception {
        tx.required(() -> {
            try (var st = TxContext.require().createStatement()) {
                st.execute("DELETE FROM TB_RESOURCE");
            }
            return null;
        });
    }

    private Resource gpu(int index) {
        return new Resource(index, "gpu" + index, 1_000, 1_000, Instant.parse("2026-03-01T00:00:00Z"));
    }

    @Test
    void required_commitsAndBindsConnectionOnlyInside() throws Exception {
        tx.required(() -> {
            assertThat(TxContext.get()).isNotNull();
            resources.upsert(gpu(0));
            return null;
        });

        assertThat(TxContext.get()).isNull();
        assertThat(tx.required(resources::findAll)).hasSize(1);
    }

    @Test
    void runtimeFailure_rollsBack() throws Exception {
        assertThatThrownBy(() -> tx.required(() -> {
            resources.upsert(gpu(0));
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(tx.required(resources::findAll)).isEmpty();
    }

    @Test
    void checkedFailure_rollsBack_andIsRethrownUnwrapped() throws Exception {
        assertThatThrownBy(() -> tx.required(() -> {
            resources.upsert(gpu(0));
            throw new IOException("disk");
        })).isInstanceOf(IOException.class).hasMessage("disk");

        assertThat(tx.required(resources::findAll)).isEmpty();
    }

    @Test
    void requiresNew_commitsIndependently_andRestoresOuterConnection() throws Exception {
        assertThatThrownBy(() -> tx.required(() -> {
            var outer = TxContext.get();
            resources.upsert(gpu(0));
            tx.requiresNew(() -> {
                assertThat(TxContext.get()).isNotSameAs(outer);
                resources.upsert(gpu(1));
                return null;
            });
            assertThat(TxContext.get()).isSameAs(outer);
            throw new SQLException("outer fails");
        })).isInstanceOf(SQLException.class);

        var left = tx.required(resources::findAll);
        assertThat(left).extracting(Resource::resourceIndex).containsExactly(1);
    }
}
