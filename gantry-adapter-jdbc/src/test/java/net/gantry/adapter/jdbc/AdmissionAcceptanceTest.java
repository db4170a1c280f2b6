package net.gantry.adapter.jdbc;

import net.gantry.core.error.BackpressureRejectedException;
import net.gantry.core.service.AdmissionController;
import net.gantry.core.service.AdmissionPolicy;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class AdmissionAcceptanceTest extends TestSupport {

    private Fixture f;

    @BeforeAll
    void initAll() {
        f = new Fixture(ds);
    }

    private AdmissionController controller(AdmissionPolicy policy) {
        return new AdmissionController(f.resourceRepo, f.transport, f.tx, f.clock, policy);
    }

    @Test
    void a1_utilizationAboveWatermark_rejectsGpuLeasesUntilItDrops() throws Exception {
        f.resources.register(0, "gpu0", 10_000, 800);
        AdmissionController admission = controller(new AdmissionPolicy(true, 100, 100, Map.of(), 90.0, 0));

        var ex = assertThrows(BackpressureRejectedException.class,
                () -> admission.check("embedder", AdmissionController.Kind.GPU_LEASE));
        assertTrue(ex.reason().startsWith("utilization"));
        assertDoesNotThrow(() -> admission.check("embedder", AdmissionController.Kind.CPU_LEASE));

        f.resources.observe(0, 5_000);
        assertDoesNotThrow(() -> admission.check("embedder", AdmissionController.Kind.GPU_LEASE));
    }

    @Test
    void a2_tokenBucket_perAgent() throws Exception {
        AdmissionController admission = controller(new AdmissionPolicy(true, 1, 2,
                Map.of("vip", new AdmissionPolicy.Limit(10, 5)), 0, 0));

        assertTrue(admission.admit("bulk", AdmissionController.Kind.JOB_SUBMIT).allowed());
        assertTrue(admission.admit("bulk", AdmissionController.Kind.JOB_SUBMIT).allowed());
        assertFalse(admission.admit("bulk", AdmissionController.Kind.JOB_SUBMIT).allowed());
        for (int i = 0; i < 5; i++) {
            assertTrue(admission.admit("vip", AdmissionController.Kind.JOB_SUBMIT).allowed());
        }

        f.clock.advance(Duration.ofSeconds(1));
        assertTrue(admission.admit("bulk", AdmissionController.Kind.JOB_SUBMIT).allowed());
    }

    @Test
    void a3_queueDepthWatermark_rejectsSubmissions() throws Exception {
        AdmissionController admission = controller(new AdmissionPolicy(true, 100, 100, Map.of(), 0, 2));
        f.queue.submit("q-1", "inference", null);
        assertTrue(admission.admit(null, AdmissionController.Kind.JOB_SUBMIT).allowed());
        f.queue.submit("q-2", "inference", null);

        var d = admission.admit(null, AdmissionController.Kind.JOB_SUBMIT);
        assertFalse(d.allowed());
        assertTrue(d.reason().startsWith("queue depth"));
    }

    @Test
    void a4_disabledPolicy_admitsEverything() throws Exception {
        f.resources.register(0, "gpu0", 10_000, 0);
        AdmissionController admission = controller(AdmissionPolicy.disabled());
        assertTrue(admission.admit("any", AdmissionController.Kind.GPU_LEASE).allowed());
    }

    @Test
    void a5_idleBuckets_areEvicted_busyOnesKept() throws Exception {
        AdmissionController admission = controller(new AdmissionPolicy(true, 1, 2, Map.of(), 0, 0));
        assertTrue(admission.admit("idle", AdmissionController.Kind.JOB_SUBMIT).allowed());
        f.clock.advance(Duration.ofSeconds(2));
        assertTrue(admission.admit("busy", AdmissionController.Kind.JOB_SUBMIT).allowed());
        assertTrue(admission.admit("busy", AdmissionController.Kind.JOB_SUBMIT).allowed());
        assertEquals(2, admission.trackedAgents());

        assertEquals(1, admission.evictIdleBuckets());
        assertEquals(1, admission.trackedAgents());
        // 남은 버킷은 소진 상태 유지
        assertFalse(admission.admit("busy", AdmissionController.Kind.JOB_SUBMIT).allowed());
    }

    @Test
    void a6_manyAgents_trackedBucketsStayBounded() throws Exception {
        AdmissionController admission = controller(new AdmissionPolicy(true, 1, 2, Map.of(), 0, 0));
        for (int i = 0; i < AdmissionController.SWEEP_THRESHOLD; i++) {
            assertTrue(admission.admit("agent-" + i, AdmissionController.Kind.JOB_SUBMIT).allowed());
        }
        f.clock.advance(Duration.ofSeconds(5));
        assertTrue(admission.admit("late", AdmissionController.Kind.JOB_SUBMIT).allowed());
        assertEquals(1, admission.trackedAgents());
    }
}
