package net.gantry.app.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import net.gantry.core.maintenance.ReclaimService;
import net.gantry.core.service.Orchestrator;
import net.gantry.core.service.WorkerPoolService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/** 리더에서만 받는 운영 작업. 팔로워는 409 와 리더 주소를 돌려준다 */
@RestController
@RequestMapping(path = "/control", produces = MediaType.APPLICATION_JSON_VALUE)
public class ControlController {

    private final Orchestrator orchestrator;

    public ControlController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public record EvictBody(@NotBlank String poolId) {}

    @PostMapping(path = "/evict_pool", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> evictPool(@Valid @RequestBody EvictBody body) throws Exception {
        return Map.of("pool_id", body.poolId(), "status", orchestrator.evictPool(body.poolId()).code());
    }

    @PostMapping("/reconcile")
    public WorkerPoolService.ReconcileReport reconcile() throws Exception {
        return orchestrator.reconcile();
    }

    @PostMapping("/reclaim")
    public ReclaimService.ReclaimReport reclaim() throws Exception {
        return orchestrator.reclaim();
    }
}
