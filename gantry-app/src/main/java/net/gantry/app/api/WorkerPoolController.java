package net.gantry.app.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import net.gantry.core.model.WorkerPool;
import net.gantry.core.service.Orchestrator;
import net.gantry.core.service.PoolRequest;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping(path = "/workers/pool", produces = MediaType.APPLICATION_JSON_VALUE)
public class WorkerPoolController {

    private final Orchestrator orchestrator;

    public WorkerPoolController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public record PoolBody(
            @NotBlank String agent,
            @NotBlank String model,
            String adapter,
            @Min(0) int desiredWorkers,
            @Min(1) Long holdSeconds,
            String poolId,
            Map<String, String> metadata
    ) {}

    public record PoolHeartbeatBody(Instant timestamp, @Min(0) Integer spawnedWorkers) {}

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> create(@Valid @RequestBody PoolBody body) throws Exception {
        var req = new PoolRequest(body.agent(), body.model(), body.adapter(), body.desiredWorkers(),
                body.holdSeconds(), body.poolId(), body.metadata() == null ? Map.of() : body.metadata());
        WorkerPool p = orchestrator.createPool(req);
        return Map.of("pool_id", p.poolId(), "status", p.status().code());
    }

    @GetMapping
    public List<WorkerPool> list() throws Exception {
        return orchestrator.pools();
    }

    @GetMapping("/{poolId}")
    public WorkerPool get(@PathVariable String poolId) throws Exception {
        return orchestrator.pool(poolId);
    }

    @PostMapping("/{poolId}/heartbeat")
    public Map<String, Object> heartbeat(@PathVariable String poolId,
                                         @Valid @RequestBody(required = false) PoolHeartbeatBody body) throws Exception {
        Integer spawned = body == null ? null : body.spawnedWorkers();
        return Map.of("status", orchestrator.poolHeartbeat(poolId, spawned).code());
    }

    @PostMapping("/{poolId}/drain")
    public Map<String, Object> drain(@PathVariable String poolId) throws Exception {
        return Map.of("pool_id", poolId, "status", orchestrator.drainPool(poolId).code());
    }
}
