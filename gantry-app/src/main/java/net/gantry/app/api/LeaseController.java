package net.gantry.app.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import net.gantry.core.model.Lease;
import net.gantry.core.service.LeaseGrant;
import net.gantry.core.service.LeaseRequest;
import net.gantry.core.service.LeaseService;
import net.gantry.core.service.Orchestrator;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping(path = "/leases", produces = MediaType.APPLICATION_JSON_VALUE)
public class LeaseController {

    private final Orchestrator orchestrator;

    public LeaseController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /** ttl 은 초. mode 는 gpu|cpu */
    public record LeaseBody(
            @NotBlank String agent,
            @Min(0) long minCapacity,
            @Min(1) Long ttl,
            String mode,
            boolean allowCpuFallback,
            String poolId,
            Map<String, String> metadata
    ) {}

    /** timestamp 는 받기만 한다. 만료 판정은 서버 시계 */
    public record HeartbeatBody(Instant timestamp) {}

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public LeaseGrant request(@Valid @RequestBody LeaseBody body) throws Exception {
        Lease.Mode mode = null;
        if (body.mode() != null) {
            mode = Lease.Mode.from(body.mode());
            if (mode == Lease.Mode.UNKNOWN) throw new IllegalArgumentException("mode must be gpu or cpu: " + body.mode());
        }
        var req = new LeaseRequest(body.agent(), body.minCapacity(), body.ttl(), mode, body.allowCpuFallback(),
                body.poolId(), body.metadata() == null ? Map.of() : body.metadata());
        return orchestrator.requestLease(req);
    }

    @PostMapping("/{token}/heartbeat")
    public Map<String, Object> heartbeat(@PathVariable String token,
                                         @RequestBody(required = false) HeartbeatBody body) throws Exception {
        LeaseService.HeartbeatResult r = orchestrator.heartbeatLease(token);
        return Map.of("status", r == LeaseService.HeartbeatResult.OK ? "ok" : "expired");
    }

    @PostMapping("/{token}/release")
    public Map<String, Object> release(@PathVariable String token) throws Exception {
        orchestrator.releaseLease(token);
        return Map.of("released", true);
    }

    @GetMapping
    public List<Lease> list() throws Exception {
        return orchestrator.leases();
    }
}
