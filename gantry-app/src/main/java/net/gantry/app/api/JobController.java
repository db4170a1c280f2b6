package net.gantry.app.api;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import net.gantry.core.model.Job;
import net.gantry.core.service.Orchestrator;
import net.gantry.core.service.SubmitResult;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping(path = "/jobs", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class JobController {

    private final Orchestrator orchestrator;

    public JobController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /** payload 는 임의 JSON. 문자열이면 그대로, 아니면 직렬화해서 저장 */
    public record SubmitBody(@NotBlank String jobId, @NotBlank String type, JsonNode payload, String agent) {
        String payloadText() {
            if (payload == null || payload.isNull()) return null;
            return payload.isTextual() ? payload.asText() : payload.toString();
        }
    }

    @PostMapping(path = "/submit", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SubmitResult submit(@Valid @RequestBody SubmitBody body) throws Exception {
        return orchestrator.submitJob(body.jobId(), body.type(), body.payloadText(), body.agent());
    }

    @GetMapping("/dead-letters")
    public List<Job> deadLetters(@RequestParam(required = false) String type,
                                 @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) throws Exception {
        return orchestrator.deadLetters(type, limit);
    }

    @GetMapping("/{jobId}")
    public Job get(@PathVariable String jobId) throws Exception {
        return orchestrator.job(jobId);
    }
}
