package net.gantry.core.error;

public class JobNotFoundException extends OrchestratorException {
    public JobNotFoundException(String jobId) {
        super("job_not_found", "job not found: " + jobId);
    }
}
