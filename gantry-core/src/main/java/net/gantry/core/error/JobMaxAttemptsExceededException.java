package net.gantry.core.error;

/** 이미 dead_letter 로 끝난 잡 */
public class JobMaxAttemptsExceededException extends OrchestratorException {
    public JobMaxAttemptsExceededException(String jobId, int attempts) {
        super("job_max_attempts_exceeded", "job " + jobId + " dead-lettered after " + attempts + " attempts");
    }
}
