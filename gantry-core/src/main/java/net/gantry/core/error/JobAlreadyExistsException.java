package net.gantry.core.error;

/** 같은 job_id 재제출. 바깥으로는 accepted=false 로만 보인다 */
public class JobAlreadyExistsException extends OrchestratorException {
    public JobAlreadyExistsException(String jobId) {
        super("job_already_exists", "job already exists: " + jobId);
    }
}
