package net.gantry.core.error;

public class PoolNotFoundException extends OrchestratorException {
    public PoolNotFoundException(String poolId) {
        super("pool_not_found", "worker pool not found: " + poolId);
    }
}
