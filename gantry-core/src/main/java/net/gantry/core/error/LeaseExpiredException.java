package net.gantry.core.error;

public class LeaseExpiredException extends OrchestratorException {
    public LeaseExpiredException(String token) {
        super("lease_expired", "lease expired: " + token);
    }
}
