package net.gantry.core.error;

public class LeaseNotFoundException extends OrchestratorException {
    public LeaseNotFoundException(String token) {
        super("lease_not_found", "lease not found: " + token);
    }
}
