package net.gantry.core.service;

import net.gantry.core.model.Lease;

import java.time.Instant;

public record LeaseGrant(
        boolean granted,
        String token,
        Integer resourceIndex,
        Lease.Mode mode,
        Instant expiresAt
) {
    static LeaseGrant of(Lease l) {
        return new LeaseGrant(true, l.token(), l.resourceIndex(), l.mode(), l.expiresAt());
    }
}
