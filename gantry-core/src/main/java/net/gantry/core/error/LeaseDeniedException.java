package net.gantry.core.error;

/** 맞는 용량 없음(또는 정책 거부). 호출자는 CPU fallback 이나 백오프로 재시도 */
public class LeaseDeniedException extends OrchestratorException {
    private final String reason;

    public LeaseDeniedException(String reason) {
        super("lease_denied", "lease denied: " + reason);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
