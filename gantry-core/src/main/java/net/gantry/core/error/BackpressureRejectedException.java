package net.gantry.core.error;

/** 승인 제어 거절. 용량 부족(LeaseDenied)과 구분: "천천히" 의미 */
public class BackpressureRejectedException extends OrchestratorException {
    private final String reason;

    public BackpressureRejectedException(String reason) {
        super("backpressure", "rejected by admission control: " + reason);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
