package net.gantry.core.service;

import java.util.Map;

/**
 * 승인 제어 설정.
 * utilizationWatermark 는 % (0 이하면 끔), queueDepthWatermark 는 미정산 엔트리 수 (0 이하면 끔).
 */
public record AdmissionPolicy(
        boolean enabled,
        double ratePerSecond,
        int burst,
        Map<String, Limit> agentLimits,
        double utilizationWatermark,
        long queueDepthWatermark
) {
    public record Limit(double ratePerSecond, int burst) {}

    public static AdmissionPolicy disabled() {
        return new AdmissionPolicy(false, 0, 1, Map.of(), 0, 0);
    }

    public Limit limitFor(String agent) {
        Limit l = agentLimits == null ? null : agentLimits.get(agent);
        return l != null ? l : new Limit(ratePerSecond, burst);
    }
}
