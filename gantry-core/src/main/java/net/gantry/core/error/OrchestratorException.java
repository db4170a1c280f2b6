package net.gantry.core.error;

/** 오케스트레이터 오류 공통 상위. code 는 API 응답에 그대로 노출 */
public class OrchestratorException extends RuntimeException {
    private final String code;

    public OrchestratorException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
