package net.gantry.core.service;

/** 스트림/그룹 이름 규칙 */
public final class Streams {
    public static final String DLQ_SUFFIX = ":dlq";
    public static final String DEFAULT_GROUP = "default";

    private Streams() {}

    public static String jobs(String type) {
        return "jobs:" + type;
    }

    public static String deadLetter(String type) {
        return jobs(type) + DLQ_SUFFIX;
    }

    public static String group(String type, String poolId) {
        return "cg:" + type + ":" + (poolId == null ? DEFAULT_GROUP : poolId);
    }

    public static boolean isDeadLetter(String stream) {
        return stream.endsWith(DLQ_SUFFIX);
    }
}
