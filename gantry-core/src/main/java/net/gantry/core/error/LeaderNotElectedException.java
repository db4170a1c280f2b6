package net.gantry.core.error;

/** 리더 전용 작업을 팔로워가 받음. leaderHint 는 현재 리더 주소(알 때만) */
public class LeaderNotElectedException extends OrchestratorException {
    private final String leaderHint;

    public LeaderNotElectedException(String leaderHint) {
        super("not_leader", leaderHint == null ? "not leader" : "not leader, current leader: " + leaderHint);
        this.leaderHint = leaderHint;
    }

    public String leaderHint() {
        return leaderHint;
    }
}
