package net.gantry.core.spi;

import net.gantry.core.model.Job;

/** 잡 한 건의 실제 작업. 예외를 던지면 실패로 처리된다 */
public interface JobHandler {
    String type();

    void handle(Job job) throws Exception;
}
