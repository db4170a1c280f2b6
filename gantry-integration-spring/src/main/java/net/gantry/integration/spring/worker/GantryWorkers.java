package net.gantry.integration.spring.worker;

import net.gantry.core.dispatch.JobWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.ArrayList;
import java.util.List;

/** 설정된 워커 루프를 스레드 하나씩 띄우고 컨텍스트 종료 시 멈춘다 */
public class GantryWorkers implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(GantryWorkers.class);

    private final List<JobWorker> workers;
    private final List<Thread> threads = new ArrayList<>();
    private volatile boolean running;

    public GantryWorkers(List<JobWorker> workers) {
        this.workers = List.copyOf(workers);
    }

    @Override
    public synchronized void start() {
        if (running) return;
        int i = 0;
        for (JobWorker w : workers) {
            Thread t = new Thread(w, "gantry-worker-" + (i++));
            t.setDaemon(true);
            t.start();
            threads.add(t);
        }
        running = true;
        log.info("started {} worker loop(s)", workers.size());
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        workers.forEach(JobWorker::stop);
        for (Thread t : threads) {
            t.interrupt();
            try {
                t.join(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        threads.clear();
        running = false;
        log.info("worker loops stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public List<JobWorker> workers() {
        return workers;
    }
}
