package net.eventmail.integration.spring.sched;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.List;

/**
 * Ties the tick loops to the Spring context: started after all beans are ready, cancelled and
 * shut down on context close.
 */
public class EventMailSchedulers implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(EventMailSchedulers.class);

    private final List<TickLoop> loops;
    private final Duration stopTimeout;
    private volatile boolean running;

    public EventMailSchedulers(List<TickLoop> loops, Duration stopTimeout) {
        this.loops = List.copyOf(loops);
        this.stopTimeout = stopTimeout;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        if (loops.isEmpty()) log.warn("No scheduler loop enabled");
        loops.forEach(TickLoop::start);
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        for (TickLoop loop : loops) {
            loop.stop(stopTimeout);
        }
        running = false;
    }

    @Override
    public boolean isRunning() { return running; }

    /** 스케줄러가 DataSource 등보다 늦게 시작하고 먼저 멈추도록 */
    @Override
    public int getPhase() { return Integer.MAX_VALUE - 1000; }

    public List<TickLoop> loops() { return loops; }
}
