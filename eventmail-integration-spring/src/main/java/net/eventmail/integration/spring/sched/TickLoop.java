package net.eventmail.integration.spring.sched;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One tick function on its own single-threaded {@link ThreadPoolTaskScheduler}, run with a fixed
 * delay so ticks never overlap and an overrunning tick simply pushes the next one back.
 * <p>
 * Exceptions thrown by a tick are logged and the loop carries on. {@link #stop} cancels the
 * schedule with interruption, runs the cancel hook for blocking calls an interrupt cannot reach
 * (a running JDBC statement), then shuts the scheduler down and waits up to the given timeout.
 * Worker threads are daemons, so a tick stuck past that timeout does not keep the JVM alive.
 */
public final class TickLoop {
    private static final Logger log = LoggerFactory.getLogger(TickLoop.class);

    private final String name;
    private final Duration interval;
    private final Tick tick;
    private final Runnable onCancel;
    private final AtomicLong ticks = new AtomicLong();

    private ThreadPoolTaskScheduler scheduler;
    private ScheduledFuture<?> future;

    public TickLoop(String name, Duration interval, Tick tick) {
        this(name, interval, tick, () -> {});
    }

    public TickLoop(String name, Duration interval, Tick tick, Runnable onCancel) {
        this.name = Objects.requireNonNull(name, "name");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.tick = Objects.requireNonNull(tick, "tick");
        this.onCancel = Objects.requireNonNull(onCancel, "onCancel");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
    }

    public synchronized void start() {
        if (scheduler != null) return;
        var s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix(name + "-");
        s.setDaemon(true);
        s.setRemoveOnCancelPolicy(true);
        s.setWaitForTasksToCompleteOnShutdown(false); // shutdownNow → 인터럽트
        s.initialize();
        future = s.scheduleWithFixedDelay(this::runTick, interval);
        scheduler = s;
        log.info("{} started (interval {})", name, interval);
    }

    /** 현재 틱을 포기시키고 timeout 까지 종료 대기 */
    public void stop(Duration timeout) {
        ThreadPoolTaskScheduler s;
        ScheduledFuture<?> f;
        synchronized (this) {
            if (scheduler == null) return;
            s = scheduler;
            f = future;
            scheduler = null;
            future = null;
        }
        f.cancel(true);
        try {
            onCancel.run();
        } catch (RuntimeException e) {
            log.warn("{} cancel hook failed", name, e);
        }
        s.setAwaitTerminationMillis(timeout.toMillis());
        s.shutdown();
        if (s.getScheduledThreadPoolExecutor().isTerminated()) {
            log.info("{} stopped after {} tick(s)", name, ticks.get());
        } else {
            log.warn("{} did not stop within {}; its daemon worker is left behind", name, timeout);
        }
    }

    public synchronized boolean isRunning() { return scheduler != null; }

    public long completedTicks() { return ticks.get(); }

    public String name() { return name; }

    public Duration interval() { return interval; }

    private void runTick() {
        try {
            tick.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} failure", name, e);
        } finally {
            ticks.incrementAndGet();
        }
    }
}
