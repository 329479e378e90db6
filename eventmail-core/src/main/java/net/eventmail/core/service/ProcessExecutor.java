package net.eventmail.core.service;

import net.eventmail.core.model.ExecutionResult;
import net.eventmail.core.model.ProcessSpec;
import net.eventmail.core.spi.ProcessLauncher;
import net.eventmail.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an external program with bounded retries.
 * <p>
 * Up to {@code maxRetries + 1} attempts; an attempt succeeds on exit code 0. Both output pipes are
 * drained while the process runs and only the last attempt's output is reported. Every process is
 * reaped before the next attempt starts. Interrupting the calling thread cancels the run: the live
 * process and everything it spawned are destroyed, the interrupt flag is restored and a failed
 * result comes back.
 * <p>
 * The no-pump constructors own a daemon pool for draining output; {@link #close()} shuts it down.
 */
public final class ProcessExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProcessExecutor.class);

    /** 프로세스 종료 후 파이프가 안 닫히는 경우(손자 프로세스) 대비 */
    private static final long DRAIN_TIMEOUT_MS = 5_000;

    private final ProcessLauncher launcher;
    private final Sleeper sleeper;
    private final Executor pump;
    private final Charset charset;
    private final ExecutorService ownedPump;

    public ProcessExecutor() {
        this(ProcessLauncher.system(), Sleeper.system());
    }

    public ProcessExecutor(ProcessLauncher launcher, Sleeper sleeper) {
        this(launcher, sleeper, Executors.newCachedThreadPool(daemonFactory()), Charset.defaultCharset(), true);
    }

    public ProcessExecutor(ProcessLauncher launcher, Sleeper sleeper, Executor pump, Charset charset) {
        this(launcher, sleeper, pump, charset, false);
    }

    private ProcessExecutor(ProcessLauncher launcher, Sleeper sleeper, Executor pump, Charset charset, boolean owned) {
        this.launcher = launcher;
        this.sleeper = sleeper;
        this.pump = pump;
        this.charset = charset;
        this.ownedPump = owned ? (ExecutorService) pump : null;
    }

    /** 직접 만든 출력 펌프만 정리. 외부에서 받은 Executor 는 건드리지 않는다 */
    @Override
    public void close() {
        if (ownedPump != null) ownedPump.shutdownNow();
    }

    boolean isClosed() {
        return ownedPump != null && ownedPump.isShutdown();
    }

    public ExecutionResult run(ProcessSpec spec) {
        List<String> command = CommandLine.build(spec.filePath(), spec.arguments());
        File dir = (spec.workingDirectory() == null || spec.workingDirectory().isBlank())
                ? null : new File(spec.workingDirectory());
        RetryPolicy retry = RetryPolicy.of(spec);

        Attempt last = null;
        int attempt = 0;
        while (attempt < retry.maxAttempts()) {
            attempt++;
            last = runOnce(command, dir);
            if (last.ok()) {
                return new ExecutionResult(true, attempt, last.exitCode(), last.stdout(), last.stderr());
            }
            if (last.cancelled()) break;
            if (retry.canRetry(attempt)) {
                Duration backoff = retry.backoff(attempt);
                log.debug("Attempt {}/{} of {} failed, retrying in {}", attempt, retry.maxAttempts(), spec.filePath(), backoff);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        return new ExecutionResult(false, attempt, last.exitCode(), last.stdout(), last.stderr());
    }

    private Attempt runOnce(List<String> command, File dir) {
        if (Thread.currentThread().isInterrupted()) {
            return Attempt.cancelled(null, "", "cancelled before start");
        }
        Process p;
        try {
            p = launcher.start(command, dir);
        } catch (IOException | RuntimeException e) {
            return Attempt.failed(null, "", e.toString());
        }

        try {
            CompletableFuture<String> out = CompletableFuture.supplyAsync(() -> drain(p.getInputStream()), pump);
            CompletableFuture<String> err = CompletableFuture.supplyAsync(() -> drain(p.getErrorStream()), pump);
            int code;
            try {
                code = p.waitFor();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                reap(p);
                return Attempt.cancelled(null, collect(out), "cancelled: " + command.get(0));
            }
            return code == 0
                    ? Attempt.ok(code, collect(out), collect(err))
                    : Attempt.failed(code, collect(out), collect(err));
        } catch (RuntimeException e) {
            reap(p);
            return Attempt.failed(null, "", e.toString());
        }
    }

    private String drain(InputStream in) {
        try (in) {
            var buf = new ByteArrayOutputStream();
            in.transferTo(buf);
            return buf.toString(charset);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String collect(CompletableFuture<String> f) {
        try {
            return f.get(DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Output stream not fully read: {}", e.toString());
            return "";
        }
    }

    /** 자손부터 강제 종료 후 종료 대기 (좀비, 파이프 점유 방지). 인터럽트 플래그는 보존 */
    private static void reap(Process p) {
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
        boolean interrupted = Thread.interrupted();
        try {
            p.waitFor(DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonFactory() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "eventmail-proc-io-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record Attempt(boolean ok, boolean cancelled, Integer exitCode, String stdout, String stderr) {
        static Attempt ok(int code, String out, String err) { return new Attempt(true, false, code, out, err); }
        static Attempt failed(Integer code, String out, String err) { return new Attempt(false, false, code, out, err); }
        static Attempt cancelled(Integer code, String out, String err) { return new Attempt(false, true, code, out, err); }
    }
}
