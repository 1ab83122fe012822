package com.vidnyan.dokita.adapter.out.process;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command with a deadline.
 * Both output streams are drained concurrently so a chatty process cannot block on a full pipe.
 */
@Slf4j
@Component
public class ProcessExecutor {

    private static final Duration DEFAULT_DRAIN_GRACE = Duration.ofSeconds(5);

    private final Duration drainGrace;

    public sealed interface Outcome permits Completed, FailedToStart, TimedOut {
    }

    public record Completed(int exitCode, String stdout, String stderr) implements Outcome {
    }

    public record FailedToStart(IOException cause) implements Outcome {
    }

    public record TimedOut(Duration timeout) implements Outcome {
    }

    public ProcessExecutor() {
        this(DEFAULT_DRAIN_GRACE);
    }

    /**
     * @param drainGrace how long to keep reading output after the process has exited
     */
    ProcessExecutor(Duration drainGrace) {
        this.drainGrace = drainGrace;
    }

    public Outcome execute(List<String> command, Path workingDirectory, Duration timeout) {
        log.debug("Executing {} in {}", command, workingDirectory);
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDirectory.toFile());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.debug("Could not start {}: {}", command.get(0), e.getMessage());
            return new FailedToStart(e);
        }
        closeQuietly(process);

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("{} did not finish within {}; destroying it", command.get(0), timeout);
                process.destroyForcibly();
                return new TimedOut(timeout);
            }
            Completed completed = new Completed(process.exitValue(),
                    collect(stdout, command, "stdout"),
                    collect(stderr, command, "stderr"));
            log.debug("{} exited with {}", command.get(0), completed.exitCode());
            return completed;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return new TimedOut(timeout);
        }
    }

    /**
     * Output of an exited process; empty when the stream cannot be read to the end in time
     * (e.g. a grandchild still holds the pipe open).
     */
    private String collect(CompletableFuture<String> output, List<String> command, String streamName)
            throws InterruptedException {
        try {
            return output.get(drainGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Could not collect {} of {}: {}", streamName, command.get(0), e.toString());
            return "";
        }
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    /**
     * The child never reads stdin.
     */
    private static void closeQuietly(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of child process: {}", e.getMessage());
        }
    }
}
