package com.example.servicereconciler.driver;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Output is drained on a separate thread
 * so a command that leaves a daemon holding the pipe cannot block the caller past the timeout.
 */
@Slf4j
@Component
public class ShellCommandRunner implements CommandRunner {

    private static final long OUTPUT_GRACE_MILLIS = 500;

    @Override
    public CommandResult run(List<String> argv, Duration timeout) {
        if (argv == null || argv.isEmpty()) {
            throw new IllegalArgumentException("Empty command");
        }
        log.debug("Executing: {}", String.join(" ", argv));

        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(argv);
            pb.redirectErrorStream(true);
            process = pb.start();
        } catch (IOException e) {
            return new CommandResult(CommandResult.LAUNCH_FAILURE_EXIT, "failed to launch: " + e.getMessage(), false);
        }

        Process started = process;
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(started));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                output.cancel(true);
                log.debug("Command timed out after {}: {}", timeout, argv);
                return new CommandResult(CommandResult.TIMEOUT_EXIT, "", true);
            }
            return new CommandResult(process.exitValue(), collect(output), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new CommandResult(CommandResult.TIMEOUT_EXIT, "interrupted", true);
        }
    }

    private static String collect(CompletableFuture<String> output) throws InterruptedException {
        try {
            return output.get(OUTPUT_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // A background child still holds the pipe; the exit code is what matters.
            output.cancel(true);
            return "";
        } catch (ExecutionException e) {
            return "";
        }
    }

    private static String drain(Process process) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
