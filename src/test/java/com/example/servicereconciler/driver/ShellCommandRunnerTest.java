package com.example.servicereconciler.driver;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ShellCommandRunnerTest {

    private final ShellCommandRunner runner = new ShellCommandRunner();

    @Test
    void capturesExitCodeAndOutput() {
        CommandResult result = runner.run(List.of("sh", "-c", "echo running; exit 3"), Duration.ofSeconds(5));

        assertFalse(result.timedOut());
        assertEquals(3, result.exitCode());
        assertEquals("running", result.output().trim());
        assertFalse(result.succeeded());
    }

    @Test
    void killsCommandThatOutlivesTimeout() {
        long start = System.currentTimeMillis();
        CommandResult result = runner.run(List.of("sleep", "10"), Duration.ofMillis(200));

        assertTrue(result.timedOut());
        assertTrue(System.currentTimeMillis() - start < 5000);
    }

    @Test
    void missingExecutableIsAFailedResult() {
        CommandResult result = runner.run(List.of("definitely-not-a-command-xyz"), Duration.ofSeconds(1));

        assertEquals(CommandResult.LAUNCH_FAILURE_EXIT, result.exitCode());
        assertFalse(result.succeeded());
    }

    @Test
    void emptyCommandIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> runner.run(List.of(), Duration.ofSeconds(1)));
    }
}
