package com.example.servicereconciler.driver;

import com.example.servicereconciler.TestSpecs;
import com.example.servicereconciler.domain.ActionKind;
import com.example.servicereconciler.domain.ActionOutcome;
import com.example.servicereconciler.domain.CheckOutcome;
import com.example.servicereconciler.domain.ServiceSpec;
import org.junit.jupiter.api.Test;

import static com.example.servicereconciler.driver.ScriptedCommandRunner.ok;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ContainerDriverTest {

    private static final String INSPECT = "docker inspect --format {{.State.Status}} knowledge-db";

    private final ScriptedCommandRunner runner = new ScriptedCommandRunner();
    private final ContainerDriver driver = new ContainerDriver(runner, mock(EndpointChecker.class));
    private final ServiceSpec spec = ProcessDriverTest.waiting(TestSpecs.container("knowledge-db"));

    @Test
    void runningContainerIsLive() {
        runner.on(INSPECT, ok("running\n"));
        assertTrue(driver.liveness(spec).passed());
    }

    @Test
    void exitedContainerIsNotLive() {
        runner.on(INSPECT, ok("exited"));

        CheckOutcome outcome = driver.liveness(spec);

        assertFalse(outcome.passed());
        assertTrue(outcome.detail().contains("exited"));
    }

    @Test
    void unknownContainerIsNotLive() {
        runner.on(INSPECT, new CommandResult(1, "Error: No such object: knowledge-db", false));
        assertFalse(driver.liveness(spec).passed());
    }

    @Test
    void startIsNoopWhenRunning() {
        runner.on(INSPECT, ok("running"));

        ActionOutcome outcome = driver.apply(spec, ActionKind.START);

        assertTrue(outcome.noop());
        assertEquals(0, runner.count("docker start knowledge-db"));
    }

    @Test
    void startUsesDockerStartByDefault() {
        runner.on(INSPECT, ok("exited"), ok("exited"), ok("running"));

        ActionOutcome outcome = driver.apply(spec, ActionKind.START);

        assertTrue(outcome.succeeded(), outcome.reason());
        assertEquals(1, runner.count("docker start knowledge-db"));
    }

    @Test
    void restartUsesDockerRestart() {
        runner.on(INSPECT, ok("running"));

        ActionOutcome outcome = driver.apply(spec, ActionKind.RESTART);

        assertTrue(outcome.succeeded(), outcome.reason());
        assertEquals(1, runner.count("docker restart knowledge-db"));
        assertEquals(0, runner.count("docker stop knowledge-db"));
    }

    @Test
    void failedRestartCommandIsReported() {
        runner.on("docker restart knowledge-db", new CommandResult(1, "daemon not running", false));

        ActionOutcome outcome = driver.apply(spec, ActionKind.RESTART);

        assertFalse(outcome.succeeded());
        assertTrue(outcome.reason().contains("daemon not running"));
    }
}
