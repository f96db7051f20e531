package com.example.servicereconciler.driver;

import com.example.servicereconciler.TestSpecs;
import com.example.servicereconciler.domain.ActionKind;
import com.example.servicereconciler.domain.ActionOutcome;
import com.example.servicereconciler.domain.ActionSpec;
import com.example.servicereconciler.domain.CheckOutcome;
import com.example.servicereconciler.domain.HealthStatus;
import com.example.servicereconciler.domain.RemoteEndpoint;
import com.example.servicereconciler.domain.ServiceKind;
import com.example.servicereconciler.domain.ServiceSpec;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.example.servicereconciler.driver.ScriptedCommandRunner.exit;
import static com.example.servicereconciler.driver.ScriptedCommandRunner.ok;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TunnelDriverTest {

    private static final String PGREP = "pgrep -f tunnel-server";

    private final ScriptedCommandRunner runner = new ScriptedCommandRunner();
    private final EndpointChecker endpointChecker = mock(EndpointChecker.class);
    private final RemoteEndpointChecker remote = mock(RemoteEndpointChecker.class);
    private final TunnelDriver driver = new TunnelDriver(runner, endpointChecker,
            new ProcessDriver(runner, endpointChecker), remote);

    private final ServiceSpec spec = tunnel();

    private static ServiceSpec tunnel() {
        ServiceSpec base = ProcessDriverTest.waiting(TestSpecs.process("tunnel"));
        return new ServiceSpec("tunnel", ServiceKind.NETWORK_TUNNEL, null, base.dependsOn(), true,
                base.healthCheck(), base.actions(), base.restartBudget(), 3,
                new RemoteEndpoint("relay.example.net", 0, "relay", null, 18010, null), null);
    }

    @Test
    void shallowCheckRunsOnTheFarSide() {
        when(remote.check(any(), any())).thenReturn(CheckOutcome.fail("exit 1"));

        assertFalse(driver.shallow(spec).passed());
        verify(remote).check(eq(spec.remoteEndpoint()), eq(spec.healthCheck().timeout()));
        assertEquals("nc -z 127.0.0.1 18010", spec.remoteEndpoint().effectiveCheckCommand());
        assertEquals(22, spec.remoteEndpoint().effectiveSshPort());
    }

    @Test
    void repairIsAlwaysRestart() {
        assertEquals(ActionKind.RESTART, driver.repairActionFor(HealthStatus.DOWN));
        assertEquals(ActionKind.RESTART, driver.repairActionFor(HealthStatus.DEGRADED));
    }

    @Test
    void liveTunnelInvisibleRemotelyIsTornDownAndReestablished() {
        runner.on(PGREP, ok("1"), ok("1"), exit(1), ok("2"));
        when(remote.check(any(), any())).thenReturn(CheckOutcome.fail("port closed"), CheckOutcome.pass("exit 0"));

        ActionOutcome outcome = driver.apply(spec, ActionKind.RESTART);

        assertTrue(outcome.succeeded(), outcome.reason());
        assertEquals(1, runner.count("pkill -f tunnel-server"));
        assertEquals(1, runner.count("start-tunnel"));
    }

    @Test
    void restartFailsWhileRemoteEndpointStaysClosed() {
        runner.on(PGREP, exit(1));
        when(remote.check(any(), any())).thenReturn(CheckOutcome.fail("port closed"));

        ActionOutcome outcome = driver.apply(withoutWait(spec), ActionKind.RESTART);

        assertFalse(outcome.succeeded());
        assertTrue(outcome.reason().contains("port closed"));
    }

    @Test
    void startIsNoopWhenEstablishedAndVisible() {
        runner.on(PGREP, ok("1"));
        when(remote.check(any(), any())).thenReturn(CheckOutcome.pass("exit 0"));

        ActionOutcome outcome = driver.apply(spec, ActionKind.START);

        assertTrue(outcome.noop());
        assertEquals(0, runner.count("start-tunnel"));
    }

    private static ServiceSpec withoutWait(ServiceSpec spec) {
        ActionSpec a = spec.actions();
        return new ServiceSpec(spec.id(), spec.kind(), null, spec.dependsOn(), spec.requiresNetwork(),
                spec.healthCheck(),
                new ActionSpec(a.start(), a.stop(), a.restart(),
                        Duration.ZERO, a.pollInterval()),
                spec.restartBudget(), spec.escalateAfter(), spec.remoteEndpoint(), null);
    }
}
