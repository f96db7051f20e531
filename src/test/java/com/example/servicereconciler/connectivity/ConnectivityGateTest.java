package com.example.servicereconciler.connectivity;

import com.example.servicereconciler.domain.ActionOutcome;
import com.example.servicereconciler.domain.CheckOutcome;
import com.example.servicereconciler.domain.ConnectivitySpec;
import com.example.servicereconciler.driver.CommandResult;
import com.example.servicereconciler.driver.EndpointChecker;
import com.example.servicereconciler.driver.ScriptedCommandRunner;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.example.servicereconciler.driver.ScriptedCommandRunner.exit;
import static com.example.servicereconciler.driver.ScriptedCommandRunner.ok;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ConnectivityGateTest {

    private static final String LINK = "ipconfig getifaddr en0";
    private static final String DISABLE = "networksetup -setairportpower en0 off";
    private static final String ENABLE = "networksetup -setairportpower en0 on";
    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private final ScriptedCommandRunner runner = new ScriptedCommandRunner();
    private final EndpointChecker endpointChecker = mock(EndpointChecker.class);
    private final ConnectivityGate gate = new ConnectivityGate(runner, endpointChecker);

    private static ConnectivitySpec wifi(Duration maxWait) {
        return new ConnectivitySpec(List.of("ipconfig", "getifaddr", "en0"), "^\\d+\\.\\d+\\.\\d+\\.\\d+$",
                List.of("networksetup", "-setairportpower", "en0", "off"),
                List.of("networksetup", "-setairportpower", "en0", "on"),
                null, null, Duration.ZERO, maxWait, Duration.ofMillis(10));
    }

    private void reachable(boolean first, boolean... rest) {
        CheckOutcome head = first ? CheckOutcome.pass("TCP ok") : CheckOutcome.fail("TCP refused");
        CheckOutcome[] tail = new CheckOutcome[rest.length];
        for (int i = 0; i < rest.length; i++) {
            tail[i] = rest[i] ? CheckOutcome.pass("TCP ok") : CheckOutcome.fail("TCP refused");
        }
        when(endpointChecker.tcp(anyString(), anyInt(), any())).thenReturn(head, tail);
    }

    @Test
    void linkIsAssociatedWhenOutputMatchesPattern() {
        runner.on(LINK, ok("192.168.1.20\n"));
        assertTrue(gate.checkLink(wifi(TIMEOUT), TIMEOUT).passed());
    }

    @Test
    void linkIsDownWhenOutputDoesNotMatch() {
        runner.on(LINK, ok(""));
        assertFalse(gate.checkLink(wifi(TIMEOUT), TIMEOUT).passed());

        runner.on(LINK, exit(1));
        assertFalse(gate.checkLink(wifi(TIMEOUT), TIMEOUT).passed());
    }

    @Test
    void reachabilityTriesDefaultTargetsInOrder() {
        when(endpointChecker.tcp("8.8.8.8", 53, TIMEOUT)).thenReturn(CheckOutcome.fail("TCP 8.8.8.8:53 failed"));
        when(endpointChecker.tcp("1.1.1.1", 53, TIMEOUT)).thenReturn(CheckOutcome.pass("TCP 1.1.1.1:53 connected"));

        CheckOutcome outcome = gate.checkReachability(wifi(TIMEOUT), TIMEOUT);

        assertTrue(outcome.passed());
        assertTrue(outcome.detail().contains("1.1.1.1"));
    }

    @Test
    void reachabilityFallsBackToUrl() {
        reachable(false);
        when(endpointChecker.http("http://www.google.com", TIMEOUT)).thenReturn(CheckOutcome.pass("HTTP 200"));
        ConnectivitySpec spec = new ConnectivitySpec(List.of("true"), null, null, null,
                List.of("8.8.8.8:53"), "http://www.google.com", Duration.ZERO, TIMEOUT, Duration.ofMillis(10));

        assertTrue(gate.checkReachability(spec, TIMEOUT).passed());
    }

    @Test
    void linkDownBouncesInterfaceExactlyOnce() {
        runner.on(LINK, ok(""), ok(""), ok("192.168.1.20"));
        reachable(true);

        ActionOutcome outcome = gate.repair(wifi(Duration.ofSeconds(2)), TIMEOUT);

        assertTrue(outcome.succeeded(), outcome.reason());
        assertEquals(1, runner.count(DISABLE));
        assertEquals(1, runner.count(ENABLE));
        assertTrue(runner.executed().indexOf(DISABLE) < runner.executed().indexOf(ENABLE));
    }

    @Test
    void linkUpOnlyRetriesReachability() {
        runner.on(LINK, ok("192.168.1.20"));
        reachable(false, false, true);

        ActionOutcome outcome = gate.repair(wifi(Duration.ofSeconds(2)), TIMEOUT);

        assertTrue(outcome.succeeded(), outcome.reason());
        assertEquals(0, runner.count(DISABLE));
        assertEquals(0, runner.count(ENABLE));
    }

    @Test
    void failedRepairStillBouncesOnlyOnce() {
        runner.on(LINK, ok(""));
        reachable(false);

        ActionOutcome outcome = gate.repair(wifi(Duration.ofMillis(50)), TIMEOUT);

        assertFalse(outcome.succeeded());
        assertEquals(1, runner.count(DISABLE));
        assertEquals(1, runner.count(ENABLE));
    }

    @Test
    void linkUpButUnreachableReportsWithoutBouncing() {
        runner.on(LINK, ok("10.0.0.5"));
        reachable(false);

        ActionOutcome outcome = gate.repair(wifi(Duration.ZERO), TIMEOUT);

        assertFalse(outcome.succeeded());
        assertTrue(outcome.reason().startsWith("link up but"));
        assertEquals(0, runner.count(DISABLE));
    }

    @Test
    void failingDisableCommandAbortsRepair() {
        runner.on(LINK, ok("")).on(DISABLE, new CommandResult(1, "permission denied", false));

        ActionOutcome outcome = gate.repair(wifi(TIMEOUT), TIMEOUT);

        assertFalse(outcome.succeeded());
        assertTrue(outcome.reason().contains("permission denied"));
        assertEquals(0, runner.count(ENABLE));
    }
}
