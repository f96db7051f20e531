package com.example.servicereconciler.connectivity;

import com.example.servicereconciler.domain.ActionOutcome;
import com.example.servicereconciler.domain.CheckOutcome;
import com.example.servicereconciler.domain.ConnectivitySpec;
import com.example.servicereconciler.driver.CommandResult;
import com.example.servicereconciler.driver.CommandRunner;
import com.example.servicereconciler.driver.EndpointChecker;
import com.example.servicereconciler.driver.Polling;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Two-level check of the machine's network: is the interface associated with an access point,
 * and can a well-known external address be reached.
 * <p>
 * Repair bounces the interface only when the link itself is down. With the link up and only
 * reachability failing, reachability is retried without touching the interface.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectivityGate {

    private final CommandRunner commandRunner;
    private final EndpointChecker endpointChecker;

    public CheckOutcome checkLink(ConnectivitySpec spec, Duration timeout) {
        CommandResult result = commandRunner.run(spec.linkCheck(), timeout);
        if (result.timedOut()) {
            return CheckOutcome.fail("link check timed out after " + timeout.toMillis() + "ms");
        }
        String output = result.output() == null ? "" : result.output().trim();
        boolean associated = spec.associatedPattern() != null && !spec.associatedPattern().isBlank()
                ? result.exitCode() == 0 && Pattern.compile(spec.associatedPattern()).matcher(output).find()
                : result.succeeded();
        String message = output.isEmpty() ? result.describe() : output;
        return associated ? CheckOutcome.pass("link associated: " + message)
                : CheckOutcome.fail("link not associated: " + message);
    }

    public CheckOutcome checkReachability(ConnectivitySpec spec, Duration timeout) {
        List<String> failures = new ArrayList<>();
        for (String target : spec.reachabilityTargets()) {
            int colon = target.lastIndexOf(':');
            if (colon <= 0) {
                failures.add(target + ": expected host:port");
                continue;
            }
            String host = target.substring(0, colon);
            int port;
            try {
                port = Integer.parseInt(target.substring(colon + 1));
            } catch (NumberFormatException e) {
                failures.add(target + ": bad port");
                continue;
            }
            CheckOutcome outcome = endpointChecker.tcp(host, port, timeout);
            if (outcome.passed()) {
                return outcome;
            }
            failures.add(outcome.detail());
        }
        if (spec.reachabilityUrl() != null && !spec.reachabilityUrl().isBlank()) {
            CheckOutcome outcome = endpointChecker.http(spec.reachabilityUrl(), timeout);
            if (outcome.passed()) {
                return outcome;
            }
            failures.add(outcome.detail());
        }
        return CheckOutcome.fail("no external address reachable: " + String.join("; ", failures));
    }

    /**
     * Applies the repair policy once. At most one interface bounce per call, and none when the
     * link is already associated.
     */
    public ActionOutcome repair(ConnectivitySpec spec, Duration checkTimeout) {
        boolean bounced = false;
        CheckOutcome link = checkLink(spec, checkTimeout);
        if (!link.passed()) {
            log.warn("Network link down ({}), bouncing interface", link.detail());
            ActionOutcome bounce = bounceInterface(spec, checkTimeout);
            if (!bounce.succeeded()) {
                return bounce;
            }
            bounced = true;
        }

        CheckOutcome[] last = {CheckOutcome.fail("reachability not checked")};
        boolean reachable = Polling.awaitCondition(() -> {
            last[0] = checkReachability(spec, checkTimeout);
            return last[0].passed();
        }, spec.maxWait(), spec.pollInterval());
        if (!reachable) {
            return ActionOutcome.failed((bounced ? "link restored but " : "link up but ")
                    + "external address still unreachable: " + last[0].detail());
        }
        return ActionOutcome.succeeded(bounced ? "connectivity restored by interface bounce"
                : "connectivity restored without interface bounce");
    }

    private ActionOutcome bounceInterface(ConnectivitySpec spec, Duration checkTimeout) {
        if (spec.disable().isEmpty() || spec.enable().isEmpty()) {
            return ActionOutcome.failed("link down and no disable/enable commands configured");
        }
        CommandResult down = commandRunner.run(spec.disable(), checkTimeout);
        if (!down.succeeded()) {
            return ActionOutcome.failed("interface disable failed (" + down.describe() + ")");
        }
        if (!Polling.pause(spec.bounceDelay())) {
            return ActionOutcome.failed("interrupted during interface bounce");
        }
        CommandResult up = commandRunner.run(spec.enable(), checkTimeout);
        if (!up.succeeded()) {
            return ActionOutcome.failed("interface enable failed (" + up.describe() + ")");
        }
        boolean associated = Polling.awaitCondition(() -> checkLink(spec, checkTimeout).passed(),
                spec.maxWait(), spec.pollInterval());
        if (!associated) {
            return ActionOutcome.failed("link not associated " + spec.maxWait().toSeconds() + "s after interface bounce");
        }
        log.info("Network link re-associated after interface bounce");
        return ActionOutcome.succeeded("interface bounced");
    }
}
