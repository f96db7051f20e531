package com.example.servicereconciler.driver;

import com.example.servicereconciler.config.ReconcilerProperties;
import com.example.servicereconciler.domain.CheckOutcome;
import com.example.servicereconciler.domain.RemoteEndpoint;
import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Checks a tunnel from its far side: opens an SSH session to the remote host and runs a
 * command there that succeeds only if the forwarded port is visible.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteEndpointChecker {

    private static final long EXIT_POLL_MILLIS = 100;

    private final ReconcilerProperties properties;

    public CheckOutcome check(RemoteEndpoint endpoint, Duration timeout) {
        String target = endpoint.sshUser() + "@" + endpoint.sshHost() + ":" + endpoint.effectiveSshPort();
        String command = endpoint.effectiveCheckCommand();
        Session session = null;
        ChannelExec channel = null;
        try {
            JSch jsch = new JSch();
            String identity = endpoint.identityFile() != null && !endpoint.identityFile().isBlank()
                    ? endpoint.identityFile() : properties.getSsh().getDefaultIdentityFile();
            jsch.addIdentity(identity);

            session = jsch.getSession(endpoint.sshUser(), endpoint.sshHost(), endpoint.effectiveSshPort());
            session.setConfig("StrictHostKeyChecking", properties.getSsh().getStrictHostKeyChecking());
            session.setTimeout((int) timeout.toMillis());
            session.connect((int) properties.getSsh().getConnectTimeout().toMillis());

            channel = (ChannelExec) session.openChannel("exec");
            channel.setCommand(command);
            channel.setInputStream(null);
            InputStream stdout = channel.getInputStream();
            channel.connect((int) timeout.toMillis());

            long deadline = System.currentTimeMillis() + timeout.toMillis();
            while (!channel.isClosed()) {
                if (System.currentTimeMillis() > deadline) {
                    return CheckOutcome.fail(String.format("remote check on %s timed out after %dms",
                            target, timeout.toMillis()));
                }
                Thread.sleep(EXIT_POLL_MILLIS);
            }
            String output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8).trim();
            int exitCode = channel.getExitStatus();
            String message = String.format("remote '%s' on %s exit %d%s", command, target, exitCode,
                    output.isEmpty() ? "" : ": " + output);
            return exitCode == 0 ? CheckOutcome.pass(message) : CheckOutcome.fail(message);
        } catch (JSchException | IOException e) {
            return CheckOutcome.fail("SSH to " + target + " failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CheckOutcome.fail("remote check on " + target + " interrupted");
        } finally {
            if (channel != null) channel.disconnect();
            if (session != null) session.disconnect();
        }
    }
}
