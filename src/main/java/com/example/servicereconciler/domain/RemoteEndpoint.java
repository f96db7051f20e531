package com.example.servicereconciler.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Far side of a network tunnel. The endpoint is checked by running {@code checkCommand}
 * on {@code sshHost}; a zero exit status means the forwarded port is visible there.
 */
public record RemoteEndpoint(
        @JsonProperty("ssh-host") String sshHost,
        @JsonProperty("ssh-port") int sshPort,
        @JsonProperty("ssh-user") String sshUser,
        @JsonProperty("identity-file") String identityFile,
        @JsonProperty("remote-port") int remotePort,
        @JsonProperty("check-command") String checkCommand
) {
    public String effectiveCheckCommand() {
        if (checkCommand != null && !checkCommand.isBlank()) {
            return checkCommand;
        }
        return "nc -z 127.0.0.1 " + remotePort;
    }

    public int effectiveSshPort() {
        return sshPort > 0 ? sshPort : 22;
    }
}
