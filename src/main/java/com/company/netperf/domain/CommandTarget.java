package com.company.netperf.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Host a command runs on. A null or loopback host means the local machine.
 */
@Value
@Builder
public class CommandTarget {

    private static final Set<String> LOCAL_NAMES = Set.of("localhost", "127.0.0.1", "::1");

    String host;
    String user;
    String sshKey;

    public static CommandTarget local() {
        return CommandTarget.builder().build();
    }

    public static CommandTarget of(String host, String user, String sshKey) {
        return CommandTarget.builder()
                .host(host)
                .user(user)
                .sshKey(sshKey)
                .build();
    }

    public boolean isLocal() {
        return host == null || host.isBlank() || LOCAL_NAMES.contains(host);
    }

    /**
     * user@host, or just host when no user is configured
     */
    public String destination() {
        return user != null && !user.isBlank() ? user + "@" + host : host;
    }
}
