package com.tenex.sync.core.build;

import java.time.Instant;

/**
 * Ask the backend to start or stop a project.
 */
public record ProjectControlIntent(String author, String projectIdentity, Command command, Instant createdAt) {

    public enum Command {
        start,
        stop
    }
}
