package com.stagehand.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Binds stagehand.* from application.yml.
 *
 * <pre>
 * stagehand:
 *   data-dir: ${user.home}/.stagehand
 *   store.busy-retry:  { max-attempts: 5, base-delay: 50ms, max-delay: 2s }
 *   tracker:           { base-url: https://api.linear.app/graphql, retry: {...} }
 *   agent:             { command: claude, timeout: 30m, workers: 4 }
 *   vcs:               { git-command: git, gh-command: gh }
 * </pre>
 */
@ConfigurationProperties(prefix = "stagehand")
public record StagehandProperties(
        Path    dataDir,
        @DefaultValue Store   store,
        @DefaultValue Tracker tracker,
        @DefaultValue Agent   agent,
        @DefaultValue Vcs     vcs
) {

    public StagehandProperties {
        if (dataDir == null) {
            dataDir = Path.of(System.getProperty("user.home"), ".stagehand");
        }
    }

    /** Bounded exponential backoff; delays are jittered by ±25 %. */
    public record RetrySettings(
            @DefaultValue("5")     int      maxAttempts,
            @DefaultValue("50ms")  Duration baseDelay,
            @DefaultValue("2s")    Duration maxDelay
    ) {}

    public record Store(@DefaultValue RetrySettings busyRetry) {}

    public record Tracker(
            @DefaultValue("https://api.linear.app/graphql") String baseUrl,
            @DefaultValue("10s")                            Duration requestTimeout,
            @DefaultValue                                   RetrySettings retry
    ) {}

    public record Agent(
            @DefaultValue("claude") String   command,
            @DefaultValue("30m")    Duration timeout,
            @DefaultValue("4")      int      workers
    ) {}

    public record Vcs(
            @DefaultValue("git") String gitCommand,
            @DefaultValue("gh")  String ghCommand
    ) {}
}
