package io.flowkube.kubernetes.models;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

@Builder
@Getter
@ToString
public class LogOptions {
    public static final int DEFAULT_TAIL_LINES = 1000;
    public static final Duration WATCHDOG = Duration.ofSeconds(10);
    public static final Duration FOLLOW_WATCHDOG = Duration.ofSeconds(30);

    @Builder.Default
    private final Integer tailLines = DEFAULT_TAIL_LINES;

    // RFC 3339, validated before any stream is opened
    private final String sinceTime;

    @Builder.Default
    private final boolean follow = false;

    // overrides the mode default when set
    private final Duration watchdog;

    public Duration effectiveWatchdog() {
        if (watchdog != null) {
            return watchdog;
        }

        return follow ? FOLLOW_WATCHDOG : WATCHDOG;
    }

    public int effectiveTailLines() {
        return tailLines != null && tailLines > 0 ? tailLines : DEFAULT_TAIL_LINES;
    }
}
