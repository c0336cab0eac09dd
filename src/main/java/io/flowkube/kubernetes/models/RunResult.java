package io.flowkube.kubernetes.models;

import io.flowkube.kubernetes.runners.Output;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Builder
@Getter
@ToString
public class RunResult implements Output {
    @Schema(
        title = "The name of the pod or job that ran"
    )
    private final String name;

    @Schema(
        title = "The namespace it ran in"
    )
    private final String namespace;

    @Schema(
        title = "How the run ended",
        description = "UNKNOWN only when the watch was aborted before the outcome was known."
    )
    private final TerminalStatus terminalStatus;

    @Schema(
        title = "The captured output, as text"
    )
    private final String rawOutput;

    @Schema(
        title = "The captured output",
        description = "The parsed JSON value when the output is valid JSON, the raw text otherwise."
    )
    private final Object output;

    @Schema(
        title = "Whether the created object was deleted"
    )
    private final boolean cleaned;

    @Schema(
        title = "The CronJob the job was created from",
        description = "Only set on CronJob triggers."
    )
    private final String cronJobName;

    @Schema(
        title = "When the triggered job was created"
    )
    private final Instant createdAt;

    @Schema(
        title = "Whether command, args or env overrides were applied"
    )
    private final Boolean overridesApplied;
}
