package io.flowkube.kubernetes.kubectl;

import io.flowkube.kubernetes.AbstractConnection;
import io.flowkube.kubernetes.models.LogOptions;
import io.flowkube.kubernetes.services.ValidationService;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@ToString
@EqualsAndHashCode(callSuper = true)
@Getter
@NoArgsConstructor
public abstract class AbstractLogs extends AbstractConnection {
    @Schema(
        title = "The container to read",
        description = "The first container of the pod when not set."
    )
    protected String container;

    @Schema(
        title = "Follow the log stream",
        description = "Reading stops after 30 seconds when following, 10 seconds otherwise; what was read by then is returned."
    )
    @NotNull
    @Builder.Default
    protected Boolean follow = false;

    @Schema(
        title = "The number of lines to read from the end of the log"
    )
    @Positive
    @Builder.Default
    protected Integer tailLines = LogOptions.DEFAULT_TAIL_LINES;

    @Schema(
        title = "Only return logs written after this time",
        description = "An RFC 3339 timestamp, e.g. `2024-01-01T00:00:00Z`."
    )
    protected String sinceTime;

    @Override
    protected void validate() {
        super.validate();

        if (sinceTime != null) {
            ValidationService.validateTimestamp(sinceTime);
        }
    }

    protected LogOptions logOptions() {
        return LogOptions.builder()
            .follow(follow)
            .tailLines(tailLines)
            .sinceTime(sinceTime)
            .build();
    }
}
