package io.flowkube.kubernetes;

import io.flowkube.kubernetes.exceptions.ValidationException;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.Duration;

@SuperBuilder
@ToString
@EqualsAndHashCode(callSuper = true)
@Getter
@NoArgsConstructor
public abstract class AbstractRun extends AbstractConnection {
    @Schema(
        title = "The maximum duration to wait for the run to complete.",
        description = "Reaching it fails the operation with a timeout error."
    )
    @NotNull
    @Builder.Default
    protected Duration waitRunning = Duration.ofSeconds(300);

    @Override
    protected void validate() {
        super.validate();

        if (waitRunning.isNegative() || waitRunning.isZero()) {
            throw new ValidationException("waitRunning must be a positive duration, got " + waitRunning);
        }
    }
}
