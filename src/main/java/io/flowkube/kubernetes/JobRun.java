package io.flowkube.kubernetes;

import io.flowkube.kubernetes.models.RestartPolicy;
import io.flowkube.kubernetes.models.RunResult;
import io.flowkube.kubernetes.runners.RunContext;
import io.flowkube.kubernetes.runners.RunnableOperation;
import io.flowkube.kubernetes.services.ClusterSession;
import io.flowkube.kubernetes.services.JobService;
import io.flowkube.kubernetes.services.PodService;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.slf4j.Logger;

import java.util.List;

@SuperBuilder
@ToString
@EqualsAndHashCode(callSuper = true)
@Getter
@NoArgsConstructor
@Schema(
    title = "Run a job to completion and capture its output.",
    description = "A random suffix is added to the job name. The run ends as soon as one pod of the job succeeded or failed; " +
        "the logs of its first pod are captured and the job is deleted unless `cleanup` is false."
)
public class JobRun extends AbstractJob implements RunnableOperation<RunResult> {
    @Schema(
        title = "The container image"
    )
    @NotBlank
    private String image;

    @Schema(
        title = "The container arguments"
    )
    private List<String> args;

    @Schema(
        title = "The job base name",
        description = "Must be a valid DNS-1123 label. The final name is `<jobName>-<6 random characters>`, at most 63 characters."
    )
    @NotBlank
    private String jobName;

    @Schema(
        title = "The pod restart policy"
    )
    @NotNull
    @Builder.Default
    private RestartPolicy restartPolicy = RestartPolicy.NEVER;

    @Override
    public RunResult run(RunContext runContext) throws Exception {
        this.validate();

        Logger logger = runContext.logger();
        String name = JobService.uniqueName(this.jobName);
        logger.debug("Generated job name '{}' from '{}'", name, this.jobName);

        try (ClusterSession session = this.session(runContext)) {
            JobService.create(session, logger, JobService.runOnce(name, namespace, image, args, restartPolicy));

            return this.complete(session, logger, name, PodService.MAIN_CONTAINER).build();
        }
    }
}
