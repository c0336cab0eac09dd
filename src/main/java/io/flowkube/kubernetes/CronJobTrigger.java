package io.flowkube.kubernetes;

import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.flowkube.kubernetes.models.JobOverrides;
import io.flowkube.kubernetes.models.RunResult;
import io.flowkube.kubernetes.runners.RunContext;
import io.flowkube.kubernetes.runners.RunnableOperation;
import io.flowkube.kubernetes.services.ClusterSession;
import io.flowkube.kubernetes.services.CronJobService;
import io.flowkube.kubernetes.services.JobService;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.slf4j.Logger;

import java.time.Instant;

@SuperBuilder
@ToString
@EqualsAndHashCode(callSuper = true)
@Getter
@NoArgsConstructor
@Schema(
    title = "Trigger a CronJob manually and capture the output of the job.",
    description = "A job named `<cronJobName>-<unix seconds>` is created from a copy of the CronJob job template, " +
        "with the given overrides applied to every container. It is labelled `manual-trigger=true` and annotated with " +
        "the CronJob it was created from."
)
public class CronJobTrigger extends AbstractJob implements RunnableOperation<RunResult> {
    @Schema(
        title = "The name of the CronJob to trigger"
    )
    @NotBlank
    private String cronJobName;

    @Schema(
        title = "Overrides applied to every container of the job template"
    )
    private JobOverrides overrides;

    @Override
    public RunResult run(RunContext runContext) throws Exception {
        this.validate();

        Logger logger = runContext.logger();
        JobOverrides applied = this.overrides != null ? this.overrides.normalized() : null;

        Instant now = Instant.now();
        String jobName = JobService.timestampedName(cronJobName, now);

        try (ClusterSession session = this.session(runContext)) {
            CronJob cronJob = CronJobService.read(session, namespace, cronJobName);
            logger.info("Triggering CronJob '{}' in namespace '{}' as job '{}'", cronJobName, namespace, jobName);

            JobService.create(session, logger, CronJobService.jobFrom(cronJob, jobName, namespace, applied, now, logger));
            Instant createdAt = Instant.now();

            return this.complete(session, logger, jobName, null)
                .cronJobName(cronJobName)
                .createdAt(createdAt)
                .overridesApplied(applied != null)
                .build();
        }
    }
}
