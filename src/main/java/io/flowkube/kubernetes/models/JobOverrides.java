package io.flowkube.kubernetes.models;

import io.fabric8.kubernetes.api.model.EnvVar;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Overrides applied to every container of a job template cloned from a CronJob.
 */
@Builder
@Getter
@ToString
public class JobOverrides {
    @Schema(
        title = "Replaces the container command when not empty"
    )
    private final List<String> command;

    @Schema(
        title = "Replaces the container args when not empty"
    )
    private final List<String> args;

    @Schema(
        title = "Environment variables merged by name into the container env",
        description = "A variable with an existing name replaces it in place, any other one is appended."
    )
    private final List<EnvVar> envs;

    public boolean hasCommand() {
        return command != null && !command.isEmpty();
    }

    public boolean hasArgs() {
        return args != null && !args.isEmpty();
    }

    public boolean hasEnvs() {
        return envs != null && !envs.isEmpty();
    }

    public boolean isEmpty() {
        return !hasCommand() && !hasArgs() && !hasEnvs();
    }

    /**
     * Drops env entries without a name or a value; returns null when nothing usable remains.
     */
    public JobOverrides normalized() {
        List<EnvVar> usableEnvs = envs == null ? null : envs.stream()
            .filter(env -> env.getName() != null && !env.getName().isBlank())
            .filter(env -> env.getValue() != null || env.getValueFrom() != null)
            .collect(Collectors.toList());

        JobOverrides normalized = JobOverrides.builder()
            .command(command)
            .args(args)
            .envs(usableEnvs)
            .build();

        return normalized.isEmpty() ? null : normalized;
    }
}
