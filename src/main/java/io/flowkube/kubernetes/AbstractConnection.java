package io.flowkube.kubernetes;

import io.flowkube.kubernetes.models.Connection;
import io.flowkube.kubernetes.runners.RunContext;
import io.flowkube.kubernetes.services.ClusterSession;
import io.flowkube.kubernetes.services.ValidationService;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@ToString
@EqualsAndHashCode
@Getter
@NoArgsConstructor
public abstract class AbstractConnection {
    @Schema(
        title = "The connection parameters to the Kubernetes cluster",
        description = "If no connection is defined, we try to load the connection from the current context in the following order: \n" +
            "1. System properties\n" +
            "2. Environment variables\n" +
            "3. Kube config file\n" +
            "4. Service account token and a mounted CA certificate.\n" +
            "\n" +
            "You can pass a full configuration with all options if needed."
    )
    @Valid
    private Connection connection;

    @Schema(
        title = "The Kubernetes namespace"
    )
    @NotBlank
    @Builder.Default
    protected String namespace = "default";

    /**
     * Checks the declared constraints, before anything reaches the cluster.
     */
    protected void validate() {
        ValidationService.validate(this);
    }

    protected ClusterSession session(RunContext runContext) {
        return runContext.session(this.connection);
    }
}
