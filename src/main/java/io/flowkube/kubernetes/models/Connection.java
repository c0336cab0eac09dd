package io.flowkube.kubernetes.models;

import io.fabric8.kubernetes.client.Config;
import io.flowkube.kubernetes.exceptions.ValidationException;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

@Builder
@Getter
@ToString(exclude = "content")
public class Connection {
    public enum LoadFrom {
        AUTOMATIC,
        FILE,
        CONTENT
    }

    @Schema(
        title = "Where the cluster configuration is loaded from",
        description = "* AUTOMATIC: system properties, environment variables, the kube config file, " +
            "then the service account token and mounted CA certificate.\n" +
            "* FILE: the kube config file given by `filePath`.\n" +
            "* CONTENT: the kube config given inline by `content`."
    )
    @NotNull
    @Builder.Default
    private final LoadFrom loadFrom = LoadFrom.AUTOMATIC;

    @Schema(
        title = "Path to a kube config file",
        description = "Required when `loadFrom` is FILE."
    )
    private final String filePath;

    @Schema(
        title = "Kube config content",
        description = "Required when `loadFrom` is CONTENT."
    )
    private final String content;

    @Schema(
        title = "The namespace used when none is given"
    )
    private final String namespace;

    @Schema(
        title = "Trust all certificates"
    )
    private final Boolean trustCerts;

    @Schema(
        title = "Timeout of a single API request"
    )
    private final Duration requestTimeout;

    public Config toConfig() {
        Config config;

        switch (loadFrom) {
            case FILE:
                if (filePath == null || filePath.isBlank()) {
                    throw new ValidationException("File path not set!");
                }

                try {
                    config = Config.fromKubeconfig(null, Files.readString(Path.of(filePath)), filePath);
                } catch (IOException e) {
                    throw new ValidationException("Unable to read kube config file '" + filePath + "': " + e.getMessage(), e);
                }
                break;
            case CONTENT:
                if (content == null || content.isBlank()) {
                    throw new ValidationException("Content not set!");
                }

                config = Config.fromKubeconfig(content);
                break;
            default:
                config = Config.autoConfigure(null);
        }

        if (namespace != null) {
            config.setNamespace(namespace);
        }

        if (trustCerts != null) {
            config.setTrustCerts(trustCerts);
        }

        if (requestTimeout != null) {
            config.setRequestTimeout((int) requestTimeout.toMillis());
        }

        return config;
    }
}
