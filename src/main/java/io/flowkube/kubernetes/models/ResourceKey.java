package io.flowkube.kubernetes.models;

import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import io.flowkube.kubernetes.exceptions.ValidationException;
import io.flowkube.kubernetes.kubectl.KubernetesKind;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;

/**
 * (apiVersion, kind, namespace, name): the address used to route a call to the right API group
 * and to build collection paths.
 * <p>
 * Custom resources are pluralized naively as {@code kind.toLowerCase() + "s"}; irregular plurals
 * are not resolved.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ResourceKey {
    private final String apiVersion;
    private final String kind;
    private final String namespace;
    private final String name;

    private ResourceKey(String apiVersion, String kind, String namespace, String name) {
        this.apiVersion = apiVersion;
        this.kind = kind;
        this.namespace = namespace;
        this.name = name;
    }

    public static ResourceKey of(String apiVersion, String kind, String namespace, String name) {
        if (apiVersion == null || apiVersion.isBlank()) {
            throw new ValidationException("apiVersion is required");
        }

        if (kind == null || kind.isBlank()) {
            throw new ValidationException("kind is required");
        }

        return new ResourceKey(apiVersion.trim(), kind.trim(), namespace, name);
    }

    public String group() {
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? "" : apiVersion.substring(0, slash);
    }

    public String version() {
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? apiVersion : apiVersion.substring(slash + 1);
    }

    public boolean isCustom() {
        return !KubernetesKind.isBuiltIn(apiVersion);
    }

    public String plural() {
        return isCustom() ? kind.toLowerCase(Locale.ROOT) + "s" : builtIn().getPlural();
    }

    public boolean isNamespaced() {
        return isCustom() || builtIn().isNamespaced();
    }

    /**
     * The canonical kind name, e.g. {@code Deployment} for {@code deployment}.
     */
    public String canonicalKind() {
        return isCustom() ? kind : builtIn().getKind();
    }

    public ResourceDefinitionContext definition() {
        if (isCustom() && group().isEmpty()) {
            throw new ValidationException("Custom resource apiVersion must be of the form <group>/<version>, got '" + apiVersion + "'");
        }

        return new ResourceDefinitionContext.Builder()
            .withGroup(group())
            .withVersion(version())
            .withKind(canonicalKind())
            .withPlural(plural())
            .withNamespaced(isNamespaced())
            .build();
    }

    /**
     * The collection endpoint watched and listed for this key.
     */
    public String collectionPath() {
        String prefix = group().isEmpty() ? "/api/" + version() : "/apis/" + group() + "/" + version();

        if (isNamespaced()) {
            return prefix + "/namespaces/" + namespace + "/" + plural();
        }

        return prefix + "/" + plural();
    }

    private KubernetesKind builtIn() {
        return KubernetesKind.from(apiVersion, kind)
            .orElseThrow(() -> new ValidationException(
                "Unsupported " + (group().isEmpty() ? "core" : group()) + " resource type: " + kind
            ));
    }
}
