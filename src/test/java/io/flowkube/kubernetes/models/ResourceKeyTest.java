package io.flowkube.kubernetes.models;

import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import io.flowkube.kubernetes.exceptions.ValidationException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ResourceKeyTest {
    @ParameterizedTest
    @CsvSource({
        "v1, pod, Pod, /api/v1/namespaces/ns/pods",
        "v1, ConfigMap, ConfigMap, /api/v1/namespaces/ns/configmaps",
        "v1, persistentvolumeclaim, PersistentVolumeClaim, /api/v1/namespaces/ns/persistentvolumeclaims",
        "v1, namespace, Namespace, /api/v1/namespaces",
        "apps/v1, DEPLOYMENT, Deployment, /apis/apps/v1/namespaces/ns/deployments",
        "apps/v1, statefulset, StatefulSet, /apis/apps/v1/namespaces/ns/statefulsets",
        "batch/v1, cronjob, CronJob, /apis/batch/v1/namespaces/ns/cronjobs",
        "networking.k8s.io/v1, ingress, Ingress, /apis/networking.k8s.io/v1/namespaces/ns/ingresses",
        "networking.k8s.io/v1, NetworkPolicy, NetworkPolicy, /apis/networking.k8s.io/v1/namespaces/ns/networkpolicies",
    })
    void builtInKinds(String apiVersion, String kind, String canonical, String path) {
        ResourceKey key = ResourceKey.of(apiVersion, kind, "ns", "x");

        assertThat(key.isCustom(), is(false));
        assertThat(key.canonicalKind(), is(canonical));
        assertThat(key.collectionPath(), is(path));
    }

    @Test
    void customResourcesUseTheNaivePlural() {
        ResourceKey key = ResourceKey.of("stable.example.com/v1", "Shirt", "ns", "blue");

        assertThat(key.isCustom(), is(true));
        assertThat(key.plural(), is("shirts"));
        assertThat(key.collectionPath(), is("/apis/stable.example.com/v1/namespaces/ns/shirts"));

        ResourceDefinitionContext definition = key.definition();
        assertThat(definition.getGroup(), is("stable.example.com"));
        assertThat(definition.getVersion(), is("v1"));
        assertThat(definition.getPlural(), is("shirts"));
        assertThat(definition.isNamespaceScoped(), is(true));
    }

    @Test
    void unknownKindOfABuiltInGroupIsRejected() {
        ValidationException e = assertThrows(ValidationException.class, () -> ResourceKey.of("apps/v1", "Widget", "ns", "x").plural());
        assertThat(e.getMessage(), is("Unsupported apps resource type: Widget"));

        ValidationException core = assertThrows(ValidationException.class, () -> ResourceKey.of("v1", "Node", "ns", "x").definition());
        assertThat(core.getMessage(), containsString("Unsupported core resource type"));
    }

    @Test
    void apiVersionAndKindAreRequired() {
        assertThrows(ValidationException.class, () -> ResourceKey.of("", "Pod", "ns", "x"));
        assertThrows(ValidationException.class, () -> ResourceKey.of("v1", null, "ns", "x"));
    }
}
