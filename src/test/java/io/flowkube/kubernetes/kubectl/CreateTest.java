package io.flowkube.kubernetes.kubectl;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.flowkube.kubernetes.exceptions.ClusterCallException;
import io.flowkube.kubernetes.exceptions.ValidationException;
import io.flowkube.kubernetes.models.ResourceKey;
import io.flowkube.kubernetes.runners.RunContext;
import io.flowkube.kubernetes.services.ClusterSession;
import io.flowkube.kubernetes.services.InstanceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CreateTest {
    private static final String EXPORTED = "{" +
        "\"apiVersion\": \"v1\", \"kind\": \"ConfigMap\"," +
        "\"metadata\": {\"name\": \"settings\", \"namespace\": \"other\", \"uid\": \"1234\", \"resourceVersion\": \"77\"," +
        "  \"annotations\": {\"kubectl.kubernetes.io/last-applied-configuration\": \"{}\", \"team\": \"data\"}}," +
        "\"data\": {\"mode\": \"fast\"}," +
        "\"status\": {}" +
        "}";

    private ClusterSession session;
    private NonNamespaceOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> collection;
    private Resource<GenericKubernetesResource> resource;
    private final AtomicReference<GenericKubernetesResource> sent = new AtomicReference<>();
    private RunContext runContext;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        session = mock(ClusterSession.class);
        collection = mock(NonNamespaceOperation.class);
        resource = mock(Resource.class);
        runContext = new RunContext(LoggerFactory.getLogger(CreateTest.class), connection -> session);

        when(session.collection(any(ResourceKey.class))).thenReturn(collection);
        when(collection.resource(any(GenericKubernetesResource.class))).thenAnswer(invocation -> {
            sent.set(invocation.getArgument(0));
            return resource;
        });
        when(resource.create()).thenAnswer(invocation -> sent.get());
    }

    @Test
    void createsACleanedCopyInTheTargetNamespace() throws Exception {
        Create.Output output = Create.builder()
            .kind("ConfigMap")
            .namespace("target")
            .resource(EXPORTED)
            .build()
            .run(runContext);

        assertThat(output.getMetadata().getName(), is("settings"));
        assertThat(output.getMetadata().getNamespace(), is("target"));
        assertThat(output.getMetadata().getUid(), nullValue());
        assertThat(output.getMetadata().getResourceVersion(), nullValue());
        assertThat(output.getMetadata().getAnnotations(), hasEntry("team", "data"));
        assertThat(output.getMetadata().getAnnotations().containsKey("kubectl.kubernetes.io/last-applied-configuration"), is(false));
        assertThat(output.getMetadata().getLabels(), hasEntry(InstanceService.MANAGED_LABEL, InstanceService.MANAGED_VALUE));
        assertThat(output.getResource().containsKey("status"), is(false));
    }

    @Test
    void missingNameIsTakenFromTheTask() throws Exception {
        Create.Output output = Create.builder()
            .kind("ConfigMap")
            .name("fallback")
            .resource("{\"data\": {\"a\": \"b\"}}")
            .build()
            .run(runContext);

        assertThat(output.getMetadata().getName(), is("fallback"));
        assertThat(output.getResource(), hasEntry("kind", (Object) "ConfigMap"));
        assertThat(output.getResource(), hasEntry("apiVersion", (Object) "v1"));
    }

    @Test
    void withoutAnyNameNothingIsCreated() {
        Create task = Create.builder()
            .kind("ConfigMap")
            .resource("{\"data\": {}}")
            .build();

        assertThrows(ValidationException.class, () -> task.run(runContext));
        verifyNoInteractions(session);
    }

    @Test
    void rejectedCreateIsWrapped() {
        when(resource.create()).thenThrow(new KubernetesClientException("already exists"));

        Create task = Create.builder()
            .kind("ConfigMap")
            .resource(EXPORTED)
            .build();

        ClusterCallException e = assertThrows(ClusterCallException.class, () -> task.run(runContext));
        assertThat(e.getOperation(), is("create"));
        assertThat(e.getName(), is("settings"));
    }
}
