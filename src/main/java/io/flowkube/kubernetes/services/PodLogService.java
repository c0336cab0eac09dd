package io.flowkube.kubernetes.services;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.LogWatch;
import io.fabric8.kubernetes.client.dsl.Loggable;
import io.fabric8.kubernetes.client.dsl.PodResource;
import io.flowkube.kubernetes.exceptions.ClusterCallException;
import io.flowkube.kubernetes.models.LogOptions;
import io.flowkube.kubernetes.utils.OneShot;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Reads the log of one container into a string.
 * <p>
 * The stream is read on its own thread until it ends; a watchdog force-closes it once
 * {@link LogOptions#effectiveWatchdog()} elapses and returns what was read so far. Reaching the
 * watchdog is not an error: a followed stream normally ends that way.
 */
@Slf4j
abstract public class PodLogService {
    /**
     * Collects the log of a container, the first container of the pod when none is given.
     *
     * @return the raw log text, possibly empty
     */
    public static String collect(
        ClusterSession session,
        Logger logger,
        String namespace,
        String pod,
        String container,
        LogOptions options
    ) throws InterruptedException {
        if (options.getSinceTime() != null) {
            ValidationService.validateTimestamp(options.getSinceTime());
        }

        PodResource podResource = session.pods(namespace).withName(pod);
        String target = container != null && !container.isBlank() ? container : firstContainer(podResource, namespace, pod);

        logger.debug("Reading logs of pod '{}' container '{}' in namespace '{}' (follow: {}, tail: {})",
            pod, target, namespace, options.isFollow(), options.effectiveTailLines());

        Loggable loggable = options.getSinceTime() != null ?
            podResource.inContainer(target).sinceTime(options.getSinceTime()).tailingLines(options.effectiveTailLines()) :
            podResource.inContainer(target).tailingLines(options.effectiveTailLines());

        InputStream stream;
        Closeable handle;
        try {
            if (options.isFollow()) {
                LogWatch logWatch = loggable.watchLog();
                stream = logWatch.getOutput();
                handle = logWatch;
            } else {
                stream = loggable.getLogInputStream();
                handle = stream;
            }
        } catch (KubernetesClientException e) {
            throw new ClusterCallException("get logs for", "Pod", pod, namespace, e);
        }

        return read(logger, namespace, pod, stream, handle, options.effectiveWatchdog());
    }

    /**
     * Accumulates a stream until it ends or the watchdog fires, whichever comes first.
     *
     * @param handle closed once the result is known, usually the stream itself or the log watch owning it
     */
    public static String read(
        Logger logger,
        String namespace,
        String pod,
        InputStream stream,
        Closeable handle,
        Duration watchdog
    ) throws InterruptedException {
        OneShot<String> result = new OneShot<>();
        StringBuffer logs = new StringBuffer();

        ExecutorService reader = Executors.newSingleThreadExecutor(daemon("k8s-log-" + pod));
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(daemon("k8s-log-watchdog-" + pod));

        try {
            timer.schedule(
                () -> {
                    if (result.complete(logs.toString())) {
                        logger.debug("Log watchdog reached for pod '{}' after {}, ending stream", pod, watchdog);
                        closeQuietly(handle, pod);
                    }
                },
                watchdog.toMillis(),
                TimeUnit.MILLISECONDS
            );

            reader.submit(() -> {
                try (Reader in = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                    char[] buffer = new char[8192];
                    int read;
                    while ((read = in.read(buffer)) != -1) {
                        logs.append(buffer, 0, read);
                    }

                    if (result.complete(logs.toString())) {
                        logger.debug("Log stream ended for pod '{}', {} characters read", pod, logs.length());
                    }
                } catch (IOException | RuntimeException e) {
                    if (result.fail(new ClusterCallException("get logs for", "Pod", pod, namespace, e))) {
                        logger.error("Log stream error for pod '{}': {}", pod, e.getMessage());
                    } else {
                        logger.trace("Log stream of pod '{}' closed after resolution: {}", pod, e.getMessage());
                    }
                }
            });

            return result.get();
        } finally {
            timer.shutdownNow();
            reader.shutdownNow();
            closeQuietly(handle, pod);
        }
    }

    public static String firstContainer(Pod pod) {
        List<Container> containers = pod.getSpec() != null ? pod.getSpec().getContainers() : null;

        if (containers == null || containers.isEmpty()) {
            return null;
        }

        return containers.get(0).getName();
    }

    private static String firstContainer(PodResource podResource, String namespace, String name) {
        Pod pod;
        try {
            pod = podResource.get();
        } catch (KubernetesClientException e) {
            throw new ClusterCallException("get", "Pod", name, namespace, e);
        }

        if (pod == null) {
            throw new ClusterCallException("get", "Pod", name, namespace, "not found");
        }

        String container = firstContainer(pod);
        if (container == null) {
            throw new ClusterCallException("get logs for", "Pod", name, namespace, "pod has no containers");
        }

        return container;
    }

    private static void closeQuietly(Closeable handle, String pod) {
        try {
            handle.close();
        } catch (IOException | RuntimeException e) {
            log.debug("Unable to close log stream of pod '{}'", pod, e);
        }
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
