package io.flowkube.kubernetes.watchers;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import org.slf4j.Logger;

abstract public class AbstractWatch<T extends HasMetadata> implements Watcher<T> {
    protected Logger logger;

    public AbstractWatch(Logger logger) {
        this.logger = logger;
    }

    public void eventReceived(Action action, T resource) {
        if (logger.isTraceEnabled()) {
            logger.trace("Received action '{}' on [{}]", action, this.logContext(resource));
        }
    }

    public void onClose() {
        logger.debug("Received close on [Type: {}]", this.getClass().getSimpleName());
    }

    public void onClose(WatcherException e) {
        logger.debug("Received close on [Type: {}] with exception", this.getClass().getSimpleName(), e);
    }

    protected String logContext(T resource) {
        if (resource == null || resource.getMetadata() == null) {
            return "Type: " + (resource == null ? "null" : resource.getClass().getSimpleName());
        }

        return String.join(
            ", ",
            "Type: " + resource.getClass().getSimpleName(),
            "Namespace: " + resource.getMetadata().getNamespace(),
            "Name: " + resource.getMetadata().getName(),
            "ResourceVersion: " + resource.getMetadata().getResourceVersion()
        );
    }
}
