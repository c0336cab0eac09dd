package io.flowkube.kubernetes.runners;

import io.flowkube.kubernetes.models.Connection;
import io.flowkube.kubernetes.services.ClientService;
import io.flowkube.kubernetes.services.ClusterSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Per-invocation context handed to every operation: the operation logger and the way
 * cluster sessions are opened.
 */
public class RunContext {
    private final Logger logger;
    private final Function<Connection, ClusterSession> sessionFactory;

    public RunContext(Logger logger, Function<Connection, ClusterSession> sessionFactory) {
        this.logger = logger;
        this.sessionFactory = sessionFactory;
    }

    /**
     * A context logging under {@code flowkube.<operation>} and connecting through {@link ClientService}.
     */
    public static RunContext of(String operation) {
        return new RunContext(
            LoggerFactory.getLogger("flowkube." + operation),
            ClientService::session
        );
    }

    public Logger logger() {
        return logger;
    }

    /**
     * Opens a session, to be closed by the caller.
     */
    public ClusterSession session(Connection connection) {
        return sessionFactory.apply(connection);
    }
}
