package com.hangar.lifecycle;

import com.hangar.config.HangarProperties;
import com.hangar.core.error.BootstrapTimeoutException;
import com.hangar.core.metrics.HangarMetrics;
import com.hangar.core.retry.RetryExhaustedException;
import com.hangar.core.retry.RetryPolicy;
import com.hangar.core.retry.Sleeper;
import com.hangar.runtime.ContainerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates (or resets) the PocketBase superuser inside a project container.
 *
 * <p>A freshly started container needs a few seconds before the binary
 * accepts commands, so {@link #bootstrap} polls under a {@link RetryPolicy}.
 */
@Component
public class AdminBootstrapper {

    private static final Logger log = LoggerFactory.getLogger(AdminBootstrapper.class);

    private final ContainerRuntime runtime;
    private final HangarProperties properties;
    private final HangarMetrics metrics;
    private final Sleeper sleeper;

    @Autowired
    public AdminBootstrapper(ContainerRuntime runtime, HangarProperties properties,
                             @Autowired(required = false) HangarMetrics metrics) {
        this(runtime, properties, metrics, Sleeper.THREAD);
    }

    public AdminBootstrapper(ContainerRuntime runtime, HangarProperties properties,
                             HangarMetrics metrics, Sleeper sleeper) {
        this.runtime = runtime;
        this.properties = properties;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    public RetryPolicy retryPolicy() {
        var bootstrap = properties.getBootstrap();
        return RetryPolicy.fixed(bootstrap.getMaxAttempts(), bootstrap.getDelay());
    }

    /**
     * Polls until the upsert succeeds.
     *
     * @throws BootstrapTimeoutException when the retry budget is spent
     */
    public void bootstrap(String containerName, String email, String password) {
        var policy = retryPolicy();
        var attempts = new AtomicInteger();
        try {
            policy.execute("Admin bootstrap in " + containerName, () -> {
                attempts.incrementAndGet();
                return runtime.execInContainer(containerName, upsertCommand(email, password));
            }, sleeper);
        } catch (RetryExhaustedException e) {
            if (metrics != null) metrics.recordBootstrap(false, e.getAttempts());
            throw new BootstrapTimeoutException(containerName, e.getAttempts(), e.getCause());
        }
        if (metrics != null) metrics.recordBootstrap(true, attempts.get());
        log.info("Superuser {} provisioned in {}", email, containerName);
    }

    /**
     * Single attempt against a container that is known to be up.
     */
    public void provision(String containerName, String email, String password) {
        runtime.execInContainer(containerName, upsertCommand(email, password));
        log.info("Superuser {} provisioned in {}", email, containerName);
    }

    List<String> upsertCommand(String email, String password) {
        var bootstrap = properties.getBootstrap();
        return List.of(bootstrap.getBinary(), "--dir", bootstrap.getDataMount(),
                "superuser", "upsert", email, password);
    }
}
