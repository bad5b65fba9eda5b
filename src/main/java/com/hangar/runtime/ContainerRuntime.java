package com.hangar.runtime;

import com.hangar.core.model.ContainerHandle;
import com.hangar.core.model.ProjectConfig;
import com.hangar.core.model.RuntimeContainerInfo;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Abstraction over the container runtime that hosts project databases.
 * Implementation: {@link DockerContainerRuntime}.
 *
 * <p>Owns network existence, image availability, container CRUD and the
 * host-port reservation set. Instances are stateful: the reservation set
 * lives for the lifetime of the process and is never shared with another
 * orchestrator process.
 */
public interface ContainerRuntime {

    /**
     * Verifies connectivity, ensures the managed network exists and seeds the
     * port reservation set from existing managed containers.
     */
    void initialize();

    /**
     * @throws com.hangar.core.error.RuntimeUnavailableException when the daemon cannot be reached
     */
    void ping();

    /**
     * Creates the isolated network for managed containers if it is absent. Idempotent.
     */
    void ensureNetwork();

    /**
     * Reserves the lowest free host port at or above the base port. If the
     * startup scan of managed containers did not complete, it is repeated first.
     */
    int reservePort();

    /**
     * Adds ports that are known to be taken (e.g. recorded in the catalog) to
     * the reservation set.
     */
    void markPortsInUse(Collection<Integer> ports);

    /**
     * Makes sure {@code imageRef} is available locally.
     *
     * @throws com.hangar.core.error.RuntimeUnavailableException when the daemon cannot be reached
     * @throws com.hangar.core.error.ImagePullFailedException    when the pull fails otherwise
     */
    void pullImage(String imageRef);

    /**
     * Creates the project's host directories and a (stopped) container bound
     * to them, to a freshly reserved port, resource limits and proxy labels.
     */
    ContainerHandle createContainer(String projectId, String slug, ProjectConfig config);

    void startContainer(String containerName);

    void stopContainer(String containerName);

    void restartContainer(String containerName);

    /**
     * Stops the container if it is running (ignoring failures), then force-removes
     * it together with its anonymous volumes.
     */
    void removeContainer(String containerName);

    /**
     * @return the live view of the container, or empty if it does not exist
     */
    Optional<RuntimeContainerInfo> getContainerInfo(String containerName);

    String getContainerLogs(String containerName, int tailLines);

    /**
     * Lists every container carrying the management label.
     */
    List<RuntimeContainerInfo> listManaged();

    /**
     * Runs a command inside a running container.
     *
     * @return captured stdout
     * @throws com.hangar.core.error.ExecFailedException on a non-zero exit code
     */
    String execInContainer(String containerName, List<String> command);

    /**
     * Container name for a slug. Pure function; equal slugs give equal names.
     */
    String containerNameFor(String slug);
}
