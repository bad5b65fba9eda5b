package com.hangar.runtime;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.DockerClientException;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.*;
import com.hangar.config.HangarProperties;
import com.hangar.config.StorageLayout;
import com.hangar.core.error.ContainerOperationException;
import com.hangar.core.error.ExecFailedException;
import com.hangar.core.error.ImagePullFailedException;
import com.hangar.core.error.RuntimeUnavailableException;
import com.hangar.core.error.StorageException;
import com.hangar.core.model.ContainerHandle;
import com.hangar.core.model.PortMapping;
import com.hangar.core.model.ProjectConfig;
import com.hangar.core.model.RuntimeContainerInfo;
import com.hangar.core.util.SecretGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Docker-backed {@link ContainerRuntime}.
 *
 * <p>Each project container is configured with:
 * <ul>
 *   <li>bind mounts from {@code projects/<id>/{data,public,migrations,hooks}} to
 *       {@code /pb_data}, {@code /pb_public}, {@code /pb_migrations}, {@code /pb_hooks}</li>
 *   <li>a published host port mapped to the container's HTTP port</li>
 *   <li>memory and CPU caps from the project config</li>
 *   <li>restart policy {@code unless-stopped}</li>
 *   <li>management and Traefik routing labels ({@link ContainerLabels})</li>
 *   <li>a random {@code PB_ENCRYPTION_KEY}</li>
 * </ul>
 *
 * <p>Daemon errors surface as {@link ContainerOperationException}; transport
 * failures (socket missing, connection refused) as {@link RuntimeUnavailableException}.
 */
public class DockerContainerRuntime implements ContainerRuntime {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerRuntime.class);

    private static final Map<String, String> MOUNT_POINTS = mountPoints();

    private static final int STATS_TIMEOUT_SECONDS = 5;

    private final DockerClient dockerClient;
    private final HangarProperties properties;
    private final StorageLayout layout;
    private final PortAllocator portAllocator;

    private volatile boolean portsSeeded;

    public DockerContainerRuntime(DockerClient dockerClient, HangarProperties properties,
                                  StorageLayout layout, PortAllocator portAllocator) {
        this.dockerClient = dockerClient;
        this.properties = properties;
        this.layout = layout;
        this.portAllocator = portAllocator;
    }

    private static Map<String, String> mountPoints() {
        var mounts = new LinkedHashMap<String, String>();
        mounts.put("data", "/pb_data");
        mounts.put("public", "/pb_public");
        mounts.put("migrations", "/pb_migrations");
        mounts.put("hooks", "/pb_hooks");
        return Collections.unmodifiableMap(mounts);
    }

    @Override
    public void initialize() {
        ping();
        ensureNetwork();
        int inUse = seedPorts();
        log.info("Container runtime ready: network {}, {} host ports already in use",
                properties.getDocker().getNetwork(), inUse);
    }

    /**
     * Marks the host ports published by managed containers as taken. A scan
     * that failed at startup is retried before the next reservation.
     *
     * @return number of published ports found
     */
    private synchronized int seedPorts() {
        var ports = new ArrayList<Integer>();
        try {
            for (Container container : listManagedContainers()) {
                if (container.getPorts() == null) continue;
                for (ContainerPort port : container.getPorts()) {
                    if (port.getPublicPort() != null) {
                        ports.add(port.getPublicPort());
                    }
                }
            }
        } catch (RuntimeException e) {
            throw translate(null, "list managed containers", e);
        }
        portAllocator.markInUse(ports);
        portsSeeded = true;
        return ports.size();
    }

    private int reserveSeededPort() {
        if (!portsSeeded) {
            log.info("Port reservations not yet seeded from managed containers, scanning now");
            seedPorts();
        }
        return portAllocator.reserve();
    }

    @Override
    public void ping() {
        try {
            dockerClient.pingCmd().exec();
        } catch (RuntimeException e) {
            throw new RuntimeUnavailableException(
                    "Cannot reach Docker daemon at " + properties.getDocker().getHost() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void ensureNetwork() {
        String network = properties.getDocker().getNetwork();
        try {
            // Docker's name filter is a substring match
            boolean exists = dockerClient.listNetworksCmd().withNameFilter(network).exec().stream()
                    .anyMatch(n -> network.equals(n.getName()));
            if (exists) {
                log.debug("Network {} already exists", network);
                return;
            }
            dockerClient.createNetworkCmd()
                    .withName(network)
                    .withDriver("bridge")
                    .withLabels(ContainerLabels.managedMarker())
                    .exec();
            log.info("Created network {}", network);
        } catch (RuntimeException e) {
            throw translate(null, "ensure network " + network, e);
        }
    }

    @Override
    public int reservePort() {
        return reserveSeededPort();
    }

    @Override
    public void markPortsInUse(Collection<Integer> ports) {
        portAllocator.markInUse(ports);
    }

    @Override
    public void pullImage(String imageRef) {
        String repository = imageRef;
        String tag = "latest";
        int colon = imageRef.lastIndexOf(':');
        if (colon > imageRef.lastIndexOf('/')) {
            repository = imageRef.substring(0, colon);
            tag = imageRef.substring(colon + 1);
        }

        log.info("Pulling image {}:{}", repository, tag);
        try {
            dockerClient.pullImageCmd(repository)
                    .withTag(tag)
                    .exec(new PullImageResultCallback() {
                        @Override
                        public void onNext(PullResponseItem item) {
                            if (item.getStatus() != null) {
                                log.debug("{}: {}", imageRef, item.getStatus());
                            }
                            super.onNext(item);
                        }
                    })
                    .awaitCompletion();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImagePullFailedException("Interrupted while pulling " + imageRef, e);
        } catch (DockerException | DockerClientException e) {
            if (isPresentLocally(imageRef)) {
                log.warn("Pull of {} failed ({}), using the local copy", imageRef, e.getMessage());
                return;
            }
            throw new ImagePullFailedException("Failed to pull image " + imageRef + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (isConnectionFailure(e)) {
                throw new RuntimeUnavailableException("Docker daemon unreachable while pulling " + imageRef, e);
            }
            throw new ImagePullFailedException("Failed to pull image " + imageRef + ": " + e.getMessage(), e);
        }
    }

    private boolean isPresentLocally(String imageRef) {
        try {
            dockerClient.inspectImageCmd(imageRef).exec();
            return true;
        } catch (NotFoundException e) {
            return false;
        } catch (RuntimeException e) {
            if (isConnectionFailure(e)) {
                throw new RuntimeUnavailableException("Docker daemon unreachable while inspecting " + imageRef, e);
            }
            log.debug("Inspecting local image {} failed: {}", imageRef, e.getMessage());
            return false;
        }
    }

    @Override
    public ContainerHandle createContainer(String projectId, String slug, ProjectConfig config) {
        var docker = properties.getDocker();
        String containerName = containerNameFor(slug);

        var binds = new ArrayList<Bind>();
        for (var mount : MOUNT_POINTS.entrySet()) {
            Path hostDir = layout.projectSubdirectory(projectId, mount.getKey());
            try {
                Files.createDirectories(hostDir);
            } catch (IOException e) {
                throw new StorageException("Cannot create project directory " + hostDir, e);
            }
            binds.add(new Bind(hostDir.toString(), new Volume(mount.getValue()), AccessMode.rw));
        }

        int port = reserveSeededPort();
        var exposed = ExposedPort.tcp(docker.getContainerPort());

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(binds.toArray(new Bind[0]))
                .withPortBindings(new PortBinding(Ports.Binding.bindPort(port), exposed))
                .withRestartPolicy(RestartPolicy.unlessStoppedRestart())
                .withMemory(ResourceLimits.memoryBytes(config.memoryLimit()))
                .withNanoCPUs(ResourceLimits.nanoCpus(config.cpuLimit()))
                .withNetworkMode(docker.getNetwork());

        log.info("Creating container {} for project {} on host port {}", containerName, projectId, port);
        try {
            var response = dockerClient.createContainerCmd(docker.getImage())
                    .withName(containerName)
                    .withHostName(slug)
                    .withLabels(ContainerLabels.forProject(projectId, slug,
                            properties.getDomain(), docker.getContainerPort()))
                    .withEnv("PB_ENCRYPTION_KEY=" + SecretGenerator.alphanumeric(32))
                    .withExposedPorts(exposed)
                    .withHostConfig(hostConfig)
                    .exec();
            return new ContainerHandle(response.getId(), containerName, port);
        } catch (RuntimeException e) {
            throw translate(containerName, "create", e);
        }
    }

    @Override
    public void startContainer(String containerName) {
        try {
            dockerClient.startContainerCmd(containerName).exec();
            log.info("Started container {}", containerName);
        } catch (NotModifiedException e) {
            log.debug("Container {} is already running", containerName);
        } catch (RuntimeException e) {
            throw translate(containerName, "start", e);
        }
    }

    @Override
    public void stopContainer(String containerName) {
        try {
            dockerClient.stopContainerCmd(containerName).exec();
            log.info("Stopped container {}", containerName);
        } catch (NotModifiedException e) {
            log.debug("Container {} is already stopped", containerName);
        } catch (RuntimeException e) {
            throw translate(containerName, "stop", e);
        }
    }

    @Override
    public void restartContainer(String containerName) {
        try {
            dockerClient.restartContainerCmd(containerName).exec();
            log.info("Restarted container {}", containerName);
        } catch (RuntimeException e) {
            throw translate(containerName, "restart", e);
        }
    }

    @Override
    public void removeContainer(String containerName) {
        try {
            dockerClient.stopContainerCmd(containerName).exec();
        } catch (Exception e) {
            log.debug("Container {} may already be stopped: {}", containerName, e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(containerName)
                    .withForce(true)
                    .withRemoveVolumes(true)
                    .exec();
            log.info("Removed container {}", containerName);
        } catch (RuntimeException e) {
            throw translate(containerName, "remove", e);
        }
    }

    @Override
    public Optional<RuntimeContainerInfo> getContainerInfo(String containerName) {
        InspectContainerResponse inspect;
        try {
            inspect = dockerClient.inspectContainerCmd(containerName).exec();
        } catch (NotFoundException e) {
            return Optional.empty();
        } catch (RuntimeException e) {
            throw translate(containerName, "inspect", e);
        }

        var state = inspect.getState();
        boolean running = state != null && Boolean.TRUE.equals(state.getRunning());
        String status = state != null && state.getStatus() != null ? state.getStatus() : "unknown";

        long memory = 0;
        double cpu = 0;
        if (running) {
            Statistics stats = readStats(containerName);
            if (stats != null) {
                memory = memoryUsage(stats);
                cpu = cpuPercent(stats);
            }
        }

        return Optional.of(new RuntimeContainerInfo(
                inspect.getId(),
                stripSlash(inspect.getName()),
                status,
                running,
                portMappings(inspect),
                parseInstant(inspect.getCreated()),
                state != null ? parseInstant(state.getStartedAt()) : null,
                memory,
                cpu));
    }

    /**
     * Point-in-time stats snapshot; null when the daemon does not answer in time.
     */
    private Statistics readStats(String containerName) {
        var latest = new AtomicReference<Statistics>();
        try {
            dockerClient.statsCmd(containerName)
                    .withNoStream(true)
                    .exec(new ResultCallback.Adapter<Statistics>() {
                        @Override
                        public void onNext(Statistics statistics) {
                            latest.compareAndSet(null, statistics);
                        }
                    })
                    .awaitCompletion(STATS_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while reading stats for {}", containerName);
        } catch (Exception e) {
            log.debug("Stats unavailable for {}: {}", containerName, e.getMessage());
        }
        return latest.get();
    }

    private static long memoryUsage(Statistics stats) {
        var memory = stats.getMemoryStats();
        return memory != null && memory.getUsage() != null ? memory.getUsage() : 0;
    }

    private static double cpuPercent(Statistics stats) {
        var cpu = stats.getCpuStats();
        var preCpu = stats.getPreCpuStats();
        if (cpu == null || preCpu == null || cpu.getCpuUsage() == null || preCpu.getCpuUsage() == null) {
            return 0;
        }
        long cpuDelta = nullToZero(cpu.getCpuUsage().getTotalUsage()) - nullToZero(preCpu.getCpuUsage().getTotalUsage());
        long systemDelta = nullToZero(cpu.getSystemCpuUsage()) - nullToZero(preCpu.getSystemCpuUsage());
        long onlineCpus = cpu.getOnlineCpus() != null && cpu.getOnlineCpus() > 0 ? cpu.getOnlineCpus() : 1;
        if (cpuDelta <= 0 || systemDelta <= 0) {
            return 0;
        }
        return (double) cpuDelta / systemDelta * onlineCpus * 100.0;
    }

    private static long nullToZero(Long value) {
        return value != null ? value : 0;
    }

    private static List<PortMapping> portMappings(InspectContainerResponse inspect) {
        Ports ports = inspect.getNetworkSettings() != null ? inspect.getNetworkSettings().getPorts() : null;
        if ((ports == null || ports.getBindings().isEmpty()) && inspect.getHostConfig() != null) {
            // Stopped containers only carry the requested bindings
            ports = inspect.getHostConfig().getPortBindings();
        }
        if (ports == null) {
            return List.of();
        }
        var mappings = new ArrayList<PortMapping>();
        for (var entry : ports.getBindings().entrySet()) {
            if (entry.getValue() == null) continue;
            for (Ports.Binding binding : entry.getValue()) {
                try {
                    mappings.add(new PortMapping(Integer.parseInt(binding.getHostPortSpec()),
                            entry.getKey().getPort()));
                } catch (NumberFormatException e) {
                    log.debug("Skipping non-numeric host port {}", binding.getHostPortSpec());
                }
            }
        }
        return mappings;
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank() || value.startsWith("0001-01-01")) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String stripSlash(String name) {
        return name != null && name.startsWith("/") ? name.substring(1) : name;
    }

    @Override
    public String getContainerLogs(String containerName, int tailLines) {
        var sb = new StringBuilder();
        try {
            boolean completed = dockerClient.logContainerCmd(containerName)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withTimestamps(true)
                    .withTail(tailLines)
                    .withFollowStream(false)
                    .exec(new ResultCallback.Adapter<Frame>() {
                        @Override
                        public void onNext(Frame frame) {
                            sb.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                        }
                    }).awaitCompletion(properties.getDocker().getLogTimeoutSeconds(), TimeUnit.SECONDS);
            if (!completed) {
                log.warn("Reading logs from {} timed out after {}s, returning partial output",
                        containerName, properties.getDocker().getLogTimeoutSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while reading logs from {}", containerName);
        } catch (RuntimeException e) {
            throw translate(containerName, "read logs of", e);
        }
        return sb.toString();
    }

    @Override
    public List<RuntimeContainerInfo> listManaged() {
        List<Container> containers;
        try {
            containers = listManagedContainers();
        } catch (RuntimeException e) {
            throw translate(null, "list managed containers", e);
        }
        var result = new ArrayList<RuntimeContainerInfo>();
        for (Container container : containers) {
            String name = container.getNames() != null && container.getNames().length > 0
                    ? stripSlash(container.getNames()[0])
                    : container.getId();
            getContainerInfo(name).ifPresent(result::add);
        }
        return result;
    }

    private List<Container> listManagedContainers() {
        return dockerClient.listContainersCmd()
                .withShowAll(true)
                .withLabelFilter(ContainerLabels.managedMarker())
                .exec();
    }

    @Override
    public String execInContainer(String containerName, List<String> command) {
        var stdout = new StringBuilder();
        var stderr = new StringBuilder();
        Long exitCode;
        try {
            var exec = dockerClient.execCreateCmd(containerName)
                    .withCmd(command.toArray(new String[0]))
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .exec();

            boolean finished = dockerClient.execStartCmd(exec.getId())
                    .exec(new ResultCallback.Adapter<Frame>() {
                        @Override
                        public void onNext(Frame frame) {
                            String chunk = new String(frame.getPayload(), StandardCharsets.UTF_8);
                            if (frame.getStreamType() == StreamType.STDERR) {
                                stderr.append(chunk);
                            } else {
                                stdout.append(chunk);
                            }
                        }
                    })
                    .awaitCompletion(properties.getDocker().getExecTimeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                throw new ContainerOperationException(containerName,
                        "Command in " + containerName + " did not finish within "
                                + properties.getDocker().getExecTimeoutSeconds() + "s");
            }
            exitCode = dockerClient.inspectExecCmd(exec.getId()).exec().getExitCodeLong();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerOperationException(containerName, "Interrupted while executing in " + containerName, e);
        } catch (ContainerOperationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(containerName, "execute in", e);
        }

        if (exitCode != null && exitCode != 0) {
            throw new ExecFailedException(containerName, exitCode, stdout.toString() + stderr);
        }
        return stdout.toString();
    }

    @Override
    public String containerNameFor(String slug) {
        return properties.getDocker().getContainerPrefix() + slug;
    }

    private RuntimeException translate(String containerName, String action, RuntimeException e) {
        if (!(e instanceof DockerException) && isConnectionFailure(e)) {
            return new RuntimeUnavailableException(
                    "Docker daemon unreachable while trying to " + action
                            + (containerName != null ? " " + containerName : ""), e);
        }
        String target = containerName != null ? " container " + containerName : "";
        return new ContainerOperationException(containerName,
                "Failed to " + action + target + ": " + e.getMessage(), e);
    }

    /**
     * True when the failure chain contains an I/O error, i.e. the daemon never answered.
     */
    static boolean isConnectionFailure(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof IOException) {
                return true;
            }
            if (t.getCause() == t) break;
        }
        return false;
    }
}
