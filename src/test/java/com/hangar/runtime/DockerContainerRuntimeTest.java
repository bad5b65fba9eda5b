package com.hangar.runtime;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.*;
import com.github.dockerjava.api.exception.DockerClientException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.*;
import com.hangar.config.HangarProperties;
import com.hangar.config.StorageLayout;
import com.hangar.core.error.ContainerOperationException;
import com.hangar.core.error.ExecFailedException;
import com.hangar.core.error.ImagePullFailedException;
import com.hangar.core.error.RuntimeUnavailableException;
import com.hangar.core.model.EnabledFeatures;
import com.hangar.core.model.ProjectConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DockerContainerRuntime.
 *
 * <p>docker-java commands are fluent builders; they are mocked with
 * {@code RETURNS_SELF} and each terminal {@code exec} is stubbed explicitly.
 */
class DockerContainerRuntimeTest {

    @TempDir
    Path root;

    private DockerClient dockerClient;
    private HangarProperties properties;
    private StorageLayout layout;
    private PortAllocator ports;
    private DockerContainerRuntime runtime;

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        properties = new HangarProperties();
        layout = new StorageLayout(root.resolve("data"), root.resolve("backups"));
        ports = new PortAllocator(8090, 65535);
        runtime = new DockerContainerRuntime(dockerClient, properties, layout, ports);
    }

    private static ProjectConfig config(String memory, String cpu) {
        return new ProjectConfig(memory, cpu, true, null, null, EnabledFeatures.allEnabled());
    }

    private CreateContainerCmd mockCreateContainerCmd(String containerId) {
        var createCmd = mock(CreateContainerCmd.class, RETURNS_SELF);
        var response = mock(CreateContainerResponse.class);
        when(response.getId()).thenReturn(containerId);
        when(createCmd.exec()).thenReturn(response);
        when(dockerClient.createContainerCmd(anyString())).thenReturn(createCmd);
        return createCmd;
    }

    private ListContainersCmd mockListContainers(List<Container> containers) {
        var listCmd = mock(ListContainersCmd.class, RETURNS_SELF);
        when(listCmd.exec()).thenReturn(containers);
        when(dockerClient.listContainersCmd()).thenReturn(listCmd);
        return listCmd;
    }

    // ── initialize ─────────────────────────────────────────────────────

    @Nested
    class Initialize {

        @BeforeEach
        void daemonUp() {
            when(dockerClient.pingCmd()).thenReturn(mock(PingCmd.class));
        }

        @Test
        void createsNetworkWhenOnlyASimilarNameExists() {
            var listNetworks = mock(ListNetworksCmd.class, RETURNS_SELF);
            var similar = mock(Network.class);
            when(similar.getName()).thenReturn("pocketbase-network-old");
            when(listNetworks.exec()).thenReturn(List.of(similar));
            when(dockerClient.listNetworksCmd()).thenReturn(listNetworks);
            var createNetwork = mock(CreateNetworkCmd.class, RETURNS_SELF);
            when(dockerClient.createNetworkCmd()).thenReturn(createNetwork);
            mockListContainers(List.of());

            runtime.initialize();

            verify(createNetwork).withName("pocketbase-network");
            verify(createNetwork).withDriver("bridge");
            verify(createNetwork).exec();
        }

        @Test
        void seedsPortAllocatorFromManagedContainers() {
            var listNetworks = mock(ListNetworksCmd.class, RETURNS_SELF);
            var existing = mock(Network.class);
            when(existing.getName()).thenReturn("pocketbase-network");
            when(listNetworks.exec()).thenReturn(List.of(existing));
            when(dockerClient.listNetworksCmd()).thenReturn(listNetworks);

            var published = mock(ContainerPort.class);
            when(published.getPublicPort()).thenReturn(8090);
            var container = mock(Container.class);
            when(container.getPorts()).thenReturn(new ContainerPort[]{published});
            var listCmd = mockListContainers(List.of(container));

            runtime.initialize();

            verify(dockerClient, never()).createNetworkCmd();
            verify(listCmd).withLabelFilter(Map.of(ContainerLabels.MANAGED, "true"));
            assertTrue(ports.isReserved(8090));
            assertEquals(8091, runtime.reservePort());
        }
    }

    @Test
    void reservationScansManagedContainersWhenStartupScanFailed() {
        var ping = mock(PingCmd.class);
        when(ping.exec()).thenThrow(new RuntimeException(new ConnectException("Connection refused")));
        when(dockerClient.pingCmd()).thenReturn(ping);
        assertThrows(RuntimeUnavailableException.class, runtime::initialize);

        var published = mock(ContainerPort.class);
        when(published.getPublicPort()).thenReturn(8090);
        var container = mock(Container.class);
        when(container.getPorts()).thenReturn(new ContainerPort[]{published});
        mockListContainers(List.of(container));

        assertEquals(8091, runtime.reservePort());
        assertEquals(8092, runtime.reservePort());
        verify(dockerClient, times(1)).listContainersCmd();
    }

    @Test
    void pingFailureIsRuntimeUnavailable() {
        var ping = mock(PingCmd.class);
        when(ping.exec()).thenThrow(new RuntimeException(new ConnectException("Connection refused")));
        when(dockerClient.pingCmd()).thenReturn(ping);

        assertThrows(RuntimeUnavailableException.class, runtime::ping);
    }

    // ── images ─────────────────────────────────────────────────────────

    @Test
    void failedPullFallsBackToLocalImage() {
        var pullCmd = mock(PullImageCmd.class, RETURNS_SELF);
        when(pullCmd.exec(any())).thenThrow(new DockerClientException("registry unreachable"));
        when(dockerClient.pullImageCmd("ghcr.io/muchobien/pocketbase")).thenReturn(pullCmd);
        when(dockerClient.inspectImageCmd("ghcr.io/muchobien/pocketbase:0.22.0"))
                .thenReturn(mock(InspectImageCmd.class));

        assertDoesNotThrow(() -> runtime.pullImage("ghcr.io/muchobien/pocketbase:0.22.0"));
        verify(pullCmd).withTag("0.22.0");
    }

    @Test
    void failedPullWithoutLocalImageThrows() {
        var pullCmd = mock(PullImageCmd.class, RETURNS_SELF);
        when(pullCmd.exec(any())).thenThrow(new DockerClientException("manifest unknown"));
        when(dockerClient.pullImageCmd(anyString())).thenReturn(pullCmd);
        var inspect = mock(InspectImageCmd.class);
        when(inspect.exec()).thenThrow(new NotFoundException("no such image"));
        when(dockerClient.inspectImageCmd("pocketbase:missing")).thenReturn(inspect);

        var ex = assertThrows(ImagePullFailedException.class, () -> runtime.pullImage("pocketbase:missing"));
        assertTrue(ex.getMessage().contains("manifest unknown"));
        verify(pullCmd).withTag("missing");
    }

    @Test
    void unreachableDaemonDuringLocalImageCheckIsRuntimeUnavailable() {
        var pullCmd = mock(PullImageCmd.class, RETURNS_SELF);
        when(pullCmd.exec(any())).thenThrow(new DockerClientException("registry unreachable"));
        when(dockerClient.pullImageCmd(anyString())).thenReturn(pullCmd);
        var inspect = mock(InspectImageCmd.class);
        when(inspect.exec()).thenThrow(new RuntimeException(new ConnectException("Connection refused")));
        when(dockerClient.inspectImageCmd("pocketbase:0.22.0")).thenReturn(inspect);

        assertThrows(RuntimeUnavailableException.class, () -> runtime.pullImage("pocketbase:0.22.0"));
    }

    @Test
    void failedLocalImageCheckFallsThroughToPullFailure() {
        var pullCmd = mock(PullImageCmd.class, RETURNS_SELF);
        when(pullCmd.exec(any())).thenThrow(new DockerClientException("manifest unknown"));
        when(dockerClient.pullImageCmd(anyString())).thenReturn(pullCmd);
        var inspect = mock(InspectImageCmd.class);
        when(inspect.exec()).thenThrow(new DockerClientException("unexpected response"));
        when(dockerClient.inspectImageCmd("pocketbase:0.22.0")).thenReturn(inspect);

        assertThrows(ImagePullFailedException.class, () -> runtime.pullImage("pocketbase:0.22.0"));
    }

    // ── containers ─────────────────────────────────────────────────────

    @Test
    void createContainerConfiguresMountsPortsLimitsAndLabels() {
        mockListContainers(List.of());
        var createCmd = mockCreateContainerCmd("c-123");

        var handle = runtime.createContainer("p1", "acme", config("512m", "1.5"));

        assertEquals("c-123", handle.containerId());
        assertEquals("pocketbase-acme", handle.containerName());
        assertEquals(8090, handle.port());
        assertTrue(Files.isDirectory(layout.projectSubdirectory("p1", "data")));
        assertTrue(Files.isDirectory(layout.projectSubdirectory("p1", "hooks")));

        verify(dockerClient).createContainerCmd("ghcr.io/muchobien/pocketbase:latest");
        verify(createCmd).withName("pocketbase-acme");
        verify(createCmd).withHostName("acme");

        var hostConfig = ArgumentCaptor.forClass(HostConfig.class);
        verify(createCmd).withHostConfig(hostConfig.capture());
        assertEquals(512L * 1024 * 1024, hostConfig.getValue().getMemory());
        assertEquals(1_500_000_000L, hostConfig.getValue().getNanoCPUs());
        assertEquals("pocketbase-network", hostConfig.getValue().getNetworkMode());
        assertEquals("unless-stopped", hostConfig.getValue().getRestartPolicy().getName());
        assertEquals(4, hostConfig.getValue().getBinds().length);
        var binding = hostConfig.getValue().getPortBindings().getBindings().get(ExposedPort.tcp(8080));
        assertEquals("8090", binding[0].getHostPortSpec());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> labels = ArgumentCaptor.forClass(Map.class);
        verify(createCmd).withLabels(labels.capture());
        assertEquals("p1", labels.getValue().get(ContainerLabels.PROJECT_ID));
        assertEquals("Host(`acme.localhost`)", labels.getValue().get("traefik.http.routers.acme.rule"));

        var env = ArgumentCaptor.forClass(String.class);
        verify(createCmd).withEnv(env.capture());
        assertTrue(env.getValue().matches("PB_ENCRYPTION_KEY=[A-Za-z0-9]{32}"));
    }

    @Test
    void consecutiveCreatesGetDistinctPorts() {
        mockListContainers(List.of());
        mockCreateContainerCmd("c-1");
        var first = runtime.createContainer("p1", "one", config("256m", "0.5"));
        var second = runtime.createContainer("p2", "two", config("256m", "0.5"));
        assertEquals(8090, first.port());
        assertEquals(8091, second.port());
    }

    @Test
    void startingARunningContainerIsANoOp() {
        var startCmd = mock(StartContainerCmd.class);
        when(startCmd.exec()).thenThrow(new NotModifiedException("already started"));
        when(dockerClient.startContainerCmd("pocketbase-acme")).thenReturn(startCmd);

        assertDoesNotThrow(() -> runtime.startContainer("pocketbase-acme"));
    }

    @Test
    void daemonErrorBecomesContainerOperationException() {
        var stopCmd = mock(StopContainerCmd.class);
        when(stopCmd.exec()).thenThrow(new NotFoundException("No such container: pocketbase-gone"));
        when(dockerClient.stopContainerCmd("pocketbase-gone")).thenReturn(stopCmd);

        var ex = assertThrows(ContainerOperationException.class, () -> runtime.stopContainer("pocketbase-gone"));
        assertTrue(ex.getMessage().startsWith("Failed to stop container pocketbase-gone"));
    }

    @Test
    void connectionFailureBecomesRuntimeUnavailable() {
        var restartCmd = mock(RestartContainerCmd.class);
        when(restartCmd.exec()).thenThrow(new RuntimeException(new ConnectException("Connection refused")));
        when(dockerClient.restartContainerCmd("pocketbase-acme")).thenReturn(restartCmd);

        assertThrows(RuntimeUnavailableException.class, () -> runtime.restartContainer("pocketbase-acme"));
    }

    @Test
    void removeForcesRemovalEvenWhenStopFails() {
        var stopCmd = mock(StopContainerCmd.class);
        when(stopCmd.exec()).thenThrow(new NotModifiedException("not running"));
        when(dockerClient.stopContainerCmd("pocketbase-acme")).thenReturn(stopCmd);
        var removeCmd = mock(RemoveContainerCmd.class, RETURNS_SELF);
        when(dockerClient.removeContainerCmd("pocketbase-acme")).thenReturn(removeCmd);

        runtime.removeContainer("pocketbase-acme");

        verify(removeCmd).withForce(true);
        verify(removeCmd).withRemoveVolumes(true);
        verify(removeCmd).exec();
    }

    @Test
    void missingContainerInfoIsEmpty() {
        var inspect = mock(InspectContainerCmd.class);
        when(inspect.exec()).thenThrow(new NotFoundException("No such container"));
        when(dockerClient.inspectContainerCmd("pocketbase-gone")).thenReturn(inspect);

        assertTrue(runtime.getContainerInfo("pocketbase-gone").isEmpty());
    }

    @Test
    void stoppedContainerInfoComesFromInspect() {
        var state = mock(InspectContainerResponse.ContainerState.class);
        when(state.getRunning()).thenReturn(false);
        when(state.getStatus()).thenReturn("exited");
        when(state.getStartedAt()).thenReturn("0001-01-01T00:00:00Z");
        var response = mock(InspectContainerResponse.class);
        when(response.getId()).thenReturn("c-123");
        when(response.getName()).thenReturn("/pocketbase-acme");
        when(response.getState()).thenReturn(state);
        when(response.getCreated()).thenReturn("2026-03-01T10:00:00Z");
        var inspect = mock(InspectContainerCmd.class);
        when(inspect.exec()).thenReturn(response);
        when(dockerClient.inspectContainerCmd("pocketbase-acme")).thenReturn(inspect);

        var info = runtime.getContainerInfo("pocketbase-acme").orElseThrow();

        assertEquals("pocketbase-acme", info.name());
        assertEquals("exited", info.status());
        assertFalse(info.running());
        assertNull(info.startedAt());
        assertEquals(0, info.memoryUsageBytes());
        verify(dockerClient, never()).statsCmd(anyString());
    }

    // ── exec ───────────────────────────────────────────────────────────

    private void mockExec(String containerName, long exitCode, Frame... frames) {
        var createCmd = mock(ExecCreateCmd.class, RETURNS_SELF);
        var created = mock(ExecCreateCmdResponse.class);
        when(created.getId()).thenReturn("exec-1");
        when(createCmd.exec()).thenReturn(created);
        when(dockerClient.execCreateCmd(containerName)).thenReturn(createCmd);

        var startCmd = mock(ExecStartCmd.class, RETURNS_SELF);
        when(startCmd.exec(any())).thenAnswer(invocation -> {
            ResultCallback.Adapter<Frame> callback = invocation.getArgument(0);
            for (Frame frame : frames) {
                callback.onNext(frame);
            }
            callback.onComplete();
            return callback;
        });
        when(dockerClient.execStartCmd("exec-1")).thenReturn(startCmd);

        var inspectCmd = mock(InspectExecCmd.class);
        var inspected = mock(InspectExecResponse.class);
        when(inspected.getExitCodeLong()).thenReturn(exitCode);
        when(inspectCmd.exec()).thenReturn(inspected);
        when(dockerClient.inspectExecCmd("exec-1")).thenReturn(inspectCmd);
    }

    @Test
    void execReturnsStdout() {
        mockExec("pocketbase-acme", 0,
                new Frame(StreamType.STDOUT, "Successfully saved superuser\n".getBytes(StandardCharsets.UTF_8)));

        String out = runtime.execInContainer("pocketbase-acme", List.of("pocketbase", "superuser", "upsert"));

        assertEquals("Successfully saved superuser\n", out);
    }

    @Test
    void nonZeroExitRaisesExecFailed() {
        mockExec("pocketbase-acme", 1,
                new Frame(StreamType.STDERR, "database is locked".getBytes(StandardCharsets.UTF_8)));

        var ex = assertThrows(ExecFailedException.class,
                () -> runtime.execInContainer("pocketbase-acme", List.of("pocketbase")));
        assertEquals(1, ex.getExitCode());
        assertTrue(ex.getOutput().contains("database is locked"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void logTimeoutReturnsPartialOutput() {
        properties.getDocker().setLogTimeoutSeconds(0);
        var logCmd = mock(LogContainerCmd.class, RETURNS_SELF);
        when(logCmd.exec(any())).thenAnswer(invocation -> {
            ResultCallback.Adapter<Frame> callback = invocation.getArgument(0);
            callback.onNext(new Frame(StreamType.STDOUT, "first line\n".getBytes(StandardCharsets.UTF_8)));
            return callback;
        });
        when(dockerClient.logContainerCmd("pocketbase-acme")).thenReturn(logCmd);

        assertEquals("first line\n", runtime.getContainerLogs("pocketbase-acme", 100));
        verify(logCmd).withTail(100);
    }

    @Test
    void containerNameUsesConfiguredPrefix() {
        properties.getDocker().setContainerPrefix("pb-");
        assertEquals("pb-acme", runtime.containerNameFor("acme"));
    }
}
