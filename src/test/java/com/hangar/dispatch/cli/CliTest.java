package com.hangar.dispatch.cli;

import com.hangar.core.error.ConflictException;
import com.hangar.core.error.ResourceNotFoundException;
import com.hangar.core.health.HealthCheckService;
import com.hangar.core.health.HealthStatus;
import com.hangar.core.model.*;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Constructor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * Exercises picocli directly without a Spring context: parsing, help output,
 * exit codes and what each command prints.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private ProjectOrchestrator orchestrator;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        orchestrator = mock(ProjectOrchestrator.class);
        healthCheckService = mock(HealthCheckService.class);
        when(orchestrator.urlOf(any())).thenAnswer(inv -> "http://localhost:" + inv.<Project>getArgument(0).getPort());
        when(orchestrator.adminUrlOf(any())).thenAnswer(inv -> "http://localhost:" + inv.<Project>getArgument(0).getPort() + "/_/");
    }

    /**
     * Builds commands with the mocked orchestrator, or the mocked health
     * service for {@link HealthCommand}.
     */
    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == HealthCommand.class) {
                    return cls.cast(new HealthCommand(healthCheckService));
                }
                for (Constructor<?> ctor : cls.getDeclaredConstructors()) {
                    if (ctor.getParameterCount() == 1 && ctor.getParameterTypes()[0] == ProjectOrchestrator.class) {
                        return cls.cast(ctor.newInstance(orchestrator));
                    }
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = CliRunner.commandLine(new HangarCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static Project project(String slug, ProjectStatus status, int port) {
        var p = new Project();
        p.setId("id-" + slug);
        p.setName(slug.toUpperCase());
        p.setSlug(slug);
        p.setStatus(status);
        p.setContainerName("pocketbase-" + slug);
        p.setPort(port);
        return p;
    }

    // =====================================================================
    //  Help output
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String name : List.of("create", "list", "info", "start", "stop", "restart", "delete", "logs",
                    "backup", "stats", "url", "credentials", "create-admin", "reconcile", "health", "serve")) {
                assertTrue(result.output().contains(name), "Help should list '" + name + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Hangar 0.1.0"));
        }

        @Test
        @DisplayName("No subcommand prints the banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("HANGAR v0.1.0"));
            assertTrue(result.output().contains("Usage: hangar"));
        }

        @Test
        @DisplayName("serve is left to the web server")
        void serveSkipsPicocli() throws Exception {
            var runner = new CliRunner(new HangarCommand(), factory());
            runner.run("serve");
            assertEquals(0, runner.getExitCode());
            verifyNoInteractions(orchestrator);
        }

        @Test
        @DisplayName("Missing required parameter is a usage error")
        void missingParameter() {
            CliResult result = execute("start");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
            verifyNoInteractions(orchestrator);
        }
    }

    // =====================================================================
    //  Project commands
    // =====================================================================

    @Nested
    @DisplayName("Project commands")
    class ProjectCommands {

        @Test
        @DisplayName("create passes options through and prints the URLs")
        void create() {
            when(orchestrator.create(any())).thenReturn(project("acme", ProjectStatus.RUNNING, 8090));

            CliResult result = execute("create", "Acme", "--client-email", "ops@acme.test", "--memory", "512m");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Project acme created"));
            assertTrue(result.output().contains("http://localhost:8090/_/"));
            verify(orchestrator).create(argThat(in -> "Acme".equals(in.name())
                    && "ops@acme.test".equals(in.clientEmail())
                    && "512m".equals(in.config().memoryLimit())
                    && in.config().cpuLimit() == null));
        }

        @Test
        @DisplayName("create without limits sends no overrides")
        void createWithoutLimits() {
            when(orchestrator.create(any())).thenReturn(project("acme", ProjectStatus.RUNNING, 8090));

            execute("create", "Acme");

            verify(orchestrator).create(argThat(in -> in.config() == null && in.slug() == null));
        }

        @Test
        @DisplayName("A failed command prints the error and exits 1")
        void failureExitCode() {
            when(orchestrator.create(any())).thenThrow(new ConflictException("Project with slug 'acme' already exists"));

            CliResult result = execute("create", "Acme");

            assertEquals(CliRunner.EXIT_FAILURE, result.exitCode());
            assertTrue(result.output().contains("Project with slug 'acme' already exists"));
        }

        @Test
        @DisplayName("list prints one row per project")
        void list() {
            when(orchestrator.list(any())).thenReturn(List.of(
                    project("alpha", ProjectStatus.RUNNING, 8090),
                    project("beta", ProjectStatus.STOPPED, 8091)));

            CliResult result = execute("ls", "--status", "RUNNING", "--limit", "10");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("alpha"));
            assertTrue(result.output().contains("http://localhost:8091"));
            assertTrue(result.output().contains("2 projects"));
            verify(orchestrator).list(argThat(q -> q.status() == ProjectStatus.RUNNING && q.limit() == 10));
        }

        @Test
        @DisplayName("list with nothing to show says so")
        void listEmpty() {
            when(orchestrator.list(any())).thenReturn(List.of());
            assertTrue(execute("list").output().contains("No projects found"));
        }

        @Test
        @DisplayName("url prints the bare URL")
        void url() {
            when(orchestrator.resolveUrl("acme")).thenReturn("http://localhost:8090");
            when(orchestrator.resolveAdminUrl("acme")).thenReturn("http://localhost:8090/_/");

            assertEquals("http://localhost:8090", execute("url", "acme").output().strip());
            assertEquals("http://localhost:8090/_/", execute("url", "acme", "--admin").output().strip());
        }

        @Test
        @DisplayName("Unknown project exits 1")
        void unknownProject() {
            when(orchestrator.start("ghost")).thenThrow(new ResourceNotFoundException("Project", "ghost"));

            CliResult result = execute("start", "ghost");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("ghost"));
        }

        @Test
        @DisplayName("stop reports the resulting status")
        void stop() {
            when(orchestrator.stop("acme")).thenReturn(project("acme", ProjectStatus.STOPPED, 8090));

            CliResult result = execute("stop", "acme");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("stopped"));
        }

        @Test
        @DisplayName("delete --keep-data keeps the data")
        void deleteKeepData() {
            when(orchestrator.get("acme")).thenReturn(project("acme", ProjectStatus.RUNNING, 8090));

            CliResult result = execute("rm", "acme", "--keep-data");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("data kept"));
            verify(orchestrator).delete("acme", true);
        }

        @Test
        @DisplayName("logs tails the requested number of lines")
        void logs() {
            when(orchestrator.logs("acme", 5)).thenReturn("a\nb\n");

            CliResult result = execute("logs", "acme", "-n", "5");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("a\nb"));
        }

        @Test
        @DisplayName("reconcile lists the corrections")
        void reconcile() {
            when(orchestrator.reconcile()).thenReturn(List.of(
                    new StatusCorrection("id-acme", "acme", ProjectStatus.RUNNING, ProjectStatus.ERROR)));

            CliResult result = execute("reconcile");

            assertTrue(result.output().contains("acme"));
            assertTrue(result.output().contains("1 project corrected"));
        }

        @Test
        @DisplayName("stats prints the totals")
        void stats() {
            when(orchestrator.stats()).thenReturn(new ProjectStats(3, 2, 1, 0, 2048, "2 KB", 0, "0 B"));

            CliResult result = execute("stats");

            assertTrue(result.output().contains("2 KB"));
        }
    }

    // =====================================================================
    //  Backup and credentials groups
    // =====================================================================

    @Nested
    @DisplayName("Backup and credentials")
    class GroupCommands {

        @Test
        @DisplayName("backup list prints each archive")
        void backupList() {
            when(orchestrator.listBackups("acme")).thenReturn(List.of(
                    new BackupRecord("acme-1", "id-acme", "acme-1.tar.gz", 1536, Instant.parse("2026-03-01T10:00:00Z"))));

            CliResult result = execute("backup", "list", "acme");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("acme-1.tar.gz"));
            assertTrue(result.output().contains("1.5 KB"));
        }

        @Test
        @DisplayName("backup restore passes project and filename")
        void backupRestore() {
            when(orchestrator.restoreBackup("acme", "acme-1.tar.gz")).thenReturn(project("acme", ProjectStatus.RUNNING, 8090));

            CliResult result = execute("backup", "restore", "acme", "acme-1.tar.gz");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Backup restored"));
        }

        @Test
        @DisplayName("A failing backup subcommand exits 1")
        void backupFailure() {
            when(orchestrator.createBackup("acme")).thenThrow(new ConflictException("Project acme is deleted"));

            CliResult result = execute("backup", "create", "acme");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Project acme is deleted"));
        }

        @Test
        @DisplayName("credentials export writes the report to a file")
        void exportToFile(@TempDir Path dir) throws Exception {
            when(orchestrator.exportCredentials()).thenReturn("# PocketBase Database Credentials\n");
            Path out = dir.resolve("creds.txt");

            CliResult result = execute("creds", "export", "-o", out.toString());

            assertEquals(0, result.exitCode());
            assertEquals("# PocketBase Database Credentials\n", Files.readString(out));
        }

        @Test
        @DisplayName("credentials show prints the admin identity")
        void show() {
            when(orchestrator.credentials("acme")).thenReturn(new Credentials("id-acme", "Acme", "acme",
                    "http://localhost:8090", "admin@acme.test", "s3cret-pass", Instant.EPOCH, Instant.EPOCH));
            when(orchestrator.resolveAdminUrl("acme")).thenReturn("http://localhost:8090/_/");

            CliResult result = execute("credentials", "show", "acme");

            assertTrue(result.output().contains("admin@acme.test"));
            assertTrue(result.output().contains("s3cret-pass"));
        }
    }

    // =====================================================================
    //  Health
    // =====================================================================

    @Nested
    @DisplayName("Health")
    class HealthTests {

        @Test
        @DisplayName("All components up exits 0")
        void healthy() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("docker", HealthStatus.Status.UP, "Docker daemon reachable", Map.of())));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("all systems operational"));
        }

        @Test
        @DisplayName("A down component exits 1")
        void down() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("docker", HealthStatus.Status.DOWN, "Cannot reach daemon", Map.of()),
                    new HealthStatus("storage", HealthStatus.Status.UP, "writable", Map.of())));

            CliResult result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Cannot reach daemon"));
        }
    }
}
