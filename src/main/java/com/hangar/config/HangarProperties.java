package com.hangar.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * All Hangar settings, bound from {@code hangar.*}.
 * Defaults match a single-host PocketBase fleet on a local Docker daemon.
 */
@Component
@ConfigurationProperties(prefix = "hangar")
public class HangarProperties {

    private Docker docker = new Docker();
    private Storage storage = new Storage();
    private Domain domain = new Domain();
    private Defaults defaults = new Defaults();
    private Bootstrap bootstrap = new Bootstrap();
    private boolean reconcileOnStartup = true;

    public Docker getDocker() { return docker; }
    public void setDocker(Docker docker) { this.docker = docker; }
    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }
    public Domain getDomain() { return domain; }
    public void setDomain(Domain domain) { this.domain = domain; }
    public Defaults getDefaults() { return defaults; }
    public void setDefaults(Defaults defaults) { this.defaults = defaults; }
    public Bootstrap getBootstrap() { return bootstrap; }
    public void setBootstrap(Bootstrap bootstrap) { this.bootstrap = bootstrap; }
    public boolean isReconcileOnStartup() { return reconcileOnStartup; }
    public void setReconcileOnStartup(boolean reconcileOnStartup) { this.reconcileOnStartup = reconcileOnStartup; }

    /**
     * Returns true when projects are published under a real domain rather than
     * plain localhost ports.
     */
    public boolean hasPublicDomain() {
        return domain.baseDomain != null
                && !domain.baseDomain.isBlank()
                && !"localhost".equalsIgnoreCase(domain.baseDomain);
    }

    public static class Docker {
        private String host = "unix:///var/run/docker.sock";
        private String image = "ghcr.io/muchobien/pocketbase:latest";
        private String network = "pocketbase-network";
        private String containerPrefix = "pocketbase-";
        private int containerPort = 8080;
        private int basePort = 8090;
        private int maxPort = 65535;
        private int logTimeoutSeconds = 30;
        private int execTimeoutSeconds = 60;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public String getNetwork() { return network; }
        public void setNetwork(String network) { this.network = network; }
        public String getContainerPrefix() { return containerPrefix; }
        public void setContainerPrefix(String containerPrefix) { this.containerPrefix = containerPrefix; }
        public int getContainerPort() { return containerPort; }
        public void setContainerPort(int containerPort) { this.containerPort = containerPort; }
        public int getBasePort() { return basePort; }
        public void setBasePort(int basePort) { this.basePort = basePort; }
        public int getMaxPort() { return maxPort; }
        public void setMaxPort(int maxPort) { this.maxPort = maxPort; }
        public int getLogTimeoutSeconds() { return logTimeoutSeconds; }
        public void setLogTimeoutSeconds(int logTimeoutSeconds) { this.logTimeoutSeconds = logTimeoutSeconds; }
        public int getExecTimeoutSeconds() { return execTimeoutSeconds; }
        public void setExecTimeoutSeconds(int execTimeoutSeconds) { this.execTimeoutSeconds = execTimeoutSeconds; }
    }

    public static class Storage {
        private String dataDir = "./data";
        private String backupsDir = "./backups";

        public String getDataDir() { return dataDir; }
        public void setDataDir(String dataDir) { this.dataDir = dataDir; }
        public String getBackupsDir() { return backupsDir; }
        public void setBackupsDir(String backupsDir) { this.backupsDir = backupsDir; }
    }

    public static class Domain {
        private String baseDomain = "localhost";
        private boolean useHttps = false;
        private String certResolver = "letsencrypt";

        public String getBaseDomain() { return baseDomain; }
        public void setBaseDomain(String baseDomain) { this.baseDomain = baseDomain; }
        public boolean isUseHttps() { return useHttps; }
        public void setUseHttps(boolean useHttps) { this.useHttps = useHttps; }
        public String getCertResolver() { return certResolver; }
        public void setCertResolver(String certResolver) { this.certResolver = certResolver; }
    }

    public static class Defaults {
        private String memoryLimit = "256m";
        private String cpuLimit = "0.5";
        private boolean autoBackup = true;

        public String getMemoryLimit() { return memoryLimit; }
        public void setMemoryLimit(String memoryLimit) { this.memoryLimit = memoryLimit; }
        public String getCpuLimit() { return cpuLimit; }
        public void setCpuLimit(String cpuLimit) { this.cpuLimit = cpuLimit; }
        public boolean isAutoBackup() { return autoBackup; }
        public void setAutoBackup(boolean autoBackup) { this.autoBackup = autoBackup; }
    }

    public static class Bootstrap {
        private boolean enabled = true;
        private int maxAttempts = 10;
        private Duration delay = Duration.ofSeconds(3);
        private String adminEmail = "admin@localhost.test";
        private String binary = "/usr/local/bin/pocketbase";
        private String dataMount = "/pb_data";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getDelay() { return delay; }
        public void setDelay(Duration delay) { this.delay = delay; }
        public String getAdminEmail() { return adminEmail; }
        public void setAdminEmail(String adminEmail) { this.adminEmail = adminEmail; }
        public String getBinary() { return binary; }
        public void setBinary(String binary) { this.binary = binary; }
        public String getDataMount() { return dataMount; }
        public void setDataMount(String dataMount) { this.dataMount = dataMount; }
    }
}
