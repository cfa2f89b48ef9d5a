package work.lcod.meshdeploy.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration bag of one service, as produced by the project loader.
 *
 * <p>Collections are never {@code null}. Optional blocks ({@code build}, {@code deploy}, {@code develop}, ...)
 * and unset strings are {@code null}. Settings the mesh runtime honors but this model does not read
 * (ports, volumes, environment, ...) are dropped while loading.
 */
@JsonDeserialize(builder = ServiceConfig.Builder.class)
public final class ServiceConfig {
    private final String name;
    private final String image;
    private final Map<String, Object> buildConfig;
    private final String containerName;
    private final Map<String, ServiceDependency> dependsOn;
    private final Map<String, ServiceNetworkConfig> networks;
    private final String networkMode;
    private final String restart;
    private final List<ServiceSecretConfig> secrets;
    private final List<String> profiles;
    private final List<String> links;
    private final List<String> externalLinks;
    private final List<String> volumesFrom;
    private final Map<String, Object> develop;
    private final String hostname;
    private final List<String> dns;
    private final List<String> dnsOpt;
    private final List<String> dnsSearch;
    private final List<String> extraHosts;
    private final List<String> securityOpt;
    private final String platform;
    private final String workingDir;
    private final List<String> tmpfs;
    private final boolean readOnly;
    private final long shmSize;
    private final String cpuset;
    private final long memswapLimit;
    private final String pid;
    private final String ipc;
    private final String uts;
    private final String usernsMode;
    private final String cgroupParent;
    private final String cgroup;
    private final String isolation;
    private final String runtime;
    private final String stopSignal;
    private final Duration stopGracePeriod;
    private final String macAddress;
    private final boolean tty;
    private final boolean stdinOpen;
    private final boolean oomKillDisable;
    private final long oomScoreAdj;
    private final long pidsLimit;
    private final Map<String, String> storageOpt;
    private final List<String> deviceCgroupRules;
    private final Map<String, Object> credentialSpec;
    private final List<String> groupAdd;
    private final Map<String, Object> blkioConfig;
    private final long cpuCount;
    private final double cpuPercent;
    private final long cpuPeriod;
    private final long cpuQuota;
    private final long cpuRtPeriod;
    private final long cpuRtRuntime;
    private final long cpuShares;
    private final long memSwappiness;
    private final String domainName;
    private final Boolean attach;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final Map<String, Object> extendsConfig;
    private final List<Map<String, Object>> postStart;
    private final List<Map<String, Object>> preStop;
    private final Map<String, Object> provider;
    private final Map<String, Object> models;
    private final String volumeDriver;
    private final boolean useApiSocket;
    private final String net;
    private final DeployConfig deploy;

    private ServiceConfig(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        this.image = builder.image;
        this.buildConfig = builder.buildConfig == null ? null : Copies.map(builder.buildConfig);
        this.containerName = builder.containerName;
        this.dependsOn = Copies.map(builder.dependsOn);
        this.networks = Copies.map(builder.networks);
        this.networkMode = builder.networkMode;
        this.restart = builder.restart;
        this.secrets = Copies.list(builder.secrets);
        this.profiles = Copies.list(builder.profiles);
        this.links = Copies.list(builder.links);
        this.externalLinks = Copies.list(builder.externalLinks);
        this.volumesFrom = Copies.list(builder.volumesFrom);
        this.develop = builder.develop == null ? null : Copies.map(builder.develop);
        this.hostname = builder.hostname;
        this.dns = Copies.list(builder.dns);
        this.dnsOpt = Copies.list(builder.dnsOpt);
        this.dnsSearch = Copies.list(builder.dnsSearch);
        this.extraHosts = Copies.list(builder.extraHosts);
        this.securityOpt = Copies.list(builder.securityOpt);
        this.platform = builder.platform;
        this.workingDir = builder.workingDir;
        this.tmpfs = Copies.list(builder.tmpfs);
        this.readOnly = builder.readOnly;
        this.shmSize = builder.shmSize;
        this.cpuset = builder.cpuset;
        this.memswapLimit = builder.memswapLimit;
        this.pid = builder.pid;
        this.ipc = builder.ipc;
        this.uts = builder.uts;
        this.usernsMode = builder.usernsMode;
        this.cgroupParent = builder.cgroupParent;
        this.cgroup = builder.cgroup;
        this.isolation = builder.isolation;
        this.runtime = builder.runtime;
        this.stopSignal = builder.stopSignal;
        this.stopGracePeriod = builder.stopGracePeriod;
        this.macAddress = builder.macAddress;
        this.tty = builder.tty;
        this.stdinOpen = builder.stdinOpen;
        this.oomKillDisable = builder.oomKillDisable;
        this.oomScoreAdj = builder.oomScoreAdj;
        this.pidsLimit = builder.pidsLimit;
        this.storageOpt = Copies.map(builder.storageOpt);
        this.deviceCgroupRules = Copies.list(builder.deviceCgroupRules);
        this.credentialSpec = builder.credentialSpec == null ? null : Copies.map(builder.credentialSpec);
        this.groupAdd = Copies.list(builder.groupAdd);
        this.blkioConfig = builder.blkioConfig == null ? null : Copies.map(builder.blkioConfig);
        this.cpuCount = builder.cpuCount;
        this.cpuPercent = builder.cpuPercent;
        this.cpuPeriod = builder.cpuPeriod;
        this.cpuQuota = builder.cpuQuota;
        this.cpuRtPeriod = builder.cpuRtPeriod;
        this.cpuRtRuntime = builder.cpuRtRuntime;
        this.cpuShares = builder.cpuShares;
        this.memSwappiness = builder.memSwappiness;
        this.domainName = builder.domainName;
        this.attach = builder.attach;
        this.labels = Copies.map(builder.labels);
        this.annotations = Copies.map(builder.annotations);
        this.extendsConfig = builder.extendsConfig == null ? null : Copies.map(builder.extendsConfig);
        this.postStart = Copies.list(builder.postStart);
        this.preStop = Copies.list(builder.preStop);
        this.provider = builder.provider == null ? null : Copies.map(builder.provider);
        this.models = Copies.map(builder.models);
        this.volumeDriver = builder.volumeDriver;
        this.useApiSocket = builder.useApiSocket;
        this.net = builder.net;
        this.deploy = builder.deploy;
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    public Builder toBuilder() {
        var builder = new Builder().name(name);
        builder.image = image;
        builder.buildConfig = buildConfig;
        builder.containerName = containerName;
        builder.dependsOn = dependsOn;
        builder.networks = networks;
        builder.networkMode = networkMode;
        builder.restart = restart;
        builder.secrets = secrets;
        builder.profiles = profiles;
        builder.links = links;
        builder.externalLinks = externalLinks;
        builder.volumesFrom = volumesFrom;
        builder.develop = develop;
        builder.hostname = hostname;
        builder.dns = dns;
        builder.dnsOpt = dnsOpt;
        builder.dnsSearch = dnsSearch;
        builder.extraHosts = extraHosts;
        builder.securityOpt = securityOpt;
        builder.platform = platform;
        builder.workingDir = workingDir;
        builder.tmpfs = tmpfs;
        builder.readOnly = readOnly;
        builder.shmSize = shmSize;
        builder.cpuset = cpuset;
        builder.memswapLimit = memswapLimit;
        builder.pid = pid;
        builder.ipc = ipc;
        builder.uts = uts;
        builder.usernsMode = usernsMode;
        builder.cgroupParent = cgroupParent;
        builder.cgroup = cgroup;
        builder.isolation = isolation;
        builder.runtime = runtime;
        builder.stopSignal = stopSignal;
        builder.stopGracePeriod = stopGracePeriod;
        builder.macAddress = macAddress;
        builder.tty = tty;
        builder.stdinOpen = stdinOpen;
        builder.oomKillDisable = oomKillDisable;
        builder.oomScoreAdj = oomScoreAdj;
        builder.pidsLimit = pidsLimit;
        builder.storageOpt = storageOpt;
        builder.deviceCgroupRules = deviceCgroupRules;
        builder.credentialSpec = credentialSpec;
        builder.groupAdd = groupAdd;
        builder.blkioConfig = blkioConfig;
        builder.cpuCount = cpuCount;
        builder.cpuPercent = cpuPercent;
        builder.cpuPeriod = cpuPeriod;
        builder.cpuQuota = cpuQuota;
        builder.cpuRtPeriod = cpuRtPeriod;
        builder.cpuRtRuntime = cpuRtRuntime;
        builder.cpuShares = cpuShares;
        builder.memSwappiness = memSwappiness;
        builder.domainName = domainName;
        builder.attach = attach;
        builder.labels = labels;
        builder.annotations = annotations;
        builder.extendsConfig = extendsConfig;
        builder.postStart = postStart;
        builder.preStop = preStop;
        builder.provider = provider;
        builder.models = models;
        builder.volumeDriver = volumeDriver;
        builder.useApiSocket = useApiSocket;
        builder.net = net;
        builder.deploy = deploy;
        return builder;
    }

    public String name() {
        return name;
    }

    public String image() {
        return image;
    }

    public Map<String, Object> buildConfig() {
        return buildConfig;
    }

    public String containerName() {
        return containerName;
    }

    public Map<String, ServiceDependency> dependsOn() {
        return dependsOn;
    }

    public Map<String, ServiceNetworkConfig> networks() {
        return networks;
    }

    public String networkMode() {
        return networkMode;
    }

    public String restart() {
        return restart;
    }

    public List<ServiceSecretConfig> secrets() {
        return secrets;
    }

    public List<String> profiles() {
        return profiles;
    }

    public List<String> links() {
        return links;
    }

    public List<String> externalLinks() {
        return externalLinks;
    }

    public List<String> volumesFrom() {
        return volumesFrom;
    }

    public Map<String, Object> develop() {
        return develop;
    }

    public String hostname() {
        return hostname;
    }

    public List<String> dns() {
        return dns;
    }

    public List<String> dnsOpt() {
        return dnsOpt;
    }

    public List<String> dnsSearch() {
        return dnsSearch;
    }

    public List<String> extraHosts() {
        return extraHosts;
    }

    public List<String> securityOpt() {
        return securityOpt;
    }

    public String platform() {
        return platform;
    }

    public String workingDir() {
        return workingDir;
    }

    public List<String> tmpfs() {
        return tmpfs;
    }

    public boolean readOnly() {
        return readOnly;
    }

    public long shmSize() {
        return shmSize;
    }

    public String cpuset() {
        return cpuset;
    }

    public long memswapLimit() {
        return memswapLimit;
    }

    public String pid() {
        return pid;
    }

    public String ipc() {
        return ipc;
    }

    public String uts() {
        return uts;
    }

    public String usernsMode() {
        return usernsMode;
    }

    public String cgroupParent() {
        return cgroupParent;
    }

    public String cgroup() {
        return cgroup;
    }

    public String isolation() {
        return isolation;
    }

    public String runtime() {
        return runtime;
    }

    public String stopSignal() {
        return stopSignal;
    }

    public Duration stopGracePeriod() {
        return stopGracePeriod;
    }

    public String macAddress() {
        return macAddress;
    }

    public boolean tty() {
        return tty;
    }

    public boolean stdinOpen() {
        return stdinOpen;
    }

    public boolean oomKillDisable() {
        return oomKillDisable;
    }

    public long oomScoreAdj() {
        return oomScoreAdj;
    }

    public long pidsLimit() {
        return pidsLimit;
    }

    public Map<String, String> storageOpt() {
        return storageOpt;
    }

    public List<String> deviceCgroupRules() {
        return deviceCgroupRules;
    }

    public Map<String, Object> credentialSpec() {
        return credentialSpec;
    }

    public List<String> groupAdd() {
        return groupAdd;
    }

    public Map<String, Object> blkioConfig() {
        return blkioConfig;
    }

    public long cpuCount() {
        return cpuCount;
    }

    public double cpuPercent() {
        return cpuPercent;
    }

    public long cpuPeriod() {
        return cpuPeriod;
    }

    public long cpuQuota() {
        return cpuQuota;
    }

    public long cpuRtPeriod() {
        return cpuRtPeriod;
    }

    public long cpuRtRuntime() {
        return cpuRtRuntime;
    }

    public long cpuShares() {
        return cpuShares;
    }

    public long memSwappiness() {
        return memSwappiness;
    }

    public String domainName() {
        return domainName;
    }

    public Boolean attach() {
        return attach;
    }

    public Map<String, String> labels() {
        return labels;
    }

    public Map<String, String> annotations() {
        return annotations;
    }

    public Map<String, Object> extendsConfig() {
        return extendsConfig;
    }

    public List<Map<String, Object>> postStart() {
        return postStart;
    }

    public List<Map<String, Object>> preStop() {
        return preStop;
    }

    public Map<String, Object> provider() {
        return provider;
    }

    public Map<String, Object> models() {
        return models;
    }

    public String volumeDriver() {
        return volumeDriver;
    }

    public boolean useApiSocket() {
        return useApiSocket;
    }

    public String net() {
        return net;
    }

    public DeployConfig deploy() {
        return deploy;
    }

    @Override
    public String toString() {
        return "ServiceConfig[" + name + "]";
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private String name;
        private String image;
        private Map<String, Object> buildConfig;
        private String containerName;
        private Map<String, ServiceDependency> dependsOn;
        private Map<String, ServiceNetworkConfig> networks;
        private String networkMode;
        private String restart;
        private List<ServiceSecretConfig> secrets;
        private List<String> profiles;
        private List<String> links;
        private List<String> externalLinks;
        private List<String> volumesFrom;
        private Map<String, Object> develop;
        private String hostname;
        private List<String> dns;
        private List<String> dnsOpt;
        private List<String> dnsSearch;
        private List<String> extraHosts;
        private List<String> securityOpt;
        private String platform;
        private String workingDir;
        private List<String> tmpfs;
        private boolean readOnly;
        private long shmSize;
        private String cpuset;
        private long memswapLimit;
        private String pid;
        private String ipc;
        private String uts;
        private String usernsMode;
        private String cgroupParent;
        private String cgroup;
        private String isolation;
        private String runtime;
        private String stopSignal;
        private Duration stopGracePeriod;
        private String macAddress;
        private boolean tty;
        private boolean stdinOpen;
        private boolean oomKillDisable;
        private long oomScoreAdj;
        private long pidsLimit;
        private Map<String, String> storageOpt;
        private List<String> deviceCgroupRules;
        private Map<String, Object> credentialSpec;
        private List<String> groupAdd;
        private Map<String, Object> blkioConfig;
        private long cpuCount;
        private double cpuPercent;
        private long cpuPeriod;
        private long cpuQuota;
        private long cpuRtPeriod;
        private long cpuRtRuntime;
        private long cpuShares;
        private long memSwappiness;
        private String domainName;
        private Boolean attach;
        private Map<String, String> labels;
        private Map<String, String> annotations;
        private Map<String, Object> extendsConfig;
        private List<Map<String, Object>> postStart;
        private List<Map<String, Object>> preStop;
        private Map<String, Object> provider;
        private Map<String, Object> models;
        private String volumeDriver;
        private boolean useApiSocket;
        private String net;
        private DeployConfig deploy;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        @JsonProperty("image")
        public Builder image(String image) {
            this.image = image;
            return this;
        }

        @JsonProperty("build")
        public Builder buildConfig(Map<String, Object> buildConfig) {
            this.buildConfig = buildConfig;
            return this;
        }

        @JsonProperty("container_name")
        public Builder containerName(String containerName) {
            this.containerName = containerName;
            return this;
        }

        @JsonProperty("depends_on")
        public Builder dependsOn(Map<String, ServiceDependency> dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        @JsonProperty("networks")
        public Builder networks(Map<String, ServiceNetworkConfig> networks) {
            this.networks = networks;
            return this;
        }

        @JsonProperty("network_mode")
        public Builder networkMode(String networkMode) {
            this.networkMode = networkMode;
            return this;
        }

        @JsonProperty("restart")
        public Builder restart(String restart) {
            this.restart = restart;
            return this;
        }

        @JsonProperty("secrets")
        public Builder secrets(List<ServiceSecretConfig> secrets) {
            this.secrets = secrets;
            return this;
        }

        @JsonProperty("profiles")
        public Builder profiles(List<String> profiles) {
            this.profiles = profiles;
            return this;
        }

        @JsonProperty("links")
        public Builder links(List<String> links) {
            this.links = links;
            return this;
        }

        @JsonProperty("external_links")
        public Builder externalLinks(List<String> externalLinks) {
            this.externalLinks = externalLinks;
            return this;
        }

        @JsonProperty("volumes_from")
        public Builder volumesFrom(List<String> volumesFrom) {
            this.volumesFrom = volumesFrom;
            return this;
        }

        @JsonProperty("develop")
        public Builder develop(Map<String, Object> develop) {
            this.develop = develop;
            return this;
        }

        @JsonProperty("hostname")
        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        @JsonProperty("dns")
        public Builder dns(List<String> dns) {
            this.dns = dns;
            return this;
        }

        @JsonProperty("dns_opt")
        public Builder dnsOpt(List<String> dnsOpt) {
            this.dnsOpt = dnsOpt;
            return this;
        }

        @JsonProperty("dns_search")
        public Builder dnsSearch(List<String> dnsSearch) {
            this.dnsSearch = dnsSearch;
            return this;
        }

        @JsonProperty("extra_hosts")
        public Builder extraHosts(List<String> extraHosts) {
            this.extraHosts = extraHosts;
            return this;
        }

        @JsonProperty("security_opt")
        public Builder securityOpt(List<String> securityOpt) {
            this.securityOpt = securityOpt;
            return this;
        }

        @JsonProperty("platform")
        public Builder platform(String platform) {
            this.platform = platform;
            return this;
        }

        @JsonProperty("working_dir")
        public Builder workingDir(String workingDir) {
            this.workingDir = workingDir;
            return this;
        }

        @JsonProperty("tmpfs")
        public Builder tmpfs(List<String> tmpfs) {
            this.tmpfs = tmpfs;
            return this;
        }

        @JsonProperty("read_only")
        public Builder readOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        @JsonProperty("shm_size")
        public Builder shmSize(long shmSize) {
            this.shmSize = shmSize;
            return this;
        }

        @JsonProperty("cpuset")
        public Builder cpuset(String cpuset) {
            this.cpuset = cpuset;
            return this;
        }

        @JsonProperty("memswap_limit")
        public Builder memswapLimit(long memswapLimit) {
            this.memswapLimit = memswapLimit;
            return this;
        }

        @JsonProperty("pid")
        public Builder pid(String pid) {
            this.pid = pid;
            return this;
        }

        @JsonProperty("ipc")
        public Builder ipc(String ipc) {
            this.ipc = ipc;
            return this;
        }

        @JsonProperty("uts")
        public Builder uts(String uts) {
            this.uts = uts;
            return this;
        }

        @JsonProperty("userns_mode")
        public Builder usernsMode(String usernsMode) {
            this.usernsMode = usernsMode;
            return this;
        }

        @JsonProperty("cgroup_parent")
        public Builder cgroupParent(String cgroupParent) {
            this.cgroupParent = cgroupParent;
            return this;
        }

        @JsonProperty("cgroup")
        public Builder cgroup(String cgroup) {
            this.cgroup = cgroup;
            return this;
        }

        @JsonProperty("isolation")
        public Builder isolation(String isolation) {
            this.isolation = isolation;
            return this;
        }

        @JsonProperty("runtime")
        public Builder runtime(String runtime) {
            this.runtime = runtime;
            return this;
        }

        @JsonProperty("stop_signal")
        public Builder stopSignal(String stopSignal) {
            this.stopSignal = stopSignal;
            return this;
        }

        @JsonProperty("stop_grace_period")
        public Builder stopGracePeriod(Duration stopGracePeriod) {
            this.stopGracePeriod = stopGracePeriod;
            return this;
        }

        @JsonProperty("mac_address")
        public Builder macAddress(String macAddress) {
            this.macAddress = macAddress;
            return this;
        }

        @JsonProperty("tty")
        public Builder tty(boolean tty) {
            this.tty = tty;
            return this;
        }

        @JsonProperty("stdin_open")
        public Builder stdinOpen(boolean stdinOpen) {
            this.stdinOpen = stdinOpen;
            return this;
        }

        @JsonProperty("oom_kill_disable")
        public Builder oomKillDisable(boolean oomKillDisable) {
            this.oomKillDisable = oomKillDisable;
            return this;
        }

        @JsonProperty("oom_score_adj")
        public Builder oomScoreAdj(long oomScoreAdj) {
            this.oomScoreAdj = oomScoreAdj;
            return this;
        }

        @JsonProperty("pids_limit")
        public Builder pidsLimit(long pidsLimit) {
            this.pidsLimit = pidsLimit;
            return this;
        }

        @JsonProperty("storage_opt")
        public Builder storageOpt(Map<String, String> storageOpt) {
            this.storageOpt = storageOpt;
            return this;
        }

        @JsonProperty("device_cgroup_rules")
        public Builder deviceCgroupRules(List<String> deviceCgroupRules) {
            this.deviceCgroupRules = deviceCgroupRules;
            return this;
        }

        @JsonProperty("credential_spec")
        public Builder credentialSpec(Map<String, Object> credentialSpec) {
            this.credentialSpec = credentialSpec;
            return this;
        }

        @JsonProperty("group_add")
        public Builder groupAdd(List<String> groupAdd) {
            this.groupAdd = groupAdd;
            return this;
        }

        @JsonProperty("blkio_config")
        public Builder blkioConfig(Map<String, Object> blkioConfig) {
            this.blkioConfig = blkioConfig;
            return this;
        }

        @JsonProperty("cpu_count")
        public Builder cpuCount(long cpuCount) {
            this.cpuCount = cpuCount;
            return this;
        }

        @JsonProperty("cpu_percent")
        public Builder cpuPercent(double cpuPercent) {
            this.cpuPercent = cpuPercent;
            return this;
        }

        @JsonProperty("cpu_period")
        public Builder cpuPeriod(long cpuPeriod) {
            this.cpuPeriod = cpuPeriod;
            return this;
        }

        @JsonProperty("cpu_quota")
        public Builder cpuQuota(long cpuQuota) {
            this.cpuQuota = cpuQuota;
            return this;
        }

        @JsonProperty("cpu_rt_period")
        public Builder cpuRtPeriod(long cpuRtPeriod) {
            this.cpuRtPeriod = cpuRtPeriod;
            return this;
        }

        @JsonProperty("cpu_rt_runtime")
        public Builder cpuRtRuntime(long cpuRtRuntime) {
            this.cpuRtRuntime = cpuRtRuntime;
            return this;
        }

        @JsonProperty("cpu_shares")
        public Builder cpuShares(long cpuShares) {
            this.cpuShares = cpuShares;
            return this;
        }

        @JsonProperty("mem_swappiness")
        public Builder memSwappiness(long memSwappiness) {
            this.memSwappiness = memSwappiness;
            return this;
        }

        @JsonProperty("domainname")
        public Builder domainName(String domainName) {
            this.domainName = domainName;
            return this;
        }

        @JsonProperty("attach")
        public Builder attach(Boolean attach) {
            this.attach = attach;
            return this;
        }

        @JsonProperty("labels")
        public Builder labels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        @JsonProperty("annotations")
        public Builder annotations(Map<String, String> annotations) {
            this.annotations = annotations;
            return this;
        }

        @JsonProperty("extends")
        public Builder extendsConfig(Map<String, Object> extendsConfig) {
            this.extendsConfig = extendsConfig;
            return this;
        }

        @JsonProperty("post_start")
        public Builder postStart(List<Map<String, Object>> postStart) {
            this.postStart = postStart;
            return this;
        }

        @JsonProperty("pre_stop")
        public Builder preStop(List<Map<String, Object>> preStop) {
            this.preStop = preStop;
            return this;
        }

        @JsonProperty("provider")
        public Builder provider(Map<String, Object> provider) {
            this.provider = provider;
            return this;
        }

        @JsonProperty("models")
        public Builder models(Map<String, Object> models) {
            this.models = models;
            return this;
        }

        @JsonProperty("volume_driver")
        public Builder volumeDriver(String volumeDriver) {
            this.volumeDriver = volumeDriver;
            return this;
        }

        @JsonProperty("use_api_socket")
        public Builder useApiSocket(boolean useApiSocket) {
            this.useApiSocket = useApiSocket;
            return this;
        }

        @JsonProperty("net")
        public Builder net(String net) {
            this.net = net;
            return this;
        }

        @JsonProperty("deploy")
        public Builder deploy(DeployConfig deploy) {
            this.deploy = deploy;
            return this;
        }

        public ServiceConfig build() {
            return new ServiceConfig(this);
        }
    }
}
