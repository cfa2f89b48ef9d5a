package work.lcod.meshdeploy.compat;

import java.util.Collection;
import java.util.Map;
import work.lcod.meshdeploy.model.Project;
import work.lcod.meshdeploy.model.ServiceConfig;

/**
 * Service-level keys the mesh runtime does not honor.
 */
public final class ServiceRules {
    private ServiceRules() {}

    public static WarningCatalogue register(WarningCatalogue catalogue) {
        catalogue.register("build",
            "'build' is not supported. Pre-build images and specify 'image' instead.",
            (project, service) -> service.buildConfig() != null);
        catalogue.register("container_name",
            "'container_name' is not supported. Container names are generated automatically.",
            (project, service) -> isSet(service.containerName()));
        // links auto-populates depends_on upstream; the links warning already covers that case.
        catalogue.register("depends_on",
            "'depends_on' is not supported. Services start independently.",
            (project, service) -> !service.dependsOn().isEmpty() && service.links().isEmpty());
        catalogue.register("networks",
            "'networks' is not supported. Services share a flat mesh network with built-in service discovery.",
            ServiceRules::hasUserDefinedNetworks);
        catalogue.register("network_mode",
            "'network_mode' is not supported. Services share a flat mesh network.",
            (project, service) -> isSet(service.networkMode()) && !Project.DEFAULT_NETWORK.equals(service.networkMode()));
        catalogue.register("restart",
            "'restart' is not supported. Container lifecycle is managed automatically.",
            (project, service) -> isSet(service.restart()));
        catalogue.register("secrets",
            "'secrets' is not supported. Use environment variables or configs instead.",
            (project, service) -> !service.secrets().isEmpty());
        catalogue.register("profiles",
            "'profiles' is not supported. Specify services explicitly during deploy.",
            (project, service) -> !service.profiles().isEmpty());
        catalogue.register("links",
            "'links' is deprecated and not supported. Use service names for discovery.",
            (project, service) -> !service.links().isEmpty());
        catalogue.register("external_links",
            "'external_links' is deprecated and not supported.",
            (project, service) -> !service.externalLinks().isEmpty());
        catalogue.register("volumes_from",
            "'volumes_from' is not supported. Define volumes explicitly.",
            (project, service) -> !service.volumesFrom().isEmpty());
        catalogue.register("develop",
            "'develop' is not supported. This is a development-only feature.",
            (project, service) -> service.develop() != null);
        catalogue.register("hostname",
            "'hostname' is not supported. Use service name for DNS resolution.",
            (project, service) -> isSet(service.hostname()));
        catalogue.register("dns",
            "'dns' is not supported. The mesh provides built-in DNS.",
            (project, service) -> !service.dns().isEmpty());
        unsupported(catalogue, "dns_opt", (project, service) -> !service.dnsOpt().isEmpty());
        unsupported(catalogue, "dns_search", (project, service) -> !service.dnsSearch().isEmpty());
        unsupported(catalogue, "extra_hosts", (project, service) -> !service.extraHosts().isEmpty());
        unsupported(catalogue, "security_opt", (project, service) -> !service.securityOpt().isEmpty());
        unsupported(catalogue, "platform", (project, service) -> isSet(service.platform()));
        unsupported(catalogue, "working_dir", (project, service) -> isSet(service.workingDir()));
        catalogue.register("tmpfs",
            "'tmpfs' at service level is not supported. Use volumes with tmpfs type instead.",
            (project, service) -> !service.tmpfs().isEmpty());
        unsupported(catalogue, "read_only", (project, service) -> service.readOnly());
        unsupported(catalogue, "shm_size", (project, service) -> service.shmSize() > 0);
        unsupported(catalogue, "cpuset", (project, service) -> isSet(service.cpuset()));
        unsupported(catalogue, "memswap_limit", (project, service) -> service.memswapLimit() > 0);

        unsupported(catalogue, "pid", (project, service) -> isSet(service.pid()));
        unsupported(catalogue, "ipc", (project, service) -> isSet(service.ipc()));
        unsupported(catalogue, "uts", (project, service) -> isSet(service.uts()));
        unsupported(catalogue, "userns_mode", (project, service) -> isSet(service.usernsMode()));
        unsupported(catalogue, "cgroup_parent", (project, service) -> isSet(service.cgroupParent()));
        unsupported(catalogue, "cgroup", (project, service) -> isSet(service.cgroup()));
        unsupported(catalogue, "isolation", (project, service) -> isSet(service.isolation()));
        unsupported(catalogue, "runtime", (project, service) -> isSet(service.runtime()));
        unsupported(catalogue, "stop_signal", (project, service) -> isSet(service.stopSignal()));
        unsupported(catalogue, "stop_grace_period", (project, service) -> service.stopGracePeriod() != null);
        unsupported(catalogue, "mac_address", (project, service) -> isSet(service.macAddress()));
        unsupported(catalogue, "tty", (project, service) -> service.tty());
        unsupported(catalogue, "stdin_open", (project, service) -> service.stdinOpen());
        unsupported(catalogue, "oom_kill_disable", (project, service) -> service.oomKillDisable());
        unsupported(catalogue, "oom_score_adj", (project, service) -> service.oomScoreAdj() != 0);
        unsupported(catalogue, "pids_limit", (project, service) -> service.pidsLimit() != 0);
        unsupported(catalogue, "storage_opt", (project, service) -> !service.storageOpt().isEmpty());
        unsupported(catalogue, "device_cgroup_rules", (project, service) -> !service.deviceCgroupRules().isEmpty());
        unsupported(catalogue, "credential_spec", (project, service) -> service.credentialSpec() != null);
        unsupported(catalogue, "group_add", (project, service) -> !service.groupAdd().isEmpty());
        unsupported(catalogue, "blkio_config", (project, service) -> service.blkioConfig() != null);

        unsupported(catalogue, "cpu_count", (project, service) -> service.cpuCount() > 0);
        unsupported(catalogue, "cpu_percent", (project, service) -> service.cpuPercent() > 0);
        unsupported(catalogue, "cpu_period", (project, service) -> service.cpuPeriod() > 0);
        unsupported(catalogue, "cpu_quota", (project, service) -> service.cpuQuota() > 0);
        unsupported(catalogue, "cpu_rt_period", (project, service) -> service.cpuRtPeriod() > 0);
        unsupported(catalogue, "cpu_rt_runtime", (project, service) -> service.cpuRtRuntime() > 0);
        unsupported(catalogue, "cpu_shares", (project, service) -> service.cpuShares() != 0);
        unsupported(catalogue, "mem_swappiness", (project, service) -> service.memSwappiness() > 0);

        unsupported(catalogue, "domainname", (project, service) -> isSet(service.domainName()));
        unsupported(catalogue, "attach", (project, service) -> Boolean.FALSE.equals(service.attach()));
        catalogue.register("labels",
            "'labels' at service level is not supported.",
            (project, service) -> !service.labels().isEmpty());
        unsupported(catalogue, "annotations", (project, service) -> !service.annotations().isEmpty());
        unsupported(catalogue, "extends", (project, service) -> service.extendsConfig() != null);
        unsupported(catalogue, "post_start", (project, service) -> !service.postStart().isEmpty());
        unsupported(catalogue, "pre_stop", (project, service) -> !service.preStop().isEmpty());
        unsupported(catalogue, "provider", (project, service) -> service.provider() != null);
        unsupported(catalogue, "models", (project, service) -> !service.models().isEmpty());
        unsupported(catalogue, "volume_driver", (project, service) -> isSet(service.volumeDriver()));
        unsupported(catalogue, "use_api_socket", (project, service) -> service.useApiSocket());
        catalogue.register("net",
            "'net' is deprecated and not supported. Use 'network_mode' instead.",
            (project, service) -> isSet(service.net()));
        return catalogue;
    }

    /**
     * True when the service joins any network other than the implicit default one,
     * which is named either after the project or literally {@code default}.
     */
    static boolean hasUserDefinedNetworks(Project project, ServiceConfig service) {
        for (String network : service.networks().keySet()) {
            if (!network.equals(project.name()) && !Project.DEFAULT_NETWORK.equals(network)) {
                return true;
            }
        }
        return false;
    }

    static void unsupported(WarningCatalogue catalogue, String key, ServiceCheck check) {
        catalogue.register(key, "'" + key + "' is not supported.", check);
    }

    static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }

    static boolean isSet(Collection<?> values) {
        return values != null && !values.isEmpty();
    }

    static boolean isSet(Map<?, ?> values) {
        return values != null && !values.isEmpty();
    }
}
