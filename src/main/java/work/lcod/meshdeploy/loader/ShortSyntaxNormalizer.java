package work.lcod.meshdeploy.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import work.lcod.meshdeploy.model.Project;
import work.lcod.meshdeploy.model.ServiceDependency;
import work.lcod.meshdeploy.shared.ByteSizeParser;
import work.lcod.meshdeploy.shared.DurationParser;

/**
 * Rewrites short compose syntax into the long form the model binds, in place.
 * Mirrors what the upstream compose parser does before handing a project over.
 */
final class ShortSyntaxNormalizer {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final List<String> KEY_VALUE_MAPS = List.of("labels", "annotations", "storage_opt");
    private static final List<String> SCALAR_LISTS = List.of("dns", "dns_search", "dns_opt", "tmpfs", "profiles");
    private static final List<String> BYTE_SIZES = List.of("shm_size", "memswap_limit");
    private static final List<String> MICROSECOND_DURATIONS = List.of("cpu_rt_period", "cpu_rt_runtime");

    private ShortSyntaxNormalizer() {}

    static void normalizeService(ObjectNode service) {
        normalizeBuild(service);
        normalizeNetworks(service);
        normalizeDependsOn(service);
        normalizeLinks(service);
        normalizeServiceSecrets(service);
        normalizeExtraHosts(service);
        for (var key : KEY_VALUE_MAPS) {
            normalizeKeyValueList(service, key);
        }
        for (var key : SCALAR_LISTS) {
            wrapScalar(service, key);
        }
        for (var key : BYTE_SIZES) {
            normalizeByteSize(service, key);
        }
        for (var key : MICROSECOND_DURATIONS) {
            normalizeMicroseconds(service, key);
        }
    }

    static void normalizeSecretDefinition(ObjectNode secret) {
        var external = secret.get("external");
        if (external != null && external.isObject()) {
            secret.put("external", true);
        }
    }

    private static void normalizeBuild(ObjectNode service) {
        var build = service.get("build");
        if (build != null && build.isTextual()) {
            service.putObject("build").put("context", build.asText());
        }
    }

    private static void normalizeNetworks(ObjectNode service) {
        var networks = service.get("networks");
        if (networks != null && networks.isArray()) {
            var mapped = NODES.objectNode();
            for (var entry : networks) {
                mapped.putNull(entry.asText());
            }
            service.set("networks", mapped);
            return;
        }
        boolean hasNetworks = networks != null && networks.isObject() && networks.size() > 0;
        if (!hasNetworks && isBlank(service.get("network_mode"))) {
            service.putObject("networks").putNull(Project.DEFAULT_NETWORK);
        }
    }

    private static void normalizeDependsOn(ObjectNode service) {
        var dependsOn = service.get("depends_on");
        if (dependsOn == null || !dependsOn.isArray()) {
            return;
        }
        var mapped = NODES.objectNode();
        for (var entry : dependsOn) {
            mapped.set(entry.asText(), startedDependency());
        }
        service.set("depends_on", mapped);
    }

    // Each link also implies a start-order dependency on the linked service.
    private static void normalizeLinks(ObjectNode service) {
        var links = service.get("links");
        if (links == null || !links.isArray() || links.isEmpty()) {
            return;
        }
        var dependsOn = service.get("depends_on");
        ObjectNode target = dependsOn != null && dependsOn.isObject()
            ? (ObjectNode) dependsOn
            : service.putObject("depends_on");
        for (var link : links) {
            String raw = link.asText();
            int colon = raw.indexOf(':');
            String linked = colon >= 0 ? raw.substring(0, colon) : raw;
            if (!target.has(linked)) {
                target.set(linked, startedDependency());
            }
        }
    }

    private static void normalizeServiceSecrets(ObjectNode service) {
        var secrets = service.get("secrets");
        if (secrets == null || !secrets.isArray()) {
            return;
        }
        var mapped = NODES.arrayNode();
        for (var entry : secrets) {
            if (entry.isTextual()) {
                mapped.addObject().put("source", entry.asText());
                continue;
            }
            if (entry.isObject()) {
                var secret = ((ObjectNode) entry).deepCopy();
                var mode = secret.get("mode");
                if (mode != null && mode.isTextual()) {
                    secret.put("mode", parseFileMode(mode.asText()));
                }
                mapped.add(secret);
                continue;
            }
            throw new IllegalArgumentException("Invalid service secret entry: " + entry);
        }
        service.set("secrets", mapped);
    }

    private static void normalizeExtraHosts(ObjectNode service) {
        var hosts = service.get("extra_hosts");
        if (hosts == null || !hosts.isObject()) {
            return;
        }
        var mapped = NODES.arrayNode();
        for (Map.Entry<String, JsonNode> entry : hosts.properties()) {
            if (entry.getValue().isArray()) {
                for (var address : entry.getValue()) {
                    mapped.add(entry.getKey() + ":" + address.asText());
                }
            } else {
                mapped.add(entry.getKey() + ":" + entry.getValue().asText());
            }
        }
        service.set("extra_hosts", mapped);
    }

    private static void normalizeKeyValueList(ObjectNode service, String key) {
        var value = service.get(key);
        if (value == null || !value.isArray()) {
            return;
        }
        var mapped = NODES.objectNode();
        for (var entry : value) {
            String raw = entry.asText();
            int separator = raw.indexOf('=');
            if (separator >= 0) {
                mapped.put(raw.substring(0, separator), raw.substring(separator + 1));
            } else {
                mapped.put(raw, "");
            }
        }
        service.set(key, mapped);
    }

    private static void wrapScalar(ObjectNode service, String key) {
        var value = service.get(key);
        if (value != null && value.isTextual()) {
            ArrayNode wrapped = NODES.arrayNode();
            wrapped.add(value.asText());
            service.set(key, wrapped);
        }
    }

    private static void normalizeByteSize(ObjectNode service, String key) {
        var value = service.get(key);
        if (value != null && value.isTextual()) {
            service.put(key, ByteSizeParser.parse(value.asText()).orElse(0L));
        }
    }

    private static void normalizeMicroseconds(ObjectNode service, String key) {
        var value = service.get(key);
        if (value != null && value.isTextual()) {
            var duration = DurationParser.parse(value.asText());
            service.put(key, duration.map(d -> d.toNanos() / 1_000L).orElse(0L));
        }
    }

    private static int parseFileMode(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("0o") || trimmed.startsWith("0O")) {
            trimmed = trimmed.substring(2);
        }
        try {
            return Integer.parseInt(trimmed, 8);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid file mode: " + raw, ex);
        }
    }

    private static ObjectNode startedDependency() {
        var dependency = NODES.objectNode();
        dependency.put("condition", ServiceDependency.SERVICE_STARTED);
        dependency.put("restart", false);
        dependency.put("required", true);
        return dependency;
    }

    private static boolean isBlank(JsonNode node) {
        return node == null || node.isNull() || node.asText().isBlank();
    }
}
