package work.lcod.meshdeploy.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.meshdeploy.model.Project;
import work.lcod.meshdeploy.model.SecretConfig;
import work.lcod.meshdeploy.model.ServiceConfig;

/**
 * Loads a compose project (YAML or JSON, long or short syntax) into the immutable {@link Project} model.
 * Variable interpolation, includes and profile filtering are expected to have happened upstream.
 */
public final class ProjectLoader {
    private static final Logger log = LoggerFactory.getLogger(ProjectLoader.class);
    private static final ObjectMapper YAML_MAPPER = createMapper();

    private ProjectLoader() {}

    public static Project loadFromFile(Path path) {
        return loadFromFile(path, LoadOptions.defaults());
    }

    public static Project loadFromFile(Path path, LoadOptions options) {
        Path absolute = path.toAbsolutePath().normalize();
        Path workingDirectory = options.workingDirectory()
            .map(dir -> dir.toAbsolutePath().normalize())
            .orElseGet(() -> absolute.getParent());
        try (var in = Files.newInputStream(absolute)) {
            var project = load(readTree(in), workingDirectory, options);
            log.debug("Loaded project '{}' with {} service(s) from {}", project.name(), project.services().size(), absolute);
            return project;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read project: " + absolute, ex);
        }
    }

    public static Project loadFromContent(String content, Path workingDirectory) {
        return loadFromContent(content, LoadOptions.defaults().withWorkingDirectory(workingDirectory));
    }

    public static Project loadFromContent(String content, LoadOptions options) {
        Path workingDirectory = options.workingDirectory()
            .orElseThrow(() -> new IllegalArgumentException("workingDirectory is required when loading from content"));
        try {
            return load(YAML_MAPPER.readTree(content), workingDirectory.toAbsolutePath().normalize(), options);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid project content: " + ex.getOriginalMessage(), ex);
        }
    }

    private static JsonNode readTree(InputStream in) throws IOException {
        try {
            return YAML_MAPPER.readTree(in);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid project content: " + ex.getOriginalMessage(), ex);
        }
    }

    private static Project load(JsonNode root, Path workingDirectory, LoadOptions options) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new IllegalArgumentException("Project file is empty");
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Project root must be a mapping");
        }
        String name = projectName(root, workingDirectory, options);
        var services = bindServices(root.get("services"));
        var secrets = bindSecrets(root.get("secrets"), options.environment());
        return new Project(name, services, secrets, workingDirectory);
    }

    private static String projectName(JsonNode root, Path workingDirectory, LoadOptions options) {
        String raw = options.projectName()
            .or(() -> textField(root, "name"))
            .orElseGet(() -> {
                Path fileName = workingDirectory.getFileName();
                return fileName == null ? "" : fileName.toString();
            });
        String normalized = normalizeProjectName(raw);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Project name is empty after normalization: '" + raw + "'");
        }
        return normalized;
    }

    static String normalizeProjectName(String raw) {
        var builder = new StringBuilder();
        for (char c : raw.toLowerCase(Locale.ROOT).toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-') {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    private static List<ServiceConfig> bindServices(JsonNode servicesNode) {
        var services = new ArrayList<ServiceConfig>();
        if (servicesNode == null || servicesNode.isNull()) {
            return services;
        }
        if (!servicesNode.isObject()) {
            throw new IllegalArgumentException("'services' must be a mapping");
        }
        for (Map.Entry<String, JsonNode> entry : servicesNode.properties()) {
            var serviceNode = asObject(entry.getKey(), entry.getValue(), "service");
            serviceNode.put("name", entry.getKey());
            ShortSyntaxNormalizer.normalizeService(serviceNode);
            services.add(bind(serviceNode, ServiceConfig.class, "service '" + entry.getKey() + "'"));
        }
        return services;
    }

    private static Map<String, SecretConfig> bindSecrets(JsonNode secretsNode, Map<String, String> environment) {
        var secrets = new LinkedHashMap<String, SecretConfig>();
        if (secretsNode == null || secretsNode.isNull()) {
            return secrets;
        }
        if (!secretsNode.isObject()) {
            throw new IllegalArgumentException("'secrets' must be a mapping");
        }
        for (Map.Entry<String, JsonNode> entry : secretsNode.properties()) {
            var secretNode = asObject(entry.getKey(), entry.getValue(), "secret");
            secretNode.put("name", entry.getKey());
            ShortSyntaxNormalizer.normalizeSecretDefinition(secretNode);
            var secret = bind(secretNode, SecretConfig.class, "secret '" + entry.getKey() + "'");
            secrets.put(entry.getKey(), fillFromEnvironment(secret, environment));
        }
        return secrets;
    }

    private static SecretConfig fillFromEnvironment(SecretConfig secret, Map<String, String> environment) {
        if (secret.environment() == null || secret.environment().isBlank() || secret.content() != null) {
            return secret;
        }
        String value = environment.get(secret.environment());
        if (value == null) {
            throw new IllegalArgumentException(
                "environment variable '" + secret.environment() + "' required by secret '" + secret.name() + "' is not set"
            );
        }
        return secret.withContent(value);
    }

    private static ObjectNode asObject(String key, JsonNode node, String kind) {
        if (node == null || node.isNull()) {
            return YAML_MAPPER.createObjectNode();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException(kind + " '" + key + "' must be a mapping");
        }
        return ((ObjectNode) node).deepCopy();
    }

    private static <T> T bind(ObjectNode node, Class<T> type, String description) {
        try {
            return YAML_MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid " + description + ": " + ex.getOriginalMessage(), ex);
        }
    }

    private static Optional<String> textField(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    private static ObjectMapper createMapper() {
        var module = new SimpleModule("mesh-deploy");
        module.addDeserializer(Duration.class, new DurationDeserializer());
        var mapper = new ObjectMapper(new YAMLFactory());
        mapper.registerModule(module);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        return mapper;
    }
}
