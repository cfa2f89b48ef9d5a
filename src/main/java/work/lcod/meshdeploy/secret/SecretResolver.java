package work.lcod.meshdeploy.secret;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.meshdeploy.model.Project;
import work.lcod.meshdeploy.model.SecretConfig;
import work.lcod.meshdeploy.model.SecretSource;
import work.lcod.meshdeploy.model.ServiceConfig;
import work.lcod.meshdeploy.model.ServiceSecretConfig;

/**
 * Turns a service's secret references into secret specs and container mounts.
 *
 * <p>All or nothing: the first failing reference aborts the call and nothing is returned.
 * The same secret referenced twice yields two specs; de-duplication is left to the caller.
 */
public final class SecretResolver {
    public static final String DEFAULT_MOUNT_DIRECTORY = "/run/secrets/";

    private static final Logger log = LoggerFactory.getLogger(SecretResolver.class);

    public SecretResolution resolve(Project project, ServiceConfig service) {
        return resolve(project.secrets(), service.secrets(), project.workingDirectory());
    }

    public SecretResolution resolve(
        Map<String, SecretConfig> definitions,
        List<ServiceSecretConfig> references,
        Path workingDirectory
    ) {
        Objects.requireNonNull(definitions, "definitions");
        Objects.requireNonNull(references, "references");
        Objects.requireNonNull(workingDirectory, "workingDirectory");

        var specs = new ArrayList<SecretSpec>(references.size());
        var mounts = new ArrayList<SecretMount>(references.size());
        for (var reference : references) {
            var definition = lookup(definitions, reference.source());
            specs.add(new SecretSpec(reference.source(), readContent(definition, workingDirectory)));
            mounts.add(mountFor(reference));
        }
        return new SecretResolution(specs, mounts);
    }

    private SecretConfig lookup(Map<String, SecretConfig> definitions, String name) {
        var definition = definitions.get(name);
        if (definition == null) {
            throw new SecretResolutionException(
                SecretResolutionException.Reason.NOT_FOUND, name, "secret '" + name + "' not found in project secrets"
            );
        }
        if (definition.external()) {
            throw new SecretResolutionException(
                SecretResolutionException.Reason.EXTERNAL_UNSUPPORTED, name, "external secrets are not supported: " + name
            );
        }
        if (definition.hasConflictingSources()) {
            log.warn("Secret '{}' defines both inline content and file '{}'; the file content is used", name, definition.file());
        }
        return definition;
    }

    private byte[] readContent(SecretConfig definition, Path workingDirectory) {
        var source = definition.source();
        if (source instanceof SecretSource.Inline inline) {
            return inline.content();
        }
        var fileBacked = (SecretSource.FileBacked) source;
        Path path = fileBacked.path().isAbsolute() ? fileBacked.path() : workingDirectory.resolve(fileBacked.path());
        try {
            byte[] content = Files.readAllBytes(path);
            log.debug("Read secret '{}' from {} ({} bytes)", definition.name(), path, content.length);
            return content;
        } catch (IOException ex) {
            throw new SecretResolutionException(
                SecretResolutionException.Reason.READ_FAILED,
                definition.name(),
                "read secret from file '" + definition.file() + "': " + describe(ex),
                ex
            );
        }
    }

    private SecretMount mountFor(ServiceSecretConfig reference) {
        String target = reference.targetPath().orElse(DEFAULT_MOUNT_DIRECTORY + reference.source());
        return new SecretMount(
            reference.source(),
            Optional.of(target),
            Optional.ofNullable(reference.uid()),
            Optional.ofNullable(reference.gid()),
            reference.fileMode()
        );
    }

    private static String describe(IOException ex) {
        String message = ex.getMessage();
        String kind = ex.getClass().getSimpleName();
        return message == null || message.isBlank() ? kind : kind + ": " + message;
    }
}
