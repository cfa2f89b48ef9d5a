package work.lcod.meshdeploy.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A service's reference to a project secret. {@code uid}/{@code gid} stay decimal strings;
 * {@code mode} holds permission bits (e.g. {@code 0400}).
 */
public record ServiceSecretConfig(String source, String target, String uid, String gid, Integer mode) {
    public ServiceSecretConfig {
        Objects.requireNonNull(source, "source");
        target = Copies.blankToNull(target);
        uid = Copies.blankToNull(uid);
        gid = Copies.blankToNull(gid);
    }

    public static ServiceSecretConfig of(String source) {
        return new ServiceSecretConfig(source, null, null, null, null);
    }

    public Optional<String> targetPath() {
        return Optional.ofNullable(target);
    }

    public Optional<Integer> fileMode() {
        return Optional.ofNullable(mode);
    }
}
