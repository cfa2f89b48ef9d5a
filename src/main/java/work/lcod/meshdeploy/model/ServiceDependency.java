package work.lcod.meshdeploy.model;

/**
 * One {@code depends_on} entry in long syntax.
 */
public record ServiceDependency(String condition, Boolean restart, Boolean required) {
    public static final String SERVICE_STARTED = "service_started";

    public static ServiceDependency started() {
        return new ServiceDependency(SERVICE_STARTED, Boolean.FALSE, Boolean.TRUE);
    }
}
