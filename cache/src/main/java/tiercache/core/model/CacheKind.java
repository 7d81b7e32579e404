package tiercache.core.model;

/**
 * The storage tier behind a cache instance.
 */
public enum CacheKind {
    MEMORY("memory", true),
    FILE("file", true),
    REDIS("redis", false),
    REDIS_CLUSTER("redis-cluster", false);

    private final String configName;
    private final boolean local;

    CacheKind(String configName, boolean local) {
        this.configName = configName;
        this.local = local;
    }

    /**
     * Name used in configuration, e.g. {@code tiercache.backend=redis-cluster}.
     */
    public String configName() {
        return configName;
    }

    /**
     * Whether the tier lives in this process or on this host. Only local tiers
     * need the facade to judge staleness and run an expiry sweeper.
     */
    public boolean isLocal() {
        return local;
    }
}
