package io.setkit.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Immutable configuration shared by the setkit containers.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * SetkitConfiguration config = SetkitConfiguration.builder()
 *     .initialCapacity(64)
 *     .dedupStrategy(SetkitConfiguration.DedupStrategy.HASHED)
 *     .build();
 * </pre>
 * <p>
 * Configurations can also be read from {@link Properties} or from a
 * {@code setkit.properties} classpath resource, see {@link #load()}.
 */
public final class SetkitConfiguration {
    private static final Logger log = LoggerFactory.getLogger(SetkitConfiguration.class);

    public static final String DEFAULT_RESOURCE = "setkit.properties";
    public static final String INITIAL_CAPACITY_KEY = "setkit.initial-capacity";
    public static final String DEDUP_STRATEGY_KEY = "setkit.dedup-strategy";

    private static final SetkitConfiguration DEFAULTS = builder().build();

    // Backing storage sizing
    private final int initialCapacity;

    // Duplicate removal used by batch filters
    private final DedupStrategy dedupStrategy;

    private SetkitConfiguration(Builder builder) {
        this.initialCapacity = builder.initialCapacity;
        this.dedupStrategy = builder.dedupStrategy;
    }

    /**
     * Create a new builder for SetkitConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static SetkitConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Load the configuration from the {@value #DEFAULT_RESOURCE} classpath resource,
     * falling back to {@link #defaults()} when the resource does not exist.
     *
     * @return the loaded configuration
     * @throws SetkitException if the resource exists but cannot be read
     */
    public static SetkitConfiguration load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Load the configuration from a named classpath resource.
     *
     * @param resource classpath resource name
     * @return the loaded configuration, or the defaults when the resource is absent
     */
    public static SetkitConfiguration load(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource required");
        }
        var loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SetkitConfiguration.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", resource);
                return DEFAULTS;
            }
            var properties = new Properties();
            properties.load(in);
            log.debug("Loading setkit configuration from {}", resource);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new SetkitException("Failed to read " + resource, e);
        }
    }

    /**
     * Build a configuration from properties. Missing keys keep their defaults.
     *
     * @param properties source properties
     * @return the configuration
     * @throws IllegalArgumentException if a present value cannot be parsed
     */
    public static SetkitConfiguration fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties required");
        }
        var builder = builder();

        var capacity = properties.getProperty(INITIAL_CAPACITY_KEY);
        if (capacity != null) {
            try {
                builder.initialCapacity(Integer.parseInt(capacity.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Cannot convert '" + capacity + "' for " + INITIAL_CAPACITY_KEY, e);
            }
        }

        var strategy = properties.getProperty(DEDUP_STRATEGY_KEY);
        if (strategy != null) {
            builder.dedupStrategy(DedupStrategy.parse(strategy));
        }

        var config = builder.build();
        log.debug("Resolved setkit configuration: initialCapacity={}, dedupStrategy={}",
                config.initialCapacity(), config.dedupStrategy());
        return config;
    }

    /**
     * Get the initial capacity of container backing storage.
     *
     * @return initial capacity (always positive)
     */
    public int initialCapacity() {
        return initialCapacity;
    }

    /**
     * Get the duplicate removal strategy used by batch filters.
     *
     * @return the dedup strategy (COMPACTING or HASHED)
     */
    public DedupStrategy dedupStrategy() {
        return dedupStrategy;
    }

    /**
     * Duplicate removal strategy enum.
     * <p>
     * Both strategies keep the first occurrence of every value, preserve
     * relative order and truncate the input list in place.
     */
    public enum DedupStrategy {
        /**
         * Anchor-and-compact scan. O(n^2), no extra allocation.
         * Suited to the small batches filters usually see.
         */
        COMPACTING,

        /**
         * Single pass with a hash set of kept values. O(n), allocates the set.
         */
        HASHED;

        static DedupStrategy parse(String value) {
            var name = value.trim().toUpperCase(Locale.ROOT);
            for (var strategy : values()) {
                if (strategy.name().equals(name)) {
                    return strategy;
                }
            }
            throw new IllegalArgumentException(
                    "Cannot convert '" + value + "' for " + DEDUP_STRATEGY_KEY);
        }
    }

    /**
     * Builder for SetkitConfiguration.
     */
    public static class Builder {
        private int initialCapacity = 16;
        private DedupStrategy dedupStrategy = DedupStrategy.COMPACTING;

        private Builder() {
        }

        /**
         * Set the initial capacity of container backing storage.
         *
         * @param initialCapacity the capacity, must be positive
         * @return this builder for method chaining
         */
        public Builder initialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        /**
         * Set the strategy used when filters remove duplicates.
         *
         * @param dedupStrategy the strategy
         * @return this builder for method chaining
         */
        public Builder dedupStrategy(DedupStrategy dedupStrategy) {
            this.dedupStrategy = dedupStrategy;
            return this;
        }

        /**
         * Build the immutable SetkitConfiguration.
         *
         * @return a new SetkitConfiguration instance
         * @throws IllegalArgumentException if a setting is out of range
         */
        public SetkitConfiguration build() {
            if (initialCapacity <= 0) {
                throw new IllegalArgumentException("initialCapacity must be positive");
            }
            if (dedupStrategy == null) {
                throw new IllegalArgumentException("dedupStrategy required");
            }
            return new SetkitConfiguration(this);
        }
    }
}
