/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Configuration of the push rule evaluation pipeline.
 *
 * <p><b>Sources, lowest precedence first:</b>
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code push-rules.properties} (classpath, then file system)</li>
 *   <li>environment variables, then system properties of the same name</li>
 * </ol>
 *
 * <p><b>Keys:</b>
 * <pre>
 * push.rules.room.cache.max.size       PUSH_RULES_ROOM_CACHE_MAX_SIZE       10000
 * push.rules.room.cache.record.stats   PUSH_RULES_ROOM_CACHE_RECORD_STATS   true
 * push.rules.room.cache.log.evictions  PUSH_RULES_ROOM_CACHE_LOG_EVICTIONS  false
 * push.rules.tracing.enabled           PUSH_RULES_TRACING_ENABLED           true
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * PushRulesConfig config = PushRulesConfig.loadDefault();
 *
 * PushRulesConfig small = PushRulesConfig.builder()
 *     .roomCacheMaxSize(100)
 *     .build();
 * }</pre>
 */
public final class PushRulesConfig {

    private static final Logger logger = Logger.getLogger(PushRulesConfig.class.getName());

    public static final String DEFAULT_PROPERTIES_FILE = "push-rules.properties";

    static final String KEY_ROOM_CACHE_MAX_SIZE = "push.rules.room.cache.max.size";
    static final String KEY_ROOM_CACHE_RECORD_STATS = "push.rules.room.cache.record.stats";
    static final String KEY_ROOM_CACHE_LOG_EVICTIONS = "push.rules.room.cache.log.evictions";
    static final String KEY_TRACING_ENABLED = "push.rules.tracing.enabled";

    static final String ENV_ROOM_CACHE_MAX_SIZE = "PUSH_RULES_ROOM_CACHE_MAX_SIZE";
    static final String ENV_ROOM_CACHE_RECORD_STATS = "PUSH_RULES_ROOM_CACHE_RECORD_STATS";
    static final String ENV_ROOM_CACHE_LOG_EVICTIONS = "PUSH_RULES_ROOM_CACHE_LOG_EVICTIONS";
    static final String ENV_TRACING_ENABLED = "PUSH_RULES_TRACING_ENABLED";

    private final long roomCacheMaxSize;
    private final boolean recordStats;
    private final boolean logEvictions;
    private final boolean tracingEnabled;

    private PushRulesConfig(Builder builder) {
        this.roomCacheMaxSize = builder.roomCacheMaxSize;
        this.recordStats = builder.recordStats;
        this.logEvictions = builder.logEvictions;
        this.tracingEnabled = builder.tracingEnabled;
        validate();
    }

    /**
     * Built-in defaults only; environment is not consulted.
     */
    public static PushRulesConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults, {@value #DEFAULT_PROPERTIES_FILE} and the process environment.
     */
    public static PushRulesConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES_FILE);
    }

    public static PushRulesConfig loadFromProperties(String propertiesPath) {
        return loadFromProperties(propertiesPath, PushRulesConfig::systemLookup);
    }

    /**
     * @param propertiesPath classpath resource or file path
     * @param environment    lookup for environment overrides; returns null when unset
     */
    public static PushRulesConfig loadFromProperties(String propertiesPath, UnaryOperator<String> environment) {
        Properties props = readProperties(propertiesPath);
        Builder builder = builder();
        builder.applyProperties(props);
        builder.applyEnvironment(environment);

        PushRulesConfig config = builder.build();
        logger.info("Push rules configuration: " + config);
        return config;
    }

    private static Properties readProperties(String propertiesPath) {
        Properties props = new Properties();

        try (InputStream is = PushRulesConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.fine("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
                return props;
            }
        } catch (IOException e) {
            logger.warning("Could not read classpath resource " + propertiesPath + ": " + e.getMessage());
        }

        try (FileInputStream fis = new FileInputStream(propertiesPath)) {
            props.load(fis);
            logger.fine("Loaded " + props.size() + " properties from file: " + propertiesPath);
        } catch (IOException e) {
            logger.fine("No properties file " + propertiesPath + ", using defaults");
        }
        return props;
    }

    private static String systemLookup(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value;
    }

    private void validate() {
        if (roomCacheMaxSize <= 0) {
            throw new IllegalArgumentException("room cache max size must be positive: " + roomCacheMaxSize);
        }
    }

    public long roomCacheMaxSize() {
        return roomCacheMaxSize;
    }

    public boolean recordStats() {
        return recordStats;
    }

    public boolean logEvictions() {
        return logEvictions;
    }

    public boolean tracingEnabled() {
        return tracingEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .roomCacheMaxSize(roomCacheMaxSize)
                .recordStats(recordStats)
                .logEvictions(logEvictions)
                .tracingEnabled(tracingEnabled);
    }

    @Override
    public String toString() {
        return String.format("PushRulesConfig{roomCacheMaxSize=%d, recordStats=%b, logEvictions=%b, tracing=%b}",
                roomCacheMaxSize, recordStats, logEvictions, tracingEnabled);
    }

    public static final class Builder {
        private long roomCacheMaxSize = 10_000;
        private boolean recordStats = true;
        private boolean logEvictions = false;
        private boolean tracingEnabled = true;

        private Builder() {
        }

        public Builder roomCacheMaxSize(long roomCacheMaxSize) {
            this.roomCacheMaxSize = roomCacheMaxSize;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public Builder logEvictions(boolean logEvictions) {
            this.logEvictions = logEvictions;
            return this;
        }

        public Builder tracingEnabled(boolean tracingEnabled) {
            this.tracingEnabled = tracingEnabled;
            return this;
        }

        public PushRulesConfig build() {
            return new PushRulesConfig(this);
        }

        private void applyProperties(Properties props) {
            parseLong(KEY_ROOM_CACHE_MAX_SIZE, props.getProperty(KEY_ROOM_CACHE_MAX_SIZE))
                    .ifPresent(val -> this.roomCacheMaxSize = val);
            Optional.ofNullable(props.getProperty(KEY_ROOM_CACHE_RECORD_STATS))
                    .ifPresent(val -> this.recordStats = Boolean.parseBoolean(val.trim()));
            Optional.ofNullable(props.getProperty(KEY_ROOM_CACHE_LOG_EVICTIONS))
                    .ifPresent(val -> this.logEvictions = Boolean.parseBoolean(val.trim()));
            Optional.ofNullable(props.getProperty(KEY_TRACING_ENABLED))
                    .ifPresent(val -> this.tracingEnabled = Boolean.parseBoolean(val.trim()));
        }

        private void applyEnvironment(UnaryOperator<String> environment) {
            parseLong(ENV_ROOM_CACHE_MAX_SIZE, environment.apply(ENV_ROOM_CACHE_MAX_SIZE))
                    .ifPresent(val -> this.roomCacheMaxSize = val);
            Optional.ofNullable(environment.apply(ENV_ROOM_CACHE_RECORD_STATS))
                    .ifPresent(val -> this.recordStats = Boolean.parseBoolean(val.trim()));
            Optional.ofNullable(environment.apply(ENV_ROOM_CACHE_LOG_EVICTIONS))
                    .ifPresent(val -> this.logEvictions = Boolean.parseBoolean(val.trim()));
            Optional.ofNullable(environment.apply(ENV_TRACING_ENABLED))
                    .ifPresent(val -> this.tracingEnabled = Boolean.parseBoolean(val.trim()));
        }

        private static Optional<Long> parseLong(String key, String value) {
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            try {
                return Optional.of(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                logger.warning("Invalid value for " + key + ": " + value + ", keeping default");
                return Optional.empty();
            }
        }
    }
}
