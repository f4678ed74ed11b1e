/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.vercon.repository;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for a repository.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dvercon.syncEnabled=false})</li>
 *   <li>Environment variables (e.g., {@code VERCON_SYNC_ENABLED})</li>
 *   <li>Properties file ({@code vercon.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>syncEnabled</td><td>vercon.syncEnabled</td><td>VERCON_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>vercon.minFreeSpaceMb</td><td>VERCON_MIN_FREE_SPACE_MB</td><td>16</td></tr>
 *   <tr><td>preserveTimestamps</td><td>vercon.preserveTimestamps</td><td>VERCON_PRESERVE_TIMESTAMPS</td><td>true</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # vercon.properties
 * vercon.syncEnabled=true
 * vercon.minFreeSpaceMb=16
 * vercon.preserveTimestamps=true
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * RepositoryConfig config = RepositoryConfig.builder()
 *     .syncEnabled(false)
 *     .minFreeSpaceMb(0)
 *     .build();
 *
 * Repository repo = FileRepository.open(Path.of("."), config);
 * </pre>
 */
public final class RepositoryConfig {

    private static final String PROPERTIES_FILE = "vercon.properties";

    // Property keys
    private static final String PROP_SYNC_ENABLED = "vercon.syncEnabled";
    private static final String PROP_MIN_FREE_SPACE_MB = "vercon.minFreeSpaceMb";
    private static final String PROP_PRESERVE_TIMESTAMPS = "vercon.preserveTimestamps";

    // Environment variable keys
    private static final String ENV_SYNC_ENABLED = "VERCON_SYNC_ENABLED";
    private static final String ENV_MIN_FREE_SPACE_MB = "VERCON_MIN_FREE_SPACE_MB";
    private static final String ENV_PRESERVE_TIMESTAMPS = "VERCON_PRESERVE_TIMESTAMPS";

    // Defaults
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 16;
    private static final boolean DEFAULT_PRESERVE_TIMESTAMPS = true;

    private final boolean syncEnabled;
    private final int minFreeSpaceMb;
    private final boolean preserveTimestamps;

    private RepositoryConfig(Builder builder) {
        this.syncEnabled = builder.syncEnabled;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
        this.preserveTimestamps = builder.preserveTimestamps;
    }

    /** Whether artifact and metadata writes are fsynced (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Minimum free disk space in MB required before a commit starts; 0 disables the check. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Whether artifacts get the modification time of the working file they were taken from. */
    public boolean preserveTimestamps() {
        return preserveTimestamps;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    @Override
    public String toString() {
        return "RepositoryConfig{" +
                "syncEnabled=" + syncEnabled +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", preserveTimestamps=" + preserveTimestamps +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code RepositoryConfig.builder().build()}.
     */
    public static RepositoryConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link RepositoryConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Boolean syncEnabled;
        private Integer minFreeSpaceMb;
        private Boolean preserveTimestamps;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 16, 0 disables the check). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            if (minFreeSpaceMb < 0) {
                throw new IllegalArgumentException("minFreeSpaceMb must not be negative: " + minFreeSpaceMb);
            }
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /** Enables or disables copying working-file timestamps onto artifacts (default: true). */
        public Builder preserveTimestamps(boolean preserveTimestamps) {
            this.preserveTimestamps = preserveTimestamps;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public RepositoryConfig build() {
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = Math.max(0,
                        resolveInt(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, DEFAULT_MIN_FREE_SPACE_MB));
            }
            if (preserveTimestamps == null) {
                preserveTimestamps = resolveBoolean(PROP_PRESERVE_TIMESTAMPS, ENV_PRESERVE_TIMESTAMPS,
                        DEFAULT_PRESERVE_TIMESTAMPS);
            }
            return new RepositoryConfig(this);
        }

        private String resolve(String sysProp, String envVar) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            return null;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = resolve(sysProp, envVar);
            return value != null ? Boolean.parseBoolean(value) : defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = resolve(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = RepositoryConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException ignored) {
                // unreadable resource: fall through to the working directory
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException ignored) {
                    // unreadable file: defaults apply
                }
            }

            return props;
        }
    }
}
