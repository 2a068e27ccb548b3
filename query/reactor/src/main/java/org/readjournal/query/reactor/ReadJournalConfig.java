/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.readjournal.query.reactor;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Properties;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Configuration for {@link ReactorReadJournal}.
 */
@NullMarked
public class ReadJournalConfig {
    public static final String DEFAULT_WRITE_PLUGIN_ID = "readjournal.journal.inmemory";
    public static final int DEFAULT_MAX_BUFFER_SIZE = 500;
    public static final boolean DEFAULT_AUTO_ACK = true;
    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(3);

    /**
     * Prefix that {@link #fromProperties(Properties)} accepts in front of every key
     */
    public static final String PROPERTY_PREFIX = "readjournal.query.";
    public static final String WRITE_PLUGIN_ID = "write-plugin-id";
    public static final String MAX_BUFFER_SIZE = "max-buffer-size";
    public static final String AUTO_ACK = "auto-ack";
    public static final String REFRESH_INTERVAL = "refresh-interval";

    /**
     * The id of the write-side journal plugin that the read journal queries
     */
    public final String writePluginId;
    /**
     * The maximum number of elements that a query buffers ahead of subscriber demand. This is also the largest page size
     * that is requested from the backend.
     */
    public final int maxBufferSize;
    /**
     * Whether pages are acknowledged to the backend once all of their elements have been delivered
     */
    public final boolean autoAck;
    /**
     * How long a live query waits before polling the backend again once it has caught up
     */
    public final Duration refreshInterval;
    /**
     * The scheduler whose workers run the per-subscription state machines
     */
    public final Scheduler scheduler;

    private ReadJournalConfig(String writePluginId, int maxBufferSize, boolean autoAck, Duration refreshInterval, Scheduler scheduler) {
        requireNonNull(writePluginId, "Write plugin id cannot be null");
        requireNonNull(refreshInterval, "Refresh interval cannot be null");
        requireNonNull(scheduler, Scheduler.class.getSimpleName() + " cannot be null");
        if (writePluginId.isBlank()) {
            throw new IllegalArgumentException("Write plugin id cannot be blank");
        }
        if (maxBufferSize < 1) {
            throw new IllegalArgumentException("Max buffer size must be greater than or equal to 1");
        }
        if (refreshInterval.isZero() || refreshInterval.isNegative()) {
            throw new IllegalArgumentException("Refresh interval must be greater than 0");
        }
        this.writePluginId = writePluginId;
        this.maxBufferSize = maxBufferSize;
        this.autoAck = autoAck;
        this.refreshInterval = refreshInterval;
        this.scheduler = scheduler;
    }

    /**
     * @return A {@code ReadJournalConfig} with default settings
     */
    public static ReadJournalConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a {@code ReadJournalConfig} from {@code properties}. Keys may be given as-is (e.g. {@code max-buffer-size}) or
     * prefixed with {@value #PROPERTY_PREFIX}, where the prefixed key takes precedence. Missing keys get their default value.
     * The refresh interval is either an ISO-8601 duration ({@code PT1S}) or a number of milliseconds.
     *
     * @param properties The properties to read
     * @return A new {@code ReadJournalConfig}
     * @throws IllegalArgumentException If a value cannot be parsed or is out of range
     */
    public static ReadJournalConfig fromProperties(Properties properties) {
        requireNonNull(properties, Properties.class.getSimpleName() + " cannot be null");
        Builder builder = new Builder();

        String writePluginId = property(properties, WRITE_PLUGIN_ID);
        if (writePluginId != null) {
            if (writePluginId.isEmpty()) {
                throw invalidProperty(WRITE_PLUGIN_ID, writePluginId, null);
            }
            builder.writePluginId(writePluginId);
        }

        String maxBufferSize = property(properties, MAX_BUFFER_SIZE);
        if (maxBufferSize != null) {
            int parsed;
            try {
                parsed = Integer.parseInt(maxBufferSize);
            } catch (NumberFormatException e) {
                throw invalidProperty(MAX_BUFFER_SIZE, maxBufferSize, e);
            }
            if (parsed < 1) {
                throw invalidProperty(MAX_BUFFER_SIZE, maxBufferSize, null);
            }
            builder.maxBufferSize(parsed);
        }

        String autoAck = property(properties, AUTO_ACK);
        if (autoAck != null) {
            if (!autoAck.equalsIgnoreCase("true") && !autoAck.equalsIgnoreCase("false")) {
                throw invalidProperty(AUTO_ACK, autoAck, null);
            }
            builder.autoAck(Boolean.parseBoolean(autoAck));
        }

        String refreshInterval = property(properties, REFRESH_INTERVAL);
        if (refreshInterval != null) {
            Duration parsed = parseDuration(refreshInterval);
            if (parsed.isZero() || parsed.isNegative()) {
                throw invalidProperty(REFRESH_INTERVAL, refreshInterval, null);
            }
            builder.refreshInterval(parsed);
        }

        return builder.build();
    }

    private static @Nullable String property(Properties properties, String key) {
        String value = properties.getProperty(PROPERTY_PREFIX + key, properties.getProperty(key));
        return value == null ? null : value.trim();
    }

    private static Duration parseDuration(String value) {
        if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            try {
                return Duration.ofMillis(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw invalidProperty(REFRESH_INTERVAL, value, e);
            }
        }
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw invalidProperty(REFRESH_INTERVAL, value, e);
        }
    }

    private static IllegalArgumentException invalidProperty(String key, String value, @Nullable Exception cause) {
        return new IllegalArgumentException("Invalid value for " + key + ": \"" + value + "\"", cause);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReadJournalConfig)) return false;
        ReadJournalConfig that = (ReadJournalConfig) o;
        return maxBufferSize == that.maxBufferSize && autoAck == that.autoAck && Objects.equals(writePluginId, that.writePluginId)
                && Objects.equals(refreshInterval, that.refreshInterval) && Objects.equals(scheduler, that.scheduler);
    }

    @Override
    public int hashCode() {
        return Objects.hash(writePluginId, maxBufferSize, autoAck, refreshInterval, scheduler);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ReadJournalConfig.class.getSimpleName() + "[", "]")
                .add("writePluginId='" + writePluginId + "'")
                .add("maxBufferSize=" + maxBufferSize)
                .add("autoAck=" + autoAck)
                .add("refreshInterval=" + refreshInterval)
                .add("scheduler=" + scheduler)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private String writePluginId = DEFAULT_WRITE_PLUGIN_ID;
        private int maxBufferSize = DEFAULT_MAX_BUFFER_SIZE;
        private boolean autoAck = DEFAULT_AUTO_ACK;
        private Duration refreshInterval = DEFAULT_REFRESH_INTERVAL;
        private Scheduler scheduler = Schedulers.parallel();

        /**
         * @param writePluginId The id of the write-side journal plugin. Default is {@code readjournal.journal.inmemory}.
         */
        @NullMarked
        public Builder writePluginId(String writePluginId) {
            this.writePluginId = writePluginId;
            return this;
        }

        /**
         * @param maxBufferSize The maximum number of elements buffered per query. Default is 500.
         */
        @NullMarked
        public Builder maxBufferSize(int maxBufferSize) {
            this.maxBufferSize = maxBufferSize;
            return this;
        }

        @NullMarked
        public Builder autoAck(boolean autoAck) {
            this.autoAck = autoAck;
            return this;
        }

        /**
         * @param refreshInterval How long live queries wait before polling again once caught up. Default is 3 seconds.
         */
        @NullMarked
        public Builder refreshInterval(Duration refreshInterval) {
            this.refreshInterval = refreshInterval;
            return this;
        }

        /**
         * @param scheduler The scheduler that runs the queries. Default is {@link Schedulers#parallel()}.
         */
        @NullMarked
        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        @NullMarked
        public ReadJournalConfig build() {
            return new ReadJournalConfig(writePluginId, maxBufferSize, autoAck, refreshInterval, scheduler);
        }
    }
}
