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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ReadJournalConfigTest {

    @Test
    void defaults() {
        // When
        ReadJournalConfig config = ReadJournalConfig.defaults();

        // Then
        assertThat(config.writePluginId).isEqualTo("readjournal.journal.inmemory");
        assertThat(config.maxBufferSize).isEqualTo(500);
        assertThat(config.autoAck).isTrue();
        assertThat(config.refreshInterval).isEqualTo(Duration.ofSeconds(3));
        assertThat(config.scheduler).isSameAs(Schedulers.parallel());
    }

    @Test
    void rejects_a_max_buffer_size_less_than_one() {
        // When
        Throwable throwable = catchThrowable(() -> ReadJournalConfig.builder().maxBufferSize(0).build());

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Max buffer size must be greater than or equal to 1");
    }

    @Test
    void rejects_a_refresh_interval_that_is_not_positive() {
        // When
        Throwable throwable = catchThrowable(() -> ReadJournalConfig.builder().refreshInterval(Duration.ZERO).build());

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Refresh interval must be greater than 0");
    }

    @Nested
    class FromProperties {

        @Test
        void reads_every_key() {
            // Given
            Properties properties = new Properties();
            properties.setProperty("write-plugin-id", "journal.eventstore");
            properties.setProperty("max-buffer-size", "100");
            properties.setProperty("auto-ack", "false");
            properties.setProperty("refresh-interval", "PT0.5S");

            // When
            ReadJournalConfig config = ReadJournalConfig.fromProperties(properties);

            // Then
            assertThat(config.writePluginId).isEqualTo("journal.eventstore");
            assertThat(config.maxBufferSize).isEqualTo(100);
            assertThat(config.autoAck).isFalse();
            assertThat(config.refreshInterval).isEqualTo(Duration.ofMillis(500));
        }

        @Test
        void prefixed_keys_take_precedence() {
            // Given
            Properties properties = new Properties();
            properties.setProperty("max-buffer-size", "100");
            properties.setProperty("readjournal.query.max-buffer-size", "200");

            // When
            ReadJournalConfig config = ReadJournalConfig.fromProperties(properties);

            // Then
            assertThat(config.maxBufferSize).isEqualTo(200);
        }

        @Test
        void reads_refresh_interval_in_milliseconds() {
            // Given
            Properties properties = new Properties();
            properties.setProperty("readjournal.query.refresh-interval", "250");

            // When
            ReadJournalConfig config = ReadJournalConfig.fromProperties(properties);

            // Then
            assertThat(config.refreshInterval).isEqualTo(Duration.ofMillis(250));
        }

        @Test
        void uses_defaults_for_missing_keys() {
            assertThat(ReadJournalConfig.fromProperties(new Properties())).isEqualTo(ReadJournalConfig.defaults());
        }

        @Test
        void names_the_key_of_an_invalid_value() {
            // Given
            Properties properties = new Properties();
            properties.setProperty("max-buffer-size", "many");

            // When
            Throwable throwable = catchThrowable(() -> ReadJournalConfig.fromProperties(properties));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Invalid value for max-buffer-size: \"many\"");
        }

        @Test
        void rejects_values_that_are_out_of_range() {
            // Given
            Properties properties = new Properties();
            properties.setProperty("refresh-interval", "PT-1S");

            // When
            Throwable throwable = catchThrowable(() -> ReadJournalConfig.fromProperties(properties));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Invalid value for refresh-interval: \"PT-1S\"");
        }

        @Test
        void rejects_auto_ack_values_that_are_not_booleans() {
            // Given
            Properties properties = new Properties();
            properties.setProperty("auto-ack", "yes");

            // When
            Throwable throwable = catchThrowable(() -> ReadJournalConfig.fromProperties(properties));

            // Then
            assertThat(throwable).hasMessage("Invalid value for auto-ack: \"yes\"");
        }
    }
}
