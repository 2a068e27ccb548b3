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

package org.readjournal.cloudevents;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class JournalPositionTest {

    @Test
    void reads_the_position_that_was_stamped_on_a_cloud_event() {
        // Given
        CloudEvent stamped = JournalPosition.of("account-1", 3).stamp(cloudEvent());

        // When
        JournalPosition position = JournalPosition.of(stamped);

        // Then
        assertThat(position).isEqualTo(JournalPosition.of("account-1", 3));
        assertThat(JournalPosition.isStamped(stamped)).isTrue();
        assertThat(stamped.getData()).isEqualTo(cloudEvent().getData());
    }

    @Test
    void stamping_replaces_an_existing_position() {
        // Given
        CloudEvent stamped = JournalPosition.of("account-1", 3).stamp(cloudEvent());

        // When
        CloudEvent restamped = JournalPosition.of("account-2", 7).stamp(stamped);

        // Then
        assertThat(JournalPosition.of(restamped)).isEqualTo(JournalPosition.of("account-2", 7));
    }

    @Test
    void accepts_a_sequence_number_delivered_as_a_string() {
        // Given
        CloudEvent cloudEvent = CloudEventBuilder.v1(cloudEvent())
                .withExtension(JournalPosition.PERSISTENCE_ID, "account-1")
                .withExtension(JournalPosition.SEQUENCE_NR, "42")
                .build();

        // When
        JournalPosition position = JournalPosition.of(cloudEvent);

        // Then
        assertThat(position.sequenceNr()).isEqualTo(42L);
    }

    @Test
    void rejects_a_cloud_event_without_a_position() {
        // When
        Throwable throwable = catchThrowable(() -> JournalPosition.of(cloudEvent()));

        // Then
        assertThat(JournalPosition.isStamped(cloudEvent())).isFalse();
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("CloudEvent id has no journal position, expected both the persistenceid and sequencenr extensions");
    }

    @Test
    void rejects_a_sequence_number_that_is_not_a_number() {
        // Given
        CloudEvent cloudEvent = CloudEventBuilder.v1(cloudEvent())
                .withExtension(JournalPosition.PERSISTENCE_ID, "account-1")
                .withExtension(JournalPosition.SEQUENCE_NR, "three")
                .build();

        // When
        Throwable throwable = catchThrowable(() -> JournalPosition.of(cloudEvent));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("CloudEvent id has a sequencenr that is not a number: \"three\"");
    }

    @Test
    void rejects_sequence_numbers_below_one() {
        // When
        Throwable throwable = catchThrowable(() -> JournalPosition.of("account-1", 0));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Sequence number cannot be less than 1, was 0");
    }

    private static CloudEvent cloudEvent() {
        return CloudEventBuilder.v1()
                .withId("id")
                .withSource(URI.create("urn:test"))
                .withType("type")
                .withData("text/plain", "hello".getBytes(UTF_8))
                .build();
    }
}
