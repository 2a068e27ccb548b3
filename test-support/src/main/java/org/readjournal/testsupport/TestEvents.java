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

package org.readjournal.testsupport;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.readjournal.query.api.EventEnvelope;

import java.net.URI;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.ZoneOffset.UTC;

/**
 * Creates cloud events whose data is a plain text string, e.g. {@code "a-1"}, which makes it easy to assert on the
 * order of delivered events.
 */
public class TestEvents {
    public static final URI SOURCE = URI.create("urn:readjournal:test");
    public static final String TYPE = "TestEvent";

    public static CloudEvent event(String data) {
        return CloudEventBuilder.v1()
                .withId(UUID.randomUUID().toString())
                .withSource(SOURCE)
                .withType(TYPE)
                .withTime(OffsetDateTime.now(UTC))
                .withDataContentType("text/plain")
                .withData(data.getBytes(UTF_8))
                .build();
    }

    /**
     * @return {@code count} events named {@code <prefix>-1} to {@code <prefix>-<count>}
     */
    public static Stream<CloudEvent> numbered(String prefix, int count) {
        return Stream.iterate(1, i -> i + 1).limit(count).map(i -> event(prefix + "-" + i));
    }

    public static String dataOf(CloudEvent cloudEvent) {
        return new String(Objects.requireNonNull(cloudEvent.getData(), "CloudEvent has no data").toBytes(), UTF_8);
    }

    public static String dataOf(EventEnvelope envelope) {
        return dataOf(envelope.event());
    }
}
