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

import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Where a {@link CloudEvent} lives in the journal, carried by the event itself as two extension attributes:
 * <ul>
 *     <li>{@value #PERSISTENCE_ID}, the persistence id of the entity that persisted the event</li>
 *     <li>{@value #SEQUENCE_NR}, the sequence number of the event for that persistence id, starting at 1</li>
 * </ul>
 * Transports that use the binary content mode deliver extension values as strings, so a numeric string is accepted
 * as sequence number when reading a position from an event.
 */
public final class JournalPosition {
    public static final String PERSISTENCE_ID = "persistenceid";
    public static final String SEQUENCE_NR = "sequencenr";

    private final String persistenceId;
    private final long sequenceNr;

    private JournalPosition(String persistenceId, long sequenceNr) {
        requireNonNull(persistenceId, "PersistenceId cannot be null");
        if (persistenceId.isEmpty()) {
            throw new IllegalArgumentException("PersistenceId cannot be empty");
        }
        if (sequenceNr < 1) {
            throw new IllegalArgumentException("Sequence number cannot be less than 1, was " + sequenceNr);
        }
        this.persistenceId = persistenceId;
        this.sequenceNr = sequenceNr;
    }

    public static JournalPosition of(String persistenceId, long sequenceNr) {
        return new JournalPosition(persistenceId, sequenceNr);
    }

    /**
     * Read the position that {@link #stamp(CloudEvent)} added to {@code cloudEvent}.
     *
     * @throws IllegalArgumentException If {@code cloudEvent} lacks either attribute or has a sequence number that isn't an integer
     */
    public static JournalPosition of(CloudEvent cloudEvent) {
        requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        Object persistenceId = cloudEvent.getExtension(PERSISTENCE_ID);
        Object sequenceNr = cloudEvent.getExtension(SEQUENCE_NR);
        if (persistenceId == null || sequenceNr == null) {
            throw new IllegalArgumentException("CloudEvent " + cloudEvent.getId() + " has no journal position, expected both the "
                    + PERSISTENCE_ID + " and " + SEQUENCE_NR + " extensions");
        }
        return new JournalPosition(persistenceId.toString(), sequenceNrOf(cloudEvent, sequenceNr));
    }

    public static boolean isStamped(CloudEvent cloudEvent) {
        return cloudEvent.getExtensionNames().contains(PERSISTENCE_ID) && cloudEvent.getExtensionNames().contains(SEQUENCE_NR);
    }

    private static long sequenceNrOf(CloudEvent cloudEvent, Object value) {
        if (value instanceof Long || value instanceof Integer) {
            return ((Number) value).longValue();
        } else if (value instanceof String string) {
            try {
                return Long.parseLong(string);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("CloudEvent " + cloudEvent.getId() + " has a " + SEQUENCE_NR + " that is not a number: \"" + string + "\"", e);
            }
        }
        throw new IllegalArgumentException("CloudEvent " + cloudEvent.getId() + " has a " + SEQUENCE_NR + " of unsupported type " + value.getClass().getName());
    }

    /**
     * @return A copy of {@code cloudEvent} carrying this position. A position that {@code cloudEvent} already carries is replaced.
     */
    public CloudEvent stamp(CloudEvent cloudEvent) {
        requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        return CloudEventBuilder.v1(cloudEvent)
                .withExtension(PERSISTENCE_ID, persistenceId)
                .withExtension(SEQUENCE_NR, sequenceNr)
                .build();
    }

    public String persistenceId() {
        return persistenceId;
    }

    public long sequenceNr() {
        return sequenceNr;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JournalPosition)) return false;
        JournalPosition that = (JournalPosition) o;
        return sequenceNr == that.sequenceNr && Objects.equals(persistenceId, that.persistenceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(persistenceId, sequenceNr);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", JournalPosition.class.getSimpleName() + "[", "]")
                .add("persistenceId='" + persistenceId + "'")
                .add("sequenceNr=" + sequenceNr)
                .toString();
    }
}
