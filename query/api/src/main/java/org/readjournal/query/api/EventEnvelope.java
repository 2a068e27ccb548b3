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

package org.readjournal.query.api;

import io.cloudevents.CloudEvent;

import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * An event delivered by a read journal query together with its position. The {@code persistenceId} and
 * {@code sequenceNr} pair uniquely identifies the event, and {@code offset} can be used to resume a query.
 */
public final class EventEnvelope {
    private final Offset offset;
    private final String persistenceId;
    private final long sequenceNr;
    private final CloudEvent event;

    public EventEnvelope(Offset offset, String persistenceId, long sequenceNr, CloudEvent event) {
        requireNonNull(offset, Offset.class.getSimpleName() + " cannot be null");
        requireNonNull(persistenceId, "PersistenceId cannot be null");
        requireNonNull(event, CloudEvent.class.getSimpleName() + " cannot be null");
        if (sequenceNr < 1) {
            throw new IllegalArgumentException("Sequence number cannot be less than 1");
        }
        this.offset = offset;
        this.persistenceId = persistenceId;
        this.sequenceNr = sequenceNr;
        this.event = event;
    }

    public Offset offset() {
        return offset;
    }

    public String persistenceId() {
        return persistenceId;
    }

    public long sequenceNr() {
        return sequenceNr;
    }

    public CloudEvent event() {
        return event;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventEnvelope)) return false;
        EventEnvelope that = (EventEnvelope) o;
        return sequenceNr == that.sequenceNr && Objects.equals(offset, that.offset) && Objects.equals(persistenceId, that.persistenceId) && Objects.equals(event, that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, persistenceId, sequenceNr, event);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventEnvelope.class.getSimpleName() + "[", "]")
                .add("offset=" + offset)
                .add("persistenceId='" + persistenceId + "'")
                .add("sequenceNr=" + sequenceNr)
                .add("eventId='" + event.getId() + "'")
                .toString();
    }
}
