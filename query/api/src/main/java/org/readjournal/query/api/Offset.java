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

import java.util.Objects;
import java.util.StringJoiner;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * A position in the ordered projection of a tag. Offsets are exclusive lower bounds, i.e. querying from
 * {@code Sequence(n)} returns the events <i>after</i> {@code n}. The offset of every delivered {@link EventEnvelope}
 * can thus be used as-is to resume a query later.
 */
public sealed interface Offset {

    /**
     * @return An offset that precedes every tagged event
     */
    static Offset noOffset() {
        return NoOffset.INSTANCE;
    }

    /**
     * @param value The ordinal position, must be greater than or equal to 0
     * @return A {@link Sequence} offset
     */
    static Offset sequence(long value) {
        return new Sequence(value);
    }

    /**
     * @param uuid A time-based (version 1) UUID
     * @return A {@link TimeBasedUuid} offset
     */
    static Offset timeBasedUuid(UUID uuid) {
        return new TimeBasedUuid(uuid);
    }

    default boolean isNoOffset() {
        return this instanceof NoOffset;
    }

    default boolean isSequence() {
        return this instanceof Sequence;
    }

    final class NoOffset implements Offset {
        private static final NoOffset INSTANCE = new NoOffset();

        private NoOffset() {
        }

        @Override
        public String toString() {
            return this.getClass().getSimpleName();
        }
    }

    final class Sequence implements Offset, Comparable<Sequence> {
        public final long value;

        private Sequence(long value) {
            if (value < 0) {
                throw new IllegalArgumentException("Sequence offset cannot be negative, was " + value);
            }
            this.value = value;
        }

        @Override
        public int compareTo(Sequence other) {
            return Long.compare(value, other.value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Sequence)) return false;
            Sequence sequence = (Sequence) o;
            return value == sequence.value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return new StringJoiner(", ", Sequence.class.getSimpleName() + "[", "]")
                    .add("value=" + value)
                    .toString();
        }
    }

    /**
     * An offset kind used by journals that order events by time. It's not an ordinal position and can't be used
     * with journals that assign sequence offsets to tagged events.
     */
    final class TimeBasedUuid implements Offset {
        public final UUID value;

        private TimeBasedUuid(UUID value) {
            requireNonNull(value, UUID.class.getSimpleName() + " cannot be null");
            if (value.version() != 1) {
                throw new IllegalArgumentException("UUID " + value + " is not time-based (version 1)");
            }
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TimeBasedUuid)) return false;
            TimeBasedUuid that = (TimeBasedUuid) o;
            return Objects.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value);
        }

        @Override
        public String toString() {
            return new StringJoiner(", ", TimeBasedUuid.class.getSimpleName() + "[", "]")
                    .add("value=" + value)
                    .toString();
        }
    }
}
