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

package org.readjournal.query.reactor.internal;

import org.readjournal.query.api.EventEnvelope;
import org.readjournal.query.api.Page;
import org.readjournal.query.api.ReadJournalBackend;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Reads the events of a single persistence id in sequence number order, from {@code fromSequenceNr} up to and
 * including {@code toSequenceNr}. A {@link Liveness#CURRENT current} poller narrows the upper bound to the highest
 * sequence number that the persistence id had when the first poll was made.
 */
public class EventsByPersistenceIdPoller implements Poller<EventEnvelope> {
    private final ReadJournalBackend backend;
    private final String persistenceId;
    private final long toSequenceNr;
    private final Liveness liveness;

    private long position;
    private long upperBound;
    private boolean upperBoundResolved;
    private boolean exhausted;

    public EventsByPersistenceIdPoller(ReadJournalBackend backend, String persistenceId, long fromSequenceNr, long toSequenceNr, Liveness liveness) {
        requireNonNull(backend, ReadJournalBackend.class.getSimpleName() + " cannot be null");
        requireNonNull(persistenceId, "PersistenceId cannot be null");
        requireNonNull(liveness, Liveness.class.getSimpleName() + " cannot be null");
        this.backend = backend;
        this.persistenceId = persistenceId;
        this.toSequenceNr = toSequenceNr;
        this.liveness = liveness;
        this.position = fromSequenceNr;
        this.upperBound = toSequenceNr;
        this.upperBoundResolved = liveness == Liveness.LIVE;
        this.exhausted = fromSequenceNr > toSequenceNr;
    }

    @Override
    public Mono<PollResult<EventEnvelope>> poll(int maxItems) {
        return resolveUpperBound().flatMap(bound -> {
            if (position > bound) {
                exhausted = true;
                return Mono.just(PollResult.empty());
            }
            return backend.eventsByPersistenceId(persistenceId, position, bound, maxItems)
                    .map(page -> onPage(Poller.requireWithinPageSize(page, maxItems)));
        });
    }

    private Mono<Long> resolveUpperBound() {
        if (upperBoundResolved) {
            return Mono.just(upperBound);
        }
        return backend.highestSequenceNr(persistenceId).map(highestSequenceNr -> {
            upperBound = Math.min(toSequenceNr, highestSequenceNr);
            upperBoundResolved = true;
            return upperBound;
        });
    }

    private PollResult<EventEnvelope> onPage(Page<EventEnvelope> page) {
        List<EventEnvelope> events = new ArrayList<>(page.size());
        for (EventEnvelope envelope : page.items()) {
            // Drop anything at or before what has already been delivered
            if (envelope.sequenceNr() >= position) {
                events.add(envelope);
                if (envelope.sequenceNr() == Long.MAX_VALUE) {
                    exhausted = true;
                } else {
                    position = envelope.sequenceNr() + 1;
                }
            }
        }

        boolean awaitRefresh = false;
        if (position > upperBound) {
            exhausted = true;
        } else if (!page.hasMore()) {
            if (liveness == Liveness.CURRENT) {
                exhausted = true;
            } else {
                awaitRefresh = true;
            }
        }
        return PollResult.of(events, awaitRefresh, page::acknowledge);
    }

    @Override
    public boolean isExhausted() {
        return exhausted;
    }
}
