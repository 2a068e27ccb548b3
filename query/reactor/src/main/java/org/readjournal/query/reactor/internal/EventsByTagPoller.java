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
import org.readjournal.query.api.Offset;
import org.readjournal.query.api.Page;
import org.readjournal.query.api.ReadJournalBackend;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Reads the events of a tag in offset order. {@code afterOffset} is exclusive and {@code toOffset} inclusive.
 * A {@link Liveness#CURRENT current} poller narrows the upper bound to the highest offset of the tag when the first
 * poll was made.
 */
public class EventsByTagPoller implements Poller<EventEnvelope> {
    private final ReadJournalBackend backend;
    private final String tag;
    private final long toOffset;
    private final Liveness liveness;

    private long position;
    private long upperBound;
    private boolean upperBoundResolved;
    private boolean exhausted;

    public EventsByTagPoller(ReadJournalBackend backend, String tag, long afterOffset, long toOffset, Liveness liveness) {
        requireNonNull(backend, ReadJournalBackend.class.getSimpleName() + " cannot be null");
        requireNonNull(tag, "Tag cannot be null");
        requireNonNull(liveness, Liveness.class.getSimpleName() + " cannot be null");
        if (afterOffset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative, was " + afterOffset);
        }
        this.backend = backend;
        this.tag = tag;
        this.toOffset = toOffset;
        this.liveness = liveness;
        this.position = afterOffset;
        this.upperBound = toOffset;
        this.upperBoundResolved = liveness == Liveness.LIVE;
        this.exhausted = afterOffset >= toOffset;
    }

    @Override
    public Mono<PollResult<EventEnvelope>> poll(int maxItems) {
        return resolveUpperBound().flatMap(bound -> {
            if (position >= bound) {
                exhausted = true;
                return Mono.just(PollResult.empty());
            }
            return backend.eventsByTag(tag, position, bound, maxItems)
                    .map(page -> onPage(Poller.requireWithinPageSize(page, maxItems)));
        });
    }

    private Mono<Long> resolveUpperBound() {
        if (upperBoundResolved) {
            return Mono.just(upperBound);
        }
        return backend.highestTagOffset(tag).map(highestOffset -> {
            upperBound = Math.min(toOffset, highestOffset);
            upperBoundResolved = true;
            return upperBound;
        });
    }

    private PollResult<EventEnvelope> onPage(Page<EventEnvelope> page) {
        List<EventEnvelope> events = new ArrayList<>(page.size());
        for (EventEnvelope envelope : page.items()) {
            if (!(envelope.offset() instanceof Offset.Sequence sequence)) {
                throw new IllegalStateException("Expected events of tag " + tag + " to have a sequence offset but was " + envelope.offset());
            }
            if (sequence.value > position) {
                events.add(envelope);
                position = sequence.value;
            }
        }

        boolean awaitRefresh = false;
        if (position >= upperBound) {
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
