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

package org.readjournal.backend.inmemory;

import io.cloudevents.CloudEvent;
import io.cloudevents.SpecVersion;
import org.readjournal.cloudevents.JournalPosition;
import org.readjournal.query.api.EventEnvelope;
import org.readjournal.query.api.Offset;
import org.readjournal.query.api.Page;
import org.readjournal.query.api.ReadJournalBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A {@link ReadJournalBackend} that keeps the journal in-memory. This is mainly useful for testing and/or demo purposes.
 * Besides the queries it supports writing events, optionally tagged, and deleting a prefix of the events of a persistence id,
 * i.e. the parts of a write-side journal that a read journal depends on.
 * <p>
 * Every written {@link CloudEvent} is stamped with its {@link JournalPosition}, and the persistence id and sequence number of
 * each {@link EventEnvelope} are read from that stamp.
 * Tagged events are appended to the projection of each of their tags with a per-tag offset starting at 1. Deleting events from a
 * persistence id doesn't remove them from the tag projections.
 * </p>
 */
public class InMemoryJournal implements ReadJournalBackend {
    private static final Logger log = LoggerFactory.getLogger(InMemoryJournal.class);

    // We cannot use ConcurrentMap since it doesn't maintain insertion order
    private final Map<String, JournalStream> streams = new LinkedHashMap<>();
    private final Map<String, List<EventEnvelope>> tags = new HashMap<>();
    private final AtomicLong acknowledgedPages = new AtomicLong();

    /**
     * Write events for a persistence id without tags
     *
     * @return The sequence number of the last written event
     */
    public long write(String persistenceId, Stream<CloudEvent> events) {
        return write(persistenceId, Collections.emptySet(), events);
    }

    /**
     * Write events for a persistence id without tags
     *
     * @return The sequence number of the last written event
     */
    public long write(String persistenceId, CloudEvent event, CloudEvent... additionalEvents) {
        return write(persistenceId, Stream.concat(Stream.of(event), Arrays.stream(additionalEvents)));
    }

    /**
     * Write events for a persistence id and add them to the projection of each tag in {@code tags}.
     *
     * @return The sequence number of the last written event
     */
    public synchronized long write(String persistenceId, Set<String> tags, Stream<CloudEvent> events) {
        requireNonNull(persistenceId, "PersistenceId cannot be null");
        requireNonNull(tags, "Tags cannot be null");
        requireNonNull(events, "Events cannot be null");

        List<CloudEvent> cloudEvents = events.peek(e -> requireTrue(e.getSpecVersion() == SpecVersion.V1, "Spec version needs to be " + SpecVersion.V1)).collect(Collectors.toList());
        if (cloudEvents.isEmpty()) {
            JournalStream existing = streams.get(persistenceId);
            return existing == null ? 0 : existing.highestSequenceNr;
        }

        JournalStream stream = streams.computeIfAbsent(persistenceId, __ -> new JournalStream());
        for (CloudEvent cloudEvent : cloudEvents) {
            CloudEvent journalEvent = JournalPosition.of(persistenceId, ++stream.highestSequenceNr).stamp(cloudEvent);
            JournalPosition position = JournalPosition.of(journalEvent);
            stream.events.add(envelope(Offset.sequence(position.sequenceNr()), position, journalEvent));
            for (String tag : tags) {
                List<EventEnvelope> projection = this.tags.computeIfAbsent(tag, __ -> new ArrayList<>());
                projection.add(envelope(Offset.sequence(projection.size() + 1), position, journalEvent));
            }
        }
        log.debug("Wrote {} events to {} (tags={}), highest sequence number is now {}", cloudEvents.size(), persistenceId, tags, stream.highestSequenceNr);
        return stream.highestSequenceNr;
    }

    private static EventEnvelope envelope(Offset offset, JournalPosition position, CloudEvent journalEvent) {
        return new EventEnvelope(offset, position.persistenceId(), position.sequenceNr(), journalEvent);
    }

    /**
     * Delete all events of {@code persistenceId} up to and including {@code toSequenceNr}. The highest sequence number of the
     * persistence id is retained, as are the tag projections.
     */
    public synchronized void deleteTo(String persistenceId, long toSequenceNr) {
        requireNonNull(persistenceId, "PersistenceId cannot be null");
        JournalStream stream = streams.get(persistenceId);
        if (stream == null) {
            return;
        }
        stream.events.removeIf(envelope -> envelope.sequenceNr() <= toSequenceNr);
        log.debug("Deleted events of {} up to sequence number {}", persistenceId, toSequenceNr);
    }

    /**
     * @return The number of pages handed out by this journal that have been acknowledged
     */
    public long acknowledgedPages() {
        return acknowledgedPages.get();
    }

    @Override
    public Mono<Page<String>> persistenceIds(long fromIndex, int pageSize) {
        requirePageSize(pageSize);
        return Mono.fromCallable(() -> {
            synchronized (this) {
                List<String> persistenceIds = new ArrayList<>(streams.keySet());
                return page(persistenceIds, fromIndex, pageSize);
            }
        });
    }

    @Override
    public Mono<Long> highestSequenceNr(String persistenceId) {
        requireNonNull(persistenceId, "PersistenceId cannot be null");
        return Mono.fromCallable(() -> {
            synchronized (this) {
                JournalStream stream = streams.get(persistenceId);
                return stream == null ? 0L : stream.highestSequenceNr;
            }
        });
    }

    @Override
    public Mono<Page<EventEnvelope>> eventsByPersistenceId(String persistenceId, long fromSequenceNr, long toSequenceNr, int pageSize) {
        requireNonNull(persistenceId, "PersistenceId cannot be null");
        requirePageSize(pageSize);
        return Mono.fromCallable(() -> {
            synchronized (this) {
                JournalStream stream = streams.get(persistenceId);
                if (stream == null) {
                    return page(Collections.<EventEnvelope>emptyList(), 0, pageSize);
                }
                List<EventEnvelope> inRange = stream.events.stream()
                        .filter(envelope -> envelope.sequenceNr() >= fromSequenceNr && envelope.sequenceNr() <= toSequenceNr)
                        .collect(Collectors.toList());
                return page(inRange, 0, pageSize);
            }
        });
    }

    @Override
    public Mono<Long> highestTagOffset(String tag) {
        requireNonNull(tag, "Tag cannot be null");
        return Mono.fromCallable(() -> {
            synchronized (this) {
                return (long) tags.getOrDefault(tag, Collections.emptyList()).size();
            }
        });
    }

    @Override
    public Mono<Page<EventEnvelope>> eventsByTag(String tag, long afterOffset, long toOffset, int pageSize) {
        requireNonNull(tag, "Tag cannot be null");
        requireTrue(afterOffset >= 0, "Offset cannot be negative");
        requirePageSize(pageSize);
        return Mono.fromCallable(() -> {
            synchronized (this) {
                List<EventEnvelope> projection = tags.getOrDefault(tag, Collections.emptyList());
                // Offsets are 1-based positions in the projection
                int to = (int) Math.min(projection.size(), toOffset);
                if (afterOffset >= to) {
                    return page(Collections.<EventEnvelope>emptyList(), 0, pageSize);
                }
                return page(projection.subList((int) afterOffset, to), 0, pageSize);
            }
        });
    }

    private <T> Page<T> page(List<T> items, long fromIndex, int pageSize) {
        int from = (int) Math.min(fromIndex, items.size());
        int to = (int) Math.min((long) from + pageSize, items.size());
        return Page.of(new ArrayList<>(items.subList(from, to)), to < items.size())
                .withAcknowledgement(acknowledgedPages::incrementAndGet);
    }

    private static void requirePageSize(int pageSize) {
        requireTrue(pageSize > 0, "Page size must be greater than 0");
    }

    private static void requireTrue(boolean bool, String message) {
        if (!bool) {
            throw new IllegalArgumentException(message);
        }
    }

    private static class JournalStream {
        private final List<EventEnvelope> events = new ArrayList<>();
        private long highestSequenceNr;
    }
}
