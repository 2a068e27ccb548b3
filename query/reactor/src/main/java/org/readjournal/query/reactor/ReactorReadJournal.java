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

import org.jspecify.annotations.Nullable;
import org.readjournal.query.api.*;
import org.readjournal.query.reactor.internal.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;
import static org.readjournal.query.reactor.internal.Liveness.CURRENT;
import static org.readjournal.query.reactor.internal.Liveness.LIVE;

/**
 * A read journal that implements every query on top of a {@link ReadJournalBackend} by polling it.
 * <p>
 * Every returned {@link Flux} is cold, each subscription gets its own poller and buffer and is driven only by the demand
 * of its subscriber. Live queries poll the backend again every {@link ReadJournalConfig#refreshInterval refresh interval}
 * once they've caught up, and never complete on their own. Current queries complete once they've delivered what the
 * backend stored when they started. A failing backend call terminates the affected subscription with the backend's error.
 * </p>
 * <p>
 * Tag queries support {@link Offset#noOffset()} and {@link Offset#sequence(long)} offsets.
 * </p>
 */
public class ReactorReadJournal implements PersistenceIdsQuery, CurrentPersistenceIdsQuery,
        EventsByPersistenceIdQuery, CurrentEventsByPersistenceIdQuery,
        EventsByTagQuery, CurrentEventsByTagQuery {
    private static final Logger log = LoggerFactory.getLogger(ReactorReadJournal.class);

    private final ReadJournalBackend backend;
    private final ReadJournalConfig config;

    /**
     * Create a read journal with the {@link ReadJournalConfig#defaults() default} configuration
     *
     * @param backend The backend to query
     */
    public ReactorReadJournal(ReadJournalBackend backend) {
        this(backend, ReadJournalConfig.defaults());
    }

    /**
     * @param backend The backend to query
     * @param config  The configuration
     */
    public ReactorReadJournal(ReadJournalBackend backend, ReadJournalConfig config) {
        requireNonNull(backend, ReadJournalBackend.class.getSimpleName() + " cannot be null");
        requireNonNull(config, ReadJournalConfig.class.getSimpleName() + " cannot be null");
        this.backend = backend;
        this.config = config;
        log.info("Created read journal for write plugin {} (maxBufferSize={}, autoAck={}, refreshInterval={})",
                config.writePluginId, config.maxBufferSize, config.autoAck, config.refreshInterval);
    }

    /**
     * @return The id of the write-side journal plugin that this read journal reads from
     */
    public String writePluginId() {
        return config.writePluginId;
    }

    @Override
    public Flux<String> persistenceIds() {
        return query("AllPersistenceIds", () -> new PersistenceIdsPoller(backend, LIVE));
    }

    @Override
    public Flux<String> currentPersistenceIds() {
        return query("CurrentPersistenceIds", () -> new PersistenceIdsPoller(backend, CURRENT));
    }

    @Override
    public Flux<EventEnvelope> eventsByPersistenceId(String persistenceId, long fromSequenceNr, long toSequenceNr) {
        requireNonNull(persistenceId, "PersistenceId cannot be null");
        return query("EventsByPersistenceId-" + persistenceId,
                () -> new EventsByPersistenceIdPoller(backend, persistenceId, fromSequenceNr, toSequenceNr, LIVE));
    }

    @Override
    public Flux<EventEnvelope> currentEventsByPersistenceId(String persistenceId, long fromSequenceNr, long toSequenceNr) {
        requireNonNull(persistenceId, "PersistenceId cannot be null");
        return query("CurrentEventsByPersistenceId-" + persistenceId,
                () -> new EventsByPersistenceIdPoller(backend, persistenceId, fromSequenceNr, toSequenceNr, CURRENT));
    }

    @Override
    public Flux<EventEnvelope> eventsByTag(String tag, @Nullable Offset offset) {
        return eventsByTag(tag, offset, Long.MAX_VALUE);
    }

    /**
     * Same as {@link #eventsByTag(String, Offset)} but completes once the event with offset {@code toOffset} has been delivered.
     *
     * @param tag      The tag
     * @param offset   Where to start (exclusive), {@code null} reads from the beginning
     * @param toOffset Where to stop (inclusive)
     * @return A {@link Flux} of events
     * @throws UnsupportedOffsetException If {@code offset} is neither {@code NoOffset} nor {@code Sequence}
     */
    public Flux<EventEnvelope> eventsByTag(String tag, @Nullable Offset offset, long toOffset) {
        requireNonNull(tag, "Tag cannot be null");
        long afterOffset = startOffset(offset);
        return query("EventsByTag-" + tag, () -> new EventsByTagPoller(backend, tag, afterOffset, toOffset, LIVE));
    }

    @Override
    public Flux<EventEnvelope> currentEventsByTag(String tag, @Nullable Offset offset) {
        return currentEventsByTag(tag, offset, Long.MAX_VALUE);
    }

    /**
     * Same as {@link #currentEventsByTag(String, Offset)} but never reads beyond {@code toOffset} (inclusive).
     *
     * @throws UnsupportedOffsetException If {@code offset} is neither {@code NoOffset} nor {@code Sequence}
     */
    public Flux<EventEnvelope> currentEventsByTag(String tag, @Nullable Offset offset, long toOffset) {
        requireNonNull(tag, "Tag cannot be null");
        long afterOffset = startOffset(offset);
        return query("CurrentEventsByTag-" + tag, () -> new EventsByTagPoller(backend, tag, afterOffset, toOffset, CURRENT));
    }

    private <T> Flux<T> query(String name, Supplier<Poller<T>> poller) {
        return Flux.defer(() -> Flux.from(new DemandDrivenPublisher<>(name, poller.get(), config.maxBufferSize, config.autoAck, config.refreshInterval, config.scheduler)))
                .name(name);
    }

    private static long startOffset(@Nullable Offset offset) {
        if (offset == null || offset instanceof Offset.NoOffset) {
            return 0;
        } else if (offset instanceof Offset.Sequence sequence) {
            return sequence.value;
        }
        throw new UnsupportedOffsetException(offset, ReactorReadJournal.class.getSimpleName() + " does not support " + offset.getClass().getSimpleName()
                + " offsets, use " + Offset.NoOffset.class.getSimpleName() + " or " + Offset.Sequence.class.getSimpleName() + " instead");
    }
}
