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

import reactor.core.publisher.Mono;

/**
 * The queries a read journal needs from the underlying event store. Every method fetches a bounded page, or a single
 * value, and returns immediately; the work happens when the returned {@link Mono} is subscribed to. Implementations
 * own their retry and timeout policy, an error signalled by the {@code Mono} terminates the query that issued the call.
 */
public interface ReadJournalBackend {

    /**
     * @param fromIndex The zero-based index of the first persistence id to return, persistence ids are ordered by the time their first event was written.
     * @param pageSize  The maximum number of persistence ids to return
     * @return A page of persistence ids
     */
    Mono<Page<String>> persistenceIds(long fromIndex, int pageSize);

    /**
     * @param persistenceId The persistence id
     * @return The sequence number of the latest event ever written for the {@code persistenceId}, deleted events included, or {@code 0} if none.
     */
    Mono<Long> highestSequenceNr(String persistenceId);

    /**
     * @param persistenceId  The persistence id whose events to read
     * @param fromSequenceNr The lowest sequence number to include
     * @param toSequenceNr   The highest sequence number to include
     * @param pageSize       The maximum number of events to return
     * @return A page of events ordered by ascending sequence number. Events that have been deleted are skipped.
     */
    Mono<Page<EventEnvelope>> eventsByPersistenceId(String persistenceId, long fromSequenceNr, long toSequenceNr, int pageSize);

    /**
     * @param tag The tag
     * @return The offset of the latest event written with the {@code tag}, or {@code 0} if none.
     */
    Mono<Long> highestTagOffset(String tag);

    /**
     * @param tag         The tag whose events to read
     * @param afterOffset Only events with an offset strictly greater than this are included, {@code 0} means from the beginning.
     * @param toOffset    The highest offset to include
     * @param pageSize    The maximum number of events to return
     * @return A page of events ordered by ascending {@link Offset.Sequence} offset
     */
    Mono<Page<EventEnvelope>> eventsByTag(String tag, long afterOffset, long toOffset, int pageSize);
}
