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

import reactor.core.publisher.Flux;

public interface EventsByPersistenceIdQuery extends ReadJournal {

    /**
     * Stream the events of the entity identified by {@code persistenceId}, ordered by sequence number. Use {@code 0}
     * and {@link Long#MAX_VALUE} to read all events. The sequence number of each {@link EventEnvelope} can be used to resume
     * from a later point.
     * <p>
     * The stream doesn't complete when it reaches the currently stored events but keeps delivering events as they are written,
     * polling the journal every refresh interval. It does complete once an event with sequence number {@code toSequenceNr}
     * has been delivered, and it completes immediately, without elements, if {@code fromSequenceNr > toSequenceNr}.
     * The stream fails if the journal fails to execute the query.
     * </p>
     *
     * @param persistenceId  The persistence id
     * @param fromSequenceNr The sequence number to start from (inclusive)
     * @param toSequenceNr   The sequence number to end at (inclusive)
     * @return A {@link Flux} of events
     */
    Flux<EventEnvelope> eventsByPersistenceId(String persistenceId, long fromSequenceNr, long toSequenceNr);
}
