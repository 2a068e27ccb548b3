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

public interface CurrentEventsByPersistenceIdQuery extends ReadJournal {

    /**
     * Same as {@link EventsByPersistenceIdQuery#eventsByPersistenceId(String, long, long)} but the stream completes when
     * it reaches the end of the events stored when the query started. Events written after that are not included.
     *
     * @param persistenceId  The persistence id
     * @param fromSequenceNr The sequence number to start from (inclusive)
     * @param toSequenceNr   The sequence number to end at (inclusive)
     * @return A {@link Flux} of events
     */
    Flux<EventEnvelope> currentEventsByPersistenceId(String persistenceId, long fromSequenceNr, long toSequenceNr);
}
