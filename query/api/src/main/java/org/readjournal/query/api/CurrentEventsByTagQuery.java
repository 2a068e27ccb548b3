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

import org.jspecify.annotations.Nullable;
import reactor.core.publisher.Flux;

public interface CurrentEventsByTagQuery extends ReadJournal {

    /**
     * Same as {@link EventsByTagQuery#eventsByTag(String, Offset)} but the stream completes when it reaches the end of the
     * tagged events stored when the query started. Events written after that are not included.
     *
     * @param tag    The tag
     * @param offset Where to start, {@link Offset#noOffset()} (or {@code null}) reads from the beginning
     * @return A {@link Flux} of events
     * @throws UnsupportedOffsetException If the journal doesn't support the kind of {@code offset}
     */
    Flux<EventEnvelope> currentEventsByTag(String tag, @Nullable Offset offset);
}
