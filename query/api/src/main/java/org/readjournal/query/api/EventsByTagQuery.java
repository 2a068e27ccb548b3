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

public interface EventsByTagQuery extends ReadJournal {

    /**
     * Stream the events that were written with the given {@code tag}, ordered by offset, which is the order in which the
     * journal stored them. The {@code offset} is exclusive, so the offset of the last {@link EventEnvelope} that was processed
     * can be passed as-is to resume. Deleting events of a persistence id doesn't remove them from the tag.
     * <p>
     * The stream doesn't complete when it reaches the currently stored events but keeps delivering events as they are written,
     * polling the journal every refresh interval. The stream fails if the journal fails to execute the query.
     * </p>
     *
     * @param tag    The tag
     * @param offset Where to start, {@link Offset#noOffset()} (or {@code null}) reads from the beginning
     * @return A {@link Flux} of events
     * @throws UnsupportedOffsetException If the journal doesn't support the kind of {@code offset}
     */
    Flux<EventEnvelope> eventsByTag(String tag, @Nullable Offset offset);
}
