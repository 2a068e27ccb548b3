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

public interface PersistenceIdsQuery extends ReadJournal {

    /**
     * Stream the persistence ids of all entities that have written events. The stream doesn't complete when it
     * reaches the persistence ids known at the moment, it keeps emitting persistence ids as new entities write their
     * first event. Each persistence id is emitted at most once per subscription.
     *
     * @return A {@link Flux} of persistence ids
     */
    Flux<String> persistenceIds();
}
