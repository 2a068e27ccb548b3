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

import org.readjournal.query.api.Page;
import org.readjournal.query.api.ReadJournalBackend;
import reactor.core.publisher.Mono;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Pages through the persistence ids known by the backend. Every id is emitted at most once.
 */
public class PersistenceIdsPoller implements Poller<String> {
    private final ReadJournalBackend backend;
    private final Liveness liveness;
    private final Set<String> seen = new HashSet<>();

    private long index;
    private boolean exhausted;

    public PersistenceIdsPoller(ReadJournalBackend backend, Liveness liveness) {
        requireNonNull(backend, ReadJournalBackend.class.getSimpleName() + " cannot be null");
        requireNonNull(liveness, Liveness.class.getSimpleName() + " cannot be null");
        this.backend = backend;
        this.liveness = liveness;
    }

    @Override
    public Mono<PollResult<String>> poll(int maxItems) {
        return backend.persistenceIds(index, maxItems).map(page -> onPage(Poller.requireWithinPageSize(page, maxItems)));
    }

    private PollResult<String> onPage(Page<String> page) {
        index += page.size();
        List<String> unseen = page.items().stream().filter(seen::add).collect(Collectors.toList());
        boolean awaitRefresh = false;
        if (!page.hasMore()) {
            if (liveness == Liveness.CURRENT) {
                exhausted = true;
            } else {
                awaitRefresh = true;
            }
        }
        return PollResult.of(unseen, awaitRefresh, page::acknowledge);
    }

    @Override
    public boolean isExhausted() {
        return exhausted;
    }
}
