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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.readjournal.backend.inmemory.InMemoryJournal;
import org.readjournal.query.api.Page;
import org.readjournal.testsupport.RecordingReadJournalBackend;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.readjournal.query.reactor.internal.Liveness.CURRENT;
import static org.readjournal.query.reactor.internal.Liveness.LIVE;
import static org.readjournal.testsupport.TestEvents.event;

@DisplayNameGeneration(ReplaceUnderscores.class)
class PersistenceIdsPollerTest {

    private InMemoryJournal journal;

    @BeforeEach
    void create_journal() {
        journal = new InMemoryJournal();
        journal.write("a", event("a-1"));
        journal.write("b", event("b-1"));
        journal.write("c", event("c-1"));
    }

    @Test
    void current_poller_pages_through_the_persistence_ids_and_is_then_exhausted() {
        // Given
        PersistenceIdsPoller poller = new PersistenceIdsPoller(journal, CURRENT);

        // When
        PollResult<String> first = poller.poll(2).block();
        boolean exhaustedAfterFirst = poller.isExhausted();
        PollResult<String> second = poller.poll(2).block();

        // Then
        assertThat(first.items()).containsExactly("a", "b");
        assertThat(exhaustedAfterFirst).isFalse();
        assertThat(second.items()).containsExactly("c");
        assertThat(poller.isExhausted()).isTrue();
    }

    @Test
    void live_poller_awaits_refresh_and_then_picks_up_new_persistence_ids() {
        // Given
        RecordingReadJournalBackend backend = new RecordingReadJournalBackend(journal);
        PersistenceIdsPoller poller = new PersistenceIdsPoller(backend, LIVE);
        PollResult<String> first = poller.poll(10).block();

        // When
        journal.write("d", event("d-1"));
        PollResult<String> second = poller.poll(10).block();

        // Then
        assertThat(first.awaitRefresh()).isTrue();
        assertThat(second.items()).containsExactly("d");
        assertThat(poller.isExhausted()).isFalse();
        assertThat(backend.calls()).containsExactly("persistenceIds(0, 10)", "persistenceIds(3, 10)");
    }

    @Test
    void emits_every_persistence_id_at_most_once() {
        // Given
        RecordingReadJournalBackend backend = new RecordingReadJournalBackend(journal) {
            @Override
            public Mono<Page<String>> persistenceIds(long fromIndex, int pageSize) {
                return Mono.just(Page.of(List.of("a", "b", "a"), fromIndex == 0));
            }
        };
        PersistenceIdsPoller poller = new PersistenceIdsPoller(backend, CURRENT);

        // When
        PollResult<String> first = poller.poll(10).block();
        PollResult<String> second = poller.poll(10).block();

        // Then
        assertThat(first.items()).containsExactly("a", "b");
        assertThat(second.items()).isEmpty();
    }
}
