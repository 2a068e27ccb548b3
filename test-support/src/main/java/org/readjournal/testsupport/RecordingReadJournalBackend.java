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

package org.readjournal.testsupport;

import org.readjournal.query.api.EventEnvelope;
import org.readjournal.query.api.Page;
import org.readjournal.query.api.ReadJournalBackend;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * A {@link ReadJournalBackend} that delegates to another backend while recording every call it receives. It can also
 * be told to fail subsequent calls, which is useful to simulate an unavailable event store.
 */
public class RecordingReadJournalBackend implements ReadJournalBackend {

    private final ReadJournalBackend delegate;
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final AtomicReference<Supplier<? extends Throwable>> failure = new AtomicReference<>();

    public RecordingReadJournalBackend(ReadJournalBackend delegate) {
        requireNonNull(delegate, ReadJournalBackend.class.getSimpleName() + " cannot be null");
        this.delegate = delegate;
    }

    /**
     * Make every following call fail with the error returned by {@code error}.
     */
    public void failWith(Supplier<? extends Throwable> error) {
        failure.set(requireNonNull(error, "Error supplier cannot be null"));
    }

    public void recover() {
        failure.set(null);
    }

    /**
     * @return The calls received so far, formatted as {@code methodName(arg1, arg2, ...)}
     */
    public List<String> calls() {
        return List.copyOf(calls);
    }

    public int numberOfCalls() {
        return calls.size();
    }

    @Override
    public Mono<Page<String>> persistenceIds(long fromIndex, int pageSize) {
        return record("persistenceIds(" + fromIndex + ", " + pageSize + ")", () -> delegate.persistenceIds(fromIndex, pageSize));
    }

    @Override
    public Mono<Long> highestSequenceNr(String persistenceId) {
        return record("highestSequenceNr(" + persistenceId + ")", () -> delegate.highestSequenceNr(persistenceId));
    }

    @Override
    public Mono<Page<EventEnvelope>> eventsByPersistenceId(String persistenceId, long fromSequenceNr, long toSequenceNr, int pageSize) {
        return record("eventsByPersistenceId(" + persistenceId + ", " + fromSequenceNr + ", " + toSequenceNr + ", " + pageSize + ")",
                () -> delegate.eventsByPersistenceId(persistenceId, fromSequenceNr, toSequenceNr, pageSize));
    }

    @Override
    public Mono<Long> highestTagOffset(String tag) {
        return record("highestTagOffset(" + tag + ")", () -> delegate.highestTagOffset(tag));
    }

    @Override
    public Mono<Page<EventEnvelope>> eventsByTag(String tag, long afterOffset, long toOffset, int pageSize) {
        return record("eventsByTag(" + tag + ", " + afterOffset + ", " + toOffset + ", " + pageSize + ")",
                () -> delegate.eventsByTag(tag, afterOffset, toOffset, pageSize));
    }

    private <T> Mono<T> record(String call, Supplier<Mono<T>> delegateCall) {
        return Mono.defer(() -> {
            calls.add(call);
            Supplier<? extends Throwable> error = failure.get();
            if (error != null) {
                return Mono.error(error.get());
            }
            return delegateCall.get();
        });
    }
}
