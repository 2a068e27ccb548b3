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

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * One page of results returned by a {@link ReadJournalBackend}. {@link #hasMore()} is the explicit end-of-data
 * signal: {@code false} means that the backend had nothing beyond this page for the requested range at the time
 * it was queried.
 *
 * @param <T> The type of the items
 */
public final class Page<T> {
    private static final Runnable NO_ACKNOWLEDGEMENT = () -> {
    };

    private final List<T> items;
    private final boolean hasMore;
    private final Runnable acknowledgement;

    private Page(List<T> items, boolean hasMore, Runnable acknowledgement) {
        requireNonNull(items, "Items cannot be null");
        requireNonNull(acknowledgement, "Acknowledgement cannot be null");
        this.items = List.copyOf(items);
        this.hasMore = hasMore;
        this.acknowledgement = acknowledgement;
    }

    public static <T> Page<T> of(List<T> items, boolean hasMore) {
        return new Page<>(items, hasMore, NO_ACKNOWLEDGEMENT);
    }

    public static <T> Page<T> last(List<T> items) {
        return of(items, false);
    }

    public static <T> Page<T> empty() {
        return of(Collections.emptyList(), false);
    }

    /**
     * @param acknowledgement Invoked when every item of this page has been consumed, if the consumer acknowledges pages automatically.
     * @return A new {@code Page} with the same items that runs {@code acknowledgement} on {@link #acknowledge()}.
     */
    public Page<T> withAcknowledgement(Runnable acknowledgement) {
        return new Page<>(items, hasMore, acknowledgement);
    }

    public List<T> items() {
        return items;
    }

    public boolean hasMore() {
        return hasMore;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    public void acknowledge() {
        acknowledgement.run();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Page)) return false;
        Page<?> page = (Page<?>) o;
        return hasMore == page.hasMore && Objects.equals(items, page.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(items, hasMore);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", Page.class.getSimpleName() + "[", "]")
                .add("size=" + items.size())
                .add("hasMore=" + hasMore)
                .toString();
    }
}
