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

import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of one {@link Poller#poll(int)} step.
 *
 * @param <T> The type of the items
 */
public final class PollResult<T> {
    private static final Runnable NO_ACKNOWLEDGEMENT = () -> {
    };

    private final List<T> items;
    private final boolean awaitRefresh;
    private final Runnable acknowledgement;

    private PollResult(List<T> items, boolean awaitRefresh, Runnable acknowledgement) {
        requireNonNull(items, "Items cannot be null");
        requireNonNull(acknowledgement, "Acknowledgement cannot be null");
        this.items = items;
        this.awaitRefresh = awaitRefresh;
        this.acknowledgement = acknowledgement;
    }

    /**
     * @param items           The items to deliver, in order
     * @param awaitRefresh    {@code true} if the poller has caught up and should not be polled again until the refresh interval has passed
     * @param acknowledgement Acknowledges the backend page that the items came from
     */
    public static <T> PollResult<T> of(List<T> items, boolean awaitRefresh, Runnable acknowledgement) {
        return new PollResult<>(items, awaitRefresh, acknowledgement);
    }

    public static <T> PollResult<T> empty() {
        return new PollResult<>(Collections.emptyList(), false, NO_ACKNOWLEDGEMENT);
    }

    public List<T> items() {
        return items;
    }

    public boolean awaitRefresh() {
        return awaitRefresh;
    }

    public void acknowledge() {
        acknowledgement.run();
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", PollResult.class.getSimpleName() + "[", "]")
                .add("size=" + items.size())
                .add("awaitRefresh=" + awaitRefresh)
                .toString();
    }
}
