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
import reactor.core.publisher.Mono;

/**
 * Fetches the next chunk of a query from the backend and keeps track of where the query is. A poller belongs to
 * exactly one subscription, and {@link #poll(int)} is never invoked again before the previous {@code Mono} has
 * terminated, so implementations don't need to be thread-safe.
 *
 * @param <T> The type of the items
 */
public interface Poller<T> {

    /**
     * Fetch at most {@code maxItems} items, starting right after the items returned by the previous poll.
     *
     * @param maxItems The maximum number of items, always greater than 0
     * @return A {@code Mono} with the result of this step. Any error terminates the query.
     */
    Mono<PollResult<T>> poll(int maxItems);

    /**
     * @return {@code true} if there's nothing more to fetch, i.e. the query completes once the buffered items have been delivered
     */
    boolean isExhausted();

    /**
     * @throws IllegalStateException If {@code page} holds more than {@code maxItems} items
     */
    static <T> Page<T> requireWithinPageSize(Page<T> page, int maxItems) {
        if (page.size() > maxItems) {
            throw new IllegalStateException("Backend returned " + page.size() + " items but at most " + maxItems + " were requested");
        }
        return page;
    }
}
