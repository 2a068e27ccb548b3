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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class PageTest {

    @Test
    void acknowledging_a_page_without_acknowledgement_does_nothing() {
        // Given
        Page<String> page = Page.of(List.of("a", "b"), true);

        // When
        page.acknowledge();

        // Then
        assertThat(page.items()).containsExactly("a", "b");
        assertThat(page.hasMore()).isTrue();
    }

    @Test
    void acknowledging_a_page_runs_its_acknowledgement() {
        // Given
        AtomicInteger acknowledgements = new AtomicInteger();
        Page<String> page = Page.last(List.of("a")).withAcknowledgement(acknowledgements::incrementAndGet);

        // When
        page.acknowledge();

        // Then
        assertThat(acknowledgements).hasValue(1);
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void items_cannot_be_modified() {
        // Given
        List<String> items = new ArrayList<>(List.of("a"));
        Page<String> page = Page.of(items, false);

        // When
        Throwable throwable = catchThrowable(() -> page.items().add("b"));

        // Then
        assertThat(throwable).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void empty_page_has_no_more_items() {
        assertThat(Page.empty().isEmpty()).isTrue();
        assertThat(Page.empty().hasMore()).isFalse();
    }
}
