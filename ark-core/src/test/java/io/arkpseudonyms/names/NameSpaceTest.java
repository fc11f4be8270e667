package io.arkpseudonyms.names;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class NameSpaceTest {

    @Test
    void testSizesAndTotal() {
        NameSpace ns = NameSpace.of(List.of("Big", "Blue", "Bold"), List.of("Bear", "Bat"));
        assertArrayEquals(new int[]{3, 2}, ns.sizes());
        assertEquals(6, ns.total());
        assertEquals(2, ns.categoryCount());
        assertThat(ns.categoryNames()).containsExactly("part1", "part2");
    }

    @Test
    void testCategoryOrderFollowsMap() {
        Map<String, List<String>> parts = new LinkedHashMap<>();
        parts.put("colors", List.of("Red"));
        parts.put("animals", List.of("Ant", "Bee"));
        NameSpace ns = new NameSpace(parts);
        assertThat(ns.categoryNames()).containsExactly("colors", "animals");
        assertEquals("Bee", ns.word(1, 2));
        assertEquals("Red", ns.word(0, 1));
    }

    @Test
    void testSizesIsDefensiveCopy() {
        NameSpace ns = NameSpace.of(List.of("A"), List.of("B", "C"));
        ns.sizes()[1] = 99;
        assertArrayEquals(new int[]{1, 2}, ns.sizes());
    }

    @Test
    void testEmptyCategoryRejected() {
        Map<String, List<String>> parts = new LinkedHashMap<>();
        parts.put("adjectives", List.of("Big"));
        parts.put("animals", List.of());
        assertThatThrownBy(() -> new NameSpace(parts))
            .isInstanceOf(EmptyCategoryException.class)
            .hasMessageContaining("animals")
            .satisfies(e -> {
                EmptyCategoryException ece = (EmptyCategoryException) e;
                assertEquals("animals", ece.getCategory());
                assertEquals(1, ece.getPosition());
            });
    }

    @Test
    void testNoCategoriesRejected() {
        assertThatThrownBy(() -> new NameSpace(Map.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDuplicateWordsRejected() {
        assertThatThrownBy(() -> NameSpace.of(List.of("Big", "Big")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Big");
    }

    @Test
    void testWordsAreCaseSensitive() {
        NameSpace ns = NameSpace.of(List.of("big", "Big"));
        assertEquals(2, ns.total());
    }

    @Test
    void testTooLargeRejected() {
        List<String> many = new ArrayList<>();
        for (int i = 0; i < 2000; i++) {
            many.add("w" + i);
        }
        assertThatThrownBy(() -> NameSpace.of(many, many, many))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("too large");
    }
}
