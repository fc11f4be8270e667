package io.arkpseudonyms.keys;

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

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyRowsTest {

    @Test
    void testTranspose() {
        List<List<Object>> rows = KeyRows.rows(List.of("a", "b"), List.of(1, 2));
        assertThat(rows).containsExactly(List.of("a", 1), List.of("b", 2));
    }

    @Test
    void testSingleColumn() {
        assertThat(KeyRows.rows(List.of("x", "y", "x"))).containsExactly(List.of("x"), List.of("y"), List.of("x"));
    }

    @Test
    void testEmptyColumns() {
        assertThat(KeyRows.rows(List.of(), List.of())).isEmpty();
    }

    @Test
    void testInconsistentLengths() {
        assertThatThrownBy(() -> KeyRows.rows(List.of("a", "b"), List.of(1)))
            .isInstanceOf(InconsistentLengthException.class)
            .hasMessageContaining("[2, 1]")
            .satisfies(e -> assertArrayEquals(new int[]{2, 1}, ((InconsistentLengthException) e).getLengths()));
    }

    @Test
    void testNoColumns() {
        assertThatThrownBy(() -> KeyRows.rows()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testAllIntegralDoubles() {
        assertTrue(KeyRows.allIntegralDoubles(List.of(1.0, 2.0), List.of(3.0f, 4.0f)));
        assertFalse(KeyRows.allIntegralDoubles(List.of(1.0, 2.5)));
        assertFalse(KeyRows.allIntegralDoubles(List.of(1.0), List.of(1)));
        assertFalse(KeyRows.allIntegralDoubles(List.of(Double.POSITIVE_INFINITY)));
        assertFalse(KeyRows.allIntegralDoubles(List.of()));
    }
}
