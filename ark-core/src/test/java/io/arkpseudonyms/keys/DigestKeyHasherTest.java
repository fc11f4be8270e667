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

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class DigestKeyHasherTest {

    private final DigestKeyHasher hasher = new DigestKeyHasher();

    @Test
    void testSameRowSameFingerprint() {
        Fingerprint a = hasher.fingerprint(List.of("alice", 42));
        Fingerprint b = hasher.fingerprint(List.of("alice", 42));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(64, a.hex().length());
    }

    @Test
    void testTypesAreDistinguished() {
        Fingerprint integer = hasher.fingerprint(List.of(1));
        Fingerprint longValue = hasher.fingerprint(List.of(1L));
        Fingerprint doubleValue = hasher.fingerprint(List.of(1.0));
        Fingerprint string = hasher.fingerprint(List.of("1"));
        assertThat(List.of(integer, longValue, doubleValue, string)).doesNotHaveDuplicates();
    }

    @Test
    void testColumnBoundariesMatter() {
        assertNotEquals(hasher.fingerprint(List.of("ab", "c")), hasher.fingerprint(List.of("a", "bc")));
        assertNotEquals(hasher.fingerprint(List.of("a")), hasher.fingerprint(List.of("a", "")));
    }

    @Test
    void testNullsAndArrays() {
        assertEquals(hasher.fingerprint(Arrays.asList("a", null)), hasher.fingerprint(Arrays.asList("a", null)));
        assertNotEquals(hasher.fingerprint(Arrays.asList((Object) null)), hasher.fingerprint(List.of("null")));
        assertEquals(hasher.fingerprint(List.of(new int[]{1, 2})), hasher.fingerprint(List.of(new int[]{1, 2})));
        assertNotEquals(hasher.fingerprint(List.of(new int[]{1, 2})), hasher.fingerprint(List.of(new int[]{2, 1})));
    }

    @Test
    void testOtherAlgorithm() {
        DigestKeyHasher md5 = new DigestKeyHasher("MD5");
        assertEquals("MD5", md5.getAlgorithm());
        assertEquals(32, md5.fingerprint(List.of("x")).hex().length());
        assertThatThrownBy(() -> new DigestKeyHasher("NOPE-256")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testFingerprintHex() {
        Fingerprint fp = Fingerprint.ofHex("00ff10abcdef0123");
        assertEquals("00ff10abcdef0123", fp.hex());
        assertEquals("00ff10ab", fp.shortHex());
        assertEquals(fp, new Fingerprint(fp.bytes()));
        assertThatThrownBy(() -> new Fingerprint(new byte[0])).isInstanceOf(IllegalArgumentException.class);
    }
}
