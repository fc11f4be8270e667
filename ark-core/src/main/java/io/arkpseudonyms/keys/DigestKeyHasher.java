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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.List;

/**
 * {@link KeyHasher} backed by a {@link MessageDigest}, SHA-256 by default.
 *
 * <p>Each row is serialized as its value count followed by, per value, a type tag and the
 * value's text, every part length-prefixed. The type tag keeps values of different types
 * apart even when they print the same, so {@code 1} (an {@link Integer}) and {@code 1.0}
 * or {@code 1L} receive different fingerprints, and {@code "1"} differs from both.
 * Arrays are serialized element-wise.
 */
public class DigestKeyHasher implements KeyHasher {

    /** The default digest algorithm. */
    public static final String DEFAULT_ALGORITHM = "SHA-256";

    private final String algorithm;

    /**
     * Creates a SHA-256 hasher.
     */
    public DigestKeyHasher() {
        this(DEFAULT_ALGORITHM);
    }

    /**
     * @param algorithm a {@link MessageDigest} algorithm name, for example {@code MD5}
     * @throws IllegalArgumentException if the algorithm is not available
     */
    public DigestKeyHasher(String algorithm) {
        newDigest(algorithm);
        this.algorithm = algorithm;
    }

    /**
     * @return the digest algorithm name
     */
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public Fingerprint fingerprint(List<?> row) {
        MessageDigest digest = newDigest(algorithm);
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(row.size()).array());
        for (Object value : row) {
            update(digest, tag(value));
            update(digest, text(value));
        }
        return new Fingerprint(digest.digest());
    }

    private static String tag(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }

    private static String text(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof byte[]) {
            return Arrays.toString((byte[]) value);
        }
        if (value instanceof Object[]) {
            return Arrays.deepToString((Object[]) value);
        }
        if (value instanceof int[]) {
            return Arrays.toString((int[]) value);
        }
        if (value instanceof long[]) {
            return Arrays.toString((long[]) value);
        }
        if (value instanceof double[]) {
            return Arrays.toString((double[]) value);
        }
        return String.valueOf(value);
    }

    private static void update(MessageDigest digest, String part) {
        byte[] bytes = part.getBytes(StandardCharsets.UTF_8);
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        digest.update(bytes);
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Digest algorithm not available: " + algorithm, e);
        }
    }
}
