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

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/// An opaque, fixed-length digest of one input row, used as the registry key.
///
/// Equality is by digest content.
public final class Fingerprint {

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] digest;

    /// @param digest the digest bytes; copied
    public Fingerprint(byte[] digest) {
        Objects.requireNonNull(digest, "digest");
        if (digest.length == 0) {
            throw new IllegalArgumentException("A fingerprint needs at least one byte");
        }
        this.digest = digest.clone();
    }

    /// @param hex an even-length hexadecimal string
    /// @return the fingerprint with those bytes
    public static Fingerprint ofHex(String hex) {
        return new Fingerprint(HEX.parseHex(hex));
    }

    /// @return the digest bytes (a copy)
    public byte[] bytes() {
        return digest.clone();
    }

    /// @return the full digest as lowercase hex
    public String hex() {
        return HEX.formatHex(digest);
    }

    /// @return the first 8 hex characters, enough to tell entries apart in listings
    public String shortHex() {
        String hex = hex();
        return hex.length() <= 8 ? hex : hex.substring(0, 8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Fingerprint)) {
            return false;
        }
        return Arrays.equals(digest, ((Fingerprint) o).digest);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(digest);
    }

    @Override
    public String toString() {
        return hex();
    }
}
