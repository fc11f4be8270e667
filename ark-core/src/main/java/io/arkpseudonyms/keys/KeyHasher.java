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

import java.util.List;

/// Reduces an input row to a [Fingerprint].
///
/// Implementations must be deterministic: the same logical row always gives the same
/// fingerprint, and different rows give different fingerprints with overwhelming probability.
@FunctionalInterface
public interface KeyHasher {

    /// @param row the values of one input row, in column order; may contain nulls
    /// @return the row's fingerprint
    Fingerprint fingerprint(List<?> row);
}
