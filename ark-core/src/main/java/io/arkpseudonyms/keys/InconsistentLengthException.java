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

/// Thrown when key columns passed together do not all have the same length.
/// Raised before any row is hashed or any pseudonym is drawn.
public class InconsistentLengthException extends RuntimeException {

    private final int[] lengths;

    public InconsistentLengthException(int[] lengths) {
        super("All key columns must have the same length, but got lengths " + Arrays.toString(lengths) + ".");
        this.lengths = lengths.clone();
    }

    public int[] getLengths() {
        return lengths.clone();
    }
}
