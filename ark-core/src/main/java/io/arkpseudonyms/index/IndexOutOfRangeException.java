package io.arkpseudonyms.index;

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

/// Thrown when a linear index or subscript does not address a point of the name space.
/// Under correct use of the codec this never happens, so it signals a programming error.
public class IndexOutOfRangeException extends RuntimeException {
    public IndexOutOfRangeException(String message) {
        super(message);
    }
}
