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

/// Thrown when a name-part category has no words, so no pseudonym could be composed.
public class EmptyCategoryException extends RuntimeException {

    private final String category;
    private final int position;

    public EmptyCategoryException(String category, int position) {
        super(String.format("Name part category '%s' (position %d) has no words.", category, position));
        this.category = category;
        this.position = position;
    }

    public String getCategory() {
        return category;
    }

    public int getPosition() {
        return position;
    }
}
