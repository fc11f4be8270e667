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

/// Thrown by [PermutationPool#draw(int)] when fewer indices remain than were requested.
/// The pool is left unchanged.
public class InsufficientCapacityException extends RuntimeException {

    private final int requested;
    private final int remaining;

    public InsufficientCapacityException(int requested, int remaining) {
        super(String.format("Requested %d indices but only %d remain in the pool.", requested, remaining));
        this.requested = requested;
        this.remaining = remaining;
    }

    public int getRequested() {
        return requested;
    }

    public int getRemaining() {
        return remaining;
    }
}
