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

import io.arkpseudonyms.random.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Arrays;
import java.util.BitSet;

/// A consumable random ordering over a set of linear indices.
///
/// The pool is a shuffled index buffer plus a cursor. Everything before the cursor has been
/// drawn; everything from the cursor to the end is still available:
///
/// ```text
///            cursor              end
///              v                  v
/// [ 7  2  9 |  4  1  8  3  6 ]
///   drawn      remaining
/// ```
///
/// [#draw(int)] advances the cursor. [#remove(int...)] deletes indices that were consumed
/// through some other pool from the remaining part, closing the gaps so the untouched
/// indices keep their relative order. These are the only mutators.
///
/// Not thread safe.
public final class PermutationPool {

    private final int[] order;
    private final int capacity;
    private int cursor;
    private int end;

    private PermutationPool(int[] order) {
        this.order = order;
        this.capacity = order.length;
        this.cursor = 0;
        this.end = order.length;
    }

    /// Create a pool over `1..total` in random order.
    /// @param total the largest index, zero or more
    /// @param rng source of the shuffle
    /// @return a new pool
    public static PermutationPool ofRange(int total, UniformRandomProvider rng) {
        if (total < 0) {
            throw new IllegalArgumentException("Pool size must not be negative: " + total);
        }
        int[] order = new int[total];
        for (int i = 0; i < total; i++) {
            order[i] = i + 1;
        }
        RandomGenerators.shuffle(order, rng);
        return new PermutationPool(order);
    }

    /// Create a pool over an explicit set of indices in random order.
    /// @param indices distinct positive indices; the array is copied
    /// @param rng source of the shuffle
    /// @return a new pool
    public static PermutationPool of(int[] indices, UniformRandomProvider rng) {
        int[] order = indices.clone();
        BitSet seen = new BitSet();
        for (int index : order) {
            if (index < 1) {
                throw new IllegalArgumentException("Pool indices must be positive: " + index);
            }
            if (seen.get(index)) {
                throw new IllegalArgumentException("Pool index " + index + " is given more than once");
            }
            seen.set(index);
        }
        RandomGenerators.shuffle(order, rng);
        return new PermutationPool(order);
    }

    /// Take the next `k` undrawn indices.
    /// @param k how many indices to take
    /// @return the indices in pool order
    /// @throws InsufficientCapacityException if fewer than `k` remain; nothing is drawn then
    public int[] draw(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("Cannot draw a negative number of indices: " + k);
        }
        if (k > remaining()) {
            throw new InsufficientCapacityException(k, remaining());
        }
        int[] drawn = Arrays.copyOfRange(order, cursor, cursor + k);
        cursor += k;
        return drawn;
    }

    /// Remove indices from the undrawn part of the pool.
    /// Indices that were already drawn or never belonged to this pool are ignored.
    /// @param indices the indices to remove
    /// @return how many indices were actually removed
    public int remove(int... indices) {
        if (indices.length == 0 || remaining() == 0) {
            return 0;
        }
        BitSet doomed = new BitSet();
        for (int index : indices) {
            if (index > 0) {
                doomed.set(index);
            }
        }
        int write = cursor;
        for (int read = cursor; read < end; read++) {
            int index = order[read];
            if (!doomed.get(index)) {
                order[write++] = index;
            }
        }
        int removed = end - write;
        end = write;
        return removed;
    }

    /// @return how many indices can still be drawn
    public int remaining() {
        return end - cursor;
    }

    /// @return how many indices the pool held when it was created
    public int capacity() {
        return capacity;
    }

    /// @return how many indices were drawn from this pool
    public int drawn() {
        return cursor;
    }

    /// @param index a linear index
    /// @return true if the index can still be drawn from this pool
    public boolean contains(int index) {
        for (int i = cursor; i < end; i++) {
            if (order[i] == index) {
                return true;
            }
        }
        return false;
    }

    /// @return the undrawn indices in the order they would be drawn (a copy)
    public int[] remainingIndices() {
        return Arrays.copyOfRange(order, cursor, end);
    }

    @Override
    public String toString() {
        return "PermutationPool{capacity=" + capacity + ", drawn=" + cursor + ", remaining=" + remaining() + '}';
    }
}
