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

import io.arkpseudonyms.names.NameSpace;

/**
 * Mixed-radix conversion between a linear index and a per-category subscript.
 *
 * <h2>Radix order</h2>
 *
 * <p>The <b>rightmost category varies fastest</b>. Both directions depend on this, so it
 * must not change once pseudonyms have been issued from a given configuration.
 *
 * <pre>{@code
 * sizes = [3, 2]           weights = [2, 1]
 *
 *   index  subscript          index  subscript
 *     1     [1, 1]              4     [2, 2]
 *     2     [1, 2]              5     [3, 1]
 *     3     [2, 1]              6     [3, 2]
 *
 * index = 1 + sum((pos[i] - 1) * weight[i])
 * }</pre>
 *
 * <p>Indices and subscript positions are both 1-based.
 */
public final class SubscriptCodec {

    private final int[] sizes;
    private final int[] weights;
    private final int total;

    /**
     * @param sizes category sizes in category order, each at least 1, with a product that fits an int
     */
    public SubscriptCodec(int[] sizes) {
        if (sizes.length == 0) {
            throw new IllegalArgumentException("At least one category size is required");
        }
        this.sizes = sizes.clone();
        this.weights = new int[sizes.length];
        long weight = 1L;
        for (int i = sizes.length - 1; i >= 0; i--) {
            if (sizes[i] < 1) {
                throw new IllegalArgumentException("Category " + i + " has size " + sizes[i]);
            }
            weights[i] = (int) weight;
            weight *= sizes[i];
            if (weight > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Product of category sizes overflows an int");
            }
        }
        this.total = (int) weight;
    }

    /**
     * @param nameSpace the name space whose category sizes define the radix
     * @return a codec for the name space
     */
    public static SubscriptCodec of(NameSpace nameSpace) {
        return new SubscriptCodec(nameSpace.sizes());
    }

    /**
     * @return the largest valid index
     */
    public int total() {
        return total;
    }

    /**
     * @return the number of categories, which is the subscript length
     */
    public int arity() {
        return sizes.length;
    }

    /**
     * Encodes one subscript.
     *
     * @param subscript one 1-based position per category
     * @return the linear index in {@code [1, total]}
     * @throws IndexOutOfRangeException if the subscript has the wrong length or a position is out of range
     */
    public int encode(int... subscript) {
        if (subscript.length != sizes.length) {
            throw new IndexOutOfRangeException(String.format(
                "Subscript has %d positions but there are %d categories", subscript.length, sizes.length));
        }
        int index = 0;
        for (int i = 0; i < sizes.length; i++) {
            int pos = subscript[i];
            if (pos < 1 || pos > sizes[i]) {
                throw new IndexOutOfRangeException(String.format(
                    "Position %d of category %d is outside [1, %d]", pos, i, sizes[i]));
            }
            index += (pos - 1) * weights[i];
        }
        return index + 1;
    }

    /**
     * Decodes one linear index.
     *
     * @param index linear index in {@code [1, total]}
     * @return one 1-based position per category
     * @throws IndexOutOfRangeException if the index is outside {@code [1, total]}
     */
    public int[] decode(int index) {
        if (index < 1 || index > total) {
            throw new IndexOutOfRangeException(String.format(
                "Index %d is outside [1, %d]", index, total));
        }
        int[] subscript = new int[sizes.length];
        int remainder = index - 1;
        for (int i = sizes.length - 1; i >= 0; i--) {
            subscript[i] = remainder % sizes[i] + 1;
            remainder /= sizes[i];
        }
        return subscript;
    }

    /**
     * Encodes a batch of subscripts, preserving order.
     *
     * @param subscripts subscripts to encode
     * @return the linear index of each subscript
     */
    public int[] encodeAll(int[][] subscripts) {
        int[] indices = new int[subscripts.length];
        for (int i = 0; i < subscripts.length; i++) {
            indices[i] = encode(subscripts[i]);
        }
        return indices;
    }

    /**
     * Decodes a batch of indices, preserving order.
     *
     * @param indices indices to decode
     * @return the subscript of each index
     */
    public int[][] decodeAll(int[] indices) {
        int[][] subscripts = new int[indices.length][];
        for (int i = 0; i < indices.length; i++) {
            subscripts[i] = decode(indices[i]);
        }
        return subscripts;
    }
}
