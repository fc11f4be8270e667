package io.arkpseudonyms.random;

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


import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.PermutationSampler;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Random sources for shuffling the pseudonym pools.
 * Based on Apache Commons RNG, so a seed reproduces the same pool orderings
 * regardless of JDK version.
 */
public class RandomGenerators {

    /**
     * Available PRNG algorithms.
     * XO_SHI_RO_256_PP is the default for its statistical quality and speed.
     */
    public enum Algorithm {
        /**
         * XorShiro256++ algorithm - 256-bit state, period 2^256 - 1
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * XorShiro128++ algorithm - 128-bit state, period 2^128 - 1
         */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),

        /**
         * SplitMix64 algorithm - 64-bit state, period 2^64
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /**
         * Mersenne Twister (MT) algorithm - 19937-bit state
         */
        MT(RandomSource.MT),

        /**
         * KISS algorithm - 128-bit state
         */
        KISS(RandomSource.KISS);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /**
     * Creates a new random number generator with the specified algorithm and seed.
     *
     * @param algorithm The PRNG algorithm to use
     * @param seed The seed for deterministic random generation
     * @return A uniform random provider
     */
    public static UniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /**
     * Creates a new random number generator with the default algorithm and specified seed.
     *
     * @param seed The seed for deterministic random generation
     * @return A uniform random provider
     */
    public static UniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Creates a new, randomly seeded generator with the default algorithm.
     *
     * @return A uniform random provider
     */
    public static UniformRandomProvider create() {
        return create(Algorithm.XO_SHI_RO_256_PP);
    }

    /**
     * Creates a randomly seeded generator with the specified algorithm.
     *
     * @param algorithm The PRNG algorithm to use
     * @return A new randomly seeded provider
     */
    public static UniformRandomProvider create(Algorithm algorithm) {
        return algorithm.getSource().create();
    }

    /**
     * Shuffles an index array in place (Fisher-Yates).
     *
     * @param indices The array to shuffle
     * @param rng The random number generator
     */
    public static void shuffle(int[] indices, UniformRandomProvider rng) {
        PermutationSampler.shuffle(rng, indices);
    }
}
