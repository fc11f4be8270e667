package io.arkpseudonyms.command.common;

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

import picocli.CommandLine;

/**
 * Shared random seed option using {@link Seed} record with automatic parsing.
 */
public class RandomSeedOption {

    /**
     * Immutable random seed specification.
     * When not specified, the pool shuffles are seeded randomly and each run differs.
     *
     * @param value the seed value, or null for a random seed
     */
    public record Seed(Long value) {

        /**
         * Creates a Seed with a specific value.
         */
        public Seed(long value) {
            this(Long.valueOf(value));
        }

        /**
         * Creates a Seed that leaves seeding to the random source.
         */
        public Seed() {
            this((Long) null);
        }

        /**
         * Checks if this seed was explicitly specified.
         */
        public boolean isExplicit() {
            return value != null;
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : "random";
        }
    }

    /**
     * Picocli type converter for {@link Seed} specifications.
     */
    public static class SeedConverter implements CommandLine.ITypeConverter<Seed> {

        @Override
        public Seed convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                return new Seed();
            }

            try {
                return new Seed(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid seed value: " + value + ". Must be a valid long integer."
                );
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Random seed for the pseudonym order; the same seed and input give the same pseudonyms (default: random)",
        converter = SeedConverter.class
    )
    private Seed seed;

    /**
     * Gets the Seed record.
     */
    public Seed getSeedRecord() {
        return seed != null ? seed : new Seed();
    }

    /**
     * Checks if a seed was explicitly specified by the user.
     */
    public boolean isSeedSpecified() {
        return seed != null && seed.isExplicit();
    }
}
