package io.arkpseudonyms;

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

import io.arkpseudonyms.index.AlliterationFinder;
import io.arkpseudonyms.index.InsufficientCapacityException;
import io.arkpseudonyms.index.PermutationPool;
import io.arkpseudonyms.index.SubscriptCodec;
import io.arkpseudonyms.keys.DigestKeyHasher;
import io.arkpseudonyms.keys.Fingerprint;
import io.arkpseudonyms.keys.KeyHasher;
import io.arkpseudonyms.keys.KeyRows;
import io.arkpseudonyms.names.NameParts;
import io.arkpseudonyms.names.NameSpace;
import io.arkpseudonyms.random.RandomGenerators;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A pseudonym archive: issues and remembers pseudonyms for arbitrary keys.
 *
 * <h2>Guarantees</h2>
 *
 * <ul>
 *   <li>The same key always receives the same pseudonym from the same Ark.</li>
 *   <li>No pseudonym is issued to two different keys.</li>
 *   <li>New pseudonyms come in a shuffled order, optionally only alliterations.</li>
 * </ul>
 *
 * <h2>Allocation</h2>
 *
 * <pre>{@code
 *  keys ──► fingerprints ──► registry hit? ──yes──► stored pseudonym
 *                                 │
 *                                 no (deduplicated)
 *                                 ▼
 *            ┌─────────── draw n from selected pool ───────────┐
 *            │   full pool (1..total)   alliteration pool      │
 *            └──────────── remove same n from the other ───────┘
 *                                 │
 *                                 ▼
 *                 decode index ──► one word per category ──► "Word Word"
 * }</pre>
 *
 * <p>The alliteration indices are a subset of the full index range, so an index issued from
 * either pool is removed from the other in the same call. A call that cannot be satisfied
 * throws {@link CapacityExhaustedException} and changes nothing.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * Ark ark = Ark.builder().seed(42).build();
 * List<String> names = ark.pseudonymize(List.of("alice", "bob", "alice"));
 * String one = ark.pseudonymizeRow("carol", 1984);
 * }</pre>
 *
 * <p>All public methods are synchronized on the Ark, so draw and sibling removal happen in
 * one critical section even if an instance is shared.
 */
public class Ark {
    private static final Logger logger = LogManager.getLogger(Ark.class);

    private final NameSpace nameSpace;
    private final SubscriptCodec codec;
    private final boolean alliterate;
    private final KeyHasher keyHasher;
    private final PermutationPool fullPool;
    private final PermutationPool alliterationPool;
    private final Map<Fingerprint, String> registry = new LinkedHashMap<>();

    private Ark(Builder builder) {
        this.nameSpace = builder.nameSpace != null ? builder.nameSpace : NameParts.defaults();
        this.codec = SubscriptCodec.of(nameSpace);
        this.alliterate = builder.alliterate;
        this.keyHasher = builder.keyHasher != null ? builder.keyHasher : new DigestKeyHasher();

        UniformRandomProvider rng = builder.random;
        if (rng == null) {
            rng = builder.seed != null ? RandomGenerators.create(builder.seed) : RandomGenerators.create();
        }
        this.fullPool = PermutationPool.ofRange(nameSpace.total(), rng);
        this.alliterationPool = PermutationPool.of(AlliterationFinder.find(nameSpace, codec), rng);

        logger.debug("Created {}Ark over {} with {} pseudonyms, {} alliterations",
            alliterate ? "alliterating " : "", nameSpace, fullPool.capacity(), alliterationPool.capacity());
    }

    /**
     * @return a builder for a new Ark
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a non-alliterating Ark over the default name parts, randomly seeded
     */
    public static Ark create() {
        return builder().build();
    }

    /**
     * Pseudonymizes key columns using this Ark's default alliteration setting.
     *
     * @param columns one or more equal-length key columns; row {@code i} is the key of output {@code i}
     * @return one pseudonym per row, in row order
     * @see #pseudonymize(boolean, List[])
     */
    public List<String> pseudonymize(List<?>... columns) {
        return pseudonymize(alliterate, columns);
    }

    /**
     * Pseudonymizes key columns.
     *
     * @param alliterate true to issue only alliterating pseudonyms for new keys; keys seen before
     *                   keep their pseudonym either way
     * @param columns one or more equal-length key columns; row {@code i} is the key of output {@code i}
     * @return one pseudonym per row, in row order
     * @throws io.arkpseudonyms.keys.InconsistentLengthException if the columns differ in length
     * @throws CapacityExhaustedException if too few unused pseudonyms of the requested kind remain
     */
    public synchronized List<String> pseudonymize(boolean alliterate, List<?>... columns) {
        List<List<Object>> rows = KeyRows.rows(columns);
        if (KeyRows.allIntegralDoubles(columns)) {
            logger.warn("All keys are whole numbers typed as floating point. They are hashed as such and"
                + " will not match the same numbers typed as integers. Convert them explicitly to avoid"
                + " unexpected pseudonyms.");
        }
        List<Fingerprint> keys = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            keys.add(keyHasher.fingerprint(row));
        }
        return pseudonymizeFingerprints(keys, alliterate);
    }

    /**
     * Pseudonymizes a single key row using this Ark's default alliteration setting.
     *
     * @param values the values of the row, in column order
     * @return the pseudonym of the row
     */
    public synchronized String pseudonymizeRow(Object... values) {
        Fingerprint key = keyHasher.fingerprint(Arrays.asList(values));
        return pseudonymizeFingerprints(List.of(key), alliterate).get(0);
    }

    /**
     * Assigns pseudonyms to already-fingerprinted keys.
     *
     * <p>Known keys reuse their pseudonym. New keys are deduplicated, so a key repeated within
     * the call consumes one pseudonym. New pseudonyms are registered in draw order.
     *
     * @param keys fingerprints, possibly repeated
     * @param alliterate true to draw new pseudonyms from the alliterations only
     * @return one pseudonym per key, in key order
     * @throws CapacityExhaustedException if too few unused pseudonyms of the requested kind remain;
     *     no state changes in that case
     */
    public synchronized List<String> pseudonymizeFingerprints(List<Fingerprint> keys, boolean alliterate) {
        Set<Fingerprint> fresh = new LinkedHashSet<>();
        for (Fingerprint key : keys) {
            Objects.requireNonNull(key, "key");
            if (!registry.containsKey(key)) {
                fresh.add(key);
            }
        }

        int n = fresh.size();
        if (n > 0) {
            PermutationPool source = alliterate ? alliterationPool : fullPool;
            PermutationPool sibling = alliterate ? fullPool : alliterationPool;
            int[] drawn;
            try {
                drawn = source.draw(n);
            } catch (InsufficientCapacityException e) {
                CapacityExhaustedException exhausted = new CapacityExhaustedException(
                    n, fullPool.remaining(), alliterationPool.remaining(), alliterate, e);
                logger.warn(exhausted.getMessage());
                throw exhausted;
            }
            sibling.remove(drawn);

            String[] pseudonyms = toPseudonyms(drawn);
            int i = 0;
            for (Fingerprint key : fresh) {
                registry.put(key, pseudonyms[i++]);
            }
            logger.debug("Issued {} new {}pseudonyms, {} remaining ({} alliterations)",
                n, alliterate ? "alliterating " : "", fullPool.remaining(), alliterationPool.remaining());
        }

        List<String> result = new ArrayList<>(keys.size());
        for (Fingerprint key : keys) {
            result.add(registry.get(key));
        }
        return result;
    }

    /**
     * Looks up the pseudonym of a key row without issuing a new one.
     *
     * @param values the values of the row, in column order
     * @return the pseudonym, or empty if the row has none yet
     */
    public synchronized Optional<String> lookup(Object... values) {
        return Optional.ofNullable(registry.get(keyHasher.fingerprint(Arrays.asList(values))));
    }

    private String[] toPseudonyms(int[] indices) {
        int[][] subscripts = codec.decodeAll(indices);
        String[] pseudonyms = new String[subscripts.length];
        String[] words = new String[nameSpace.categoryCount()];
        for (int i = 0; i < subscripts.length; i++) {
            for (int c = 0; c < words.length; c++) {
                words[c] = nameSpace.word(c, subscripts[i][c]);
            }
            pseudonyms[i] = String.join(" ", words);
        }
        return pseudonyms;
    }

    /**
     * @return number of keys that have a pseudonym
     */
    public synchronized int size() {
        return registry.size();
    }

    /**
     * @return number of issued pseudonyms that are alliterations, whichever way they were requested
     */
    public synchronized int alliterationCount() {
        return alliterationPool.capacity() - alliterationPool.remaining();
    }

    /**
     * @return number of distinct pseudonyms this Ark can ever issue
     */
    public int capacity() {
        return fullPool.capacity();
    }

    /**
     * @return number of alliterating pseudonyms this Ark can ever issue
     */
    public int alliterationCapacity() {
        return alliterationPool.capacity();
    }

    /**
     * @return number of pseudonyms not yet issued
     */
    public synchronized int remaining() {
        return fullPool.remaining();
    }

    /**
     * @return number of alliterating pseudonyms not yet issued
     */
    public synchronized int remainingAlliterations() {
        return alliterationPool.remaining();
    }

    /**
     * @return true if new pseudonyms are alliterations unless a call says otherwise
     */
    public boolean isAlliterating() {
        return alliterate;
    }

    /**
     * @return the name space pseudonyms are composed from
     */
    public NameSpace getNameSpace() {
        return nameSpace;
    }

    /**
     * @return a snapshot of the registry, in the order pseudonyms were issued
     */
    public synchronized Map<Fingerprint, String> entries() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(registry));
    }

    /**
     * @return the issued pseudonyms, in issue order
     */
    public synchronized Collection<String> pseudonyms() {
        return List.copyOf(registry.values());
    }

    @Override
    public String toString() {
        return ArkSummary.render(this);
    }

    /**
     * Builder for {@link Ark}. Every setting is optional.
     */
    public static class Builder {
        private NameSpace nameSpace;
        private boolean alliterate;
        private Long seed;
        private UniformRandomProvider random;
        private KeyHasher keyHasher;

        private Builder() {
        }

        /**
         * @param nameSpace the name parts to compose pseudonyms from; defaults to bundled adjectives and animals
         * @return this builder
         */
        public Builder parts(NameSpace nameSpace) {
            this.nameSpace = Objects.requireNonNull(nameSpace, "nameSpace");
            return this;
        }

        /**
         * Uses raw word lists, cleaned with {@link NameParts#clean(Map)}.
         *
         * @param parts category name to words, in category order
         * @return this builder
         */
        public Builder parts(Map<String, ? extends Collection<String>> parts) {
            this.nameSpace = new NameSpace(NameParts.clean(parts));
            return this;
        }

        /**
         * @param alliterate whether new pseudonyms are alliterations by default
         * @return this builder
         */
        public Builder alliterate(boolean alliterate) {
            this.alliterate = alliterate;
            return this;
        }

        /**
         * @param seed seed for the pool shuffles; makes the Ark reproducible
         * @return this builder
         */
        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * @param random random source for the pool shuffles; takes precedence over {@link #seed(long)}
         * @return this builder
         */
        public Builder random(UniformRandomProvider random) {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        /**
         * @param keyHasher how key rows become fingerprints; defaults to {@link DigestKeyHasher}
         * @return this builder
         */
        public Builder keyHasher(KeyHasher keyHasher) {
            this.keyHasher = Objects.requireNonNull(keyHasher, "keyHasher");
            return this;
        }

        /**
         * @return a new Ark
         */
        public Ark build() {
            return new Ark(this);
        }
    }
}
