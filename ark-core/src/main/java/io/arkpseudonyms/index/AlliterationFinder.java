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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/// Enumerates the linear indices of all alliterating pseudonyms in a name space.
///
/// A pseudonym alliterates when every word starts with the same letter `A`..`Z`,
/// compared case-insensitively. Words starting with any other character never alliterate.
///
/// For each letter, the matching word positions of every category are collected. If any
/// category has none, the letter contributes nothing; otherwise every combination of the
/// matching positions is encoded:
///
/// ```text
/// adjectives: [Big, Blue, Cold]     B -> {1, 2}    C -> {3}
/// animals:    [Bear, Bat, Dog]      B -> {1, 2}    C -> {}
///
/// B: {1,2} x {1,2} -> [1,1] [1,2] [2,1] [2,2]
/// C: no animal starts with C -> nothing
/// ```
public final class AlliterationFinder {
    private static final Logger logger = LogManager.getLogger(AlliterationFinder.class);

    private AlliterationFinder() {
        // Utility class
    }

    /// Find every alliterating index of a name space.
    /// @param nameSpace the name space to search
    /// @return the alliterating indices, ascending and without duplicates; possibly empty
    public static int[] find(NameSpace nameSpace) {
        return find(nameSpace, SubscriptCodec.of(nameSpace));
    }

    /// Find every alliterating index of a name space using an existing codec.
    /// @param nameSpace the name space to search
    /// @param codec a codec built from the same name space
    /// @return the alliterating indices, ascending and without duplicates; possibly empty
    public static int[] find(NameSpace nameSpace, SubscriptCodec codec) {
        int categoryCount = nameSpace.categoryCount();
        char[][] initials = new char[categoryCount][];
        for (int c = 0; c < categoryCount; c++) {
            List<String> words = nameSpace.category(c);
            initials[c] = new char[words.size()];
            for (int w = 0; w < words.size(); w++) {
                initials[c][w] = initial(words.get(w));
            }
        }

        BitSet found = new BitSet(nameSpace.total() + 1);
        for (char letter = 'A'; letter <= 'Z'; letter++) {
            int[][] positions = new int[categoryCount][];
            boolean complete = true;
            for (int c = 0; c < categoryCount && complete; c++) {
                positions[c] = positionsOf(initials[c], letter);
                complete = positions[c].length > 0;
            }
            if (complete) {
                addCombinations(positions, codec, found);
            }
        }

        int[] indices = found.stream().toArray();
        logger.debug("Found {} alliterations among {} pseudonyms", indices.length, nameSpace.total());
        return indices;
    }

    /// @param words the words of one pseudonym
    /// @return true if every word starts with the same letter `A`..`Z`, ignoring case
    public static boolean isAlliteration(List<String> words) {
        if (words.isEmpty()) {
            return false;
        }
        char first = initial(words.get(0));
        if (first == 0) {
            return false;
        }
        for (String word : words) {
            if (initial(word) != first) {
                return false;
            }
        }
        return true;
    }

    /// @return the upper-cased first letter if it is `A`..`Z`, else 0
    private static char initial(String word) {
        if (word.isEmpty()) {
            return 0;
        }
        char c = Character.toUpperCase(word.charAt(0));
        return c >= 'A' && c <= 'Z' ? c : 0;
    }

    private static int[] positionsOf(char[] initials, char letter) {
        int[] positions = new int[initials.length];
        int count = 0;
        for (int i = 0; i < initials.length; i++) {
            if (initials[i] == letter) {
                positions[count++] = i + 1;
            }
        }
        return Arrays.copyOf(positions, count);
    }

    /// Odometer walk over the cartesian product of the per-category position sets.
    private static void addCombinations(int[][] positions, SubscriptCodec codec, BitSet found) {
        int n = positions.length;
        int[] cursor = new int[n];
        int[] subscript = new int[n];
        while (true) {
            for (int c = 0; c < n; c++) {
                subscript[c] = positions[c][cursor[c]];
            }
            found.set(codec.encode(subscript));

            int c = n - 1;
            while (c >= 0 && ++cursor[c] == positions[c].length) {
                cursor[c] = 0;
                c--;
            }
            if (c < 0) {
                return;
            }
        }
    }
}
