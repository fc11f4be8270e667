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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// The ordered name-part categories that pseudonyms are composed from.
///
/// A pseudonym takes exactly one word from every category, in category order. The
/// number of distinct pseudonyms is the product of the category sizes:
///
/// ```text
/// adjectives: [Big, Blue]      sizes = [2, 2]
/// animals:    [Bear, Bat]      total = 4
///
///   1: Big Bear   2: Big Bat   3: Blue Bear   4: Blue Bat
/// ```
///
/// Instances are immutable. Words are used exactly as given; use
/// [NameParts#clean(Map)] to normalize raw word lists first.
public final class NameSpace {

    /// Largest name space whose indices can all be held in one array.
    public static final int MAX_TOTAL = Integer.MAX_VALUE - 8;

    private final List<String> categoryNames;
    private final List<List<String>> categories;
    private final int[] sizes;
    private final int total;

    /// Create a name space from named categories, in the map's iteration order.
    /// @param categories category name to word list, each list non-empty with distinct words
    /// @throws EmptyCategoryException if any category has no words
    /// @throws IllegalArgumentException if there are no categories, a category repeats a word,
    ///     or the total exceeds [#MAX_TOTAL]
    public NameSpace(Map<String, ? extends List<String>> categories) {
        Objects.requireNonNull(categories, "categories");
        if (categories.isEmpty()) {
            throw new IllegalArgumentException("A name space needs at least one category");
        }
        List<String> names = new ArrayList<>(categories.size());
        List<List<String>> words = new ArrayList<>(categories.size());
        int[] sizes = new int[categories.size()];
        long total = 1L;
        int position = 0;
        for (Map.Entry<String, ? extends List<String>> entry : categories.entrySet()) {
            String name = Objects.requireNonNull(entry.getKey(), "category name");
            List<String> list = List.copyOf(Objects.requireNonNull(entry.getValue(), name));
            if (list.isEmpty()) {
                throw new EmptyCategoryException(name, position);
            }
            Set<String> seen = new HashSet<>();
            for (String word : list) {
                if (!seen.add(word)) {
                    throw new IllegalArgumentException(
                        "Category '" + name + "' contains the word '" + word + "' more than once");
                }
            }
            total *= list.size();
            if (total > MAX_TOTAL) {
                throw new IllegalArgumentException(
                    "Name space is too large: more than " + MAX_TOTAL + " combinations");
            }
            names.add(name);
            words.add(list);
            sizes[position++] = list.size();
        }
        this.categoryNames = Collections.unmodifiableList(names);
        this.categories = Collections.unmodifiableList(words);
        this.sizes = sizes;
        this.total = (int) total;
    }

    /// Create a name space from unnamed categories, which are named `part1`, `part2`, ...
    /// @param categories the word lists, in category order
    /// @return a new name space
    @SafeVarargs
    public static NameSpace of(List<String>... categories) {
        Map<String, List<String>> named = new LinkedHashMap<>();
        for (int i = 0; i < categories.length; i++) {
            named.put("part" + (i + 1), categories[i]);
        }
        return new NameSpace(named);
    }

    /// @return the number of words in each category, in category order (a copy)
    public int[] sizes() {
        return sizes.clone();
    }

    /// @return the number of distinct pseudonyms in this name space
    public int total() {
        return total;
    }

    /// @return the number of categories
    public int categoryCount() {
        return sizes.length;
    }

    /// @return the category names, in category order
    public List<String> categoryNames() {
        return categoryNames;
    }

    /// @param category zero-based category position
    /// @return the words of the category
    public List<String> category(int category) {
        return categories.get(category);
    }

    /// Look up a word by its 1-based position within a category.
    /// @param category zero-based category position
    /// @param position 1-based word position
    /// @return the word
    public String word(int category, int position) {
        return categories.get(category).get(position - 1);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NameSpace{");
        for (int i = 0; i < sizes.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(categoryNames.get(i)).append('=').append(sizes[i]);
        }
        return sb.append(", total=").append(total).append('}').toString();
    }
}
