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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loading and normalization of name-part word lists.
 *
 * <p>Name parts are stored as a JSON object whose keys are category names and whose
 * values are arrays of words:
 * <pre>{@code
 * {
 *   "adjectives": ["Able", "Brave", "Calm"],
 *   "animals":    ["Ant", "Bear", "Cat"]
 * }
 * }</pre>
 *
 * <p>Raw word lists are cleaned before use: surrounding whitespace is trimmed, inner runs
 * of whitespace collapse to one space, blank entries are dropped and repeated words keep
 * only their first occurrence.
 */
public final class NameParts {
    private static final Logger logger = LogManager.getLogger(NameParts.class);

    /** Classpath location of the bundled name parts. */
    public static final String DEFAULT_RESOURCE = "ark/name_parts.json";

    /** Categories used when no name parts are configured. */
    public static final List<String> DEFAULT_CATEGORIES = List.of("adjectives", "animals");

    private NameParts() {
        // Utility class
    }

    /**
     * Cleans a single word list.
     *
     * @param words raw words, possibly with stray whitespace, blanks or repeats
     * @return the normalized, duplicate-free words in first-seen order
     */
    public static List<String> clean(Collection<String> words) {
        Set<String> cleaned = new LinkedHashSet<>();
        for (String word : words) {
            if (word == null) {
                continue;
            }
            String squished = word.strip().replaceAll("\\s+", " ");
            if (!squished.isEmpty()) {
                cleaned.add(squished);
            }
        }
        return List.copyOf(cleaned);
    }

    /**
     * Cleans every category of a name-part map, keeping category order.
     *
     * @param parts category name to raw words
     * @return category name to cleaned words
     */
    public static Map<String, List<String>> clean(Map<String, ? extends Collection<String>> parts) {
        Map<String, List<String>> cleaned = new LinkedHashMap<>();
        parts.forEach((name, words) -> cleaned.put(name, clean(words)));
        return cleaned;
    }

    /**
     * Reads name parts from JSON. Category order follows the document.
     *
     * @param reader JSON source
     * @return category name to cleaned words
     * @throws IllegalArgumentException if the document is not an object of string arrays
     */
    public static Map<String, List<String>> load(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Name parts are not valid JSON: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new IllegalArgumentException("Name parts must be a JSON object of word arrays");
        }
        JsonObject object = root.getAsJsonObject();
        Map<String, List<String>> parts = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            if (!entry.getValue().isJsonArray()) {
                throw new IllegalArgumentException(
                    "Name part category '" + entry.getKey() + "' must be an array of strings");
            }
            JsonArray array = entry.getValue().getAsJsonArray();
            List<String> words = new ArrayList<>(array.size());
            for (JsonElement element : array) {
                if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
                    throw new IllegalArgumentException(
                        "Name part category '" + entry.getKey() + "' contains a non-string value: " + element);
                }
                words.add(element.getAsString());
            }
            parts.put(entry.getKey(), clean(words));
        }
        return parts;
    }

    /**
     * Reads name parts from a JSON file.
     *
     * @param path the JSON file
     * @return category name to cleaned words
     * @throws IOException if the file cannot be read
     */
    public static Map<String, List<String>> load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Map<String, List<String>> parts = load(reader);
            logger.debug("Loaded {} name part categories from {}", parts.size(), path);
            return parts;
        }
    }

    /**
     * Reads every category of the bundled name parts.
     *
     * @return category name to words
     */
    public static Map<String, List<String>> bundled() {
        InputStream is = NameParts.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (is == null) {
            throw new IllegalStateException("Bundled name parts not found on classpath: " + DEFAULT_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read bundled name parts", e);
        }
    }

    /**
     * @return the default name space: bundled adjectives followed by bundled animals
     */
    public static NameSpace defaults() {
        return select(bundled(), DEFAULT_CATEGORIES);
    }

    /**
     * Builds a name space from a subset of categories, in the requested order.
     *
     * @param parts available categories
     * @param categories names of the categories to use; all of them when empty
     * @return a name space over the selected categories
     * @throws IllegalArgumentException if a requested category is unknown
     */
    public static NameSpace select(Map<String, List<String>> parts, List<String> categories) {
        if (categories == null || categories.isEmpty()) {
            return new NameSpace(parts);
        }
        Map<String, List<String>> selected = new LinkedHashMap<>();
        for (String name : categories) {
            List<String> words = parts.get(name);
            if (words == null) {
                throw new IllegalArgumentException(
                    "Unknown name part category '" + name + "', available: " + parts.keySet());
            }
            selected.put(name, words);
        }
        return new NameSpace(Collections.unmodifiableMap(selected));
    }
}
