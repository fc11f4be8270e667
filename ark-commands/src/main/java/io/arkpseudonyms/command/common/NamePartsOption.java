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

import io.arkpseudonyms.names.NameParts;
import io.arkpseudonyms.names.NameSpace;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared name part options: where the word lists come from and which categories to use.
 */
public class NamePartsOption {

    @CommandLine.Option(
        names = {"-p", "--parts"},
        description = "JSON file of name part categories, e.g. {\"adjectives\": [...], \"animals\": [...]} (default: bundled parts)"
    )
    private Path partsFile;

    @CommandLine.Option(
        names = {"-k", "--categories"},
        split = ",",
        description = "Categories to compose pseudonyms from, in order (default: adjectives,animals for bundled parts, all categories of a parts file)"
    )
    private List<String> categories = new ArrayList<>();

    /**
     * Builds the configured name space.
     *
     * @return the name space
     * @throws IOException if the parts file cannot be read
     */
    public NameSpace nameSpace() throws IOException {
        if (partsFile == null) {
            if (categories.isEmpty()) {
                return NameParts.defaults();
            }
            return NameParts.select(NameParts.bundled(), categories);
        }
        Map<String, List<String>> parts = NameParts.load(partsFile);
        return NameParts.select(parts, categories);
    }

    /**
     * @return a short description of the configured source, for messages
     */
    public String describe() {
        String source = partsFile != null ? partsFile.toString() : "bundled name parts";
        return categories.isEmpty() ? source : source + " " + categories;
    }
}
