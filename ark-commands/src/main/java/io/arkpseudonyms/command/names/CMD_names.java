package io.arkpseudonyms.command.names;

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

import io.arkpseudonyms.command.common.NamePartsOption;
import io.arkpseudonyms.index.AlliterationFinder;
import io.arkpseudonyms.names.NameSpace;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Describe a name space: its categories, their sizes, and how many pseudonyms and
 * alliterations it can issue.
 */
@CommandLine.Command(name = "names",
    header = "Show the size of a pseudonym name space",
    description = """
        Prints each name part category with its word count, the total number of
        pseudonyms the categories can form, and how many of them alliterate.
        """,
    exitCodeList = {"0: success", "2: error"})
public class CMD_names implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_names.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private NamePartsOption namePartsOption = new NamePartsOption();

    @CommandLine.Option(names = {"-w", "--words"},
        description = "Also list the first N words of each category",
        paramLabel = "N",
        defaultValue = "0")
    private int words;

    public static void main(String[] args) {
        CMD_names cmd = new CMD_names();
        int exitCode = new CommandLine(cmd).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (words < 0) {
            err.println("Error: Number of words to list cannot be negative, got " + words);
            return EXIT_ERROR;
        }
        try {
            NameSpace nameSpace = namePartsOption.nameSpace();
            int alliterations = AlliterationFinder.find(nameSpace).length;
            logger.debug("Described {} from {}", nameSpace, namePartsOption.describe());

            int width = "category".length();
            for (String name : nameSpace.categoryNames()) {
                width = Math.max(width, name.length());
            }
            String row = "%-" + width + "s %10s%n";
            out.printf(row, "category", "words");
            for (int c = 0; c < nameSpace.categoryCount(); c++) {
                List<String> category = nameSpace.category(c);
                out.printf(row, nameSpace.categoryNames().get(c), category.size());
                if (words > 0) {
                    out.println("  " + String.join(", ", category.subList(0, Math.min(words, category.size()))));
                }
            }
            out.printf("pseudonyms:    %d%n", nameSpace.total());
            out.printf("alliterations: %d%n", alliterations);
            out.flush();
            return EXIT_SUCCESS;
        } catch (IOException e) {
            err.println("Error: I/O problem when reading name parts - " + e.getMessage());
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            logger.debug("Describing name parts failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
