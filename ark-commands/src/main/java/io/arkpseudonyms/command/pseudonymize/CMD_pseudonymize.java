package io.arkpseudonyms.command.pseudonymize;

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

import io.arkpseudonyms.Ark;
import io.arkpseudonyms.ArkSummary;
import io.arkpseudonyms.CapacityExhaustedException;
import io.arkpseudonyms.command.common.InputFileOption;
import io.arkpseudonyms.command.common.NamePartsOption;
import io.arkpseudonyms.command.common.RandomSeedOption;
import io.arkpseudonyms.command.common.VerbosityOption;
import io.arkpseudonyms.random.RandomGenerators;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

/**
 * Replace the keys of a delimited text file with pseudonyms.
 *
 * <p>Every input row is written back unchanged, prefixed by the pseudonym of its key and the
 * delimiter. The key is made of the selected columns, or of every column when none are selected.
 * Rows with equal keys receive equal pseudonyms. All rows are pseudonymized in one batch, so
 * when the name space cannot hold every new key nothing is written.
 */
@CommandLine.Command(name = "pseudonymize",
    header = "Replace row keys with memorable pseudonyms",
    description = """
        Reads delimited rows and writes each one prefixed with a pseudonym for its key.
        Equal keys always get equal pseudonyms, distinct keys never share one.
        With a fixed seed the same input produces the same pseudonyms.
        """,
    exitCodeList = {"0: success", "1: not enough unused pseudonyms", "2: error"})
public class CMD_pseudonymize implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_pseudonymize.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_CAPACITY = 1;
    static final int EXIT_ERROR = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.Mixin
    private NamePartsOption namePartsOption = new NamePartsOption();

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(names = {"-d", "--delimiter"},
        description = "Field delimiter of the input (default: '${DEFAULT-VALUE}')",
        defaultValue = ",")
    private String delimiter;

    @CommandLine.Option(names = {"--header"},
        description = "The first line is a header; it is passed through and columns may be selected by name")
    private boolean header = false;

    @CommandLine.Option(names = {"-c", "--columns"},
        split = ",",
        description = "Key columns, as 1-based positions or header names (default: all columns)")
    private List<String> columns = new ArrayList<>();

    @CommandLine.Option(names = {"-a", "--alliterate"},
        description = "Only issue pseudonyms whose words all start with the same letter")
    private boolean alliterate = false;

    @CommandLine.Option(names = {"--algorithm"},
        description = "PRNG algorithm to use (${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE})",
        defaultValue = "XO_SHI_RO_256_PP")
    private RandomGenerators.Algorithm algorithm = RandomGenerators.Algorithm.XO_SHI_RO_256_PP;

    @CommandLine.Option(names = {"--summary"},
        description = "After the output, print a summary of the Ark with up to N entries to stderr",
        paramLabel = "N")
    private Integer summary;

    private InputStream stdin = System.in;

    public static void main(String[] args) {
        CMD_pseudonymize cmd = new CMD_pseudonymize();
        int exitCode = new CommandLine(cmd).execute(args);
        System.exit(exitCode);
    }

    /// Replace standard input, for callers that pipe rows in from elsewhere.
    void setStdin(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            verbosityOption.validate();
            inputFileOption.validate();
            if (delimiter.isEmpty()) {
                throw new IllegalStateException("Delimiter cannot be empty");
            }
            if (summary != null && summary <= 0) {
                throw new IllegalStateException("Summary size must be positive, got " + summary);
            }
        } catch (IllegalStateException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
        verbosityOption.applyLogLevel();

        try {
            InputFileOption.InputFile input = inputFileOption.getInputFile();
            DelimitedRows rows;
            try (BufferedReader reader = input.open(stdin)) {
                rows = DelimitedRows.read(reader, delimiter, header);
            }
            logger.debug("Read {} rows from {}", rows.size(), input);

            int[] keyColumns = rows.resolveColumns(columns);
            List<List<String>> keys = rows.columns(keyColumns);

            Ark ark = buildArk();
            List<String> pseudonyms = rows.size() == 0
                ? List.of()
                : ark.pseudonymize(keys.toArray(new List<?>[0]));

            if (rows.header() != null) {
                out.println("pseudonym" + delimiter + rows.header());
            }
            for (int i = 0; i < rows.size(); i++) {
                out.println(pseudonyms.get(i) + delimiter + rows.line(i));
            }
            out.flush();

            if (verbosityOption.showVerbose()) {
                err.println("Pseudonymized " + rows.size() + " rows with " + ark.size()
                    + " distinct keys from " + namePartsOption.describe()
                    + " (seed: " + randomSeedOption.getSeedRecord() + ")");
            }
            if (summary != null) {
                err.println(ArkSummary.render(ark, summary));
            }
            err.flush();
            return EXIT_SUCCESS;
        } catch (CapacityExhaustedException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_CAPACITY;
        } catch (IOException e) {
            logger.error("I/O problem reading input", e);
            err.println("Error: I/O problem when reading input - " + e.getMessage());
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            logger.debug("Pseudonymization failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private Ark buildArk() throws IOException {
        Ark.Builder builder = Ark.builder()
            .parts(namePartsOption.nameSpace())
            .alliterate(alliterate);
        RandomSeedOption.Seed seed = randomSeedOption.getSeedRecord();
        if (seed.isExplicit()) {
            builder.random(RandomGenerators.create(algorithm, seed.value()));
        } else {
            builder.random(RandomGenerators.create(algorithm));
        }
        return builder.build();
    }

    /// Rows of a delimited text input, kept verbatim alongside their split fields.
    static final class DelimitedRows {
        private final String header;
        private final String[] headerFields;
        private final List<String> lines;
        private final List<String[]> fields;

        private DelimitedRows(String header, String[] headerFields, List<String> lines, List<String[]> fields) {
            this.header = header;
            this.headerFields = headerFields;
            this.lines = lines;
            this.fields = fields;
        }

        /// Read all non-blank lines. Fields are split on the literal delimiter and kept as text.
        static DelimitedRows read(BufferedReader reader, String delimiter, boolean hasHeader) throws IOException {
            Pattern split = Pattern.compile(Pattern.quote(delimiter));
            String header = null;
            String[] headerFields = null;
            List<String> lines = new ArrayList<>();
            List<String[]> fields = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                if (hasHeader && header == null) {
                    header = line;
                    headerFields = split.split(line, -1);
                    continue;
                }
                lines.add(line);
                fields.add(split.split(line, -1));
            }
            return new DelimitedRows(header, headerFields, lines, fields);
        }

        int size() {
            return lines.size();
        }

        String header() {
            return header;
        }

        String line(int row) {
            return lines.get(row);
        }

        /// Resolve column selectors to 0-based positions. No selectors means every column,
        /// which requires all rows to have the same number of fields.
        int[] resolveColumns(List<String> selectors) {
            if (selectors.isEmpty()) {
                int width = headerFields != null ? headerFields.length
                    : fields.isEmpty() ? 0 : fields.get(0).length;
                for (int row = 0; row < fields.size(); row++) {
                    if (fields.get(row).length != width) {
                        throw new IllegalStateException(String.format(
                            "Row %d has %d fields, expected %d", row + 1, fields.get(row).length, width));
                    }
                }
                int[] all = new int[width];
                Arrays.setAll(all, i -> i);
                return all;
            }
            int[] resolved = new int[selectors.size()];
            for (int i = 0; i < resolved.length; i++) {
                resolved[i] = resolveColumn(selectors.get(i).trim());
            }
            return resolved;
        }

        private int resolveColumn(String selector) {
            if (headerFields != null) {
                for (int i = 0; i < headerFields.length; i++) {
                    if (headerFields[i].trim().equals(selector)) {
                        return i;
                    }
                }
            }
            try {
                int position = Integer.parseInt(selector);
                if (position < 1) {
                    throw new IllegalStateException("Column positions start at 1, got " + position);
                }
                return position - 1;
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Unknown column: " + selector, e);
            }
        }

        /// Extract key columns in selector order.
        /// @throws IllegalStateException if a row is too short for a selected column
        List<List<String>> columns(int[] positions) {
            List<List<String>> result = new ArrayList<>(positions.length);
            for (int position : positions) {
                List<String> column = new ArrayList<>(fields.size());
                for (int row = 0; row < fields.size(); row++) {
                    String[] values = fields.get(row);
                    if (position >= values.length) {
                        throw new IllegalStateException(String.format(
                            "Row %d has %d fields, column %d is missing", row + 1, values.length, position + 1));
                    }
                    column.add(values[position]);
                }
                result.add(column);
            }
            return result;
        }
    }
}
