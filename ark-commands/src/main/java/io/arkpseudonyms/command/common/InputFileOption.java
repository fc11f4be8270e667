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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Shared input file option. A single {@code -} reads standard input.
 */
public class InputFileOption {

    /**
     * Immutable input specification.
     *
     * @param path the input file path, or null for standard input
     */
    public record InputFile(Path path) {

        /**
         * Standard input.
         */
        public static final InputFile STDIN = new InputFile(null);

        /**
         * Checks if this input is standard input.
         */
        public boolean isStdin() {
            return path == null;
        }

        /**
         * Validates that the input file exists.
         */
        public void validate() {
            if (!isStdin() && !Files.exists(path)) {
                throw new IllegalStateException("Input file does not exist: " + path);
            }
        }

        /**
         * Opens the input as UTF-8 text.
         *
         * @param stdin the stream to use for standard input
         * @return a reader over the input
         * @throws IOException if the file cannot be opened
         */
        public BufferedReader open(InputStream stdin) throws IOException {
            if (isStdin()) {
                return new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            }
            return Files.newBufferedReader(path, StandardCharsets.UTF_8);
        }

        @Override
        public String toString() {
            return isStdin() ? "<stdin>" : path.toString();
        }
    }

    /**
     * Picocli type converter for {@link InputFile} specifications.
     */
    public static class InputFileConverter implements CommandLine.ITypeConverter<InputFile> {

        @Override
        public InputFile convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new CommandLine.TypeConversionException("Input file path cannot be empty");
            }
            if (value.equals("-")) {
                return InputFile.STDIN;
            }
            return new InputFile(Paths.get(value));
        }
    }

    @CommandLine.Option(
        names = {"-i", "--input"},
        description = "The delimited input file, or '-' for standard input (default: ${DEFAULT-VALUE})",
        defaultValue = "-",
        converter = InputFileConverter.class
    )
    private InputFile inputFile;

    /**
     * Gets the InputFile record constructed from the options.
     */
    public InputFile getInputFile() {
        return inputFile != null ? inputFile : InputFile.STDIN;
    }

    /**
     * Validates the input specification.
     */
    public void validate() {
        getInputFile().validate();
    }
}
