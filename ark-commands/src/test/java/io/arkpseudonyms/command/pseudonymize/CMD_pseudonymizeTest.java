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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ark pseudonymize")
class CMD_pseudonymizeTest {

    @TempDir
    Path tempDir;

    private Path parts;
    private String stdout;
    private String stderr;

    @BeforeEach
    void writeParts() throws IOException {
        parts = tempDir.resolve("parts.json");
        Files.writeString(parts, "{\"adjectives\": [\"Big\", \"Calm\"], \"animals\": [\"Bear\", \"Cat\"]}");
    }

    private int run(String input, String... args) {
        CMD_pseudonymize cmd = new CMD_pseudonymize();
        cmd.setStdin(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine commandLine = new CommandLine(cmd);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        int exitCode = commandLine.execute(args);
        stdout = out.toString();
        stderr = err.toString();
        return exitCode;
    }

    private List<String> outputLines() {
        return stdout.lines().collect(Collectors.toList());
    }

    private static String pseudonymOf(String outputLine) {
        return outputLine.substring(0, outputLine.indexOf(','));
    }

    @Test
    @DisplayName("equal keys share a pseudonym and rows pass through unchanged")
    void equalKeysSharePseudonym() {
        int exitCode = run("alice,1\nbob,2\nalice,3\n", "-p", parts.toString(), "-c", "1", "-s", "7");

        assertThat(exitCode).isEqualTo(0);
        List<String> lines = outputLines();
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).endsWith(",alice,1");
        assertThat(lines.get(1)).endsWith(",bob,2");
        assertThat(lines.get(2)).endsWith(",alice,3");
        assertThat(pseudonymOf(lines.get(0))).isEqualTo(pseudonymOf(lines.get(2)));
        assertThat(pseudonymOf(lines.get(0))).isNotEqualTo(pseudonymOf(lines.get(1)));
        assertThat(pseudonymOf(lines.get(0))).isIn("Big Bear", "Big Cat", "Calm Bear", "Calm Cat");
    }

    @Test
    @DisplayName("the same seed gives the same output")
    void seedIsReproducible() {
        String input = "a\nb\nc\nd\n";
        assertThat(run(input, "-p", parts.toString(), "-s", "42")).isEqualTo(0);
        String first = stdout;
        assertThat(run(input, "-p", parts.toString(), "-s", "42")).isEqualTo(0);

        assertThat(stdout).isEqualTo(first);
        assertThat(outputLines().stream().map(CMD_pseudonymizeTest::pseudonymOf).distinct()).hasSize(4);
    }

    @Test
    @DisplayName("reads a file and selects columns by header name")
    void headerColumnsByName() throws IOException {
        Path csv = tempDir.resolve("people.csv");
        Files.writeString(csv, "name,visit\nalice,1\nalice,2\n");

        int exitCode = run("", "-i", csv.toString(), "--header", "-c", "name", "-p", parts.toString());

        assertThat(exitCode).isEqualTo(0);
        List<String> lines = outputLines();
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo("pseudonym,name,visit");
        assertThat(pseudonymOf(lines.get(1))).isEqualTo(pseudonymOf(lines.get(2)));
    }

    @Test
    @DisplayName("all columns form the key by default")
    void allColumnsByDefault() {
        int exitCode = run("a,1\na,2\na,1\n", "-p", parts.toString());

        assertThat(exitCode).isEqualTo(0);
        List<String> lines = outputLines();
        assertThat(pseudonymOf(lines.get(0))).isEqualTo(pseudonymOf(lines.get(2)));
        assertThat(pseudonymOf(lines.get(0))).isNotEqualTo(pseudonymOf(lines.get(1)));
    }

    @Test
    @DisplayName("multiple key columns are combined")
    void multipleKeyColumns() {
        int exitCode = run("x,a,1\ny,a,2\nz,a,1\n", "-p", parts.toString(), "-c", "2,3");

        assertThat(exitCode).isEqualTo(0);
        List<String> lines = outputLines();
        assertThat(pseudonymOf(lines.get(0))).isEqualTo(pseudonymOf(lines.get(2)));
        assertThat(pseudonymOf(lines.get(0))).isNotEqualTo(pseudonymOf(lines.get(1)));
    }

    @Test
    @DisplayName("a custom delimiter is used for input and output")
    void customDelimiter() {
        int exitCode = run("a\t1\nb\t2\n", "-p", parts.toString(), "-d", "\t", "-c", "1");

        assertThat(exitCode).isEqualTo(0);
        assertThat(outputLines()).allSatisfy(line -> assertThat(line.split("\t")).hasSize(3));
    }

    @Test
    @DisplayName("alliterating pseudonyms only")
    void alliterate() {
        int exitCode = run("a\nb\n", "-p", parts.toString(), "-a");

        assertThat(exitCode).isEqualTo(0);
        assertThat(outputLines().stream().map(CMD_pseudonymizeTest::pseudonymOf))
            .containsExactlyInAnyOrder("Big Bear", "Calm Cat");
    }

    @Test
    @DisplayName("running out of alliterations exits with 1 and writes nothing")
    void alliterationsExhausted() {
        int exitCode = run("a\nb\nc\n", "-p", parts.toString(), "-a");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout).isEmpty();
        assertThat(stderr).contains("Requested: 3, available: 4 (2 alliterations)")
            .contains("not alliterations");
    }

    @Test
    @DisplayName("running out of pseudonyms exits with 1 and writes nothing")
    void capacityExhausted() {
        int exitCode = run("a\nb\nc\nd\ne\n", "-p", parts.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout).isEmpty();
        assertThat(stderr).contains("Not enough unused pseudonyms").contains("custom name parts");
    }

    @Test
    @DisplayName("bundled name parts are used without a parts file")
    void bundledParts() {
        int exitCode = run("a\nb\n", "-s", "1");

        assertThat(exitCode).isEqualTo(0);
        assertThat(outputLines()).hasSize(2)
            .allSatisfy(line -> assertThat(pseudonymOf(line).split(" ")).hasSize(2));
    }

    @Test
    @DisplayName("categories select and order the name parts")
    void categories() throws IOException {
        Path three = tempDir.resolve("three.json");
        Files.writeString(three,
            "{\"colors\": [\"Red\"], \"adjectives\": [\"Big\"], \"animals\": [\"Bear\", \"Cat\"]}");

        int exitCode = run("a\n", "-p", three.toString(), "-k", "adjectives,colors,animals");

        assertThat(exitCode).isEqualTo(0);
        assertThat(pseudonymOf(outputLines().get(0))).isIn("Big Red Bear", "Big Red Cat");
    }

    @Test
    @DisplayName("a summary is written to stderr")
    void summary() {
        int exitCode = run("a\nb\n", "-p", parts.toString(), "--summary", "5");

        assertThat(exitCode).isEqualTo(0);
        assertThat(stderr).contains("# An Ark")
            .contains("# 2 / 4 pseudonyms used (50%)")
            .contains("key         pseudonym");
    }

    @Test
    @DisplayName("empty input writes nothing")
    void emptyInput() {
        assertThat(run("", "-p", parts.toString())).isEqualTo(0);
        assertThat(stdout).isEmpty();
    }

    @Test
    @DisplayName("errors exit with 2")
    void errors() {
        assertThat(run("a,1\nb\n", "-p", parts.toString())).isEqualTo(2);
        assertThat(stderr).contains("Row 2 has 1 fields, expected 2");

        assertThat(run("a,1\n", "-p", parts.toString(), "-c", "3")).isEqualTo(2);
        assertThat(stderr).contains("column 3 is missing");

        assertThat(run("a,1\n", "-p", parts.toString(), "-c", "nope")).isEqualTo(2);
        assertThat(stderr).contains("Unknown column: nope");

        assertThat(run("a\n", "-i", tempDir.resolve("missing.csv").toString())).isEqualTo(2);
        assertThat(stderr).contains("does not exist");

        assertThat(run("a\n", "-p", parts.toString(), "-k", "colors")).isEqualTo(2);
        assertThat(stderr).contains("Unknown name part category 'colors'");

        assertThat(run("a\n", "-v", "-q")).isEqualTo(2);
        assertThat(run("a\n", "--summary", "0")).isEqualTo(2);
        assertThat(stdout).isEmpty();
    }

    @Test
    @DisplayName("the algorithm option changes the generator")
    void algorithmOption() {
        String input = Arrays.stream(new String[]{"a", "b", "c", "d"}).collect(Collectors.joining("\n"));
        assertThat(run(input, "-p", parts.toString(), "-s", "3", "--algorithm", "MT")).isEqualTo(0);
        assertThat(outputLines()).hasSize(4);
    }
}
