package io.arkpseudonyms.command;

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

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_arkTest {

    @Test
    public void testUsageWithoutSubcommand() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = CMD_ark.newCommandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute();

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("pseudonymize").contains("names");
    }

    @Test
    public void testSubcommandsAreRegistered() {
        CommandLine commandLine = CMD_ark.newCommandLine();

        assertThat(commandLine.getSubcommands()).containsKeys("pseudonymize", "names", "help");
    }

    @Test
    public void testNamesThroughTopLevel() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = CMD_ark.newCommandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("names", "-k", "colors");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("pseudonyms:    39");
    }

    @Test
    public void testUnknownOptionIsUsageError() {
        CommandLine commandLine = CMD_ark.newCommandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        assertThat(commandLine.execute("pseudonymize", "--no-such-option")).isEqualTo(2);
    }

    @Test
    public void testCaseInsensitiveAlgorithm() {
        CommandLine commandLine = CMD_ark.newCommandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        CommandLine.ParseResult result = commandLine.parseArgs("pseudonymize", "--algorithm", "kiss");

        assertThat(result.subcommand().<Object>matchedOptionValue("--algorithm", null)).hasToString("KISS");
    }
}
