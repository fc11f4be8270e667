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

import io.arkpseudonyms.command.names.CMD_names;
import io.arkpseudonyms.command.pseudonymize.CMD_pseudonymize;
import picocli.CommandLine;

/// Entry point of the `ark` command line.
@CommandLine.Command(name = "ark",
    header = "Memorable, collision-free pseudonyms for data keys",
    description = """
        Replaces identifying keys with pseudonyms like "Brave Otter", composed
        from lists of name parts. Equal keys get equal pseudonyms.
        """,
    mixinStandardHelpOptions = true,
    version = "ark 0.1.0",
    exitCodeList = {"0: success", "1: not enough unused pseudonyms", "2: error"},
    subcommands = {CMD_pseudonymize.class, CMD_names.class, CommandLine.HelpCommand.class})
public class CMD_ark implements Runnable {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /// @return the configured command line, shared by [#main] and tests
    public static CommandLine newCommandLine() {
        return new CommandLine(new CMD_ark())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
