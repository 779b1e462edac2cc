package io.taxfetch.command;


/*
 * Copyright (c) taxfetch
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

import io.taxfetch.command.download.CMD_download;
import picocli.CommandLine;

/// Retrieve genome sequences for taxonomic subtrees from NCBI
///
/// This is the top level command which serves as the entry point for all sub-commands
@CommandLine.Command(name = "taxfetch",
    mixinStandardHelpOptions = true,
    version = "taxfetch 0.1.0",
    description = "Retrieve assembly sequences, classes and labels for NCBI taxa",
    subcommands = {CommandLine.HelpCommand.class, CMD_download.class})
public class CMD_taxfetch {

    /// @return a command line with the options taxfetch always uses
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_taxfetch()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    /// run a taxfetch command
    /// @param args
    ///     command line args
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
