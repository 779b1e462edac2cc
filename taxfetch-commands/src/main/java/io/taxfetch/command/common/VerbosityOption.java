package io.taxfetch.command.common;


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

import org.apache.logging.log4j.Level;
import picocli.CommandLine;

import java.nio.file.Path;

/// Shared console verbosity and log file options.
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Report progress on the console, not only warnings and errors"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-l", "--logfile"},
        description = "Also write INFO and above to this file"
    )
    private Path logfile;

    /// @return true if verbose is enabled
    public boolean isVerbose() {
        return verbose;
    }

    /// @return the log file, or null when none was requested
    public Path getLogfile() {
        return logfile;
    }

    /// @return the lowest level shown on the console
    public Level consoleLevel() {
        return verbose ? Level.INFO : Level.WARN;
    }
}
