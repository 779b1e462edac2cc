package io.taxfetch.command.logging;


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
import org.apache.logging.log4j.core.appender.ConsoleAppender;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.AppenderComponentBuilder;
import org.apache.logging.log4j.core.config.builder.api.ConfigurationBuilder;
import org.apache.logging.log4j.core.config.builder.api.ConfigurationBuilderFactory;
import org.apache.logging.log4j.core.config.builder.api.RootLoggerComponentBuilder;
import org.apache.logging.log4j.core.config.builder.impl.BuiltConfiguration;

import java.nio.file.Path;

/// Replaces the Log4j configuration for a command run.
///
/// The console appender writes to stderr with a bare `LEVEL: message` layout at
/// the requested level. An optional file appender receives INFO and above with
/// timestamps, whatever the console level is.
public final class LoggingConfigurator {

    /// Name of the console appender.
    public static final String CONSOLE = "console";
    /// Name of the log file appender.
    public static final String LOGFILE = "logfile";

    static final String CONSOLE_PATTERN = "%level: %msg%n";
    static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss} [%level] %logger{1}: %msg%n";

    private LoggingConfigurator() {
    }

    /// @param consoleLevel lowest level shown on the console
    /// @param logfile file to log to, or null for console only
    /// @return the configuration
    public static BuiltConfiguration build(Level consoleLevel, Path logfile) {
        ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
        builder.setConfigurationName("taxfetch");
        builder.setStatusLevel(Level.ERROR);

        AppenderComponentBuilder console = builder.newAppender(CONSOLE, "Console")
            .addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR)
            .add(builder.newLayout("PatternLayout").addAttribute("pattern", CONSOLE_PATTERN));
        builder.add(console);

        Level rootLevel = logfile != null && Level.INFO.isLessSpecificThan(consoleLevel) ? Level.INFO : consoleLevel;
        RootLoggerComponentBuilder root = builder.newRootLogger(rootLevel)
            .add(builder.newAppenderRef(CONSOLE).addAttribute("level", consoleLevel));

        if (logfile != null) {
            AppenderComponentBuilder file = builder.newAppender(LOGFILE, "File")
                .addAttribute("fileName", logfile.toAbsolutePath().toString())
                .addAttribute("append", false)
                .add(builder.newLayout("PatternLayout").addAttribute("pattern", FILE_PATTERN));
            builder.add(file);
            root.add(builder.newAppenderRef(LOGFILE).addAttribute("level", Level.INFO));
        }
        builder.add(root);
        return builder.build(false);
    }

    /// Install the configuration for this run.
    /// @param consoleLevel lowest level shown on the console
    /// @param logfile file to log to, or null for console only
    public static void configure(Level consoleLevel, Path logfile) {
        Configurator.reconfigure(build(consoleLevel, logfile));
    }
}
