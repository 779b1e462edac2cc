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
import org.apache.logging.log4j.core.config.builder.impl.BuiltConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingConfiguratorTest {

    @TempDir
    Path tempDir;

    @Test
    void consoleOnlyAtRequestedLevel() {
        BuiltConfiguration configuration = LoggingConfigurator.build(Level.WARN, null);
        try {
            configuration.initialize();

            assertThat(configuration.getAppenders()).containsOnlyKeys(LoggingConfigurator.CONSOLE);
            assertThat(configuration.getRootLogger().getLevel()).isEqualTo(Level.WARN);
        } finally {
            configuration.stop();
        }
    }

    @Test
    void logfileLowersRootToInfo() {
        BuiltConfiguration configuration = LoggingConfigurator.build(Level.WARN, tempDir.resolve("run.log"));
        try {
            configuration.initialize();

            assertThat(configuration.getAppenders())
                .containsOnlyKeys(LoggingConfigurator.CONSOLE, LoggingConfigurator.LOGFILE);
            assertThat(configuration.getRootLogger().getLevel()).isEqualTo(Level.INFO);
        } finally {
            configuration.stop();
        }
    }

    @Test
    void verboseConsoleKeepsInfo() {
        BuiltConfiguration configuration = LoggingConfigurator.build(Level.INFO, null);
        try {
            configuration.initialize();

            assertThat(configuration.getRootLogger().getLevel()).isEqualTo(Level.INFO);
        } finally {
            configuration.stop();
        }
    }
}
