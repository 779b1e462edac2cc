package io.taxfetch.jetty.testserver;


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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/// A JUnit Jupiter extension that shares one [JettyFileServerFixture] across a test run.
///
/// The server is started on first use, serves a fresh temporary directory, and is
/// stopped when the JVM exits. Tests write the files they want served below
/// [#getRootDirectory()], preferably in a directory of their own, and script the
/// E-utilities stub through [#getEntrezStub()] after resetting it.
///
/// Example usage:
///
/// ```java
/// @ExtendWith(JettyFileServerExtension.class)
/// public class MyTest {
///     @BeforeEach
///     void reset() {
///         JettyFileServerExtension.getEntrezStub().reset();
///     }
/// }
/// ```
public class JettyFileServerExtension implements BeforeAllCallback, AfterAllCallback {
    private static final Logger logger = LogManager.getLogger(JettyFileServerExtension.class);
    private static JettyFileServerFixture server;

    private static final Object lock = new Object();

    /**
     * Initializes and starts the server if not already started.
     * This method is thread-safe and idempotent.
     */
    public static void initialize() {
        synchronized (lock) {
            if (server == null) {
                try {
                    Path root = Files.createTempDirectory("taxfetch-testserver");
                    logger.info("Starting Jetty test web server");
                    server = new JettyFileServerFixture(root);
                    server.start();
                    logger.info("Jetty test web server started at {}", server.getBaseUrl());

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        if (server != null) {
                            logger.info("Stopping Jetty test web server (shutdown hook)");
                            server.close();
                            server = null;
                        }
                    }));
                } catch (IOException e) {
                    logger.error("Failed to start Jetty test web server", e);
                    throw new RuntimeException("Failed to start Jetty test web server", e);
                }
            }
        }
    }

    /// @return the base URL of the test web server, ending in a slash
    public static String getBaseUrl() {
        initialize();
        return server.getBaseUrl();
    }

    /// @return the E-utilities base URL of the test web server
    public static String getEutilsUrl() {
        initialize();
        return server.getEutilsUrl();
    }

    /// @return the scripted E-utilities responder
    public static EntrezStub getEntrezStub() {
        initialize();
        return server.getEntrezStub();
    }

    /// @return the directory served at the base URL
    public static Path getRootDirectory() {
        initialize();
        return server.getRootDirectory();
    }

    /// @return the shared fixture
    public static JettyFileServerFixture getServer() {
        initialize();
        return server;
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        initialize();
        logger.debug("JettyFileServerExtension beforeAll called for {}", context.getDisplayName());
    }

    @Override
    public void afterAll(ExtensionContext context) {
        // server is stopped by the shutdown hook
        logger.debug("JettyFileServerExtension afterAll called for {}", context.getDisplayName());
    }
}
