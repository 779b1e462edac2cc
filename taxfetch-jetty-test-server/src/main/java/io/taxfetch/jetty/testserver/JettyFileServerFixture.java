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
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.DefaultServlet;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A test fixture that starts a Jetty web server standing in for the NCBI services.
 * <p>
 * Files placed under the root directory are served as-is, which covers the WGS archive
 * and the genomes FTP tree. Requests under {@code /eutils/} are answered by an
 * {@link EntrezStub} that tests script per endpoint.
 * <p>
 * Example usage:
 * ```java
 * try (JettyFileServerFixture server = new JettyFileServerFixture(tempDir)) {
 *     server.start();
 *     server.getEntrezStub().respond("esearch.fcgi", "{...}");
 *     String eutils = server.getEutilsUrl();
 * }
 * ```
 */
public class JettyFileServerFixture implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(JettyFileServerFixture.class);

    /// Path under which the E-utilities stub is mounted.
    public static final String EUTILS_PATH = "/eutils";

    private Server server;
    private int port;
    private final Path resourcesRoot;
    private final EntrezStub entrezStub = new EntrezStub();

    /**
     * Creates a new fixture serving files from the given directory.
     *
     * @param resourcesRoot The root directory containing the files to serve
     */
    public JettyFileServerFixture(Path resourcesRoot) {
        logger.debug("resourcesRoot: {}", resourcesRoot);
        this.resourcesRoot = resourcesRoot;
        if (!Files.isDirectory(resourcesRoot)) {
            throw new UncheckedIOException(new IOException("Resources directory does not exist: " + resourcesRoot));
        }
    }

    /**
     * Starts the web server on a port chosen by the operating system.
     *
     * @throws IOException If the server cannot be started
     */
    public void start() throws IOException {
        server = new Server();

        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(0);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.setResourceBase(resourcesRoot.toAbsolutePath().toString());
        server.setHandler(context);

        context.addServlet(new ServletHolder("eutils", new EntrezStubServlet(entrezStub)), EUTILS_PATH + "/*");

        ServletHolder defaultServlet = new ServletHolder("default", DefaultServlet.class);
        defaultServlet.setInitParameter("dirAllowed", "false");
        defaultServlet.setInitParameter("welcomeServlets", "false");
        defaultServlet.setInitParameter("redirectWelcome", "false");
        defaultServlet.setInitParameter("precompressed", "false");
        defaultServlet.setInitParameter("useFileMappedBuffer", "false");
        context.addServlet(defaultServlet, "/");

        try {
            server.start();
            port = connector.getLocalPort();
            logger.info("Jetty test web server started on port {} serving files from {}", port, resourcesRoot);
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /**
     * Gets the base URL of the server, ending in a slash.
     *
     * @return The base URL of the server
     */
    public String getBaseUrl() {
        return "http://127.0.0.1:" + port + "/";
    }

    /// @return the E-utilities base URL, without a trailing slash
    public String getEutilsUrl() {
        return "http://127.0.0.1:" + port + EUTILS_PATH;
    }

    /// @return the scripted E-utilities responder
    public EntrezStub getEntrezStub() {
        return entrezStub;
    }

    /**
     * Gets the root directory being served by this server.
     *
     * @return The root directory path
     */
    public Path getRootDirectory() {
        return resourcesRoot;
    }

    /**
     * Stops the server and releases resources.
     */
    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("Jetty test web server stopped");
            } catch (Exception e) {
                logger.error("Error stopping Jetty server", e);
            }
        }
    }
}
