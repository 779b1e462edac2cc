/// Embedded Jetty server standing in for the NCBI services in tests.
///
/// [io.taxfetch.jetty.testserver.JettyFileServerExtension] shares a single
/// [io.taxfetch.jetty.testserver.JettyFileServerFixture] per JVM. The fixture serves
/// static files for archive and genome downloads and routes `/eutils/` to a scripted
/// [io.taxfetch.jetty.testserver.EntrezStub].
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
