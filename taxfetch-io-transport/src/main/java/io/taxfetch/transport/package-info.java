/// HTTP implementations of the taxfetch collaborator interfaces, built on OkHttp.
///
/// [io.taxfetch.transport.OkHttpEntrezClient] speaks to the E-utilities endpoints and
/// [io.taxfetch.transport.OkHttpTransferClient] opens archive and hash files for streaming.
package io.taxfetch.transport;


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
