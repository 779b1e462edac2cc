package io.taxfetch.api.transfer;


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

import java.io.IOException;

/// Plain GET access to downloadable files such as sequence archives and hash listings.
public interface TransferClient extends AutoCloseable {

    /// Open a remote file for reading.
    ///
    /// The response headers have been received when this returns; the body has not
    /// been read. A resource that does not exist, or answers with an error status,
    /// fails here rather than on read.
    /// @param url the absolute URL of the file
    /// @return the open resource; the caller must close it
    /// @throws IOException if the server cannot be reached or does not answer with success
    RemoteResource open(String url) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
