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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/// An opened remote file whose body has not been consumed yet.
public interface RemoteResource extends Closeable {

    /// @return the URL this resource was opened from
    String url();

    /// @return the declared Content-Length in bytes, or -1 when the server did not declare one
    long contentLength();

    /// @return the response body; reading it consumes the resource
    /// @throws IOException if the body is not available
    InputStream body() throws IOException;
}
